package com.example.cameratrap.config;

import com.example.cameratrap.service.classification.NoOpSpeciesClassifier;
import com.example.cameratrap.service.classification.OnnxSpeciesClassifier;
import com.example.cameratrap.service.classification.RemoteSpeciesClassifier;
import com.example.cameratrap.service.classification.SpeciesClassifier;
import com.example.cameratrap.service.detection.AnimalDetector;
import com.example.cameratrap.service.detection.NoOpAnimalDetector;
import com.example.cameratrap.service.detection.OpenCvMegaDetector;
import com.example.cameratrap.service.detection.RemoteAnimalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.Locale;

/**
 * Selects the detector and classifier backends from {@code camera-trap.detection.backend} and
 * {@code camera-trap.classification.backend}. Tests replace these beans with mocks.
 */
@Configuration
public class DetectorConfiguration {

    private static final Logger log = LoggerFactory.getLogger(DetectorConfiguration.class);

    @Bean
    public RestTemplate inferenceRestTemplate(RestTemplateBuilder builder, PipelineProperties properties) {
        Duration timeout = properties.pipeline().invocationTimeout();
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .build();
    }

    @Bean
    public AnimalDetector animalDetector(PipelineProperties properties, RestTemplate inferenceRestTemplate) {
        PipelineProperties.DetectionProperties detection = properties.detection();
        String backend = detection.backend().toLowerCase(Locale.ROOT);
        switch (backend) {
            case "opencv" -> {
                log.info("Using OpenCV MegaDetector backend with model {}", detection.modelPath());
                return new OpenCvMegaDetector(detection);
            }
            case "remote" -> {
                log.info("Using remote detector at {}", detection.endpoint());
                return new RemoteAnimalDetector(inferenceRestTemplate, detection.endpoint());
            }
            case "none" -> {
                log.info("Using fallback detector. Configure camera-trap.detection.backend to run a real model.");
                return new NoOpAnimalDetector();
            }
            default -> throw new IllegalStateException("Unknown detector backend: " + detection.backend());
        }
    }

    @Bean
    public SpeciesClassifier speciesClassifier(PipelineProperties properties, RestTemplate inferenceRestTemplate) {
        PipelineProperties.ClassificationProperties classification = properties.classification();
        String backend = classification.backend().toLowerCase(Locale.ROOT);
        switch (backend) {
            case "onnx" -> {
                log.info("Using ONNX species classifier with model {}", classification.modelPath());
                return new OnnxSpeciesClassifier(classification);
            }
            case "remote" -> {
                log.info("Using remote species classifier at {}", classification.endpoint());
                return new RemoteSpeciesClassifier(inferenceRestTemplate, classification.endpoint());
            }
            case "none" -> {
                log.info("Using fallback species classifier. Animal detections will be left for review.");
                return new NoOpSpeciesClassifier();
            }
            default -> throw new IllegalStateException("Unknown classifier backend: " + classification.backend());
        }
    }
}
