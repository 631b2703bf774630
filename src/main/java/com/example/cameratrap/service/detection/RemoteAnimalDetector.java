package com.example.cameratrap.service.detection;

import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.exception.InferenceUnavailableException;
import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Posts the image to an HTTP inference service that answers with
 * {@code {"detections":[{"category":"animal","confidence":0.93,"bbox":[x,y,w,h]}]}}. Categories may
 * be given by name or by one-based identifier.
 */
public class RemoteAnimalDetector implements AnimalDetector {

    private static final Logger log = LoggerFactory.getLogger(RemoteAnimalDetector.class);

    private final RestTemplate restTemplate;
    private final String endpoint;

    public RemoteAnimalDetector(RestTemplate restTemplate, String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("camera-trap.detection.endpoint must be configured for the remote backend");
        }
        this.restTemplate = restTemplate;
        this.endpoint = endpoint;
    }

    @Override
    public List<DetectionCandidate> detect(byte[] image) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_OCTET_STREAM);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        DetectorResponse response;
        try {
            response = restTemplate.postForObject(endpoint, new HttpEntity<>(image, headers), DetectorResponse.class);
        } catch (ResourceAccessException | HttpServerErrorException | HttpClientErrorException.TooManyRequests ex) {
            throw new InferenceUnavailableException("Detector service unavailable: " + ex.getMessage(), ex);
        } catch (HttpClientErrorException ex) {
            throw new InferenceRejectedException("Detector service rejected the image: " + ex.getStatusCode(), ex);
        } catch (RestClientException ex) {
            throw new InferenceRejectedException("Unreadable detector response: " + ex.getMessage(), ex);
        }
        if (response == null || response.detections() == null) {
            return List.of();
        }
        List<DetectionCandidate> candidates = new ArrayList<>(response.detections().size());
        for (RemoteDetection detection : response.detections()) {
            candidates.add(toCandidate(detection));
        }
        log.debug("Remote detector returned {} candidates", candidates.size());
        return candidates;
    }

    private DetectionCandidate toCandidate(RemoteDetection detection) {
        try {
            List<Double> bbox = detection.bbox();
            if (bbox == null || bbox.size() != 4) {
                throw new IllegalArgumentException("bbox must hold four values");
            }
            if (detection.confidence() == null) {
                throw new IllegalArgumentException("confidence is missing");
            }
            BoundingBox box = new BoundingBox(bbox.get(0), bbox.get(1), bbox.get(2), bbox.get(3));
            return new DetectionCandidate(resolveType(detection.category()), box, detection.confidence());
        } catch (IllegalArgumentException | NullPointerException ex) {
            throw new InferenceRejectedException("Malformed detection in detector response: " + ex.getMessage(), ex);
        }
    }

    private DetectionType resolveType(String category) {
        if (category != null && !category.isBlank() && category.chars().allMatch(Character::isDigit)) {
            return DetectionType.fromCategoryId(Integer.parseInt(category));
        }
        return DetectionType.fromLabel(category);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record DetectorResponse(List<RemoteDetection> detections) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record RemoteDetection(String category, Double confidence, List<Double> bbox) {
    }
}
