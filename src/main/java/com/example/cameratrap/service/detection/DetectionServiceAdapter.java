package com.example.cameratrap.service.detection;

import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.exception.PipelineException;
import com.example.cameratrap.model.DetectionCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Wraps the configured {@link AnimalDetector} and enforces the detection threshold. Overlapping
 * boxes are passed through untouched; every qualifying box becomes its own detection.
 */
@Service
public class DetectionServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(DetectionServiceAdapter.class);

    private final AnimalDetector detector;

    public DetectionServiceAdapter(AnimalDetector detector) {
        this.detector = detector;
    }

    public List<DetectionCandidate> detect(byte[] image, double threshold) {
        if (image == null || image.length == 0) {
            throw new InferenceRejectedException("Image payload is empty");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Detection threshold must be within [0, 1] but was " + threshold);
        }
        List<DetectionCandidate> raw;
        try {
            raw = detector.detect(image);
        } catch (PipelineException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new InferenceRejectedException("Detector failed: " + ex.getMessage(), ex);
        }
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<DetectionCandidate> retained = raw.stream()
                .filter(candidate -> candidate.confidence() >= threshold)
                .toList();
        log.debug("Detector returned {} candidates, {} at or above {}", raw.size(), retained.size(), threshold);
        return retained;
    }
}
