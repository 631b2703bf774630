package com.example.cameratrap.service.detection;

import com.example.cameratrap.model.DetectionCandidate;

import java.util.List;

/**
 * Fallback used when no detector backend is configured. Every image is reported as empty, so
 * images complete with zero detections.
 */
public class NoOpAnimalDetector implements AnimalDetector {

    @Override
    public List<DetectionCandidate> detect(byte[] image) {
        return List.of();
    }
}
