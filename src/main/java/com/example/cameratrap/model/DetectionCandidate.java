package com.example.cameratrap.model;

import java.util.Objects;

/**
 * One bounding box returned by the detection service.
 */
public record DetectionCandidate(DetectionType type, BoundingBox boundingBox, double confidence) {

    public DetectionCandidate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(boundingBox, "boundingBox");
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Detection confidence must be within [0, 1] but was " + confidence);
        }
    }
}
