package com.example.cameratrap.model;

import java.util.List;

public record DetectionView(
        Long id,
        DetectionType detectionType,
        BoundingBox boundingBox,
        double detectorConfidence,
        Double classifierConfidence,
        Double overallConfidence,
        String scientificName,
        String commonName,
        List<SpeciesCandidate> speciesTop5,
        boolean verified,
        boolean falsePositive,
        boolean needsReview) {
}
