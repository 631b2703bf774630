package com.example.cameratrap.model;

public record OverviewStatistics(
        long totalImages,
        long totalDetections,
        long totalSpecies,
        long totalLocations,
        long processedImages,
        long pendingImages) {
}
