package com.example.cameratrap.model;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;

public record ImageStatusResponse(
        Long id,
        String storageKey,
        String cameraId,
        ProcessingStatus processingStatus,
        String errorMessage,
        LocalDateTime capturedAt,
        Instant uploadedAt,
        Instant processedAt,
        int detectionCount,
        boolean hasDetections,
        List<DetectionView> detections) {
}
