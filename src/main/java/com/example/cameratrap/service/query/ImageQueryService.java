package com.example.cameratrap.service.query;

import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.domain.Detection;
import com.example.cameratrap.domain.Species;
import com.example.cameratrap.model.DetectionView;
import com.example.cameratrap.model.ImageStatusResponse;
import com.example.cameratrap.repository.CameraImageRepository;
import com.example.cameratrap.repository.DetectionRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Read side for a single image: its persisted status and detections, highest detector confidence
 * first.
 */
@Service
@Transactional(readOnly = true)
public class ImageQueryService {

    private final CameraImageRepository images;
    private final DetectionRepository detections;

    public ImageQueryService(CameraImageRepository images, DetectionRepository detections) {
        this.images = images;
        this.detections = detections;
    }

    public Optional<ImageStatusResponse> findByStorageKey(String key) {
        return images.findByS3Key(key).map(this::toResponse);
    }

    private ImageStatusResponse toResponse(CameraImage image) {
        List<DetectionView> views = detections.findByImageIdOrderByConfidence(image.getId()).stream()
                .map(this::toView)
                .toList();
        return new ImageStatusResponse(
                image.getId(),
                image.getS3Key(),
                image.getCameraId(),
                image.getProcessingStatus(),
                image.getErrorMessage(),
                image.getCapturedAt(),
                image.getUploadedAt(),
                image.getProcessedAt(),
                image.getDetectionCount(),
                image.isHasDetections(),
                views);
    }

    private DetectionView toView(Detection detection) {
        Species species = detection.getSpecies();
        return new DetectionView(
                detection.getId(),
                detection.getDetectionType(),
                detection.boundingBox(),
                detection.getDetectorConfidence(),
                detection.getClassifierConfidence(),
                detection.getOverallConfidence(),
                species == null ? null : species.getScientificName(),
                species == null ? null : species.getCommonName(),
                detection.getSpeciesTop5() == null ? List.of() : detection.getSpeciesTop5(),
                detection.isVerified(),
                detection.isFalsePositive(),
                detection.isNeedsReview());
    }
}
