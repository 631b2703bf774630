package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.domain.Detection;
import com.example.cameratrap.exception.ClaimLostException;
import com.example.cameratrap.model.ImageMetadata;
import com.example.cameratrap.repository.CameraImageRepository;
import com.example.cameratrap.repository.DetectionRepository;
import com.example.cameratrap.repository.LocationRepository;
import com.example.cameratrap.repository.SpeciesRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Transactional writes made by a claim holder. Each method locks the image row and verifies the
 * claim token before touching it.
 */
@Service
public class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    private final CameraImageRepository images;
    private final DetectionRepository detections;
    private final SpeciesRepository species;
    private final LocationRepository locations;
    private final Clock clock;

    public ResultWriter(CameraImageRepository images,
                        DetectionRepository detections,
                        SpeciesRepository species,
                        LocationRepository locations,
                        Clock clock) {
        this.images = images;
        this.detections = detections;
        this.species = species;
        this.locations = locations;
        this.clock = clock;
    }

    @Transactional
    public void recordMetadata(Long imageId, String token, long fileSize, String fileHash, ImageMetadata metadata) {
        CameraImage image = lockOwned(imageId, token);
        image.applyMetadata(metadata, fileSize, fileHash);
        if (image.getCameraId() != null && image.getLocation() == null) {
            locations.findByCameraId(image.getCameraId()).ifPresentOrElse(
                    image::setLocation,
                    () -> log.debug("Camera {} has no registered location", image.getCameraId()));
        }
    }

    /**
     * Writes the whole detection batch and marks the image completed. Any failure rolls back every
     * detection of the batch together with the status change.
     *
     * @return the number of detections now stored for the image
     */
    @Transactional
    public int complete(Long imageId, String token, List<DetectionDraft> drafts) {
        CameraImage image = lockOwned(imageId, token);
        for (DetectionDraft draft : drafts) {
            Detection detection = Detection.of(image, draft.candidate());
            if (draft.isClassified()) {
                detection.assignSpecies(species.getReferenceById(draft.speciesId()),
                        draft.classifierConfidence(), draft.topCandidates());
            }
            detection.setNeedsReview(draft.needsReview());
            detections.save(detection);
        }
        detections.flush();
        int stored = Math.toIntExact(detections.countByImageId(imageId));
        image.markCompleted(stored, Instant.now(clock));
        log.info("Completed image {} with {} detections", imageId, stored);
        return stored;
    }

    /**
     * @return {@code false} when the claim was lost and the failure was not recorded
     */
    @Transactional
    public boolean fail(Long imageId, String token, String errorMessage) {
        CameraImage image = images.findByIdForUpdate(imageId).orElse(null);
        if (image == null || !image.isClaimedBy(token)) {
            log.warn("Not recording failure for image {}: claim no longer held", imageId);
            return false;
        }
        image.markFailed(errorMessage);
        log.info("Marked image {} failed: {}", imageId, image.getErrorMessage());
        return true;
    }

    private CameraImage lockOwned(Long imageId, String token) {
        CameraImage image = images.findByIdForUpdate(imageId)
                .orElseThrow(() -> new ClaimLostException("Image " + imageId + " no longer exists"));
        if (!image.isClaimedBy(token)) {
            throw new ClaimLostException("Claim on image " + imageId + " was taken over by another worker");
        }
        return image;
    }
}
