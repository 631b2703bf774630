package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.config.PipelineProperties;
import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import com.example.cameratrap.model.ImageMetadata;
import com.example.cameratrap.model.PipelineOutcome;
import com.example.cameratrap.model.SpeciesCandidate;
import com.example.cameratrap.model.StorageEvent;
import com.example.cameratrap.service.classification.ClassificationServiceAdapter;
import com.example.cameratrap.service.detection.DetectionServiceAdapter;
import com.example.cameratrap.service.metadata.MetadataExtractor;
import com.example.cameratrap.service.storage.ImageSource;
import com.example.cameratrap.service.tracking.TrackingStatus;
import com.example.cameratrap.service.tracking.TrackingStatusPublisher;
import com.example.cameratrap.util.Checksums;
import com.example.cameratrap.util.ImageDecoding;
import com.example.cameratrap.util.RegionCropper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.example.cameratrap.service.pipeline.InferenceRetryExecutor.INFERENCE;
import static com.example.cameratrap.service.pipeline.InferenceRetryExecutor.PERSISTENCE;

/**
 * Processes one uploaded image from notification to stored detections.
 * <p>
 * The image row moves {@code pending -> processing -> completed | failed}. Detections become
 * visible only together with the {@code completed} status; any failure after the claim marks the
 * image failed without leaving detection rows behind. Tracking updates are sent afterwards and
 * never change the stored outcome.
 */
@Service
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ImageClaimService claims;
    private final ResultWriter writer;
    private final SpeciesResolver speciesResolver;
    private final ImageSource imageSource;
    private final MetadataExtractor metadataExtractor;
    private final DetectionServiceAdapter detectionAdapter;
    private final ClassificationServiceAdapter classificationAdapter;
    private final TrackingStatusPublisher tracking;
    private final InferenceRetryExecutor retries;
    private final PipelineProperties properties;
    private final Clock clock;

    public PipelineOrchestrator(ImageClaimService claims,
                                ResultWriter writer,
                                SpeciesResolver speciesResolver,
                                ImageSource imageSource,
                                MetadataExtractor metadataExtractor,
                                DetectionServiceAdapter detectionAdapter,
                                ClassificationServiceAdapter classificationAdapter,
                                TrackingStatusPublisher tracking,
                                InferenceRetryExecutor retries,
                                PipelineProperties properties,
                                Clock clock) {
        this.claims = claims;
        this.writer = writer;
        this.speciesResolver = speciesResolver;
        this.imageSource = imageSource;
        this.metadataExtractor = metadataExtractor;
        this.detectionAdapter = detectionAdapter;
        this.classificationAdapter = classificationAdapter;
        this.tracking = tracking;
        this.retries = retries;
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineOutcome process(StorageEvent event) {
        String key = event.key();
        InvocationDeadline deadline = InvocationDeadline.after(properties.pipeline().invocationTimeout(), clock);

        CameraImage image = retries.call(PERSISTENCE, "register", deadline, () -> claims.register(event));
        Long imageId = image.getId();
        if (image.getProcessingStatus().isTerminal()) {
            log.info("Skipping {}: already {}", key, image.getProcessingStatus().dbValue());
            return PipelineOutcome.skipped(key, imageId);
        }
        Optional<String> claim = retries.call(PERSISTENCE, "claim", deadline, () -> claims.claim(imageId));
        if (claim.isEmpty()) {
            return PipelineOutcome.skipped(key, imageId);
        }
        String token = claim.get();
        tracking.publish(key, TrackingStatus.PROCESSING, Map.of("image_id", String.valueOf(imageId)));

        long started = System.nanoTime();
        try {
            BatchResult result = runStages(event, imageId, token, deadline);
            log.info("Processed {} in {} ms: {} detections", key, (System.nanoTime() - started) / 1_000_000, result.detectionCount());
            tracking.publish(key, TrackingStatus.DETECTION_COMPLETE, Map.of(
                    "image_id", String.valueOf(imageId),
                    "detection_count", String.valueOf(result.detectionCount()),
                    "has_animals", String.valueOf(result.hasAnimals())));
            return PipelineOutcome.completed(key, imageId, result.detectionCount());
        } catch (RuntimeException ex) {
            return recordFailure(key, imageId, token, ex);
        }
    }

    private BatchResult runStages(StorageEvent event, Long imageId, String token, InvocationDeadline deadline) {
        byte[] bytes = retries.call(INFERENCE, "load", deadline, () -> imageSource.load(event.bucket(), event.key()));

        deadline.check("metadata");
        ImageMetadata metadata = metadataExtractor.extract(bytes);
        String fileHash = Checksums.sha256Hex(bytes);
        retries.run(PERSISTENCE, "metadata", deadline,
                () -> writer.recordMetadata(imageId, token, bytes.length, fileHash, metadata));

        double detectionThreshold = properties.detection().threshold();
        List<DetectionCandidate> candidates = retries.call(INFERENCE, "detection", deadline,
                () -> detectionAdapter.detect(bytes, detectionThreshold));
        log.debug("Image {} has {} qualifying detections", imageId, candidates.size());

        List<DetectionDraft> drafts = classify(bytes, candidates, deadline);
        int stored = retries.call(PERSISTENCE, "persist", deadline, () -> writer.complete(imageId, token, drafts));
        boolean hasAnimals = drafts.stream().anyMatch(draft -> draft.candidate().type() == DetectionType.ANIMAL);
        return new BatchResult(stored, hasAnimals);
    }

    /**
     * Crops and classifies animal detections one after another. Other detection types pass
     * through without a species.
     */
    private List<DetectionDraft> classify(byte[] bytes, List<DetectionCandidate> candidates, InvocationDeadline deadline) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        PipelineProperties.ClassificationProperties classification = properties.classification();
        double reviewThreshold = properties.detection().reviewThreshold();
        BufferedImage source = null;
        List<DetectionDraft> drafts = new ArrayList<>(candidates.size());
        for (DetectionCandidate candidate : candidates) {
            boolean lowConfidence = candidate.confidence() < reviewThreshold;
            if (!candidate.type().isClassifiable()) {
                drafts.add(DetectionDraft.unclassified(candidate, lowConfidence));
                continue;
            }
            if (source == null) {
                source = ImageDecoding.decode(bytes).image();
            }
            byte[] crop = RegionCropper.crop(source, candidate.boundingBox(), classification.cropPadding());
            List<SpeciesCandidate> predictions = retries.call(INFERENCE, "classification", deadline,
                    () -> classificationAdapter.classify(crop, classification.threshold()));
            if (predictions.isEmpty()) {
                drafts.add(DetectionDraft.unclassified(candidate, true));
                continue;
            }
            SpeciesCandidate top = predictions.get(0);
            Long speciesId = retries.call(PERSISTENCE, "species", deadline,
                    () -> speciesResolver.resolve(top.scientificName()));
            drafts.add(new DetectionDraft(candidate, speciesId, top.confidence(), predictions, lowConfidence));
        }
        return drafts;
    }

    private PipelineOutcome recordFailure(String key, Long imageId, String token, RuntimeException failure) {
        String message = describe(failure);
        log.error("Processing {} failed: {}", key, message, failure);
        boolean recorded;
        try {
            recorded = writer.fail(imageId, token, message);
        } catch (RuntimeException ex) {
            log.error("Could not record failure of {}; the claim lease will expire", key, ex);
            return PipelineOutcome.abandoned(key, imageId, message);
        }
        if (!recorded) {
            return PipelineOutcome.skipped(key, imageId);
        }
        tracking.publish(key, TrackingStatus.DETECTION_FAILED, Map.of("error_message", message));
        return PipelineOutcome.failed(key, imageId, message);
    }

    private static String describe(Throwable failure) {
        String message = failure.getMessage();
        if (message == null || message.isBlank()) {
            return failure.getClass().getSimpleName();
        }
        return message;
    }

    private record BatchResult(int detectionCount, boolean hasAnimals) {
    }
}
