package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.config.PipelineProperties;
import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.model.ProcessingStatus;
import com.example.cameratrap.model.StorageEvent;
import com.example.cameratrap.repository.CameraImageRepository;
import com.example.cameratrap.util.StorageKeyParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Registers images by storage key and hands out exclusive processing claims. The unique key on
 * {@code images.s3_key} turns a duplicate registration into a lookup; the conditional update in
 * {@link CameraImageRepository#claim} lets exactly one worker move a row into {@code processing}.
 */
@Service
public class ImageClaimService {

    private static final Logger log = LoggerFactory.getLogger(ImageClaimService.class);

    private final CameraImageRepository images;
    private final TransactionTemplate newTransaction;
    private final Clock clock;
    private final Duration claimLease;

    public ImageClaimService(CameraImageRepository images,
                             PlatformTransactionManager transactionManager,
                             Clock clock,
                             PipelineProperties properties) {
        this.images = images;
        this.newTransaction = new TransactionTemplate(transactionManager);
        this.newTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.claimLease = properties.pipeline().claimLease();
    }

    /**
     * Returns the image row for the event, inserting a {@code pending} row when the key is new.
     */
    public CameraImage register(StorageEvent event) {
        Optional<CameraImage> existing = images.findByS3Key(event.key());
        if (existing.isPresent()) {
            log.debug("Image {} already registered as {}", event.key(), existing.get().getProcessingStatus());
            return existing.get();
        }
        try {
            CameraImage created = newTransaction.execute(status -> images.saveAndFlush(
                    CameraImage.pending(event.bucket(), event.key(), StorageKeyParser.parse(event.key()), Instant.now(clock))));
            log.info("Registered image {} as id {}", event.key(), created.getId());
            return created;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Concurrent registration of {}, loading the winning row", event.key());
            return images.findByS3Key(event.key()).orElseThrow(() -> ex);
        }
    }

    /**
     * @return the claim token when this caller now owns the image, empty when the image is
     * terminal or another worker holds a live claim
     */
    @Transactional
    public Optional<String> claim(Long imageId) {
        String token = UUID.randomUUID().toString();
        Instant now = Instant.now(clock);
        int updated = images.claim(imageId, token, now, now.minus(claimLease),
                ProcessingStatus.PENDING, ProcessingStatus.PROCESSING);
        if (updated == 0) {
            log.info("Image {} is owned by another worker or already finished", imageId);
            return Optional.empty();
        }
        log.info("Claimed image {}", imageId);
        return Optional.of(token);
    }
}
