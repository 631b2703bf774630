package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.PipelineIntegrationTestSupport;
import com.example.cameratrap.TestImages;
import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.domain.Detection;
import com.example.cameratrap.domain.Location;
import com.example.cameratrap.domain.Species;
import com.example.cameratrap.exception.ImageDecodeException;
import com.example.cameratrap.exception.InferenceUnavailableException;
import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import com.example.cameratrap.model.PipelineOutcome;
import com.example.cameratrap.model.PipelineOutcome.Result;
import com.example.cameratrap.model.ProcessingStatus;
import com.example.cameratrap.model.SpeciesCandidate;
import com.example.cameratrap.model.StorageEvent;
import com.example.cameratrap.repository.CameraImageRepository;
import com.example.cameratrap.repository.DetectionRepository;
import com.example.cameratrap.repository.LocationRepository;
import com.example.cameratrap.repository.SpeciesRepository;
import com.example.cameratrap.service.tracking.TrackingStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineOrchestratorIntegrationTest extends PipelineIntegrationTestSupport {

    private static final String BUCKET = "camera-trap-uploads";
    private static final String KEY = "serengeti/tz/wcs/CAM-017/2024-05-01/IMG_0042.JPG";
    private static final StorageEvent EVENT = new StorageEvent(BUCKET, KEY);
    private static final BoundingBox BOX = new BoundingBox(0.2, 0.3, 0.25, 0.2);

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private CameraImageRepository imageRepository;

    @Autowired
    private DetectionRepository detectionRepository;

    @Autowired
    private SpeciesRepository speciesRepository;

    @Autowired
    private LocationRepository locationRepository;

    @Autowired
    private ImageClaimService claimService;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @BeforeEach
    void setUp() {
        when(imageSource.load(anyString(), anyString())).thenReturn(TestImages.sampleJpeg());
    }

    @Test
    void emptyFrameCompletesWithoutDetections() {
        when(animalDetector.detect(any())).thenReturn(List.of());

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        assertThat(outcome.detectionCount()).isZero();
        CameraImage image = imageRepository.findByS3Key(KEY).orElseThrow();
        assertThat(image.getProcessingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(image.isHasDetections()).isFalse();
        assertThat(image.getDetectionCount()).isZero();
        assertThat(image.getProcessedAt()).isNotNull();
        assertThat(image.getWidth()).isEqualTo(320);
        assertThat(image.getFormat()).isEqualTo("JPEG");
        assertThat(image.getFileHash()).hasSize(64);
        assertThat(image.getCameraId()).isEqualTo("CAM-017");
        assertThat(image.getProjectName()).isEqualTo("serengeti");
        assertThat(image.getClaimToken()).isNull();
        verify(speciesClassifier, never()).classify(any(), anyInt());
        verify(trackingStore, timeout(2000).atLeastOnce()).setStatus(eq(KEY), eq(TrackingStatus.DETECTION_COMPLETE),
                argThat(detail -> "0".equals(detail.get("detection_count")) && "false".equals(detail.get("has_animals"))));
    }

    @Test
    void classifiedAnimalIsLinkedToCatalogSpecies() {
        Species lion = new Species("Panthera leo");
        lion.setCommonName("Lion");
        speciesRepository.save(lion);
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.93)));
        when(speciesClassifier.classify(any(), anyInt())).thenReturn(List.of(
                new SpeciesCandidate("Panthera leo", "Lion", 0.92),
                new SpeciesCandidate("Panthera pardus", "Leopard", 0.05)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        assertThat(outcome.detectionCount()).isEqualTo(1);
        List<Detection> detections = detectionRepository.findByImageIdOrderByConfidence(outcome.imageId());
        assertThat(detections).hasSize(1);
        Detection detection = detections.get(0);
        assertThat(detection.getSpecies().getId()).isEqualTo(lion.getId());
        assertThat(detection.getClassifierConfidence()).isEqualTo(0.92);
        assertThat(detection.getSpeciesTop5()).extracting(SpeciesCandidate::scientificName).containsExactly("Panthera leo");
        assertThat(detection.isNeedsReview()).isFalse();
        assertThat(detection.getBboxWidth()).isEqualTo(0.25);
        verify(trackingStore, timeout(2000).atLeastOnce()).setStatus(eq(KEY), eq(TrackingStatus.DETECTION_COMPLETE),
                argThat(detail -> "true".equals(detail.get("has_animals"))));
    }

    @Test
    void personIsStoredWithoutSpeciesAndNeverClassified() {
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.PERSON, BOX, 0.7)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        Detection detection = detectionRepository.findByImageIdOrderByConfidence(outcome.imageId()).get(0);
        assertThat(detection.getDetectionType()).isEqualTo(DetectionType.PERSON);
        assertThat(detection.getSpecies()).isNull();
        assertThat(detection.getClassifierConfidence()).isNull();
        assertThat(detection.isNeedsReview()).isTrue();
        verify(speciesClassifier, never()).classify(any(), anyInt());
    }

    @Test
    void unknownSpeciesGetsStubEntry() {
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.9)));
        when(speciesClassifier.classify(any(), anyInt())).thenReturn(List.of(
                new SpeciesCandidate("Orycteropus afer", "Aardvark", 0.81)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        Species stub = speciesRepository.findByScientificName("Orycteropus afer").orElseThrow();
        assertThat(stub.getCommonName()).isNull();
        assertThat(stub.getConservationStatus()).isNull();
        Detection detection = detectionRepository.findByImageIdOrderByConfidence(outcome.imageId()).get(0);
        assertThat(detection.getSpecies().getId()).isEqualTo(stub.getId());
    }

    @Test
    void animalBelowClassificationThresholdIsFlaggedForReview() {
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.95)));
        when(speciesClassifier.classify(any(), anyInt())).thenReturn(List.of(
                new SpeciesCandidate("Panthera leo", "Lion", 0.3)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        Detection detection = detectionRepository.findByImageIdOrderByConfidence(outcome.imageId()).get(0);
        assertThat(detection.getSpecies()).isNull();
        assertThat(detection.getClassifierConfidence()).isNull();
        assertThat(detection.isNeedsReview()).isTrue();
        assertThat(speciesRepository.findByScientificName("Panthera leo")).isEmpty();
    }

    @Test
    void persistentDetectorOutageMarksImageFailedAfterRetries() {
        when(animalDetector.detect(any())).thenThrow(new InferenceUnavailableException("detector offline"));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.FAILED);
        assertThat(outcome.errorMessage()).contains("detector offline");
        verify(animalDetector, times(3)).detect(any());
        CameraImage image = imageRepository.findByS3Key(KEY).orElseThrow();
        assertThat(image.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(image.getErrorMessage()).isNotBlank();
        assertThat(detectionRepository.countByImageId(image.getId())).isZero();
        verify(trackingStore, timeout(2000).atLeastOnce()).setStatus(eq(KEY), eq(TrackingStatus.DETECTION_FAILED),
                argThat(detail -> detail.getOrDefault("error_message", "").contains("detector offline")));
    }

    @Test
    void invocationTimeoutStopsRetriesAndMarksImageFailed() {
        when(animalDetector.detect(any())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(11));
            throw new InferenceUnavailableException("detector overloaded");
        });

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.FAILED);
        assertThat(outcome.errorMessage()).contains("exceeded");
        verify(animalDetector, times(1)).detect(any());
        CameraImage image = imageRepository.findByS3Key(KEY).orElseThrow();
        assertThat(image.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(image.getErrorMessage()).contains("exceeded");
        assertThat(image.getClaimToken()).isNull();
        assertThat(detectionRepository.countByImageId(image.getId())).isZero();
    }

    @Test
    void transientDetectorFailureRecoversOnRetry() {
        when(animalDetector.detect(any()))
                .thenThrow(new InferenceUnavailableException("warming up"))
                .thenReturn(List.of(new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.88)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        assertThat(outcome.detectionCount()).isEqualTo(1);
        verify(animalDetector, times(2)).detect(any());
    }

    @Test
    void corruptImageFailsWithoutCallingDetector() {
        when(imageSource.load(anyString(), anyString())).thenReturn(new byte[]{0x01, 0x02, 0x03});

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.FAILED);
        verify(animalDetector, never()).detect(any());
        verify(imageSource, times(1)).load(BUCKET, KEY);
    }

    @Test
    void missingObjectFailsWithoutRetry() {
        when(imageSource.load(anyString(), anyString())).thenThrow(new ImageDecodeException("Object not found"));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.FAILED);
        assertThat(imageRepository.findByS3Key(KEY).orElseThrow().getErrorMessage()).contains("Object not found");
        verify(imageSource, times(1)).load(BUCKET, KEY);
    }

    @Test
    void redeliveredEventIsSkipped() {
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.88)));

        PipelineOutcome first = orchestrator.process(EVENT);
        PipelineOutcome second = orchestrator.process(EVENT);

        assertThat(first.result()).isEqualTo(Result.COMPLETED);
        assertThat(second.result()).isEqualTo(Result.SKIPPED);
        assertThat(second.imageId()).isEqualTo(first.imageId());
        assertThat(imageRepository.count()).isEqualTo(1);
        assertThat(detectionRepository.countByImageId(first.imageId())).isEqualTo(1);
        verify(animalDetector, times(1)).detect(any());
    }

    @Test
    void failedImageIsNotReprocessed() {
        when(animalDetector.detect(any())).thenThrow(new InferenceUnavailableException("down"));
        orchestrator.process(EVENT);

        PipelineOutcome again = orchestrator.process(EVENT);

        assertThat(again.result()).isEqualTo(Result.SKIPPED);
        assertThat(imageRepository.findByS3Key(KEY).orElseThrow().getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
    }

    @Test
    void onlyDetectionsAtOrAboveThresholdAreStored() {
        when(animalDetector.detect(any())).thenReturn(List.of(
                new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.59),
                new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.61),
                new DetectionCandidate(DetectionType.PERSON, BOX, 0.6)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        List<Detection> detections = detectionRepository.findByImageIdOrderByConfidence(outcome.imageId());
        assertThat(detections).extracting(Detection::getDetectionType)
                .containsExactly(DetectionType.VEHICLE, DetectionType.PERSON);
        assertThat(detections).allMatch(detection -> detection.getDetectorConfidence() >= 0.6);
        verify(speciesClassifier, never()).classify(any(), anyInt());
    }

    @Test
    void detectionCountMatchesStoredRowsAndSpeciesOnlyOnAnimals() {
        speciesRepository.save(new Species("Loxodonta africana"));
        when(animalDetector.detect(any())).thenReturn(List.of(
                new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.97),
                new DetectionCandidate(DetectionType.ANIMAL, new BoundingBox(0.6, 0.5, 0.2, 0.2), 0.91),
                new DetectionCandidate(DetectionType.PERSON, BOX, 0.83),
                new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.65)));
        when(speciesClassifier.classify(any(), anyInt())).thenReturn(List.of(
                new SpeciesCandidate("Loxodonta africana", "African Elephant", 0.88)));

        PipelineOutcome outcome = orchestrator.process(EVENT);

        CameraImage image = imageRepository.findByS3Key(KEY).orElseThrow();
        assertThat(image.getDetectionCount()).isEqualTo(4);
        assertThat(detectionRepository.countByImageId(image.getId())).isEqualTo(image.getDetectionCount());
        assertThat(outcome.detectionCount()).isEqualTo(4);
        List<Detection> detections = detectionRepository.findByImageIdOrderByConfidence(image.getId());
        assertThat(detections).allSatisfy(detection -> {
            if (detection.getDetectionType() == DetectionType.ANIMAL) {
                assertThat(detection.getSpecies()).isNotNull();
            } else {
                assertThat(detection.getSpecies()).isNull();
            }
        });
        verify(speciesClassifier, times(2)).classify(any(), anyInt());
    }

    @Test
    void deletingImageRemovesItsDetections() {
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.9)));
        PipelineOutcome doomed = orchestrator.process(EVENT);
        PipelineOutcome kept = orchestrator.process(new StorageEvent(BUCKET, "serengeti/tz/wcs/CAM-017/2024-05-01/IMG_0043.JPG"));

        imageRepository.deleteById(doomed.imageId());

        assertThat(detectionRepository.countByImageId(doomed.imageId())).isZero();
        assertThat(detectionRepository.countByImageId(kept.imageId())).isEqualTo(1);
    }

    @Test
    void concurrentDeliveriesProduceOneCompletedRun() throws Exception {
        when(animalDetector.detect(any())).thenReturn(List.of(new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.9)));
        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<PipelineOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 2; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return orchestrator.process(EVENT);
                }));
            }
            start.countDown();
            List<Result> results = new ArrayList<>();
            for (Future<PipelineOutcome> future : futures) {
                results.add(future.get(30, TimeUnit.SECONDS).result());
            }

            assertThat(results).containsOnly(Result.COMPLETED, Result.SKIPPED);
            assertThat(results).filteredOn(result -> result == Result.COMPLETED).hasSize(1);
        } finally {
            pool.shutdownNow();
        }
        CameraImage image = imageRepository.findByS3Key(KEY).orElseThrow();
        assertThat(imageRepository.count()).isEqualTo(1);
        assertThat(image.getProcessingStatus()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(detectionRepository.countByImageId(image.getId())).isEqualTo(1);
    }

    @Test
    void liveClaimBlocksSecondWorker() {
        CameraImage image = claimService.register(EVENT);
        assertThat(claimService.claim(image.getId())).isPresent();

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.SKIPPED);
        verify(animalDetector, never()).detect(any());
    }

    @Test
    void expiredClaimIsTakenOver() {
        when(animalDetector.detect(any())).thenReturn(List.of());
        CameraImage image = claimService.register(EVENT);
        assertThat(claimService.claim(image.getId())).isPresent();
        jdbcTemplate.update("UPDATE images SET claimed_at = ? WHERE id = ?",
                Timestamp.from(Instant.now().minusSeconds(60)), image.getId());

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
    }

    @Test
    void unregisteredCameraLeavesLocationEmpty() {
        when(animalDetector.detect(any())).thenReturn(List.of());

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        assertThat(locationIdOf(outcome.imageId())).isNull();
    }

    @Test
    void registeredCameraIsLinkedToItsLocation() {
        Location location = locationRepository.save(new Location("CAM-017", -2.4531, 34.822));
        when(animalDetector.detect(any())).thenReturn(List.of());

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(locationIdOf(outcome.imageId())).isEqualTo(location.getId());
    }

    @Test
    void trackingFailureDoesNotRevertCompletion() {
        when(animalDetector.detect(any())).thenReturn(List.of());
        doThrow(new IllegalStateException("throttled")).when(trackingStore).setStatus(anyString(), any(), anyMap());

        PipelineOutcome outcome = orchestrator.process(EVENT);

        assertThat(outcome.result()).isEqualTo(Result.COMPLETED);
        verify(trackingStore, timeout(2000).atLeast(2)).setStatus(anyString(), any(), anyMap());
        assertThat(imageRepository.findByS3Key(KEY).orElseThrow().getProcessingStatus())
                .isEqualTo(ProcessingStatus.COMPLETED);
    }

    private Long locationIdOf(Long imageId) {
        TransactionTemplate transaction = new TransactionTemplate(transactionManager);
        return transaction.execute(status -> {
            Location location = imageRepository.findById(imageId).orElseThrow().getLocation();
            return location == null ? null : location.getId();
        });
    }
}
