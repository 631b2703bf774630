package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.PipelineIntegrationTestSupport;
import com.example.cameratrap.domain.CameraImage;
import com.example.cameratrap.domain.Species;
import com.example.cameratrap.exception.ClaimLostException;
import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import com.example.cameratrap.model.ProcessingStatus;
import com.example.cameratrap.model.SpeciesCandidate;
import com.example.cameratrap.model.StorageEvent;
import com.example.cameratrap.repository.CameraImageRepository;
import com.example.cameratrap.repository.DetectionRepository;
import com.example.cameratrap.repository.SpeciesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResultWriterTest extends PipelineIntegrationTestSupport {

    private static final BoundingBox BOX = new BoundingBox(0.1, 0.1, 0.2, 0.2);

    @Autowired
    private ResultWriter writer;

    @Autowired
    private ImageClaimService claimService;

    @Autowired
    private CameraImageRepository imageRepository;

    @Autowired
    private DetectionRepository detectionRepository;

    @Autowired
    private SpeciesRepository speciesRepository;

    private Long imageId;
    private String token;

    @BeforeEach
    void claimImage() {
        CameraImage image = claimService.register(new StorageEvent("traps", "mara/ke/mnc/CAM-3/2024-06-02/0001.jpg"));
        imageId = image.getId();
        token = claimService.claim(imageId).orElseThrow();
    }

    @Test
    void failedBatchLeavesNoDetectionsBehind() {
        Species zebra = speciesRepository.save(new Species("Equus quagga"));
        List<DetectionDraft> drafts = List.of(
                new DetectionDraft(animal(0.9), zebra.getId(), 0.8, List.of(new SpeciesCandidate("Equus quagga", "Plains Zebra", 0.8)), false),
                DetectionDraft.unclassified(new DetectionCandidate(DetectionType.PERSON, BOX, 0.7), true),
                new DetectionDraft(animal(0.85), Long.MAX_VALUE, 0.75, List.of(), false));

        assertThatThrownBy(() -> writer.complete(imageId, token, drafts))
                .isInstanceOf(DataAccessException.class);

        assertThat(detectionRepository.countByImageId(imageId)).isZero();
        CameraImage image = imageRepository.findById(imageId).orElseThrow();
        assertThat(image.getProcessingStatus()).isEqualTo(ProcessingStatus.PROCESSING);
        assertThat(image.getDetectionCount()).isZero();
    }

    @Test
    void completeRequiresCurrentClaim() {
        assertThatThrownBy(() -> writer.complete(imageId, "stale-token", List.of()))
                .isInstanceOf(ClaimLostException.class);

        assertThat(imageRepository.findById(imageId).orElseThrow().getProcessingStatus())
                .isEqualTo(ProcessingStatus.PROCESSING);
    }

    @Test
    void failIsIgnoredForLostClaim() {
        assertThat(writer.fail(imageId, "stale-token", "boom")).isFalse();
        assertThat(writer.fail(imageId, token, "boom")).isTrue();

        CameraImage image = imageRepository.findById(imageId).orElseThrow();
        assertThat(image.getProcessingStatus()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(image.getErrorMessage()).isEqualTo("boom");
        assertThat(image.getClaimToken()).isNull();
    }

    @Test
    void completedImageCannotBeFailedAfterwards() {
        assertThat(writer.complete(imageId, token, List.of())).isZero();

        assertThat(writer.fail(imageId, token, "late failure")).isFalse();
        assertThat(imageRepository.findById(imageId).orElseThrow().getProcessingStatus())
                .isEqualTo(ProcessingStatus.COMPLETED);
    }

    @Test
    void draftRejectsSpeciesOnNonAnimal() {
        assertThatThrownBy(() -> new DetectionDraft(new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.9), 1L, 0.9, List.of(), false))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DetectionDraft(animal(0.9), 1L, null, List.of(), false))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static DetectionCandidate animal(double confidence) {
        return new DetectionCandidate(DetectionType.ANIMAL, BOX, confidence);
    }
}
