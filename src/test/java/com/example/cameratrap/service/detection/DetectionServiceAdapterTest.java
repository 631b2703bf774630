package com.example.cameratrap.service.detection;

import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.exception.InferenceUnavailableException;
import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectionServiceAdapterTest {

    private static final byte[] IMAGE = {1, 2, 3};
    private static final BoundingBox BOX = new BoundingBox(0.1, 0.1, 0.3, 0.3);

    @Mock
    private AnimalDetector detector;

    @InjectMocks
    private DetectionServiceAdapter adapter;

    @Test
    void keepsCandidatesAtOrAboveThresholdInDetectorOrder() {
        when(detector.detect(any())).thenReturn(List.of(
                new DetectionCandidate(DetectionType.VEHICLE, BOX, 0.61),
                new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.59),
                new DetectionCandidate(DetectionType.PERSON, BOX, 0.60)));

        List<DetectionCandidate> result = adapter.detect(IMAGE, 0.6);

        assertThat(result).extracting(DetectionCandidate::type)
                .containsExactly(DetectionType.VEHICLE, DetectionType.PERSON);
    }

    @Test
    void keepsOverlappingBoxes() {
        when(detector.detect(any())).thenReturn(List.of(
                new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.9),
                new DetectionCandidate(DetectionType.ANIMAL, BOX, 0.8)));

        assertThat(adapter.detect(IMAGE, 0.6)).hasSize(2);
    }

    @Test
    void emptyDetectorResultIsNotAnError() {
        when(detector.detect(any())).thenReturn(List.of());

        assertThat(adapter.detect(IMAGE, 0.6)).isEmpty();
    }

    @Test
    void rejectsEmptyPayloadWithoutCallingDetector() {
        assertThatThrownBy(() -> adapter.detect(new byte[0], 0.6))
                .isInstanceOf(InferenceRejectedException.class);
        verifyNoInteractions(detector);
    }

    @Test
    void rejectsThresholdOutsideUnitInterval() {
        assertThatThrownBy(() -> adapter.detect(IMAGE, 1.2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void propagatesTransientFailuresUnchanged() {
        when(detector.detect(any())).thenThrow(new InferenceUnavailableException("busy"));

        assertThatThrownBy(() -> adapter.detect(IMAGE, 0.6))
                .isInstanceOf(InferenceUnavailableException.class)
                .hasMessage("busy");
    }

    @Test
    void wrapsUnexpectedDetectorErrorsAsRejections() {
        when(detector.detect(any())).thenThrow(new IllegalStateException("bad tensor"));

        assertThatThrownBy(() -> adapter.detect(IMAGE, 0.6))
                .isInstanceOf(InferenceRejectedException.class)
                .hasMessageContaining("bad tensor");
    }
}
