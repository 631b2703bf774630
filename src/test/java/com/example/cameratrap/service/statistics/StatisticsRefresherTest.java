package com.example.cameratrap.service.statistics;

import com.example.cameratrap.PipelineIntegrationTestSupport;
import com.example.cameratrap.TestImages;
import com.example.cameratrap.domain.Location;
import com.example.cameratrap.domain.LocationStatistics;
import com.example.cameratrap.domain.Species;
import com.example.cameratrap.domain.SpeciesStatistics;
import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.ConservationStatus;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import com.example.cameratrap.model.OverviewStatistics;
import com.example.cameratrap.model.RefreshSummary;
import com.example.cameratrap.model.SpeciesCandidate;
import com.example.cameratrap.model.StorageEvent;
import com.example.cameratrap.repository.LocationRepository;
import com.example.cameratrap.repository.SpeciesRepository;
import com.example.cameratrap.service.pipeline.PipelineOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.temporal.ChronoUnit;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

class StatisticsRefresherTest extends PipelineIntegrationTestSupport {

    private static final String PREFIX = "serengeti/tz/wcs/CAM-017/2024-05-01/";

    @Autowired
    private StatisticsRefresher refresher;

    @Autowired
    private StatisticsQueryService queryService;

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private SpeciesRepository speciesRepository;

    @Autowired
    private LocationRepository locationRepository;

    private Location site;

    @BeforeEach
    void seedObservations() {
        site = new Location("CAM-017", -2.4531, 34.822);
        site.setLocationName("Seronera river crossing");
        site = locationRepository.save(site);
        Species lion = new Species("Panthera leo");
        lion.setCommonName("Lion");
        lion.setConservationStatus(ConservationStatus.VU);
        speciesRepository.save(lion);
        speciesRepository.save(new Species("Panthera pardus"));

        when(imageSource.load(anyString(), anyString())).thenReturn(TestImages.sampleJpeg());
        when(speciesClassifier.classify(any(), anyInt())).thenReturn(List.of(
                new SpeciesCandidate("Panthera leo", "Lion", 0.9)));
        when(animalDetector.detect(any())).thenReturn(List.of(
                new DetectionCandidate(DetectionType.ANIMAL, new BoundingBox(0.1, 0.1, 0.2, 0.5), 0.95),
                new DetectionCandidate(DetectionType.ANIMAL, new BoundingBox(0.5, 0.5, 0.4, 0.25), 0.85),
                new DetectionCandidate(DetectionType.PERSON, new BoundingBox(0.7, 0.1, 0.1, 0.3), 0.75)));
        orchestrator.process(new StorageEvent("traps", PREFIX + "IMG_0001.JPG"));

        when(animalDetector.detect(any())).thenReturn(List.of());
        orchestrator.process(new StorageEvent("traps", PREFIX + "IMG_0002.JPG"));
    }

    @Test
    void aggregatesPerLocation() {
        RefreshSummary summary = refresher.refresh();

        assertThat(summary.locationRows()).isEqualTo(1);
        LocationStatistics stats = queryService.locations().get(0);
        assertThat(stats.getLocationId()).isEqualTo(site.getId());
        assertThat(stats.getCameraId()).isEqualTo("CAM-017");
        assertThat(stats.getLocationName()).isEqualTo("Seronera river crossing");
        assertThat(stats.getTotalImages()).isEqualTo(2);
        assertThat(stats.getTotalDetections()).isEqualTo(3);
        assertThat(stats.getUniqueSpecies()).isEqualTo(1);
        assertThat(stats.getUniqueAnimalSpecies()).isEqualTo(1);
        assertThat(stats.getAvgDetectionConfidence()).isCloseTo(0.85, within(1e-9));
        assertThat(stats.getAvgSpeciesConfidence()).isCloseTo(0.9, within(1e-9));
        assertThat(stats.getRefreshedAt()).isCloseTo(summary.refreshedAt(), within(1, ChronoUnit.MILLIS));
    }

    @Test
    void aggregatesOnlyObservedSpecies() {
        RefreshSummary summary = refresher.refresh();

        assertThat(summary.speciesRows()).isEqualTo(1);
        List<SpeciesStatistics> species = queryService.species(null, 50, 0);
        assertThat(species).hasSize(1);
        SpeciesStatistics lion = species.get(0);
        assertThat(lion.getScientificName()).isEqualTo("Panthera leo");
        assertThat(lion.getConservationStatus()).isEqualTo("VU");
        assertThat(lion.getTotalDetections()).isEqualTo(2);
        assertThat(lion.getImagesWithSpecies()).isEqualTo(1);
        assertThat(lion.getUniqueLocations()).isEqualTo(1);
        assertThat(lion.getAvgDetectionSize()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    void filtersSpeciesByConservationStatus() {
        refresher.refresh();

        assertThat(queryService.species(ConservationStatus.VU, 10, 0)).hasSize(1);
        assertThat(queryService.species(ConservationStatus.EN, 10, 0)).isEmpty();
        assertThatThrownBy(() -> queryService.species(null, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refreshReplacesPreviousSnapshot() {
        refresher.refresh();
        when(animalDetector.detect(any())).thenReturn(List.of(
                new DetectionCandidate(DetectionType.VEHICLE, new BoundingBox(0.1, 0.1, 0.2, 0.2), 0.9)));
        orchestrator.process(new StorageEvent("traps", PREFIX + "IMG_0003.JPG"));

        RefreshSummary second = refresher.refresh();

        assertThat(second.locationRows()).isEqualTo(1);
        assertThat(queryService.locations()).singleElement()
                .satisfies(stats -> assertThat(stats.getTotalDetections()).isEqualTo(4));
    }

    @Test
    void overviewCountsLiveTables() {
        OverviewStatistics overview = queryService.overview();

        assertThat(overview.totalImages()).isEqualTo(2);
        assertThat(overview.totalDetections()).isEqualTo(3);
        assertThat(overview.totalSpecies()).isEqualTo(1);
        assertThat(overview.totalLocations()).isEqualTo(1);
        assertThat(overview.processedImages()).isEqualTo(2);
        assertThat(overview.pendingImages()).isZero();
    }
}
