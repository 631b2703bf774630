package com.example.cameratrap.service.statistics;

import com.example.cameratrap.model.RefreshSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Rebuilds {@code location_statistics} and {@code species_statistics} from the base tables. Both
 * tables are replaced in one transaction, so readers see either the old or the new snapshot. The
 * pipeline never waits on this.
 */
@Service
public class StatisticsRefresher {

    private static final Logger log = LoggerFactory.getLogger(StatisticsRefresher.class);

    private static final String LOCATION_STATISTICS = """
            INSERT INTO location_statistics (
                location_id, camera_id, location_name, latitude, longitude,
                total_images, total_detections, unique_species, unique_animal_species,
                first_capture, last_capture, avg_detection_confidence, avg_species_confidence, refreshed_at)
            SELECT
                l.id, l.camera_id, l.location_name, l.latitude, l.longitude,
                COUNT(DISTINCT i.id),
                COUNT(DISTINCT d.id),
                COUNT(DISTINCT d.species_id),
                COUNT(DISTINCT CASE WHEN d.detection_type = 'animal' THEN d.species_id END),
                MIN(i.captured_at),
                MAX(i.captured_at),
                AVG(d.detector_confidence),
                AVG(d.classifier_confidence),
                CAST(? AS TIMESTAMP WITH TIME ZONE)
            FROM locations l
            LEFT JOIN images i ON l.camera_id = i.camera_id
            LEFT JOIN detections d ON i.id = d.image_id
            GROUP BY l.id, l.camera_id, l.location_name, l.latitude, l.longitude
            """;

    private static final String SPECIES_STATISTICS = """
            INSERT INTO species_statistics (
                species_id, scientific_name, common_name, conservation_status,
                total_detections, images_with_species, unique_locations,
                first_observed, last_observed, avg_confidence, avg_detection_size, refreshed_at)
            SELECT
                s.id, s.scientific_name, s.common_name, s.conservation_status,
                COUNT(DISTINCT d.id),
                COUNT(DISTINCT d.image_id),
                COUNT(DISTINCT i.camera_id),
                MIN(i.captured_at),
                MAX(i.captured_at),
                AVG(d.classifier_confidence),
                AVG(d.bbox_width * d.bbox_height),
                CAST(? AS TIMESTAMP WITH TIME ZONE)
            FROM species s
            JOIN detections d ON s.id = d.species_id AND d.detection_type = 'animal'
            LEFT JOIN images i ON d.image_id = i.id
            GROUP BY s.id, s.scientific_name, s.common_name, s.conservation_status
            """;

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public StatisticsRefresher(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public RefreshSummary refresh() {
        Instant refreshedAt = Instant.now(clock);
        OffsetDateTime timestamp = OffsetDateTime.ofInstant(refreshedAt, ZoneOffset.UTC);
        long started = System.nanoTime();
        RefreshSummary summary = transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM location_statistics");
            int locations = jdbcTemplate.update(LOCATION_STATISTICS, timestamp);
            jdbcTemplate.update("DELETE FROM species_statistics");
            int species = jdbcTemplate.update(SPECIES_STATISTICS, timestamp);
            return new RefreshSummary(locations, species, refreshedAt);
        });
        log.info("Refreshed statistics in {} ms: {} locations, {} species",
                (System.nanoTime() - started) / 1_000_000, summary.locationRows(), summary.speciesRows());
        return summary;
    }

    @Scheduled(fixedDelayString = "${camera-trap.statistics.refresh-interval:PT15M}",
            initialDelayString = "${camera-trap.statistics.refresh-interval:PT15M}")
    public void scheduledRefresh() {
        try {
            refresh();
        } catch (DataAccessException ex) {
            log.error("Scheduled statistics refresh failed; keeping the previous snapshot", ex);
        }
    }
}
