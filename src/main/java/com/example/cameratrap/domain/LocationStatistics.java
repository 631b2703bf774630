package com.example.cameratrap.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Per-camera aggregates. Rows are rebuilt wholesale by the statistics refresher and may lag the
 * base tables.
 */
@Entity
@Immutable
@Table(name = "location_statistics")
public class LocationStatistics {

    @Id
    @Column(name = "location_id")
    private Long locationId;

    @Column(name = "camera_id")
    private String cameraId;

    @Column(name = "location_name")
    private String locationName;

    private Double latitude;

    private Double longitude;

    @Column(name = "total_images")
    private long totalImages;

    @Column(name = "total_detections")
    private long totalDetections;

    @Column(name = "unique_species")
    private long uniqueSpecies;

    @Column(name = "unique_animal_species")
    private long uniqueAnimalSpecies;

    @Column(name = "first_capture")
    private LocalDateTime firstCapture;

    @Column(name = "last_capture")
    private LocalDateTime lastCapture;

    @Column(name = "avg_detection_confidence")
    private Double avgDetectionConfidence;

    @Column(name = "avg_species_confidence")
    private Double avgSpeciesConfidence;

    @Column(name = "refreshed_at")
    private Instant refreshedAt;

    protected LocationStatistics() {
    }

    public Long getLocationId() {
        return locationId;
    }

    public String getCameraId() {
        return cameraId;
    }

    public String getLocationName() {
        return locationName;
    }

    public Double getLatitude() {
        return latitude;
    }

    public Double getLongitude() {
        return longitude;
    }

    public long getTotalImages() {
        return totalImages;
    }

    public long getTotalDetections() {
        return totalDetections;
    }

    public long getUniqueSpecies() {
        return uniqueSpecies;
    }

    public long getUniqueAnimalSpecies() {
        return uniqueAnimalSpecies;
    }

    public LocalDateTime getFirstCapture() {
        return firstCapture;
    }

    public LocalDateTime getLastCapture() {
        return lastCapture;
    }

    public Double getAvgDetectionConfidence() {
        return avgDetectionConfidence;
    }

    public Double getAvgSpeciesConfidence() {
        return avgSpeciesConfidence;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }
}
