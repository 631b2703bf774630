package com.example.cameratrap.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Per-species aggregates over animal detections, rebuilt by the statistics refresher.
 */
@Entity
@Immutable
@Table(name = "species_statistics")
public class SpeciesStatistics {

    @Id
    @Column(name = "species_id")
    private Long speciesId;

    @Column(name = "scientific_name")
    private String scientificName;

    @Column(name = "common_name")
    private String commonName;

    @Column(name = "conservation_status", length = 2)
    private String conservationStatus;

    @Column(name = "total_detections")
    private long totalDetections;

    @Column(name = "images_with_species")
    private long imagesWithSpecies;

    @Column(name = "unique_locations")
    private long uniqueLocations;

    @Column(name = "first_observed")
    private LocalDateTime firstObserved;

    @Column(name = "last_observed")
    private LocalDateTime lastObserved;

    @Column(name = "avg_confidence")
    private Double avgConfidence;

    @Column(name = "avg_detection_size")
    private Double avgDetectionSize;

    @Column(name = "refreshed_at")
    private Instant refreshedAt;

    protected SpeciesStatistics() {
    }

    public Long getSpeciesId() {
        return speciesId;
    }

    public String getScientificName() {
        return scientificName;
    }

    public String getCommonName() {
        return commonName;
    }

    public String getConservationStatus() {
        return conservationStatus;
    }

    public long getTotalDetections() {
        return totalDetections;
    }

    public long getImagesWithSpecies() {
        return imagesWithSpecies;
    }

    public long getUniqueLocations() {
        return uniqueLocations;
    }

    public LocalDateTime getFirstObserved() {
        return firstObserved;
    }

    public LocalDateTime getLastObserved() {
        return lastObserved;
    }

    public Double getAvgConfidence() {
        return avgConfidence;
    }

    public Double getAvgDetectionSize() {
        return avgDetectionSize;
    }

    public Instant getRefreshedAt() {
        return refreshedAt;
    }
}
