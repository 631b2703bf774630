package com.example.cameratrap.domain;

import com.example.cameratrap.model.ConservationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Catalog entry keyed by scientific name. The key never changes once written; every other field
 * can be enriched later.
 */
@Entity
@Table(name = "species", indexes = {
        @Index(name = "idx_species_common", columnList = "common_name"),
        @Index(name = "idx_species_status", columnList = "conservation_status")
})
public class Species {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "scientific_name", nullable = false, unique = true, updatable = false)
    private String scientificName;

    @Column(name = "common_name")
    private String commonName;

    @Column(name = "taxonomy_kingdom", length = 100)
    private String taxonomyKingdom;

    @Column(name = "taxonomy_phylum", length = 100)
    private String taxonomyPhylum;

    @Column(name = "taxonomy_class", length = 100)
    private String taxonomyClass;

    @Column(name = "taxonomy_order", length = 100)
    private String taxonomyOrder;

    @Column(name = "taxonomy_family", length = 100)
    private String taxonomyFamily;

    @Column(name = "taxonomy_genus", length = 100)
    private String taxonomyGenus;

    @Enumerated(EnumType.STRING)
    @Column(name = "conservation_status", length = 2)
    private ConservationStatus conservationStatus;

    @Column(name = "iucn_id", length = 50)
    private String iucnId;

    @Column(length = 4000)
    private String description;

    @Column(name = "habitat_notes", length = 4000)
    private String habitatNotes;

    @Column(name = "behavior_notes", length = 4000)
    private String behaviorNotes;

    @Column(name = "average_weight_kg", precision = 10, scale = 2)
    private BigDecimal averageWeightKg;

    @Column(name = "average_length_cm", precision = 10, scale = 2)
    private BigDecimal averageLengthCm;

    @Column(name = "thumbnail_url", length = 500)
    private String thumbnailUrl;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    protected Species() {
    }

    public Species(String scientificName) {
        if (scientificName == null || scientificName.isBlank()) {
            throw new IllegalArgumentException("Scientific name is required");
        }
        this.scientificName = scientificName.trim();
    }

    public Long getId() {
        return id;
    }

    public String getScientificName() {
        return scientificName;
    }

    public String getCommonName() {
        return commonName;
    }

    public void setCommonName(String commonName) {
        this.commonName = commonName;
    }

    public String getTaxonomyKingdom() {
        return taxonomyKingdom;
    }

    public void setTaxonomyKingdom(String taxonomyKingdom) {
        this.taxonomyKingdom = taxonomyKingdom;
    }

    public String getTaxonomyPhylum() {
        return taxonomyPhylum;
    }

    public void setTaxonomyPhylum(String taxonomyPhylum) {
        this.taxonomyPhylum = taxonomyPhylum;
    }

    public String getTaxonomyClass() {
        return taxonomyClass;
    }

    public void setTaxonomyClass(String taxonomyClass) {
        this.taxonomyClass = taxonomyClass;
    }

    public String getTaxonomyOrder() {
        return taxonomyOrder;
    }

    public void setTaxonomyOrder(String taxonomyOrder) {
        this.taxonomyOrder = taxonomyOrder;
    }

    public String getTaxonomyFamily() {
        return taxonomyFamily;
    }

    public void setTaxonomyFamily(String taxonomyFamily) {
        this.taxonomyFamily = taxonomyFamily;
    }

    public String getTaxonomyGenus() {
        return taxonomyGenus;
    }

    public void setTaxonomyGenus(String taxonomyGenus) {
        this.taxonomyGenus = taxonomyGenus;
    }

    public ConservationStatus getConservationStatus() {
        return conservationStatus;
    }

    public void setConservationStatus(ConservationStatus conservationStatus) {
        this.conservationStatus = conservationStatus;
    }

    public String getIucnId() {
        return iucnId;
    }

    public void setIucnId(String iucnId) {
        this.iucnId = iucnId;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getHabitatNotes() {
        return habitatNotes;
    }

    public void setHabitatNotes(String habitatNotes) {
        this.habitatNotes = habitatNotes;
    }

    public String getBehaviorNotes() {
        return behaviorNotes;
    }

    public void setBehaviorNotes(String behaviorNotes) {
        this.behaviorNotes = behaviorNotes;
    }

    public BigDecimal getAverageWeightKg() {
        return averageWeightKg;
    }

    public void setAverageWeightKg(BigDecimal averageWeightKg) {
        this.averageWeightKg = averageWeightKg;
    }

    public BigDecimal getAverageLengthCm() {
        return averageLengthCm;
    }

    public void setAverageLengthCm(BigDecimal averageLengthCm) {
        this.averageLengthCm = averageLengthCm;
    }

    public String getThumbnailUrl() {
        return thumbnailUrl;
    }

    public void setThumbnailUrl(String thumbnailUrl) {
        this.thumbnailUrl = thumbnailUrl;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
