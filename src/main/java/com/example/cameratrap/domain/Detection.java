package com.example.cameratrap.domain;

import com.example.cameratrap.model.BoundingBox;
import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.DetectionType;
import com.example.cameratrap.model.SpeciesCandidate;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.List;

/**
 * One bounding box found in an image. Rows are written once by the pipeline; afterwards only the
 * verification fields change. Only {@link DetectionType#ANIMAL} rows may reference a species.
 */
@Entity
@Table(name = "detections", indexes = {
        @Index(name = "idx_detections_image", columnList = "image_id"),
        @Index(name = "idx_detections_species", columnList = "species_id"),
        @Index(name = "idx_detections_type", columnList = "detection_type"),
        @Index(name = "idx_detections_confidence", columnList = "detector_confidence, classifier_confidence"),
        @Index(name = "idx_detections_verified", columnList = "is_verified"),
        @Index(name = "idx_detections_review", columnList = "needs_review")
})
public class Detection {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "image_id", nullable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private CameraImage image;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "species_id")
    private Species species;

    @Column(name = "detection_type", nullable = false, length = 50)
    private DetectionType detectionType;

    @Column(name = "bbox_x", nullable = false)
    private double bboxX;

    @Column(name = "bbox_y", nullable = false)
    private double bboxY;

    @Column(name = "bbox_width", nullable = false)
    private double bboxWidth;

    @Column(name = "bbox_height", nullable = false)
    private double bboxHeight;

    @Column(name = "detector_confidence", nullable = false)
    private double detectorConfidence;

    @Column(name = "classifier_confidence")
    private Double classifierConfidence;

    @Column(name = "overall_confidence")
    private Double overallConfidence;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "species_top5")
    private List<SpeciesCandidate> speciesTop5;

    @Column(name = "is_verified", nullable = false)
    private boolean verified;

    @Column(name = "verified_by", length = 100)
    private String verifiedBy;

    @Column(name = "verified_at")
    private Instant verifiedAt;

    @Column(name = "verification_notes", length = 4000)
    private String verificationNotes;

    @Column(name = "is_false_positive", nullable = false)
    private boolean falsePositive;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview = true;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    protected Detection() {
    }

    public static Detection of(CameraImage image, DetectionCandidate candidate) {
        Detection detection = new Detection();
        detection.image = image;
        detection.detectionType = candidate.type();
        BoundingBox box = candidate.boundingBox();
        detection.bboxX = box.x();
        detection.bboxY = box.y();
        detection.bboxWidth = box.width();
        detection.bboxHeight = box.height();
        detection.detectorConfidence = candidate.confidence();
        return detection;
    }

    public void assignSpecies(Species species, double classifierConfidence, List<SpeciesCandidate> topCandidates) {
        if (!detectionType.isClassifiable()) {
            throw new IllegalStateException("Only animal detections can carry a species, got " + detectionType.label());
        }
        this.species = species;
        this.classifierConfidence = classifierConfidence;
        this.overallConfidence = (detectorConfidence + classifierConfidence) / 2.0;
        this.speciesTop5 = List.copyOf(topCandidates);
    }

    @PrePersist
    void checkSpeciesCoupling() {
        if (!detectionType.isClassifiable() && (species != null || classifierConfidence != null)) {
            throw new IllegalStateException("A " + detectionType.label() + " detection cannot reference a species");
        }
    }

    public BoundingBox boundingBox() {
        return new BoundingBox(bboxX, bboxY, bboxWidth, bboxHeight);
    }

    public Long getId() {
        return id;
    }

    public CameraImage getImage() {
        return image;
    }

    public Species getSpecies() {
        return species;
    }

    public DetectionType getDetectionType() {
        return detectionType;
    }

    public double getBboxX() {
        return bboxX;
    }

    public double getBboxY() {
        return bboxY;
    }

    public double getBboxWidth() {
        return bboxWidth;
    }

    public double getBboxHeight() {
        return bboxHeight;
    }

    public double getDetectorConfidence() {
        return detectorConfidence;
    }

    public Double getClassifierConfidence() {
        return classifierConfidence;
    }

    public Double getOverallConfidence() {
        return overallConfidence;
    }

    public List<SpeciesCandidate> getSpeciesTop5() {
        return speciesTop5;
    }

    public boolean isVerified() {
        return verified;
    }

    public String getVerifiedBy() {
        return verifiedBy;
    }

    public Instant getVerifiedAt() {
        return verifiedAt;
    }

    public String getVerificationNotes() {
        return verificationNotes;
    }

    public boolean isFalsePositive() {
        return falsePositive;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public void setNeedsReview(boolean needsReview) {
        this.needsReview = needsReview;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
