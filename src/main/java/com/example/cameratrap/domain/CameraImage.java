package com.example.cameratrap.domain;

import com.example.cameratrap.model.ImageMetadata;
import com.example.cameratrap.model.ProcessingStatus;
import com.example.cameratrap.util.StorageKeyParser.StoragePath;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * One camera trap photo, keyed by its storage key. The unique key doubles as the idempotency
 * guard for repeated upload notifications.
 */
@Entity
@Table(name = "images", indexes = {
        @Index(name = "idx_images_camera", columnList = "camera_id"),
        @Index(name = "idx_images_captured", columnList = "captured_at"),
        @Index(name = "idx_images_status", columnList = "processing_status"),
        @Index(name = "idx_images_project", columnList = "project_name, country, client")
})
public class CameraImage {

    private static final int MAX_ERROR_LENGTH = 2000;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "s3_bucket", nullable = false)
    private String s3Bucket;

    @Column(name = "s3_key", nullable = false, unique = true, updatable = false, length = 500)
    private String s3Key;

    @Column(name = "file_name", nullable = false)
    private String fileName;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "file_hash", length = 64)
    private String fileHash;

    private Integer width;

    private Integer height;

    @Column(length = 20)
    private String format;

    @Column(name = "camera_id", length = 100)
    private String cameraId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "location_id")
    private Location location;

    @Column(name = "captured_at")
    private LocalDateTime capturedAt;

    @Column(name = "uploaded_at", nullable = false)
    private Instant uploadedAt;

    @Column(name = "processed_at")
    private Instant processedAt;

    @Column(name = "project_name", length = 100)
    private String projectName;

    @Column(length = 100)
    private String client;

    @Column(length = 100)
    private String country;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "exif_data")
    private Map<String, String> exifData = new HashMap<>();

    @Column(name = "gps_latitude")
    private Double gpsLatitude;

    @Column(name = "gps_longitude")
    private Double gpsLongitude;

    @Column(name = "gps_altitude")
    private Double gpsAltitude;

    @Column(name = "camera_make", length = 100)
    private String cameraMake;

    @Column(name = "camera_model", length = 100)
    private String cameraModel;

    @Column(name = "processing_status", nullable = false, length = 50)
    private ProcessingStatus processingStatus = ProcessingStatus.PENDING;

    @Column(name = "error_message", length = MAX_ERROR_LENGTH)
    private String errorMessage;

    @Column(name = "claim_token", length = 36)
    private String claimToken;

    @Column(name = "claimed_at")
    private Instant claimedAt;

    @Column(name = "has_detections", nullable = false)
    private boolean hasDetections;

    @Column(name = "detection_count", nullable = false)
    private int detectionCount;

    @Column(name = "brightness_score")
    private Double brightnessScore;

    @Column(name = "sharpness_score")
    private Double sharpnessScore;

    @Column(name = "quality_score")
    private Double qualityScore;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    protected CameraImage() {
    }

    public static CameraImage pending(String bucket, String key, StoragePath path, Instant uploadedAt) {
        CameraImage image = new CameraImage();
        image.s3Bucket = bucket;
        image.s3Key = key;
        image.fileName = path.fileName();
        image.projectName = path.projectName();
        image.country = path.country();
        image.client = path.client();
        image.cameraId = path.cameraId();
        image.uploadedAt = uploadedAt;
        image.processingStatus = ProcessingStatus.PENDING;
        return image;
    }

    public void applyMetadata(ImageMetadata metadata, long fileSize, String fileHash) {
        this.fileSize = fileSize;
        this.fileHash = fileHash;
        this.width = metadata.width();
        this.height = metadata.height();
        this.format = metadata.format();
        this.capturedAt = metadata.capturedAt();
        this.gpsLatitude = metadata.gpsLatitude();
        this.gpsLongitude = metadata.gpsLongitude();
        this.gpsAltitude = metadata.gpsAltitude();
        this.cameraMake = metadata.cameraMake();
        this.cameraModel = metadata.cameraModel();
        this.exifData = new HashMap<>(metadata.exif());
        this.brightnessScore = metadata.brightness();
        this.sharpnessScore = metadata.sharpness();
        this.qualityScore = metadata.quality();
    }

    public boolean isClaimedBy(String token) {
        return processingStatus == ProcessingStatus.PROCESSING && token != null && token.equals(claimToken);
    }

    public void markCompleted(int detectionCount, Instant processedAt) {
        this.processingStatus = ProcessingStatus.COMPLETED;
        this.detectionCount = detectionCount;
        this.hasDetections = detectionCount > 0;
        this.processedAt = processedAt;
        this.errorMessage = null;
        releaseClaim();
    }

    public void markFailed(String errorMessage) {
        this.processingStatus = ProcessingStatus.FAILED;
        this.errorMessage = truncate(errorMessage == null || errorMessage.isBlank() ? "Unknown failure" : errorMessage);
        releaseClaim();
    }

    private void releaseClaim() {
        this.claimToken = null;
        this.claimedAt = null;
    }

    private static String truncate(String message) {
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }

    public Long getId() {
        return id;
    }

    public String getS3Bucket() {
        return s3Bucket;
    }

    public String getS3Key() {
        return s3Key;
    }

    public String getFileName() {
        return fileName;
    }

    public Long getFileSize() {
        return fileSize;
    }

    public String getFileHash() {
        return fileHash;
    }

    public Integer getWidth() {
        return width;
    }

    public Integer getHeight() {
        return height;
    }

    public String getFormat() {
        return format;
    }

    public String getCameraId() {
        return cameraId;
    }

    public Location getLocation() {
        return location;
    }

    public void setLocation(Location location) {
        this.location = location;
    }

    public LocalDateTime getCapturedAt() {
        return capturedAt;
    }

    public Instant getUploadedAt() {
        return uploadedAt;
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public String getProjectName() {
        return projectName;
    }

    public String getClient() {
        return client;
    }

    public String getCountry() {
        return country;
    }

    public Map<String, String> getExifData() {
        return exifData;
    }

    public Double getGpsLatitude() {
        return gpsLatitude;
    }

    public Double getGpsLongitude() {
        return gpsLongitude;
    }

    public Double getGpsAltitude() {
        return gpsAltitude;
    }

    public String getCameraMake() {
        return cameraMake;
    }

    public String getCameraModel() {
        return cameraModel;
    }

    public ProcessingStatus getProcessingStatus() {
        return processingStatus;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public String getClaimToken() {
        return claimToken;
    }

    public Instant getClaimedAt() {
        return claimedAt;
    }

    public boolean isHasDetections() {
        return hasDetections;
    }

    public int getDetectionCount() {
        return detectionCount;
    }

    public Double getBrightnessScore() {
        return brightnessScore;
    }

    public Double getSharpnessScore() {
        return sharpnessScore;
    }

    public Double getQualityScore() {
        return qualityScore;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
