package com.example.cameratrap.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "camera-trap")
public record PipelineProperties(
        @DefaultValue DetectionProperties detection,
        @DefaultValue ClassificationProperties classification,
        InvocationProperties pipeline,
        @DefaultValue TrackingProperties tracking,
        @DefaultValue StorageProperties storage,
        @DefaultValue StatisticsProperties statistics,
        @DefaultValue CatalogProperties catalog) {

    public PipelineProperties {
        if (pipeline == null) {
            throw new IllegalStateException("camera-trap.pipeline settings must be configured");
        }
    }

    public record DetectionProperties(
            @DefaultValue("0.6") double threshold,
            @DefaultValue("0.8") double reviewThreshold,
            @DefaultValue("none") String backend,
            String modelPath,
            @DefaultValue("640") int inputSize,
            @DefaultValue("0.45") double nmsThreshold,
            String endpoint) {

        public DetectionProperties {
            requireUnitInterval("camera-trap.detection.threshold", threshold);
            requireUnitInterval("camera-trap.detection.review-threshold", reviewThreshold);
        }
    }

    public record ClassificationProperties(
            @DefaultValue("0.5") double threshold,
            @DefaultValue("5") int topK,
            @DefaultValue("none") String backend,
            String modelPath,
            String labelsPath,
            @DefaultValue("224") int inputSize,
            @DefaultValue("0.1") double cropPadding,
            String endpoint) {

        public ClassificationProperties {
            requireUnitInterval("camera-trap.classification.threshold", threshold);
            if (topK < 1 || topK > 5) {
                throw new IllegalStateException("camera-trap.classification.top-k must be between 1 and 5");
            }
        }
    }

    /**
     * Per-invocation limits. The timeout has no default and must be supplied by the deployment.
     */
    public record InvocationProperties(
            Duration invocationTimeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration initialBackoff,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("4") int workerThreads,
            Duration claimLease) {

        public InvocationProperties {
            if (invocationTimeout == null || invocationTimeout.isZero() || invocationTimeout.isNegative()) {
                throw new IllegalStateException("camera-trap.pipeline.invocation-timeout must be a positive duration");
            }
            if (maxAttempts < 1) {
                throw new IllegalStateException("camera-trap.pipeline.max-attempts must be at least 1");
            }
            if (claimLease == null) {
                claimLease = invocationTimeout;
            }
        }
    }

    public record TrackingProperties(
            @DefaultValue("false") boolean enabled,
            @DefaultValue("sensor-tracking") String tableName,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration backoff) {
    }

    public record StorageProperties(
            @DefaultValue("us-east-1") String region) {
    }

    public record StatisticsProperties(
            @DefaultValue("15m") Duration refreshInterval) {
    }

    public record CatalogProperties(
            @DefaultValue("false") boolean seedEnabled,
            @DefaultValue("classpath:catalog/species.json") String seedResource) {
    }

    private static void requireUnitInterval(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalStateException(name + " must be within [0, 1]");
        }
    }
}
