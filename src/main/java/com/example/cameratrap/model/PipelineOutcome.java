package com.example.cameratrap.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Result of one pipeline invocation")
public record PipelineOutcome(
        @Schema(description = "Storage key of the processed image") String storageKey,
        @Schema(description = "Database id of the image row, when one exists") Long imageId,
        @Schema(description = "How the invocation ended") Result result,
        @Schema(description = "Number of persisted detections") int detectionCount,
        @Schema(description = "Failure reason for failed or abandoned invocations") String errorMessage) {

    public enum Result {
        /** Image and detections committed. */
        COMPLETED,
        /** Image marked failed with an error message. */
        FAILED,
        /** Already terminal, or owned by another worker. */
        SKIPPED,
        /** Could not record the failure; the row stays in processing until its lease expires. */
        ABANDONED
    }

    public static PipelineOutcome completed(String storageKey, Long imageId, int detectionCount) {
        return new PipelineOutcome(storageKey, imageId, Result.COMPLETED, detectionCount, null);
    }

    public static PipelineOutcome failed(String storageKey, Long imageId, String errorMessage) {
        return new PipelineOutcome(storageKey, imageId, Result.FAILED, 0, errorMessage);
    }

    public static PipelineOutcome skipped(String storageKey, Long imageId) {
        return new PipelineOutcome(storageKey, imageId, Result.SKIPPED, 0, null);
    }

    public static PipelineOutcome abandoned(String storageKey, Long imageId, String errorMessage) {
        return new PipelineOutcome(storageKey, imageId, Result.ABANDONED, 0, errorMessage);
    }
}
