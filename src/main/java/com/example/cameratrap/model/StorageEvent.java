package com.example.cameratrap.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

@Schema(description = "Location of a newly written image object")
public record StorageEvent(
        @NotBlank @Schema(description = "Bucket holding the object", example = "camera-trap-uploads") String bucket,
        @NotBlank @Schema(description = "Object key", example = "serengeti/tz/wcs/CAM-017/2024-05-01/IMG_0042.JPG") String key) {
}
