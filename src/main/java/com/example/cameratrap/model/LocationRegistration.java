package com.example.cameratrap.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

@Schema(description = "Camera deployment keyed by camera identifier")
public record LocationRegistration(
        @NotBlank @Schema(description = "Camera identifier (natural key)", example = "CAM-017") String cameraId,
        @Schema(description = "Human readable site name", example = "Seronera river crossing") String locationName,
        @NotNull @Schema(description = "Latitude in decimal degrees", example = "-2.4531") Double latitude,
        @NotNull @Schema(description = "Longitude in decimal degrees", example = "34.8220") Double longitude,
        @Schema(description = "Altitude in metres", example = "1520") Double altitude,
        @Schema(description = "Country", example = "Tanzania") String country,
        @Schema(description = "State or province") String stateProvince,
        @Schema(description = "Protected area name") String protectedArea,
        @Schema(description = "Habitat type", example = "grassland") String habitatType,
        @Schema(description = "Vegetation type") String vegetationType,
        @Schema(description = "Installation date") LocalDate installationDate,
        @Schema(description = "Whether the camera is currently deployed") Boolean active,
        @Schema(description = "Free text notes") String notes) {
}
