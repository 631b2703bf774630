package com.example.cameratrap.model;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;

import java.math.BigDecimal;

@Schema(description = "Species catalog entry keyed by scientific name")
public record SpeciesDefinition(
        @NotBlank @Schema(description = "Scientific name (natural key)", example = "Panthera leo") String scientificName,
        @Schema(description = "Common name", example = "Lion") String commonName,
        @Schema(description = "Taxonomic ranks") Taxonomy taxonomy,
        @Schema(description = "IUCN conservation status", example = "VU") ConservationStatus conservationStatus,
        @Schema(description = "IUCN identifier") String iucnId,
        @Schema(description = "Free text description") String description,
        @Schema(description = "Habitat notes") String habitatNotes,
        @Schema(description = "Behaviour notes") String behaviorNotes,
        @Schema(description = "Average adult weight in kilograms", example = "190.00") BigDecimal averageWeightKg,
        @Schema(description = "Average adult length in centimetres", example = "250.00") BigDecimal averageLengthCm,
        @Schema(description = "Thumbnail image URL") String thumbnailUrl) {

    public record Taxonomy(
            String kingdom,
            String phylum,
            String taxonomicClass,
            String order,
            String family,
            String genus) {
    }
}
