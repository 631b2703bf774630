package com.example.cameratrap.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Species prediction for one animal detection")
public record SpeciesCandidate(
        @JsonProperty("scientific_name")
        @Schema(description = "Scientific name resolvable against the species catalog", example = "Ursus arctos")
        String scientificName,
        @JsonProperty("common_name")
        @Schema(description = "Common name reported by the classifier", example = "Brown Bear")
        String commonName,
        @Schema(description = "Classifier confidence", example = "0.87")
        double confidence) {

    public SpeciesCandidate {
        if (scientificName == null || scientificName.isBlank()) {
            throw new IllegalArgumentException("Species candidate requires a scientific name");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Species confidence must be within [0, 1] but was " + confidence);
        }
        scientificName = scientificName.trim();
    }
}
