package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.model.DetectionCandidate;
import com.example.cameratrap.model.SpeciesCandidate;

import java.util.List;

/**
 * A detection ready to be written. {@code speciesId} and {@code classifierConfidence} are set
 * together, and only for classified animals.
 */
public record DetectionDraft(
        DetectionCandidate candidate,
        Long speciesId,
        Double classifierConfidence,
        List<SpeciesCandidate> topCandidates,
        boolean needsReview) {

    public DetectionDraft {
        if ((speciesId == null) != (classifierConfidence == null)) {
            throw new IllegalArgumentException("Species id and classifier confidence must be set together");
        }
        if (speciesId != null && !candidate.type().isClassifiable()) {
            throw new IllegalArgumentException("Only animal detections can carry a species");
        }
        topCandidates = topCandidates == null ? List.of() : List.copyOf(topCandidates);
    }

    public static DetectionDraft unclassified(DetectionCandidate candidate, boolean needsReview) {
        return new DetectionDraft(candidate, null, null, List.of(), needsReview);
    }

    public boolean isClassified() {
        return speciesId != null;
    }
}
