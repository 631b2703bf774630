package com.example.cameratrap.service.classification;

import com.example.cameratrap.model.SpeciesCandidate;

import java.util.List;

/**
 * Predicts the species shown in a cropped animal region.
 */
public interface SpeciesClassifier {

    /**
     * @param crop encoded image of a single animal
     * @param topK maximum number of predictions to return
     * @return predictions ranked by the backend, possibly unsorted or below any threshold
     */
    List<SpeciesCandidate> classify(byte[] crop, int topK);
}
