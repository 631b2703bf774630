package com.example.cameratrap.service.classification;

import com.example.cameratrap.model.SpeciesCandidate;

import java.util.List;

public class NoOpSpeciesClassifier implements SpeciesClassifier {

    @Override
    public List<SpeciesCandidate> classify(byte[] crop, int topK) {
        return List.of();
    }
}
