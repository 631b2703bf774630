package com.example.cameratrap.service.classification;

import com.example.cameratrap.config.PipelineProperties;
import com.example.cameratrap.exception.InferenceRejectedException;
import com.example.cameratrap.exception.PipelineException;
import com.example.cameratrap.model.SpeciesCandidate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;

/**
 * Wraps the configured {@link SpeciesClassifier}. Results are sorted by confidence, filtered by
 * the classification threshold and capped at five entries.
 */
@Service
public class ClassificationServiceAdapter {

    private static final Logger log = LoggerFactory.getLogger(ClassificationServiceAdapter.class);

    static final int MAX_CANDIDATES = 5;

    private final SpeciesClassifier classifier;
    private final int topK;

    public ClassificationServiceAdapter(SpeciesClassifier classifier, PipelineProperties properties) {
        this.classifier = classifier;
        this.topK = Math.min(properties.classification().topK(), MAX_CANDIDATES);
    }

    public List<SpeciesCandidate> classify(byte[] crop, double threshold) {
        if (crop == null || crop.length == 0) {
            throw new InferenceRejectedException("Crop payload is empty");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("Classification threshold must be within [0, 1] but was " + threshold);
        }
        List<SpeciesCandidate> raw;
        try {
            raw = classifier.classify(crop, topK);
        } catch (PipelineException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new InferenceRejectedException("Classifier failed: " + ex.getMessage(), ex);
        }
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<SpeciesCandidate> ranked = raw.stream()
                .filter(candidate -> candidate.confidence() >= threshold)
                .sorted(Comparator.comparingDouble(SpeciesCandidate::confidence).reversed())
                .limit(topK)
                .toList();
        log.debug("Classifier returned {} predictions, kept {}", raw.size(), ranked.size());
        return ranked;
    }
}
