package com.example.cameratrap.service.detection;

import com.example.cameratrap.model.DetectionCandidate;

import java.util.List;

/**
 * Finds animals, people and vehicles in an image. Implementations can run a local model, call a
 * remote inference service or return fixtures; the active one is chosen through Spring
 * configuration.
 */
public interface AnimalDetector {

    /**
     * @param image encoded image bytes
     * @return candidates with normalised boxes in the order the backend produced them. The list
     * can be empty.
     * @throws com.example.cameratrap.exception.InferenceUnavailableException when the backend cannot
     *                                                                        be reached
     * @throws com.example.cameratrap.exception.InferenceRejectedException    when the backend refuses
     *                                                                        the input
     */
    List<DetectionCandidate> detect(byte[] image);
}
