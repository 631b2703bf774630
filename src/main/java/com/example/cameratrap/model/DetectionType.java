package com.example.cameratrap.model;

import java.util.Arrays;
import java.util.Locale;

public enum DetectionType {

    ANIMAL("animal", 1),
    PERSON("person", 2),
    VEHICLE("vehicle", 3);

    private final String label;
    private final int categoryId;

    DetectionType(String label, int categoryId) {
        this.label = label;
        this.categoryId = categoryId;
    }

    public String label() {
        return label;
    }

    public int categoryId() {
        return categoryId;
    }

    public boolean isClassifiable() {
        return this == ANIMAL;
    }

    public static DetectionType fromLabel(String label) {
        if (label == null) {
            throw new IllegalArgumentException("Detection class label is required");
        }
        String normalized = label.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(type -> type.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown detection class: " + label));
    }

    /**
     * Maps the detector's one-based category identifiers (1 animal, 2 person, 3 vehicle).
     */
    public static DetectionType fromCategoryId(int categoryId) {
        return Arrays.stream(values())
                .filter(type -> type.categoryId == categoryId)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown detection category: " + categoryId));
    }
}
