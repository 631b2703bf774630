package com.example.cameratrap.model;

import java.util.Arrays;

public enum ProcessingStatus {

    PENDING("pending"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String dbValue;

    ProcessingStatus(String dbValue) {
        this.dbValue = dbValue;
    }

    public String dbValue() {
        return dbValue;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public static ProcessingStatus fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(status -> status.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown processing status: " + value));
    }
}
