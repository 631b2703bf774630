package com.example.cameratrap.service.tracking;

public enum TrackingStatus {
    PROCESSING,
    DETECTION_COMPLETE,
    DETECTION_FAILED
}
