package com.example.cameratrap.service.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Used when no external tracking table is configured.
 */
public class LoggingTrackingStore implements TrackingStore {

    private static final Logger log = LoggerFactory.getLogger(LoggingTrackingStore.class);

    @Override
    public void setStatus(String key, TrackingStatus status, Map<String, String> detail) {
        log.info("Tracking status for {}: {} {}", key, status, detail);
    }
}
