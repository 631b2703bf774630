package com.example.cameratrap.service.tracking;

import java.util.Map;

/**
 * Process-wide status board keyed by storage key. Writes are best effort and live outside the
 * database transaction.
 */
public interface TrackingStore {

    void setStatus(String key, TrackingStatus status, Map<String, String> detail);
}
