package com.example.cameratrap.model;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Metadata derived from the raw image bytes. EXIF-backed fields are {@code null} when the image
 * carries no EXIF block; dimensions, format and quality scores are always present.
 */
public record ImageMetadata(
        int width,
        int height,
        String format,
        LocalDateTime capturedAt,
        Double gpsLatitude,
        Double gpsLongitude,
        Double gpsAltitude,
        String cameraMake,
        String cameraModel,
        Map<String, String> exif,
        double brightness,
        double sharpness,
        double quality) {

    public ImageMetadata {
        exif = exif == null ? Map.of() : Map.copyOf(exif);
    }

    public boolean hasGps() {
        return gpsLatitude != null && gpsLongitude != null;
    }
}
