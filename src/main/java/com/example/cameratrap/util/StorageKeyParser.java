package com.example.cameratrap.util;

/**
 * Splits storage keys laid out as {@code project/country/client/camera-id/date/file}. Only the
 * directory segments feed the named fields, so a short key never reports its file name as a
 * camera identifier.
 */
public final class StorageKeyParser {

    private StorageKeyParser() {
    }

    public static StoragePath parse(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Storage key must not be blank");
        }
        String[] parts = key.split("/");
        int directories = parts.length - 1;
        return new StoragePath(
                segment(parts, 0, directories),
                segment(parts, 1, directories),
                segment(parts, 2, directories),
                segment(parts, 3, directories),
                segment(parts, 4, directories),
                parts[parts.length - 1]);
    }

    private static String segment(String[] parts, int index, int directories) {
        if (index >= directories) {
            return null;
        }
        String value = parts[index].trim();
        return value.isEmpty() ? null : value;
    }

    public record StoragePath(
            String projectName,
            String country,
            String client,
            String cameraId,
            String date,
            String fileName) {
    }
}
