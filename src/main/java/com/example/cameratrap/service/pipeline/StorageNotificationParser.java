package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.model.StorageEvent;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads S3 event notifications ({@code Records[].s3.bucket.name} and the URL-encoded
 * {@code Records[].s3.object.key}).
 */
@Component
public class StorageNotificationParser {

    public List<StorageEvent> parse(JsonNode notification) {
        if (notification == null || !notification.path("Records").isArray()) {
            throw new IllegalArgumentException("Notification has no Records array");
        }
        List<StorageEvent> events = new ArrayList<>();
        for (JsonNode record : notification.path("Records")) {
            JsonNode s3 = record.path("s3");
            String bucket = s3.path("bucket").path("name").asText(null);
            String rawKey = s3.path("object").path("key").asText(null);
            if (bucket == null || bucket.isBlank() || rawKey == null || rawKey.isBlank()) {
                throw new IllegalArgumentException("Notification record is missing bucket or key");
            }
            events.add(new StorageEvent(bucket, URLDecoder.decode(rawKey, StandardCharsets.UTF_8)));
        }
        return events;
    }
}
