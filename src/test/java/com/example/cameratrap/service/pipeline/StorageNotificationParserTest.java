package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.model.StorageEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StorageNotificationParserTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final StorageNotificationParser parser = new StorageNotificationParser();

    @Test
    void decodesEveryRecord() throws Exception {
        List<StorageEvent> events = parser.parse(mapper.readTree("""
                {"Records":[
                  {"s3":{"bucket":{"name":"traps"},"object":{"key":"serengeti/tz/wcs/CAM-1/2024-05-01/IMG+0001.JPG"}}},
                  {"s3":{"bucket":{"name":"traps"},"object":{"key":"serengeti/tz/wcs/CAM%202/2024-05-01/b.jpg"}}}
                ]}
                """));

        assertThat(events).containsExactly(
                new StorageEvent("traps", "serengeti/tz/wcs/CAM-1/2024-05-01/IMG 0001.JPG"),
                new StorageEvent("traps", "serengeti/tz/wcs/CAM 2/2024-05-01/b.jpg"));
    }

    @Test
    void emptyRecordsYieldNoEvents() throws Exception {
        assertThat(parser.parse(mapper.readTree("{\"Records\":[]}"))).isEmpty();
    }

    @Test
    void rejectsNotificationWithoutRecords() throws Exception {
        assertThatThrownBy(() -> parser.parse(mapper.readTree("{\"bucket\":\"traps\"}")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void rejectsRecordWithoutKey() throws Exception {
        assertThatThrownBy(() -> parser.parse(mapper.readTree(
                "{\"Records\":[{\"s3\":{\"bucket\":{\"name\":\"traps\"},\"object\":{}}}]}")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("key");
    }
}
