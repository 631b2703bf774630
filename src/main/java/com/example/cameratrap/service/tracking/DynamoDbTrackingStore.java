package com.example.cameratrap.service.tracking;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbTable;
import software.amazon.awssdk.enhanced.dynamodb.TableSchema;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Writes the latest status of each storage key into a DynamoDB table, replacing the previous
 * item.
 */
public class DynamoDbTrackingStore implements TrackingStore {

    private static final Logger log = LoggerFactory.getLogger(DynamoDbTrackingStore.class);

    private final DynamoDbTable<TrackingRecord> table;
    private final Clock clock;

    public DynamoDbTrackingStore(DynamoDbEnhancedClient client, String tableName, Clock clock) {
        this.table = client.table(tableName, TableSchema.fromBean(TrackingRecord.class));
        this.clock = clock;
    }

    @Override
    public void setStatus(String key, TrackingStatus status, Map<String, String> detail) {
        TrackingRecord record = new TrackingRecord();
        record.setFileKey(key);
        record.setProcessingStatus(status.name());
        record.setUpdatedAt(Instant.now(clock).toString());
        record.setDetail(detail == null || detail.isEmpty() ? null : new HashMap<>(detail));
        table.putItem(record);
        log.debug("Updated tracking status for {}: {}", key, status);
    }
}
