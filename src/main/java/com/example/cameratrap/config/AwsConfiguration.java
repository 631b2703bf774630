package com.example.cameratrap.config;

import com.example.cameratrap.service.tracking.DynamoDbTrackingStore;
import com.example.cameratrap.service.tracking.LoggingTrackingStore;
import com.example.cameratrap.service.tracking.TrackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.enhanced.dynamodb.DynamoDbEnhancedClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

import java.time.Clock;

/**
 * AWS clients use the default credential chain. The tracking table is only contacted when
 * {@code camera-trap.tracking.enabled} is set.
 */
@Configuration
public class AwsConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AwsConfiguration.class);

    @Bean
    public S3Client s3Client(PipelineProperties properties) {
        return S3Client.builder()
                .region(Region.of(properties.storage().region()))
                .build();
    }

    @Bean
    public TrackingStore trackingStore(PipelineProperties properties, Clock clock) {
        PipelineProperties.TrackingProperties tracking = properties.tracking();
        if (!tracking.enabled()) {
            log.info("Tracking table disabled; status updates are logged only");
            return new LoggingTrackingStore();
        }
        DynamoDbClient dynamoDb = DynamoDbClient.builder()
                .region(Region.of(properties.storage().region()))
                .build();
        DynamoDbEnhancedClient enhanced = DynamoDbEnhancedClient.builder()
                .dynamoDbClient(dynamoDb)
                .build();
        log.info("Publishing tracking status to DynamoDB table {}", tracking.tableName());
        return new DynamoDbTrackingStore(enhanced, tracking.tableName(), clock);
    }
}
