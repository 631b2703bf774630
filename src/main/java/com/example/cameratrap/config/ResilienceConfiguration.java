package com.example.cameratrap.config;

import com.example.cameratrap.exception.PipelineException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Retry policies shared by the pipeline:
 * <ul>
 *     <li>{@code inference}: object storage and model calls, retryable {@link PipelineException}s only</li>
 *     <li>{@code persistence}: transient database failures such as lock conflicts</li>
 *     <li>{@code tracking}: any failure of the tracking store</li>
 * </ul>
 */
@Configuration
public class ResilienceConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ResilienceConfiguration.class);

    @Bean
    public RetryRegistry retryRegistry(PipelineProperties properties) {
        PipelineProperties.InvocationProperties pipeline = properties.pipeline();
        IntervalFunction backoff = IntervalFunction.ofExponentialBackoff(pipeline.initialBackoff(), pipeline.backoffMultiplier());

        RetryConfig inference = RetryConfig.custom()
                .maxAttempts(pipeline.maxAttempts())
                .intervalFunction(backoff)
                .retryOnException(ex -> ex instanceof PipelineException pipelineException && pipelineException.isRetryable())
                .build();

        RetryConfig persistence = RetryConfig.custom()
                .maxAttempts(pipeline.maxAttempts())
                .intervalFunction(backoff)
                .retryOnException(ex -> ex instanceof TransientDataAccessException
                        || ex instanceof CannotCreateTransactionException)
                .build();

        PipelineProperties.TrackingProperties tracking = properties.tracking();
        RetryConfig trackingConfig = RetryConfig.custom()
                .maxAttempts(tracking.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(tracking.backoff(), 2.0))
                .retryOnException(ex -> true)
                .build();

        RetryRegistry registry = RetryRegistry.of(inference);
        registry.addConfiguration("inference", inference);
        registry.addConfiguration("persistence", persistence);
        registry.addConfiguration("tracking", trackingConfig);
        registry.getEventPublisher().onEntryAdded(event -> event.getAddedEntry().getEventPublisher()
                .onRetry(retryEvent -> log.warn("Retry '{}' attempt {} after {}", retryEvent.getName(),
                        retryEvent.getNumberOfRetryAttempts(), String.valueOf(retryEvent.getLastThrowable()))));
        log.info("Configured retries: {} attempts starting at {} (x{})", pipeline.maxAttempts(),
                pipeline.initialBackoff(), pipeline.backoffMultiplier());
        return registry;
    }
}
