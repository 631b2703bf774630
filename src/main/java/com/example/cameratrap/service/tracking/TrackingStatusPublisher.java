package com.example.cameratrap.service.tracking;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Sends status updates to the {@link TrackingStore} off the caller's thread, retrying on its own
 * schedule. Failures end in the log; they never reach the pipeline.
 */
@Component
public class TrackingStatusPublisher {

    private static final Logger log = LoggerFactory.getLogger(TrackingStatusPublisher.class);

    private final TrackingStore store;
    private final Retry retry;
    private final TaskExecutor executor;

    public TrackingStatusPublisher(TrackingStore store,
                                   RetryRegistry retryRegistry,
                                   @Qualifier("trackingExecutor") TaskExecutor executor) {
        this.store = store;
        this.retry = retryRegistry.retry("tracking", "tracking");
        this.executor = executor;
    }

    public CompletableFuture<Void> publish(String key, TrackingStatus status, Map<String, String> detail) {
        Runnable update = Retry.decorateRunnable(retry, () -> store.setStatus(key, status, detail));
        return CompletableFuture.runAsync(update, executor)
                .exceptionally(ex -> {
                    log.error("Giving up on tracking status {} for {}", status, key, ex);
                    return null;
                });
    }
}
