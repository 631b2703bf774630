package com.example.cameratrap.service.pipeline;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs one pipeline stage under a named retry policy. Every attempt first checks the invocation
 * deadline, so an expired budget ends the retries with an
 * {@link com.example.cameratrap.exception.InvocationTimeoutException}.
 */
@Component
public class InferenceRetryExecutor {

    public static final String INFERENCE = "inference";
    public static final String PERSISTENCE = "persistence";

    private final RetryRegistry registry;

    public InferenceRetryExecutor(RetryRegistry registry) {
        this.registry = registry;
    }

    public <T> T call(String policy, String stage, InvocationDeadline deadline, Supplier<T> action) {
        Retry retry = registry.retry(stage, policy);
        Supplier<T> guarded = () -> {
            deadline.check(stage);
            return action.get();
        };
        return Retry.decorateSupplier(retry, guarded).get();
    }

    public void run(String policy, String stage, InvocationDeadline deadline, Runnable action) {
        call(policy, stage, deadline, () -> {
            action.run();
            return null;
        });
    }
}
