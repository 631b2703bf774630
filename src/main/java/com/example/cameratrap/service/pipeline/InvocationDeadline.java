package com.example.cameratrap.service.pipeline;

import com.example.cameratrap.exception.InvocationTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock budget of one pipeline invocation. Stages call {@link #check(String)} before doing
 * work, so retries stop once the budget is spent.
 */
public final class InvocationDeadline {

    private final Clock clock;
    private final Duration timeout;
    private final Instant expiresAt;

    private InvocationDeadline(Clock clock, Duration timeout) {
        this.clock = clock;
        this.timeout = timeout;
        this.expiresAt = clock.instant().plus(timeout);
    }

    public static InvocationDeadline after(Duration timeout, Clock clock) {
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Invocation timeout must be positive");
        }
        return new InvocationDeadline(clock, timeout);
    }

    public void check(String stage) {
        if (isExpired()) {
            throw new InvocationTimeoutException("Invocation exceeded " + timeout + " before " + stage);
        }
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(expiresAt);
    }

    public Duration remaining() {
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }
}
