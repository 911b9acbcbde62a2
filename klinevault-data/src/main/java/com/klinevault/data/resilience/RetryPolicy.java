package com.klinevault.data.resilience;

import java.time.Duration;
import java.util.Random;

/**
 * Bounded exponential backoff with jitter.
 *
 * @param maxAttempts total attempts including the first call
 * @param baseDelay   delay before the first retry
 * @param maxDelay    cap applied before jitter
 * @param jitter      relative spread, 0.2 means +/-20%
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 0.2);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 0);
    }

    /**
     * Delay before retry number {@code attempt + 1}: min(base * 2^attempt, maxDelay) +/- jitter.
     */
    public Duration delayFor(int attempt, Random random) {
        long base = baseDelay.toMillis();
        long exponential = base << Math.min(attempt, 30);
        if (exponential < base) {
            exponential = Long.MAX_VALUE;
        }
        long capped = Math.min(exponential, maxDelay.toMillis());
        double factor = jitter == 0 ? 1.0 : 1.0 - jitter + random.nextDouble() * 2 * jitter;
        return Duration.ofMillis(Math.round(capped * factor));
    }
}
