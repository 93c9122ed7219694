package com.openrangelabs.donpetre.mobility.model;

import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties;
import com.openrangelabs.donpetre.mobility.config.MobilitySyncProperties.BackoffStrategy;

import java.time.Duration;

/**
 * Attempt budget and backoff for a chunk
 */
public record RetryPolicy(int maxAttempts, BackoffStrategy strategy, Duration initialBackoff, Duration maxBackoff) {

    public static RetryPolicy from(MobilitySyncProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getStrategy(),
                retry.getInitialBackoff(), retry.getMaxBackoff());
    }

    public static RetryPolicy noBackoff(int maxAttempts) {
        return new RetryPolicy(maxAttempts, BackoffStrategy.LINEAR, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Delay before the given attempt. Attempt 1 never waits.
     */
    public Duration backoffBefore(int attempt) {
        if (attempt <= 1 || initialBackoff.isZero()) {
            return Duration.ZERO;
        }
        int step = attempt - 1;
        Duration delay = strategy == BackoffStrategy.LINEAR
                ? initialBackoff.multipliedBy(step)
                : initialBackoff.multipliedBy(1L << Math.min(step - 1, 20));
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }

    public boolean hasAttemptsAfter(int attempt) {
        return attempt < maxAttempts;
    }
}
