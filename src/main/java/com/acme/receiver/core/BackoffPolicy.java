package com.acme.receiver.core;

import java.time.Duration;

/**
 * Maps a retry attempt (0 for the first retry) to the wait before the payload is redelivered.
 * Implementations must be pure and non-decreasing in {@code attempt}.
 */
@FunctionalInterface
public interface BackoffPolicy {

    Duration DEFAULT_BASE = Duration.ofSeconds(1);

    Duration delay(int attempt);

    /**
     * {@code base * 2^attempt}, saturating at {@code Long.MAX_VALUE} milliseconds.
     */
    static BackoffPolicy exponential(Duration base) {
        long baseMillis = base.toMillis();
        if (baseMillis <= 0) {
            throw new IllegalArgumentException("Backoff base must be positive: " + base);
        }
        return attempt -> {
            if (attempt < 0) {
                throw new IllegalArgumentException("Negative attempt " + attempt);
            }
            if (attempt >= Long.numberOfLeadingZeros(baseMillis)) {
                return Duration.ofMillis(Long.MAX_VALUE);
            }
            return Duration.ofMillis(baseMillis << attempt);
        };
    }

    static BackoffPolicy exponential() {
        return exponential(DEFAULT_BASE);
    }

    static BackoffPolicy constant(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("Negative backoff " + delay);
        }
        return attempt -> delay;
    }

    static BackoffPolicy none() {
        return constant(Duration.ZERO);
    }
}
