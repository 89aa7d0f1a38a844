package com.acme.receiver.core;

/**
 * Retry bookkeeping for one message; lives for a single transport callback.
 */
final class RetryContext {
    private final int maxAttempts;
    private int attemptCount;

    RetryContext(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    int attemptCount() {
        return attemptCount;
    }

    boolean exhausted() {
        return attemptCount >= maxAttempts;
    }

    void next() {
        attemptCount++;
    }
}
