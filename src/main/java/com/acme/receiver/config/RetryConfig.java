package com.acme.receiver.config;

import io.micronaut.context.annotation.ConfigurationProperties;
import java.time.Duration;

/**
 * Retry bound, backoff and dead-letter settings.
 */
@ConfigurationProperties("retry")
public class RetryConfig {

    private int maxAttempts = 3;
    private Duration backoffBase = Duration.ofSeconds(1);
    private Duration publishTimeout = Duration.ofSeconds(30);

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getBackoffBase() {
        return backoffBase;
    }

    public void setBackoffBase(Duration backoffBase) {
        this.backoffBase = backoffBase;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
        this.publishTimeout = publishTimeout;
    }

    public long getPublishTimeoutMillis() {
        return publishTimeout.toMillis();
    }
}
