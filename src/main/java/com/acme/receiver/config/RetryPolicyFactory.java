package com.acme.receiver.config;

import com.acme.receiver.core.BackoffPolicy;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;

@Factory
public class RetryPolicyFactory {

    @Singleton
    public BackoffPolicy backoffPolicy(RetryConfig config) {
        return BackoffPolicy.exponential(config.getBackoffBase());
    }
}
