package com.acme.receiver.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * One delivery attempt of a message, handed to the consumer.
 * <p>
 * The consumer reads {@link #payload()} and calls exactly one of {@link #acknowledge()} or
 * {@link #reject()}. Every retry produces a new item with its own completion future, so a late
 * signal on an earlier attempt has no effect on the current one.
 */
public final class WorkItem {
    private static final Logger LOG = LoggerFactory.getLogger(WorkItem.class);

    private final byte[] payload;
    private final int attempt;
    private final CompletableFuture<Outcome> outcome = new CompletableFuture<>();

    WorkItem(byte[] payload, int attempt) {
        this.payload = payload.clone();
        this.attempt = attempt;
    }

    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Zero for the first delivery, incremented on every redelivery.
     */
    public int attempt() {
        return attempt;
    }

    /**
     * @return false if an outcome was already reported for this attempt
     */
    public boolean acknowledge() {
        return complete(Outcome.ACK);
    }

    /**
     * @return false if an outcome was already reported for this attempt
     */
    public boolean reject() {
        return complete(Outcome.NACK);
    }

    public boolean isCompleted() {
        return outcome.isDone();
    }

    CompletableFuture<Outcome> outcome() {
        return outcome;
    }

    private boolean complete(Outcome value) {
        boolean first = outcome.complete(value);
        if (!first) {
            LOG.warn("Ignoring {} on attempt {}: outcome {} already reported", value, attempt, outcome.getNow(null));
        }
        return first;
    }
}
