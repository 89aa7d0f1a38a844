package com.acme.receiver.core;

import com.acme.receiver.spi.DeadLetterPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Base64;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Drives one message from delivery to a terminal state.
 * <p>
 * {@link #process(byte[])} runs on the partition's thread and only returns once the message is
 * acknowledged, dead-lettered or lost. Blocking that thread is what keeps a partition strictly
 * sequential and what pushes backpressure onto the transport.
 */
public class RetryStateMachine {
    private static final Logger LOG = LoggerFactory.getLogger(RetryStateMachine.class);

    private final BlockingQueue<WorkItem> outbound;
    private final DeadLetterPublisher deadLetters;
    private final String deadLetterTopic;
    private final int maxAttempts;
    private final BackoffPolicy backoff;

    public RetryStateMachine(BlockingQueue<WorkItem> outbound, DeadLetterPublisher deadLetters,
                             String deadLetterTopic, int maxAttempts, BackoffPolicy backoff) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must not be negative: " + maxAttempts);
        }
        this.outbound = outbound;
        this.deadLetters = deadLetters;
        this.deadLetterTopic = deadLetterTopic;
        this.maxAttempts = maxAttempts;
        this.backoff = backoff;
    }

    public TerminalState process(byte[] payload) {
        RetryContext ctx = new RetryContext(maxAttempts);
        try {
            while (true) {
                WorkItem item = new WorkItem(payload, ctx.attemptCount());
                outbound.put(item);

                if (awaitOutcome(item) == Outcome.ACK) {
                    LOG.debug("Message acknowledged on attempt {}", ctx.attemptCount());
                    return TerminalState.SUCCEEDED;
                }
                if (ctx.exhausted()) {
                    return deadLetter(payload, ctx.attemptCount());
                }

                Duration delay = backoff.delay(ctx.attemptCount());
                LOG.debug("Waiting {} before retry {}", delay, ctx.attemptCount());
                sleep(delay);
                ctx.next();
                LOG.info("Retry {} of {}", ctx.attemptCount(), maxAttempts);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted on attempt {}; message left for redelivery", ctx.attemptCount());
            return TerminalState.ABANDONED;
        }
    }

    private Outcome awaitOutcome(WorkItem item) throws InterruptedException {
        try {
            return item.outcome().get();
        } catch (ExecutionException e) {
            // the future is only ever completed normally
            throw new IllegalStateException("Outcome future failed", e.getCause());
        }
    }

    private TerminalState deadLetter(byte[] payload, int attempts) {
        LOG.warn("Retries exhausted after {} attempts, copying message to {}", attempts + 1, deadLetterTopic);
        try {
            deadLetters.publish(deadLetterTopic, payload);
        } catch (RuntimeException e) {
            LOG.error("Dead-letter publish to {} failed, message lost. payload(base64)={}",
                deadLetterTopic, Base64.getEncoder().encodeToString(payload), e);
            return TerminalState.LOST;
        }
        LOG.info("Message reported to {}", deadLetterTopic);
        return TerminalState.DEAD_LETTERED;
    }

    private static void sleep(Duration delay) throws InterruptedException {
        if (!delay.isZero() && !delay.isNegative()) {
            TimeUnit.NANOSECONDS.sleep(delay.toNanos());
        }
    }
}
