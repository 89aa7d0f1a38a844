package com.acme.receiver.receiver;

import com.acme.receiver.spi.TransportSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Token for one connected receiver. Returned by {@link QueueReceiver#connect} and required to stop it.
 */
public final class ReceiverHandle {
    private static final Logger LOG = LoggerFactory.getLogger(ReceiverHandle.class);

    private final String topic;
    private final TransportSession session;
    private final CompletableFuture<Void> termination;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    ReceiverHandle(String topic, TransportSession session, CompletableFuture<Void> termination) {
        this.topic = topic;
        this.session = session;
        this.termination = termination;
    }

    public String topic() {
        return topic;
    }

    /**
     * Signals the run loop to stop. Returns without waiting; see {@link #awaitTermination(Duration)}.
     */
    public void shutdown() {
        if (shutdown.compareAndSet(false, true)) {
            LOG.info("Shutting down receiver for {}", topic);
        }
        session.cancel();
    }

    public boolean isRunning() {
        return !termination.isDone();
    }

    /**
     * Completes when the run loop exits, exceptionally if it failed.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    /**
     * @return true if the run loop stopped within {@code timeout}
     */
    public boolean awaitTermination(Duration timeout) throws InterruptedException {
        try {
            termination.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            LOG.warn("Receiver for {} terminated with error", topic, e.getCause());
            return true;
        }
    }
}
