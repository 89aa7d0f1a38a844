package com.acme.receiver.receiver;

import com.acme.receiver.config.ReceiverConfig;
import com.acme.receiver.config.RetryConfig;
import com.acme.receiver.core.BackoffPolicy;
import com.acme.receiver.core.ReceiverConnectException;
import com.acme.receiver.core.RetryStateMachine;
import com.acme.receiver.core.WorkItem;
import com.acme.receiver.spi.DeadLetterPublisher;
import com.acme.receiver.spi.PartitionedTransport;
import com.acme.receiver.spi.TransportSession;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Pulls the configured topic through the retry state machine and onto the caller's queue.
 */
@Singleton
public class QueueReceiver {
    private static final Logger LOG = LoggerFactory.getLogger(QueueReceiver.class);

    private final ReceiverConfig config;
    private final RetryConfig retryConfig;
    private final PartitionedTransport transport;
    private final DeadLetterPublisher deadLetters;
    private final BackoffPolicy backoff;

    public QueueReceiver(ReceiverConfig config, RetryConfig retryConfig, PartitionedTransport transport,
                         DeadLetterPublisher deadLetters, BackoffPolicy backoff) {
        this.config = config;
        this.retryConfig = retryConfig;
        this.transport = transport;
        this.deadLetters = deadLetters;
        this.backoff = backoff;
    }

    /**
     * Opens the consumer-group session and starts the run loop on a background thread.
     * Returns as soon as the session exists.
     *
     * @param outbound queue the consumer takes work items from; a full queue stalls the partition
     * @throws ReceiverConnectException if the session could not be established
     */
    public ReceiverHandle connect(BlockingQueue<WorkItem> outbound) {
        String topic = config.getTopic();
        if (topic == null || topic.isBlank()) {
            throw new ReceiverConnectException("receiver.topic is not configured");
        }
        RetryStateMachine machine = new RetryStateMachine(
            outbound,
            deadLetters,
            config.getDeadLetterTopic(),
            retryConfig.getMaxAttempts(),
            backoff
        );

        TransportSession session;
        try {
            session = transport.open(config.getGroup(), topic, (partition, payload) -> {
                LOG.debug("Message received on {}-{}", topic, partition);
                machine.process(payload);
            });
        } catch (ReceiverConnectException e) {
            LOG.error("Failed to connect receiver for {} (group {}, brokers {})",
                topic, config.getGroup(), config.getBootstrapServers(), e);
            throw e;
        }

        CompletableFuture<Void> termination = new CompletableFuture<>();
        Thread loop = new Thread(() -> {
            try {
                session.run();
                termination.complete(null);
            } catch (RuntimeException e) {
                LOG.error("Run loop for {} failed", topic, e);
                termination.completeExceptionally(e);
            }
        }, "queue-receiver-" + topic);
        loop.setDaemon(true);
        loop.start();

        LOG.info("Receiver connected to {} (group {}, max attempts {}, dead letters to {})",
            topic, config.getGroup(), retryConfig.getMaxAttempts(), config.getDeadLetterTopic());
        return new ReceiverHandle(topic, session, termination);
    }

    public void shutdown(ReceiverHandle handle) {
        if (handle == null) {
            throw new IllegalStateException("receiver is not connected");
        }
        handle.shutdown();
    }
}
