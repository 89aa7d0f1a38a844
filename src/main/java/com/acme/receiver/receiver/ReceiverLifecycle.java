package com.acme.receiver.receiver;

import com.acme.receiver.config.ReceiverConfig;
import com.acme.receiver.core.WorkItem;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.annotation.PreDestroy;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;

/**
 * Connects the receiver when the application starts and stops it on shutdown.
 */
@Singleton
@Requires(notEnv = "test")
@Requires(property = "receiver.autostart", value = "true", defaultValue = "false")
public class ReceiverLifecycle implements ApplicationEventListener<StartupEvent> {
    private static final Logger LOG = LoggerFactory.getLogger(ReceiverLifecycle.class);

    private final QueueReceiver receiver;
    private final WorkDispatcher dispatcher;
    private final ReceiverConfig config;
    private ReceiverHandle handle;

    public ReceiverLifecycle(QueueReceiver receiver, WorkDispatcher dispatcher, ReceiverConfig config) {
        this.receiver = receiver;
        this.dispatcher = dispatcher;
        this.config = config;
    }

    @Override
    public synchronized void onApplicationEvent(StartupEvent event) {
        BlockingQueue<WorkItem> queue = new ArrayBlockingQueue<>(config.getOutboundCapacity());
        dispatcher.start(queue);
        try {
            handle = receiver.connect(queue);
        } catch (RuntimeException e) {
            dispatcher.stop();
            throw e;
        }
    }

    @PreDestroy
    synchronized void shutdown() {
        if (handle == null) {
            return;
        }
        receiver.shutdown(handle);
        try {
            Duration wait = config.getEffectiveDrainTimeout().plus(config.getPollTimeout());
            if (!handle.awaitTermination(wait)) {
                LOG.warn("Receiver for {} still running after {}", handle.topic(), wait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        dispatcher.stop();
        handle = null;
    }
}
