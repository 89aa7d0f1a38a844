package com.acme.receiver.receiver;

import com.acme.receiver.config.ReceiverConfig;
import com.acme.receiver.core.WorkItem;
import com.acme.receiver.spi.PayloadHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;

/**
 * Consumer side of the outbound queue: takes work items and reports the handler's result.
 */
@Singleton
public class WorkDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(WorkDispatcher.class);

    private final PayloadHandler handler;
    private final int threads;
    private final List<Thread> workers = new ArrayList<>();

    public WorkDispatcher(PayloadHandler handler, ReceiverConfig config) {
        this.handler = handler;
        this.threads = Math.max(1, config.getHandlerThreads());
    }

    public synchronized void start(BlockingQueue<WorkItem> queue) {
        if (!workers.isEmpty()) {
            throw new IllegalStateException("Dispatcher already started");
        }
        for (int i = 0; i < threads; i++) {
            Thread t = new Thread(() -> drain(queue), "work-dispatcher-" + i);
            t.setDaemon(true);
            workers.add(t);
            t.start();
        }
        LOG.info("Started {} dispatcher threads", threads);
    }

    public synchronized void stop() {
        workers.forEach(Thread::interrupt);
        workers.clear();
    }

    void dispatch(WorkItem item) {
        try {
            handler.handle(item.payload());
            item.acknowledge();
        } catch (Exception e) {
            LOG.warn("Handler rejected attempt {}: {}", item.attempt(), e.getMessage());
            item.reject();
        }
    }

    private void drain(BlockingQueue<WorkItem> queue) {
        try {
            while (!Thread.currentThread().isInterrupted()) {
                dispatch(queue.take());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
