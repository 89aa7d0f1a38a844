package com.acme.receiver.kafka;

import com.acme.receiver.core.ReceiverConnectException;
import com.acme.receiver.spi.PartitionCallback;
import com.acme.receiver.spi.PartitionedTransport;
import com.acme.receiver.spi.TransportSession;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Consumer-group transport on top of a plain Kafka consumer.
 * <p>
 * One poll thread owns the consumer. Records of a partition are handed, in offset order, to a
 * single-thread executor dedicated to that partition; the partition stays paused until its batch
 * is done and the offsets are committed. Partitions therefore progress independently while each
 * one is strictly sequential.
 */
public class KafkaPartitionedTransport implements PartitionedTransport {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaPartitionedTransport.class);
    private static final byte[] EMPTY = new byte[0];
    private static final Duration REVOKE_TIMEOUT = Duration.ofSeconds(10);

    private final Function<String, Consumer<byte[], byte[]>> consumers;
    private final Duration pollTimeout;
    private final Duration connectTimeout;
    private final Duration drainTimeout;

    /**
     * @param consumers    creates a consumer for a group id
     * @param drainTimeout how long cancelled sessions wait for in-flight messages; zero abandons them
     */
    public KafkaPartitionedTransport(Function<String, Consumer<byte[], byte[]>> consumers,
                                     Duration pollTimeout, Duration connectTimeout, Duration drainTimeout) {
        this.consumers = consumers;
        this.pollTimeout = pollTimeout;
        this.connectTimeout = connectTimeout;
        this.drainTimeout = drainTimeout;
    }

    @Override
    public TransportSession open(String group, String topic, PartitionCallback callback) {
        Consumer<byte[], byte[]> consumer;
        try {
            consumer = consumers.apply(group);
        } catch (KafkaException e) {
            throw new ReceiverConnectException("Failed to create consumer for group " + group, e);
        }

        try {
            List<PartitionInfo> partitions = consumer.partitionsFor(topic, connectTimeout);
            if (partitions == null || partitions.isEmpty()) {
                throw new ReceiverConnectException("No partitions found for topic " + topic);
            }
            LOG.info("Joining group {} on topic {} ({} partitions)", group, topic, partitions.size());

            KafkaSession session = new KafkaSession(consumer, topic, callback);
            consumer.subscribe(List.of(topic), session);
            return session;
        } catch (ReceiverConnectException e) {
            closeQuietly(consumer);
            throw e;
        } catch (KafkaException e) {
            closeQuietly(consumer);
            throw new ReceiverConnectException("Failed to reach brokers for topic " + topic, e);
        }
    }

    private static void closeQuietly(Consumer<byte[], byte[]> consumer) {
        try {
            consumer.close();
        } catch (Exception e) {
            LOG.warn("Error closing Kafka consumer", e);
        }
    }

    private record Completion(PartitionWorker worker, long nextOffset) {}

    private final class KafkaSession implements TransportSession, ConsumerRebalanceListener {
        private final Consumer<byte[], byte[]> consumer;
        private final String topic;
        private final PartitionCallback callback;
        private final AtomicBoolean running = new AtomicBoolean(true);
        private final AtomicBoolean started = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        // poll thread only
        private final Map<TopicPartition, PartitionWorker> workers = new HashMap<>();
        // revoked workers that had not terminated yet; the next worker of the partition waits for them
        private final Map<TopicPartition, PartitionWorker> retired = new HashMap<>();
        private final ConcurrentLinkedQueue<Completion> completed = new ConcurrentLinkedQueue<>();

        KafkaSession(Consumer<byte[], byte[]> consumer, String topic, PartitionCallback callback) {
            this.consumer = consumer;
            this.topic = topic;
            this.callback = callback;
        }

        @Override
        public void run() {
            if (!started.compareAndSet(false, true)) {
                throw new IllegalStateException("Session for " + topic + " already started");
            }
            LOG.info("Starting fetch loop for {}", topic);
            try {
                while (running.get()) {
                    ConsumerRecords<byte[], byte[]> records = consumer.poll(pollTimeout);
                    dispatch(records);
                    commitCompleted();
                }
            } catch (WakeupException e) {
                if (running.get()) {
                    throw e;
                }
            } finally {
                stopWorkers();
                try {
                    commitCompleted();
                } catch (KafkaException e) {
                    LOG.warn("Final offset commit for {} failed", topic, e);
                }
                closed.set(true);
                closeQuietly(consumer);
                LOG.info("Fetch loop for {} stopped", topic);
            }
        }

        @Override
        public void cancel() {
            if (running.compareAndSet(true, false)) {
                LOG.info("Cancelling fetch loop for {}", topic);
            }
            if (!closed.get()) {
                consumer.wakeup();
            }
        }

        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            try {
                commitCompleted();
            } catch (KafkaException e) {
                LOG.warn("Offset commit before revocation of {} failed", partitions, e);
            }
            List<PartitionWorker> revoked = new ArrayList<>();
            for (TopicPartition tp : partitions) {
                PartitionWorker worker = workers.remove(tp);
                if (worker != null) {
                    worker.abort();
                    revoked.add(worker);
                }
            }
            long deadline = System.nanoTime() + REVOKE_TIMEOUT.toNanos();
            for (PartitionWorker worker : revoked) {
                try {
                    if (!worker.awaitTermination(Math.max(0, deadline - System.nanoTime()))) {
                        LOG.warn("Worker for revoked partition {} still busy after {}", worker.partition(), REVOKE_TIMEOUT);
                        retired.put(worker.partition(), worker);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    retired.put(worker.partition(), worker);
                }
            }
            LOG.info("Partitions revoked: {}", partitions);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            LOG.info("Partitions assigned: {}", partitions);
        }

        private void dispatch(ConsumerRecords<byte[], byte[]> records) {
            for (TopicPartition tp : records.partitions()) {
                List<ConsumerRecord<byte[], byte[]>> batch = records.records(tp);
                PartitionWorker worker = workers.computeIfAbsent(tp,
                    p -> new PartitionWorker(p, callback, completed, retired.remove(p)));
                consumer.pause(List.of(tp));
                worker.submit(batch);
            }
        }

        private void commitCompleted() {
            Map<TopicPartition, OffsetAndMetadata> offsets = new HashMap<>();
            List<TopicPartition> resume = new ArrayList<>();
            Set<TopicPartition> assigned = consumer.assignment();
            Completion c;
            while ((c = completed.poll()) != null) {
                TopicPartition tp = c.worker().partition();
                if (workers.get(tp) != c.worker() || !assigned.contains(tp)) {
                    continue;
                }
                if (c.nextOffset() >= 0) {
                    offsets.put(tp, new OffsetAndMetadata(c.nextOffset()));
                }
                resume.add(tp);
            }
            if (!offsets.isEmpty()) {
                commitSync(offsets);
                LOG.debug("Committed {}", offsets);
            }
            if (!resume.isEmpty() && running.get()) {
                consumer.resume(resume);
            }
        }

        private void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
            try {
                consumer.commitSync(offsets);
            } catch (WakeupException e) {
                if (running.get()) {
                    throw e;
                }
                // cancel() woke the consumer outside poll; the wakeup is consumed now
                consumer.commitSync(offsets);
            }
        }

        private void stopWorkers() {
            if (drainTimeout.isZero() || drainTimeout.isNegative()) {
                if (!workers.isEmpty()) {
                    LOG.info("Abandoning in-flight messages on {} partitions", workers.size());
                }
                workers.values().forEach(PartitionWorker::abort);
                return;
            }
            workers.values().forEach(PartitionWorker::stop);
            long deadline = System.nanoTime() + drainTimeout.toNanos();
            for (PartitionWorker worker : workers.values()) {
                long remaining = deadline - System.nanoTime();
                try {
                    if (remaining <= 0 || !worker.awaitTermination(remaining)) {
                        LOG.warn("Partition {} did not drain within {}, abandoning", worker.partition(), drainTimeout);
                        worker.abort();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    LOG.warn("Interrupted while draining {}", topic);
                    workers.values().forEach(PartitionWorker::abort);
                    return;
                }
            }
        }
    }

    /**
     * Sequential executor for one partition. A worker created after a revocation starts only once
     * the previous worker of the same partition has terminated.
     */
    private static final class PartitionWorker {
        private final TopicPartition partition;
        private final PartitionCallback callback;
        private final ConcurrentLinkedQueue<Completion> completed;
        private final ExecutorService executor;
        private volatile boolean stopped;
        // executor thread only
        private PartitionWorker predecessor;

        PartitionWorker(TopicPartition partition, PartitionCallback callback,
                        ConcurrentLinkedQueue<Completion> completed, PartitionWorker predecessor) {
            this.partition = partition;
            this.callback = callback;
            this.completed = completed;
            this.predecessor = predecessor;
            this.executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "partition-" + partition);
                t.setDaemon(true);
                return t;
            });
        }

        TopicPartition partition() {
            return partition;
        }

        void submit(List<ConsumerRecord<byte[], byte[]>> batch) {
            executor.execute(() -> process(batch));
        }

        void stop() {
            stopped = true;
            executor.shutdown();
        }

        /**
         * Stops and interrupts the in-flight message, which then ends as abandoned.
         */
        void abort() {
            stopped = true;
            executor.shutdownNow();
        }

        boolean awaitTermination(long nanos) throws InterruptedException {
            return executor.awaitTermination(nanos, TimeUnit.NANOSECONDS);
        }

        private void process(List<ConsumerRecord<byte[], byte[]>> batch) {
            long next = -1;
            if (predecessor != null) {
                try {
                    predecessor.awaitTermination(Long.MAX_VALUE);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    completed.add(new Completion(this, next));
                    return;
                }
                predecessor = null;
            }
            for (ConsumerRecord<byte[], byte[]> rec : batch) {
                if (stopped) {
                    break;
                }
                try {
                    callback.onMessage(partition.partition(), rec.value() != null ? rec.value() : EMPTY);
                } catch (RuntimeException e) {
                    LOG.error("Callback failed on {} offset {}, skipping record", partition, rec.offset(), e);
                }
                if (Thread.currentThread().isInterrupted()) {
                    break;
                }
                next = rec.offset() + 1;
            }
            completed.add(new Completion(this, next));
        }
    }
}
