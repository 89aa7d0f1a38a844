package com.acme.receiver.receiver;

import com.acme.receiver.config.ReceiverConfig;
import com.acme.receiver.config.RetryConfig;
import com.acme.receiver.core.BackoffPolicy;
import com.acme.receiver.core.WorkItem;
import com.acme.receiver.kafka.KafkaDeadLetterPublisher;
import com.acme.receiver.kafka.KafkaPartitionedTransport;
import com.acme.receiver.sample.EchoPayloadHandler;
import com.acme.receiver.test.RecordingMockConsumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.PartitionInfo;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Receiver wired to Kafka's mock clients: consumer group in, dead-letter topic out.
 */
class ReceiverEndToEndTest {

    private static final String TOPIC = "events.test";
    private static final TopicPartition P0 = new TopicPartition(TOPIC, 0);

    private RecordingMockConsumer consumer;
    private final List<MockProducer<byte[], byte[]>> producers = new CopyOnWriteArrayList<>();
    private QueueReceiver receiver;
    private WorkDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        consumer = new RecordingMockConsumer();
        consumer.updatePartitions(TOPIC, List.of(new PartitionInfo(TOPIC, 0, null, null, null)));
        consumer.updateBeginningOffsets(Map.of(P0, 0L));

        ReceiverConfig config = new ReceiverConfig();
        config.setTopic(TOPIC);
        config.setGroup("receiver-test");
        config.setHandlerThreads(1);
        RetryConfig retry = new RetryConfig();
        retry.setMaxAttempts(1);

        KafkaPartitionedTransport transport = new KafkaPartitionedTransport(
            group -> consumer, Duration.ofMillis(10), Duration.ofSeconds(1), Duration.ofSeconds(5));
        KafkaDeadLetterPublisher deadLetters = new KafkaDeadLetterPublisher(() -> {
            MockProducer<byte[], byte[]> producer =
                new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());
            producers.add(producer);
            return producer;
        }, Duration.ofSeconds(5));

        receiver = new QueueReceiver(config, retry, transport, deadLetters, BackoffPolicy.none());
        dispatcher = new WorkDispatcher(new EchoPayloadHandler(), config);
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    private static ConsumerRecord<byte[], byte[]> record(long offset, String value) {
        return new ConsumerRecord<>(TOPIC, 0, offset, null, value.getBytes(StandardCharsets.UTF_8));
    }

    private List<ProducerRecord<byte[], byte[]>> deadLettered() {
        return producers.stream().flatMap(p -> p.history().stream()).collect(Collectors.toList());
    }

    @Test
    void testFailingMessageIsDeadLetteredAndOffsetsAdvance() throws Exception {
        consumer.schedulePollTask(() -> {
            consumer.rebalance(List.of(P0));
            consumer.addRecord(record(0, "order-1"));
            consumer.addRecord(record(1, "order-2 should fail"));
            consumer.addRecord(record(2, "order-3"));
        });
        BlockingQueue<WorkItem> queue = new ArrayBlockingQueue<>(4);
        dispatcher.start(queue);

        ReceiverHandle handle = receiver.connect(queue);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!Long.valueOf(3).equals(consumer.lastCommitted(P0)) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(3L, consumer.lastCommitted(P0));

        List<ProducerRecord<byte[], byte[]>> records = deadLettered();
        assertEquals(1, records.size());
        assertEquals("events.test.errors", records.get(0).topic());
        assertEquals("order-2 should fail", new String(records.get(0).value(), StandardCharsets.UTF_8));
        assertTrue(producers.get(0).closed());

        receiver.shutdown(handle);
        assertTrue(handle.awaitTermination(Duration.ofSeconds(5)));
        assertFalse(handle.isRunning());
        assertTrue(consumer.closed());
    }

    @Test
    void testShutdownWithIdleConsumerStopsCleanly() throws Exception {
        BlockingQueue<WorkItem> queue = new ArrayBlockingQueue<>(4);
        dispatcher.start(queue);
        ReceiverHandle handle = receiver.connect(queue);

        assertTrue(handle.isRunning());
        receiver.shutdown(handle);

        assertTrue(handle.awaitTermination(Duration.ofSeconds(5)));
        assertNull(consumer.lastCommitted(P0));
        assertTrue(deadLettered().isEmpty());
    }
}
