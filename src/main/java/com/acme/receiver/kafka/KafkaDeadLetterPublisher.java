package com.acme.receiver.kafka;

import com.acme.receiver.core.DeadLetterPublishException;
import com.acme.receiver.spi.DeadLetterPublisher;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Writes a key-less record and waits for the broker acknowledgement.
 * A producer is created for each publish and closed afterwards, whatever the result.
 */
public class KafkaDeadLetterPublisher implements DeadLetterPublisher {
    private static final Logger LOG = LoggerFactory.getLogger(KafkaDeadLetterPublisher.class);

    private final Supplier<Producer<byte[], byte[]>> producers;
    private final Duration timeout;

    public KafkaDeadLetterPublisher(Supplier<Producer<byte[], byte[]>> producers, Duration timeout) {
        this.producers = producers;
        this.timeout = timeout;
    }

    @Override
    public void publish(String topic, byte[] payload) {
        try (Producer<byte[], byte[]> producer = producers.get()) {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, payload))
                .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            LOG.debug("Dead letter written to {} partition {} offset {}",
                metadata.topic(), metadata.partition(), metadata.offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeadLetterPublishException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException e) {
            throw new DeadLetterPublishException("Failed to publish to " + topic, e.getCause());
        } catch (TimeoutException e) {
            throw new DeadLetterPublishException("No acknowledgement from " + topic + " within " + timeout, e);
        } catch (KafkaException e) {
            throw new DeadLetterPublishException("Failed to publish to " + topic, e);
        }
    }
}
