package com.acme.receiver.kafka;

import com.acme.receiver.config.ReceiverConfig;
import com.acme.receiver.config.RetryConfig;
import com.acme.receiver.spi.DeadLetterPublisher;
import com.acme.receiver.spi.PartitionedTransport;
import io.micronaut.context.annotation.Factory;
import io.micronaut.context.annotation.Requires;
import jakarta.inject.Singleton;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.util.Properties;

@Factory
@Requires(notEnv = "test")
public class KafkaClientFactory {

    @Singleton
    public PartitionedTransport partitionedTransport(ReceiverConfig config) {
        String bootstrap = config.getBootstrapServers();
        return new KafkaPartitionedTransport(
            group -> new KafkaConsumer<>(consumerProperties(bootstrap, group)),
            config.getPollTimeout(),
            config.getConnectTimeout(),
            config.getEffectiveDrainTimeout()
        );
    }

    @Singleton
    public DeadLetterPublisher deadLetterPublisher(ReceiverConfig config, RetryConfig retry) {
        String bootstrap = config.getBootstrapServers();
        return new KafkaDeadLetterPublisher(
            () -> new KafkaProducer<>(producerProperties(bootstrap)),
            retry.getPublishTimeout()
        );
    }

    static Properties consumerProperties(String bootstrapServers, String group) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, group);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());

        // Offsets are committed by the transport once a message reached a terminal state
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        // Paused partitions keep polling, so long backoffs do not trip the poll interval
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, 30000);
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, 10000);

        props.put(ConsumerConfig.CLIENT_ID_CONFIG, "queue-receiver-" + group);
        return props;
    }

    static Properties producerProperties(String bootstrapServers) {
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());

        // Reliability settings
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.RETRIES_CONFIG, 3);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, 30000);
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, 120000);

        props.put(ProducerConfig.CLIENT_ID_CONFIG, "queue-receiver-dlq");
        return props;
    }
}
