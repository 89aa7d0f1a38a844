package com.acme.receiver.test;

import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * MockConsumer that keeps every synchronous commit, readable after the consumer was closed.
 */
public class RecordingMockConsumer extends MockConsumer<byte[], byte[]> {
    private final List<Map<TopicPartition, OffsetAndMetadata>> commits = new ArrayList<>();

    public RecordingMockConsumer() {
        super(OffsetResetStrategy.EARLIEST);
    }

    @Override
    public synchronized void commitSync(Map<TopicPartition, OffsetAndMetadata> offsets) {
        super.commitSync(offsets);
        commits.add(new HashMap<>(offsets));
    }

    public synchronized Long lastCommitted(TopicPartition tp) {
        Long offset = null;
        for (Map<TopicPartition, OffsetAndMetadata> commit : commits) {
            if (commit.containsKey(tp)) {
                offset = commit.get(tp).offset();
            }
        }
        return offset;
    }

    public synchronized int commitCount() {
        return commits.size();
    }
}
