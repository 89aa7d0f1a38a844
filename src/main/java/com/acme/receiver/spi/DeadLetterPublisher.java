package com.acme.receiver.spi;

/**
 * Synchronous emit of a single record to a named topic.
 */
public interface DeadLetterPublisher {
    /**
     * Blocks until the transport confirmed the record.
     *
     * @throws com.acme.receiver.core.DeadLetterPublishException if the record could not be written
     */
    void publish(String topic, byte[] payload);
}
