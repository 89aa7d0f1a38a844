package com.acme.receiver.spi;

/**
 * Invoked by the transport once per message. Calls for the same partition never overlap and the
 * next message of that partition is not delivered until the call returns.
 */
@FunctionalInterface
public interface PartitionCallback {
    void onMessage(int partition, byte[] payload);
}
