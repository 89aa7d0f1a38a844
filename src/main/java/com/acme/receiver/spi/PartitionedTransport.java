package com.acme.receiver.spi;

public interface PartitionedTransport {
    /**
     * Joins {@code group} on {@code topic}. Nothing is consumed until {@link TransportSession#run()}.
     *
     * @throws com.acme.receiver.core.ReceiverConnectException if no session could be established
     */
    TransportSession open(String group, String topic, PartitionCallback callback);
}
