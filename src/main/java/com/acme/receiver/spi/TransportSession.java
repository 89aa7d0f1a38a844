package com.acme.receiver.spi;

public interface TransportSession {
    /**
     * Runs the fetch loop on the calling thread until {@link #cancel()} is called.
     */
    void run();

    /**
     * Safe to call from any thread, any number of times.
     */
    void cancel();
}
