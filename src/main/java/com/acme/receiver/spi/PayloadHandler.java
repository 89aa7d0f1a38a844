package com.acme.receiver.spi;

/**
 * Application logic behind the bundled dispatcher. Returning normally acknowledges the item,
 * throwing rejects it.
 */
public interface PayloadHandler {
    void handle(byte[] payload) throws Exception;
}
