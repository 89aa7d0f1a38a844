package com.acme.receiver.core;

public class ReceiverConnectException extends RuntimeException {
    public ReceiverConnectException(String message) {
        super(message);
    }

    public ReceiverConnectException(String message, Throwable cause) {
        super(message, cause);
    }
}
