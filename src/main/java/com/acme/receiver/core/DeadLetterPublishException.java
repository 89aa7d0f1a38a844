package com.acme.receiver.core;

public class DeadLetterPublishException extends RuntimeException {
    public DeadLetterPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
