package com.acme.receiver.core;

public enum Outcome {
    ACK,
    NACK
}
