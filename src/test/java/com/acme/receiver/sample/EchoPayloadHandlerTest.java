package com.acme.receiver.sample;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class EchoPayloadHandlerTest {

    private final EchoPayloadHandler handler = new EchoPayloadHandler();

    @Test
    void testAcceptsOrdinaryPayload() {
        assertDoesNotThrow(() -> handler.handle("{\"orderId\":1}".getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void testRejectsPayloadAskingToFail() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
            () -> handler.handle("please fail".getBytes(StandardCharsets.UTF_8)));
        assertTrue(ex.getMessage().contains("please fail"));
    }

    @Test
    void testEmptyPayloadIsAccepted() {
        assertDoesNotThrow(() -> handler.handle(new byte[0]));
    }
}
