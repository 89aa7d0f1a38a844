package com.acme.receiver.sample;

import com.acme.receiver.spi.PayloadHandler;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

@Singleton
public class EchoPayloadHandler implements PayloadHandler {
    private static final Logger LOG = LoggerFactory.getLogger(EchoPayloadHandler.class);

    @Override
    public void handle(byte[] payload) {
        String text = new String(payload, StandardCharsets.UTF_8);
        if (text.contains("fail")) {
            throw new IllegalArgumentException("Refusing payload " + text);
        }
        LOG.info("Processed {}", text);
    }
}
