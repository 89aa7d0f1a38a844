package com.acme.receiver.config;

import io.micronaut.context.annotation.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection, topic and lifecycle settings of the queue receiver.
 */
@ConfigurationProperties("receiver")
public class ReceiverConfig {

    private List<String> brokers = new ArrayList<>(List.of("localhost:9092"));
    private String group = "queue-receiver";
    private String topic;
    private String deadLetterSuffix = ".errors";
    private boolean autostart = false;
    private Duration pollTimeout = Duration.ofMillis(500);
    private Duration connectTimeout = Duration.ofSeconds(10);
    private boolean drainOnShutdown = false;
    private Duration drainTimeout = Duration.ofSeconds(30);
    private int outboundCapacity = 16;
    private int handlerThreads = 4;

    public List<String> getBrokers() {
        return brokers;
    }

    public void setBrokers(List<String> brokers) {
        this.brokers = brokers;
    }

    /**
     * Brokers as a Kafka bootstrap string. KAFKA_BOOTSTRAP_SERVERS wins over configuration.
     */
    public String getBootstrapServers() {
        String env = System.getenv("KAFKA_BOOTSTRAP_SERVERS");
        if (env != null && !env.isBlank()) {
            return env;
        }
        return String.join(",", brokers);
    }

    public String getGroup() {
        return group;
    }

    public void setGroup(String group) {
        this.group = group;
    }

    public String getTopic() {
        return topic;
    }

    public void setTopic(String topic) {
        this.topic = topic;
    }

    public String getDeadLetterSuffix() {
        return deadLetterSuffix;
    }

    public void setDeadLetterSuffix(String deadLetterSuffix) {
        this.deadLetterSuffix = deadLetterSuffix;
    }

    /**
     * Example: payments -> payments.errors
     */
    public String getDeadLetterTopic() {
        return topic + deadLetterSuffix;
    }

    public boolean isAutostart() {
        return autostart;
    }

    public void setAutostart(boolean autostart) {
        this.autostart = autostart;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }

    public void setPollTimeout(Duration pollTimeout) {
        this.pollTimeout = pollTimeout;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public boolean isDrainOnShutdown() {
        return drainOnShutdown;
    }

    public void setDrainOnShutdown(boolean drainOnShutdown) {
        this.drainOnShutdown = drainOnShutdown;
    }

    public Duration getDrainTimeout() {
        return drainTimeout;
    }

    public void setDrainTimeout(Duration drainTimeout) {
        this.drainTimeout = drainTimeout;
    }

    /**
     * Zero when in-flight work is abandoned on shutdown.
     */
    public Duration getEffectiveDrainTimeout() {
        return drainOnShutdown ? drainTimeout : Duration.ZERO;
    }

    public int getOutboundCapacity() {
        return outboundCapacity;
    }

    public void setOutboundCapacity(int outboundCapacity) {
        this.outboundCapacity = outboundCapacity;
    }

    public int getHandlerThreads() {
        return handlerThreads;
    }

    public void setHandlerThreads(int handlerThreads) {
        this.handlerThreads = handlerThreads;
    }
}
