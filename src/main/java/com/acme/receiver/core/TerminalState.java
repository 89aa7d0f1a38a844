package com.acme.receiver.core;

/**
 * Final state of one message after it left the retry machine.
 */
public enum TerminalState {
    /**
     * The consumer acknowledged one of the delivery attempts.
     */
    SUCCEEDED,

    /**
     * Retries were exhausted and the payload was copied to the dead-letter topic.
     */
    DEAD_LETTERED,

    /**
     * Retries were exhausted and the dead-letter publish failed. The payload only survives in the log.
     */
    LOST,

    /**
     * The processing thread was interrupted while waiting. The transport will redeliver.
     */
    ABANDONED
}
