package com.acme.receiver.receiver;

import com.acme.receiver.config.ReceiverConfig;
import com.acme.receiver.core.BackoffPolicy;
import com.acme.receiver.core.RetryStateMachine;
import com.acme.receiver.core.TerminalState;
import com.acme.receiver.core.WorkItem;
import com.acme.receiver.spi.PayloadHandler;
import com.acme.receiver.test.RecordingDeadLetterPublisher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.LinkedBlockingQueue;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WorkDispatcherTest {

    private PayloadHandler handler;
    private WorkDispatcher dispatcher;
    private RecordingDeadLetterPublisher deadLetters;

    @BeforeEach
    void setUp() {
        handler = mock(PayloadHandler.class);
        ReceiverConfig config = new ReceiverConfig();
        config.setHandlerThreads(2);
        dispatcher = new WorkDispatcher(handler, config);
        deadLetters = new RecordingDeadLetterPublisher();
    }

    @AfterEach
    void tearDown() {
        dispatcher.stop();
    }

    @Test
    void testHandlerSuccessAcknowledges() throws Exception {
        LinkedBlockingQueue<WorkItem> queue = new LinkedBlockingQueue<>();
        dispatcher.start(queue);
        RetryStateMachine machine = new RetryStateMachine(queue, deadLetters, "t.errors", 3, BackoffPolicy.none());

        byte[] payload = "hello".getBytes(StandardCharsets.UTF_8);
        assertEquals(TerminalState.SUCCEEDED, machine.process(payload));

        verify(handler).handle(payload);
        assertTrue(deadLetters.getPublished().isEmpty());
    }

    @Test
    void testHandlerFailureRejectsUntilDeadLettered() throws Exception {
        doThrow(new IllegalArgumentException("bad payload")).when(handler).handle(any());
        LinkedBlockingQueue<WorkItem> queue = new LinkedBlockingQueue<>();
        dispatcher.start(queue);
        RetryStateMachine machine = new RetryStateMachine(queue, deadLetters, "t.errors", 2, BackoffPolicy.none());

        assertEquals(TerminalState.DEAD_LETTERED, machine.process("x".getBytes(StandardCharsets.UTF_8)));

        verify(handler, times(3)).handle(any());
        assertEquals(1, deadLetters.getPublished().size());
    }

    @Test
    void testCheckedExceptionRejects() throws Exception {
        doThrow(new java.io.IOException("disk full")).doNothing().when(handler).handle(any());
        LinkedBlockingQueue<WorkItem> queue = new LinkedBlockingQueue<>();
        dispatcher.start(queue);
        RetryStateMachine machine = new RetryStateMachine(queue, deadLetters, "t.errors", 1, BackoffPolicy.none());

        assertEquals(TerminalState.SUCCEEDED, machine.process("x".getBytes(StandardCharsets.UTF_8)));

        verify(handler, times(2)).handle(any());
    }

    @Test
    void testStartTwiceIsRejected() {
        LinkedBlockingQueue<WorkItem> queue = new LinkedBlockingQueue<>();
        dispatcher.start(queue);

        assertThrows(IllegalStateException.class, () -> dispatcher.start(queue));
    }
}
