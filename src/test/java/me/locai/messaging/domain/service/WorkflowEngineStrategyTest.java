package me.locai.messaging.domain.service;

import me.locai.messaging.domain.model.DeliveryResult;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.port.outbound.WorkflowEngineException;
import me.locai.messaging.port.outbound.WorkflowPort;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WorkflowEngineStrategyTest {

    private static final MessageEvent EVENT = new MessageEvent("tenant-a", "m1", "+5511999990000", "Hello",
            Instant.parse("2026-01-01T10:00:00Z"));

    private final WorkflowPort workflowPort = mock(WorkflowPort.class);
    private final WorkflowEngineStrategy strategy = new WorkflowEngineStrategy(workflowPort);

    @Test
    void shouldSucceedWithoutLocalReply() {
        DeliveryResult result = strategy.deliver(EVENT);

        assertTrue(result.success());
        assertFalse(result.replySent());
        verify(workflowPort).dispatch(EVENT);
    }

    @Test
    void shouldReportNotConfigured() {
        doThrow(new WorkflowEngineException(WorkflowEngineException.Reason.NOT_CONFIGURED, "no url"))
                .when(workflowPort).dispatch(any());

        DeliveryResult result = strategy.deliver(EVENT);

        assertFalse(result.success());
        assertEquals("not_configured", result.reason());
    }

    @Test
    void shouldTreatUnexpectedErrorsAsUnavailable() {
        doThrow(new IllegalStateException("bug")).when(workflowPort).dispatch(any());

        assertEquals("unavailable", strategy.deliver(EVENT).reason());
    }
}
