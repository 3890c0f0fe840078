package me.locai.messaging.domain.service;

import me.locai.messaging.adapter.outbound.completion.KeywordCompletionAdapter;
import me.locai.messaging.cache.MessageDeduplicationCache;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.domain.model.RoutingOutcome;
import me.locai.messaging.infrastructure.config.AutoConfiguration;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelBackendException;
import me.locai.messaging.port.outbound.ChannelGateway;
import me.locai.messaging.port.outbound.DocumentStorePort;
import me.locai.messaging.port.outbound.WorkflowEngineException;
import me.locai.messaging.port.outbound.WorkflowPort;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class InboundMessageRouterTest {

    private static final String TENANT = "tenant-a";
    private static final String CLIENT = "+5511999990000";

    private MessagingProperties properties;
    private WorkflowPort workflowPort;
    private ChannelGateway channelGateway;
    private MessageDeduplicationCache dedup;
    private ConversationAgentService agentService;
    private InboundMessageRouter router;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        properties = new MessagingProperties();
        properties.getAgent().setLaneTimeout(Duration.ofMillis(100));

        workflowPort = mock(WorkflowPort.class);
        channelGateway = mock(ChannelGateway.class);
        DocumentStorePort documentStore = mock(DocumentStorePort.class);
        when(documentStore.getDocument(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(documentStore.putDocument(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));
        when(channelGateway.send(anyString(), anyString(), anyString())).thenReturn("sent-1");

        dedup = new MessageDeduplicationCache(properties, clock);
        agentService = new ConversationAgentService(new KeywordCompletionAdapter(),
                new BusinessFunctionRegistry(List.of(), properties), documentStore, AutoConfiguration.objectMapper(),
                properties, clock);
        router = new InboundMessageRouter(dedup, agentService, new WorkflowEngineStrategy(workflowPort),
                new LocalAgentFallbackStrategy(agentService, channelGateway, properties));
    }

    private MessageEvent message(String messageId) {
        return new MessageEvent(TENANT, messageId, CLIENT, "Hello", Instant.parse("2026-01-01T10:00:00Z"));
    }

    @Test
    void shouldDeliverThroughWorkflowWithoutLocalReply() {
        RoutingOutcome outcome = router.dispatch(message("m1"));

        assertTrue(outcome.isDelivered());
        assertEquals(WorkflowEngineStrategy.NAME, outcome.deliveredBy());
        assertFalse(outcome.isReplySent());
        verify(workflowPort).dispatch(any());
        verify(channelGateway, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void shouldFallBackAndSendExactlyOnceWhenWorkflowFails() {
        doThrow(new WorkflowEngineException(WorkflowEngineException.Reason.UNAVAILABLE, "HTTP 500"))
                .when(workflowPort).dispatch(any());

        RoutingOutcome outcome = router.dispatch(message("m1"));

        assertEquals(LocalAgentFallbackStrategy.NAME, outcome.deliveredBy());
        assertTrue(outcome.isReplySent());
        assertEquals("unavailable", outcome.attempts().get(0).reason());
        verify(channelGateway, times(1)).send(eq(TENANT), eq(CLIENT), anyString());
    }

    @Test
    void shouldFallBackWhenWorkflowTimesOut() {
        doThrow(new WorkflowEngineException(WorkflowEngineException.Reason.TIMEOUT, "timed out"))
                .when(workflowPort).dispatch(any());

        RoutingOutcome outcome = router.dispatch(message("m1"));

        assertEquals("timeout", outcome.attempts().get(0).reason());
        verify(channelGateway, times(1)).send(eq(TENANT), eq(CLIENT), anyString());
    }

    @Test
    void shouldIgnoreReplayedMessage() {
        doThrow(new WorkflowEngineException(WorkflowEngineException.Reason.NOT_CONFIGURED, "not configured"))
                .when(workflowPort).dispatch(any());

        RoutingOutcome first = router.dispatch(message("m1"));
        RoutingOutcome second = router.dispatch(message("m1"));

        assertFalse(first.duplicate());
        assertTrue(second.duplicate());
        verify(workflowPort, times(1)).dispatch(any());
        verify(channelGateway, times(1)).send(anyString(), anyString(), anyString());
    }

    @Test
    void shouldReportFailureWhenEveryStrategyFails() {
        doThrow(new WorkflowEngineException(WorkflowEngineException.Reason.UNAVAILABLE, "down"))
                .when(workflowPort).dispatch(any());
        when(channelGateway.send(anyString(), anyString(), anyString()))
                .thenThrow(new ChannelBackendException("send failed"));

        RoutingOutcome outcome = router.dispatch(message("m1"));

        assertFalse(outcome.isDelivered());
        assertEquals(2, outcome.attempts().size());
        assertEquals(LocalAgentFallbackStrategy.REASON_SEND_FAILED, outcome.attempts().get(1).reason());
        verify(channelGateway, times(1)).send(anyString(), anyString(), anyString());
    }

    @Test
    void shouldForgetMarkWhenLaneStaysBusy() throws Exception {
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicReference<Throwable> holderError = new AtomicReference<>();
        Thread holder = new Thread(() -> {
            try {
                agentService.inLane(TENANT, CLIENT, () -> {
                    holding.countDown();
                    try {
                        release.await(5, TimeUnit.SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return null;
                });
            } catch (RuntimeException e) {
                holderError.set(e);
            }
        });
        holder.start();
        assertTrue(holding.await(5, TimeUnit.SECONDS));

        try {
            assertThrows(LaneUnavailableException.class, () -> router.dispatch(message("m1")));
            assertFalse(dedup.isDuplicate(TENANT, "m1"));
        } finally {
            release.countDown();
            holder.join(5000);
        }
        assertNull(holderError.get());

        assertTrue(router.dispatch(message("m1")).isDelivered());
    }
}
