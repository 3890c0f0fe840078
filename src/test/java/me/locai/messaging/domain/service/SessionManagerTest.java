package me.locai.messaging.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.locai.messaging.cache.SessionStatusCache;
import me.locai.messaging.domain.model.BackendStatus;
import me.locai.messaging.domain.model.PairingCodeEvent;
import me.locai.messaging.domain.model.PairingResult;
import me.locai.messaging.domain.model.SessionStatus;
import me.locai.messaging.domain.model.SessionStatusView;
import me.locai.messaging.domain.model.StatusChangeEvent;
import me.locai.messaging.infrastructure.config.AutoConfiguration;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelBackendException;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.port.outbound.ChannelGateway;
import me.locai.messaging.port.outbound.DocumentStorePort;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class SessionManagerTest {

    private static final String TENANT = "tenant-a";
    private static final String CODE = "2@pairing-code-1";

    private MutableClock clock;
    private ChannelGateway channelGateway;
    private ChannelClient client;
    private PairingCodePoller poller;
    private DocumentStorePort documentStore;
    private SessionManager sessionManager;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        MessagingProperties properties = new MessagingProperties();
        properties.getSession().setInitCooldown(Duration.ofSeconds(30));
        properties.getSession().setPairingCodeTtl(Duration.ofSeconds(60));
        properties.getSession().setStatusTtl(Duration.ofSeconds(5));

        channelGateway = mock(ChannelGateway.class);
        client = mock(ChannelClient.class);
        poller = mock(PairingCodePoller.class);
        documentStore = mock(DocumentStorePort.class);
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();

        when(channelGateway.getClient(TENANT)).thenReturn(client);
        when(client.getTenantId()).thenReturn(TENANT);
        when(poller.poll(any())).thenReturn(Optional.empty());
        when(documentStore.getDocument(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
        when(documentStore.putDocument(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        sessionManager = new SessionManager(channelGateway, poller, new SessionStatusCache(properties, clock),
                documentStore, objectMapper, properties, clock);
    }

    // ==================== initializeSession ====================

    @Test
    void shouldReturnPairingCodeFromBackend() {
        when(client.initializeSession()).thenReturn(new PairingResult(CODE, "qr_available"));

        SessionStatusView view = sessionManager.initializeSession(TENANT);

        assertEquals("pairing_pending", view.getStatus());
        assertEquals(CODE, view.getQrCode());
        assertFalse(view.isConnected());
        assertFalse(sessionManager.snapshot(TENANT).isInitInProgress());
        verify(documentStore, atLeastOnce()).putDocument(eq(SessionManager.COLLECTION), eq(TENANT), anyString());
    }

    @Test
    void shouldReturnSameCodeWithinTtlWithoutCallingBackendAgain() {
        when(client.initializeSession()).thenReturn(new PairingResult(CODE, "qr_available"));

        SessionStatusView first = sessionManager.initializeSession(TENANT);
        clock.advance(Duration.ofSeconds(45));
        SessionStatusView second = sessionManager.initializeSession(TENANT);

        assertEquals(first.getQrCode(), second.getQrCode());
        verify(client, times(1)).initializeSession();
    }

    @Test
    void shouldRequestNewCodeOnceTtlExpired() {
        when(client.initializeSession())
                .thenReturn(new PairingResult(CODE, "qr_available"))
                .thenReturn(new PairingResult("2@pairing-code-2", "qr_available"));

        sessionManager.initializeSession(TENANT);
        clock.advance(Duration.ofSeconds(61));
        SessionStatusView view = sessionManager.initializeSession(TENANT);

        assertEquals("2@pairing-code-2", view.getQrCode());
        verify(client, times(2)).initializeSession();
    }

    @Test
    void shouldCallBackendOnceForConcurrentInitCalls() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        when(client.initializeSession()).thenAnswer(invocation -> {
            entered.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return new PairingResult(CODE, "qr_available");
        });

        int callers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<SessionStatusView>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                futures.add(executor.submit(() -> sessionManager.initializeSession(TENANT)));
            }
            assertTrue(entered.await(5, TimeUnit.SECONDS));
            release.countDown();
            for (Future<SessionStatusView> future : futures) {
                SessionStatusView view = future.get(5, TimeUnit.SECONDS);
                assertNotEquals("error", view.getStatus());
            }
        } finally {
            executor.shutdownNow();
        }

        verify(client, times(1)).initializeSession();
        assertEquals(CODE, sessionManager.initializeSession(TENANT).getQrCode());
        verify(client, times(1)).initializeSession();
    }

    @Test
    void shouldNotRetryPairingWithinCooldownWhenNoCodeArrived() {
        when(client.initializeSession()).thenReturn(new PairingResult(null, "connecting"));

        SessionStatusView first = sessionManager.initializeSession(TENANT);
        clock.advance(Duration.ofSeconds(10));
        SessionStatusView second = sessionManager.initializeSession(TENANT);

        assertEquals("connecting", first.getStatus());
        assertEquals("connecting", second.getStatus());
        verify(client, times(1)).initializeSession();

        clock.advance(Duration.ofSeconds(21));
        sessionManager.initializeSession(TENANT);

        verify(client, times(2)).initializeSession();
    }

    @Test
    void shouldUsePolledCodeWhenBackendGeneratesItAsynchronously() {
        when(client.initializeSession()).thenReturn(new PairingResult(null, "connecting"));
        when(poller.poll(client)).thenReturn(Optional.of(new BackendStatus(false, "qr", CODE, null, null)));

        SessionStatusView view = sessionManager.initializeSession(TENANT);

        assertEquals(CODE, view.getQrCode());
        assertEquals("pairing_pending", view.getStatus());
    }

    @Test
    void shouldNotCallBackendWhenAlreadyConnected() {
        when(client.initializeSession()).thenReturn(new PairingResult(null, "connected"));

        SessionStatusView first = sessionManager.initializeSession(TENANT);
        clock.advance(Duration.ofMinutes(5));
        SessionStatusView second = sessionManager.initializeSession(TENANT);

        assertTrue(first.isConnected());
        assertTrue(second.isConnected());
        assertNull(second.getQrCode());
        verify(client, times(1)).initializeSession();
    }

    @Test
    void shouldDegradeWhenBackendInitFails() {
        when(client.initializeSession()).thenThrow(new ChannelBackendException("connection refused"));

        SessionStatusView view = sessionManager.initializeSession(TENANT);

        assertEquals("error", view.getStatus());
        assertFalse(view.isConnected());
        assertTrue(view.getMessage().startsWith("Failed to initialize session"));
        assertEquals(SessionStatus.ERROR, sessionManager.snapshot(TENANT).getStatus());
        assertFalse(sessionManager.snapshot(TENANT).isInitInProgress());
    }

    @Test
    void shouldRetryAfterError() {
        when(client.initializeSession())
                .thenThrow(new ChannelBackendException("connection refused"))
                .thenReturn(new PairingResult(CODE, "qr_available"));

        sessionManager.initializeSession(TENANT);
        SessionStatusView view = sessionManager.initializeSession(TENANT);

        assertEquals(CODE, view.getQrCode());
        assertNull(sessionManager.snapshot(TENANT).getLastError());
    }

    // ==================== getStatus ====================

    @Test
    void shouldServeStatusFromCacheWithinTtl() {
        when(client.getConnectionStatus())
                .thenReturn(new BackendStatus(true, "connected", null, "+5511999990000", "Casa Praia"));

        SessionStatusView first = sessionManager.getStatus(TENANT);
        clock.advance(Duration.ofSeconds(2));
        SessionStatusView second = sessionManager.getStatus(TENANT);

        assertTrue(first.isConnected());
        assertEquals("Casa Praia", second.getBusinessName());
        verify(client, times(1)).getConnectionStatus();
    }

    @Test
    void shouldReturnDegradedViewWithoutChangingStateWhenBackendDown() {
        when(client.getConnectionStatus()).thenThrow(new ChannelBackendException("timeout"));

        SessionStatusView view = sessionManager.getStatus(TENANT);

        assertEquals("error", view.getStatus());
        assertEquals("Channel backend unavailable", view.getMessage());
        assertEquals(SessionStatus.DISCONNECTED, sessionManager.snapshot(TENANT).getStatus());
    }

    @Test
    void shouldKeepOutstandingCodeWhenBackendReportsAnother() {
        when(client.initializeSession()).thenReturn(new PairingResult(CODE, "qr_available"));
        when(client.getConnectionStatus()).thenReturn(new BackendStatus(false, "qr", "2@other", null, null));

        sessionManager.initializeSession(TENANT);
        clock.advance(Duration.ofSeconds(40));
        SessionStatusView view = sessionManager.getStatus(TENANT);

        assertEquals(CODE, view.getQrCode());
    }

    // ==================== events ====================

    @Test
    void pairingCodeEventShouldNotReplaceFreshCode() {
        sessionManager.applyChannelEvent(new PairingCodeEvent(TENANT, CODE));
        clock.advance(Duration.ofSeconds(20));
        sessionManager.applyChannelEvent(new PairingCodeEvent(TENANT, "2@other"));

        assertEquals(CODE, sessionManager.snapshot(TENANT).getPairingCode());
        assertEquals(SessionStatus.PAIRING_PENDING, sessionManager.snapshot(TENANT).getStatus());

        clock.advance(Duration.ofSeconds(41));
        sessionManager.applyChannelEvent(new PairingCodeEvent(TENANT, "2@other"));

        assertEquals("2@other", sessionManager.snapshot(TENANT).getPairingCode());
    }

    @Test
    void connectedEventShouldClearCodeAndRecordIdentity() {
        sessionManager.applyChannelEvent(new PairingCodeEvent(TENANT, CODE));
        sessionManager.applyChannelEvent(new StatusChangeEvent(TENANT, "connected", "+5511999990000", "Casa Praia"));

        SessionStatusView view = sessionManager.getStatus(TENANT);

        assertTrue(view.isConnected());
        assertNull(view.getQrCode());
        assertEquals("+5511999990000", view.getPhoneNumber());
        verify(client, never()).getConnectionStatus();
    }

    // ==================== disconnect ====================

    @Test
    void disconnectShouldResetStateEvenWhenBackendFails() {
        sessionManager.applyChannelEvent(new StatusChangeEvent(TENANT, "connected", "+5511999990000", "Casa Praia"));
        doThrow(new ChannelBackendException("gone")).when(client).disconnect();

        SessionStatusView view = sessionManager.disconnect(TENANT);

        assertEquals("disconnected", view.getStatus());
        assertNull(view.getPhoneNumber());
        verify(channelGateway).evict(TENANT);
    }
}
