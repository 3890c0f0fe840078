package me.locai.messaging.adapter.inbound.webhook;

import me.locai.messaging.adapter.inbound.webhook.dto.WebhookResponse;
import me.locai.messaging.domain.model.DeliveryResult;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.domain.model.RoutingOutcome;
import me.locai.messaging.domain.model.StatusChangeEvent;
import me.locai.messaging.domain.service.InboundMessageRouter;
import me.locai.messaging.domain.service.LaneUnavailableException;
import me.locai.messaging.domain.service.SessionManager;
import me.locai.messaging.infrastructure.config.AutoConfiguration;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class WebhookControllerTest {

    private static final String TOKEN = "test-webhook-token";
    private static final String MESSAGE = "{\"event\":\"message\",\"tenantId\":\"t1\",\"data\":{\"messageId\":\"m1\","
            + "\"from\":\"+5511999990000\",\"message\":\"Hello\"}}";

    private MessagingProperties properties;
    private InboundMessageRouter router;
    private SessionManager sessionManager;
    private WebhookController controller;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        properties.getWebhook().setToken(TOKEN);
        properties.getWebhook().setMaxPayloadSize(1024);
        router = mock(InboundMessageRouter.class);
        sessionManager = mock(SessionManager.class);
        controller = new WebhookController(new WebhookAuthenticator(properties),
                new WebhookEventParser(AutoConfiguration.objectMapper(),
                        MutableClock.startingAt("2026-01-01T10:00:00Z")),
                router, sessionManager, properties);

        when(router.dispatch(any())).thenReturn(RoutingOutcome.routed("t1", "m1",
                List.of(DeliveryResult.delivered("workflow", false))));
    }

    private static HttpHeaders authorized() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN);
        return headers;
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void shouldRouteMessageEvent() {
        ResponseEntity<WebhookResponse> response = controller.receive(bytes(MESSAGE), authorized()).block();

        assertNotNull(response);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().isSuccess());

        ArgumentCaptor<MessageEvent> captor = ArgumentCaptor.forClass(MessageEvent.class);
        verify(router).dispatch(captor.capture());
        assertEquals("m1", captor.getValue().messageId());
        verifyNoInteractions(sessionManager);
    }

    @Test
    void shouldRejectUnauthenticatedRequestWithoutSideEffects() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(HttpHeaders.AUTHORIZATION, "Bearer wrong");

        StepVerifier.create(controller.receive(bytes(MESSAGE), headers))
                .assertNext(response -> {
                    assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
                    assertFalse(response.getBody().isSuccess());
                })
                .verifyComplete();

        verifyNoInteractions(router, sessionManager);
    }

    @Test
    void shouldRejectOversizedPayload() {
        byte[] large = new byte[2048];

        ResponseEntity<WebhookResponse> response = controller.receive(large, authorized()).block();

        assertEquals(HttpStatus.PAYLOAD_TOO_LARGE, response.getStatusCode());
        verifyNoInteractions(router);
    }

    @Test
    void shouldAcknowledgeInvalidPayloadWithoutProcessing() {
        ResponseEntity<WebhookResponse> response = controller.receive(bytes("{\"event\":\"message\","
                + "\"tenantId\":\"t1\",\"data\":{\"messageId\":\"m1\",\"from\":\"+5511\",\"message\":\"k\"}}"),
                authorized()).block();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().isSuccess());
        verifyNoInteractions(router);
    }

    @Test
    void shouldApplyStatusChangeToSession() {
        String json = "{\"event\":\"status_change\",\"tenantId\":\"t1\",\"data\":{\"status\":\"connected\"}}";

        ResponseEntity<WebhookResponse> response = controller.receive(bytes(json), authorized()).block();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        verify(sessionManager).applyChannelEvent(any(StatusChangeEvent.class));
        verifyNoInteractions(router);
    }

    @Test
    void shouldAnswerServerErrorWhenProcessingFails() {
        when(router.dispatch(any())).thenThrow(new LaneUnavailableException("busy"));

        ResponseEntity<WebhookResponse> response = controller.receive(bytes(MESSAGE), authorized()).block();

        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal server error", response.getBody().getError());
    }

    // ==================== verification handshake ====================

    @Test
    void shouldEchoChallengeForValidVerifyToken() {
        properties.getWebhook().setVerifyToken("verify-me");

        ResponseEntity<String> response = controller.verify("subscribe", "verify-me", "12345").block();

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("12345", response.getBody());
    }

    @Test
    void shouldRejectHandshakeWithWrongToken() {
        properties.getWebhook().setVerifyToken("verify-me");

        ResponseEntity<String> response = controller.verify("subscribe", "guess", "12345").block();

        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
    }
}
