package me.locai.messaging.adapter.inbound.webhook;

import me.locai.messaging.domain.model.ChannelEvent;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.domain.model.PairingCodeEvent;
import me.locai.messaging.domain.model.StatusChangeEvent;
import me.locai.messaging.infrastructure.config.AutoConfiguration;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WebhookEventParserTest {

    private static final Instant NOW = Instant.parse("2026-01-01T10:00:00Z");

    private final WebhookEventParser parser = new WebhookEventParser(AutoConfiguration.objectMapper(),
            new MutableClock(NOW));

    private ChannelEvent parse(String json, String headerTenant) {
        return parser.parse(json.getBytes(StandardCharsets.UTF_8), headerTenant);
    }

    @Test
    void shouldParseMessageEvent() {
        ChannelEvent event = parse("{\"event\":\"message\",\"tenantId\":\"t1\",\"data\":{\"messageId\":\"m1\","
                + "\"from\":\"+5511999990000\",\"message\":\"  Hello  \",\"timestamp\":1767261600}}", null);

        MessageEvent message = assertInstanceOf(MessageEvent.class, event);
        assertEquals("t1", message.tenantId());
        assertEquals("m1", message.messageId());
        assertEquals("Hello", message.text());
        assertEquals(Instant.ofEpochSecond(1767261600L), message.receivedAt());
    }

    @Test
    void shouldAcceptAlternativeFieldNamesAndHeaderTenant() {
        ChannelEvent event = parse("{\"event\":\"message\",\"data\":{\"id\":\"m2\",\"from\":\"+5511\","
                + "\"text\":\"Oi tudo bem\"}}", "t-header");

        MessageEvent message = assertInstanceOf(MessageEvent.class, event);
        assertEquals("t-header", message.tenantId());
        assertEquals("m2", message.messageId());
        assertEquals(NOW, message.receivedAt());
    }

    @Test
    void shouldRejectTooShortMessage() {
        assertThrows(WebhookValidationException.class, () -> parse("{\"event\":\"message\",\"tenantId\":\"t1\","
                + "\"data\":{\"messageId\":\"m1\",\"from\":\"+5511\",\"message\":\" k \"}}", null));
    }

    @Test
    void shouldRejectMessageWithoutSender() {
        assertThrows(WebhookValidationException.class, () -> parse("{\"event\":\"message\",\"tenantId\":\"t1\","
                + "\"data\":{\"messageId\":\"m1\",\"message\":\"Hello\"}}", null));
    }

    @Test
    void shouldRejectMissingTenant() {
        assertThrows(WebhookValidationException.class, () -> parse("{\"event\":\"message\","
                + "\"data\":{\"messageId\":\"m1\",\"from\":\"+5511\",\"message\":\"Hello\"}}", " "));
    }

    @Test
    void shouldParseStatusChange() {
        ChannelEvent event = parse("{\"event\":\"status_change\",\"tenantId\":\"t1\",\"data\":{\"status\":"
                + "\"connected\",\"phone\":\"+5511999990000\",\"businessName\":\"Casa Praia\"}}", null);

        StatusChangeEvent status = assertInstanceOf(StatusChangeEvent.class, event);
        assertEquals("connected", status.status());
        assertEquals("+5511999990000", status.phoneNumber());
        assertEquals("Casa Praia", status.businessName());
    }

    @Test
    void shouldParsePairingCodeUnderEitherEventName() {
        ChannelEvent qr = parse("{\"event\":\"qr_code\",\"tenantId\":\"t1\",\"data\":{\"qrCode\":\"2@abc\"}}", null);
        ChannelEvent pairing = parse("{\"event\":\"pairing_code\",\"tenantId\":\"t1\","
                + "\"data\":{\"pairingCode\":\"2@def\"}}", null);

        assertEquals("2@abc", assertInstanceOf(PairingCodeEvent.class, qr).pairingCode());
        assertEquals("2@def", assertInstanceOf(PairingCodeEvent.class, pairing).pairingCode());
    }

    @Test
    void shouldRejectUnknownEventAndMalformedJson() {
        assertThrows(WebhookValidationException.class,
                () -> parse("{\"event\":\"typing\",\"tenantId\":\"t1\",\"data\":{}}", null));
        assertThrows(WebhookValidationException.class, () -> parse("{not json", null));
        assertThrows(WebhookValidationException.class, () -> parse("[1,2,3]", null));
    }
}
