package me.locai.messaging.adapter.inbound.webhook;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.locai.messaging.domain.model.ChannelEvent;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.domain.model.PairingCodeEvent;
import me.locai.messaging.domain.model.StatusChangeEvent;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Turns a raw webhook body into a {@link ChannelEvent}.
 *
 * <p>
 * Body shape: {@code {"event": "...", "tenantId": "...", "data": {...}}}.
 * Supported events:
 * <ul>
 * <li>{@code message} - {@code data.messageId} (or {@code id}),
 * {@code data.from}, {@code data.message} (or {@code text})</li>
 * <li>{@code status_change} - {@code data.status}, optional {@code phone} and
 * {@code businessName}</li>
 * <li>{@code pairing_code} or {@code qr_code} - {@code data.qrCode} (or
 * {@code pairingCode})</li>
 * </ul>
 * When the body has no tenant id, the {@code X-Tenant-ID} header is used.
 */
@Component
@RequiredArgsConstructor
public class WebhookEventParser {

    static final int MIN_MESSAGE_LENGTH = 2;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * @throws WebhookValidationException
     *             if the body is malformed, the event is unknown, or required
     *             fields are missing
     */
    public ChannelEvent parse(byte[] body, String headerTenantId) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new WebhookValidationException("Malformed JSON body", e);
        } catch (IOException e) {
            throw new WebhookValidationException("Unreadable body", e);
        }
        if (root == null || !root.isObject()) {
            throw new WebhookValidationException("Body is not a JSON object");
        }

        String tenantId = firstText(root, "tenantId");
        if (tenantId == null) {
            tenantId = blankToNull(headerTenantId);
        }
        if (tenantId == null) {
            throw new WebhookValidationException("Missing tenantId");
        }

        String event = firstText(root, "event");
        if (event == null) {
            throw new WebhookValidationException("Missing event type");
        }
        JsonNode data = root.path("data");

        return switch (event) {
        case "message" -> parseMessage(tenantId, data);
        case "status_change" -> parseStatusChange(tenantId, data);
        case "pairing_code", "qr_code" -> parsePairingCode(tenantId, data);
        default -> throw new WebhookValidationException("Unknown event type: " + event);
        };
    }

    private MessageEvent parseMessage(String tenantId, JsonNode data) {
        requireObject(data);
        String messageId = firstText(data, "messageId", "id");
        String from = firstText(data, "from");
        String text = firstText(data, "message", "text");
        if (messageId == null) {
            throw new WebhookValidationException("Missing messageId");
        }
        if (from == null) {
            throw new WebhookValidationException("Missing sender");
        }
        if (text == null || text.trim().length() < MIN_MESSAGE_LENGTH) {
            throw new WebhookValidationException("Message text missing or too short");
        }
        return new MessageEvent(tenantId, messageId, from, text.trim(), parseTimestamp(data.get("timestamp")));
    }

    private StatusChangeEvent parseStatusChange(String tenantId, JsonNode data) {
        requireObject(data);
        String status = firstText(data, "status");
        if (status == null) {
            throw new WebhookValidationException("Missing status");
        }
        return new StatusChangeEvent(tenantId, status, firstText(data, "phone", "phoneNumber"),
                firstText(data, "businessName"));
    }

    private PairingCodeEvent parsePairingCode(String tenantId, JsonNode data) {
        requireObject(data);
        String code = firstText(data, "qrCode", "pairingCode", "code");
        if (code == null) {
            throw new WebhookValidationException("Missing pairing code");
        }
        return new PairingCodeEvent(tenantId, code);
    }

    private Instant parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return clock.instant();
        }
        if (node.isNumber()) {
            long value = node.asLong();
            // seconds or milliseconds since the epoch
            return value < 100_000_000_000L ? Instant.ofEpochSecond(value) : Instant.ofEpochMilli(value);
        }
        try {
            return Instant.parse(node.asText());
        } catch (DateTimeParseException e) {
            return clock.instant();
        }
    }

    private static void requireObject(JsonNode data) {
        if (data == null || !data.isObject()) {
            throw new WebhookValidationException("Missing data object");
        }
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isValueNode() && !value.isNull()) {
                String text = blankToNull(value.asText());
                if (text != null) {
                    return text;
                }
            }
        }
        return null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
