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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.adapter.inbound.webhook.dto.WebhookResponse;
import me.locai.messaging.domain.model.ChannelEvent;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.domain.model.RoutingOutcome;
import me.locai.messaging.domain.service.InboundMessageRouter;
import me.locai.messaging.domain.service.SessionManager;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.security.LogMasking;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Inbound webhook of the channel backend (WebFlux).
 *
 * <p>
 * Two endpoints:
 * <ul>
 * <li>{@code POST /webhook} - channel events: messages, status changes and
 * pairing codes</li>
 * <li>{@code GET /webhook} - subscription verification handshake</li>
 * </ul>
 *
 * <p>
 * Authentication runs before anything else. Payloads that fail validation are
 * acknowledged with {@code 200} so the sender does not retry them; only
 * processing failures answer {@code 500}.
 */
@RestController
@RequestMapping("/webhook")
@RequiredArgsConstructor
@Slf4j
public class WebhookController {

    static final String TENANT_HEADER = "X-Tenant-ID";
    private static final String HUB_MODE_SUBSCRIBE = "subscribe";

    private final WebhookAuthenticator authenticator;
    private final WebhookEventParser eventParser;
    private final InboundMessageRouter messageRouter;
    private final SessionManager sessionManager;
    private final MessagingProperties properties;

    @PostMapping
    public Mono<ResponseEntity<WebhookResponse>> receive(
            @RequestBody(required = false) byte[] body,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> handle(body != null ? body : new byte[0], headers))
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Subscription handshake: echoes {@code hub.challenge} when the verify token
     * matches.
     */
    @GetMapping
    public Mono<ResponseEntity<String>> verify(
            @RequestParam(name = "hub.mode", required = false) String mode,
            @RequestParam(name = "hub.verify_token", required = false) String verifyToken,
            @RequestParam(name = "hub.challenge", required = false) String challenge) {

        return Mono.fromCallable(() -> {
            String expected = properties.getWebhook().getVerifyToken();
            if (HUB_MODE_SUBSCRIBE.equals(mode) && expected != null && !expected.isBlank()
                    && expected.equals(verifyToken) && challenge != null) {
                log.info("[Webhook] Verification handshake accepted");
                return ResponseEntity.ok(challenge);
            }
            log.warn("[Webhook] Verification handshake rejected");
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body("Forbidden");
        });
    }

    private ResponseEntity<WebhookResponse> handle(byte[] body, HttpHeaders headers) {
        if (!authenticator.authenticate(headers, body)) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(WebhookResponse.error("Unauthorized"));
        }

        int maxSize = properties.getWebhook().getMaxPayloadSize();
        if (body.length > maxSize) {
            log.warn("[Webhook] Payload too large: {} bytes (max {})", body.length, maxSize);
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                    .body(WebhookResponse.error("Payload too large"));
        }

        ChannelEvent event;
        try {
            event = eventParser.parse(body, headers.getFirst(TENANT_HEADER));
        } catch (WebhookValidationException e) {
            log.warn("[Webhook] Ignoring invalid payload: {}", e.getMessage());
            return ResponseEntity.ok(WebhookResponse.ok("Ignored"));
        }

        try {
            if (event instanceof MessageEvent message) {
                RoutingOutcome outcome = messageRouter.dispatch(message);
                log.debug("[Webhook] Message {} from {} handled (duplicate={}, delivered={})",
                        message.messageId(), LogMasking.maskPhone(message.from()),
                        outcome.duplicate(), outcome.isDelivered());
                return ResponseEntity.ok(WebhookResponse.ok(outcome.duplicate() ? "Duplicate" : "Processed"));
            }
            sessionManager.applyChannelEvent(event);
            return ResponseEntity.ok(WebhookResponse.ok("Processed"));
        } catch (RuntimeException e) {
            log.error("[Webhook] Failed to process event for tenant {}", LogMasking.maskTenant(event.tenantId()), e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(WebhookResponse.error("Internal server error"));
        }
    }
}
