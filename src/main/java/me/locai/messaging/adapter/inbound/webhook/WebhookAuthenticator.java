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
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.security.HmacSigner;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Authenticates inbound webhook requests using a Bearer token or an HMAC
 * signature.
 *
 * <p>
 * A request passes when either check succeeds:
 * <ul>
 * <li>{@code Authorization: Bearer <token>} equals {@code locai.webhook.token}</li>
 * <li>{@code X-Webhook-Signature: sha256=<hex>} is the HMAC-SHA256 of the raw
 * body under {@code locai.webhook.secret}</li>
 * </ul>
 *
 * <p>
 * All comparisons use constant-time algorithms to prevent timing attacks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebhookAuthenticator {

    private static final String BEARER_PREFIX = "Bearer ";

    private final MessagingProperties properties;

    /**
     * @return {@code true} if either the bearer token or the body signature is
     *         valid
     */
    public boolean authenticate(HttpHeaders headers, byte[] body) {
        if (authenticateBearer(headers)) {
            return true;
        }
        if (authenticateHmac(headers, body)) {
            return true;
        }
        log.warn("[Webhook] Authentication failed");
        return false;
    }

    /**
     * Checks {@code Authorization: Bearer <token>} against the configured
     * token.
     */
    public boolean authenticateBearer(HttpHeaders headers) {
        String expected = properties.getWebhook().getToken();
        if (expected == null || expected.isBlank()) {
            return false;
        }
        String authHeader = headers.getFirst(HttpHeaders.AUTHORIZATION);
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            return false;
        }
        String provided = authHeader.substring(BEARER_PREFIX.length()).trim();
        return HmacSigner.constantTimeEquals(expected, provided);
    }

    /**
     * Verifies {@code X-Webhook-Signature} over the raw body.
     */
    public boolean authenticateHmac(HttpHeaders headers, byte[] body) {
        String secret = properties.getWebhook().getSecret();
        if (secret == null || secret.isBlank()) {
            return false;
        }
        String signature = headers.getFirst(HmacSigner.SIGNATURE_HEADER);
        if (signature == null) {
            log.debug("[Webhook] Signature header not present in request");
            return false;
        }
        return HmacSigner.verify(secret, body != null ? body : new byte[0], signature);
    }
}
