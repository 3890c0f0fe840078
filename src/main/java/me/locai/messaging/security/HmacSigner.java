package me.locai.messaging.security;

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

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * HMAC-SHA256 signatures in the {@code sha256=<hex>} header format used by
 * the channel microservice and the workflow engine.
 */
public final class HmacSigner {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String SIGNATURE_PREFIX = "sha256=";

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    private HmacSigner() {
    }

    /**
     * Lowercase hex HMAC-SHA256 of {@code data}.
     */
    public static String hmacSha256Hex(String secret, byte[] data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(data));
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    /**
     * Full header value, {@code sha256=<hex>}.
     */
    public static String signatureHeaderValue(String secret, byte[] data) {
        return SIGNATURE_PREFIX + hmacSha256Hex(secret, data);
    }

    /**
     * Verifies a {@code sha256=<hex>} header value against the body. Hex case
     * is ignored; the comparison is constant-time.
     */
    public static boolean verify(String secret, byte[] data, String headerValue) {
        if (secret == null || secret.isBlank() || headerValue == null
                || !headerValue.startsWith(SIGNATURE_PREFIX)) {
            return false;
        }
        String provided = headerValue.substring(SIGNATURE_PREFIX.length()).trim().toLowerCase(Locale.ROOT);
        return constantTimeEquals(hmacSha256Hex(secret, data), provided);
    }

    public static boolean constantTimeEquals(String expected, String provided) {
        if (expected == null || provided == null) {
            return false;
        }
        byte[] expectedBytes = expected.getBytes(StandardCharsets.UTF_8);
        byte[] providedBytes = provided.getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expectedBytes, providedBytes);
    }
}
