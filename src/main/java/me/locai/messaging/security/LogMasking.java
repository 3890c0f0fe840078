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

/**
 * Masks identifiers before they reach the logs.
 */
public final class LogMasking {

    private static final int VISIBLE_SUFFIX = 4;

    private LogMasking() {
    }

    /**
     * Keeps the last four characters of a phone number,
     * {@code +5511999998888 -> ***8888}.
     */
    public static String maskPhone(String phone) {
        if (phone == null || phone.isBlank()) {
            return "<none>";
        }
        String trimmed = phone.trim();
        if (trimmed.length() <= VISIBLE_SUFFIX) {
            return "***";
        }
        return "***" + trimmed.substring(trimmed.length() - VISIBLE_SUFFIX);
    }

    /**
     * Keeps a short prefix of a tenant id, which is enough to correlate lines.
     */
    public static String maskTenant(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return "<none>";
        }
        if (tenantId.length() <= 6) {
            return tenantId;
        }
        return tenantId.substring(0, 6) + "…";
    }
}
