package me.locai.messaging.domain.model;

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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle of a tenant's paired channel session.
 *
 * <pre>
 * disconnected → connecting → pairing_pending → scanning → connected
 * error ← (any)        error → disconnected (retry)
 * connected → disconnected (explicit disconnect or drop)
 * </pre>
 */
public enum SessionStatus {

    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    PAIRING_PENDING("pairing_pending"),
    SCANNING("scanning"),
    CONNECTED("connected"),
    ERROR("error");

    private final String wireName;

    SessionStatus(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Checks whether a locally initiated transition is allowed. Every state may
     * move to {@link #ERROR}.
     */
    public boolean canTransitionTo(SessionStatus target) {
        if (target == ERROR || target == this) {
            return true;
        }
        return allowedTargets().contains(target);
    }

    /**
     * Whether the session is somewhere between starting a pairing attempt and
     * being connected.
     */
    public boolean isPairing() {
        return this == CONNECTING || this == PAIRING_PENDING || this == SCANNING;
    }

    private Set<SessionStatus> allowedTargets() {
        return switch (this) {
        case DISCONNECTED -> EnumSet.of(CONNECTING);
        case CONNECTING -> EnumSet.of(PAIRING_PENDING, SCANNING, CONNECTED, DISCONNECTED);
        case PAIRING_PENDING -> EnumSet.of(SCANNING, CONNECTED, DISCONNECTED);
        case SCANNING -> EnumSet.of(CONNECTED, PAIRING_PENDING, DISCONNECTED);
        case CONNECTED -> EnumSet.of(DISCONNECTED);
        case ERROR -> EnumSet.of(DISCONNECTED);
        };
    }

    /**
     * Maps the status vocabulary used by channel backends onto the lifecycle.
     * Unknown or missing values map to {@link #DISCONNECTED}.
     */
    public static SessionStatus fromBackend(String raw, boolean connected, boolean hasPairingCode) {
        if (connected) {
            return CONNECTED;
        }
        String normalized = raw != null ? raw.trim().toLowerCase(Locale.ROOT) : "";
        return switch (normalized) {
        case "connected", "open" -> CONNECTED;
        case "connecting", "initializing", "starting" -> hasPairingCode ? PAIRING_PENDING : CONNECTING;
        case "qr", "qr_available", "qr_code", "pairing", "pairing_pending" -> PAIRING_PENDING;
        case "scanning", "authenticating", "syncing" -> SCANNING;
        case "error", "failed" -> ERROR;
        default -> hasPairingCode ? PAIRING_PENDING : DISCONNECTED;
        };
    }
}
