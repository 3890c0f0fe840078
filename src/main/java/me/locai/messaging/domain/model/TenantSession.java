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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * Pairing/connection state of one tenant's channel session.
 *
 * <p>
 * One instance exists per tenant. It is created on the first status or init
 * call and is never deleted; a disconnect moves it back to
 * {@link SessionStatus#DISCONNECTED}. Instances are mutated only by the session
 * manager while holding the instance monitor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TenantSession {

    private String tenantId;

    @Builder.Default
    private SessionStatus status = SessionStatus.DISCONNECTED;

    private String pairingCode;
    private Instant pairingGeneratedAt;
    private String phoneNumber;
    private String displayName;
    private Instant lastActivityAt;

    private boolean initInProgress;
    private Instant initStartedAt;

    private String lastError;

    public static TenantSession create(String tenantId, Instant now) {
        return TenantSession.builder()
                .tenantId(tenantId)
                .lastActivityAt(now)
                .build();
    }

    /**
     * Applies a locally initiated transition.
     *
     * @throws IllegalStateException
     *             if the lifecycle does not allow it
     */
    public void transitionTo(SessionStatus target, Instant now) {
        if (!status.canTransitionTo(target)) {
            throw new IllegalStateException("Invalid session transition " + status.getWireName()
                    + " -> " + target.getWireName() + " for tenant " + tenantId);
        }
        status = target;
        lastActivityAt = now;
    }

    /**
     * Applies a state reported by the channel backend. The backend is the source
     * of truth, so no transition check is made.
     */
    public void observe(SessionStatus observed, Instant now) {
        status = observed;
        lastActivityAt = now;
        if (observed != SessionStatus.ERROR) {
            lastError = null;
        }
    }

    /**
     * Whether a pairing code is outstanding and younger than the given TTL.
     */
    public boolean hasFreshPairingCode(Instant now, Duration ttl) {
        return pairingCode != null && !pairingCode.isBlank() && pairingGeneratedAt != null
                && now.isBefore(pairingGeneratedAt.plus(ttl));
    }

    /**
     * Offers a pairing code reported by the backend. An outstanding code younger
     * than {@code ttl} is kept even if the backend reports a different one, so a
     * user mid-scan is not invalidated.
     *
     * @return {@code true} if the offered code is now the stored one
     */
    public boolean offerPairingCode(String code, Instant now, Duration ttl) {
        if (code == null || code.isBlank()) {
            return false;
        }
        if (code.equals(pairingCode)) {
            return true;
        }
        if (hasFreshPairingCode(now, ttl)) {
            return false;
        }
        pairingCode = code;
        pairingGeneratedAt = now;
        return true;
    }

    /**
     * Clears the pairing code once it was consumed or the session was torn down.
     */
    public void clearPairingCode() {
        pairingCode = null;
        pairingGeneratedAt = null;
    }

    /**
     * Whether an init attempt is running and started within the cooldown.
     */
    public boolean isInitCoolingDown(Instant now, Duration cooldown) {
        return initInProgress && initStartedAt != null && now.isBefore(initStartedAt.plus(cooldown));
    }

    @JsonIgnore
    public boolean isConnected() {
        return status == SessionStatus.CONNECTED;
    }

    public SessionStatusView toView() {
        return SessionStatusView.builder()
                .connected(isConnected())
                .status(status.getWireName())
                .phoneNumber(phoneNumber)
                .businessName(displayName)
                .qrCode(isConnected() ? null : pairingCode)
                .message(status == SessionStatus.ERROR ? lastError : null)
                .build();
    }

    public TenantSession copy() {
        return toBuilder().build();
    }

    private TenantSessionBuilder toBuilder() {
        return TenantSession.builder()
                .tenantId(tenantId)
                .status(status)
                .pairingCode(pairingCode)
                .pairingGeneratedAt(pairingGeneratedAt)
                .phoneNumber(phoneNumber)
                .displayName(displayName)
                .lastActivityAt(lastActivityAt)
                .initInProgress(initInProgress)
                .initStartedAt(initStartedAt)
                .lastError(lastError);
    }
}
