package me.locai.messaging.cache;

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

import me.locai.messaging.domain.model.SessionStatusView;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Short-lived cache of the dashboard status view per tenant.
 *
 * <p>
 * A view that carries a pairing code is kept for the pairing-code TTL instead
 * of the regular status TTL, so dashboard polls keep showing the same code
 * while the user scans it. Degraded (error) views are never cached.
 */
@Component
public class SessionStatusCache {

    private static final int MAX_TENANTS = 10_000;

    private final Duration statusTtl;
    private final Duration pairingTtl;
    private final ExpiringCache<String, SessionStatusView> views;

    public SessionStatusCache(MessagingProperties properties, Clock clock) {
        MessagingProperties.SessionProperties session = properties.getSession();
        this.statusTtl = session.getStatusTtl();
        this.pairingTtl = session.getPairingCodeTtl();
        this.views = new ExpiringCache<>(clock, statusTtl, MAX_TENANTS);
    }

    public Optional<SessionStatusView> get(String tenantId) {
        return views.get(tenantId);
    }

    public void put(String tenantId, SessionStatusView view) {
        if (view == null || "error".equals(view.getStatus())) {
            views.remove(tenantId);
            return;
        }
        boolean pairing = !view.isConnected() && view.getQrCode() != null && !view.getQrCode().isBlank();
        views.put(tenantId, view, pairing ? pairingTtl : statusTtl);
    }

    /**
     * Caches a pairing view only for what is left of its code's lifetime.
     */
    public void putPairing(String tenantId, SessionStatusView view, Duration remaining) {
        if (remaining.isNegative() || remaining.isZero()) {
            views.remove(tenantId);
            return;
        }
        views.put(tenantId, view, remaining.compareTo(pairingTtl) < 0 ? remaining : pairingTtl);
    }

    public void evict(String tenantId) {
        views.remove(tenantId);
    }
}
