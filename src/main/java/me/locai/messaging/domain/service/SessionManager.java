package me.locai.messaging.domain.service;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.cache.SessionStatusCache;
import me.locai.messaging.domain.model.BackendStatus;
import me.locai.messaging.domain.model.ChannelEvent;
import me.locai.messaging.domain.model.PairingCodeEvent;
import me.locai.messaging.domain.model.PairingResult;
import me.locai.messaging.domain.model.SessionStatus;
import me.locai.messaging.domain.model.SessionStatusView;
import me.locai.messaging.domain.model.StatusChangeEvent;
import me.locai.messaging.domain.model.TenantSession;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.port.outbound.ChannelGateway;
import me.locai.messaging.port.outbound.DocumentStorePort;
import me.locai.messaging.security.LogMasking;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns every tenant's {@link TenantSession} and drives the pairing lifecycle
 * against the channel backend.
 *
 * <p>
 * Each session is guarded by its own monitor, so tenants never wait on each
 * other. Backend calls are made outside the monitor; the
 * {@code initInProgress} flag keeps a second pairing attempt from starting
 * while one is running.
 *
 * <p>
 * None of the public operations throw on backend failure. They answer with a
 * degraded {@link SessionStatusView} instead.
 */
@Service
@Slf4j
public class SessionManager {

    static final String COLLECTION = "sessions";

    private static final long SNAPSHOT_LOAD_TIMEOUT_MS = 2000;

    private final ChannelGateway channelGateway;
    private final PairingCodePoller pairingCodePoller;
    private final SessionStatusCache statusCache;
    private final DocumentStorePort documentStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration initCooldown;
    private final Duration pairingCodeTtl;

    private final Map<String, TenantSession> sessions = new ConcurrentHashMap<>();

    public SessionManager(ChannelGateway channelGateway, PairingCodePoller pairingCodePoller,
            SessionStatusCache statusCache, DocumentStorePort documentStore, ObjectMapper objectMapper,
            MessagingProperties properties, Clock clock) {
        this.channelGateway = channelGateway;
        this.pairingCodePoller = pairingCodePoller;
        this.statusCache = statusCache;
        this.documentStore = documentStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.initCooldown = properties.getSession().getInitCooldown();
        this.pairingCodeTtl = properties.getSession().getPairingCodeTtl();
    }

    /**
     * Starts pairing for the tenant unless an attempt is already running,
     * the session is connected, or a pairing code is still valid.
     */
    public SessionStatusView initializeSession(String tenantId) {
        TenantSession session = session(tenantId);
        synchronized (session) {
            Instant now = clock.instant();
            if (session.isInitCoolingDown(now, initCooldown)) {
                log.info("[Session] Init already in progress for tenant {}, returning cached status",
                        LogMasking.maskTenant(tenantId));
                return statusCache.get(tenantId).orElseGet(session::toView);
            }
            if (session.isConnected()) {
                return session.toView();
            }
            if (session.hasFreshPairingCode(now, pairingCodeTtl)) {
                log.debug("[Session] Reusing pairing code for tenant {}", LogMasking.maskTenant(tenantId));
                return session.toView();
            }
            if (startedWithinCooldown(session, now) && session.getStatus().isPairing()) {
                log.info("[Session] Pairing attempt for tenant {} started {}s ago, not retrying yet",
                        LogMasking.maskTenant(tenantId),
                        Duration.between(session.getInitStartedAt(), now).toSeconds());
                return session.toView();
            }
            beginAttempt(session, now);
        }

        try {
            ChannelClient client = channelGateway.getClient(tenantId);
            PairingResult result = client.initializeSession();
            BackendStatus observed = resolveInitResult(client, result);
            synchronized (session) {
                if (observed != null) {
                    applyObserved(session, observed, clock.instant());
                }
                SessionStatusView view = session.toView();
                cache(session, view);
                persist(session);
                log.info("[Session] Init for tenant {} finished with status {}", LogMasking.maskTenant(tenantId),
                        view.getStatus());
                return view;
            }
        } catch (RuntimeException e) {
            log.warn("[Session] Init failed for tenant {}: {}", LogMasking.maskTenant(tenantId), e.getMessage());
            synchronized (session) {
                session.setLastError(e.getMessage());
                session.transitionTo(SessionStatus.ERROR, clock.instant());
                statusCache.evict(tenantId);
                persist(session);
            }
            return SessionStatusView.degraded("Failed to initialize session: " + e.getMessage());
        } finally {
            synchronized (session) {
                session.setInitInProgress(false);
            }
        }
    }

    /**
     * Current status for the dashboard, served from the status cache when
     * fresh.
     */
    public SessionStatusView getStatus(String tenantId) {
        Optional<SessionStatusView> cached = statusCache.get(tenantId);
        if (cached.isPresent()) {
            return cached.get();
        }

        TenantSession session = session(tenantId);
        synchronized (session) {
            if (session.isInitCoolingDown(clock.instant(), initCooldown)) {
                return session.toView();
            }
        }

        try {
            BackendStatus status = channelGateway.getClient(tenantId).getConnectionStatus();
            synchronized (session) {
                applyObserved(session, status, clock.instant());
                SessionStatusView view = session.toView();
                cache(session, view);
                persist(session);
                return view;
            }
        } catch (RuntimeException e) {
            log.warn("[Session] Status check failed for tenant {}: {}", LogMasking.maskTenant(tenantId),
                    e.getMessage());
            return SessionStatusView.degraded("Channel backend unavailable");
        }
    }

    /**
     * Tears the session down. Backend failures are logged and ignored; the
     * local state is reset regardless.
     */
    public SessionStatusView disconnect(String tenantId) {
        try {
            channelGateway.getClient(tenantId).disconnect();
        } catch (RuntimeException e) {
            log.warn("[Session] Backend disconnect failed for tenant {}: {}", LogMasking.maskTenant(tenantId),
                    e.getMessage());
        }
        channelGateway.evict(tenantId);
        statusCache.evict(tenantId);

        TenantSession session = session(tenantId);
        synchronized (session) {
            session.clearPairingCode();
            session.setPhoneNumber(null);
            session.setDisplayName(null);
            session.setLastError(null);
            session.setInitInProgress(false);
            session.transitionTo(SessionStatus.DISCONNECTED, clock.instant());
            persist(session);
            log.info("[Session] Tenant {} disconnected", LogMasking.maskTenant(tenantId));
            return session.toView();
        }
    }

    /**
     * Applies a status-change or pairing-code event pushed by the channel
     * backend.
     */
    public void applyChannelEvent(ChannelEvent event) {
        TenantSession session = session(event.tenantId());
        synchronized (session) {
            Instant now = clock.instant();
            if (event instanceof StatusChangeEvent statusChange) {
                boolean connected = "connected".equalsIgnoreCase(statusChange.status());
                applyObserved(session, new BackendStatus(connected, statusChange.status(), null,
                        statusChange.phoneNumber(), statusChange.businessName()), now);
            } else if (event instanceof PairingCodeEvent pairing) {
                if (session.offerPairingCode(pairing.pairingCode(), now, pairingCodeTtl)) {
                    if (session.getStatus() != SessionStatus.SCANNING) {
                        session.observe(SessionStatus.PAIRING_PENDING, now);
                    }
                } else {
                    log.debug("[Session] Keeping outstanding pairing code for tenant {}",
                            LogMasking.maskTenant(event.tenantId()));
                }
            } else {
                return;
            }
            cache(session, session.toView());
            persist(session);
            log.info("[Session] Tenant {} is now {}", LogMasking.maskTenant(event.tenantId()),
                    session.getStatus().getWireName());
        }
    }

    /**
     * Copy of the tenant's session state, for diagnostics and tests.
     */
    public TenantSession snapshot(String tenantId) {
        TenantSession session = session(tenantId);
        synchronized (session) {
            return session.copy();
        }
    }

    private boolean startedWithinCooldown(TenantSession session, Instant now) {
        return session.getInitStartedAt() != null && now.isBefore(session.getInitStartedAt().plus(initCooldown));
    }

    private void beginAttempt(TenantSession session, Instant now) {
        if (session.getStatus() == SessionStatus.ERROR) {
            session.setLastError(null);
            session.transitionTo(SessionStatus.DISCONNECTED, now);
        }
        session.clearPairingCode();
        if (session.getStatus() == SessionStatus.DISCONNECTED) {
            session.transitionTo(SessionStatus.CONNECTING, now);
        }
        session.setInitInProgress(true);
        session.setInitStartedAt(now);
        statusCache.evict(session.getTenantId());
        log.info("[Session] Starting pairing attempt for tenant {}", LogMasking.maskTenant(session.getTenantId()));
    }

    private BackendStatus resolveInitResult(ChannelClient client, PairingResult result) {
        if (result.isConnected()) {
            return new BackendStatus(true, "connected", null, null, null);
        }
        if (result.hasPairingCode()) {
            return new BackendStatus(false, "qr_available", result.pairingCode(), null, null);
        }
        return pairingCodePoller.poll(client).orElse(null);
    }

    /**
     * Applies backend-reported state. An outstanding pairing code younger than
     * its TTL survives any report short of a connection or an error.
     */
    private void applyObserved(TenantSession session, BackendStatus status, Instant now) {
        SessionStatus mapped = status.toSessionStatus();
        if (mapped == SessionStatus.CONNECTED) {
            session.observe(SessionStatus.CONNECTED, now);
            session.clearPairingCode();
            if (status.phoneNumber() != null) {
                session.setPhoneNumber(status.phoneNumber());
            }
            if (status.businessName() != null) {
                session.setDisplayName(status.businessName());
            }
            return;
        }
        if (mapped == SessionStatus.ERROR) {
            session.setLastError("Channel backend reported an error");
            session.observe(SessionStatus.ERROR, now);
            return;
        }

        session.offerPairingCode(status.pairingCode(), now, pairingCodeTtl);
        boolean codeStillValid = session.hasFreshPairingCode(now, pairingCodeTtl)
                || (status.hasPairingCode() && status.pairingCode().equals(session.getPairingCode()));
        if (codeStillValid) {
            session.observe(mapped == SessionStatus.SCANNING ? SessionStatus.SCANNING
                    : SessionStatus.PAIRING_PENDING, now);
            return;
        }

        session.clearPairingCode();
        if (mapped == SessionStatus.DISCONNECTED && session.isInitInProgress()) {
            // the backend has not registered the attempt yet
            return;
        }
        session.observe(mapped, now);
        if (mapped == SessionStatus.DISCONNECTED) {
            session.setPhoneNumber(null);
            session.setDisplayName(null);
        }
    }

    private void cache(TenantSession session, SessionStatusView view) {
        String tenantId = session.getTenantId();
        if (view.getQrCode() != null && session.getPairingGeneratedAt() != null) {
            Duration remaining = Duration.between(clock.instant(),
                    session.getPairingGeneratedAt().plus(pairingCodeTtl));
            statusCache.putPairing(tenantId, view, remaining);
        } else {
            statusCache.put(tenantId, view);
        }
    }

    private TenantSession session(String tenantId) {
        TenantSession existing = sessions.get(tenantId);
        if (existing != null) {
            return existing;
        }
        TenantSession loaded = loadSnapshot(tenantId).orElseGet(() -> TenantSession.create(tenantId, clock.instant()));
        TenantSession raced = sessions.putIfAbsent(tenantId, loaded);
        return raced != null ? raced : loaded;
    }

    private Optional<TenantSession> loadSnapshot(String tenantId) {
        try {
            String json = documentStore.getDocument(COLLECTION, tenantId)
                    .get(SNAPSHOT_LOAD_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            if (json == null) {
                return Optional.empty();
            }
            TenantSession restored = objectMapper.readValue(json, TenantSession.class);
            restored.setTenantId(tenantId);
            restored.setInitInProgress(false);
            log.debug("[Session] Restored snapshot for tenant {}", LogMasking.maskTenant(tenantId));
            return Optional.of(restored);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException | TimeoutException | JsonProcessingException | RuntimeException e) {
            log.warn("[Session] Could not restore snapshot for tenant {}: {}", LogMasking.maskTenant(tenantId),
                    e.getMessage());
            return Optional.empty();
        }
    }

    private void persist(TenantSession session) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            log.warn("[Session] Failed to serialize session {}: {}", LogMasking.maskTenant(session.getTenantId()),
                    e.getMessage());
            return;
        }
        documentStore.putDocument(COLLECTION, session.getTenantId(), json)
                .exceptionally(e -> {
                    log.warn("[Session] Failed to persist session {}: {}",
                            LogMasking.maskTenant(session.getTenantId()), e.getMessage());
                    return null;
                });
    }
}
