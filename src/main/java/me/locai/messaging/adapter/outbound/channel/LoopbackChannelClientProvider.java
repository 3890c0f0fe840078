package me.locai.messaging.adapter.outbound.channel;

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

import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.BackendStatus;
import me.locai.messaging.domain.model.PairingResult;
import me.locai.messaging.port.outbound.ChannelBackendException;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.port.outbound.ChannelClientProvider;
import me.locai.messaging.security.LogMasking;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process channel backend for local development and tests.
 *
 * <p>
 * Keeps one simulated device session per tenant. A pairing attempt yields a
 * random pairing code; {@link #completePairing} plays the part of the user
 * scanning it. Sent messages are recorded in a per-tenant outbox instead of
 * leaving the process; the outbox keeps the latest {@value #OUTBOX_CAPACITY}.
 */
@Component
@Slf4j
public class LoopbackChannelClientProvider implements ChannelClientProvider {

    static final String BACKEND_ID = "local";
    static final int OUTBOX_CAPACITY = 100;

    private final Clock clock;
    private final Map<String, DeviceSession> devices = new ConcurrentHashMap<>();

    public LoopbackChannelClientProvider(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String getBackendId() {
        return BACKEND_ID;
    }

    @Override
    public ChannelClient create(String tenantId) {
        return new LoopbackChannelClient(tenantId);
    }

    /**
     * Simulates the user scanning the outstanding pairing code.
     *
     * @throws IllegalStateException
     *             if no pairing attempt is outstanding
     */
    public void completePairing(String tenantId, String phoneNumber, String businessName) {
        DeviceSession device = device(tenantId);
        synchronized (device) {
            if (device.pairingCode == null) {
                throw new IllegalStateException("No pairing attempt outstanding for tenant " + tenantId);
            }
            device.status = "connected";
            device.pairingCode = null;
            device.phoneNumber = phoneNumber;
            device.businessName = businessName;
        }
        log.info("[Loopback] Tenant {} paired", LogMasking.maskTenant(tenantId));
    }

    /**
     * Messages sent for the tenant, oldest first.
     */
    public List<SentMessage> outbox(String tenantId) {
        DeviceSession device = device(tenantId);
        synchronized (device) {
            return List.copyOf(device.outbox);
        }
    }

    private DeviceSession device(String tenantId) {
        return devices.computeIfAbsent(tenantId, id -> new DeviceSession());
    }

    public record SentMessage(String messageId, String to, String text, Instant sentAt) {
    }

    private static final class DeviceSession {
        private String status = "disconnected";
        private String pairingCode;
        private String phoneNumber;
        private String businessName;
        private final Deque<SentMessage> outbox = new ArrayDeque<>();
    }

    private final class LoopbackChannelClient implements ChannelClient {

        private final String tenantId;

        private LoopbackChannelClient(String tenantId) {
            this.tenantId = tenantId;
        }

        @Override
        public String getBackendId() {
            return BACKEND_ID;
        }

        @Override
        public String getTenantId() {
            return tenantId;
        }

        @Override
        public PairingResult initializeSession() {
            DeviceSession device = device(tenantId);
            synchronized (device) {
                if ("connected".equals(device.status)) {
                    return new PairingResult(null, device.status);
                }
                if (device.pairingCode == null) {
                    device.pairingCode = "locai-pair-" + UUID.randomUUID();
                }
                device.status = "qr_available";
                return new PairingResult(device.pairingCode, device.status);
            }
        }

        @Override
        public BackendStatus getConnectionStatus() {
            DeviceSession device = device(tenantId);
            synchronized (device) {
                return new BackendStatus("connected".equals(device.status), device.status, device.pairingCode,
                        device.phoneNumber, device.businessName);
            }
        }

        @Override
        public void disconnect() {
            DeviceSession device = device(tenantId);
            synchronized (device) {
                device.status = "disconnected";
                device.pairingCode = null;
                device.phoneNumber = null;
                device.businessName = null;
            }
        }

        @Override
        public String send(String to, String text) {
            String recipient = PhoneNumberFormatter.format(to);
            DeviceSession device = device(tenantId);
            synchronized (device) {
                if (!"connected".equals(device.status)) {
                    throw new ChannelBackendException("Tenant " + tenantId + " is not connected");
                }
                String messageId = "loopback-" + UUID.randomUUID();
                device.outbox.add(new SentMessage(messageId, recipient, text, clock.instant()));
                if (device.outbox.size() > OUTBOX_CAPACITY) {
                    device.outbox.removeFirst();
                }
                return messageId;
            }
        }
    }
}
