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

import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.BackendStatus;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelBackendException;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.security.LogMasking;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Polls the channel backend for a pairing code after a pairing attempt that
 * returned none.
 *
 * <p>
 * Polling stops at the first status that carries a pairing code or reports
 * the session connected, after {@code locai.session.poll-max-attempts}
 * attempts, or once {@code locai.session.poll-timeout} has passed, whichever
 * comes first. Backend errors during a poll count as an attempt.
 */
@Component
@Slf4j
public class PairingCodePoller {

    private final MessagingProperties.SessionProperties session;
    private final Clock clock;

    public PairingCodePoller(MessagingProperties properties, Clock clock) {
        this.session = properties.getSession();
        this.clock = clock;
    }

    /**
     * @return the first status with a pairing code or a connected session, or
     *         empty when polling gave up
     */
    public Optional<BackendStatus> poll(ChannelClient client) {
        Instant deadline = clock.instant().plus(session.getPollTimeout());
        Duration interval = session.getPollInterval();

        for (int attempt = 1; attempt <= session.getPollMaxAttempts(); attempt++) {
            if (!clock.instant().isBefore(deadline)) {
                log.debug("[Session] Pairing poll deadline reached after {} attempt(s)", attempt - 1);
                break;
            }
            try {
                BackendStatus status = client.getConnectionStatus();
                if (status.connected() || status.hasPairingCode()) {
                    log.debug("[Session] Pairing poll succeeded on attempt {} for tenant {}", attempt,
                            LogMasking.maskTenant(client.getTenantId()));
                    return Optional.of(status);
                }
            } catch (ChannelBackendException e) {
                log.debug("[Session] Pairing poll attempt {} failed: {}", attempt, e.getMessage());
            }

            if (attempt < session.getPollMaxAttempts() && !pause(interval, deadline)) {
                break;
            }
        }
        log.info("[Session] No pairing code after polling for tenant {}",
                LogMasking.maskTenant(client.getTenantId()));
        return Optional.empty();
    }

    private boolean pause(Duration interval, Instant deadline) {
        if (interval.isZero() || interval.isNegative()) {
            return true;
        }
        Duration remaining = Duration.between(clock.instant(), deadline);
        if (remaining.isZero() || remaining.isNegative()) {
            return false;
        }
        try {
            Thread.sleep(Math.min(interval.toMillis(), remaining.toMillis()));
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
