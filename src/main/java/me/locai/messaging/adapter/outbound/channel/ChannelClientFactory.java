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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.port.outbound.ChannelClientProvider;
import me.locai.messaging.port.outbound.ChannelGateway;
import me.locai.messaging.security.LogMasking;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the channel backend and caches one {@link ChannelClient} handle per
 * tenant.
 *
 * <p>
 * The backend is chosen by {@code locai.channel.backend}:
 * <ul>
 * <li>external - channel microservice over HTTP
 * <li>local - in-process loopback
 * </ul>
 *
 * <p>
 * Handles are created lazily with {@code computeIfAbsent}, so concurrent
 * callers for one tenant share a single handle. {@link #evict(String)} removes
 * the handle immediately; the next call creates a fresh one.
 *
 * @see MicroserviceChannelClientProvider
 * @see LoopbackChannelClientProvider
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ChannelClientFactory implements ChannelGateway {

    private final MessagingProperties properties;
    private final List<ChannelClientProvider> providers;

    private final Map<String, ChannelClientProvider> providersByBackend = new ConcurrentHashMap<>();
    private final Map<String, ChannelClient> handles = new ConcurrentHashMap<>();
    private ChannelClientProvider activeProvider;

    @PostConstruct
    public void init() {
        for (ChannelClientProvider provider : providers) {
            providersByBackend.put(provider.getBackendId(), provider);
            log.debug("Registered channel backend: {}", provider.getBackendId());
        }

        String backend = properties.getChannel().getBackend();
        activeProvider = providersByBackend.get(backend);
        if (activeProvider == null) {
            throw new IllegalStateException("Unknown channel backend '" + backend + "', expected one of "
                    + providersByBackend.keySet());
        }
        log.info("Active channel backend: {}", backend);
    }

    @Override
    public String getBackendId() {
        return activeProvider.getBackendId();
    }

    @Override
    public ChannelClient getClient(String tenantId) {
        return handles.computeIfAbsent(tenantId, id -> {
            log.debug("[Channel] Creating {} handle for tenant {}", activeProvider.getBackendId(),
                    LogMasking.maskTenant(id));
            return activeProvider.create(id);
        });
    }

    @Override
    public void evict(String tenantId) {
        if (handles.remove(tenantId) != null) {
            log.debug("[Channel] Evicted handle for tenant {}", LogMasking.maskTenant(tenantId));
        }
    }

    @Override
    public String send(String tenantId, String to, String text) {
        return getClient(tenantId).send(to, text);
    }
}
