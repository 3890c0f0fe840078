package me.locai.messaging.adapter.outbound.completion;

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
import me.locai.messaging.domain.model.CompletionRequest;
import me.locai.messaging.domain.model.CompletionResult;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.CompletionPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the completion provider based on {@code locai.ai.provider}:
 * <ul>
 * <li>langchain4j - OpenAI-compatible chat model via langchain4j
 * <li>keyword - offline keyword classifier
 * </ul>
 *
 * <p>
 * When the configured provider is unknown or not available (no API key), the
 * keyword classifier is used so the agent keeps answering.
 *
 * @see Langchain4jCompletionAdapter
 * @see KeywordCompletionAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class CompletionAdapterFactory implements CompletionPort {

    private static final String PROVIDER_KEYWORD = KeywordCompletionAdapter.PROVIDER_ID;

    private final MessagingProperties properties;
    private final List<CompletionProviderAdapter> adapters;

    private final Map<String, CompletionProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private CompletionProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (CompletionProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("Registered completion adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getAi().getProvider();
        CompletionProviderAdapter configured = adaptersByProvider.get(provider);
        if (configured != null && configured.isAvailable()) {
            activeAdapter = configured;
            log.info("Active completion provider: {}", provider);
            return;
        }

        activeAdapter = adaptersByProvider.get(PROVIDER_KEYWORD);
        if (activeAdapter == null && !adapters.isEmpty()) {
            activeAdapter = adapters.get(0);
        }
        log.warn("Completion provider '{}' {}, using: {}", provider,
                configured == null ? "not found" : "not available",
                activeAdapter != null ? activeAdapter.getProviderId() : "none");
    }

    public CompletionPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : "none";
    }

    @Override
    public CompletableFuture<CompletionResult> classifyAndDispatch(CompletionRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No completion provider available"));
        }
        return activeAdapter.classifyAndDispatch(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
