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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.model.FunctionCall;
import me.locai.messaging.domain.model.FunctionResult;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.BusinessFunctionPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Resolves business function names to the port that serves them.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BusinessFunctionRegistry {

    private final List<BusinessFunctionPort> ports;
    private final MessagingProperties properties;

    /**
     * Configured function names that some port can actually serve, in
     * configuration order.
     */
    public List<String> availableFunctions() {
        return properties.getFunctions().getNames().stream()
                .filter(name -> ports.stream().anyMatch(port -> port.supports(name)))
                .toList();
    }

    /**
     * Executes the call on the first port that supports it. An unknown name
     * yields a failed result rather than an exception.
     */
    public CompletableFuture<FunctionResult> execute(String tenantId, FunctionCall call) {
        for (BusinessFunctionPort port : ports) {
            if (port.supports(call.name())) {
                return port.execute(tenantId, call.name(), call.arguments());
            }
        }
        log.warn("[Functions] No handler for function '{}'", call.name());
        return CompletableFuture.completedFuture(FunctionResult.failure(call.name(), "unsupported function"));
    }
}
