package me.locai.messaging.adapter.inbound.web.controller;

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
import me.locai.messaging.adapter.inbound.web.dto.AgentMessageRequest;
import me.locai.messaging.adapter.inbound.web.dto.AgentMessageResponse;
import me.locai.messaging.adapter.inbound.webhook.WebhookAuthenticator;
import me.locai.messaging.domain.model.AgentReply;
import me.locai.messaging.domain.model.AgentRequest;
import me.locai.messaging.domain.service.ConversationAgentService;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.security.LogMasking;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Direct access to the conversation agent, used by internal tools and tests.
 * Requires the webhook bearer token.
 */
@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
@Slf4j
public class AgentController {

    private final ConversationAgentService agentService;
    private final WebhookAuthenticator authenticator;
    private final MessagingProperties properties;

    @PostMapping
    public Mono<ResponseEntity<AgentMessageResponse>> process(
            @RequestBody AgentMessageRequest request,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            requireAuthenticated(headers);
            String clientKey = request.resolveClientKey();
            requireText(request.getTenantId(), "tenantId");
            requireText(clientKey, "clientKey");
            requireText(request.getMessage(), "message");

            AgentReply reply = agentService.processMessage(AgentRequest.builder()
                    .tenantId(request.getTenantId())
                    .clientKey(clientKey)
                    .text(request.getMessage().trim())
                    .messageId(request.getMessageId())
                    .budget(properties.getAgent().getRequestTimeout())
                    .build());
            log.info("[Agent] Direct turn for client {} finished (intent={}, fallback={})",
                    LogMasking.maskPhone(clientKey), reply.getIntent(), reply.isFallbackUsed());
            return ResponseEntity.ok(AgentMessageResponse.builder()
                    .success(true)
                    .data(reply)
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @DeleteMapping("/context")
    public Mono<ResponseEntity<AgentMessageResponse>> clearContext(
            @RequestParam String tenantId,
            @RequestParam String clientKey,
            @RequestHeader HttpHeaders headers) {

        return Mono.fromCallable(() -> {
            requireAuthenticated(headers);
            boolean cleared = agentService.clearContext(tenantId, clientKey);
            return ResponseEntity.ok(AgentMessageResponse.builder()
                    .success(true)
                    .cleared(cleared)
                    .build());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    private void requireAuthenticated(HttpHeaders headers) {
        if (!authenticator.authenticateBearer(headers)) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Unauthorized");
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
    }
}
