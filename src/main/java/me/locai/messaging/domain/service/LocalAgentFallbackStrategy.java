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
import me.locai.messaging.domain.model.AgentReply;
import me.locai.messaging.domain.model.AgentRequest;
import me.locai.messaging.domain.model.DeliveryResult;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelGateway;
import me.locai.messaging.security.LogMasking;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Fallback route: answer with the local conversation agent and send the reply
 * through the tenant's channel.
 *
 * <p>
 * The agent runs with its own budget ({@code locai.agent.fallback-timeout}),
 * skips rehydration and bypasses its own message-id check, since the ingress
 * already deduplicated the message. A non-empty reply is sent exactly once; an
 * empty one is dropped.
 */
@Component
@Slf4j
public class LocalAgentFallbackStrategy implements RoutingStrategy {

    static final String NAME = "local_agent";
    static final String REASON_SEND_FAILED = "send_failed";
    static final String REASON_AGENT_FAILED = "agent_failed";

    private final ConversationAgentService agentService;
    private final ChannelGateway channelGateway;
    private final Duration budget;

    public LocalAgentFallbackStrategy(ConversationAgentService agentService, ChannelGateway channelGateway,
            MessagingProperties properties) {
        this.agentService = agentService;
        this.channelGateway = channelGateway;
        this.budget = properties.getAgent().getFallbackTimeout();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public DeliveryResult deliver(MessageEvent event) {
        AgentReply reply;
        try {
            reply = agentService.processMessage(AgentRequest.builder()
                    .tenantId(event.tenantId())
                    .clientKey(event.from())
                    .text(event.text())
                    .messageId(event.messageId())
                    .bypassDeduplication(true)
                    .skipHeavyProcessing(true)
                    .budget(budget)
                    .build());
        } catch (RuntimeException e) {
            log.error("[Router] Local agent failed for message {}: {}", event.messageId(), e.getMessage());
            return DeliveryResult.failed(NAME, REASON_AGENT_FAILED);
        }

        if (!reply.hasReply()) {
            log.warn("[Router] Empty reply from local agent for client {}, nothing sent",
                    LogMasking.maskPhone(event.from()));
            return DeliveryResult.delivered(NAME, false);
        }

        try {
            String sentId = channelGateway.send(event.tenantId(), event.from(), reply.getReply());
            log.info("[Router] Fallback reply {} sent to {} ({} chars)", sentId, LogMasking.maskPhone(event.from()),
                    reply.getReply().length());
            return DeliveryResult.delivered(NAME, true);
        } catch (RuntimeException e) {
            log.error("[Router] Failed to send fallback reply to {}: {}", LogMasking.maskPhone(event.from()),
                    e.getMessage());
            return DeliveryResult.failed(NAME, REASON_SEND_FAILED);
        }
    }
}
