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
import me.locai.messaging.cache.MessageDeduplicationCache;
import me.locai.messaging.domain.model.DeliveryResult;
import me.locai.messaging.domain.model.MessageEvent;
import me.locai.messaging.domain.model.RoutingOutcome;
import me.locai.messaging.security.LogMasking;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Routes inbound client messages through an ordered list of strategies: the
 * external workflow engine first, the local agent second. The first strategy
 * that succeeds ends the route.
 *
 * <p>
 * A message is marked in the deduplication cache before anything else, so a
 * redelivery is dropped even while the first delivery is still running. The
 * route then runs inside the client's lane, which serializes routing and
 * replies for one client. If the lane cannot be acquired the mark is removed
 * and {@link LaneUnavailableException} propagates, so the channel backend's
 * retry gets processed.
 */
@Service
@Slf4j
public class InboundMessageRouter {

    private final MessageDeduplicationCache deduplicationCache;
    private final ConversationAgentService agentService;
    private final List<RoutingStrategy> strategies;

    @Autowired
    public InboundMessageRouter(MessageDeduplicationCache deduplicationCache, ConversationAgentService agentService,
            WorkflowEngineStrategy workflowStrategy, LocalAgentFallbackStrategy fallbackStrategy) {
        this(deduplicationCache, agentService, List.of(workflowStrategy, fallbackStrategy));
    }

    InboundMessageRouter(MessageDeduplicationCache deduplicationCache, ConversationAgentService agentService,
            List<RoutingStrategy> strategies) {
        this.deduplicationCache = deduplicationCache;
        this.agentService = agentService;
        this.strategies = List.copyOf(strategies);
    }

    /**
     * Deduplicates and routes one message.
     *
     * @throws LaneUnavailableException
     *             if the client's lane stayed busy past the lane timeout
     */
    public RoutingOutcome dispatch(MessageEvent event) {
        if (!deduplicationCache.markIfNew(event.tenantId(), event.messageId())) {
            log.info("[Router] Message {} for tenant {} already processed, skipping", event.messageId(),
                    LogMasking.maskTenant(event.tenantId()));
            return RoutingOutcome.duplicate(event.tenantId(), event.messageId());
        }

        try {
            return agentService.inLane(event.tenantId(), event.from(), () -> route(event));
        } catch (LaneUnavailableException e) {
            deduplicationCache.forget(event.tenantId(), event.messageId());
            log.warn("[Router] Could not start processing message {}: {}", event.messageId(), e.getMessage());
            throw e;
        }
    }

    private RoutingOutcome route(MessageEvent event) {
        List<DeliveryResult> attempts = new ArrayList<>();
        for (RoutingStrategy strategy : strategies) {
            DeliveryResult result = strategy.deliver(event);
            attempts.add(result);
            if (result.success()) {
                break;
            }
            log.info("[Router] Strategy {} failed for message {} ({}), trying next", strategy.getName(),
                    event.messageId(), result.reason());
        }

        RoutingOutcome outcome = RoutingOutcome.routed(event.tenantId(), event.messageId(), attempts);
        if (outcome.isDelivered()) {
            log.info("[Router] Message {} handled by {}", event.messageId(), outcome.deliveredBy());
        } else {
            log.error("[Router] Message {} for tenant {} could not be handled by any strategy: {}",
                    event.messageId(), LogMasking.maskTenant(event.tenantId()), attempts);
        }
        return outcome;
    }
}
