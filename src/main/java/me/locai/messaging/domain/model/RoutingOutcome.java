package me.locai.messaging.domain.model;

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

import java.util.List;

/**
 * Every strategy attempt made for one inbound message, in order.
 *
 * @param duplicate
 *            the message was seen before and not routed again
 */
public record RoutingOutcome(String tenantId, String messageId, boolean duplicate, List<DeliveryResult> attempts) {

    public RoutingOutcome {
        attempts = List.copyOf(attempts);
    }

    public static RoutingOutcome duplicate(String tenantId, String messageId) {
        return new RoutingOutcome(tenantId, messageId, true, List.of());
    }

    public static RoutingOutcome routed(String tenantId, String messageId, List<DeliveryResult> attempts) {
        return new RoutingOutcome(tenantId, messageId, false, attempts);
    }

    public boolean isDelivered() {
        return attempts.stream().anyMatch(DeliveryResult::success);
    }

    public String deliveredBy() {
        return attempts.stream()
                .filter(DeliveryResult::success)
                .map(DeliveryResult::strategy)
                .findFirst()
                .orElse(null);
    }

    public boolean isReplySent() {
        return attempts.stream().anyMatch(DeliveryResult::replySent);
    }
}
