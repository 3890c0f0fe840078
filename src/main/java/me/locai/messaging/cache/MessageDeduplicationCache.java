package me.locai.messaging.cache;

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

import me.locai.messaging.infrastructure.config.MessagingProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Records which inbound message ids were already processed, per tenant.
 *
 * <p>
 * Keys are {@code (tenantId, messageId)} pairs, so ids are never compared
 * across tenants. Entries expire after {@code locai.dedup.ttl}; the cache is
 * also size-bounded so a flood of unique ids cannot grow it without limit.
 *
 * <p>
 * The webhook path uses {@link #markIfNew(String, String)}, which checks and
 * marks atomically. {@link #isDuplicate} and {@link #markProcessed} are the
 * two-step form for callers that need to inspect first.
 */
@Component
@Slf4j
public class MessageDeduplicationCache {

    private final Clock clock;
    private final ExpiringCache<DedupKey, Instant> processed;

    public MessageDeduplicationCache(MessagingProperties properties, Clock clock) {
        this.clock = clock;
        MessagingProperties.DedupProperties dedup = properties.getDedup();
        this.processed = new ExpiringCache<>(clock, dedup.getTtl(), dedup.getMaxEntries());
    }

    public boolean isDuplicate(String tenantId, String messageId) {
        return processed.containsKey(new DedupKey(tenantId, messageId));
    }

    public void markProcessed(String tenantId, String messageId) {
        processed.put(new DedupKey(tenantId, messageId), clock.instant());
    }

    /**
     * Marks the message as processed unless it already was.
     *
     * @return {@code true} for a first sighting, {@code false} for a duplicate
     */
    public boolean markIfNew(String tenantId, String messageId) {
        boolean fresh = processed.putIfAbsent(new DedupKey(tenantId, messageId), clock.instant());
        if (!fresh) {
            log.debug("[Dedup] Duplicate message {} for tenant {}", messageId, tenantId);
        }
        return fresh;
    }

    /**
     * Drops a mark so that a redelivery of the message gets processed. Used when
     * processing could not start at all.
     */
    public void forget(String tenantId, String messageId) {
        processed.remove(new DedupKey(tenantId, messageId));
    }

    public int purgeExpired() {
        return processed.purgeExpired();
    }

    record DedupKey(String tenantId, String messageId) {
    }
}
