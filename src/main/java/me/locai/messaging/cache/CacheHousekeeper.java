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

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.locai.messaging.domain.service.ConversationAgentService;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodically purges expired entries from the in-memory caches. Lookups
 * already ignore expired entries; this only reclaims their memory.
 */
@Component
@Slf4j
public class CacheHousekeeper {

    private static final long PERIOD_SECONDS = 60;

    private final MessageDeduplicationCache deduplicationCache;
    private final ConversationAgentService agentService;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "cache-housekeeping");
        t.setDaemon(true);
        return t;
    });

    public CacheHousekeeper(MessageDeduplicationCache deduplicationCache, ConversationAgentService agentService) {
        this.deduplicationCache = deduplicationCache;
        this.agentService = agentService;
    }

    @PostConstruct
    void start() {
        scheduler.scheduleAtFixedRate(this::purge, PERIOD_SECONDS, PERIOD_SECONDS, TimeUnit.SECONDS);
    }

    void purge() {
        try {
            int dedup = deduplicationCache.purgeExpired();
            int contexts = agentService.purgeIdleContexts();
            if (dedup > 0 || contexts > 0) {
                log.debug("[Cache] Purged {} dedup entries and {} idle contexts", dedup, contexts);
            }
        } catch (RuntimeException e) {
            // an exception would cancel the schedule
            log.warn("[Cache] Housekeeping failed", e);
        }
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
        try {
            scheduler.awaitTermination(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
