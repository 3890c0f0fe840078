package me.locai.messaging.cache;

import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class MessageDeduplicationCacheTest {

    private MutableClock clock;
    private MessageDeduplicationCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        MessagingProperties properties = new MessagingProperties();
        properties.getDedup().setTtl(Duration.ofMinutes(5));
        cache = new MessageDeduplicationCache(properties, clock);
    }

    @Test
    void shouldDetectRepeatedMessageId() {
        assertTrue(cache.markIfNew("tenant-a", "wamid.1"));
        assertFalse(cache.markIfNew("tenant-a", "wamid.1"));
        assertTrue(cache.isDuplicate("tenant-a", "wamid.1"));
    }

    @Test
    void shouldScopeMessageIdsPerTenant() {
        cache.markProcessed("tenant-a", "wamid.1");

        assertFalse(cache.isDuplicate("tenant-b", "wamid.1"));
        assertTrue(cache.markIfNew("tenant-b", "wamid.1"));
    }

    @Test
    void shouldForgetMessageAfterTtl() {
        cache.markProcessed("tenant-a", "wamid.1");
        clock.advance(Duration.ofMinutes(5));

        assertFalse(cache.isDuplicate("tenant-a", "wamid.1"));
    }

    @Test
    void forgetShouldAllowRedelivery() {
        cache.markIfNew("tenant-a", "wamid.1");
        cache.forget("tenant-a", "wamid.1");

        assertTrue(cache.markIfNew("tenant-a", "wamid.1"));
    }

    @Test
    void purgeExpiredShouldCountExpiredMarks() {
        cache.markProcessed("tenant-a", "wamid.1");
        cache.markProcessed("tenant-a", "wamid.2");
        clock.advance(Duration.ofMinutes(6));

        assertEquals(2, cache.purgeExpired());
    }
}
