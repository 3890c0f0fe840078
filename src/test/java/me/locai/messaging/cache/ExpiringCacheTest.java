package me.locai.messaging.cache;

import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExpiringCacheTest {

    private MutableClock clock;
    private ExpiringCache<String, String> cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        cache = new ExpiringCache<>(clock, Duration.ofSeconds(10), 3);
    }

    @Test
    void shouldReturnValueBeforeExpiry() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(9));

        assertEquals(Optional.of("1"), cache.get("a"));
    }

    @Test
    void shouldExpireValueAtTtl() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(10));

        assertTrue(cache.get("a").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void shouldHonorPerEntryTtl() {
        cache.put("short", "1", Duration.ofSeconds(2));
        cache.put("long", "2", Duration.ofSeconds(30));
        clock.advance(Duration.ofSeconds(15));

        assertFalse(cache.containsKey("short"));
        assertTrue(cache.containsKey("long"));
    }

    @Test
    void shouldEvictLeastRecentlyUsedBeyondCapacity() {
        cache.put("a", "1");
        cache.put("b", "2");
        cache.put("c", "3");
        cache.get("a");
        cache.put("d", "4");

        assertTrue(cache.containsKey("a"));
        assertFalse(cache.containsKey("b"));
        assertTrue(cache.containsKey("c"));
        assertTrue(cache.containsKey("d"));
    }

    @Test
    void putIfAbsentShouldRejectLiveEntryAndAcceptExpiredOne() {
        assertTrue(cache.putIfAbsent("a", "1"));
        assertFalse(cache.putIfAbsent("a", "2"));

        clock.advance(Duration.ofSeconds(11));

        assertTrue(cache.putIfAbsent("a", "3"));
        assertEquals(Optional.of("3"), cache.get("a"));
    }

    @Test
    void shouldRefreshTtlOnAccessWhenConfigured() {
        ExpiringCache<String, String> idle = new ExpiringCache<>(clock, Duration.ofSeconds(10), 10, true);
        idle.put("a", "1");

        clock.advance(Duration.ofSeconds(8));
        assertTrue(idle.get("a").isPresent());
        clock.advance(Duration.ofSeconds(8));

        assertTrue(idle.get("a").isPresent());
    }

    @Test
    void computeIfAbsentShouldReuseLiveValue() {
        String first = cache.computeIfAbsent("a", k -> "created");
        String second = cache.computeIfAbsent("a", k -> "other");

        assertEquals("created", first);
        assertEquals("created", second);
    }

    @Test
    void purgeExpiredShouldDropOnlyExpiredEntries() {
        cache.put("a", "1", Duration.ofSeconds(1));
        cache.put("b", "2");
        clock.advance(Duration.ofSeconds(5));

        assertEquals(1, cache.purgeExpired());
        assertEquals(1, cache.size());
    }

    @Test
    void ageOfShouldMeasureFromWrite() {
        cache.put("a", "1");
        clock.advance(Duration.ofSeconds(4));

        assertEquals(Optional.of(Duration.ofSeconds(4)), cache.ageOf("a"));
        assertTrue(cache.ageOf("missing").isEmpty());
    }

    @Test
    void shouldRejectNonPositiveTtl() {
        assertThrows(IllegalArgumentException.class, () -> new ExpiringCache<>(clock, Duration.ZERO, 1));
    }
}
