package me.locai.messaging.cache;

import me.locai.messaging.domain.model.SessionStatusView;
import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionStatusCacheTest {

    private static final String TENANT = "tenant-a";

    private MutableClock clock;
    private SessionStatusCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        MessagingProperties properties = new MessagingProperties();
        properties.getSession().setStatusTtl(Duration.ofSeconds(5));
        properties.getSession().setPairingCodeTtl(Duration.ofSeconds(60));
        cache = new SessionStatusCache(properties, clock);
    }

    @Test
    void shouldExpirePlainStatusAfterStatusTtl() {
        cache.put(TENANT, SessionStatusView.builder().connected(true).status("connected").build());
        clock.advance(Duration.ofSeconds(4));
        assertTrue(cache.get(TENANT).isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get(TENANT).isEmpty());
    }

    @Test
    void shouldKeepPairingViewForPairingTtl() {
        cache.put(TENANT, SessionStatusView.builder().status("pairing_pending").qrCode("code-1").build());
        clock.advance(Duration.ofSeconds(30));

        assertEquals("code-1", cache.get(TENANT).orElseThrow().getQrCode());
    }

    @Test
    void shouldNeverCacheErrorView() {
        cache.put(TENANT, SessionStatusView.builder().status("connected").connected(true).build());
        cache.put(TENANT, SessionStatusView.degraded("Channel backend unavailable"));

        assertTrue(cache.get(TENANT).isEmpty());
    }

    @Test
    void putPairingShouldCapTtlAtRemainingLifetime() {
        SessionStatusView view = SessionStatusView.builder().status("pairing_pending").qrCode("code-1").build();
        cache.putPairing(TENANT, view, Duration.ofSeconds(10));

        clock.advance(Duration.ofSeconds(10));

        assertTrue(cache.get(TENANT).isEmpty());
    }

    @Test
    void putPairingShouldEvictWhenNothingRemains() {
        cache.put(TENANT, SessionStatusView.builder().status("connecting").build());
        cache.putPairing(TENANT, SessionStatusView.builder().qrCode("x").build(), Duration.ZERO);

        assertTrue(cache.get(TENANT).isEmpty());
    }
}
