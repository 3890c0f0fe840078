package me.locai.messaging.adapter.outbound.channel;

import me.locai.messaging.infrastructure.config.MessagingProperties;
import me.locai.messaging.port.outbound.ChannelClient;
import me.locai.messaging.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChannelClientFactoryTest {

    private MessagingProperties properties;
    private LoopbackChannelClientProvider loopback;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        properties.getChannel().setBackend("local");
        loopback = new LoopbackChannelClientProvider(MutableClock.startingAt("2026-01-01T10:00:00Z"));
    }

    @Test
    void shouldReuseHandlePerTenantUntilEvicted() {
        ChannelClientFactory factory = new ChannelClientFactory(properties, List.of(loopback));
        factory.init();

        ChannelClient first = factory.getClient("tenant-a");

        assertSame(first, factory.getClient("tenant-a"));
        assertNotSame(first, factory.getClient("tenant-b"));

        factory.evict("tenant-a");
        assertNotSame(first, factory.getClient("tenant-a"));
        assertEquals("local", factory.getBackendId());
    }

    @Test
    void shouldFailFastOnUnknownBackend() {
        properties.getChannel().setBackend("carrier-pigeon");
        ChannelClientFactory factory = new ChannelClientFactory(properties, List.of(loopback));

        assertThrows(IllegalStateException.class, factory::init);
    }

    @Test
    void shouldSendThroughLoopbackOncePaired() {
        ChannelClientFactory factory = new ChannelClientFactory(properties, List.of(loopback));
        factory.init();
        String code = factory.getClient("tenant-a").initializeSession().pairingCode();
        assertNotNull(code);

        loopback.completePairing("tenant-a", "+5511988887777", "Casa Praia");
        factory.send("tenant-a", "11 99999-0000", "Hello!");

        List<LoopbackChannelClientProvider.SentMessage> outbox = loopback.outbox("tenant-a");
        assertEquals(1, outbox.size());
        assertEquals("+5511999990000", outbox.get(0).to());
        assertTrue(factory.getClient("tenant-a").getConnectionStatus().connected());
    }

    @Test
    void shouldKeepOnlyLatestMessagesInLoopbackOutbox() {
        ChannelClientFactory factory = new ChannelClientFactory(properties, List.of(loopback));
        factory.init();
        factory.getClient("tenant-a").initializeSession();
        loopback.completePairing("tenant-a", "+5511988887777", "Casa Praia");

        int sent = LoopbackChannelClientProvider.OUTBOX_CAPACITY + 25;
        for (int i = 0; i < sent; i++) {
            factory.send("tenant-a", "11 99999-0000", "message " + i);
        }

        List<LoopbackChannelClientProvider.SentMessage> outbox = loopback.outbox("tenant-a");
        assertEquals(LoopbackChannelClientProvider.OUTBOX_CAPACITY, outbox.size());
        assertEquals("message 25", outbox.get(0).text());
        assertEquals("message " + (sent - 1), outbox.get(outbox.size() - 1).text());
    }
}
