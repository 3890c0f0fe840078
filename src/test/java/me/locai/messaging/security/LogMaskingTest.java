package me.locai.messaging.security;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LogMaskingTest {

    @Test
    void shouldKeepLastFourDigitsOfPhone() {
        assertEquals("***8888", LogMasking.maskPhone("+5511999998888"));
        assertEquals("***", LogMasking.maskPhone("123"));
        assertEquals("<none>", LogMasking.maskPhone(null));
    }

    @Test
    void shouldShortenLongTenantIds() {
        assertEquals("tenant…", LogMasking.maskTenant("tenant-0042-abcdef"));
        assertEquals("t1", LogMasking.maskTenant("t1"));
        assertEquals("<none>", LogMasking.maskTenant(" "));
    }
}
