package org.sessionsync;

import org.junit.jupiter.api.Test;
import org.sessionsync.interfaces.ExpiryPolicy;
import org.sessionsync.util.FixedTtlPolicy;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class FixedTtlPolicyTest {

    @Test
    void ttlAndExpiry() {
        ExpiryPolicy p = new FixedTtlPolicy(30_000L);
        long now = 1_000_000L;
        assertTrue(p.isExpired(0L, now));                   // old
        assertFalse(p.isExpired(now - 1000, now));          // fresh
        assertTrue(p.isExpired(now - 30_000, now));         // exactly at ttl
        assertTrue(p.isExpired(now - 31_000, now));         // expired
        assertEquals(30_000L, p.ttlMs());
    }

    @Test
    void epochZeroIsAnOrdinaryInstant() {
        ExpiryPolicy p = new FixedTtlPolicy(30_000L);
        assertFalse(p.isExpired(0L, 0L));
        assertFalse(p.isExpired(0L, 1_000L));
        assertTrue(p.isExpired(0L, 30_000L));
    }

    @Test
    void zeroTtlExpiresImmediately() {
        ExpiryPolicy p = FixedTtlPolicy.of(Duration.ZERO);
        assertTrue(p.isExpired(5_000L, 5_000L));
    }

    @Test
    void negativeTtlRejected() {
        assertThrows(IllegalArgumentException.class, () -> new FixedTtlPolicy(-1));
    }
}
