package com.firefly.sagaorchestrator.persistence;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class InMemorySagaLeaseTest {

    private Instant now = Instant.parse("2025-01-01T00:00:00Z");
    private final Clock clock = new Clock() {
        @Override public ZoneOffset getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(java.time.ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    };
    private final InMemorySagaLease lease = new InMemorySagaLease(clock);

    @Test
    void onlyOneOwnerHoldsTheLease() {
        assertTrue(lease.tryAcquire("s1", "a", Duration.ofSeconds(30)).block());
        assertFalse(lease.tryAcquire("s1", "b", Duration.ofSeconds(30)).block());
        assertTrue(lease.isHeld("s1"));

        assertFalse(lease.renew("s1", "b", Duration.ofSeconds(30)).block());
        assertTrue(lease.renew("s1", "a", Duration.ofSeconds(30)).block());

        lease.release("s1", "b").block();
        assertTrue(lease.isHeld("s1"));
        lease.release("s1", "a").block();
        assertFalse(lease.isHeld("s1"));
    }

    @Test
    void expiredLeaseCanBeTakenOver() {
        assertTrue(lease.tryAcquire("s1", "a", Duration.ofSeconds(30)).block());
        now = now.plusSeconds(31);

        assertFalse(lease.isHeld("s1"));
        assertTrue(lease.tryAcquire("s1", "b", Duration.ofSeconds(30)).block());
        assertFalse(lease.renew("s1", "a", Duration.ofSeconds(30)).block());
    }

    @Test
    void ownerReacquiresItsOwnLease() {
        assertTrue(lease.tryAcquire("s1", "a", Duration.ofSeconds(30)).block());
        now = now.plusSeconds(10);

        assertTrue(lease.tryAcquire("s1", "a", Duration.ofSeconds(30)).block());
        now = now.plusSeconds(25);
        assertTrue(lease.isHeld("s1"));
        assertFalse(lease.tryAcquire("s1", "b", Duration.ofSeconds(30)).block());
    }

    @Test
    void expiredLeaseCannotBeRenewed() {
        assertTrue(lease.tryAcquire("s1", "a", Duration.ofSeconds(30)).block());
        now = now.plusSeconds(31);

        assertFalse(lease.renew("s1", "a", Duration.ofSeconds(30)).block());
        assertFalse(lease.isHeld("s1"));
    }
}
