package me.golemcore.gateway.domain.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void shouldDoubleDelayUpToCap() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0, () -> 0.5);

        assertEquals(Duration.ofSeconds(1), policy.delayFor(1));
        assertEquals(Duration.ofSeconds(2), policy.delayFor(2));
        assertEquals(Duration.ofSeconds(32), policy.delayFor(6));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(7));
        assertEquals(Duration.ofSeconds(60), policy.delayFor(100));
    }

    @Test
    void shouldApplySymmetricJitter() {
        BackoffPolicy low = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, () -> 0.0);
        BackoffPolicy high = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, () -> 1.0);

        assertEquals(Duration.ofMillis(3200), low.delayFor(3));
        assertEquals(Duration.ofMillis(4800), high.delayFor(3));
    }

    @Test
    void shouldNeverExceedCapWithJitter() {
        BackoffPolicy policy = new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2, () -> 1.0);

        assertEquals(Duration.ofSeconds(60), policy.delayFor(10));
    }

    @Test
    void shouldRejectJitterOutsideUnitRange() {
        assertThrows(IllegalArgumentException.class,
                () -> new BackoffPolicy(Duration.ofSeconds(1), Duration.ofSeconds(60), 1.5));
    }
}
