package com.sandy.aiot.gateway.tools;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackoffPolicyTest {

    @Test
    void doublesPerAttemptUpToTheCap() {
        BackoffPolicy policy = new BackoffPolicy(1000, 60_000, 0);
        assertEquals(1000, policy.delayMs(0));
        assertEquals(2000, policy.delayMs(1));
        assertEquals(4000, policy.delayMs(2));
        assertEquals(32_000, policy.delayMs(5));
        assertEquals(60_000, policy.delayMs(6));
        assertEquals(60_000, policy.delayMs(40));
    }

    @Test
    void jitterStaysWithinBounds() {
        BackoffPolicy policy = new BackoffPolicy(1000, 60_000, 0.2);
        for (int i = 0; i < 200; i++) {
            long d = policy.delayMs(4);
            assertTrue(d >= 16_000 && d <= 19_200, "delay out of range: " + d);
        }
        assertEquals(19_200, policy.maxDelayMs(4));
    }

    @Test
    void rejectsNegativeSettings() {
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(-1, 10, 0));
        assertThrows(IllegalArgumentException.class, () -> new BackoffPolicy(1, 10, -0.1));
    }
}
