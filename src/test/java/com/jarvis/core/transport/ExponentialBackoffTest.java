package com.jarvis.core.transport;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ExponentialBackoffTest {

    private final ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(30));

    @Test
    @DisplayName("no delay before the first attempt")
    void zeroAttempts() {
        assertEquals(0, backoff.computeDelayMs(0));
    }

    @Test
    @DisplayName("delay doubles per attempt within the jitter band")
    void doubles() {
        for (int i = 0; i < 50; i++) {
            long third = backoff.computeDelayMs(3);
            assertTrue(third >= 2_000 && third <= 6_000, "attempt 3 delay " + third);
        }
    }

    @Test
    @DisplayName("delay never exceeds the cap")
    void capped() {
        for (int attempts : new int[]{10, 31, 1_000}) {
            long delay = backoff.computeDelayMs(attempts);
            assertTrue(delay >= 15_000 && delay <= 30_000, "attempt " + attempts + " delay " + delay);
        }
    }

    @Test
    void rejectsBadBounds() {
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(0, 10));
        assertThrows(IllegalArgumentException.class, () -> new ExponentialBackoff(100, 10));
    }
}
