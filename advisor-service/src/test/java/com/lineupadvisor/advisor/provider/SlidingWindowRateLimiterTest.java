package com.lineupadvisor.advisor.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SlidingWindowRateLimiterTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2025-10-05T17:00:00Z"));

    @Test
    @DisplayName("allows up to the budget, then refuses until the oldest call leaves the window")
    void slidingWindow() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(3, Duration.ofHours(1), clock);

        assertTrue(limiter.tryAcquire());
        clock.advance(Duration.ofMinutes(10));
        assertTrue(limiter.tryAcquire());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertEquals(0, limiter.remaining());
        assertEquals(Duration.ofMinutes(50), limiter.retryAfter());

        clock.advance(Duration.ofMinutes(50));
        assertEquals(1, limiter.remaining());
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
    }

    @Test
    @DisplayName("refused calls are not recorded")
    void refusalsDoNotCount() {
        SlidingWindowRateLimiter limiter = new SlidingWindowRateLimiter(1, Duration.ofMinutes(1), clock);
        assertTrue(limiter.tryAcquire());
        for (int i = 0; i < 5; i++) {
            assertFalse(limiter.tryAcquire());
        }
        clock.advance(Duration.ofMinutes(1));
        assertTrue(limiter.tryAcquire());
    }

    @Test
    @DisplayName("invalid budget or window rejected")
    void invalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(0, Duration.ofHours(1), clock));
        assertThrows(IllegalArgumentException.class, () -> new SlidingWindowRateLimiter(5, Duration.ZERO, clock));
    }
}
