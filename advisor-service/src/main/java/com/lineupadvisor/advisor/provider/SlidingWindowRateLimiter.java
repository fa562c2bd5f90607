package com.lineupadvisor.advisor.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps outbound provider calls at {@code maxRequests} per sliding {@code window}.
 *
 * <p>Never waits: {@link #tryAcquire()} either records the call or refuses it, and the caller
 * degrades to cached or empty data. Shared by every provider of one service instance.
 */
public class SlidingWindowRateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Deque<Instant> calls = new ArrayDeque<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be positive, got " + maxRequests);
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive, got " + window);
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    public synchronized boolean tryAcquire() {
        Instant now = clock.instant();
        prune(now);
        if (calls.size() >= maxRequests) {
            log.warn("RATE_LIMITED inWindow={} max={} retryAfterSeconds={}",
                     calls.size(), maxRequests, retryAfter(now).toSeconds());
            return false;
        }
        calls.addLast(now);
        return true;
    }

    public synchronized int remaining() {
        prune(clock.instant());
        return maxRequests - calls.size();
    }

    /** Time until the oldest recorded call leaves the window; zero when a call is allowed now. */
    public synchronized Duration retryAfter() {
        Instant now = clock.instant();
        prune(now);
        return retryAfter(now);
    }

    private Duration retryAfter(Instant now) {
        if (calls.size() < maxRequests || calls.isEmpty()) {
            return Duration.ZERO;
        }
        return Duration.between(now, calls.peekFirst().plus(window));
    }

    private void prune(Instant now) {
        Instant cutoff = now.minus(window);
        while (!calls.isEmpty() && !calls.peekFirst().isAfter(cutoff)) {
            calls.pollFirst();
        }
    }
}
