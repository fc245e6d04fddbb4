package com.sweepwatch.core.recovery;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Caps how many retries may start within a rolling window.
 */
public class FailureRateLimiter {

    private final Clock clock;
    private final int maxPerWindow;
    private final Duration window;
    private final Deque<Instant> permits = new ArrayDeque<>();

    public FailureRateLimiter(Clock clock, int maxPerWindow, Duration window) {
        this.clock = clock;
        this.maxPerWindow = maxPerWindow;
        this.window = window;
    }

    /**
     * Takes a permit if the window has room.
     *
     * @return false when the window is exhausted
     */
    public synchronized boolean tryAcquire() {
        prune();
        if (permits.size() >= maxPerWindow) {
            return false;
        }
        permits.addLast(clock.instant());
        return true;
    }

    public synchronized boolean isExhausted() {
        prune();
        return permits.size() >= maxPerWindow;
    }

    public synchronized int inWindow() {
        prune();
        return permits.size();
    }

    public synchronized void reset() {
        permits.clear();
    }

    private void prune() {
        Instant cutoff = clock.instant().minus(window);
        while (!permits.isEmpty() && !permits.peekFirst().isAfter(cutoff)) {
            permits.removeFirst();
        }
    }
}
