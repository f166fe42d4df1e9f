package io.bastion.core.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Per-key sliding-window admission control.
 * <p>
 * Each key keeps the timestamps of its admitted requests inside the trailing window.
 * A timestamp exactly {@code window} old counts as outside the window. Keys whose
 * window has emptied are dropped during lookups, so no eviction thread is needed.
 * One lock guards the whole map.
 */
public class SlidingWindowRateLimiter {

    private final int maxRequests;
    private final Duration window;
    private final Clock clock;
    private final Map<String, Deque<Instant>> windows = new HashMap<>();

    public SlidingWindowRateLimiter(int maxRequests, Duration window, Clock clock) {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("Max requests must be positive");
        }
        if (window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Window must be positive");
        }
        this.maxRequests = maxRequests;
        this.window = window;
        this.clock = clock;
    }

    public synchronized RateDecision isAllowed(String key) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);

        sweepExpiredKeys(cutoff);

        Deque<Instant> timestamps = windows.computeIfAbsent(key, k -> new ArrayDeque<>());
        prune(timestamps, cutoff);

        if (timestamps.size() >= maxRequests) {
            Instant oldest = timestamps.peekFirst();
            long waitNanos = Duration.between(now, oldest.plus(window)).toNanos();
            long retryAfter = Math.max(1, (waitNanos + 999_999_999L) / 1_000_000_000L);
            return RateDecision.deny(retryAfter);
        }

        timestamps.addLast(now);
        return RateDecision.allow();
    }

    /**
     * @return number of requests currently counted against {@code key}
     */
    public synchronized int currentCount(String key) {
        Deque<Instant> timestamps = windows.get(key);
        if (timestamps == null) {
            return 0;
        }
        prune(timestamps, clock.instant().minus(window));
        return timestamps.size();
    }

    public synchronized int trackedKeys() {
        return windows.size();
    }

    public int maxRequests() {
        return maxRequests;
    }

    public Duration window() {
        return window;
    }

    private static void prune(Deque<Instant> timestamps, Instant cutoff) {
        while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
            timestamps.pollFirst();
        }
    }

    private void sweepExpiredKeys(Instant cutoff) {
        Iterator<Deque<Instant>> it = windows.values().iterator();
        while (it.hasNext()) {
            Deque<Instant> timestamps = it.next();
            Instant newest = timestamps.peekLast();
            if (newest == null || !newest.isAfter(cutoff)) {
                it.remove();
            }
        }
    }
}
