package com.rcmp.marketplace.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory sliding-window rate limiter.
 *
 * Each identifier owns a deque of attempt timestamps (epoch millis, oldest first).
 * An attempt made at {@code t} counts while {@code now - t < window}.
 * All access to a deque goes through {@link ConcurrentMap#compute}, which runs
 * the read-prune-append sequence under the map's per-key lock, so concurrent
 * bursts from one identifier cannot undercount.
 *
 * Windows are only removed by {@link #reapExpired()}; without the scheduled
 * reaper the map keeps one entry per identifier ever seen.
 *
 * @author Marketplace Team
 */
public class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final ConcurrentMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();
    private final int maxAttempts;
    private final long windowMillis;
    private final Clock clock;

    public SlidingWindowRateLimiter(int maxAttempts, Duration window, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    @Override
    public RateLimitResult tryAcquire(String identifier) {
        long now = clock.millis();
        RateLimitResult[] result = new RateLimitResult[1];

        windows.compute(identifier, (key, attempts) -> {
            Deque<Long> window = attempts != null ? attempts : new ArrayDeque<>();
            prune(window, now);

            if (window.size() >= maxAttempts) {
                long oldest = window.peekFirst();
                result[0] = RateLimitResult.rejected(maxAttempts, retryAfterSeconds(oldest, now));
            } else {
                window.addLast(now);
                result[0] = RateLimitResult.allowed(maxAttempts, maxAttempts - window.size());
            }
            return window;
        });

        if (!result[0].isAllowed()) {
            logger.debug("Rate limit exceeded for identifier: {}", identifier);
        }
        return result[0];
    }

    @Override
    public int reapExpired() {
        long now = clock.millis();
        int removed = 0;
        for (String identifier : windows.keySet()) {
            boolean[] emptied = new boolean[1];
            windows.computeIfPresent(identifier, (key, window) -> {
                prune(window, now);
                emptied[0] = window.isEmpty();
                return emptied[0] ? null : window;
            });
            if (emptied[0]) {
                removed++;
            }
        }
        if (removed > 0) {
            logger.debug("Reaped {} idle rate-limit windows, {} remain", removed, windows.size());
        }
        return removed;
    }

    /**
     * Number of identifiers currently tracked.
     *
     * @return Tracked identifier count
     */
    public int trackedIdentifiers() {
        return windows.size();
    }

    private void prune(Deque<Long> window, long now) {
        while (!window.isEmpty() && now - window.peekFirst() >= windowMillis) {
            window.pollFirst();
        }
    }

    private long retryAfterSeconds(long oldestAttempt, long now) {
        long waitMillis = oldestAttempt + windowMillis - now;
        return Math.max(1, (waitMillis + 999) / 1000);
    }
}
