package com.rcmp.marketplace.infrastructure.ratelimit;

/**
 * Result of a rate limit check.
 *
 * @author Marketplace Team
 */
public class RateLimitResult {
    private final boolean allowed;
    private final int limit;
    private final int remaining;
    private final long retryAfterSeconds;

    private RateLimitResult(boolean allowed, int limit, int remaining, long retryAfterSeconds) {
        this.allowed = allowed;
        this.limit = limit;
        this.remaining = remaining;
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RateLimitResult allowed(int limit, int remaining) {
        return new RateLimitResult(true, limit, remaining, 0);
    }

    public static RateLimitResult rejected(int limit, long retryAfterSeconds) {
        return new RateLimitResult(false, limit, 0, retryAfterSeconds);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public int getLimit() {
        return limit;
    }

    public int getRemaining() {
        return remaining;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
