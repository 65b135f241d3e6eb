package com.rcmp.marketplace.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.data.redis.core.script.RedisScript;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Sliding-window rate limiter shared by all instances through Redis.
 *
 * Each identifier maps to a sorted set of attempt timestamps (score = epoch millis).
 * A Lua script prunes, counts and appends in one server-side step, which Redis
 * executes atomically. The key expires one window after the last attempt, so
 * Redis reclaims idle identifiers on its own and {@link #reapExpired()} has nothing to do.
 *
 * @author Marketplace Team
 */
public class RedisSlidingWindowRateLimiter implements RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RedisSlidingWindowRateLimiter.class);

    private static final String KEY_PREFIX = "rate_limit:sliding_window:";

    /**
     * KEYS[1] window key; ARGV[1] now millis, ARGV[2] window millis, ARGV[3] max attempts, ARGV[4] member.
     * Returns {allowed (1/0), count after the call, oldest attempt millis}.
     */
    private static final String SLIDING_WINDOW_SCRIPT =
            "local now = tonumber(ARGV[1]) " +
            "local window = tonumber(ARGV[2]) " +
            "local limit = tonumber(ARGV[3]) " +
            "redis.call('ZREMRANGEBYSCORE', KEYS[1], '-inf', now - window) " +
            "local count = redis.call('ZCARD', KEYS[1]) " +
            "if count >= limit then " +
            "  local oldest = redis.call('ZRANGE', KEYS[1], 0, 0, 'WITHSCORES') " +
            "  return {0, count, tonumber(oldest[2])} " +
            "end " +
            "redis.call('ZADD', KEYS[1], now, ARGV[4]) " +
            "redis.call('PEXPIRE', KEYS[1], window) " +
            "return {1, count + 1, now}";

    private static final RedisScript<List> SCRIPT = new DefaultRedisScript<>(SLIDING_WINDOW_SCRIPT, List.class);

    private final StringRedisTemplate redisTemplate;
    private final int maxAttempts;
    private final long windowMillis;
    private final Clock clock;

    public RedisSlidingWindowRateLimiter(StringRedisTemplate redisTemplate, int maxAttempts,
                                         Duration window, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.maxAttempts = maxAttempts;
        this.windowMillis = window.toMillis();
        this.clock = clock;
    }

    @Override
    public RateLimitResult tryAcquire(String identifier) {
        long now = clock.millis();
        String member = now + ":" + UUID.randomUUID();

        List<?> reply = redisTemplate.execute(
                SCRIPT,
                Collections.singletonList(KEY_PREFIX + identifier),
                String.valueOf(now),
                String.valueOf(windowMillis),
                String.valueOf(maxAttempts),
                member
        );

        if (reply == null || reply.size() < 3) {
            throw new IllegalStateException("Unexpected reply from rate-limit script: " + reply);
        }

        boolean allowed = ((Number) reply.get(0)).longValue() == 1L;
        long count = ((Number) reply.get(1)).longValue();
        long oldest = ((Number) reply.get(2)).longValue();

        if (allowed) {
            return RateLimitResult.allowed(maxAttempts, (int) Math.max(0, maxAttempts - count));
        }

        long waitMillis = oldest + windowMillis - now;
        logger.debug("Rate limit exceeded for identifier: {}", identifier);
        return RateLimitResult.rejected(maxAttempts, Math.max(1, (waitMillis + 999) / 1000));
    }

    @Override
    public int reapExpired() {
        return 0;
    }
}
