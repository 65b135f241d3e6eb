package com.rcmp.marketplace.infrastructure.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Selects the window store: in-memory by default, Redis when
 * {@code marketplace.rate-limit.store=redis} so that several instances share one budget.
 *
 * @author Marketplace Team
 */
@Configuration
public class RateLimiterConfig {

    @Value("${marketplace.rate-limit.max-attempts:5}")
    private int maxAttempts;

    @Value("${marketplace.rate-limit.window:PT60S}")
    private Duration window;

    @Bean
    @ConditionalOnProperty(name = "marketplace.rate-limit.store", havingValue = "memory", matchIfMissing = true)
    public RateLimiter inMemoryRateLimiter(Clock clock) {
        return new SlidingWindowRateLimiter(maxAttempts, window, clock);
    }

    @Bean
    @ConditionalOnProperty(name = "marketplace.rate-limit.store", havingValue = "redis")
    public RateLimiter redisRateLimiter(StringRedisTemplate stringRedisTemplate, Clock clock) {
        return new RedisSlidingWindowRateLimiter(stringRedisTemplate, maxAttempts, window, clock);
    }
}
