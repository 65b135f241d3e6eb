package com.rcmp.marketplace.infrastructure.ratelimit;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Configuration for rate limiting interceptor.
 *
 * Guards every endpoint that checks or replaces credentials. All three share one
 * window per client IP, so alternating between them does not buy extra attempts:
 * - POST /api/v1/auth/login
 * - POST /api/v1/auth/forgot-password
 * - POST /api/v1/auth/reset-password
 *
 * @author Marketplace Team
 */
@Configuration
public class RateLimitConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;

    @Value("${marketplace.rate-limit.enabled:true}")
    private boolean rateLimitingEnabled;

    public RateLimitConfig(RateLimitInterceptor rateLimitInterceptor) {
        this.rateLimitInterceptor = rateLimitInterceptor;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        if (rateLimitingEnabled) {
            registry.addInterceptor(rateLimitInterceptor)
                    .addPathPatterns("/api/v1/auth/login")
                    .addPathPatterns("/api/v1/auth/forgot-password")
                    .addPathPatterns("/api/v1/auth/reset-password");
        }
    }
}
