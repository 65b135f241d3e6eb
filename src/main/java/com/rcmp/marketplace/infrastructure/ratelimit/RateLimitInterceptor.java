package com.rcmp.marketplace.infrastructure.ratelimit;

import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Interceptor to apply rate limiting before controller methods execute.
 *
 * Attempts are keyed by client IP. Forwarding headers are honoured only when
 * {@code marketplace.rate-limit.trust-forwarded-headers} is set, since a client
 * talking to the service directly could otherwise pick a fresh key per request.
 *
 * @author Marketplace Team
 */
@Component
public class RateLimitInterceptor implements HandlerInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitInterceptor.class);

    private final RateLimiter rateLimiter;
    private final MarketplaceMetricsService metricsService;

    @Value("${marketplace.rate-limit.trust-forwarded-headers:false}")
    private boolean trustForwardedHeaders;

    public RateLimitInterceptor(RateLimiter rateLimiter, MarketplaceMetricsService metricsService) {
        this.rateLimiter = rateLimiter;
        this.metricsService = metricsService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws Exception {

        String ipAddress = getClientIp(request);
        RateLimitResult result = rateLimiter.tryAcquire(ipAddress);

        response.setHeader("X-RateLimit-Limit", String.valueOf(result.getLimit()));
        response.setHeader("X-RateLimit-Remaining", String.valueOf(result.getRemaining()));

        if (result.isAllowed()) {
            return true;
        }

        logger.warn("Rate limit exceeded for ip: {}, path: {}", ipAddress, request.getRequestURI());
        metricsService.recordRateLimitRejection(request.getRequestURI());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader("Retry-After", String.valueOf(result.getRetryAfterSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);

        String errorJson = String.format(
                "{\"status\":429,\"error\":\"Too Many Requests\",\"message\":\"%s\",\"retryAfter\":%d}",
                "Too many attempts, try again later",
                result.getRetryAfterSeconds()
        );
        response.getWriter().write(errorJson);

        return false;
    }

    /**
     * Get client IP address, optionally honouring proxy headers.
     *
     * @param request HTTP request
     * @return Client IP address
     */
    String getClientIp(HttpServletRequest request) {
        if (trustForwardedHeaders) {
            // X-Forwarded-For can contain multiple IPs: client, proxy1, proxy2
            String xForwardedFor = request.getHeader("X-Forwarded-For");
            if (xForwardedFor != null && !xForwardedFor.isBlank()) {
                return xForwardedFor.split(",")[0].trim();
            }

            String xRealIp = request.getHeader("X-Real-IP");
            if (xRealIp != null && !xRealIp.isBlank()) {
                return xRealIp.trim();
            }
        }

        return request.getRemoteAddr();
    }
}
