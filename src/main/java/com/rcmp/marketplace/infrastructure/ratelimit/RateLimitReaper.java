package com.rcmp.marketplace.infrastructure.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodically drops rate-limit windows that no longer hold any attempt,
 * keeping the in-memory store bounded by the number of recently active clients.
 *
 * @author Marketplace Team
 */
@Service
public class RateLimitReaper {

    private static final Logger logger = LoggerFactory.getLogger(RateLimitReaper.class);

    private final RateLimiter rateLimiter;

    @Value("${marketplace.rate-limit.reaper.enabled:true}")
    private boolean reaperEnabled;

    public RateLimitReaper(RateLimiter rateLimiter) {
        this.rateLimiter = rateLimiter;
    }

    /**
     * Fixed delay: the next run starts once the previous one has finished.
     */
    @Scheduled(fixedDelayString = "${marketplace.rate-limit.reaper.interval-ms:60000}",
               initialDelayString = "${marketplace.rate-limit.reaper.interval-ms:60000}")
    public void reap() {
        if (!reaperEnabled) {
            return;
        }

        try {
            int removed = rateLimiter.reapExpired();
            if (removed > 0) {
                logger.debug("Reaped {} idle rate-limit windows", removed);
            }
        } catch (Exception e) {
            logger.error("Error reaping rate-limit windows", e);
        }
    }
}
