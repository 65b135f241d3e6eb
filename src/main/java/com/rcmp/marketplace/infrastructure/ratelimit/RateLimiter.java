package com.rcmp.marketplace.infrastructure.ratelimit;

/**
 * Per-identifier sliding-window admission control.
 *
 * @author Marketplace Team
 */
public interface RateLimiter {

    /**
     * Count one attempt for the identifier if the window has room.
     * Pruning, counting and recording happen as one atomic step per identifier.
     *
     * @param identifier Caller identifier (usually the client IP)
     * @return Decision with remaining quota or retry-after
     */
    RateLimitResult tryAcquire(String identifier);

    /**
     * Boolean form of {@link #tryAcquire(String)}.
     *
     * @param identifier Caller identifier
     * @return true if the attempt is admitted
     */
    default boolean allow(String identifier) {
        return tryAcquire(identifier).isAllowed();
    }

    /**
     * Drop state for identifiers with no attempts left inside the window.
     *
     * @return Number of identifiers removed
     */
    int reapExpired();
}
