package com.rcmp.marketplace.infrastructure.ratelimit;

import com.rcmp.marketplace.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the in-memory sliding-window rate limiter.
 */
@DisplayName("SlidingWindowRateLimiter Unit Tests")
class SlidingWindowRateLimiterTest {

    private static final String IP = "203.0.113.7";

    private MutableClock clock;
    private SlidingWindowRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        rateLimiter = new SlidingWindowRateLimiter(5, Duration.ofSeconds(60), clock);
    }

    @Test
    @DisplayName("Five attempts inside the window are allowed, the sixth is denied")
    void sixthAttemptWithinWindowIsDenied() {
        // When
        for (int i = 0; i < 5; i++) {
            assertThat(rateLimiter.allow(IP)).as("attempt %d", i + 1).isTrue();
            clock.advance(Duration.ofSeconds(1));
        }

        // Then
        RateLimitResult sixth = rateLimiter.tryAcquire(IP);
        assertThat(sixth.isAllowed()).isFalse();
        assertThat(sixth.getRemaining()).isZero();
        assertThat(sixth.getRetryAfterSeconds()).isEqualTo(55);
    }

    @Test
    @DisplayName("Remaining quota counts down with each allowed attempt")
    void remainingCountsDown() {
        assertThat(rateLimiter.tryAcquire(IP).getRemaining()).isEqualTo(4);
        assertThat(rateLimiter.tryAcquire(IP).getRemaining()).isEqualTo(3);
        assertThat(rateLimiter.tryAcquire(IP).getLimit()).isEqualTo(5);
    }

    @Test
    @DisplayName("Denied attempts are not recorded")
    void deniedAttemptsDoNotExtendTheWindow() {
        // Given
        for (int i = 0; i < 5; i++) {
            rateLimiter.allow(IP);
        }

        // When: hammer while blocked
        clock.advance(Duration.ofSeconds(30));
        for (int i = 0; i < 10; i++) {
            assertThat(rateLimiter.allow(IP)).isFalse();
        }

        // Then: the original attempts age out on schedule
        clock.advance(Duration.ofSeconds(30));
        assertThat(rateLimiter.allow(IP)).isTrue();
    }

    @Test
    @DisplayName("An attempt exactly one window old no longer counts")
    void attemptAtWindowBoundaryExpires() {
        // Given
        for (int i = 0; i < 5; i++) {
            rateLimiter.allow(IP);
        }

        // When
        clock.advance(Duration.ofMillis(59_999));

        // Then
        assertThat(rateLimiter.allow(IP)).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(rateLimiter.allow(IP)).isTrue();
    }

    @Test
    @DisplayName("Window slides: capacity returns as individual attempts age out")
    void windowSlides() {
        // Given: attempts at t=0,10,20,30,40
        for (int i = 0; i < 5; i++) {
            rateLimiter.allow(IP);
            clock.advance(Duration.ofSeconds(10));
        }
        // now t=50
        assertThat(rateLimiter.allow(IP)).isFalse();

        // When: t=60, the t=0 attempt is gone
        clock.advance(Duration.ofSeconds(10));

        // Then
        assertThat(rateLimiter.allow(IP)).isTrue();
        assertThat(rateLimiter.allow(IP)).isFalse();
    }

    @Test
    @DisplayName("Identifiers are limited independently")
    void identifiersAreIndependent() {
        for (int i = 0; i < 5; i++) {
            rateLimiter.allow(IP);
        }

        assertThat(rateLimiter.allow(IP)).isFalse();
        assertThat(rateLimiter.allow("198.51.100.1")).isTrue();
    }

    @Test
    @DisplayName("reapExpired removes only identifiers with no attempts left in the window")
    void reapRemovesOnlyIdleWindows() {
        // Given
        rateLimiter.allow("idle");
        clock.advance(Duration.ofSeconds(45));
        rateLimiter.allow("active");
        assertThat(rateLimiter.trackedIdentifiers()).isEqualTo(2);

        // When
        clock.advance(Duration.ofSeconds(20));
        int removed = rateLimiter.reapExpired();

        // Then
        assertThat(removed).isEqualTo(1);
        assertThat(rateLimiter.trackedIdentifiers()).isEqualTo(1);
    }

    @Test
    @DisplayName("reapExpired on an empty limiter is a no-op")
    void reapOnEmptyLimiter() {
        assertThat(rateLimiter.reapExpired()).isZero();
    }

    @Test
    @DisplayName("Concurrent bursts from one identifier admit exactly the cap")
    void concurrentBurstAdmitsExactlyCap() throws Exception {
        // Given
        int threads = 32;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return rateLimiter.allow(IP);
                }));
            }

            // When
            start.countDown();

            // Then
            int allowed = 0;
            for (Future<Boolean> result : results) {
                if (result.get(5, TimeUnit.SECONDS)) {
                    allowed++;
                }
            }
            assertThat(allowed).isEqualTo(5);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Constructor rejects non-positive limits")
    void constructorValidatesArguments() {
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(0, Duration.ofSeconds(60), clock))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SlidingWindowRateLimiter(5, Duration.ZERO, clock))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
