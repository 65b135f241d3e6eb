package com.rcmp.marketplace.infrastructure.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.TimeUnit;

/**
 * Metrics for the checkout, fulfillment and account-recovery flows.
 * Published through whichever Micrometer registry is active (CloudWatch in production).
 *
 * Key Metrics:
 * - Checkout sessions created / failed, processor latency
 * - Listings sold, duplicate and ignored webhook deliveries
 * - Webhook signature rejections
 * - Reset links issued, resets completed, tokens rejected
 * - Rate-limit rejections
 *
 * @author Marketplace Team
 */
@Service
public class MarketplaceMetricsService {

    private static final Logger logger = LoggerFactory.getLogger(MarketplaceMetricsService.class);

    private final MeterRegistry meterRegistry;

    private static final String METRIC_PREFIX = "marketplace.";
    private static final String CHECKOUT_PREFIX = METRIC_PREFIX + "checkout.";
    private static final String WEBHOOK_PREFIX = METRIC_PREFIX + "webhook.";
    private static final String RESET_PREFIX = METRIC_PREFIX + "password_reset.";
    private static final String RATE_LIMIT_PREFIX = METRIC_PREFIX + "rate_limit.";

    public MarketplaceMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Record a checkout session created at the processor.
     *
     * @param feeSplit Whether the session routes funds to a seller account
     */
    public void recordCheckoutCreated(boolean feeSplit) {
        Counter.builder(CHECKOUT_PREFIX + "created")
                .tag("fee_split", String.valueOf(feeSplit))
                .description("Checkout sessions created")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rejected or failed checkout attempt.
     *
     * @param reason Failure reason (e.g. "ALREADY_SOLD", "PROCESSOR_ERROR")
     */
    public void recordCheckoutFailure(String reason) {
        Counter.builder(CHECKOUT_PREFIX + "failure")
                .tag("reason", reason)
                .description("Failed checkout attempts")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded checkout failure, reason: {}", reason);
    }

    /**
     * Record round-trip latency of a processor call.
     *
     * @param latencyMs Latency in milliseconds
     */
    public void recordProcessorLatency(long latencyMs) {
        Timer.builder(CHECKOUT_PREFIX + "processor.latency")
                .description("Payment processor call latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry)
                .record(latencyMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Record a listing transitioned to SOLD.
     */
    public void recordListingSold() {
        Counter.builder(WEBHOOK_PREFIX + "listing_sold")
                .description("Listings marked sold by the payment webhook")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a redelivered completion event for an already sold listing.
     */
    public void recordDuplicateDelivery() {
        Counter.builder(WEBHOOK_PREFIX + "duplicate")
                .description("Completion events for listings that were already sold")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an authenticated event that caused no state change.
     *
     * @param reason Why it was ignored (e.g. "EVENT_TYPE", "UNKNOWN_LISTING")
     */
    public void recordWebhookIgnored(String reason) {
        Counter.builder(WEBHOOK_PREFIX + "ignored")
                .tag("reason", reason)
                .description("Authenticated webhook events that were acknowledged without action")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a webhook rejected by signature verification.
     */
    public void recordWebhookRejected() {
        Counter.builder(WEBHOOK_PREFIX + "rejected")
                .description("Webhook deliveries with an invalid signature")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded webhook signature rejection");
    }

    /**
     * Record a reset link handed to the messaging transport.
     */
    public void recordResetLinkIssued() {
        Counter.builder(RESET_PREFIX + "issued")
                .description("Password reset links issued")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a completed password reset.
     */
    public void recordResetCompleted() {
        Counter.builder(RESET_PREFIX + "completed")
                .description("Passwords changed through a reset token")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a rejected reset token.
     */
    public void recordResetTokenRejected() {
        Counter.builder(RESET_PREFIX + "token_rejected")
                .description("Reset tokens rejected as invalid, expired or used")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record a request denied by the rate limiter.
     *
     * @param path Request path
     */
    public void recordRateLimitRejection(String path) {
        Counter.builder(RATE_LIMIT_PREFIX + "rejected")
                .tag("path", path)
                .description("Requests denied by the sliding-window rate limiter")
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record an unexpected error.
     *
     * @param errorType Error type
     * @param operation Operation that failed
     */
    public void recordError(String errorType, String operation) {
        Counter.builder(METRIC_PREFIX + "errors")
                .tag("error_type", errorType)
                .tag("operation", operation)
                .description("Application errors")
                .register(meterRegistry)
                .increment();
        logger.debug("Recorded error: {} in operation: {}", errorType, operation);
    }
}
