package com.rcmp.marketplace.service;

import com.rcmp.marketplace.domain.model.Listing;
import com.rcmp.marketplace.exception.InvalidSignatureException;
import com.rcmp.marketplace.infrastructure.messaging.KafkaProducerService;
import com.rcmp.marketplace.infrastructure.messaging.events.ListingSoldEvent;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.rcmp.marketplace.infrastructure.payment.StripeEvent;
import com.rcmp.marketplace.infrastructure.payment.StripeWebhookVerifier;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import static com.rcmp.marketplace.infrastructure.payment.StripeCheckoutClient.LISTING_ID_METADATA_KEY;

/**
 * Handles payment notifications from the processor.
 *
 * The processor delivers at least once and may deliver concurrently, so the
 * handler is idempotent: the sale transition is a compare-and-set and only
 * the delivery that wins it publishes the sale event. Every authentic
 * notification is acknowledged, including ones this service does not act on,
 * so the processor stops retrying them.
 *
 * @author Marketplace Team
 */
@Service
public class FulfillmentWebhookService {

    private static final Logger logger = LoggerFactory.getLogger(FulfillmentWebhookService.class);

    private final StripeWebhookVerifier webhookVerifier;
    private final ListingService listingService;
    private final KafkaProducerService kafkaProducerService;
    private final MarketplaceMetricsService metricsService;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FulfillmentWebhookService(
            StripeWebhookVerifier webhookVerifier,
            ListingService listingService,
            KafkaProducerService kafkaProducerService,
            MarketplaceMetricsService metricsService,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.webhookVerifier = webhookVerifier;
        this.listingService = listingService;
        this.kafkaProducerService = kafkaProducerService;
        this.metricsService = metricsService;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Verify and apply one notification.
     *
     * @param rawBody Request body exactly as received
     * @param signatureHeader Stripe-Signature header value
     * @throws InvalidSignatureException if the notification is not authentic
     */
    public void handleNotification(byte[] rawBody, String signatureHeader) {
        try {
            webhookVerifier.verify(rawBody, signatureHeader);
        } catch (InvalidSignatureException e) {
            metricsService.recordWebhookRejected();
            throw e;
        }

        StripeEvent event;
        try {
            event = objectMapper.readValue(rawBody, StripeEvent.class);
        } catch (IOException e) {
            logger.error("Signed webhook payload could not be parsed, acknowledging without action", e);
            metricsService.recordWebhookIgnored("UNPARSEABLE");
            return;
        }
        if (event == null) {
            // JSON literal null
            logger.warn("Signed webhook payload is empty, acknowledging without action");
            metricsService.recordWebhookIgnored("UNPARSEABLE");
            return;
        }

        if (!StripeEvent.CHECKOUT_SESSION_COMPLETED.equals(event.type)) {
            logger.debug("Ignoring webhook event {} of type {}", event.id, event.type);
            metricsService.recordWebhookIgnored("EVENT_TYPE");
            return;
        }

        String listingId = event.metadata(LISTING_ID_METADATA_KEY);
        if (listingId == null || listingId.isBlank()) {
            logger.warn("Checkout completion {} carries no listing id, nothing to fulfil", event.id);
            metricsService.recordWebhookIgnored("NO_LISTING_ID");
            return;
        }

        Optional<Listing> listing = listingService.findListing(listingId);
        if (listing.isEmpty()) {
            logger.warn("Checkout completion {} references unknown listing {}", event.id, listingId);
            metricsService.recordWebhookIgnored("UNKNOWN_LISTING");
            return;
        }

        String sessionId = event.objectId();
        if (listingService.markSold(listingId, sessionId)) {
            metricsService.recordListingSold();
            Listing sold = listing.get();
            kafkaProducerService.publishListingSold(
                    new ListingSoldEvent(listingId, sold.getSellerId(), sessionId, Instant.now(clock)));
        } else {
            logger.debug("Duplicate completion for listing {} (event {}), already sold", listingId, event.id);
            metricsService.recordDuplicateDelivery();
        }
    }
}
