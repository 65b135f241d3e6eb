package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.service.FulfillmentWebhookService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Receives payment notifications.
 * The body is taken as raw bytes: the signature covers the exact payload,
 * so it must not be re-serialized before verification.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/webhooks")
public class WebhookController {

    static final String SIGNATURE_HEADER = "Stripe-Signature";

    private final FulfillmentWebhookService fulfillmentWebhookService;

    public WebhookController(FulfillmentWebhookService fulfillmentWebhookService) {
        this.fulfillmentWebhookService = fulfillmentWebhookService;
    }

    @PostMapping("/stripe")
    public ResponseEntity<Map<String, String>> handleStripeEvent(
            @RequestBody(required = false) byte[] payload,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature
    ) {
        fulfillmentWebhookService.handleNotification(payload == null ? new byte[0] : payload, signature);
        return ResponseEntity.ok(Map.of("status", "success"));
    }
}
