package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.api.dto.CheckoutRequest;
import com.rcmp.marketplace.api.dto.CheckoutResponse;
import com.rcmp.marketplace.infrastructure.payment.CheckoutRedirect;
import com.rcmp.marketplace.service.CheckoutService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for starting a purchase.
 * The buyer is redirected to the processor's hosted page; the sale itself is
 * recorded later by the payment webhook.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/checkout")
public class CheckoutController {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutController.class);

    private final CheckoutService checkoutService;

    public CheckoutController(CheckoutService checkoutService) {
        this.checkoutService = checkoutService;
    }

    /**
     * Create a hosted checkout session for a listing.
     *
     * @param request Listing and buyer email
     * @return Session id and checkout URL
     */
    @PostMapping
    public ResponseEntity<CheckoutResponse> createCheckout(@Valid @RequestBody CheckoutRequest request) {
        logger.info("Creating checkout for listing {}", request.getListingId());

        CheckoutRedirect redirect = checkoutService.createCheckout(request.getListingId(), request.getBuyerEmail());
        return ResponseEntity.ok(CheckoutResponse.from(redirect));
    }
}
