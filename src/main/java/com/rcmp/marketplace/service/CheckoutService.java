package com.rcmp.marketplace.service;

import com.rcmp.marketplace.config.PaymentProperties;
import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.domain.model.Listing;
import com.rcmp.marketplace.exception.ListingAlreadySoldException;
import com.rcmp.marketplace.exception.PaymentProcessorException;
import com.rcmp.marketplace.exception.ResourceNotFoundException;
import com.rcmp.marketplace.exception.SellerNotPayableException;
import com.rcmp.marketplace.infrastructure.metrics.MarketplaceMetricsService;
import com.rcmp.marketplace.infrastructure.payment.CheckoutRedirect;
import com.rcmp.marketplace.infrastructure.payment.CheckoutSessionRequest;
import com.rcmp.marketplace.infrastructure.payment.PaymentProcessorClient;
import com.rcmp.marketplace.repository.AccountRepository;
import com.rcmp.marketplace.repository.ListingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Creates hosted checkout sessions for listings.
 *
 * Flow:
 * 1. Load the listing; reject if absent or already sold
 * 2. With fee splitting on, resolve the seller's payout account
 * 3. Build an immutable session request from the listing as read now
 * 4. Ask the processor for a session and return its redirect
 *
 * Nothing is written locally. The listing only changes state when the
 * processor later confirms payment through the webhook, so calling this
 * twice simply yields two independent sessions.
 *
 * Not transactional: no database resources are held while waiting on the processor.
 *
 * @author Marketplace Team
 */
@Service
public class CheckoutService {

    private static final Logger logger = LoggerFactory.getLogger(CheckoutService.class);

    private final ListingRepository listingRepository;
    private final AccountRepository accountRepository;
    private final PaymentProcessorClient paymentProcessorClient;
    private final PaymentProperties paymentProperties;
    private final MarketplaceMetricsService metricsService;

    public CheckoutService(
            ListingRepository listingRepository,
            AccountRepository accountRepository,
            PaymentProcessorClient paymentProcessorClient,
            PaymentProperties paymentProperties,
            MarketplaceMetricsService metricsService
    ) {
        this.listingRepository = listingRepository;
        this.accountRepository = accountRepository;
        this.paymentProcessorClient = paymentProcessorClient;
        this.paymentProperties = paymentProperties;
        this.metricsService = metricsService;
    }

    /**
     * Create a checkout session for a listing.
     *
     * @param listingId Listing ID
     * @param buyerEmail Buyer email, pre-filled on the hosted page
     * @return Session id and hosted checkout URL
     * @throws ResourceNotFoundException if the listing does not exist
     * @throws ListingAlreadySoldException if the listing is sold
     * @throws SellerNotPayableException if fee splitting is on and the seller has no payout account
     * @throws IllegalArgumentException if the platform fee is not below the price
     * @throws PaymentProcessorException if the processor fails or cannot be reached
     */
    public CheckoutRedirect createCheckout(String listingId, String buyerEmail) {
        Listing listing = listingRepository.findById(listingId)
                .orElseThrow(() -> {
                    metricsService.recordCheckoutFailure("NOT_FOUND");
                    return new ResourceNotFoundException("Listing", listingId);
                });

        if (listing.isSold()) {
            logger.warn("Checkout rejected, listing {} already sold", listingId);
            metricsService.recordCheckoutFailure("ALREADY_SOLD");
            throw new ListingAlreadySoldException(listingId);
        }

        long amountMinor = listing.priceInMinorUnits();
        CheckoutSessionRequest.CheckoutSessionRequestBuilder request = CheckoutSessionRequest.builder()
                .listingId(listing.getListingId())
                .buyerEmail(buyerEmail)
                .currency(paymentProperties.getCurrency())
                .itemName(listing.getTitle())
                .itemDescription(listing.getDescription())
                .amountMinor(amountMinor)
                .successUrl(paymentProperties.getSuccessUrl())
                .cancelUrl(paymentProperties.getCancelUrl());

        PaymentProperties.FeeSplit feeSplit = paymentProperties.getFeeSplit();
        if (feeSplit.isEnabled()) {
            String destination = resolvePayoutAccount(listing);
            long fee = feeSplit.getPlatformFeeMinor();
            if (fee >= amountMinor) {
                metricsService.recordCheckoutFailure("FEE_EXCEEDS_PRICE");
                throw new IllegalArgumentException(
                        "Listing price is too low to cover the platform fee");
            }
            request.applicationFeeMinor(fee).destinationAccountId(destination);
        }

        long startTime = System.currentTimeMillis();
        try {
            CheckoutRedirect redirect = paymentProcessorClient.createCheckoutSession(request.build());

            logger.info("Created checkout session {} for listing {}, amount {} {}",
                    redirect.getSessionId(), listingId, amountMinor, paymentProperties.getCurrency());
            metricsService.recordCheckoutCreated(feeSplit.isEnabled());
            return redirect;
        } catch (PaymentProcessorException e) {
            logger.error("Payment processor failed for listing {}: {}", listingId, e.getMessage());
            metricsService.recordCheckoutFailure("PROCESSOR_ERROR");
            throw e;
        } finally {
            metricsService.recordProcessorLatency(System.currentTimeMillis() - startTime);
        }
    }

    private String resolvePayoutAccount(Listing listing) {
        Account seller = accountRepository.findById(listing.getSellerId()).orElse(null);

        if (seller == null || !seller.isPayable()) {
            logger.warn("Checkout rejected, seller {} of listing {} has no payout account",
                    listing.getSellerId(), listing.getListingId());
            metricsService.recordCheckoutFailure("SELLER_NOT_PAYABLE");
            throw new SellerNotPayableException(listing.getListingId(), listing.getSellerId());
        }

        return seller.getPayoutAccountId();
    }
}
