package com.rcmp.marketplace.infrastructure.payment;

import com.rcmp.marketplace.exception.PaymentProcessorException;

/**
 * Outbound port to the hosted-checkout payment processor.
 *
 * @author Marketplace Team
 */
public interface PaymentProcessorClient {

    /**
     * Create a hosted checkout session.
     *
     * @param request Immutable description of the purchase
     * @return Session id and the URL to redirect the buyer to
     * @throws PaymentProcessorException if the processor cannot be reached, times out or rejects the request
     */
    CheckoutRedirect createCheckoutSession(CheckoutSessionRequest request);
}
