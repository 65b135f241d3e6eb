package com.rcmp.marketplace.infrastructure.payment;

import lombok.Value;

/**
 * Processor-issued checkout session and the hosted page the buyer is sent to.
 *
 * @author Marketplace Team
 */
@Value
public class CheckoutRedirect {
    String sessionId;
    String checkoutUrl;
}
