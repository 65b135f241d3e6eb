package com.rcmp.marketplace.api.dto;

import com.rcmp.marketplace.infrastructure.payment.CheckoutRedirect;

/**
 * Response DTO for checkout creation: where to send the buyer.
 *
 * @author Marketplace Team
 */
public class CheckoutResponse {

    private String sessionId;
    private String checkoutUrl;

    public CheckoutResponse() {
    }

    public CheckoutResponse(String sessionId, String checkoutUrl) {
        this.sessionId = sessionId;
        this.checkoutUrl = checkoutUrl;
    }

    public static CheckoutResponse from(CheckoutRedirect redirect) {
        return new CheckoutResponse(redirect.getSessionId(), redirect.getCheckoutUrl());
    }

    public String getSessionId() {
        return sessionId;
    }

    public void setSessionId(String sessionId) {
        this.sessionId = sessionId;
    }

    public String getCheckoutUrl() {
        return checkoutUrl;
    }

    public void setCheckoutUrl(String checkoutUrl) {
        this.checkoutUrl = checkoutUrl;
    }
}
