package com.rcmp.marketplace.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

/**
 * Request DTO for linking a Stripe Connect payout account.
 *
 * @author Marketplace Team
 */
public class PayoutAccountRequest {

    @NotBlank(message = "Payout account ID is required")
    @Pattern(regexp = "acct_[A-Za-z0-9]+", message = "Payout account ID must look like acct_...")
    private String payoutAccountId;

    public PayoutAccountRequest() {
    }

    public PayoutAccountRequest(String payoutAccountId) {
        this.payoutAccountId = payoutAccountId;
    }

    public String getPayoutAccountId() {
        return payoutAccountId;
    }

    public void setPayoutAccountId(String payoutAccountId) {
        this.payoutAccountId = payoutAccountId;
    }
}
