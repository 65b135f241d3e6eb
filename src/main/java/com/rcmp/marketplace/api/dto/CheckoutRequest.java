package com.rcmp.marketplace.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;

/**
 * Request DTO for starting a hosted checkout.
 *
 * @author Marketplace Team
 */
public class CheckoutRequest {

    @NotBlank(message = "Listing ID is required")
    private String listingId;

    @NotBlank(message = "Buyer email is required")
    @Email(message = "Buyer email must be a valid address")
    private String buyerEmail;

    public CheckoutRequest() {
    }

    public CheckoutRequest(String listingId, String buyerEmail) {
        this.listingId = listingId;
        this.buyerEmail = buyerEmail;
    }

    public String getListingId() {
        return listingId;
    }

    public void setListingId(String listingId) {
        this.listingId = listingId;
    }

    public String getBuyerEmail() {
        return buyerEmail;
    }

    public void setBuyerEmail(String buyerEmail) {
        this.buyerEmail = buyerEmail;
    }
}
