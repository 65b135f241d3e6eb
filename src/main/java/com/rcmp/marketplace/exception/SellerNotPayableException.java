package com.rcmp.marketplace.exception;

/**
 * Exception thrown when fee splitting is enabled but the seller has no
 * linked payout account to receive the remainder.
 *
 * @author Marketplace Team
 */
public class SellerNotPayableException extends RuntimeException {

    private final String listingId;
    private final String sellerId;

    public SellerNotPayableException(String listingId, String sellerId) {
        super(String.format("Seller %s of listing %s is not connected to a payout account", sellerId, listingId));
        this.listingId = listingId;
        this.sellerId = sellerId;
    }

    public String getListingId() {
        return listingId;
    }

    public String getSellerId() {
        return sellerId;
    }
}
