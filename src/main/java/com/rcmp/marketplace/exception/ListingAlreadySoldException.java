package com.rcmp.marketplace.exception;

/**
 * Exception thrown when a checkout is requested for a listing that has already been sold.
 *
 * @author Marketplace Team
 */
public class ListingAlreadySoldException extends RuntimeException {

    private final String listingId;

    public ListingAlreadySoldException(String listingId) {
        super(String.format("Listing %s is already sold", listingId));
        this.listingId = listingId;
    }

    public String getListingId() {
        return listingId;
    }
}
