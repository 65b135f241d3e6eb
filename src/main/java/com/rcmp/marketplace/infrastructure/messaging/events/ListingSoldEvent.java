package com.rcmp.marketplace.infrastructure.messaging.events;

import java.time.Instant;

/**
 * Published once per listing, when a confirmed payment moves it from LISTED to SOLD.
 * Duplicate processor deliveries never produce a second event.
 *
 * @author Marketplace Team
 */
public class ListingSoldEvent {

    private String listingId;
    private String sellerId;
    private String paymentReference;
    private Instant soldAt;

    /**
     * Default constructor for deserialization.
     */
    public ListingSoldEvent() {
    }

    public ListingSoldEvent(String listingId, String sellerId, String paymentReference, Instant soldAt) {
        this.listingId = listingId;
        this.sellerId = sellerId;
        this.paymentReference = paymentReference;
        this.soldAt = soldAt;
    }

    public String getListingId() {
        return listingId;
    }

    public void setListingId(String listingId) {
        this.listingId = listingId;
    }

    public String getSellerId() {
        return sellerId;
    }

    public void setSellerId(String sellerId) {
        this.sellerId = sellerId;
    }

    public String getPaymentReference() {
        return paymentReference;
    }

    public void setPaymentReference(String paymentReference) {
        this.paymentReference = paymentReference;
    }

    public Instant getSoldAt() {
        return soldAt;
    }

    public void setSoldAt(Instant soldAt) {
        this.soldAt = soldAt;
    }

    @Override
    public String toString() {
        return "ListingSoldEvent{" +
                "listingId='" + listingId + '\'' +
                ", sellerId='" + sellerId + '\'' +
                ", paymentReference='" + paymentReference + '\'' +
                ", soldAt=" + soldAt +
                '}';
    }
}
