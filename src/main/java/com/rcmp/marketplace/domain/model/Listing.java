package com.rcmp.marketplace.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Listing entity representing a single item offered by a seller.
 *
 * Sale state machine: LISTED -> SOLD, applied once by the payment webhook.
 * There is no transition back to LISTED. Apart from the sale fields a listing
 * is not modified after creation.
 *
 * @author Marketplace Team
 */
@Entity
@Table(name = "listings", indexes = {
    @Index(name = "idx_listings_seller_id", columnList = "seller_id"),
    @Index(name = "idx_listings_sale_state", columnList = "sale_state"),
    @Index(name = "idx_listings_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Listing {

    @Id
    @Column(name = "listing_id", nullable = false, length = 36)
    private String listingId;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    /**
     * Asking price in major currency units (e.g. 19.99).
     */
    @Column(name = "price", nullable = false, precision = 12, scale = 2)
    private BigDecimal price;

    /**
     * Foreign key reference to accounts.account_id.
     */
    @Column(name = "seller_id", nullable = false, length = 36)
    private String sellerId;

    /**
     * Opaque reference to the stored image (e.g. "/images/3f2a_boots.jpg").
     */
    @Column(name = "image_url", length = 500)
    private String imageUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "sale_state", nullable = false, length = 20)
    private SaleState saleState;

    /**
     * Timestamp when the sale was recorded.
     */
    @Column(name = "sold_at")
    private Instant soldAt;

    /**
     * Checkout session id of the payment that completed the sale.
     */
    @Column(name = "payment_reference", length = 255)
    private String paymentReference;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (listingId == null) {
            listingId = UUID.randomUUID().toString();
        }
        if (saleState == null) {
            saleState = SaleState.LISTED;
        }
        createdAt = Instant.now();
    }

    /**
     * Check if the listing has been sold.
     *
     * @return true if sale state is SOLD
     */
    public boolean isSold() {
        return saleState == SaleState.SOLD;
    }

    /**
     * Price in minor currency units, rounded half away from zero.
     * 19.99 becomes 1999; a fractional-cent price such as 10.005 becomes 1001.
     *
     * @return Amount in minor units
     * @throws ArithmeticException if the amount does not fit in a long
     */
    public long priceInMinorUnits() {
        return price.movePointRight(2).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    /**
     * Listing sale state.
     */
    public enum SaleState {
        /**
         * Open for purchase.
         */
        LISTED,

        /**
         * Payment completed. Terminal.
         */
        SOLD
    }
}
