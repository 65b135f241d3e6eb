package com.rcmp.marketplace.repository;

import com.rcmp.marketplace.domain.model.Listing;
import com.rcmp.marketplace.domain.model.Listing.SaleState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;

/**
 * Repository interface for Listing entity.
 * The sale transition is a conditional UPDATE so concurrent webhook deliveries
 * for the same listing cannot both apply it.
 *
 * @author Marketplace Team
 */
@Repository
public interface ListingRepository extends JpaRepository<Listing, String> {

    /**
     * All listings, newest first.
     *
     * @return List of listings
     */
    List<Listing> findAllByOrderByCreatedAtDesc();

    /**
     * Compare-and-set LISTED -> SOLD.
     *
     * The WHERE clause only matches a listing that is still LISTED, so the row
     * lock taken by the UPDATE serializes concurrent callers and only the first
     * one sees a changed row.
     *
     * @param listingId Listing ID
     * @param listed Expected current state
     * @param sold New state
     * @param paymentReference Checkout session that paid for the listing
     * @param soldAt Sale timestamp
     * @return Number of rows updated
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Listing l SET " +
           "l.saleState = :sold, " +
           "l.soldAt = :soldAt, " +
           "l.paymentReference = :paymentReference " +
           "WHERE l.listingId = :listingId AND l.saleState = :listed")
    int compareAndSetSaleState(
            @Param("listingId") String listingId,
            @Param("listed") SaleState listed,
            @Param("sold") SaleState sold,
            @Param("paymentReference") String paymentReference,
            @Param("soldAt") Instant soldAt
    );

    /**
     * Mark a listing sold if it is still listed.
     *
     * @param listingId Listing ID
     * @param paymentReference Checkout session that paid for the listing
     * @param soldAt Sale timestamp
     * @return 1 if this call sold the listing, 0 if it was already sold or does not exist
     */
    default int markSold(String listingId, String paymentReference, Instant soldAt) {
        return compareAndSetSaleState(listingId, SaleState.LISTED, SaleState.SOLD, paymentReference, soldAt);
    }
}
