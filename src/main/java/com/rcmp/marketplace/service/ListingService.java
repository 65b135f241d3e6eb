package com.rcmp.marketplace.service;

import com.rcmp.marketplace.domain.model.Account;
import com.rcmp.marketplace.domain.model.Listing;
import com.rcmp.marketplace.exception.ResourceNotFoundException;
import com.rcmp.marketplace.repository.AccountRepository;
import com.rcmp.marketplace.repository.ListingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Service for listings and their sale state.
 *
 * @author Marketplace Team
 */
@Service
public class ListingService {

    private static final Logger logger = LoggerFactory.getLogger(ListingService.class);

    private final ListingRepository listingRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    public ListingService(ListingRepository listingRepository, AccountRepository accountRepository, Clock clock) {
        this.listingRepository = listingRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    /**
     * Create a listing in state LISTED.
     *
     * @param sellerId Seller account ID
     * @param title Title
     * @param description Description
     * @param price Asking price in major units, must be positive
     * @param imageUrl Image reference
     * @return Created listing
     * @throws ResourceNotFoundException if the seller does not exist
     * @throws IllegalArgumentException if the price is not positive
     */
    @Transactional
    public Listing createListing(String sellerId, String title, String description,
                                 BigDecimal price, String imageUrl) {
        if (price == null || price.signum() <= 0) {
            throw new IllegalArgumentException("Price must be greater than zero");
        }
        if (!accountRepository.existsById(sellerId)) {
            throw new ResourceNotFoundException("Account", sellerId);
        }

        Listing listing = Listing.builder()
                .sellerId(sellerId)
                .title(title)
                .description(description)
                .price(price)
                .imageUrl(imageUrl)
                .saleState(Listing.SaleState.LISTED)
                .build();

        listing = listingRepository.save(listing);
        logger.info("Created listing {} for seller {} at price {}", listing.getListingId(), sellerId, price);
        return listing;
    }

    /**
     * Get listing by ID.
     *
     * @param listingId Listing ID
     * @return Listing
     * @throws ResourceNotFoundException if not found
     */
    @Transactional(readOnly = true)
    public Listing getListing(String listingId) {
        return findListing(listingId)
                .orElseThrow(() -> new ResourceNotFoundException("Listing", listingId));
    }

    /**
     * Find listing by ID.
     *
     * @param listingId Listing ID
     * @return Optional listing
     */
    @Transactional(readOnly = true)
    public Optional<Listing> findListing(String listingId) {
        if (listingId == null || listingId.isBlank()) {
            return Optional.empty();
        }
        return listingRepository.findById(listingId);
    }

    /**
     * All listings, newest first.
     *
     * @return Listings
     */
    @Transactional(readOnly = true)
    public List<Listing> listListings() {
        return listingRepository.findAllByOrderByCreatedAtDesc();
    }

    /**
     * Usernames of the given sellers, for display next to their listings.
     * Sellers that no longer resolve are left out of the map.
     *
     * @param listings Listings
     * @return Seller account ID to username
     */
    @Transactional(readOnly = true)
    public Map<String, String> sellerUsernames(List<Listing> listings) {
        Set<String> sellerIds = listings.stream()
                .map(Listing::getSellerId)
                .collect(Collectors.toSet());

        return accountRepository.findAllById(sellerIds).stream()
                .collect(Collectors.toMap(Account::getAccountId, Account::getUsername, (a, b) -> a));
    }

    /**
     * Apply LISTED -> SOLD.
     *
     * Exactly one of any number of concurrent calls for the same listing returns true.
     * Every other call, and any call for a listing that is absent or already sold, returns false.
     *
     * @param listingId Listing ID
     * @param paymentReference Checkout session that paid for the listing
     * @return true if this call performed the transition
     */
    @Transactional
    public boolean markSold(String listingId, String paymentReference) {
        Instant now = Instant.now(clock);
        int updated = listingRepository.markSold(listingId, paymentReference, now);

        if (updated == 1) {
            logger.info("Listing {} marked SOLD, payment reference {}", listingId, paymentReference);
            return true;
        }

        logger.debug("Listing {} was not in LISTED state, no transition applied", listingId);
        return false;
    }
}
