package com.rcmp.marketplace.api.controller;

import com.rcmp.marketplace.api.dto.CreateListingRequest;
import com.rcmp.marketplace.api.dto.ListingResponse;
import com.rcmp.marketplace.domain.model.Listing;
import com.rcmp.marketplace.security.SecurityUtils;
import com.rcmp.marketplace.service.ListingService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for listings.
 * Reads are public; creating a listing requires the caller to be the seller.
 *
 * @author Marketplace Team
 */
@RestController
@RequestMapping("/api/v1/listings")
public class ListingController {

    private static final Logger logger = LoggerFactory.getLogger(ListingController.class);

    private final ListingService listingService;

    public ListingController(ListingService listingService) {
        this.listingService = listingService;
    }

    /**
     * Create a listing.
     *
     * Authorization: the seller ID must be the caller's own account (or admin)
     *
     * @param request Listing details
     * @return Created listing
     */
    @PostMapping
    @PreAuthorize("isAuthenticated()")
    public ResponseEntity<ListingResponse> createListing(@Valid @RequestBody CreateListingRequest request) {
        SecurityUtils.verifyAccountAccess(request.getSellerId());

        Listing listing = listingService.createListing(
                request.getSellerId(),
                request.getTitle(),
                request.getDescription(),
                request.getPrice(),
                request.getImageUrl()
        );

        Map<String, String> usernames = listingService.sellerUsernames(Collections.singletonList(listing));
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ListingResponse.fromEntity(listing, usernames.get(listing.getSellerId())));
    }

    /**
     * All listings, newest first, sold ones included and flagged.
     *
     * @return Listings
     */
    @GetMapping
    public ResponseEntity<List<ListingResponse>> getListings() {
        List<Listing> listings = listingService.listListings();
        Map<String, String> usernames = listingService.sellerUsernames(listings);

        List<ListingResponse> responses = listings.stream()
                .map(listing -> ListingResponse.fromEntity(listing, usernames.get(listing.getSellerId())))
                .collect(Collectors.toList());

        logger.debug("Returning {} listings", responses.size());
        return ResponseEntity.ok(responses);
    }

    @GetMapping("/{listingId}")
    public ResponseEntity<ListingResponse> getListing(@PathVariable String listingId) {
        Listing listing = listingService.getListing(listingId);
        Map<String, String> usernames = listingService.sellerUsernames(Collections.singletonList(listing));
        return ResponseEntity.ok(ListingResponse.fromEntity(listing, usernames.get(listing.getSellerId())));
    }
}
