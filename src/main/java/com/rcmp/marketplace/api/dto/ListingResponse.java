package com.rcmp.marketplace.api.dto;

import com.rcmp.marketplace.domain.model.Listing;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Response DTO for a listing, with the seller's username for display.
 *
 * @author Marketplace Team
 */
public class ListingResponse {

    private String listingId;
    private String title;
    private String description;
    private BigDecimal price;
    private String imageUrl;
    private String sellerId;
    private String sellerUsername;
    private String saleState;
    private boolean sold;
    private Instant createdAt;

    public ListingResponse() {
    }

    /**
     * Create response from Listing entity.
     *
     * @param listing Listing entity
     * @param sellerUsername Seller username, may be null
     * @return ListingResponse
     */
    public static ListingResponse fromEntity(Listing listing, String sellerUsername) {
        ListingResponse response = new ListingResponse();
        response.setListingId(listing.getListingId());
        response.setTitle(listing.getTitle());
        response.setDescription(listing.getDescription());
        response.setPrice(listing.getPrice());
        response.setImageUrl(listing.getImageUrl());
        response.setSellerId(listing.getSellerId());
        response.setSellerUsername(sellerUsername);
        response.setSaleState(listing.getSaleState().name());
        response.setSold(listing.isSold());
        response.setCreatedAt(listing.getCreatedAt());
        return response;
    }

    public String getListingId() {
        return listingId;
    }

    public void setListingId(String listingId) {
        this.listingId = listingId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public BigDecimal getPrice() {
        return price;
    }

    public void setPrice(BigDecimal price) {
        this.price = price;
    }

    public String getImageUrl() {
        return imageUrl;
    }

    public void setImageUrl(String imageUrl) {
        this.imageUrl = imageUrl;
    }

    public String getSellerId() {
        return sellerId;
    }

    public void setSellerId(String sellerId) {
        this.sellerId = sellerId;
    }

    public String getSellerUsername() {
        return sellerUsername;
    }

    public void setSellerUsername(String sellerUsername) {
        this.sellerUsername = sellerUsername;
    }

    public String getSaleState() {
        return saleState;
    }

    public void setSaleState(String saleState) {
        this.saleState = saleState;
    }

    public boolean isSold() {
        return sold;
    }

    public void setSold(boolean sold) {
        this.sold = sold;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
