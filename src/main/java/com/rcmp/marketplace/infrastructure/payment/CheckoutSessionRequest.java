package com.rcmp.marketplace.infrastructure.payment;

import lombok.Builder;
import lombok.Value;

/**
 * Checkout intent as sent to the processor.
 * Built from the listing as read when the buyer started checkout; later
 * changes to the listing do not affect an instance that already exists.
 *
 * @author Marketplace Team
 */
@Value
@Builder
public class CheckoutSessionRequest {

    String listingId;
    String buyerEmail;
    String currency;
    String itemName;
    String itemDescription;

    /** Charged amount in minor units. */
    long amountMinor;

    /** Platform fee in minor units; null when funds are not split. */
    Long applicationFeeMinor;

    /** Connect account receiving the remainder; null when funds are not split. */
    String destinationAccountId;

    String successUrl;
    String cancelUrl;

    public boolean isFeeSplit() {
        return applicationFeeMinor != null && destinationAccountId != null;
    }
}
