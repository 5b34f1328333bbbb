package com.bazaar.marketplace.storage;

import com.bazaar.marketplace.model.ListingStatus;

import java.time.OffsetDateTime;
import java.util.Objects;

/**
 * Conditional status change: applied only when the stored listing is still in {@code expected}.
 * A transition to {@link ListingStatus#SOLD} carries the buyer and payment reference.
 */
public record ListingTransition(
        String listingId,
        ListingStatus expected,
        ListingStatus target,
        String buyerWallet,
        String buyerUsername,
        String paymentTxRef,
        OffsetDateTime at
) {
    public ListingTransition {
        Objects.requireNonNull(listingId, "listingId is required");
        Objects.requireNonNull(expected, "expected is required");
        Objects.requireNonNull(target, "target is required");
        Objects.requireNonNull(at, "at is required");
    }

    public static ListingTransition sold(
            String listingId,
            String buyerWallet,
            String buyerUsername,
            String paymentTxRef,
            OffsetDateTime at
    ) {
        return new ListingTransition(
                listingId, ListingStatus.ACTIVE, ListingStatus.SOLD, buyerWallet, buyerUsername, paymentTxRef, at
        );
    }

    public static ListingTransition closed(String listingId, ListingStatus target, OffsetDateTime at) {
        if (target != ListingStatus.CANCELLED && target != ListingStatus.EXPIRED) {
            throw new IllegalArgumentException("Closing transition must target CANCELLED or EXPIRED");
        }
        return new ListingTransition(listingId, ListingStatus.ACTIVE, target, null, null, null, at);
    }
}
