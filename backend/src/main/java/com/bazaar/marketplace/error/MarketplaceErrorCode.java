package com.bazaar.marketplace.error;

import lombok.Getter;

/**
 * Every failure the marketplace core reports to its caller.
 */
@Getter
public enum MarketplaceErrorCode {
    INVALID_PRICE("invalid_price", MarketplaceErrorCategory.VALIDATION),
    INVALID_ITEM_DATA("invalid_item_data", MarketplaceErrorCategory.VALIDATION),
    INVALID_EXPIRY("invalid_expiry", MarketplaceErrorCategory.VALIDATION),
    INVALID_REQUEST("invalid_request", MarketplaceErrorCategory.VALIDATION),
    ITEM_NOT_OWNED("item_not_owned", MarketplaceErrorCategory.VALIDATION),
    ITEM_LOCK_FAILED("item_lock_failed", MarketplaceErrorCategory.CONFLICT),

    LISTING_NOT_FOUND("listing_not_found", MarketplaceErrorCategory.NOT_FOUND),
    TIER_NOT_FOUND("tier_not_found", MarketplaceErrorCategory.NOT_FOUND),

    LISTING_NOT_ACTIVE("listing_not_active", MarketplaceErrorCategory.CONFLICT),
    LISTING_EXPIRED("listing_expired", MarketplaceErrorCategory.CONFLICT),
    LISTING_RACE_LOST("listing_race_lost", MarketplaceErrorCategory.CONFLICT, false, true),
    DUPLICATE_PAYMENT_REFERENCE("duplicate_payment_reference", MarketplaceErrorCategory.CONFLICT, false, true),

    INSUFFICIENT_PAYMENT("insufficient_payment", MarketplaceErrorCategory.PAYMENT),
    PAYER_MISMATCH("payer_mismatch", MarketplaceErrorCategory.PAYMENT),
    PAYMENT_ALREADY_USED("payment_already_used", MarketplaceErrorCategory.PAYMENT),
    VERIFICATION_TIMEOUT("verification_timeout", MarketplaceErrorCategory.PAYMENT, true, false),
    PAYMENT_REJECTED("payment_rejected", MarketplaceErrorCategory.PAYMENT),

    UNAUTHORIZED("unauthorized", MarketplaceErrorCategory.UNAUTHORIZED),

    ITEM_TRANSFER_FAILED("item_transfer_failed", MarketplaceErrorCategory.FULFILLMENT, false, true);

    private final String code;
    private final MarketplaceErrorCategory category;

    /**
     * Whether the caller may resubmit the same request with the same idempotency key.
     */
    private final boolean retryable;

    /**
     * Whether a payment was captured that the caller must compensate outside the core.
     */
    private final boolean compensationRequired;

    MarketplaceErrorCode(String code, MarketplaceErrorCategory category) {
        this(code, category, false, false);
    }

    MarketplaceErrorCode(
            String code,
            MarketplaceErrorCategory category,
            boolean retryable,
            boolean compensationRequired
    ) {
        this.code = code;
        this.category = category;
        this.retryable = retryable;
        this.compensationRequired = compensationRequired;
    }
}
