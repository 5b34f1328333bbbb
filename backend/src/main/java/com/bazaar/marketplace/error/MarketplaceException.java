package com.bazaar.marketplace.error;

import lombok.Getter;

@Getter
public class MarketplaceException extends RuntimeException {

    private final MarketplaceErrorCode errorCode;

    public MarketplaceException(MarketplaceErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MarketplaceException(MarketplaceErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public MarketplaceErrorCategory getCategory() {
        return errorCode.getCategory();
    }

    public boolean isRetryable() {
        return errorCode.isRetryable();
    }

    public boolean isCompensationRequired() {
        return errorCode.isCompensationRequired();
    }

    public static MarketplaceException invalidPrice(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.INVALID_PRICE, detail);
    }

    public static MarketplaceException invalidItemData(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.INVALID_ITEM_DATA, detail);
    }

    public static MarketplaceException invalidExpiry(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.INVALID_EXPIRY, detail);
    }

    public static MarketplaceException invalidRequest(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.INVALID_REQUEST, detail);
    }

    public static MarketplaceException itemNotOwned(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.ITEM_NOT_OWNED, detail);
    }

    public static MarketplaceException itemLockFailed(String detail, Throwable cause) {
        return new MarketplaceException(MarketplaceErrorCode.ITEM_LOCK_FAILED, detail, cause);
    }

    public static MarketplaceException listingNotFound(String listingId) {
        return new MarketplaceException(MarketplaceErrorCode.LISTING_NOT_FOUND, "Listing not found: " + listingId);
    }

    public static MarketplaceException tierNotFound(String tierId) {
        return new MarketplaceException(MarketplaceErrorCode.TIER_NOT_FOUND, "Mystery box tier not found: " + tierId);
    }

    public static MarketplaceException listingNotActive(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.LISTING_NOT_ACTIVE, detail);
    }

    public static MarketplaceException listingExpired(String listingId) {
        return new MarketplaceException(MarketplaceErrorCode.LISTING_EXPIRED, "Listing has expired: " + listingId);
    }

    public static MarketplaceException listingExpiredAfterSettlement(String listingId, String paymentTxRef) {
        return new MarketplaceException(
                MarketplaceErrorCode.LISTING_EXPIRED,
                "Listing " + listingId + " expired before payment " + paymentTxRef + " could complete the sale"
        );
    }

    public static MarketplaceException listingRaceLost(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.LISTING_RACE_LOST, detail);
    }

    public static MarketplaceException duplicatePaymentReference(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.DUPLICATE_PAYMENT_REFERENCE, detail);
    }

    public static MarketplaceException insufficientPayment(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.INSUFFICIENT_PAYMENT, detail);
    }

    public static MarketplaceException payerMismatch(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.PAYER_MISMATCH, detail);
    }

    public static MarketplaceException paymentAlreadyUsed(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.PAYMENT_ALREADY_USED, detail);
    }

    public static MarketplaceException verificationTimeout(String detail, Throwable cause) {
        return new MarketplaceException(MarketplaceErrorCode.VERIFICATION_TIMEOUT, detail, cause);
    }

    public static MarketplaceException paymentRejected(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.PAYMENT_REJECTED, detail);
    }

    public static MarketplaceException unauthorized(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.UNAUTHORIZED, detail);
    }

    public static MarketplaceException itemTransferFailed(String detail) {
        return new MarketplaceException(MarketplaceErrorCode.ITEM_TRANSFER_FAILED, detail);
    }
}
