package com.bazaar.marketplace.error;

public enum MarketplaceErrorCategory {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    PAYMENT,
    UNAUTHORIZED,
    FULFILLMENT
}
