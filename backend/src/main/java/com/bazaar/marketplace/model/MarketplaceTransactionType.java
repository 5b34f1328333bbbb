package com.bazaar.marketplace.model;

public enum MarketplaceTransactionType {
    LISTING_PURCHASE,
    MYSTERY_BOX_PURCHASE
}
