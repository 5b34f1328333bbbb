package com.bazaar.marketplace.model;

public enum ListingStatus {
    ACTIVE,
    SOLD,
    CANCELLED,
    EXPIRED;

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
