package com.bazaar.marketplace.storage;

import java.util.Locale;

public enum ListingSort {
    NEWEST,
    PRICE_LOW,
    PRICE_HIGH;

    public static ListingSort fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NEWEST;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported listing sort: " + value, ex);
        }
    }
}
