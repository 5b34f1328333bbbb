package com.bazaar.marketplace.storage;

import java.time.OffsetDateTime;

/**
 * Page request over active listings. {@code cursor} is the opaque value returned as
 * {@link ListingPage#nextCursor()} by the previous page, or null for the first page.
 * When {@code asOf} is set, listings whose expiry has passed at that instant are left out
 * even if the sweep has not closed them yet.
 */
public record ListingQuery(
        String cursor,
        int limit,
        ListingSort sortBy,
        OffsetDateTime asOf
) {
    public ListingQuery {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        if (sortBy == null) {
            sortBy = ListingSort.NEWEST;
        }
    }

    public int offset() {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        int offset;
        try {
            offset = Integer.parseInt(cursor.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Invalid listing cursor: " + cursor, ex);
        }
        if (offset < 0) {
            throw new IllegalArgumentException("Invalid listing cursor: " + cursor);
        }
        return offset;
    }
}
