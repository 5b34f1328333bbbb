package com.bazaar.marketplace.storage;

import com.bazaar.marketplace.model.Listing;

import java.util.List;

public record ListingPage(
        List<Listing> listings,
        String nextCursor
) {
    public ListingPage {
        listings = List.copyOf(listings);
    }

    public boolean hasMore() {
        return nextCursor != null;
    }

    static ListingPage of(List<Listing> fetched, ListingQuery query) {
        // fetched holds up to limit + 1 rows; the extra row only signals another page
        if (fetched.size() > query.limit()) {
            return new ListingPage(
                    fetched.subList(0, query.limit()),
                    Integer.toString(query.offset() + query.limit())
            );
        }
        return new ListingPage(fetched, null);
    }
}
