package com.bazaar.marketplace.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Item data tagged with the item type that owns its schema. Only the item adapter
 * interprets {@code data}; the marketplace passes it through untouched.
 */
public record ItemPayload(
        String itemType,
        JsonNode data
) {
}
