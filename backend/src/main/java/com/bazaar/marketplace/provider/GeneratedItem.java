package com.bazaar.marketplace.provider;

import com.bazaar.marketplace.model.ItemPayload;

public record GeneratedItem(
        String itemId,
        String rarity,
        ItemPayload payload
) {
}
