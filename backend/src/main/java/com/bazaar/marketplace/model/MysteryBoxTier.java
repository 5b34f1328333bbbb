package com.bazaar.marketplace.model;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Published mystery box configuration. Weights are iterated in rarity-label order so that
 * sampling walks the same sequence for the same weight map.
 */
public record MysteryBoxTier(
        String id,
        String name,
        BigDecimal priceUsdc,
        String description,
        SortedMap<String, Long> rarityWeights
) {
    public MysteryBoxTier {
        rarityWeights = Collections.unmodifiableSortedMap(new TreeMap<>(rarityWeights));
    }

    public long totalWeight() {
        long total = 0L;
        for (long weight : rarityWeights.values()) {
            total = Math.addExact(total, weight);
        }
        return total;
    }
}
