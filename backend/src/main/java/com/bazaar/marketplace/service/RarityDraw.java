package com.bazaar.marketplace.service;

public record RarityDraw(
        String rarity,
        long roll,
        long totalWeight
) {
}
