package com.bazaar.marketplace.service;

import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import com.bazaar.marketplace.model.MysteryBoxTier;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MysteryBoxTierCatalogTest {

    @Test
    void loadsConfiguredTiersWithScaledPrices() {
        MarketplaceRuntimeProperties properties = new MarketplaceRuntimeProperties();
        properties.getMysteryBox().getTiers().add(configuredTier("starter", "2", Map.of("rare", 20L, "common", 80L)));

        MysteryBoxTierCatalog catalog = new MysteryBoxTierCatalog(properties);

        MysteryBoxTier tier = catalog.getTier("starter").orElseThrow();
        assertEquals(new BigDecimal("2.000000"), tier.priceUsdc());
        assertEquals(List.of("common", "rare"), List.copyOf(tier.rarityWeights().keySet()));
        assertEquals(1, catalog.getAllTiers().size());
        assertTrue(catalog.getTier("missing").isEmpty());
        assertTrue(catalog.getTier(null).isEmpty());
    }

    @Test
    void rejectsNonPositivePrice() {
        assertThrows(IllegalStateException.class, () -> new MysteryBoxTierCatalog(List.of(
                new MysteryBoxTier("free", "Free", BigDecimal.ZERO, null, new TreeMap<>(Map.of("common", 1L)))
        )));
    }

    @Test
    void rejectsNegativeOrAllZeroWeights() {
        assertThrows(IllegalStateException.class, () -> new MysteryBoxTierCatalog(List.of(
                new MysteryBoxTier("neg", "Neg", BigDecimal.ONE, null, new TreeMap<>(Map.of("common", -1L, "rare", 5L)))
        )));
        assertThrows(IllegalStateException.class, () -> new MysteryBoxTierCatalog(List.of(
                new MysteryBoxTier("zero", "Zero", BigDecimal.ONE, null, new TreeMap<>(Map.of("common", 0L)))
        )));
        assertThrows(IllegalStateException.class, () -> new MysteryBoxTierCatalog(List.of(
                new MysteryBoxTier("empty", "Empty", BigDecimal.ONE, null, new TreeMap<>())
        )));
    }

    @Test
    void rejectsDuplicateTierIds() {
        MysteryBoxTier tier = new MysteryBoxTier("dup", "Dup", BigDecimal.ONE, null, new TreeMap<>(Map.of("common", 1L)));

        assertThrows(IllegalStateException.class, () -> new MysteryBoxTierCatalog(List.of(tier, tier)));
    }

    @Test
    void rejectsOverflowingWeights() {
        assertThrows(IllegalStateException.class, () -> new MysteryBoxTierCatalog(List.of(
                new MysteryBoxTier("big", "Big", BigDecimal.ONE, null,
                        new TreeMap<>(Map.of("common", Long.MAX_VALUE, "rare", 1L)))
        )));
    }

    private static MarketplaceRuntimeProperties.Tier configuredTier(String id, String price, Map<String, Long> weights) {
        MarketplaceRuntimeProperties.Tier tier = new MarketplaceRuntimeProperties.Tier();
        tier.setId(id);
        tier.setName(id);
        tier.setPriceUsdc(new BigDecimal(price));
        tier.setDescription(id + " tier");
        tier.setRarityWeights(new LinkedHashMap<>(weights));
        return tier;
    }
}
