package com.bazaar.marketplace.service;

import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import com.bazaar.marketplace.model.MysteryBoxTier;
import com.bazaar.marketplace.provider.UsdcAmounts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Published mystery box tiers. Built once from configuration; an invalid tier fails startup.
 */
@Component
public class MysteryBoxTierCatalog {

    private static final Logger log = LoggerFactory.getLogger(MysteryBoxTierCatalog.class);

    private final Map<String, MysteryBoxTier> tiers;

    @Autowired
    public MysteryBoxTierCatalog(MarketplaceRuntimeProperties marketplaceRuntimeProperties) {
        this(toTiers(marketplaceRuntimeProperties.getMysteryBox().getTiers()));
    }

    MysteryBoxTierCatalog(List<MysteryBoxTier> configuredTiers) {
        Map<String, MysteryBoxTier> byId = new LinkedHashMap<>();
        for (MysteryBoxTier tier : configuredTiers) {
            validate(tier);
            if (byId.putIfAbsent(tier.id(), tier) != null) {
                throw new IllegalStateException("Duplicate mystery box tier id: " + tier.id());
            }
        }
        this.tiers = Collections.unmodifiableMap(byId);
        log.info("Loaded {} mystery box tier(s): {}", tiers.size(), tiers.keySet());
    }

    public Optional<MysteryBoxTier> getTier(String tierId) {
        if (tierId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tiers.get(tierId));
    }

    public List<MysteryBoxTier> getAllTiers() {
        return List.copyOf(tiers.values());
    }

    static void validate(MysteryBoxTier tier) {
        if (!StringUtils.hasText(tier.id())) {
            throw new IllegalStateException("Mystery box tier id is required");
        }
        if (tier.priceUsdc() == null || tier.priceUsdc().signum() <= 0) {
            throw new IllegalStateException("Mystery box tier " + tier.id() + " must have a positive price");
        }
        if (tier.rarityWeights().isEmpty()) {
            throw new IllegalStateException("Mystery box tier " + tier.id() + " has no rarity weights");
        }
        boolean anyPositive = false;
        for (Map.Entry<String, Long> weight : tier.rarityWeights().entrySet()) {
            if (weight.getValue() == null || weight.getValue() < 0) {
                throw new IllegalStateException(
                        "Mystery box tier " + tier.id() + " has a negative weight for rarity " + weight.getKey()
                );
            }
            anyPositive |= weight.getValue() > 0;
        }
        if (!anyPositive) {
            throw new IllegalStateException("Mystery box tier " + tier.id() + " needs at least one positive weight");
        }
        try {
            tier.totalWeight();
        } catch (ArithmeticException ex) {
            throw new IllegalStateException("Mystery box tier " + tier.id() + " weights overflow", ex);
        }
    }

    private static List<MysteryBoxTier> toTiers(List<MarketplaceRuntimeProperties.Tier> configured) {
        List<MysteryBoxTier> result = new ArrayList<>();
        for (MarketplaceRuntimeProperties.Tier tier : configured) {
            BigDecimal price = tier.getPriceUsdc() == null ? null : UsdcAmounts.scale(tier.getPriceUsdc());
            Map<String, Long> weights = tier.getRarityWeights() == null ? Map.of() : tier.getRarityWeights();
            if (weights.containsValue(null)) {
                throw new IllegalStateException("Mystery box tier " + tier.getId() + " has a weight without a value");
            }
            result.add(new MysteryBoxTier(tier.getId(), tier.getName(), price, tier.getDescription(), new TreeMap<>(weights)));
        }
        return result;
    }
}
