package com.bazaar.marketplace.service;

import com.bazaar.marketplace.model.MysteryBoxTier;

import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Weighted rarity draw. A roll is taken uniformly from {@code [0, totalWeight)} and the
 * weights are walked in rarity-label order; the first rarity whose cumulative weight
 * exceeds the roll wins. Zero-weight rarities can therefore never be selected.
 */
public class RaritySampler {

    private final Random random;

    public RaritySampler(Random random) {
        this.random = Objects.requireNonNull(random, "random is required");
    }

    public RarityDraw sample(MysteryBoxTier tier) {
        return draw(tier, random);
    }

    /**
     * Replays the first draw of a generator seeded with {@code seed}.
     */
    public RarityDraw sample(MysteryBoxTier tier, long seed) {
        return draw(tier, new Random(seed));
    }

    static RarityDraw draw(MysteryBoxTier tier, Random source) {
        long totalWeight = tier.totalWeight();
        if (totalWeight <= 0) {
            throw new IllegalArgumentException("Tier " + tier.id() + " has no positive rarity weight");
        }
        long roll = source.nextLong(totalWeight);
        return new RarityDraw(select(tier, roll), roll, totalWeight);
    }

    static String select(MysteryBoxTier tier, long roll) {
        long cumulative = 0L;
        for (Map.Entry<String, Long> entry : tier.rarityWeights().entrySet()) {
            cumulative += entry.getValue();
            if (roll < cumulative) {
                return entry.getKey();
            }
        }
        throw new IllegalArgumentException("Roll " + roll + " is outside the weight range of tier " + tier.id());
    }
}
