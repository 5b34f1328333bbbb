package com.bazaar.marketplace.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Marketplace runtime settings: adapter selection, settlement limits, sweep cadence
 * and the published mystery box catalog.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "bazaar")
public class MarketplaceRuntimeProperties {

    /**
     * Currency adapter variant: {@code mock} or {@code x402}.
     */
    private String paymentMode = "mock";

    /**
     * Storage adapter variant: {@code jpa} or {@code in_memory}.
     */
    private String storageMode = "jpa";

    /**
     * Item adapter variant; {@code gem} is the bundled in-memory inventory.
     */
    private String itemMode = "gem";

    private Settlement settlement = new Settlement();
    private Listing listing = new Listing();
    private Sweep sweep = new Sweep();
    private MysteryBox mysteryBox = new MysteryBox();
    private MockCurrency mockCurrency = new MockCurrency();

    @Getter
    @Setter
    public static class Settlement {
        private long verifyTimeoutMs = 15_000;
        private int verifierPoolSize = 8;
    }

    @Getter
    @Setter
    public static class Listing {
        private int defaultPageSize = 20;
        private int maxPageSize = 100;
        private long maxExpiresInSeconds = 30L * 24 * 60 * 60;
    }

    @Getter
    @Setter
    public static class Sweep {
        private boolean enabled = true;
        private long initialDelayMs = 5_000;
        private long intervalMs = 60_000;
        private int batchSize = 200;
    }

    @Getter
    @Setter
    public static class MysteryBox {
        /**
         * Fixed seed for rarity sampling; unset means a fresh random seed per process.
         */
        private Long rngSeed;
        private List<Tier> tiers = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Tier {
        private String id;
        private String name;
        private BigDecimal priceUsdc;
        private String description;
        private Map<String, Long> rarityWeights = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class MockCurrency {
        private BigDecimal defaultBalanceUsdc = new BigDecimal("100.000000");
        private String txRefPrefix = "mock";
    }
}
