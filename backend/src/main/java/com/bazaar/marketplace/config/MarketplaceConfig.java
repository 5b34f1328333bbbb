package com.bazaar.marketplace.config;

import com.bazaar.marketplace.service.RaritySampler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Random;

@Configuration
public class MarketplaceConfig {

    public static final String SETTLEMENT_VERIFIER_EXECUTOR = "settlement-verifier-executor";

    private static final Logger log = LoggerFactory.getLogger(MarketplaceConfig.class);

    @Bean
    public Clock marketplaceClock() {
        return Clock.systemUTC();
    }

    /**
     * Runs currency adapter verify calls so that a hung adapter can be abandoned after the
     * configured timeout. The queue is bounded; a full queue is treated like a timeout.
     */
    @Bean(name = SETTLEMENT_VERIFIER_EXECUTOR)
    public ThreadPoolTaskExecutor settlementVerifierExecutor(MarketplaceRuntimeProperties marketplaceRuntimeProperties) {
        int poolSize = Math.max(1, marketplaceRuntimeProperties.getSettlement().getVerifierPoolSize());
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(poolSize);
        e.setMaxPoolSize(poolSize);
        e.setQueueCapacity(poolSize * 16);
        e.setThreadNamePrefix("settlement-verify-");
        e.setWaitForTasksToCompleteOnShutdown(false);
        e.initialize();
        return e;
    }

    @Bean
    public RaritySampler raritySampler(MarketplaceRuntimeProperties marketplaceRuntimeProperties) {
        Long seed = marketplaceRuntimeProperties.getMysteryBox().getRngSeed();
        if (seed != null) {
            log.info("Mystery box rarity sampling uses fixed seed {}", seed);
            return new RaritySampler(new Random(seed));
        }
        return new RaritySampler(new Random(new SecureRandom().nextLong()));
    }
}
