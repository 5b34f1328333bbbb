package com.bazaar.marketplace.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * x402 payment-required settings for Solana USDC settlement.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "x402")
public class X402Properties {

    private String network = "solana-devnet";
    private int x402Version = 1;
    private String devnetRpcUrl = "https://api.devnet.solana.com";
    private String mainnetRpcUrl = "https://api.mainnet-beta.solana.com";
    private String usdcMintDevnet = "4zMMC9srt5Ri5X14GAgXhaHii3GnPAEERYPJgZJDncDU";
    private String usdcMintMainnet = "EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v";

    /**
     * Treasury wallet every x402 payment must be addressed to.
     */
    private String settlementAddress = "11111111111111111111111111111111";
    private int maxTimeoutSeconds = 30;
    private int maxPollAttempts = 10;
    private long pollIntervalMs = 1_000L;
    private String paymentHeaderName = "X-PAYMENT";

    public boolean isMainnet() {
        return "solana-mainnet".equals(network);
    }

    public String resolveRpcUrl() {
        return isMainnet() ? mainnetRpcUrl : devnetRpcUrl;
    }

    public String resolveUsdcMint() {
        return isMainnet() ? usdcMintMainnet : usdcMintDevnet;
    }
}
