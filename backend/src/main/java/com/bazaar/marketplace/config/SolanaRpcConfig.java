package com.bazaar.marketplace.config;

import org.p2p.solanaj.rpc.RpcClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConditionalOnProperty(prefix = "bazaar", name = "payment-mode", havingValue = "x402")
public class SolanaRpcConfig {

    private static final Logger log = LoggerFactory.getLogger(SolanaRpcConfig.class);

    @Bean
    public RpcClient solanaRpcClient(X402Properties x402Properties) {
        String rpcUrl = x402Properties.resolveRpcUrl();
        log.info("Initializing Solana RPC client for {} ({})", rpcUrl, x402Properties.getNetwork());
        return new RpcClient(rpcUrl);
    }
}
