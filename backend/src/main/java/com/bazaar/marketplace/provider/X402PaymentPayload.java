package com.bazaar.marketplace.provider;

/**
 * Decoded X-PAYMENT header: a signed USDC transfer offered against a 402 challenge.
 */
public record X402PaymentPayload(
        int x402Version,
        String scheme,
        String network,
        Transfer payload
) {
    public record Transfer(
            String signature,
            String from,
            String to,
            String amount,
            String mint
    ) {
    }
}
