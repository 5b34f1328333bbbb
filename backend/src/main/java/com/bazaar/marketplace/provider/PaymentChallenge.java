package com.bazaar.marketplace.provider;

import java.util.List;

/**
 * Body of an HTTP 402 Payment Required response.
 */
public record PaymentChallenge(
        int x402Version,
        List<Requirements> accepts
) {
    public PaymentChallenge {
        accepts = List.copyOf(accepts);
    }

    public record Requirements(
            String scheme,
            String network,
            String maxAmountRequired,
            String resource,
            String description,
            String mimeType,
            String payTo,
            int maxTimeoutSeconds,
            String asset
    ) {
    }
}
