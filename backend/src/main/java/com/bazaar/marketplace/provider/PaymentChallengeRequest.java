package com.bazaar.marketplace.provider;

import java.math.BigDecimal;

public record PaymentChallengeRequest(
        BigDecimal amountUsdc,
        String resource,
        String description
) {
}
