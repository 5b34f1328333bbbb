package com.bazaar.marketplace.provider;

import java.math.BigDecimal;

public record PaymentVerification(
        boolean valid,
        BigDecimal confirmedAmount,
        String payerWallet,
        String txHash,
        String networkId,
        String failureReason
) {
    public static PaymentVerification confirmed(
            BigDecimal confirmedAmount,
            String payerWallet,
            String txHash,
            String networkId
    ) {
        return new PaymentVerification(true, confirmedAmount, payerWallet, txHash, networkId, null);
    }

    public static PaymentVerification rejected(
            BigDecimal confirmedAmount,
            String payerWallet,
            String txHash,
            String networkId,
            String failureReason
    ) {
        return new PaymentVerification(false, confirmedAmount, payerWallet, txHash, networkId, failureReason);
    }
}
