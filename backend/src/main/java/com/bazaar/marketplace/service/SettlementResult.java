package com.bazaar.marketplace.service;

import java.math.BigDecimal;

/**
 * Outcome of a settled payment. {@code txRef} is the canonical payment reference;
 * {@code replayed} is set when the payment had already been consumed under the same key.
 */
public record SettlementResult(
        boolean confirmed,
        BigDecimal amount,
        String payer,
        String txRef,
        String idempotencyKey,
        boolean replayed
) {
}
