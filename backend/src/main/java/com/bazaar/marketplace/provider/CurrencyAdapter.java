package com.bazaar.marketplace.provider;

import java.math.BigDecimal;

/**
 * Currency abstraction for payment verification and payment-required challenges.
 * Implementations may block on network calls; callers bound them with a timeout.
 */
public interface CurrencyAdapter {

    /**
     * Maps a client-supplied payment reference to the identity of the underlying payment, so
     * that two encodings of the same payment resolve to the same key.
     */
    default String canonicalReference(String txRef) {
        return txRef;
    }

    PaymentVerification verify(String txRef, BigDecimal requiredAmount, String requiredPayer);

    PaymentChallenge createChallenge(PaymentChallengeRequest request);
}
