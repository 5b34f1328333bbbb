package com.bazaar.marketplace.service;

import com.bazaar.marketplace.model.MysteryBoxPurchase;
import com.bazaar.marketplace.provider.GeneratedItem;

/**
 * Result of a mystery box purchase. A result with {@code success == false} means payment
 * was consumed but no item was awarded; the caller must treat it as a refund case.
 */
public record MysteryBoxResult(
        boolean success,
        GeneratedItem item,
        String txHash,
        MysteryBoxPurchase purchase,
        String message
) {
    public static MysteryBoxResult awarded(GeneratedItem item, MysteryBoxPurchase purchase) {
        return new MysteryBoxResult(true, item, purchase.getTxHash(), purchase, null);
    }

    public static MysteryBoxResult failed(String txHash, String message) {
        return new MysteryBoxResult(false, null, txHash, null, message);
    }
}
