package com.bazaar.marketplace.provider;

import java.math.BigDecimal;

/**
 * A USDC movement as recorded on chain: what the recipient received and whose balance paid for it.
 * {@code payerWallet} is null when no owner's balance of the mint decreased.
 */
public record ConfirmedTransfer(String signature, BigDecimal amountUsdc, String payerWallet) {
}
