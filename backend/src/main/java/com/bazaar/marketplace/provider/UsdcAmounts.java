package com.bazaar.marketplace.provider;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;

/**
 * USDC carries 6 decimals on chain; amounts travel as integer strings of the smallest unit.
 */
public final class UsdcAmounts {

    public static final int USDC_DECIMALS = 6;

    private UsdcAmounts() {
    }

    public static BigDecimal scale(BigDecimal amountUsdc) {
        return amountUsdc.setScale(USDC_DECIMALS, RoundingMode.HALF_UP);
    }

    public static String toSmallestUnit(BigDecimal amountUsdc) {
        if (amountUsdc == null || amountUsdc.signum() < 0) {
            throw new IllegalArgumentException("USDC amount must be non-negative");
        }
        return scale(amountUsdc).movePointRight(USDC_DECIMALS).toBigIntegerExact().toString();
    }

    public static BigDecimal fromSmallestUnit(String smallestUnit) {
        if (smallestUnit == null || smallestUnit.isBlank()) {
            throw new IllegalArgumentException("Smallest-unit amount is required");
        }
        BigInteger raw;
        try {
            raw = new BigInteger(smallestUnit.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("Smallest-unit amount must be an integer: " + smallestUnit, ex);
        }
        if (raw.signum() < 0) {
            throw new IllegalArgumentException("Smallest-unit amount must be non-negative: " + smallestUnit);
        }
        return new BigDecimal(raw, USDC_DECIMALS);
    }
}
