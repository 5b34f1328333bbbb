package com.bazaar.marketplace.provider;

public record ItemTransferResult(
        boolean success,
        String message
) {
    public static ItemTransferResult transferred() {
        return new ItemTransferResult(true, null);
    }

    public static ItemTransferResult failed(String message) {
        return new ItemTransferResult(false, message);
    }
}
