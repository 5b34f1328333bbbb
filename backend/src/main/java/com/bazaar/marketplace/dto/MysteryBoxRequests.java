package com.bazaar.marketplace.dto;

import jakarta.validation.constraints.NotBlank;

public final class MysteryBoxRequests {

    private MysteryBoxRequests() {
    }

    public record PurchaseMysteryBoxRequest(
            @NotBlank(message = "tierId is required")
            String tierId,

            @NotBlank(message = "buyerWallet is required")
            String buyerWallet,

            @NotBlank(message = "buyerUsername is required")
            String buyerUsername,

            @NotBlank(message = "txRef is required")
            String txRef
    ) {
    }
}
