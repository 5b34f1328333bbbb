package com.bazaar.marketplace.dto;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.math.BigDecimal;

public final class ListingRequests {

    private ListingRequests() {
    }

    public record CreateListingRequest(
            @NotBlank(message = "itemId is required")
            @Size(max = 128, message = "itemId must be at most 128 characters")
            String itemId,

            @NotBlank(message = "itemType is required")
            @Size(max = 64, message = "itemType must be at most 64 characters")
            String itemType,

            @NotNull(message = "itemData is required")
            JsonNode itemData,

            @NotBlank(message = "sellerWallet is required")
            String sellerWallet,

            @NotBlank(message = "sellerUsername is required")
            String sellerUsername,

            @NotNull(message = "priceUsdc is required")
            @DecimalMin(value = "0.0", inclusive = false, message = "priceUsdc must be greater than zero")
            @Digits(integer = 12, fraction = 6, message = "priceUsdc supports up to 6 decimal places")
            BigDecimal priceUsdc,

            @Positive(message = "expiresInSeconds must be positive")
            Long expiresInSeconds
    ) {
    }

    public record BuyListingRequest(
            @NotBlank(message = "listingId is required")
            String listingId,

            @NotBlank(message = "buyerWallet is required")
            String buyerWallet,

            @NotBlank(message = "buyerUsername is required")
            String buyerUsername,

            @NotBlank(message = "txRef is required")
            String txRef
    ) {
    }

    public record CancelListingRequest(
            @NotBlank(message = "listingId is required")
            String listingId,

            @NotBlank(message = "requesterWallet is required")
            String requesterWallet
    ) {
    }
}
