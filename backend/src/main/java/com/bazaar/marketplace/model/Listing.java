package com.bazaar.marketplace.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Getter
@Setter
@Entity
@Table(name = "marketplace_listings")
public class Listing extends AssignedIdEntity {

    @Id
    @Column(name = "listing_id", nullable = false, updatable = false, length = 64)
    private String listingId;

    @Column(name = "item_id", nullable = false, updatable = false, length = 128)
    private String itemId;

    @Column(name = "item_type", nullable = false, updatable = false, length = 64)
    private String itemType;

    @Convert(converter = JsonNodeAttributeConverter.class)
    @Column(name = "item_data_json", nullable = false, updatable = false)
    private JsonNode itemData;

    @Column(name = "seller_wallet", nullable = false, updatable = false, length = 128)
    private String sellerWallet;

    @Column(name = "seller_username", nullable = false, updatable = false, length = 128)
    private String sellerUsername;

    @Column(name = "price_usdc", nullable = false, updatable = false, precision = 18, scale = 6)
    private BigDecimal priceUsdc;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 32)
    private ListingStatus status = ListingStatus.ACTIVE;

    @Column(name = "buyer_wallet", length = 128)
    private String buyerWallet;

    @Column(name = "buyer_username", length = 128)
    private String buyerUsername;

    @Column(name = "payment_tx_ref", length = 256)
    private String paymentTxRef;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    @Column(name = "expires_at", updatable = false)
    private OffsetDateTime expiresAt;

    @Column(name = "sold_at")
    private OffsetDateTime soldAt;

    @Column(name = "closed_at")
    private OffsetDateTime closedAt;

    @Column(name = "updated_at", nullable = false)
    private OffsetDateTime updatedAt;

    public ItemPayload itemPayload() {
        return new ItemPayload(itemType, itemData);
    }

    public boolean isExpiredAt(OffsetDateTime instant) {
        return expiresAt != null && !instant.isBefore(expiresAt);
    }

    public Listing copy() {
        Listing copy = new Listing();
        copyStateTo(copy);
        copy.listingId = listingId;
        copy.itemId = itemId;
        copy.itemType = itemType;
        copy.itemData = itemData == null ? null : itemData.deepCopy();
        copy.sellerWallet = sellerWallet;
        copy.sellerUsername = sellerUsername;
        copy.priceUsdc = priceUsdc;
        copy.status = status;
        copy.buyerWallet = buyerWallet;
        copy.buyerUsername = buyerUsername;
        copy.paymentTxRef = paymentTxRef;
        copy.createdAt = createdAt;
        copy.expiresAt = expiresAt;
        copy.soldAt = soldAt;
        copy.closedAt = closedAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    @Override
    public String getId() {
        return listingId;
    }
}
