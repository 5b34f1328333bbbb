package com.bazaar.marketplace.model;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Audit record of one awarded mystery box. {@code txHash} is unique across all purchases.
 */
@Getter
@Setter
@Entity
@Table(name = "mystery_box_purchases")
public class MysteryBoxPurchase extends AssignedIdEntity {

    @Id
    @Column(name = "purchase_id", nullable = false, updatable = false, length = 64)
    private String purchaseId;

    @Column(name = "tier_id", nullable = false, updatable = false, length = 64)
    private String tierId;

    @Column(name = "buyer_wallet", nullable = false, updatable = false, length = 128)
    private String buyerWallet;

    @Column(name = "buyer_username", nullable = false, updatable = false, length = 128)
    private String buyerUsername;

    @Column(name = "price_usdc", nullable = false, updatable = false, precision = 18, scale = 6)
    private BigDecimal priceUsdc;

    @Column(name = "rarity", nullable = false, updatable = false, length = 64)
    private String rarity;

    @Column(name = "roll", nullable = false, updatable = false)
    private long roll;

    @Column(name = "item_id", nullable = false, updatable = false, length = 128)
    private String itemId;

    @Convert(converter = JsonNodeAttributeConverter.class)
    @Column(name = "item_generated_json", nullable = false, updatable = false)
    private JsonNode itemGenerated;

    @Column(name = "tx_hash", nullable = false, updatable = false, unique = true, length = 256)
    private String txHash;

    @Column(name = "purchased_at", nullable = false, updatable = false)
    private OffsetDateTime purchasedAt;

    public MysteryBoxPurchase copy() {
        MysteryBoxPurchase copy = new MysteryBoxPurchase();
        copyStateTo(copy);
        copy.purchaseId = purchaseId;
        copy.tierId = tierId;
        copy.buyerWallet = buyerWallet;
        copy.buyerUsername = buyerUsername;
        copy.priceUsdc = priceUsdc;
        copy.rarity = rarity;
        copy.roll = roll;
        copy.itemId = itemId;
        copy.itemGenerated = itemGenerated == null ? null : itemGenerated.deepCopy();
        copy.txHash = txHash;
        copy.purchasedAt = purchasedAt;
        return copy;
    }

    @Override
    public String getId() {
        return purchaseId;
    }
}
