package com.bazaar.marketplace.model;

import jakarta.persistence.Column;
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
@Table(name = "marketplace_transactions")
public class MarketplaceTransaction extends AssignedIdEntity {

    @Id
    @Column(name = "transaction_id", nullable = false, updatable = false, length = 64)
    private String transactionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, updatable = false, length = 32)
    private MarketplaceTransactionType type;

    @Column(name = "buyer_wallet", nullable = false, updatable = false, length = 128)
    private String buyerWallet;

    @Column(name = "buyer_username", nullable = false, updatable = false, length = 128)
    private String buyerUsername;

    @Column(name = "seller_wallet", updatable = false, length = 128)
    private String sellerWallet;

    @Column(name = "seller_username", updatable = false, length = 128)
    private String sellerUsername;

    @Column(name = "listing_id", updatable = false, length = 64)
    private String listingId;

    @Column(name = "tier_id", updatable = false, length = 64)
    private String tierId;

    @Column(name = "item_id", nullable = false, updatable = false, length = 128)
    private String itemId;

    @Column(name = "price_usdc", nullable = false, updatable = false, precision = 18, scale = 6)
    private BigDecimal priceUsdc;

    @Column(name = "tx_hash", nullable = false, updatable = false, length = 256)
    private String txHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private OffsetDateTime createdAt;

    public MarketplaceTransaction copy() {
        MarketplaceTransaction copy = new MarketplaceTransaction();
        copyStateTo(copy);
        copy.transactionId = transactionId;
        copy.type = type;
        copy.buyerWallet = buyerWallet;
        copy.buyerUsername = buyerUsername;
        copy.sellerWallet = sellerWallet;
        copy.sellerUsername = sellerUsername;
        copy.listingId = listingId;
        copy.tierId = tierId;
        copy.itemId = itemId;
        copy.priceUsdc = priceUsdc;
        copy.txHash = txHash;
        copy.createdAt = createdAt;
        return copy;
    }

    @Override
    public String getId() {
        return transactionId;
    }
}
