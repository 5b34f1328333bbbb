package com.bazaar.marketplace.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;

/**
 * Reserves a settled payment for one mystery box draw while the item is generated.
 * Released again only when generation or granting fails.
 */
@Getter
@Setter
@Entity
@Table(name = "mystery_box_payment_claims")
public class MysteryBoxPaymentClaim extends AssignedIdEntity {

    @Id
    @Column(name = "tx_hash", nullable = false, updatable = false, length = 256)
    private String txHash;

    @Column(name = "tier_id", nullable = false, updatable = false, length = 64)
    private String tierId;

    @Column(name = "buyer_wallet", nullable = false, updatable = false, length = 128)
    private String buyerWallet;

    @Column(name = "claimed_at", nullable = false, updatable = false)
    private OffsetDateTime claimedAt;

    public MysteryBoxPaymentClaim copy() {
        MysteryBoxPaymentClaim copy = new MysteryBoxPaymentClaim();
        copyStateTo(copy);
        copy.txHash = txHash;
        copy.tierId = tierId;
        copy.buyerWallet = buyerWallet;
        copy.claimedAt = claimedAt;
        return copy;
    }

    @Override
    public String getId() {
        return txHash;
    }
}
