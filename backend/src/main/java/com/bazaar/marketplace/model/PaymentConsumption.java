package com.bazaar.marketplace.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

/**
 * Marks a payment reference as spent on exactly one economic event (the idempotency key).
 */
@Getter
@Setter
@Entity
@Table(name = "payment_consumptions")
public class PaymentConsumption extends AssignedIdEntity {

    @Id
    @Column(name = "tx_ref", nullable = false, updatable = false, length = 256)
    private String txRef;

    @Column(name = "idempotency_key", nullable = false, updatable = false, length = 256)
    private String idempotencyKey;

    @Column(name = "payer_wallet", nullable = false, updatable = false, length = 128)
    private String payerWallet;

    @Column(name = "amount_usdc", nullable = false, updatable = false, precision = 18, scale = 6)
    private BigDecimal amountUsdc;

    @Column(name = "consumed_at", nullable = false, updatable = false)
    private OffsetDateTime consumedAt;

    public PaymentConsumption copy() {
        PaymentConsumption copy = new PaymentConsumption();
        copyStateTo(copy);
        copy.txRef = txRef;
        copy.idempotencyKey = idempotencyKey;
        copy.payerWallet = payerWallet;
        copy.amountUsdc = amountUsdc;
        copy.consumedAt = consumedAt;
        return copy;
    }

    @Override
    public String getId() {
        return txRef;
    }
}
