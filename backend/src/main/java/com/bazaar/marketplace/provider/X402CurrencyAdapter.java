package com.bazaar.marketplace.provider;

import com.bazaar.marketplace.config.X402Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * x402 pay-per-request settlement in Solana USDC. The payment reference is the X-PAYMENT
 * header; its transfer signature identifies the payment.
 */
@Component
@ConditionalOnProperty(prefix = "bazaar", name = "payment-mode", havingValue = "x402")
public class X402CurrencyAdapter implements CurrencyAdapter {

    private static final Logger log = LoggerFactory.getLogger(X402CurrencyAdapter.class);
    private static final String SCHEME_EXACT = "exact";

    private final X402Properties x402Properties;
    private final X402TransactionConfirmer x402TransactionConfirmer;

    public X402CurrencyAdapter(X402Properties x402Properties, X402TransactionConfirmer x402TransactionConfirmer) {
        this.x402Properties = x402Properties;
        this.x402TransactionConfirmer = x402TransactionConfirmer;
    }

    @Override
    public String canonicalReference(String txRef) {
        try {
            return X402PaymentHeaderCodec.decode(txRef).payload().signature();
        } catch (IllegalArgumentException ex) {
            return txRef;
        }
    }

    @Override
    public PaymentVerification verify(String txRef, BigDecimal requiredAmount, String requiredPayer) {
        String networkId = x402Properties.getNetwork();
        X402PaymentPayload payment;
        try {
            payment = X402PaymentHeaderCodec.decode(txRef);
        } catch (IllegalArgumentException ex) {
            return PaymentVerification.rejected(null, null, txRef, networkId, ex.getMessage());
        }

        X402PaymentPayload.Transfer transfer = payment.payload();
        String signature = transfer.signature();

        if (payment.x402Version() != x402Properties.getX402Version()) {
            return rejected(transfer, "Unsupported x402 version: " + payment.x402Version());
        }
        if (!SCHEME_EXACT.equals(payment.scheme())) {
            return rejected(transfer, "Unsupported payment scheme: " + payment.scheme());
        }
        if (!networkId.equals(payment.network())) {
            return rejected(transfer, "Network mismatch: expected " + networkId + ", got " + payment.network());
        }
        if (!x402Properties.resolveUsdcMint().equals(transfer.mint())) {
            return rejected(transfer, "Token mint mismatch: " + transfer.mint());
        }
        if (!x402Properties.getSettlementAddress().equals(transfer.to())) {
            return rejected(transfer, "Recipient mismatch: " + transfer.to());
        }

        BigDecimal paidAmount;
        try {
            paidAmount = UsdcAmounts.fromSmallestUnit(transfer.amount());
        } catch (IllegalArgumentException ex) {
            return rejected(transfer, ex.getMessage());
        }

        Optional<ConfirmedTransfer> onChain = x402TransactionConfirmer.findTransfer(
                signature,
                transfer.mint(),
                x402Properties.getSettlementAddress()
        );
        if (onChain.isEmpty()) {
            log.warn("x402 transfer {} not found or failed on {}", signature, networkId);
            return rejected(transfer, "Transaction not found or failed on chain");
        }

        ConfirmedTransfer confirmed = onChain.get();
        if (confirmed.amountUsdc().signum() <= 0) {
            return rejected(transfer, "Transaction moved no USDC to " + x402Properties.getSettlementAddress());
        }
        if (confirmed.payerWallet() == null) {
            return rejected(transfer, "Transaction shows no USDC debit from any wallet");
        }
        if (confirmed.amountUsdc().compareTo(paidAmount) != 0 || !Objects.equals(transfer.from(), confirmed.payerWallet())) {
            log.warn(
                    "x402 header for {} claims {} USDC from {}, chain shows {} USDC from {}",
                    signature,
                    paidAmount,
                    transfer.from(),
                    confirmed.amountUsdc(),
                    confirmed.payerWallet()
            );
            return PaymentVerification.rejected(
                    confirmed.amountUsdc(),
                    confirmed.payerWallet(),
                    signature,
                    networkId,
                    "Payment header does not match the on-chain transfer"
            );
        }

        log.info("x402 transfer {} confirmed: {} USDC from {}", signature, confirmed.amountUsdc(), confirmed.payerWallet());
        return PaymentVerification.confirmed(confirmed.amountUsdc(), confirmed.payerWallet(), signature, networkId);
    }

    @Override
    public PaymentChallenge createChallenge(PaymentChallengeRequest request) {
        return new PaymentChallenge(x402Properties.getX402Version(), List.of(new PaymentChallenge.Requirements(
                SCHEME_EXACT,
                x402Properties.getNetwork(),
                UsdcAmounts.toSmallestUnit(request.amountUsdc()),
                request.resource(),
                request.description(),
                "application/json",
                x402Properties.getSettlementAddress(),
                x402Properties.getMaxTimeoutSeconds(),
                x402Properties.resolveUsdcMint()
        )));
    }

    private PaymentVerification rejected(X402PaymentPayload.Transfer transfer, String reason) {
        return PaymentVerification.rejected(
                null,
                transfer.from(),
                transfer.signature(),
                x402Properties.getNetwork(),
                reason
        );
    }
}
