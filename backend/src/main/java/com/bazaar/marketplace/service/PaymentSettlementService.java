package com.bazaar.marketplace.service;

import com.bazaar.marketplace.config.MarketplaceConfig;
import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import com.bazaar.marketplace.error.MarketplaceException;
import com.bazaar.marketplace.model.PaymentConsumption;
import com.bazaar.marketplace.provider.CurrencyAdapter;
import com.bazaar.marketplace.provider.CurrencyAdapterException;
import com.bazaar.marketplace.provider.PaymentVerification;
import com.bazaar.marketplace.provider.UsdcAmounts;
import com.bazaar.marketplace.storage.MarketplaceStorageAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Verifies a payment reference and marks it consumed by exactly one economic event.
 * <p>
 * Settlement always completes before the caller mutates a listing or records a purchase.
 * A second call with the same reference and idempotency key returns the recorded outcome
 * without verifying again; the same reference under a different key is rejected.
 */
@Service
public class PaymentSettlementService {

    private static final Logger log = LoggerFactory.getLogger(PaymentSettlementService.class);

    private final CurrencyAdapter currencyAdapter;
    private final MarketplaceStorageAdapter storageAdapter;
    private final AsyncTaskExecutor verifierExecutor;
    private final MarketplaceRuntimeProperties marketplaceRuntimeProperties;
    private final Clock clock;

    public PaymentSettlementService(
            CurrencyAdapter currencyAdapter,
            MarketplaceStorageAdapter storageAdapter,
            @Qualifier(MarketplaceConfig.SETTLEMENT_VERIFIER_EXECUTOR) AsyncTaskExecutor verifierExecutor,
            MarketplaceRuntimeProperties marketplaceRuntimeProperties,
            Clock clock
    ) {
        this.currencyAdapter = currencyAdapter;
        this.storageAdapter = storageAdapter;
        this.verifierExecutor = verifierExecutor;
        this.marketplaceRuntimeProperties = marketplaceRuntimeProperties;
        this.clock = clock;
    }

    public SettlementResult settle(String txRef, BigDecimal requiredAmount, String requiredPayer, String idempotencyKey) {
        if (!StringUtils.hasText(txRef)) {
            throw MarketplaceException.invalidRequest("txRef is required");
        }
        if (requiredAmount == null || requiredAmount.signum() <= 0) {
            throw MarketplaceException.invalidPrice("requiredAmount must be greater than zero");
        }
        if (!StringUtils.hasText(requiredPayer)) {
            throw MarketplaceException.invalidRequest("requiredPayer is required");
        }
        if (!StringUtils.hasText(idempotencyKey)) {
            throw MarketplaceException.invalidRequest("idempotencyKey is required");
        }

        String canonicalRef = canonicalize(txRef);
        BigDecimal amount = UsdcAmounts.scale(requiredAmount);

        Optional<PaymentConsumption> existing = storageAdapter.findPaymentConsumption(canonicalRef);
        if (existing.isPresent()) {
            return replayOrReject(existing.get(), idempotencyKey);
        }

        PaymentVerification verification = verifyWithTimeout(txRef, amount, requiredPayer);
        if (!verification.valid()) {
            throw rejection(verification, amount, requiredPayer);
        }
        if (verification.payerWallet() != null && !verification.payerWallet().equals(requiredPayer)) {
            throw MarketplaceException.payerMismatch(
                    "Payment was made by " + verification.payerWallet() + ", expected " + requiredPayer
            );
        }
        BigDecimal confirmedAmount = verification.confirmedAmount() == null
                ? null
                : UsdcAmounts.scale(verification.confirmedAmount());
        if (confirmedAmount == null || confirmedAmount.compareTo(amount) < 0) {
            throw MarketplaceException.insufficientPayment(
                    "Payment confirmed " + confirmedAmount + " USDC, required " + amount
            );
        }

        PaymentConsumption consumption = new PaymentConsumption();
        consumption.setTxRef(canonicalRef);
        consumption.setIdempotencyKey(idempotencyKey);
        consumption.setPayerWallet(requiredPayer);
        consumption.setAmountUsdc(confirmedAmount);
        consumption.setConsumedAt(OffsetDateTime.now(clock));
        if (storageAdapter.recordPaymentConsumption(consumption)) {
            // a concurrent settlement recorded the same payment between our read and write
            PaymentConsumption winner = storageAdapter.findPaymentConsumption(canonicalRef)
                    .orElseThrow(() -> new IllegalStateException(
                            "Payment consumption reported present but not found: " + canonicalRef
                    ));
            return replayOrReject(winner, idempotencyKey);
        }

        log.info("Settled payment {} for key {}: {} USDC from {}", canonicalRef, idempotencyKey, confirmedAmount, requiredPayer);
        return new SettlementResult(true, confirmedAmount, requiredPayer, canonicalRef, idempotencyKey, false);
    }

    public String canonicalize(String txRef) {
        try {
            return currencyAdapter.canonicalReference(txRef);
        } catch (IllegalArgumentException ex) {
            throw MarketplaceException.paymentRejected("Malformed payment reference: " + ex.getMessage());
        }
    }

    public Optional<PaymentConsumption> findConsumption(String txRef) {
        return storageAdapter.findPaymentConsumption(canonicalize(txRef));
    }

    private SettlementResult replayOrReject(PaymentConsumption consumption, String idempotencyKey) {
        if (!consumption.getIdempotencyKey().equals(idempotencyKey)) {
            throw MarketplaceException.paymentAlreadyUsed(
                    "Payment " + consumption.getTxRef() + " was already used for " + consumption.getIdempotencyKey()
            );
        }
        log.debug("Replaying settlement of payment {} for key {}", consumption.getTxRef(), idempotencyKey);
        return new SettlementResult(
                true,
                consumption.getAmountUsdc(),
                consumption.getPayerWallet(),
                consumption.getTxRef(),
                idempotencyKey,
                true
        );
    }

    private PaymentVerification verifyWithTimeout(String txRef, BigDecimal amount, String requiredPayer) {
        long timeoutMs = marketplaceRuntimeProperties.getSettlement().getVerifyTimeoutMs();
        Future<PaymentVerification> future;
        try {
            future = verifierExecutor.submit(() -> currencyAdapter.verify(txRef, amount, requiredPayer));
        } catch (TaskRejectedException ex) {
            log.warn("Payment verification queue is full; rejecting {} as timed out", txRef);
            throw MarketplaceException.verificationTimeout("Payment verification is saturated, retry later", ex);
        }

        try {
            PaymentVerification verification = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (verification == null) {
                throw new IllegalStateException("Currency adapter returned no verification for " + txRef);
            }
            return verification;
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Payment verification of {} timed out after {} ms", txRef, timeoutMs);
            throw MarketplaceException.verificationTimeout("Payment verification timed out after " + timeoutMs + " ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw MarketplaceException.verificationTimeout("Payment verification was interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof CurrencyAdapterException adapterException) {
                if (adapterException.isTransientFailure()) {
                    log.warn("Transient currency adapter failure for {}: {}", txRef, adapterException.getMessage());
                    throw MarketplaceException.verificationTimeout(adapterException.getMessage(), adapterException);
                }
                throw MarketplaceException.paymentRejected(adapterException.getMessage());
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new IllegalStateException("Payment verification failed for " + txRef, cause);
        }
    }

    private MarketplaceException rejection(PaymentVerification verification, BigDecimal amount, String requiredPayer) {
        String reason = verification.failureReason() != null ? verification.failureReason() : "Payment was not accepted";
        if (verification.confirmedAmount() != null && verification.confirmedAmount().compareTo(amount) < 0) {
            return MarketplaceException.insufficientPayment(
                    reason + ": confirmed " + verification.confirmedAmount() + " USDC, required " + amount
            );
        }
        if (verification.payerWallet() != null && !verification.payerWallet().equals(requiredPayer)) {
            return MarketplaceException.payerMismatch(
                    reason + ": paid by " + verification.payerWallet() + ", expected " + requiredPayer
            );
        }
        return MarketplaceException.paymentRejected(reason);
    }
}
