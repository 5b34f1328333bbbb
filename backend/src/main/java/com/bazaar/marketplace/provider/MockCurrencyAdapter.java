package com.bazaar.marketplace.provider;

import com.bazaar.marketplace.config.MarketplaceRuntimeProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;

/**
 * Deterministic in-memory currency used for local runs and tests. Any well-formed reference
 * is accepted as a payment from the required payer, debited from a mock wallet balance.
 * A reference is debited once; verifying it again returns the first confirmation.
 */
@Component
@ConditionalOnProperty(
        prefix = "bazaar",
        name = "payment-mode",
        havingValue = "mock",
        matchIfMissing = true
)
public class MockCurrencyAdapter implements CurrencyAdapter {

    private static final Logger log = LoggerFactory.getLogger(MockCurrencyAdapter.class);
    private static final Pattern WELL_FORMED_REFERENCE = Pattern.compile("[A-Za-z0-9:_.\\-]{6,128}");
    private static final String NETWORK_ID = "mock";

    private final MarketplaceRuntimeProperties marketplaceRuntimeProperties;
    private final ConcurrentMap<String, BigDecimal> balances = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, PaymentVerification> confirmedPayments = new ConcurrentHashMap<>();

    public MockCurrencyAdapter(MarketplaceRuntimeProperties marketplaceRuntimeProperties) {
        this.marketplaceRuntimeProperties = marketplaceRuntimeProperties;
    }

    @Override
    public PaymentVerification verify(String txRef, BigDecimal requiredAmount, String requiredPayer) {
        if (txRef == null || !WELL_FORMED_REFERENCE.matcher(txRef).matches()) {
            return PaymentVerification.rejected(null, null, txRef, NETWORK_ID, "Malformed mock payment reference");
        }
        BigDecimal amount = UsdcAmounts.scale(requiredAmount);
        AtomicReference<PaymentVerification> shortfall = new AtomicReference<>();
        PaymentVerification confirmed = confirmedPayments.computeIfAbsent(txRef, ref -> debit(ref, amount, requiredPayer, shortfall));
        return confirmed != null ? confirmed : shortfall.get();
    }

    /**
     * @return the confirmation, or null when the payer is short (the rejection is left in {@code shortfall})
     */
    private PaymentVerification debit(
            String txRef,
            BigDecimal amount,
            String payer,
            AtomicReference<PaymentVerification> shortfall
    ) {
        AtomicReference<BigDecimal> available = new AtomicReference<>();
        AtomicReference<Boolean> debited = new AtomicReference<>(false);
        balances.compute(payer, (wallet, current) -> {
            BigDecimal balance = current != null ? current : defaultBalance();
            available.set(balance);
            if (balance.compareTo(amount) < 0) {
                return balance;
            }
            debited.set(true);
            return UsdcAmounts.scale(balance.subtract(amount));
        });

        if (!debited.get()) {
            log.debug("Mock payment {} short: wallet {} holds {} of {}", txRef, payer, available.get(), amount);
            shortfall.set(PaymentVerification.rejected(
                    available.get(),
                    payer,
                    txRef,
                    NETWORK_ID,
                    "Insufficient mock balance"
            ));
            return null;
        }
        return PaymentVerification.confirmed(amount, payer, txRef, NETWORK_ID);
    }

    @Override
    public PaymentChallenge createChallenge(PaymentChallengeRequest request) {
        return new PaymentChallenge(1, List.of(new PaymentChallenge.Requirements(
                "exact",
                NETWORK_ID,
                UsdcAmounts.toSmallestUnit(request.amountUsdc()),
                request.resource(),
                request.description(),
                "application/json",
                marketplaceRuntimeProperties.getMockCurrency().getTxRefPrefix() + "-treasury",
                30,
                "MOCK_USDC"
        )));
    }

    public BigDecimal getBalance(String wallet) {
        return balances.getOrDefault(Objects.requireNonNull(wallet, "wallet is required"), defaultBalance());
    }

    /**
     * Adds funds to a mock wallet, e.g. a refund or a test credit.
     */
    public BigDecimal credit(String wallet, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        return balances.merge(
                Objects.requireNonNull(wallet, "wallet is required"),
                UsdcAmounts.scale(defaultBalance().add(amount)),
                (current, ignored) -> UsdcAmounts.scale(current.add(amount))
        );
    }

    private BigDecimal defaultBalance() {
        return UsdcAmounts.scale(marketplaceRuntimeProperties.getMockCurrency().getDefaultBalanceUsdc());
    }
}
