package com.bazaar.marketplace.provider;

import java.util.Optional;

/**
 * Reads a transfer signature back from the chain.
 */
public interface X402TransactionConfirmer {

    /**
     * @param mint      token mint whose balances are inspected
     * @param recipient wallet that owns the receiving token account
     * @return the confirmed movement of {@code mint} into {@code recipient}'s accounts, or empty if the
     *         transaction never appeared or failed on chain
     * @throws CurrencyAdapterException (transient) if the chain could not be queried
     */
    Optional<ConfirmedTransfer> findTransfer(String signature, String mint, String recipient);
}
