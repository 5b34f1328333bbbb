package com.bazaar.marketplace.provider;

import lombok.Getter;

/**
 * Raised by a currency adapter that could not reach a verdict. Transient failures
 * (RPC unavailable, confirmation still pending) may be retried with the same reference.
 */
@Getter
public class CurrencyAdapterException extends RuntimeException {

    private final boolean transientFailure;

    public CurrencyAdapterException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public CurrencyAdapterException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }
}
