package com.dextrader.core.error;

/**
 * Timeout, connection failure, 5xx or rate-limit response. Safe to retry with the same idempotency key.
 */
public class TransientTransportException extends ExchangeException {
    private final boolean rateLimited;

    public TransientTransportException(String message) {
        this(message, false, null);
    }

    public TransientTransportException(String message, Throwable cause) {
        this(message, false, cause);
    }

    public TransientTransportException(String message, boolean rateLimited, Throwable cause) {
        super(message, cause);
        this.rateLimited = rateLimited;
    }

    public boolean isRateLimited() {
        return rateLimited;
    }
}
