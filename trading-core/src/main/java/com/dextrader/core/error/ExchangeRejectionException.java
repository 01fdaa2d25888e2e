package com.dextrader.core.error;

/**
 * The exchange refused the request (invalid size, insufficient margin, ...). Never retried.
 */
public class ExchangeRejectionException extends ExchangeException {
    private final String clientOrderId;

    public ExchangeRejectionException(String clientOrderId, String reason) {
        super(reason);
        this.clientOrderId = clientOrderId;
    }

    public String getClientOrderId() {
        return clientOrderId;
    }
}
