package com.dextrader.core.error;

/**
 * Failure reported by, or while talking to, the exchange.
 */
public class ExchangeException extends TradingEngineException {
    public ExchangeException(String message) {
        super(message);
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
