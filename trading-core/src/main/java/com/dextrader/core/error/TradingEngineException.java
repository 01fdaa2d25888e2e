package com.dextrader.core.error;

/**
 * Root of the engine's exception hierarchy.
 */
public class TradingEngineException extends RuntimeException {
    public TradingEngineException(String message) {
        super(message);
    }

    public TradingEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
