package com.dextrader.core.error;

public class UnknownOrderException extends TradingEngineException {
    public UnknownOrderException(String clientOrderId) {
        super("Unknown order: " + clientOrderId);
    }
}
