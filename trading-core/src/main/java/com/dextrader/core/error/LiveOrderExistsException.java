package com.dextrader.core.error;

import com.dextrader.core.model.PairKey;

/**
 * A second live order was requested for a (symbol, strategy) pair that already has one.
 */
public class LiveOrderExistsException extends TradingEngineException {
    private final PairKey pair;
    private final String liveClientOrderId;

    public LiveOrderExistsException(PairKey pair, String liveClientOrderId) {
        super(String.format("%s already has live order %s", pair, liveClientOrderId));
        this.pair = pair;
        this.liveClientOrderId = liveClientOrderId;
    }

    public PairKey getPair() {
        return pair;
    }

    public String getLiveClientOrderId() {
        return liveClientOrderId;
    }
}
