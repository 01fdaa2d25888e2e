package com.dextrader.exchange;

import com.dextrader.core.exchange.ExchangeRateBudget;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;

import java.util.List;

/**
 * Charges every market data request to the shared exchange rate budget, including the ones the paper
 * exchange makes on its own to price and match orders.
 */
public final class ThrottledMarketData implements MarketDataSource {
    private final MarketDataSource delegate;
    private final ExchangeRateBudget budget;

    public ThrottledMarketData(MarketDataSource delegate, ExchangeRateBudget budget) {
        this.delegate = delegate;
        this.budget = budget;
    }

    @Override
    public List<Candle> getCandles(String symbol, Timeframe timeframe, int lookback) {
        return budget.call(() -> delegate.getCandles(symbol, timeframe, lookback));
    }

    @Override
    public Ticker getTicker(String symbol) {
        return budget.call(() -> delegate.getTicker(symbol));
    }

    @Override
    public MarketInfo getMarketInfo(String symbol) {
        return budget.call(() -> delegate.getMarketInfo(symbol));
    }
}
