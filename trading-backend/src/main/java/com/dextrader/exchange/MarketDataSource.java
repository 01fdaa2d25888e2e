package com.dextrader.exchange;

import com.dextrader.core.model.Candle;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;

import java.util.List;

/**
 * Read-only market data used by the paper exchange.
 */
public interface MarketDataSource {

    /** Most recent {@code lookback} candles, oldest first. */
    List<Candle> getCandles(String symbol, Timeframe timeframe, int lookback);

    Ticker getTicker(String symbol);

    MarketInfo getMarketInfo(String symbol);
}
