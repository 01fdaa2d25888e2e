package com.dextrader.core.exchange;

import com.dextrader.core.model.Candle;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Narrow port to an exchange. Implementations throw
 * {@link com.dextrader.core.error.TransientTransportException} for retryable transport failures and
 * {@link com.dextrader.core.error.ExchangeRejectionException} when the exchange refuses a request.
 */
public interface ExchangeClient {

    /**
     * Most recent {@code lookback} candles, oldest first. The last one may still be open.
     */
    List<Candle> getCandles(String symbol, Timeframe timeframe, int lookback);

    Ticker getTicker(String symbol);

    MarketInfo getMarketInfo(String symbol);

    AccountSnapshot getAccountState();

    /**
     * Places an order. Submitting a client order id the exchange already knows must not create a second order.
     */
    OrderAck submitOrder(OrderRequest request);

    OrderAck cancelOrder(String symbol, String clientOrderId);

    List<ExchangeOrder> getOpenOrders();

    List<ExchangePosition> getPositions();

    /** Fills executed at or after {@code since}. */
    List<ExchangeFill> getRecentFills(Instant since);
}
