package com.dextrader.core.exchange;

import com.dextrader.core.model.OrderType;
import com.dextrader.core.model.Side;

/**
 * An order resting on the exchange.
 *
 * @param clientOrderId id given at submission, null for orders placed outside the engine
 */
public record ExchangeOrder(
    String clientOrderId,
    String exchangeOrderId,
    String symbol,
    Side side,
    OrderType type,
    double price,
    double size,
    double filledSize
) {
}
