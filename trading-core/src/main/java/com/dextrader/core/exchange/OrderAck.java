package com.dextrader.core.exchange;

import com.dextrader.core.model.OrderStatus;

/**
 * Exchange response to a submit or cancel.
 *
 * @param cumulativeFilled total size filled so far for the order
 * @param averagePrice average fill price, 0 when nothing filled
 */
public record OrderAck(
    String clientOrderId,
    String exchangeOrderId,
    OrderStatus status,
    double cumulativeFilled,
    double averagePrice,
    String message
) {
    public static OrderAck resting(String clientOrderId, String exchangeOrderId) {
        return new OrderAck(clientOrderId, exchangeOrderId, OrderStatus.OPEN, 0.0, 0.0, null);
    }

    public static OrderAck filled(String clientOrderId, String exchangeOrderId, double size, double price) {
        return new OrderAck(clientOrderId, exchangeOrderId, OrderStatus.FILLED, size, price, null);
    }

    public static OrderAck cancelled(String clientOrderId, String exchangeOrderId, double filled, double price) {
        return new OrderAck(clientOrderId, exchangeOrderId, OrderStatus.CANCELLED, filled, price, null);
    }
}
