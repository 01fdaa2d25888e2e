package com.dextrader.core.model;

/**
 * Order the engine wants placed. {@code clientOrderId} is generated by the caller and is the
 * idempotency key for the whole lifecycle of the order.
 *
 * @param price limit price, {@code null} for market orders
 */
public record OrderRequest(
    String clientOrderId,
    String symbol,
    String strategyId,
    Side side,
    OrderType type,
    Double price,
    double size,
    boolean reduceOnly,
    boolean postOnly
) {
    public OrderRequest {
        if (clientOrderId == null || clientOrderId.isBlank()) {
            throw new IllegalArgumentException("clientOrderId is required");
        }
        if (size <= 0.0 || Double.isNaN(size)) {
            throw new IllegalArgumentException("Order size must be positive: " + size);
        }
        if (type == OrderType.LIMIT && (price == null || price <= 0.0)) {
            throw new IllegalArgumentException("Limit orders need a positive price");
        }
    }

    public static OrderRequest market(String clientOrderId, String symbol, String strategyId,
                                      Side side, double size, boolean reduceOnly) {
        return new OrderRequest(clientOrderId, symbol, strategyId, side, OrderType.MARKET, null, size, reduceOnly, false);
    }

    public static OrderRequest limit(String clientOrderId, String symbol, String strategyId,
                                     Side side, double price, double size, boolean postOnly) {
        return new OrderRequest(clientOrderId, symbol, strategyId, side, OrderType.LIMIT, price, size, false, postOnly);
    }

    public PairKey pair() {
        return new PairKey(symbol, strategyId);
    }
}
