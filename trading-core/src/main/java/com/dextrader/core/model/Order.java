package com.dextrader.core.model;

import java.time.Instant;

/**
 * Immutable view of an order owned by the order manager. Every change produces a new instance;
 * status changes are validated against {@link OrderStatus#canTransitionTo(OrderStatus)}.
 */
public record Order(
    OrderRequest request,
    OrderStatus status,
    String exchangeOrderId,
    double filledSize,
    double averageFillPrice,
    Instant createdAt,
    Instant updatedAt,
    String statusReason
) {
    public static Order pending(OrderRequest request, Instant now) {
        return new Order(request, OrderStatus.PENDING, null, 0.0, 0.0, now, now, null);
    }

    public String clientOrderId() {
        return request.clientOrderId();
    }

    public String symbol() {
        return request.symbol();
    }

    public String strategyId() {
        return request.strategyId();
    }

    public Side side() {
        return request.side();
    }

    public double size() {
        return request.size();
    }

    public PairKey pair() {
        return request.pair();
    }

    public boolean isLive() {
        return !status.isTerminal();
    }

    public double remainingSize() {
        return Math.max(0.0, request.size() - filledSize);
    }

    public Order transitionTo(OrderStatus next, Instant now, String reason) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(String.format("Illegal order transition %s -> %s for %s",
                status, next, request.clientOrderId()));
        }
        return new Order(request, next, exchangeOrderId, filledSize, averageFillPrice, createdAt, now,
            reason != null ? reason : statusReason);
    }

    public Order withExchangeOrderId(String id, Instant now) {
        return new Order(request, status, id, filledSize, averageFillPrice, createdAt, now, statusReason);
    }

    /**
     * Records the cumulative filled size reported by the exchange. Cumulative fills never decrease.
     */
    public Order withCumulativeFill(double cumulativeFilled, double averagePrice, Instant now) {
        double filled = Math.max(filledSize, Math.min(cumulativeFilled, request.size()));
        double price = averagePrice > 0.0 ? averagePrice : averageFillPrice;
        return new Order(request, status, exchangeOrderId, filled, price, createdAt, now, statusReason);
    }
}
