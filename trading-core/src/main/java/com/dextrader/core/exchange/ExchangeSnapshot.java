package com.dextrader.core.exchange;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative exchange state at {@code takenAt}: resting orders, positions and recent fills.
 */
public record ExchangeSnapshot(
    List<ExchangeOrder> openOrders,
    List<ExchangePosition> positions,
    List<ExchangeFill> fills,
    Instant takenAt
) {
    public ExchangeSnapshot {
        openOrders = List.copyOf(openOrders);
        positions = List.copyOf(positions);
        fills = List.copyOf(fills);
    }

    public Optional<ExchangeOrder> openOrder(String clientOrderId) {
        return openOrders.stream()
            .filter(o -> clientOrderId.equals(o.clientOrderId()))
            .findFirst();
    }

    /** Total size filled for the order across the snapshot's fills. */
    public double filledSize(String clientOrderId) {
        return fills.stream()
            .filter(f -> clientOrderId.equals(f.clientOrderId()))
            .mapToDouble(ExchangeFill::size)
            .sum();
    }

    /** Size-weighted average fill price for the order, 0 when it has no fills. */
    public double averageFillPrice(String clientOrderId) {
        double size = 0.0;
        double value = 0.0;
        for (ExchangeFill fill : fills) {
            if (clientOrderId.equals(fill.clientOrderId())) {
                size += fill.size();
                value += fill.size() * fill.price();
            }
        }
        return size > 0.0 ? value / size : 0.0;
    }
}
