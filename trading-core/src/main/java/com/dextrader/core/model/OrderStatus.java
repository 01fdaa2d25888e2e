package com.dextrader.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Order lifecycle. Transitions only move forward; a terminal status is never left.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIALLY_FILLED,
    FILLED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    public boolean canTransitionTo(OrderStatus next) {
        return allowedNext().contains(next);
    }

    private Set<OrderStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(OPEN, PARTIALLY_FILLED, FILLED, CANCELLED, REJECTED);
            case OPEN -> EnumSet.of(OPEN, PARTIALLY_FILLED, FILLED, CANCELLED);
            case PARTIALLY_FILLED -> EnumSet.of(PARTIALLY_FILLED, FILLED, CANCELLED);
            case FILLED, CANCELLED, REJECTED -> EnumSet.noneOf(OrderStatus.class);
        };
    }
}
