package com.dextrader.core.model;

public enum Side {
    BUY,
    SELL;

    /** +1 for buys, -1 for sells. */
    public int sign() {
        return this == BUY ? 1 : -1;
    }

    public Side opposite() {
        return this == BUY ? SELL : BUY;
    }

    public static Side opening(Direction direction) {
        return switch (direction) {
            case LONG -> BUY;
            case SHORT -> SELL;
            case FLAT -> throw new IllegalArgumentException("FLAT has no opening side");
        };
    }
}
