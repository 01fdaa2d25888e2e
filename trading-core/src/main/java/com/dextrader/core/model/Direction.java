package com.dextrader.core.model;

public enum Direction {
    LONG,
    SHORT,
    FLAT;

    public Direction opposite() {
        return switch (this) {
            case LONG -> SHORT;
            case SHORT -> LONG;
            case FLAT -> FLAT;
        };
    }
}
