package com.dextrader.core.model;

public enum OrderType {
    MARKET,
    LIMIT
}
