package com.dextrader.core.model;

public enum RejectionReason {
    INVALID_INTENT,
    LEVERAGE,
    POSITION_CAP,
    DAILY_LOSS,
    DRAWDOWN,
    SIZE_TOO_SMALL
}
