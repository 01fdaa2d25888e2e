package com.dextrader.core.exchange;

import java.time.Duration;

/**
 * @param maxAttempts total attempts including the first one
 * @param initialBackoff wait before the second attempt; each later wait is multiplied by {@code multiplier}
 */
public record RetrySettings(int maxAttempts, Duration initialBackoff, double multiplier) {
    public RetrySettings {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
    }

    public static RetrySettings defaults() {
        return new RetrySettings(3, Duration.ofMillis(500), 2.0);
    }
}
