package com.dextrader.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Candle interval. Codes match the exchange's interval strings.
 */
public enum Timeframe {
    M1("1m", Duration.ofMinutes(1)),
    M5("5m", Duration.ofMinutes(5)),
    M15("15m", Duration.ofMinutes(15)),
    H1("1h", Duration.ofHours(1)),
    H4("4h", Duration.ofHours(4)),
    D1("1d", Duration.ofDays(1));

    private final String code;
    private final Duration duration;

    Timeframe(String code, Duration duration) {
        this.code = code;
        this.duration = duration;
    }

    public String code() {
        return code;
    }

    public Duration duration() {
        return duration;
    }

    /**
     * Close time of the candle that is open at {@code instant}, i.e. the next boundary strictly after it.
     */
    public Instant nextBoundary(Instant instant) {
        long millis = duration.toMillis();
        long epochMillis = instant.toEpochMilli();
        return Instant.ofEpochMilli((Math.floorDiv(epochMillis, millis) + 1) * millis);
    }

    public static Timeframe fromCode(String code) {
        return Arrays.stream(values())
            .filter(tf -> tf.code.equalsIgnoreCase(code.trim()))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown timeframe: " + code));
    }
}
