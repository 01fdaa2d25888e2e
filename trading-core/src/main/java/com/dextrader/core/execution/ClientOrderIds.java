package com.dextrader.core.execution;

import com.dextrader.core.model.PairKey;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Client order ids of the form {@code dx:<symbol>:<strategy>:<epochMillis>:<sequence>}. The pair is
 * recoverable from the id, so orders found on the exchange after a restart can be attributed.
 */
public final class ClientOrderIds {
    private static final String PREFIX = "dx";
    private static final String SEPARATOR = ":";
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private ClientOrderIds() {
    }

    public static String next(PairKey pair, Instant now) {
        return String.join(SEPARATOR, PREFIX, pair.symbol(), pair.strategyId(),
            Long.toString(now.toEpochMilli()), Long.toString(SEQUENCE.incrementAndGet()));
    }

    public static Optional<PairKey> pairOf(String clientOrderId) {
        if (clientOrderId == null) {
            return Optional.empty();
        }
        String[] parts = clientOrderId.split(SEPARATOR);
        if (parts.length != 5 || !PREFIX.equals(parts[0])) {
            return Optional.empty();
        }
        return Optional.of(new PairKey(parts[1], parts[2]));
    }
}
