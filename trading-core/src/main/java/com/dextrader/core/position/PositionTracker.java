package com.dextrader.core.position;

import com.dextrader.core.exchange.ExchangePosition;
import com.dextrader.core.execution.ReconciliationMismatch;
import com.dextrader.core.model.FillEvent;
import com.dextrader.core.model.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-process view of exposure per symbol. Changed only by confirmed fills and reconciliation
 * overwrites; never from orders that have not filled.
 */
public final class PositionTracker {
    private static final Logger logger = LoggerFactory.getLogger(PositionTracker.class);
    private static final double SIZE_EPSILON = 1e-9;

    private final Map<String, Entry> entries = new HashMap<>();
    private LocalDate pnlDay;
    private double realizedToday;
    private Instant lastReconciledAt;

    /**
     * Applies a confirmed fill: adds to the position at a size-weighted entry price, or reduces it and
     * realizes PnL against the entry price. A fill larger than the position flips it at the fill price.
     */
    public synchronized void applyFill(FillEvent fill) {
        Entry entry = entries.computeIfAbsent(fill.symbol(), s -> new Entry());
        double signed = fill.signedSize();
        double price = fill.price();

        if (Math.abs(entry.netSize) < SIZE_EPSILON) {
            entry.netSize = signed;
            entry.entryPrice = price;
        } else if (Math.signum(entry.netSize) == Math.signum(signed)) {
            double total = Math.abs(entry.netSize) + Math.abs(signed);
            entry.entryPrice = (Math.abs(entry.netSize) * entry.entryPrice + Math.abs(signed) * price) / total;
            entry.netSize += signed;
        } else {
            double closing = Math.min(Math.abs(entry.netSize), Math.abs(signed));
            double realized = closing * (price - entry.entryPrice) * Math.signum(entry.netSize);
            entry.realizedPnl += realized;
            addRealizedToday(realized, fill.filledAt());

            double remaining = entry.netSize + signed;
            if (Math.abs(remaining) < SIZE_EPSILON) {
                entry.netSize = 0.0;
                entry.entryPrice = 0.0;
            } else {
                if (Math.signum(remaining) != Math.signum(entry.netSize)) {
                    entry.entryPrice = price;
                }
                entry.netSize = remaining;
            }
        }
        entry.markPrice = price;
        logger.atInfo()
            .addKeyValue("symbol", fill.symbol())
            .addKeyValue("clientOrderId", fill.clientOrderId())
            .log("{}: fill {} {} @ {} -> net {}", fill.symbol(), fill.side(), fill.size(), price, entry.netSize);
    }

    /**
     * Overwrites local positions with the exchange's. Symbols the exchange does not report are flat.
     *
     * @return the differences that were corrected
     */
    public List<ReconciliationMismatch> reconcile(List<ExchangePosition> positions, Instant at) {
        return reconcile(positions, at, Set.of());
    }

    /**
     * As {@link #reconcile(List, Instant)}, leaving the symbols in {@code unsettled} untouched: their
     * local state already reflects fills newer than the reported positions.
     */
    public synchronized List<ReconciliationMismatch> reconcile(List<ExchangePosition> positions, Instant at,
                                                               Set<String> unsettled) {
        List<ReconciliationMismatch> mismatches = new ArrayList<>();
        Set<String> reported = new HashSet<>(unsettled);
        for (ExchangePosition reportedPosition : positions) {
            String symbol = reportedPosition.symbol();
            if (!reported.add(symbol)) {
                continue;
            }
            Entry entry = entries.get(symbol);
            if (entry == null) {
                entry = new Entry();
                entries.put(symbol, entry);
                if (Math.abs(reportedPosition.netSize()) >= SIZE_EPSILON) {
                    mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.POSITION_UNKNOWN,
                        symbol, symbol, "none", describe(reportedPosition.netSize(), reportedPosition.entryPrice())));
                }
            } else if (Math.abs(entry.netSize - reportedPosition.netSize()) >= SIZE_EPSILON
                || (Math.abs(entry.netSize) >= SIZE_EPSILON
                    && Math.abs(entry.entryPrice - reportedPosition.entryPrice()) > 1e-6 * Math.max(1.0, entry.entryPrice))) {
                mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.POSITION_SIZE, symbol, symbol,
                    describe(entry.netSize, entry.entryPrice),
                    describe(reportedPosition.netSize(), reportedPosition.entryPrice())));
            }
            entry.netSize = reportedPosition.netSize();
            entry.entryPrice = reportedPosition.entryPrice();
            entry.realizedPnl = reportedPosition.realizedPnl();
            entry.markPrice = reportedPosition.markPrice();
            entry.reconciledAt = at;
        }
        for (Map.Entry<String, Entry> local : entries.entrySet()) {
            if (reported.contains(local.getKey())) {
                continue;
            }
            Entry entry = local.getValue();
            if (Math.abs(entry.netSize) >= SIZE_EPSILON) {
                mismatches.add(new ReconciliationMismatch(ReconciliationMismatch.Kind.POSITION_MISSING,
                    local.getKey(), local.getKey(), describe(entry.netSize, entry.entryPrice), "flat"));
            }
            entry.netSize = 0.0;
            entry.entryPrice = 0.0;
            entry.reconciledAt = at;
        }
        lastReconciledAt = at;
        return mismatches;
    }

    private static String describe(double netSize, double entryPrice) {
        return String.format("%s@%s", netSize, entryPrice);
    }

    /**
     * Current position with unrealized PnL computed from the latest mark price.
     */
    public synchronized Position get(String symbol) {
        Entry entry = entries.get(symbol);
        if (entry == null) {
            return Position.flat(symbol);
        }
        double unrealized = entry.netSize == 0.0 || entry.markPrice <= 0.0
            ? 0.0
            : entry.netSize * (entry.markPrice - entry.entryPrice);
        return new Position(symbol, entry.netSize, entry.entryPrice, unrealized, entry.realizedPnl,
            entry.markPrice, entry.reconciledAt);
    }

    public synchronized List<Position> all() {
        List<Position> result = new ArrayList<>();
        for (String symbol : entries.keySet()) {
            result.add(get(symbol));
        }
        return result;
    }

    public synchronized void updateMark(String symbol, double markPrice) {
        if (markPrice > 0.0) {
            entries.computeIfAbsent(symbol, s -> new Entry()).markPrice = markPrice;
        }
    }

    /** Sum of absolute position notionals at mark (entry price when no mark is known). */
    public synchronized double totalNotional() {
        double total = 0.0;
        for (Entry entry : entries.values()) {
            double price = entry.markPrice > 0.0 ? entry.markPrice : entry.entryPrice;
            total += Math.abs(entry.netSize) * price;
        }
        return total;
    }

    /**
     * Realized PnL from fills since the start of the current UTC day.
     */
    public synchronized double realizedPnlToday(Instant now) {
        rollDay(now);
        return realizedToday;
    }

    /**
     * Seeds today's realized PnL, e.g. after a restart.
     */
    public synchronized void restoreRealizedToday(double realized, Instant now) {
        rollDay(now);
        realizedToday = realized;
    }

    public synchronized Optional<Instant> lastReconciledAt() {
        return Optional.ofNullable(lastReconciledAt);
    }

    private void addRealizedToday(double realized, Instant at) {
        rollDay(at);
        if (at.atZone(ZoneOffset.UTC).toLocalDate().equals(pnlDay)) {
            realizedToday += realized;
        }
    }

    private void rollDay(Instant now) {
        LocalDate today = now.atZone(ZoneOffset.UTC).toLocalDate();
        if (pnlDay == null || today.isAfter(pnlDay)) {
            if (pnlDay != null) {
                logger.info("New UTC day {}: realized PnL for {} was {}", today, pnlDay, String.format("%.2f", realizedToday));
            }
            pnlDay = today;
            realizedToday = 0.0;
        }
    }

    private static final class Entry {
        double netSize;
        double entryPrice;
        double realizedPnl;
        double markPrice;
        Instant reconciledAt;
    }
}
