package com.dextrader.persistence;

import com.dextrader.core.model.Order;
import com.dextrader.core.model.PairKey;
import com.dextrader.core.orchestrator.EngineStateSink;
import com.dextrader.core.orchestrator.PairSnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.locks.StampedLock;
import java.util.stream.Collectors;

/**
 * SQLite store for crash recovery: one row per (symbol, strategy) with the last pair snapshot as JSON,
 * plus the realized PnL per UTC day and the equity peak used for drawdown.
 *
 * Thread-Safety: StampedLock, read lock for loads and write lock for upserts.
 */
public final class EngineStateStore implements EngineStateSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EngineStateStore.class);

    private final Connection connection;
    private final ObjectMapper objectMapper;
    private final StampedLock lock = new StampedLock();

    public EngineStateStore(String dbPath, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        try {
            connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath);
            createTables();
            logger.info("Engine state store initialized: {}", dbPath);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to initialize engine state store at " + dbPath, e);
        }
    }

    private void createTables() throws SQLException {
        String stateSql = """
            CREATE TABLE IF NOT EXISTS engine_state (
                symbol TEXT NOT NULL,
                strategy_id TEXT NOT NULL,
                state TEXT NOT NULL,
                entry_price REAL,
                live_order_ids TEXT,
                payload TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                PRIMARY KEY (symbol, strategy_id)
            )
            """;
        String pnlSql = """
            CREATE TABLE IF NOT EXISTS daily_pnl (
                day TEXT PRIMARY KEY,
                realized REAL NOT NULL
            )
            """;
        String watermarkSql = """
            CREATE TABLE IF NOT EXISTS equity_watermark (
                id INTEGER PRIMARY KEY CHECK (id = 1),
                peak REAL NOT NULL
            )
            """;

        long stamp = lock.writeLock();
        try (var stmt = connection.createStatement()) {
            stmt.execute(stateSql);
            stmt.execute(pnlSql);
            stmt.execute(watermarkSql);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public void save(PairSnapshot snapshot) {
        String sql = """
            INSERT INTO engine_state (symbol, strategy_id, state, entry_price, live_order_ids, payload, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(symbol, strategy_id) DO UPDATE SET
                state = excluded.state,
                entry_price = excluded.entry_price,
                live_order_ids = excluded.live_order_ids,
                payload = excluded.payload,
                updated_at = excluded.updated_at
            """;
        String payload;
        try {
            payload = objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize state for " + snapshot.pair(), e);
        }
        String liveOrderIds = snapshot.liveOrders().stream()
            .map(Order::clientOrderId)
            .collect(Collectors.joining(","));

        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, snapshot.pair().symbol());
            stmt.setString(2, snapshot.pair().strategyId());
            stmt.setString(3, snapshot.strategy().state().name());
            stmt.setDouble(4, snapshot.strategy().entryPrice());
            stmt.setString(5, liveOrderIds);
            stmt.setString(6, payload);
            stmt.setString(7, snapshot.savedAt().toString());
            stmt.executeUpdate();
            logger.debug("{}: state saved ({})", snapshot.pair(), snapshot.strategy().state());
        } catch (SQLException e) {
            logger.error("Failed to save state for {}", snapshot.pair(), e);
            throw new IllegalStateException("Engine state write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Loads every stored snapshot. Rows that no longer deserialize are skipped with a warning.
     */
    @Override
    public Map<PairKey, PairSnapshot> loadAll() {
        Map<PairKey, PairSnapshot> result = new LinkedHashMap<>();
        long stamp = lock.readLock();
        try (var stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT symbol, strategy_id, payload FROM engine_state ORDER BY symbol, strategy_id")) {
            while (rs.next()) {
                PairKey pair = new PairKey(rs.getString("symbol"), rs.getString("strategy_id"));
                try {
                    result.put(pair, objectMapper.readValue(rs.getString("payload"), PairSnapshot.class));
                } catch (JsonProcessingException e) {
                    logger.warn("{}: stored state is unreadable, starting fresh: {}", pair, e.getOriginalMessage());
                }
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Engine state read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
        return result;
    }

    @Override
    public void saveRealizedPnl(LocalDate day, double realized) {
        String sql = """
            INSERT INTO daily_pnl (day, realized) VALUES (?, ?)
            ON CONFLICT(day) DO UPDATE SET realized = excluded.realized
            """;
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setString(1, day.toString());
            stmt.setDouble(2, realized);
            stmt.executeUpdate();
        } catch (SQLException e) {
            logger.error("Failed to save realized PnL for {}", day, e);
            throw new IllegalStateException("Daily PnL write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public OptionalDouble loadRealizedPnl(LocalDate day) {
        long stamp = lock.readLock();
        try (var stmt = connection.prepareStatement("SELECT realized FROM daily_pnl WHERE day = ?")) {
            stmt.setString(1, day.toString());
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? OptionalDouble.of(rs.getDouble("realized")) : OptionalDouble.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Daily PnL read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void savePeakEquity(double peak) {
        String sql = """
            INSERT INTO equity_watermark (id, peak) VALUES (1, ?)
            ON CONFLICT(id) DO UPDATE SET peak = excluded.peak
            """;
        long stamp = lock.writeLock();
        try (var stmt = connection.prepareStatement(sql)) {
            stmt.setDouble(1, peak);
            stmt.executeUpdate();
        } catch (SQLException e) {
            logger.error("Failed to save peak equity", e);
            throw new IllegalStateException("Peak equity write failed", e);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    @Override
    public OptionalDouble loadPeakEquity() {
        long stamp = lock.readLock();
        try (var stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT peak FROM equity_watermark WHERE id = 1")) {
            return rs.next() ? OptionalDouble.of(rs.getDouble("peak")) : OptionalDouble.empty();
        } catch (SQLException e) {
            throw new IllegalStateException("Peak equity read failed", e);
        } finally {
            lock.unlockRead(stamp);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
            logger.info("Engine state store closed");
        } catch (SQLException e) {
            logger.error("Error closing engine state store", e);
        }
    }
}
