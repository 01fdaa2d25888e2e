package com.dextrader.core.exchange;

import com.dextrader.core.error.ExchangeException;
import com.dextrader.core.error.TransientTransportException;
import com.dextrader.core.model.Candle;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.OrderRequest;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates an {@link ExchangeClient} with the shared rate budget, metrics and, for reads, retry and a
 * circuit breaker. Order submission and cancellation are not retried here: the order manager owns that
 * retry so that a single policy and idempotency key govern it.
 *
 * A delegate that meters its own network calls (the paper exchange over throttled market data) is
 * wrapped without a budget so that no request is charged twice.
 */
public final class ResilientExchangeClient implements ExchangeClient {
    private static final Logger logger = LoggerFactory.getLogger(ResilientExchangeClient.class);

    private final ExchangeClient delegate;
    private final ExchangeRateBudget budget;
    private final RetryPolicy readRetry;
    private final CircuitBreaker circuitBreaker;
    private final MeterRegistry meterRegistry;

    public ResilientExchangeClient(ExchangeClient delegate, RetryPolicy readRetry, MeterRegistry meterRegistry) {
        this(delegate, null, readRetry, meterRegistry);
    }

    public ResilientExchangeClient(ExchangeClient delegate, ExchangeRateBudget budget, RetryPolicy readRetry,
                                   MeterRegistry meterRegistry) {
        this.delegate = delegate;
        this.budget = budget;
        this.readRetry = readRetry;
        this.meterRegistry = meterRegistry;

        var cbConfig = CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .slidingWindowSize(10)
            .permittedNumberOfCallsInHalfOpenState(3)
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .recordException(e -> e instanceof TransientTransportException)
            .build();
        this.circuitBreaker = CircuitBreaker.of("exchange-reads", cbConfig);
        circuitBreaker.getEventPublisher()
            .onStateTransition(event -> logger.warn("Exchange circuit breaker: {}", event.getStateTransition()));
    }

    public String circuitBreakerState() {
        return circuitBreaker.getState().name();
    }

    private <T> T read(String operation, Supplier<T> call) {
        return timed(operation, () -> {
            try {
                return readRetry.execute(() -> circuitBreaker.executeSupplier(() -> throttled(call)));
            } catch (CallNotPermittedException e) {
                throw new TransientTransportException("Exchange circuit open for " + operation, e);
            }
        });
    }

    private <T> T write(String operation, Supplier<T> call) {
        return timed(operation, () -> throttled(call));
    }

    private <T> T throttled(Supplier<T> call) {
        return budget == null ? call.get() : budget.call(call);
    }

    private <T> T timed(String operation, Supplier<T> call) {
        Timer timer = Timer.builder("exchange.call")
            .tag("operation", operation)
            .register(meterRegistry);
        long start = System.nanoTime();
        try {
            T result = call.get();
            meterRegistry.counter("exchange.call.success", "operation", operation).increment();
            return result;
        } catch (ExchangeException e) {
            meterRegistry.counter("exchange.call.failure",
                "operation", operation,
                "error", e.getClass().getSimpleName()).increment();
            logger.debug("Exchange call {} failed: {}", operation, e.getMessage());
            throw e;
        } finally {
            timer.record(Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public List<Candle> getCandles(String symbol, Timeframe timeframe, int lookback) {
        return read("getCandles", () -> delegate.getCandles(symbol, timeframe, lookback));
    }

    @Override
    public Ticker getTicker(String symbol) {
        return read("getTicker", () -> delegate.getTicker(symbol));
    }

    @Override
    public MarketInfo getMarketInfo(String symbol) {
        return read("getMarketInfo", () -> delegate.getMarketInfo(symbol));
    }

    @Override
    public AccountSnapshot getAccountState() {
        return read("getAccountState", delegate::getAccountState);
    }

    @Override
    public OrderAck submitOrder(OrderRequest request) {
        return write("submitOrder", () -> delegate.submitOrder(request));
    }

    @Override
    public OrderAck cancelOrder(String symbol, String clientOrderId) {
        return write("cancelOrder", () -> delegate.cancelOrder(symbol, clientOrderId));
    }

    @Override
    public List<ExchangeOrder> getOpenOrders() {
        return read("getOpenOrders", delegate::getOpenOrders);
    }

    @Override
    public List<ExchangePosition> getPositions() {
        return read("getPositions", delegate::getPositions);
    }

    @Override
    public List<ExchangeFill> getRecentFills(Instant since) {
        return read("getRecentFills", () -> delegate.getRecentFills(since));
    }
}
