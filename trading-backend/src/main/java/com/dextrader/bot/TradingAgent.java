package com.dextrader.bot;

import com.dextrader.config.ObjectMappers;
import com.dextrader.config.TradingConfig;
import com.dextrader.core.exchange.ExchangeRateBudget;
import com.dextrader.core.exchange.ResilientExchangeClient;
import com.dextrader.core.exchange.RetryPolicy;
import com.dextrader.core.execution.OrderManager;
import com.dextrader.core.metrics.EngineMetrics;
import com.dextrader.core.orchestrator.TradingOrchestrator;
import com.dextrader.core.position.PositionTracker;
import com.dextrader.core.risk.EquityWatermark;
import com.dextrader.core.risk.RiskManager;
import com.dextrader.exchange.HyperliquidInfoClient;
import com.dextrader.exchange.PaperExchangeClient;
import com.dextrader.exchange.ThrottledMarketData;
import com.dextrader.monitoring.MetricsServer;
import com.dextrader.persistence.EngineStateStore;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Entry point: wires configuration, market data, the paper exchange, persistence and the orchestrator,
 * then runs until the JVM is asked to stop.
 */
public final class TradingAgent {
    private static final Logger logger = LoggerFactory.getLogger(TradingAgent.class);

    private TradingAgent() {
    }

    public static void main(String[] args) {
        TradingConfig config;
        try {
            config = TradingConfig.load();
        } catch (IllegalStateException | IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
            return;
        }
        if (!config.accountAddress().isBlank()) {
            logger.warn("Account {} configured, but live order signing is not available; trading on paper",
                config.accountAddress());
        }

        var clock = Clock.systemUTC();
        var objectMapper = ObjectMappers.create();
        var registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        var settings = config.engineSettings();

        // the paper book is in memory, so the budget meters its market data requests only
        var budget = new ExchangeRateBudget(config.rateLimitRequestsPerSecond());
        var marketData = new ThrottledMarketData(
            new HyperliquidInfoClient(config.apiUrl(), objectMapper, clock), budget);
        var paper = new PaperExchangeClient(marketData, settings.timeframe(), config.paperStartingEquity(),
            settings.riskLimits().maxLeverage(), clock);
        var exchange = new ResilientExchangeClient(paper,
            new RetryPolicy("exchange-read", config.retrySettings()),
            registry);

        var positions = new PositionTracker();
        var orderManager = new OrderManager(exchange, new RetryPolicy("order-submit", config.retrySettings()),
            positions, clock, config.orderMaxAge());
        var store = new EngineStateStore(config.stateDbPath(), objectMapper);
        var orchestrator = new TradingOrchestrator(settings, exchange, orderManager, positions, new RiskManager(),
            new EquityWatermark(config.paperStartingEquity()), new EngineMetrics(registry), store, clock);

        MetricsServer metricsServer = null;
        if (config.metricsPort() > 0) {
            metricsServer = new MetricsServer(registry, orchestrator::status, () -> !orchestrator.isCancelled(),
                exchange::circuitBreakerState, objectMapper, clock);
            metricsServer.start(config.metricsPort());
        }

        var stopped = new CountDownLatch(1);
        final MetricsServer server = metricsServer;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping agent...");
            try {
                orchestrator.shutdown();
            } finally {
                if (server != null) {
                    server.stop();
                }
                store.close();
                stopped.countDown();
            }
        }, "shutdown-hook"));

        orchestrator.start();
        logger.info("DEX trading agent running: {} on {}", settings.strategies(), settings.symbols());

        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Main thread interrupted, exiting");
        }
    }
}
