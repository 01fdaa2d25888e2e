package com.dextrader.monitoring;

import com.dextrader.core.orchestrator.PairStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Supplier;

/**
 * Ops endpoint: {@code /health}, Prometheus {@code /metrics} and {@code /state} with pair states and positions.
 */
public final class MetricsServer {
    private static final Logger logger = LoggerFactory.getLogger(MetricsServer.class);

    private final Javalin app;
    private final PrometheusMeterRegistry registry;
    private final Supplier<List<PairStatus>> status;
    private final BooleanSupplier running;
    private final Supplier<String> circuitBreakerState;
    private final Clock clock;

    public enum Health { UP, DEGRADED, DOWN }

    public record HealthReport(Health status, String circuitBreaker, int pairs, Instant checkedAt) {
    }

    public MetricsServer(PrometheusMeterRegistry registry,
                         Supplier<List<PairStatus>> status,
                         BooleanSupplier running,
                         Supplier<String> circuitBreakerState,
                         ObjectMapper objectMapper,
                         Clock clock) {
        this.registry = registry;
        this.status = status;
        this.running = running;
        this.circuitBreakerState = circuitBreakerState;
        this.clock = clock;

        this.app = Javalin.create(javalinConfig -> {
            javalinConfig.showJavalinBanner = false;
            javalinConfig.jsonMapper(new JavalinJackson(objectMapper, false));
        });

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(registry.scrape());
        });

        app.get("/health", ctx -> {
            HealthReport health = health();
            ctx.status(health.status() == Health.DOWN ? 503 : 200);
            ctx.json(health);
        });

        app.get("/state", ctx -> ctx.json(status.get()));
    }

    /**
     * DOWN once the engine stopped, DEGRADED while exchange reads are short-circuited.
     */
    HealthReport health() {
        String breaker = circuitBreakerState.get();
        Health health;
        if (!running.getAsBoolean()) {
            health = Health.DOWN;
        } else if ("OPEN".equals(breaker) || "FORCED_OPEN".equals(breaker)) {
            health = Health.DEGRADED;
        } else {
            health = Health.UP;
        }
        return new HealthReport(health, breaker, status.get().size(), clock.instant());
    }

    public void start(int port) {
        app.start(port);
        logger.info("Metrics server started at http://localhost:{}", app.port());
        logger.info("   Health: http://localhost:{}/health", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
        logger.info("   State: http://localhost:{}/state", app.port());
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Metrics server stopped");
    }
}
