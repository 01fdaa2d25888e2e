package com.dextrader.core.exchange;

import com.dextrader.core.error.TransientTransportException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Request budget shared by every caller of the exchange. Each call acquires a permit first.
 *
 * On a rate-limit response the permitted rate is halved and all callers pause for a cool-down;
 * after a run of successes the rate is raised again until it is back at the configured limit.
 */
public final class ExchangeRateBudget {
    private static final Logger logger = LoggerFactory.getLogger(ExchangeRateBudget.class);
    private static final int SUCCESSES_BEFORE_RAISE = 10;

    private final RateLimiter rateLimiter;
    private final int maxPerSecond;
    private final Duration coolDown;

    private final ReentrantLock lock = new ReentrantLock();
    private final AtomicLong pausedUntilMillis = new AtomicLong(0);
    private final AtomicInteger consecutiveSuccesses = new AtomicInteger(0);

    public ExchangeRateBudget(int requestsPerSecond, Duration acquireTimeout, Duration coolDown) {
        if (requestsPerSecond < 1) {
            throw new IllegalArgumentException("requestsPerSecond must be at least 1");
        }
        this.maxPerSecond = requestsPerSecond;
        this.coolDown = coolDown;
        var config = RateLimiterConfig.custom()
            .limitForPeriod(requestsPerSecond)
            .limitRefreshPeriod(Duration.ofSeconds(1))
            .timeoutDuration(acquireTimeout)
            .build();
        this.rateLimiter = RateLimiter.of("exchange-budget", config);
        logger.info("Exchange rate budget: {} requests/s", requestsPerSecond);
    }

    public ExchangeRateBudget(int requestsPerSecond) {
        this(requestsPerSecond, Duration.ofSeconds(30), Duration.ofSeconds(2));
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws TransientTransportException if no permit could be obtained within the acquire timeout
     */
    public void acquire() {
        long waitMillis = pausedUntilMillis.get() - System.currentTimeMillis();
        if (waitMillis > 0) {
            LockSupport.parkNanos(TimeUnit.MILLISECONDS.toNanos(waitMillis));
        }
        if (!rateLimiter.acquirePermission()) {
            throw new TransientTransportException("Exchange rate budget exhausted", true, null);
        }
    }

    /**
     * Runs {@code call} under one permit and feeds its outcome back into the budget.
     */
    public <T> T call(Supplier<T> call) {
        acquire();
        try {
            T result = call.get();
            recordSuccess();
            return result;
        } catch (TransientTransportException e) {
            if (e.isRateLimited()) {
                recordRateLimited();
            }
            throw e;
        }
    }

    public void recordSuccess() {
        if (consecutiveSuccesses.incrementAndGet() < SUCCESSES_BEFORE_RAISE) {
            return;
        }
        lock.lock();
        try {
            consecutiveSuccesses.set(0);
            int current = currentLimit();
            if (current < maxPerSecond) {
                int raised = Math.min(maxPerSecond, current + Math.max(1, current / 2));
                rateLimiter.changeLimitForPeriod(raised);
                logger.debug("Rate budget raised to {}/s", raised);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * The exchange answered with a rate-limit error: slow everyone down.
     */
    public void recordRateLimited() {
        lock.lock();
        try {
            consecutiveSuccesses.set(0);
            int current = currentLimit();
            int lowered = Math.max(1, current / 2);
            rateLimiter.changeLimitForPeriod(lowered);
            pausedUntilMillis.set(System.currentTimeMillis() + coolDown.toMillis());
            logger.warn("Rate limited by exchange: budget {}/s -> {}/s, pausing {} ms", current, lowered,
                coolDown.toMillis());
        } finally {
            lock.unlock();
        }
    }

    public int currentLimit() {
        return rateLimiter.getRateLimiterConfig().getLimitForPeriod();
    }
}
