package com.dextrader.core.exchange;

import com.dextrader.core.error.TransientTransportException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * The single retry policy for exchange calls: bounded attempts with exponential backoff, retrying only
 * {@link TransientTransportException}. After the last attempt the final exception is rethrown.
 */
public final class RetryPolicy {
    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);

    private final Retry retry;
    private final RetrySettings settings;

    public RetryPolicy(String name, RetrySettings settings) {
        this.settings = settings;
        var config = RetryConfig.custom()
            .maxAttempts(settings.maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                settings.initialBackoff().toMillis(), settings.multiplier()))
            .retryOnException(e -> e instanceof TransientTransportException)
            .build();
        this.retry = Retry.of(name, config);

        retry.getEventPublisher()
            .onRetry(event -> logger.warn("{}: attempt {} failed, retrying in {} ms: {}",
                event.getName(), event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"))
            .onError(event -> logger.error("{}: giving up after {} attempts: {}",
                event.getName(), event.getNumberOfRetryAttempts(),
                event.getLastThrowable() != null ? event.getLastThrowable().getMessage() : "unknown"));
    }

    public <T> T execute(Supplier<T> call) {
        return Retry.decorateSupplier(retry, call).get();
    }

    public RetrySettings settings() {
        return settings;
    }
}
