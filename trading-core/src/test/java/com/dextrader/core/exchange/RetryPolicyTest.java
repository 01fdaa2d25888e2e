package com.dextrader.core.exchange;

import com.dextrader.core.error.ExchangeRejectionException;
import com.dextrader.core.error.TransientTransportException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Retry policy")
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy("test", new RetrySettings(3, Duration.ofMillis(1), 2.0));

    @Test
    @DisplayName("Transient failures are retried until success")
    void retriesTransient() {
        AtomicInteger calls = new AtomicInteger();

        String result = policy.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientTransportException("timeout");
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("The last transient failure is rethrown after max attempts")
    void givesUp() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new TransientTransportException("503");
        })).isInstanceOf(TransientTransportException.class).hasMessage("503");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Rejections are not retried")
    void rejectionNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            calls.incrementAndGet();
            throw new ExchangeRejectionException("c-1", "insufficient margin");
        })).isInstanceOf(ExchangeRejectionException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Settings reject nonsensical values")
    void validatesSettings() {
        assertThatThrownBy(() -> new RetrySettings(0, Duration.ofMillis(1), 2.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetrySettings(3, Duration.ZERO, 2.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
