package com.dextrader.exchange;

import com.dextrader.core.error.TransientTransportException;
import com.dextrader.core.exchange.ExchangeRateBudget;
import com.dextrader.core.model.MarketInfo;
import com.dextrader.core.model.Ticker;
import com.dextrader.core.model.Timeframe;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Throttled market data")
class ThrottledMarketDataTest {

    @Mock
    private MarketDataSource delegate;

    @Test
    @DisplayName("Each request takes a permit from the shared budget")
    void requestsTakePermits() {
        ExchangeRateBudget budget = new ExchangeRateBudget(2, Duration.ZERO, Duration.ofMillis(1));
        ThrottledMarketData marketData = new ThrottledMarketData(delegate, budget);
        when(delegate.getTicker("BTC")).thenReturn(new Ticker("BTC", 99, 101, Instant.parse("2024-01-01T00:00:00Z")));
        when(delegate.getMarketInfo("BTC")).thenReturn(MarketInfo.defaults("BTC"));

        marketData.getTicker("BTC");
        marketData.getMarketInfo("BTC");

        assertThatThrownBy(() -> marketData.getCandles("BTC", Timeframe.M15, 2))
            .isInstanceOf(TransientTransportException.class)
            .hasMessageContaining("budget exhausted");
        verify(delegate, never()).getCandles(any(), any(), anyInt());
    }

    @Test
    @DisplayName("A rate-limited response lowers the shared budget")
    void rateLimitFeedsBudget() {
        ExchangeRateBudget budget = new ExchangeRateBudget(8, Duration.ofMillis(10), Duration.ofMillis(1));
        ThrottledMarketData marketData = new ThrottledMarketData(delegate, budget);
        when(delegate.getCandles("BTC", Timeframe.M15, 2))
            .thenThrow(new TransientTransportException("HTTP 429", true, null));

        assertThatThrownBy(() -> marketData.getCandles("BTC", Timeframe.M15, 2))
            .isInstanceOf(TransientTransportException.class);

        assertThat(budget.currentLimit()).isEqualTo(4);
    }
}
