package com.pairtrader.engine.service.exchange;

import com.pairtrader.engine.exception.ExchangeException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RateLimitedExchangeGatewayTest {

    @Test
    void callsBeyondTheBudgetAreRejectedWith429() {
        ExchangeGateway delegate = mock(ExchangeGateway.class);
        when(delegate.fetchTicker("ETH/USDT")).thenReturn(new BigDecimal("3000"));
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(1)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        RateLimitedExchangeGateway gateway = new RateLimitedExchangeGateway(delegate, limiter, registry);

        assertThat(gateway.fetchTicker("ETH/USDT")).isEqualByComparingTo("3000");
        assertThatThrownBy(() -> gateway.fetchTicker("ETH/USDT"))
                .isInstanceOf(ExchangeException.class)
                .isInstanceOfSatisfying(ExchangeException.class, e -> assertThat(e.getStatusCode()).isEqualTo(429));

        verify(delegate, times(1)).fetchTicker("ETH/USDT");
        assertThat(registry.get("exchange_call_latency").tag("method", "fetchTicker").tag("status", "success")
                .timer().count()).isEqualTo(1);
        assertThat(registry.get("exchange_call_latency").tag("method", "fetchTicker").tag("status", "error")
                .timer().count()).isEqualTo(1);
    }

    @Test
    void delegateErrorsPassThroughUnchanged() {
        ExchangeGateway delegate = mock(ExchangeGateway.class);
        when(delegate.cancelOrder("ex-1", "ETH/USDT")).thenThrow(new ExchangeException("boom", 503, null));
        RateLimitedExchangeGateway gateway = new RateLimitedExchangeGateway(delegate,
                RateLimiter.ofDefaults("test"), new SimpleMeterRegistry());

        assertThatThrownBy(() -> gateway.cancelOrder("ex-1", "ETH/USDT"))
                .isInstanceOf(ExchangeException.class)
                .hasMessage("boom");
    }
}
