package com.pairtrader.engine.service.exchange;

import com.pairtrader.engine.exception.ExchangeException;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderType;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Enforces the exchange request budget in front of any gateway and records call latency.
 * Retrying is left to the callers; this layer only throttles.
 */
@Slf4j
public class RateLimitedExchangeGateway implements ExchangeGateway {

    private final ExchangeGateway delegate;
    private final RateLimiter rateLimiter;
    private final MeterRegistry meterRegistry;

    public RateLimitedExchangeGateway(ExchangeGateway delegate, RateLimiter rateLimiter, MeterRegistry meterRegistry) {
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public ExchangeOrderUpdate createOrder(String symbol, OrderSide side, OrderType type,
                                           BigDecimal amount, BigDecimal price, String clientOrderId) {
        return call("createOrder", () -> delegate.createOrder(symbol, side, type, amount, price, clientOrderId));
    }

    @Override
    public ExchangeOrderUpdate cancelOrder(String exchangeId, String symbol) {
        return call("cancelOrder", () -> delegate.cancelOrder(exchangeId, symbol));
    }

    @Override
    public ExchangeOrderUpdate fetchOrder(String exchangeId, String symbol) {
        return call("fetchOrder", () -> delegate.fetchOrder(exchangeId, symbol));
    }

    @Override
    public BigDecimal fetchTicker(String symbol) {
        return call("fetchTicker", () -> delegate.fetchTicker(symbol));
    }

    @Override
    public BalanceCheck checkSufficientBalance(String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
        return call("checkSufficientBalance", () -> delegate.checkSufficientBalance(symbol, side, amount, price));
    }

    @Override
    public CurrencyPair fetchCurrencyPair(String symbol) {
        return call("fetchCurrencyPair", () -> delegate.fetchCurrencyPair(symbol));
    }

    private <T> T call(String method, Supplier<T> supplier) {
        Timer.Sample sample = Timer.start(meterRegistry);
        boolean success = false;
        try {
            T result = RateLimiter.decorateSupplier(rateLimiter, supplier).get();
            success = true;
            return result;
        } catch (RequestNotPermitted e) {
            log.warn("Exchange rate limit reached method={}", method);
            throw new ExchangeException("Exchange rate limit reached for " + method, 429, e);
        } finally {
            sample.stop(Timer.builder("exchange_call_latency")
                    .tag("method", method)
                    .tag("status", success ? "success" : "error")
                    .register(meterRegistry));
        }
    }
}
