package com.pairtrader.engine.service;

import com.pairtrader.engine.config.ExecutionProperties;
import com.pairtrader.engine.exception.ExchangeException;
import com.pairtrader.engine.exception.TradingException;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pair metadata cache. Entries older than the freshness window are fetched again; when the
 * refresh fails the previous entry keeps being served.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CurrencyPairRegistry {

    private final ExchangeGateway exchangeGateway;
    private final ExecutionProperties executionProperties;

    private final Map<String, CurrencyPair> cache = new ConcurrentHashMap<>();

    public CurrencyPair get(String symbol) {
        CurrencyPair cached = cache.get(symbol);
        if (cached != null && isFresh(cached)) {
            return cached;
        }
        try {
            CurrencyPair loaded = exchangeGateway.fetchCurrencyPair(symbol);
            if (loaded == null) {
                throw new ExchangeException("Exchange returned no metadata for " + symbol);
            }
            return register(loaded.toBuilder().loadedAt(Instant.now()).build());
        } catch (TradingException e) {
            if (cached != null) {
                log.warn("Serving stale metadata for {} loadedAt={}: {}", symbol, cached.getLoadedAt(), e.getMessage());
                return cached;
            }
            throw e;
        }
    }

    /** Like {@link #get} but empty instead of throwing when the pair cannot be loaded. */
    public Optional<CurrencyPair> find(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(get(symbol));
        } catch (TradingException e) {
            log.warn("Metadata unavailable for {}: {}", symbol, e.getMessage());
            return Optional.empty();
        }
    }

    /** Caches {@code pair}, stamped now unless it already carries its load time. */
    public CurrencyPair register(CurrencyPair pair) {
        CurrencyPair stamped = pair.toBuilder()
                .loadedAt(pair.getLoadedAt() != null ? pair.getLoadedAt() : Instant.now())
                .build();
        cache.put(stamped.getSymbol(), stamped);
        return stamped;
    }

    private boolean isFresh(CurrencyPair pair) {
        if (pair.getLoadedAt() == null) {
            return false;
        }
        Duration window = Duration.ofMinutes(executionProperties.getPairCacheMinutes());
        return pair.getLoadedAt().plus(window).isAfter(Instant.now());
    }
}
