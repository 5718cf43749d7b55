package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.model.Order;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.Function;

public class AgeStalenessPredicate implements StalenessPredicate {

    private final Duration defaultMaxAge;
    private final Function<String, Optional<Duration>> pairLifetime;

    public AgeStalenessPredicate(Duration maxAge) {
        this(maxAge, symbol -> Optional.empty());
    }

    /**
     * @param pairLifetime order lifetime configured for a symbol, used instead of the
     *                     default when present
     */
    public AgeStalenessPredicate(Duration defaultMaxAge, Function<String, Optional<Duration>> pairLifetime) {
        this.defaultMaxAge = defaultMaxAge;
        this.pairLifetime = pairLifetime;
    }

    @Override
    public Optional<String> staleReason(Order order, Instant now, MarketPriceSource marketPrices) {
        Duration maxAge = pairLifetime.apply(order.getSymbol()).orElse(defaultMaxAge);
        Duration age = order.ageAt(now);
        if (age.compareTo(maxAge) > 0) {
            return Optional.of(String.format("age %.1f min exceeds %d min", age.toMillis() / 60000.0, maxAge.toMinutes()));
        }
        return Optional.empty();
    }
}
