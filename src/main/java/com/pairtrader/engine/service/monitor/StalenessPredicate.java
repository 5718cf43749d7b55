package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.model.Order;

import java.time.Instant;
import java.util.Optional;

/**
 * One reason an open order may no longer be worth filling.
 */
public interface StalenessPredicate {

    /**
     * @return a human readable reason when the order is stale, empty otherwise
     */
    Optional<String> staleReason(Order order, Instant now, MarketPriceSource marketPrices);
}
