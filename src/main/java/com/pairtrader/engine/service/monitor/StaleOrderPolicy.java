package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.model.Order;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Ordered set of staleness predicates. The first predicate that fires decides; later ones
 * are not evaluated, so cheap checks go first.
 */
public class StaleOrderPolicy {

    private final List<StalenessPredicate> predicates;

    public StaleOrderPolicy(List<StalenessPredicate> predicates) {
        this.predicates = List.copyOf(predicates);
    }

    public Optional<String> evaluate(Order order, Instant now, MarketPriceSource marketPrices) {
        for (StalenessPredicate predicate : predicates) {
            Optional<String> reason = predicate.staleReason(order, now, marketPrices);
            if (reason.isPresent()) {
                return reason;
            }
        }
        return Optional.empty();
    }
}
