package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.util.MoneyUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;

/**
 * Stale when the market has moved up away from a resting BUY by more than the allowed
 * percent, so the order is unlikely to fill.
 */
public class PriceDeviationStalenessPredicate implements StalenessPredicate {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal maxDeviationPct;

    public PriceDeviationStalenessPredicate(BigDecimal maxDeviationPct) {
        this.maxDeviationPct = maxDeviationPct;
    }

    @Override
    public Optional<String> staleReason(Order order, Instant now, MarketPriceSource marketPrices) {
        BigDecimal price = order.getPrice();
        if (price == null || price.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal market = marketPrices.lastPrice(order.getSymbol());
        if (market == null || market.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal deviationPct = MoneyUtils.divide(market.subtract(price), price).multiply(HUNDRED);
        if (deviationPct.compareTo(maxDeviationPct) > 0) {
            return Optional.of(String.format("market %s is %s%% above order price %s (max %s%%)",
                    market.toPlainString(), deviationPct.setScale(2, RoundingMode.HALF_UP).toPlainString(),
                    price.toPlainString(), maxDeviationPct.toPlainString()));
        }
        return Optional.empty();
    }
}
