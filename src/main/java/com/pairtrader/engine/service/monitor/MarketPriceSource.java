package com.pairtrader.engine.service.monitor;

import java.math.BigDecimal;

@FunctionalInterface
public interface MarketPriceSource {

    /** Last price for the symbol, or null when unknown. */
    BigDecimal lastPrice(String symbol);
}
