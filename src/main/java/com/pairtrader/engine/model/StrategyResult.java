package com.pairtrader.engine.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * A sized trade: buy {@code coinsToBuy} at {@code buyPrice}, later sell {@code coinsToSell}
 * (what survives the sell fee) at {@code sellPrice}.
 */
@Builder
public record StrategyResult(
        BigDecimal buyPrice,
        BigDecimal coinsToBuy,
        BigDecimal sellPrice,
        BigDecimal coinsToSell,
        Info info
) {

    public StrategyResult(BigDecimal buyPrice, BigDecimal coinsToBuy, BigDecimal sellPrice, BigDecimal coinsToSell) {
        this(buyPrice, coinsToBuy, sellPrice, coinsToSell, null);
    }

    @Builder
    public record Info(
            BigDecimal buyPriceWithFee,
            BigDecimal totalCost,
            BigDecimal finalRevenue,
            BigDecimal netProfit,
            String comment
    ) {
    }
}
