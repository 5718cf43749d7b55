package com.pairtrader.engine.model;

import com.pairtrader.engine.util.MoneyUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Symbol metadata (precision, limits, fees) plus the per-pair trading parameters.
 * Fees are fractions: 0.001 means 0.1%.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class CurrencyPair {

    private String symbol;

    private String baseCurrency;

    private String quoteCurrency;

    /** Quantity lot size. */
    @Builder.Default
    private BigDecimal amountStep = new BigDecimal("0.0001");

    /** Price tick size. */
    @Builder.Default
    private BigDecimal priceStep = new BigDecimal("0.01");

    private BigDecimal minAmount;

    private BigDecimal maxAmount;

    private BigDecimal minPrice;

    private BigDecimal maxPrice;

    @Builder.Default
    private BigDecimal minNotional = BigDecimal.TEN;

    @Builder.Default
    private BigDecimal makerFee = new BigDecimal("0.001");

    @Builder.Default
    private BigDecimal takerFee = new BigDecimal("0.001");

    /** Budget of one deal in quote currency. */
    @Builder.Default
    private BigDecimal dealQuota = new BigDecimal("100");

    /** Desired profit as a fraction, 0.01 means 1%. */
    @Builder.Default
    private BigDecimal profitMarkup = new BigDecimal("0.01");

    /** A resting BUY older than this is stale. 0 falls back to the monitor's max age. */
    @Builder.Default
    private int orderLifeTimeMinutes = 15;

    /** Concurrent OPEN deals allowed on this pair, 0 for no limit. */
    @Builder.Default
    private int maxOpenDeals = 1;

    private Instant loadedAt;

    public static CurrencyPair of(String baseCurrency, String quoteCurrency) {
        return CurrencyPair.builder()
                .baseCurrency(baseCurrency)
                .quoteCurrency(quoteCurrency)
                .symbol(baseCurrency + "/" + quoteCurrency)
                .build();
    }

    public BigDecimal takerFeePercent() {
        return takerFee.movePointRight(2);
    }

    public BigDecimal floorPrice(BigDecimal price) {
        return MoneyUtils.floorToStep(price, priceStep);
    }

    public BigDecimal floorAmount(BigDecimal amount) {
        return MoneyUtils.floorToStep(amount, amountStep);
    }

    public BigDecimal roundPrice(BigDecimal price) {
        return MoneyUtils.roundToStep(price, priceStep);
    }
}
