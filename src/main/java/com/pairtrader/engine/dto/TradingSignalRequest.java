package com.pairtrader.engine.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A trade decision from the signal producer. When only {@code buyPrice} is given the trade
 * is sized from the pair's deal quota and profit markup.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradingSignalRequest {

    @NotBlank
    private String symbol;

    @NotNull
    @Positive
    private BigDecimal buyPrice;

    @Positive
    private BigDecimal coinsToBuy;

    @Positive
    private BigDecimal sellPrice;

    @Positive
    private BigDecimal coinsToSell;

    public boolean isPreSized() {
        return coinsToBuy != null || sellPrice != null || coinsToSell != null;
    }

    public boolean isFullySized() {
        return coinsToBuy != null && sellPrice != null && coinsToSell != null;
    }
}
