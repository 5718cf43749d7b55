package com.pairtrader.engine.service.exchange;

import java.math.BigDecimal;

/**
 * @param currency  the currency the order would spend
 * @param available free balance of that currency
 * @param required  amount the order needs
 */
public record BalanceCheck(boolean sufficient, String currency, BigDecimal available, BigDecimal required) {

    public String describe() {
        return String.format("need %s %s, have %s",
                required != null ? required.toPlainString() : "?",
                currency,
                available != null ? available.toPlainString() : "?");
    }
}
