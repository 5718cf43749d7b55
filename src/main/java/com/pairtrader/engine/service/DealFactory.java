package com.pairtrader.engine.service;

import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.DealStatus;
import com.pairtrader.engine.util.TimeSeededSequence;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

@Component
public class DealFactory {

    private final TimeSeededSequence sequence = new TimeSeededSequence();

    /** A new OPEN deal with no orders attached yet. */
    public Deal createNewDeal(CurrencyPair currencyPair) {
        if (currencyPair == null || currencyPair.getSymbol() == null) {
            throw new IllegalArgumentException("Currency pair is required to open a deal");
        }
        Instant now = Instant.now();
        return Deal.builder()
                .id(sequence.next())
                .currencyPair(currencyPair)
                .status(DealStatus.OPEN)
                .profit(BigDecimal.ZERO)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
