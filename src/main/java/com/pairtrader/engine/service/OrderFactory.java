package com.pairtrader.engine.service;

import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.OrderType;
import com.pairtrader.engine.util.TimeSeededSequence;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Builds local PENDING orders. Prices and amounts are snapped to the pair's tick and lot
 * size when pair metadata is supplied.
 */
@Component
public class OrderFactory {

    private final TimeSeededSequence sequence = new TimeSeededSequence();

    public Order createOrder(String symbol, OrderSide side, OrderType type, BigDecimal amount,
                             BigDecimal price, Long dealId, CurrencyPair pair) {
        long id = sequence.next();
        Instant now = Instant.now();
        return Order.builder()
                .id(id)
                .symbol(symbol)
                .side(side)
                .type(type)
                .amount(pair != null ? pair.floorAmount(amount) : amount)
                .price(pair != null ? pair.floorPrice(price) : price)
                .status(OrderStatus.PENDING)
                .dealId(dealId)
                .clientOrderId(clientOrderId(side, id))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private static String clientOrderId(OrderSide side, long id) {
        return "pt-" + side.name().toLowerCase() + "-" + id;
    }
}
