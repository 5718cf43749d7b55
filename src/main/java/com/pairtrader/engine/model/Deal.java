package com.pairtrader.engine.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.stream.Stream;

/**
 * One trade cycle: a BUY order and the SELL order that closes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class Deal {

    private Long id;

    private CurrencyPair currencyPair;

    @Builder.Default
    private DealStatus status = DealStatus.OPEN;

    @ToString.Exclude
    private Order buyOrder;

    @ToString.Exclude
    private Order sellOrder;

    @Builder.Default
    private BigDecimal profit = BigDecimal.ZERO;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant closedAt;

    public String getSymbol() {
        return currencyPair != null ? currencyPair.getSymbol() : null;
    }

    public void attachOrders(Order buy, Order sell) {
        if (buy != null && buy.getSide() != OrderSide.BUY) {
            throw new IllegalArgumentException("Deal " + id + " expects a BUY order, got " + buy.getSide());
        }
        if (sell != null && sell.getSide() != OrderSide.SELL) {
            throw new IllegalArgumentException("Deal " + id + " expects a SELL order, got " + sell.getSide());
        }
        this.buyOrder = buy;
        this.sellOrder = sell;
        syncOrderDealIds();
        touch();
    }

    public void replaceBuyOrder(Order buy) {
        attachOrders(buy, sellOrder);
    }

    private void syncOrderDealIds() {
        if (buyOrder != null) {
            buyOrder.setDealId(id);
        }
        if (sellOrder != null) {
            sellOrder.setDealId(id);
        }
    }

    public boolean isOpen() {
        return status == DealStatus.OPEN;
    }

    public boolean bothOrdersFilled() {
        return buyOrder != null && sellOrder != null && buyOrder.isFilled() && sellOrder.isFilled();
    }

    public boolean hasOpenOrder() {
        return Stream.of(buyOrder, sellOrder).anyMatch(order -> order != null && order.isOpen());
    }

    public void close() {
        finish(DealStatus.CLOSED);
    }

    public void cancel() {
        finish(DealStatus.CANCELED);
    }

    private void finish(DealStatus target) {
        if (status != DealStatus.OPEN) {
            log.debug("Deal {} already finished with status {}", id, status);
            return;
        }
        if (hasOpenOrder()) {
            throw new IllegalStateException("Deal " + id + " still has an open order and cannot become " + target);
        }
        this.status = target;
        touch();
        this.closedAt = updatedAt;
    }

    /**
     * Sell revenue minus buy cost including fees. Zero until both legs are filled.
     */
    public BigDecimal calculateProfit() {
        if (!bothOrdersFilled()) {
            return BigDecimal.ZERO;
        }
        BigDecimal calculated = sellOrder.totalCost()
                .subtract(sellOrder.getFees())
                .subtract(buyOrder.totalCostWithFees());
        this.profit = calculated;
        touch();
        return calculated;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
