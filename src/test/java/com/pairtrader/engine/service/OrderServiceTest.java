package com.pairtrader.engine.service;

import com.pairtrader.engine.exception.ExchangeException;
import com.pairtrader.engine.exception.OrderNotFoundException;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.service.exchange.ExchangeOrderStatus;
import com.pairtrader.engine.service.exchange.ExchangeOrderUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrderServiceTest {

    private static final String SYMBOL = TradingTestHarness.SYMBOL;

    private ExchangeGateway gateway;
    private TradingTestHarness harness;
    private OrderService orderService;

    @BeforeEach
    void setup() {
        gateway = mock(ExchangeGateway.class);
        harness = TradingTestHarness.with(gateway);
        orderService = harness.orderService;
    }

    @Test
    void placementFailingEveryAttemptEndsFailedWithRetriesCounted() {
        when(gateway.createOrder(any(), any(), any(), any(), any(), anyString()))
                .thenThrow(new ExchangeException("timeout"));

        OrderExecutionResult result = orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.0332"),
                new BigDecimal("2990"), 5L);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("Failed after 3 attempts: timeout");
        Order order = result.order();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(order.getRetries()).isEqualTo(3);
        assertThat(order.getExchangeId()).isNull();
        assertThat(harness.orderRepository.findById(order.getId())).contains(order);
        verify(gateway, times(3)).createOrder(eq(SYMBOL), eq(OrderSide.BUY), any(), any(), any(),
                eq(order.getClientOrderId()));
        assertThat(orderService.getStatistics().ordersFailed()).isEqualTo(1);
    }

    @Test
    void placementSucceedsAfterATransientError() {
        when(gateway.createOrder(any(), any(), any(), any(), any(), anyString()))
                .thenThrow(new ExchangeException("502 bad gateway"))
                .thenReturn(update("ex-1", ExchangeOrderStatus.OPEN, "0", 100L));

        OrderExecutionResult result = orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.03329"),
                new BigDecimal("2990.009"), 5L);

        assertThat(result.success()).isTrue();
        Order order = result.order();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(order.getExchangeId()).isEqualTo("ex-1");
        assertThat(order.getRetries()).isEqualTo(1);
        assertThat(order.getErrorMessage()).isNull();
        assertThat(order.getAmount()).isEqualByComparingTo("0.0332");
        assertThat(order.getPrice()).isEqualByComparingTo("2990.00");
        assertThat(order.getClientOrderId()).startsWith("pt-buy-");
    }

    @Test
    void placedOrderThatCannotBeStoredIsCanceledOnTheExchange() {
        TradingTestHarness failing = TradingTestHarness.with(gateway,
                TradingTestHarness.failingSavesOfPlaced(OrderSide.BUY));
        when(gateway.createOrder(any(), any(), any(), any(), any(), anyString()))
                .thenReturn(update("ex-7", ExchangeOrderStatus.OPEN, "0", 100L));
        when(gateway.cancelOrder("ex-7", SYMBOL)).thenReturn(update("ex-7", ExchangeOrderStatus.CANCELED, "0", 200L));

        OrderExecutionResult result = failing.orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.0332"),
                new BigDecimal("2990"), 5L);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Placed order could not be recorded: order store unavailable");
        Order order = result.order();
        assertThat(order.getExchangeId()).isEqualTo("ex-7");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELED);
        verify(gateway).cancelOrder("ex-7", SYMBOL);
        assertThat(failing.orderService.getStatistics().ordersFailed()).isEqualTo(1);
        assertThat(failing.meterRegistry.get("emergency_cancels_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void unstoredOrderStaysOpenWhenItsCancelFails() {
        TradingTestHarness failing = TradingTestHarness.with(gateway,
                TradingTestHarness.failingSavesOfPlaced(OrderSide.BUY));
        when(gateway.createOrder(any(), any(), any(), any(), any(), anyString()))
                .thenReturn(update("ex-8", ExchangeOrderStatus.OPEN, "0", 100L));
        when(gateway.cancelOrder("ex-8", SYMBOL)).thenThrow(new ExchangeException("503", 503, null));

        OrderExecutionResult result = failing.orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.0332"),
                new BigDecimal("2990"), 5L);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).contains("emergency cancel failed: 503");
        assertThat(result.order().getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(result.order().getExchangeId()).isEqualTo("ex-8");
    }

    @Test
    void orderBelowMinimumNotionalNeverReachesTheExchange() {
        OrderExecutionResult result = orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.001"),
                new BigDecimal("2990"), 5L);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Validation failed").contains("below minimum 10");
        assertThat(result.order().getStatus()).isEqualTo(OrderStatus.FAILED);
        verify(gateway, never()).createOrder(any(), any(), any(), any(), any(), any());
    }

    @Test
    void repeatedStatusChecksAreIdempotent() {
        Order order = placedOrder();
        when(gateway.fetchOrder("ex-1", SYMBOL)).thenReturn(update("ex-1", ExchangeOrderStatus.OPEN, "0.01", 200L));

        orderService.getOrderStatus(order);
        Order afterFirst = harness.orderRepository.findById(order.getId()).orElseThrow();
        BigDecimal filledAfterFirst = afterFirst.getFilledAmount();
        orderService.getOrderStatus(order);

        assertThat(order.getStatus()).isEqualTo(OrderStatus.PARTIALLY_FILLED);
        assertThat(order.getFilledAmount()).isEqualByComparingTo(filledAfterFirst);
        assertThat(order.getExchangeTimestamp()).isEqualTo(200L);
        assertThat(orderService.getStatistics().statusChecks()).isEqualTo(2);
    }

    @Test
    void statusCheckFailureLeavesTheOrderAsItWas() {
        Order order = placedOrder();
        when(gateway.fetchOrder("ex-1", SYMBOL)).thenThrow(new ExchangeException("timeout"));

        Order result = orderService.getOrderStatus(order);

        assertThat(result.getStatus()).isEqualTo(OrderStatus.OPEN);
    }

    @Test
    void cancelingAFilledOrderIsANoOp() {
        Order order = placedOrder();
        order.applyExchangeUpdate(update("ex-1", ExchangeOrderStatus.CLOSED, "0.0332", 300L));

        OrderExecutionResult result = orderService.cancelOrder(order, "stale");

        assertThat(result.success()).isTrue();
        assertThat(result.order().getStatus()).isEqualTo(OrderStatus.FILLED);
        verify(gateway, never()).cancelOrder(any(), any());
    }

    @Test
    void cancelReportsFillThatRacedTheCancel() {
        Order order = placedOrder();
        when(gateway.cancelOrder("ex-1", SYMBOL)).thenReturn(update("ex-1", ExchangeOrderStatus.CLOSED, "0.0332", 300L));

        OrderExecutionResult result = orderService.cancelOrder(order, "stale");

        assertThat(result.success()).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(orderService.getStatistics().ordersCanceled()).isZero();
    }

    @Test
    void cancelingAnOrderUnknownToTheExchangeCancelsLocally() {
        Order order = placedOrder();
        when(gateway.cancelOrder("ex-1", SYMBOL)).thenThrow(new OrderNotFoundException("ex-1", SYMBOL));

        OrderExecutionResult result = orderService.cancelOrder(order, "stale");

        assertThat(result.success()).isTrue();
        assertThat(order.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(order.getErrorMessage()).contains("not found on exchange");
    }

    @Test
    void cancelFailureIsReportedNotThrown() {
        Order order = placedOrder();
        when(gateway.cancelOrder("ex-1", SYMBOL)).thenThrow(new ExchangeException("503", 503, null));

        OrderExecutionResult result = orderService.cancelOrder(order, "stale");

        assertThat(result.success()).isFalse();
        assertThat(result.error()).startsWith("Cancel failed");
        assertThat(order.getStatus()).isEqualTo(OrderStatus.OPEN);
    }

    @Test
    void cancelingAPendingOrderFailsItLocally() {
        Order pending = orderService.createLocalOrder(SYMBOL, OrderSide.SELL, new BigDecimal("0.0332"),
                new BigDecimal("3020"), 5L);

        OrderExecutionResult result = orderService.cancelOrder(pending, "BUY canceled");

        assertThat(result.success()).isTrue();
        assertThat(pending.getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(pending.getErrorMessage()).isEqualTo("Canceled before placement: BUY canceled");
        verify(gateway, never()).cancelOrder(any(), any());
    }

    @Test
    void emergencyCancelOnlyTouchesTheRequestedSymbol() {
        Order eth = placedOrder();
        when(gateway.cancelOrder("ex-1", SYMBOL)).thenReturn(update("ex-1", ExchangeOrderStatus.CANCELED, "0", 400L));

        assertThat(orderService.emergencyCancelAllOrders("BTC/USDT", "halt")).isZero();
        assertThat(orderService.emergencyCancelAllOrders(null, "halt")).isEqualTo(1);
        assertThat(eth.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(orderService.getOpenOrders()).isEmpty();
    }

    private Order placedOrder() {
        when(gateway.createOrder(any(), any(), any(), any(), any(), anyString()))
                .thenReturn(update("ex-1", ExchangeOrderStatus.OPEN, "0", 100L));
        return orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.0332"), new BigDecimal("2990"), 5L)
                .order();
    }

    private static ExchangeOrderUpdate update(String id, ExchangeOrderStatus status, String filled, long timestamp) {
        return ExchangeOrderUpdate.builder()
                .exchangeId(id)
                .status(status)
                .filled(new BigDecimal(filled))
                .timestamp(timestamp)
                .build();
    }
}
