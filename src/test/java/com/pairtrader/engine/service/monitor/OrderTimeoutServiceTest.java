package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.exception.ExchangeException;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.DealStatus;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.StrategyResult;
import com.pairtrader.engine.service.ExecutionReport;
import com.pairtrader.engine.service.TradingTestHarness;
import com.pairtrader.engine.service.exchange.BalanceCheck;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.service.exchange.ExchangeOrderStatus;
import com.pairtrader.engine.service.exchange.ExchangeOrderUpdate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OrderTimeoutServiceTest {

    private static final String SYMBOL = TradingTestHarness.SYMBOL;

    private TradingTestHarness harness;
    private OrderTimeoutService timeoutService;

    @BeforeEach
    void setup() {
        harness = TradingTestHarness.paper();
        timeoutService = harness.timeoutService;
    }

    @Test
    void staleBuyIsReplacedJustUnderTheMarket() {
        Deal deal = openDeal();
        Order stale = deal.getBuyOrder();

        RemediationOutcome outcome = timeoutService.handleStaleOrder(stale, "age 20.0 min exceeds 15 min");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.RECREATED);
        assertThat(stale.getStatus()).isEqualTo(OrderStatus.CANCELED);
        Order replacement = outcome.replacement();
        assertThat(replacement.getPrice()).isEqualByComparingTo("2997.00");
        assertThat(replacement.getAmount()).isEqualByComparingTo(stale.getAmount());
        assertThat(replacement.getDealId()).isEqualTo(deal.getId());
        assertThat(replacement.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(deal.getBuyOrder()).isSameAs(replacement);
        assertThat(deal.getSellOrder().getPrice()).isEqualByComparingTo("3026.97");
        assertThat(deal.getSellOrder().getAmount()).isEqualByComparingTo("0.0332");
        assertThat(timeoutService.recreationCount(deal.getId())).isEqualTo(1);
        assertThat(harness.meterRegistry.get("order_recreations_total").counter().count()).isEqualTo(1.0);
    }

    @Test
    void coolDownLeavesTheStaleOrderUntouched() {
        Deal deal = openDeal();
        Order replacement = timeoutService.handleStaleOrder(deal.getBuyOrder(), "age").replacement();

        RemediationOutcome outcome = timeoutService.handleStaleOrder(replacement, "age");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.SKIPPED_COOLDOWN);
        assertThat(replacement.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(timeoutService.inCooldown(deal.getId(), Instant.now())).isTrue();
        assertThat(timeoutService.getStatistics().skippedByCooldown()).isEqualTo(1);
    }

    @Test
    void recreationCapCancelsWithoutReplacement() {
        harness.monitorProperties.getTimeout().setMaxRecreationsPerDeal(1);
        harness.monitorProperties.getTimeout().setMinMinutesBetweenRecreations(0);
        Deal deal = openDeal();
        Order replacement = timeoutService.handleStaleOrder(deal.getBuyOrder(), "age").replacement();

        RemediationOutcome outcome = timeoutService.handleStaleOrder(replacement, "age");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.CANCELED_ONLY);
        assertThat(outcome.message()).isEqualTo("recreation limit reached");
        assertThat(replacement.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(deal.getBuyOrder()).isSameAs(replacement);
        assertThat(harness.orderRepository.findOpenOrders()).isEmpty();

        assertThat(harness.dealService.closeDealIfCompleted(deal)).isTrue();
    }

    @Test
    void buyThatFilledMeanwhileIsLeftToTheDeal() {
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("2980"));

        RemediationOutcome outcome = timeoutService.handleStaleOrder(buy, "age");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.ALREADY_FILLED);
        assertThat(buy.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(timeoutService.recreationCount(deal.getId())).isZero();
    }

    @Test
    void rejectedReplacementLeavesTheCanceledBuyOnTheDeal() {
        Deal deal = openDeal();
        Order stale = deal.getBuyOrder();
        harness.registry.register(harness.pair().toBuilder().maxPrice(new BigDecimal("2995")).build());

        RemediationOutcome outcome = timeoutService.handleStaleOrder(stale, "age");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.RECREATION_FAILED);
        assertThat(outcome.message()).contains("above maximum 2995");
        assertThat(outcome.replacement().getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(stale.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(deal.getBuyOrder()).isSameAs(stale);
        assertThat(timeoutService.getStatistics().recreationFailures()).isEqualTo(1);

        assertThat(harness.dealService.closeDealIfCompleted(deal)).isTrue();
        assertThat(deal.getStatus()).isEqualTo(DealStatus.CANCELED);
    }

    @Test
    void missingTickerAfterTheCancelIsARecreationFailure() {
        ExchangeGateway gateway = mock(ExchangeGateway.class);
        when(gateway.checkSufficientBalance(any(), any(), any(), any()))
                .thenReturn(new BalanceCheck(true, "USDT", new BigDecimal("1000"), new BigDecimal("99.37")));
        when(gateway.fetchTicker(SYMBOL))
                .thenReturn(new BigDecimal("3000"))
                .thenThrow(new ExchangeException("ticker unavailable"));
        when(gateway.createOrder(any(), any(), any(), any(), any(), anyString()))
                .thenReturn(update(ExchangeOrderStatus.OPEN, 100L));
        when(gateway.cancelOrder("ex-1", SYMBOL)).thenReturn(update(ExchangeOrderStatus.CANCELED, 200L));
        TradingTestHarness mocked = TradingTestHarness.with(gateway);
        ExecutionReport report = mocked.executionService.executeTradingStrategy(mocked.pair(), strategy());
        Deal deal = mocked.dealService.getDealById(report.dealId()).orElseThrow();
        Order stale = deal.getBuyOrder();

        RemediationOutcome outcome = mocked.timeoutService.handleStaleOrder(stale, "age");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.RECREATION_FAILED);
        assertThat(outcome.message()).isEqualTo("ticker unavailable");
        assertThat(outcome.replacement()).isNull();
        assertThat(stale.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(deal.getBuyOrder()).isSameAs(stale);
        verify(gateway, times(1)).createOrder(any(), any(), any(), any(), any(), anyString());
        assertThat(mocked.timeoutService.getStatistics().recreationFailures()).isEqualTo(1);
    }

    @Test
    void buyOfADealWithoutSellIsNotRecreated() {
        Deal deal = harness.dealService.createNewDeal(harness.pair());
        Order buy = harness.orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.0332"),
                new BigDecimal("2990"), deal.getId()).order();
        harness.dealService.attachOrders(deal, buy, null);

        RemediationOutcome outcome = timeoutService.handleStaleOrder(buy, "age");

        assertThat(outcome.action()).isEqualTo(RemediationOutcome.Action.CANCELED_ONLY);
        assertThat(outcome.message()).isEqualTo("deal has no SELL");
        assertThat(buy.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(harness.orderRepository.findAll()).hasSize(1);
        assertThat(harness.dealService.closeDealIfCompleted(deal)).isTrue();
    }

    @Test
    void recordsOfFinishedDealsAreDropped() {
        Deal deal = openDeal();
        Order replacement = timeoutService.handleStaleOrder(deal.getBuyOrder(), "age").replacement();
        harness.orderService.cancelOrder(replacement, "operator");
        harness.dealService.closeDealIfCompleted(deal);

        assertThat(timeoutService.cleanupRecords()).isEqualTo(1);
        assertThat(timeoutService.recreationCount(deal.getId())).isZero();
    }

    private Deal openDeal() {
        ExecutionReport report = harness.executionService.executeTradingStrategy(harness.pair(), strategy());
        assertThat(report.success()).as(report.errorMessage()).isTrue();
        return harness.dealService.getDealById(report.dealId()).orElseThrow();
    }

    private static StrategyResult strategy() {
        return new StrategyResult(new BigDecimal("2990"), new BigDecimal("0.0332"),
                new BigDecimal("3020"), new BigDecimal("0.0332"));
    }

    private static ExchangeOrderUpdate update(ExchangeOrderStatus status, long timestamp) {
        return ExchangeOrderUpdate.builder()
                .exchangeId("ex-1")
                .status(status)
                .filled(BigDecimal.ZERO)
                .timestamp(timestamp)
                .build();
    }
}
