package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.config.MonitorConfig;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.StrategyResult;
import com.pairtrader.engine.service.ExecutionReport;
import com.pairtrader.engine.service.TradingTestHarness;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class BuyOrderMonitorTest {

    private static final String SYMBOL = TradingTestHarness.SYMBOL;

    private TradingTestHarness harness;
    private BuyOrderMonitor monitor;

    @BeforeEach
    void setup() {
        harness = TradingTestHarness.paper();
        monitor = new BuyOrderMonitor(
                harness.orderRepository,
                harness.orderService,
                harness.timeoutService,
                harness.gateway,
                new MonitorConfig().buyOrderStalePolicy(harness.monitorProperties, harness.registry),
                harness.monitorProperties,
                harness.taskGuard);
    }

    @Test
    void ordersInTheGracePeriodAreNeverCanceled() {
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("3500"));

        monitor.runOnce();

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(deal.getBuyOrder()).isSameAs(buy);
        assertThat(monitor.getStatistics().skippedInGrace()).isEqualTo(1);
        assertThat(monitor.getStatistics().staleOrdersFound()).isZero();
    }

    @Test
    void oldBuyIsCanceledAndRecreatedBelowTheMarket() {
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        buy.setCreatedAt(Instant.now().minus(Duration.ofMinutes(20)));

        monitor.runOnce();

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.CANCELED);
        Order replacement = deal.getBuyOrder();
        assertThat(replacement).isNotSameAs(buy);
        assertThat(replacement.getPrice()).isEqualByComparingTo("2997.00");
        assertThat(replacement.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(monitor.getStatistics().ordersRecreated()).isEqualTo(1);
    }

    @Test
    void marketRunningAwayMakesTheBuyStale() {
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        buy.setCreatedAt(Instant.now().minus(Duration.ofMinutes(2)));
        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("3100"));

        monitor.runOnce();

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(deal.getBuyOrder().getPrice()).isEqualByComparingTo("3096.90");
        assertThat(deal.getSellOrder().getPrice()).isEqualByComparingTo("3127.87");
    }

    @Test
    void healthyBuyIsLeftAlone() {
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        buy.setCreatedAt(Instant.now().minus(Duration.ofMinutes(5)));

        monitor.runOnce();

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(monitor.getStatistics().ordersInspected()).isEqualTo(1);
        assertThat(monitor.getStatistics().staleOrdersFound()).isZero();
    }

    @Test
    void pairOrderLifetimeOverridesTheMonitorMaxAge() {
        harness.registry.register(harness.pair().toBuilder().orderLifeTimeMinutes(5).build());
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        buy.setCreatedAt(Instant.now().minus(Duration.ofMinutes(8)));

        monitor.runOnce();

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(deal.getBuyOrder()).isNotSameAs(buy);
        assertThat(monitor.getStatistics().staleOrdersFound()).isEqualTo(1);
    }

    @Test
    void buyFilledSinceTheLastCheckIsNotRemediated() {
        Deal deal = openDeal();
        Order buy = deal.getBuyOrder();
        buy.setCreatedAt(Instant.now().minus(Duration.ofMinutes(20)));
        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("2980"));

        monitor.runOnce();

        assertThat(buy.getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(deal.getBuyOrder()).isSameAs(buy);
        assertThat(harness.timeoutService.getStatistics().staleOrdersHandled()).isZero();
    }

    private Deal openDeal() {
        StrategyResult strategy = new StrategyResult(new BigDecimal("2990"), new BigDecimal("0.0332"),
                new BigDecimal("3020"), new BigDecimal("0.0332"));
        ExecutionReport report = harness.executionService.executeTradingStrategy(harness.pair(), strategy);
        assertThat(report.success()).as(report.errorMessage()).isTrue();
        return harness.dealService.getDealById(report.dealId()).orElseThrow();
    }
}
