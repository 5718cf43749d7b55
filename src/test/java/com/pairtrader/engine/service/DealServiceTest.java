package com.pairtrader.engine.service;

import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.DealStatus;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.StrategyResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class DealServiceTest {

    private static final String SYMBOL = TradingTestHarness.SYMBOL;

    private TradingTestHarness harness;
    private DealService dealService;

    @BeforeEach
    void setup() {
        harness = TradingTestHarness.paper();
        dealService = harness.dealService;
    }

    @Test
    void filledBuyReleasesTheSellAndFilledSellClosesTheDeal() {
        Deal deal = openDeal();
        assertThat(dealService.closeDealIfCompleted(deal)).isFalse();
        assertThat(deal.getSellOrder().getStatus()).isEqualTo(OrderStatus.PENDING);

        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("2985"));
        assertThat(dealService.closeDealIfCompleted(deal)).isFalse();

        Order sell = deal.getSellOrder();
        assertThat(deal.getBuyOrder().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(sell.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(sell.getExchangeId()).isNotNull();

        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("3025"));
        assertThat(dealService.closeDealIfCompleted(deal)).isTrue();

        assertThat(deal.getStatus()).isEqualTo(DealStatus.CLOSED);
        assertThat(deal.getProfit()).isEqualByComparingTo("0.796468");
        assertThat(dealService.getOpenDeals()).isEmpty();
        assertThat(dealService.getStatistics().realizedProfit()).isEqualByComparingTo("0.796468");
        assertThat(harness.paperExchange.balance("ETH")).isEqualByComparingTo("0");
    }

    @Test
    void canceledBuyCancelsTheDealAndItsWaitingSell() {
        Deal deal = openDeal();
        harness.orderService.cancelOrder(deal.getBuyOrder(), "operator");

        assertThat(dealService.closeDealIfCompleted(deal)).isTrue();

        assertThat(deal.getStatus()).isEqualTo(DealStatus.CANCELED);
        assertThat(deal.getSellOrder().getStatus()).isEqualTo(OrderStatus.FAILED);
        assertThat(dealService.getStatistics().dealsCanceled()).isEqualTo(1);
    }

    @Test
    void dealWithoutSellGetsOneOnceTheBuyFills() {
        Deal deal = dealWithoutSell();

        assertThat(dealService.closeDealIfCompleted(deal)).isFalse();
        assertThat(deal.getSellOrder()).isNull();

        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("2985"));
        assertThat(dealService.closeDealIfCompleted(deal)).isFalse();

        Order sell = deal.getSellOrder();
        assertThat(deal.getBuyOrder().getStatus()).isEqualTo(OrderStatus.FILLED);
        assertThat(sell.getAmount()).isEqualByComparingTo("0.0332");
        assertThat(sell.getPrice()).isEqualByComparingTo("3019.90");
        assertThat(sell.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(sell.getDealId()).isEqualTo(deal.getId());

        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("3020"));
        assertThat(dealService.closeDealIfCompleted(deal)).isTrue();
        assertThat(deal.getStatus()).isEqualTo(DealStatus.CLOSED);
        assertThat(harness.paperExchange.balance("ETH")).isEqualByComparingTo("0");
    }

    @Test
    void dealWithoutSellIsCanceledWhenItsBuyIsCanceled() {
        Deal deal = dealWithoutSell();
        harness.orderService.cancelOrder(deal.getBuyOrder(), "operator");

        assertThat(dealService.closeDealIfCompleted(deal)).isTrue();

        assertThat(deal.getStatus()).isEqualTo(DealStatus.CANCELED);
        assertThat(deal.getSellOrder()).isNull();
        assertThat(dealService.getStatistics().dealsCanceled()).isEqualTo(1);
    }

    @Test
    void failedSellIsReplacedAndPlaced() {
        Deal deal = openDeal();
        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("2985"));
        CurrencyPair pair = harness.pair();
        harness.registry.register(pair.toBuilder().maxPrice(new BigDecimal("3000")).build());
        dealService.closeDealIfCompleted(deal);
        Order failed = deal.getSellOrder();
        assertThat(failed.getStatus()).isEqualTo(OrderStatus.FAILED);

        harness.registry.register(pair);
        dealService.closeDealIfCompleted(deal);
        Order replacement = deal.getSellOrder();
        assertThat(replacement).isNotSameAs(failed);
        assertThat(replacement.getStatus()).isEqualTo(OrderStatus.PENDING);
        assertThat(replacement.getPrice()).isEqualByComparingTo(failed.getPrice());
        assertThat(replacement.getAmount()).isEqualByComparingTo(failed.getAmount());

        dealService.closeDealIfCompleted(deal);
        assertThat(replacement.getStatus()).isEqualTo(OrderStatus.OPEN);
        assertThat(deal.isOpen()).isTrue();
    }

    @Test
    void sellReplacementsStopAtTheLimit() {
        harness.executionProperties.setMaxSellReplacements(3);
        Deal deal = openDeal();
        harness.paperExchange.updateLastPrice(SYMBOL, new BigDecimal("2985"));
        harness.registry.register(harness.pair().toBuilder().maxPrice(new BigDecimal("3000")).build());

        for (int i = 0; i < 20; i++) {
            assertThat(dealService.closeDealIfCompleted(deal)).isFalse();
        }

        assertThat(harness.orderRepository.findAll())
                .filteredOn(order -> order.getSide() == OrderSide.SELL)
                .hasSize(4)
                .allSatisfy(order -> assertThat(order.getStatus()).isEqualTo(OrderStatus.FAILED));
        assertThat(deal.getStatus()).isEqualTo(DealStatus.OPEN);
        assertThat(deal.getSellOrder().getStatus()).isEqualTo(OrderStatus.FAILED);
    }

    @Test
    void finishedDealIsIgnored() {
        Deal deal = openDeal();
        harness.orderService.cancelOrder(deal.getBuyOrder(), "operator");
        dealService.closeDealIfCompleted(deal);

        assertThat(dealService.closeDealIfCompleted(deal)).isFalse();
        assertThat(dealService.closeDealIfCompleted(null)).isFalse();
    }

    @Test
    void forceCloseCancelsEverythingStillOpen() {
        Deal deal = openDeal();

        int closed = dealService.forceCloseAllDeals(null, "shutdown");

        assertThat(closed).isEqualTo(1);
        assertThat(deal.getStatus()).isEqualTo(DealStatus.CLOSED);
        assertThat(deal.getBuyOrder().getStatus()).isEqualTo(OrderStatus.CANCELED);
        assertThat(deal.getSellOrder().getStatus()).isEqualTo(OrderStatus.FAILED);
    }

    @Test
    void balanceCheckUsesTheQuoteCurrency() {
        assertThat(dealService.checkBalanceBeforeDeal(harness.pair(), new BigDecimal("0.0332"), new BigDecimal("3000"))
                .sufficient()).isTrue();
        assertThat(dealService.checkBalanceBeforeDeal(harness.pair(), BigDecimal.ONE, new BigDecimal("3000"))
                .sufficient()).isFalse();
    }

    private Deal dealWithoutSell() {
        Deal deal = dealService.createNewDeal(harness.pair());
        Order buy = harness.orderService.createAndPlaceBuyOrder(SYMBOL, new BigDecimal("0.0332"),
                new BigDecimal("2990"), deal.getId()).order();
        assertThat(buy.getStatus()).isEqualTo(OrderStatus.OPEN);
        return dealService.attachOrders(deal, buy, null);
    }

    private Deal openDeal() {
        StrategyResult strategy = new StrategyResult(new BigDecimal("2990"), new BigDecimal("0.0332"),
                new BigDecimal("3020"), new BigDecimal("0.0332"));
        ExecutionReport report = harness.executionService.executeTradingStrategy(harness.pair(), strategy);
        assertThat(report.success()).as(report.errorMessage()).isTrue();
        return dealService.getDealById(report.dealId()).orElseThrow();
    }
}
