package com.pairtrader.engine.service;

import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.StrategyResult;
import com.pairtrader.engine.service.ExecutionReport.FailureType;
import com.pairtrader.engine.service.exchange.BalanceCheck;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns one sized trade into a tracked deal: balance check, deal, BUY on the exchange,
 * SELL recorded locally until the BUY fills. A failure after the BUY was placed cancels
 * the BUY before the failure is reported.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderExecutionService {

    private static final BigDecimal BUY_PRICE_WARN_DEVIATION = new BigDecimal("0.05");
    private static final BigDecimal SELL_PRICE_WARN_DEVIATION = new BigDecimal("0.10");

    private final OrderService orderService;
    private final DealService dealService;
    private final ExchangeGateway exchangeGateway;
    private final MetricsService metricsService;

    private long totalExecutions;
    private long successfulExecutions;
    private long failedExecutions;
    private BigDecimal totalVolume = BigDecimal.ZERO;
    private BigDecimal totalFees = BigDecimal.ZERO;
    private long totalExecutionTimeMs;

    public ExecutionReport executeTradingStrategy(CurrencyPair currencyPair, StrategyResult strategyResult) {
        long startedAt = System.nanoTime();
        ExecutionReport report;
        MDC.put("symbol", currencyPair != null ? currencyPair.getSymbol() : "unknown");
        try {
            report = execute(currencyPair, strategyResult);
        } catch (RuntimeException e) {
            log.error("Unexpected error executing strategy for {}", currencyPair != null ? currencyPair.getSymbol() : null, e);
            report = failure(FailureType.UNEXPECTED, "Unexpected error: " + e.getMessage(), null, null, List.of());
        } finally {
            MDC.remove("symbol");
            MDC.remove("dealId");
        }
        report = report.toBuilder()
                .executionTimeMs((System.nanoTime() - startedAt) / 1_000_000)
                .build();
        recordStatistics(report);
        return report;
    }

    private ExecutionReport execute(CurrencyPair pair, StrategyResult strategy) {
        String invalid = validate(pair, strategy);
        if (invalid != null) {
            log.warn("Strategy rejected before execution: {}", invalid);
            return failure(FailureType.VALIDATION, invalid, null, null, List.of());
        }
        String symbol = pair.getSymbol();
        List<String> warnings = new ArrayList<>();
        long openDeals = dealService.countOpenDeals(symbol);
        if (pair.getMaxOpenDeals() > 0 && openDeals >= pair.getMaxOpenDeals()) {
            log.warn("Signal for {} rejected, {} open deals reach the limit {}", symbol, openDeals, pair.getMaxOpenDeals());
            return failure(FailureType.VALIDATION, "Open deal limit reached for " + symbol + ": " + openDeals
                    + " of " + pair.getMaxOpenDeals(), null, null, List.of());
        }

        BalanceCheck balance;
        try {
            balance = dealService.checkBalanceBeforeDeal(pair, strategy.coinsToBuy(), strategy.buyPrice());
        } catch (RuntimeException e) {
            log.warn("Balance check failed for {}: {}", symbol, e.getMessage());
            return failure(FailureType.EXCHANGE_ERROR, "Balance check failed: " + e.getMessage(), null, null, List.of());
        }
        if (!balance.sufficient()) {
            return failure(FailureType.INSUFFICIENT_BALANCE, "Insufficient balance: " + balance.describe(),
                    null, null, List.of());
        }
        collectPriceWarnings(symbol, strategy, warnings);

        Deal deal = dealService.createNewDeal(pair);
        MDC.put("dealId", String.valueOf(deal.getId()));

        OrderExecutionResult buyResult = orderService.createAndPlaceBuyOrder(
                symbol, strategy.coinsToBuy(), strategy.buyPrice(), deal.getId());
        if (!buyResult.success() && isLiveOnExchange(buyResult.order())) {
            Order buyOrder = buyResult.order();
            log.error("BUY {} of deal {} is on the exchange but failed locally, keeping the deal tracked: {}",
                    buyOrder.getExchangeId(), deal.getId(), buyResult.error());
            keepTracked(deal, buyOrder, strategy);
            return failure(FailureType.PARTIAL_FAILURE, "BUY placed but not recorded: " + buyResult.error(),
                    deal.getId(), buyOrder, warnings);
        }
        if (!buyResult.success()) {
            deal.cancel();
            dealService.save(deal);
            log.warn("BUY placement failed, deal {} canceled: {}", deal.getId(), buyResult.error());
            return failure(FailureType.EXCHANGE_ERROR, "BUY order failed: " + buyResult.error(),
                    deal.getId(), buyResult.order(), warnings);
        }
        Order buyOrder = buyResult.order();

        try {
            Order sellOrder = orderService.createLocalOrder(
                    symbol, OrderSide.SELL, strategy.coinsToSell(), strategy.sellPrice(), deal.getId());
            dealService.attachOrders(deal, buyOrder, sellOrder);
            log.info("Deal {} executed: BUY {} {} @ {} placed, SELL {} @ {} pending",
                    deal.getId(), buyOrder.getAmount(), symbol, buyOrder.getPrice(),
                    sellOrder.getAmount(), sellOrder.getPrice());
            return success(pair, strategy, deal, buyOrder, sellOrder, warnings);
        } catch (RuntimeException e) {
            log.error("Execution failed after BUY placement for deal {}, canceling BUY {}", deal.getId(),
                    buyOrder.getExchangeId(), e);
            rollback(deal, buyOrder, strategy);
            return failure(FailureType.PARTIAL_FAILURE, "Execution failed after BUY placement: " + e.getMessage(),
                    deal.getId(), buyOrder, warnings);
        }
    }

    private String validate(CurrencyPair pair, StrategyResult strategy) {
        if (pair == null || pair.getSymbol() == null || pair.getSymbol().isBlank()) {
            return "Currency pair symbol is required";
        }
        if (pair.getDealQuota() == null || pair.getDealQuota().signum() <= 0) {
            return "Deal quota must be positive";
        }
        if (strategy == null) {
            return "Strategy result is required";
        }
        if (!positive(strategy.buyPrice()) || !positive(strategy.coinsToBuy())
                || !positive(strategy.sellPrice()) || !positive(strategy.coinsToSell())) {
            return "Strategy result must carry positive prices and quantities";
        }
        if (strategy.sellPrice().compareTo(strategy.buyPrice()) <= 0) {
            return "Sell price must be above buy price";
        }
        if (strategy.coinsToSell().compareTo(strategy.coinsToBuy()) > 0) {
            return "Cannot sell more coins than bought";
        }
        return null;
    }

    private void collectPriceWarnings(String symbol, StrategyResult strategy, List<String> warnings) {
        BigDecimal market;
        try {
            market = exchangeGateway.fetchTicker(symbol);
        } catch (RuntimeException e) {
            warnings.add("Market price unavailable: " + e.getMessage());
            return;
        }
        if (market == null || market.signum() <= 0) {
            return;
        }
        BigDecimal buyDeviation = deviation(strategy.buyPrice(), market);
        if (buyDeviation.compareTo(BUY_PRICE_WARN_DEVIATION) > 0) {
            warnings.add("BUY price differs from market by " + asPercent(buyDeviation) + "%");
        }
        BigDecimal sellDeviation = deviation(strategy.sellPrice(), market);
        if (sellDeviation.compareTo(SELL_PRICE_WARN_DEVIATION) > 0) {
            warnings.add("SELL price differs from market by " + asPercent(sellDeviation) + "%");
        }
        warnings.forEach(warning -> log.warn("{}: {}", symbol, warning));
    }

    private void rollback(Deal deal, Order buyOrder, StrategyResult strategy) {
        boolean released = false;
        try {
            OrderExecutionResult cancel = orderService.cancelOrder(buyOrder, "rollback after partial failure");
            metricsService.recordEmergencyCancel();
            released = cancel.success() && buyOrder.getStatus().isTerminal() && buyOrder.getStatus() != OrderStatus.FILLED;
            if (!released) {
                log.error("Emergency cancel did not release BUY {} of deal {}, status={} error={}",
                        buyOrder.getExchangeId(), deal.getId(), buyOrder.getStatus(), cancel.error());
            }
        } catch (RuntimeException e) {
            log.error("Emergency cancel of BUY {} failed", buyOrder.getExchangeId(), e);
        }
        if (!released) {
            keepTracked(deal, buyOrder, strategy);
            return;
        }
        try {
            deal.cancel();
            dealService.save(deal);
        } catch (RuntimeException e) {
            log.error("Could not persist rollback state of deal {}", deal.getId(), e);
        }
    }

    /**
     * Leaves a BUY that is still live on the exchange inside an OPEN deal with a pending SELL,
     * so the sync and completion monitors keep following it. Without a SELL the completion
     * check derives one from the filled BUY.
     */
    private void keepTracked(Deal deal, Order buyOrder, StrategyResult strategy) {
        Order sellOrder = null;
        try {
            sellOrder = orderService.createLocalOrder(deal.getSymbol(), OrderSide.SELL, strategy.coinsToSell(),
                    strategy.sellPrice(), deal.getId());
        } catch (RuntimeException e) {
            log.error("Could not record SELL for deal {}, it will be derived from the BUY fill", deal.getId(), e);
        }
        try {
            deal.attachOrders(buyOrder, sellOrder);
            dealService.save(deal);
        } catch (RuntimeException e) {
            log.error("Could not persist tracking state of deal {}", deal.getId(), e);
        }
    }

    private static boolean isLiveOnExchange(Order order) {
        return order != null && order.getExchangeId() != null
                && (order.isOpen() || order.getStatus() == OrderStatus.FILLED);
    }

    private ExecutionReport success(CurrencyPair pair, StrategyResult strategy, Deal deal, Order buyOrder,
                                    Order sellOrder, List<String> warnings) {
        BigDecimal totalCost = strategy.coinsToBuy().multiply(strategy.buyPrice());
        BigDecimal revenue = strategy.coinsToSell().multiply(strategy.sellPrice());
        BigDecimal fee = MoneyUtils.orZero(pair.getTakerFee());
        BigDecimal fees = totalCost.add(revenue).multiply(fee);
        BigDecimal expectedProfit = strategy.info() != null && strategy.info().netProfit() != null
                ? strategy.info().netProfit()
                : revenue.subtract(totalCost).subtract(fees);
        return ExecutionReport.builder()
                .success(true)
                .dealId(deal.getId())
                .buyOrder(buyOrder)
                .sellOrder(sellOrder)
                .totalCost(totalCost)
                .expectedProfit(expectedProfit)
                .fees(fees)
                .warnings(List.copyOf(warnings))
                .build();
    }

    private static ExecutionReport failure(FailureType type, String message, Long dealId, Order buyOrder,
                                           List<String> warnings) {
        return ExecutionReport.builder()
                .success(false)
                .dealId(dealId)
                .buyOrder(buyOrder)
                .totalCost(BigDecimal.ZERO)
                .expectedProfit(BigDecimal.ZERO)
                .fees(BigDecimal.ZERO)
                .errorMessage(message)
                .failureType(type)
                .warnings(List.copyOf(warnings))
                .build();
    }

    private synchronized void recordStatistics(ExecutionReport report) {
        totalExecutions++;
        totalExecutionTimeMs += report.executionTimeMs();
        if (report.success()) {
            successfulExecutions++;
            totalVolume = totalVolume.add(report.totalCost());
            totalFees = totalFees.add(report.fees());
        } else {
            failedExecutions++;
        }
        metricsService.recordExecution(report.success());
    }

    public synchronized ExecutionStatistics getExecutionStatistics() {
        BigDecimal successRate = totalExecutions == 0 ? BigDecimal.ZERO
                : BigDecimal.valueOf(successfulExecutions * 100).divide(BigDecimal.valueOf(totalExecutions), 2, RoundingMode.HALF_UP);
        long averageTime = totalExecutions == 0 ? 0 : totalExecutionTimeMs / totalExecutions;
        return new ExecutionStatistics(totalExecutions, successfulExecutions, failedExecutions, totalVolume,
                totalFees, averageTime, successRate);
    }

    /**
     * Cancels open orders and force-closes open deals, for one symbol or for all when
     * {@code symbol} is null.
     */
    public EmergencyStopReport emergencyStopAllTrading(String symbol) {
        log.warn("EMERGENCY STOP symbol={}", symbol != null ? symbol : "ALL");
        try {
            int canceled = orderService.emergencyCancelAllOrders(symbol, "emergency stop");
            int closed = dealService.forceCloseAllDeals(symbol, "emergency stop");
            return new EmergencyStopReport(true, canceled, closed, orderService.getOpenOrders().size(),
                    dealService.getOpenDeals().size(), symbol != null ? symbol : "ALL", Instant.now(), null);
        } catch (RuntimeException e) {
            log.error("Emergency stop failed", e);
            return new EmergencyStopReport(false, 0, 0, -1, -1, symbol != null ? symbol : "ALL", Instant.now(),
                    e.getMessage());
        }
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static BigDecimal deviation(BigDecimal price, BigDecimal market) {
        return price.subtract(market).abs().divide(market, MoneyUtils.CALC);
    }

    private static String asPercent(BigDecimal fraction) {
        return fraction.movePointRight(2).setScale(1, RoundingMode.HALF_UP).toPlainString();
    }

    public record ExecutionStatistics(long totalExecutions, long successfulExecutions, long failedExecutions,
                                      BigDecimal totalVolume, BigDecimal totalFees, long averageExecutionTimeMs,
                                      BigDecimal successRate) {
    }

    public record EmergencyStopReport(boolean success, int canceledOrders, int closedDeals, int remainingOpenOrders,
                                      int openDeals, String symbol, Instant timestamp, String error) {
    }
}
