package com.pairtrader.engine.service;

import com.pairtrader.engine.config.ExecutionProperties;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.DealStatus;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.repository.DealRepository;
import com.pairtrader.engine.service.exchange.BalanceCheck;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deal lifecycle: open, attach orders, advance once the BUY fills, close.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DealService {

    private final DealRepository dealRepository;
    private final DealFactory dealFactory;
    private final OrderService orderService;
    private final ExchangeGateway exchangeGateway;
    private final ExecutionProperties executionProperties;
    private final MetricsService metricsService;

    /** Failed SELLs replaced so far, per deal. */
    private final Map<Long, Integer> sellReplacements = new ConcurrentHashMap<>();

    private final AtomicLong dealsCreated = new AtomicLong();
    private final AtomicLong dealsClosed = new AtomicLong();
    private final AtomicLong dealsCanceled = new AtomicLong();
    private final AtomicLong sellOrdersPlaced = new AtomicLong();

    public Deal createNewDeal(CurrencyPair currencyPair) {
        Deal deal = dealFactory.createNewDeal(currencyPair);
        dealRepository.save(deal);
        dealsCreated.incrementAndGet();
        log.info("Deal opened dealId={} symbol={}", deal.getId(), deal.getSymbol());
        return deal;
    }

    /**
     * Whether the quote balance covers a BUY of {@code amount} at {@code price}.
     */
    public BalanceCheck checkBalanceBeforeDeal(CurrencyPair currencyPair, BigDecimal amount, BigDecimal price) {
        BalanceCheck check = exchangeGateway.checkSufficientBalance(currencyPair.getSymbol(), OrderSide.BUY, amount, price);
        if (!check.sufficient()) {
            log.warn("Insufficient balance for {}: {}", currencyPair.getSymbol(), check.describe());
        }
        return check;
    }

    public Deal attachOrders(Deal deal, Order buyOrder, Order sellOrder) {
        deal.attachOrders(buyOrder, sellOrder);
        return dealRepository.save(deal);
    }

    public Deal save(Deal deal) {
        return dealRepository.save(deal);
    }

    public Optional<Deal> getDealById(Long id) {
        return dealRepository.findById(id);
    }

    public List<Deal> getOpenDeals() {
        return dealRepository.findOpenDeals();
    }

    public long countOpenDeals(String symbol) {
        return dealRepository.countOpenDealsBySymbol(symbol);
    }

    /**
     * Refreshes both legs and moves the deal forward: a filled BUY releases the pending SELL
     * to the exchange, two filled legs close the deal with its profit, and a BUY that ended
     * without a fill cancels it. A failed SELL is replaced a limited number of times.
     *
     * @return true when the deal left the OPEN state
     */
    public boolean closeDealIfCompleted(Deal deal) {
        if (deal == null || !deal.isOpen()) {
            return false;
        }
        synchronized (deal) {
            Order buy = orderService.getOrderStatus(deal.getBuyOrder());
            Order sell = orderService.getOrderStatus(deal.getSellOrder());
            if (buy == null) {
                return false;
            }
            if (sell == null) {
                return handleMissingSell(deal, buy);
            }

            if (buy.isFilled() && sell.isPending()) {
                placePendingSell(deal, sell);
                return false;
            }

            if (buy.isFilled() && sell.getStatus() == OrderStatus.FAILED) {
                replaceFailedSell(deal, buy, sell);
                return false;
            }

            if (deal.bothOrdersFilled()) {
                BigDecimal profit = deal.calculateProfit();
                deal.close();
                dealRepository.save(deal);
                sellReplacements.remove(deal.getId());
                dealsClosed.incrementAndGet();
                metricsService.recordDealClosed();
                log.info("Deal completed dealId={} symbol={} profit={}", deal.getId(), deal.getSymbol(),
                        profit.toPlainString());
                return true;
            }

            if (isAbandoned(buy) && sell.isPending()) {
                if (buy.getFilledAmount().signum() > 0) {
                    log.warn("Deal {} BUY ended {} after a partial fill of {}, the bought amount needs manual handling",
                            deal.getId(), buy.getStatus(), buy.getFilledAmount());
                }
                orderService.cancelOrder(sell, "BUY order " + buy.getStatus());
                deal.cancel();
                dealRepository.save(deal);
                dealsCanceled.incrementAndGet();
                log.info("Deal canceled dealId={} buyStatus={}", deal.getId(), buy.getStatus());
                return true;
            }
            return false;
        }
    }

    /**
     * Cancels whatever is still open on every OPEN deal (of {@code symbol}, or all when null)
     * and closes it. A deal whose open order could not be canceled stays OPEN.
     *
     * @return number of deals closed
     */
    public int forceCloseAllDeals(String symbol, String reason) {
        int closed = 0;
        for (Deal deal : dealRepository.findOpenDeals()) {
            if (symbol != null && !symbol.equals(deal.getSymbol())) {
                continue;
            }
            synchronized (deal) {
                if (!deal.isOpen()) {
                    continue;
                }
                for (Order order : new Order[]{deal.getBuyOrder(), deal.getSellOrder()}) {
                    if (order != null && !order.getStatus().isTerminal()) {
                        orderService.cancelOrder(order, reason);
                    }
                }
                if (deal.hasOpenOrder()) {
                    log.error("Deal {} still has an open order after force close, leaving it OPEN", deal.getId());
                    continue;
                }
                deal.calculateProfit();
                deal.close();
                dealRepository.save(deal);
                dealsClosed.incrementAndGet();
                closed++;
                log.warn("Deal force-closed dealId={} reason={}", deal.getId(), reason);
            }
        }
        return closed;
    }

    public DealStatistics getStatistics() {
        List<Deal> all = dealRepository.findAll();
        long open = all.stream().filter(Deal::isOpen).count();
        BigDecimal realizedProfit = all.stream()
                .filter(deal -> deal.getStatus() == DealStatus.CLOSED)
                .map(Deal::getProfit)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new DealStatistics(all.size(), open, dealsCreated.get(), dealsClosed.get(), dealsCanceled.get(),
                sellOrdersPlaced.get(), realizedProfit);
    }

    private void placePendingSell(Deal deal, Order sell) {
        OrderExecutionResult result = orderService.placeOrder(sell);
        if (result.success()) {
            sellOrdersPlaced.incrementAndGet();
            log.info("SELL released dealId={} orderId={} exchangeId={} price={}",
                    deal.getId(), sell.getId(), sell.getExchangeId(), sell.getPrice());
        } else {
            log.error("SELL placement failed dealId={} orderId={} error={}", deal.getId(), sell.getId(), result.error());
        }
        dealRepository.save(deal);
    }

    private void replaceFailedSell(Deal deal, Order buy, Order failed) {
        int limit = executionProperties.getMaxSellReplacements();
        int done = sellReplacements.getOrDefault(deal.getId(), 0);
        if (done >= limit) {
            if (done == limit) {
                sellReplacements.put(deal.getId(), done + 1);
                log.error("Deal {} SELL failed after {} replacements ({}), holding {} {} for manual handling",
                        deal.getId(), limit, failed.getErrorMessage(), buy.getFilledAmount(), deal.getSymbol());
            }
            return;
        }
        sellReplacements.put(deal.getId(), done + 1);
        Order retry = orderService.createLocalOrder(failed.getSymbol(), OrderSide.SELL, failed.getAmount(),
                failed.getPrice(), deal.getId());
        deal.attachOrders(buy, retry);
        dealRepository.save(deal);
        log.warn("SELL for deal {} failed earlier ({}), queued replacement {}/{} orderId={}",
                deal.getId(), failed.getErrorMessage(), done + 1, limit, retry.getId());
    }

    /**
     * A deal kept open after a failed rollback may have no SELL. Once its BUY fills, a SELL
     * is derived from the fill and the pair's markup; a BUY that ended otherwise cancels it.
     */
    private boolean handleMissingSell(Deal deal, Order buy) {
        if (buy.isFilled()) {
            Order sell = orderService.createLocalOrder(buy.getSymbol(), OrderSide.SELL, buy.getFilledAmount(),
                    targetSellPrice(deal.getCurrencyPair(), buy), deal.getId());
            deal.attachOrders(buy, sell);
            dealRepository.save(deal);
            log.warn("Deal {} had no SELL, recorded orderId={} {} @ {}", deal.getId(), sell.getId(),
                    sell.getAmount(), sell.getPrice());
            placePendingSell(deal, sell);
            return false;
        }
        if (isAbandoned(buy)) {
            if (buy.getFilledAmount().signum() > 0) {
                log.warn("Deal {} BUY ended {} after a partial fill of {}, the bought amount needs manual handling",
                        deal.getId(), buy.getStatus(), buy.getFilledAmount());
            }
            deal.cancel();
            dealRepository.save(deal);
            dealsCanceled.incrementAndGet();
            log.info("Deal without SELL canceled dealId={} buyStatus={}", deal.getId(), buy.getStatus());
            return true;
        }
        return false;
    }

    private static BigDecimal targetSellPrice(CurrencyPair pair, Order buy) {
        BigDecimal entry = buy.getAveragePrice() != null && buy.getAveragePrice().signum() > 0
                ? buy.getAveragePrice() : buy.getPrice();
        if (pair == null) {
            return entry;
        }
        return pair.roundPrice(entry.multiply(BigDecimal.ONE.add(MoneyUtils.orZero(pair.getProfitMarkup()))));
    }

    private static boolean isAbandoned(Order buy) {
        return buy.getStatus() == OrderStatus.FAILED || buy.getStatus() == OrderStatus.CANCELED;
    }

    public record DealStatistics(int totalDeals, long openDeals, long dealsCreated, long dealsClosed,
                                 long dealsCanceled, long sellOrdersPlaced, BigDecimal realizedProfit) {
    }
}
