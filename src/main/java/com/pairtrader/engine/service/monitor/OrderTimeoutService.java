package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.config.ExecutionProperties;
import com.pairtrader.engine.config.MonitorProperties;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.repository.DealRepository;
import com.pairtrader.engine.repository.OrderRepository;
import com.pairtrader.engine.service.CurrencyPairRegistry;
import com.pairtrader.engine.service.MetricsService;
import com.pairtrader.engine.service.OrderExecutionResult;
import com.pairtrader.engine.service.OrderService;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Remediates a stale BUY: cancel it, then place a replacement just under the market with the
 * same amount and deal. Replacements per deal are capped and spaced by a cool-down; while the
 * cool-down runs the stale order is left untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderTimeoutService {

    private final OrderService orderService;
    private final OrderRepository orderRepository;
    private final DealRepository dealRepository;
    private final ExchangeGateway exchangeGateway;
    private final CurrencyPairRegistry currencyPairRegistry;
    private final ExecutionProperties executionProperties;
    private final MonitorProperties monitorProperties;
    private final MetricsService metricsService;

    private final Map<Long, RecreationRecord> recreations = new ConcurrentHashMap<>();

    private final AtomicLong staleOrdersHandled = new AtomicLong();
    private final AtomicLong ordersCanceled = new AtomicLong();
    private final AtomicLong ordersRecreated = new AtomicLong();
    private final AtomicLong recreationFailures = new AtomicLong();
    private final AtomicLong skippedByCooldown = new AtomicLong();
    private final AtomicLong skippedByCap = new AtomicLong();

    public RemediationOutcome handleStaleOrder(Order order, String reason) {
        Deal deal = dealRepository.findById(order.getDealId()).orElse(null);
        if (deal == null) {
            return remediate(order, null, reason);
        }
        synchronized (deal) {
            return remediate(order, deal, reason);
        }
    }

    private RemediationOutcome remediate(Order order, Deal deal, String reason) {
        staleOrdersHandled.incrementAndGet();
        Instant now = Instant.now();
        if (inCooldown(order.getDealId(), now)) {
            skippedByCooldown.incrementAndGet();
            log.info("Stale BUY {} of deal {} left alone, recreation cool-down active", order.getId(), order.getDealId());
            return RemediationOutcome.of(RemediationOutcome.Action.SKIPPED_COOLDOWN, null, "cool-down active");
        }

        log.warn("Stale BUY orderId={} dealId={} price={} reason={}", order.getId(), order.getDealId(),
                order.getPrice(), reason);
        OrderExecutionResult cancel = orderService.cancelOrder(order, "stale: " + reason);
        if (!cancel.success()) {
            return RemediationOutcome.of(RemediationOutcome.Action.CANCEL_FAILED, null, cancel.error());
        }
        if (order.getStatus() == OrderStatus.FILLED) {
            log.info("Stale BUY {} filled before it could be canceled", order.getId());
            return RemediationOutcome.of(RemediationOutcome.Action.ALREADY_FILLED, null, "filled");
        }
        if (order.getStatus() != OrderStatus.CANCELED) {
            return RemediationOutcome.of(RemediationOutcome.Action.CANCEL_FAILED, null,
                    "order ended " + order.getStatus());
        }
        ordersCanceled.incrementAndGet();

        if (deal == null || !deal.isOpen()) {
            return RemediationOutcome.of(RemediationOutcome.Action.CANCELED_ONLY, null, "no open deal");
        }
        if (order.getFilledAmount().signum() > 0) {
            return RemediationOutcome.of(RemediationOutcome.Action.CANCELED_ONLY, null, "partially filled");
        }
        if (deal.getSellOrder() == null) {
            log.warn("Deal {} has no SELL, BUY {} canceled without replacement", deal.getId(), order.getId());
            return RemediationOutcome.of(RemediationOutcome.Action.CANCELED_ONLY, null, "deal has no SELL");
        }
        int done = recreationCount(deal.getId());
        if (done >= monitorProperties.getTimeout().getMaxRecreationsPerDeal()) {
            skippedByCap.incrementAndGet();
            log.warn("Deal {} reached the recreation limit {}, BUY canceled without replacement",
                    deal.getId(), done);
            return RemediationOutcome.of(RemediationOutcome.Action.CANCELED_ONLY, null, "recreation limit reached");
        }
        return recreate(order, deal, now);
    }

    private RemediationOutcome recreate(Order stale, Deal deal, Instant now) {
        recreations.merge(deal.getId(), new RecreationRecord(1, now),
                (previous, ignored) -> new RecreationRecord(previous.count() + 1, now));
        CurrencyPair pair = deal.getCurrencyPair() != null ? deal.getCurrencyPair()
                : currencyPairRegistry.find(stale.getSymbol()).orElse(null);
        BigDecimal newPrice;
        try {
            BigDecimal market = exchangeGateway.fetchTicker(stale.getSymbol());
            newPrice = market.multiply(executionProperties.getRecreationPriceFactor());
            if (pair != null) {
                newPrice = pair.floorPrice(newPrice);
            }
        } catch (RuntimeException e) {
            recreationFailures.incrementAndGet();
            log.error("No market price to recreate BUY for deal {}: {}", deal.getId(), e.getMessage());
            return RemediationOutcome.of(RemediationOutcome.Action.RECREATION_FAILED, null, e.getMessage());
        }

        OrderExecutionResult placed = orderService.createAndPlaceBuyOrder(
                stale.getSymbol(), stale.getAmount(), newPrice, deal.getId());
        if (!placed.success()) {
            recreationFailures.incrementAndGet();
            log.error("Replacement BUY for deal {} failed: {}", deal.getId(), placed.error());
            return RemediationOutcome.of(RemediationOutcome.Action.RECREATION_FAILED, placed.order(), placed.error());
        }

        Order replacement = placed.order();
        deal.replaceBuyOrder(replacement);
        repricePendingSell(deal, replacement, pair);
        dealRepository.save(deal);
        ordersRecreated.incrementAndGet();
        metricsService.recordOrderRecreation();
        log.info("BUY recreated dealId={} old={} @ {} new={} @ {}", deal.getId(), stale.getId(), stale.getPrice(),
                replacement.getId(), replacement.getPrice());
        return RemediationOutcome.of(RemediationOutcome.Action.RECREATED, replacement, null);
    }

    /** The waiting SELL follows the new entry price so the target markup is kept. */
    private void repricePendingSell(Deal deal, Order replacement, CurrencyPair pair) {
        Order sell = deal.getSellOrder();
        if (sell == null || !sell.isPending()) {
            return;
        }
        BigDecimal markup = pair != null ? MoneyUtils.orZero(pair.getProfitMarkup()) : BigDecimal.ZERO;
        BigDecimal raw = replacement.getPrice().multiply(BigDecimal.ONE.add(markup));
        BigDecimal newPrice = pair != null ? pair.roundPrice(raw) : raw;
        BigDecimal previous = sell.getPrice();
        sell.setPrice(newPrice);
        sell.setUpdatedAt(Instant.now());
        orderRepository.save(sell);
        log.info("Pending SELL {} of deal {} repriced {} -> {}", sell.getId(), deal.getId(), previous, newPrice);
    }

    public boolean inCooldown(Long dealId, Instant now) {
        RecreationRecord record = dealId != null ? recreations.get(dealId) : null;
        if (record == null) {
            return false;
        }
        Duration cooldown = Duration.ofMinutes(monitorProperties.getTimeout().getMinMinutesBetweenRecreations());
        return record.lastAt().plus(cooldown).isAfter(now);
    }

    public int recreationCount(Long dealId) {
        RecreationRecord record = dealId != null ? recreations.get(dealId) : null;
        return record != null ? record.count() : 0;
    }

    /** Forgets deals that are no longer open. */
    public int cleanupRecords() {
        int before = recreations.size();
        recreations.keySet().removeIf(dealId -> dealRepository.findById(dealId).map(deal -> !deal.isOpen()).orElse(true));
        return before - recreations.size();
    }

    public TimeoutStatistics getStatistics() {
        return new TimeoutStatistics(staleOrdersHandled.get(), ordersCanceled.get(), ordersRecreated.get(),
                recreationFailures.get(), skippedByCooldown.get(), skippedByCap.get(), recreations.size());
    }

    private record RecreationRecord(int count, Instant lastAt) {
    }

    public record TimeoutStatistics(long staleOrdersHandled, long ordersCanceled, long ordersRecreated,
                                    long recreationFailures, long skippedByCooldown, long skippedByCap,
                                    int trackedDeals) {
    }
}
