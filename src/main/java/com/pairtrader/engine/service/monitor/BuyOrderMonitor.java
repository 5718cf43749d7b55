package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.config.MonitorProperties;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.repository.OrderRepository;
import com.pairtrader.engine.service.OrderService;
import com.pairtrader.engine.service.ScheduledTaskGuard;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Watches resting BUY orders and hands stale ones to {@link OrderTimeoutService}.
 * Orders younger than the grace period are not even refreshed, the exchange may not know
 * them yet. Partially filled BUYs are left to fill.
 */
@Slf4j
@Service
public class BuyOrderMonitor extends AbstractOrderMonitor {

    private final OrderRepository orderRepository;
    private final OrderService orderService;
    private final OrderTimeoutService orderTimeoutService;
    private final ExchangeGateway exchangeGateway;
    private final StaleOrderPolicy buyOrderStalePolicy;
    private final MonitorProperties monitorProperties;

    private final AtomicLong checksPerformed = new AtomicLong();
    private final AtomicLong ordersInspected = new AtomicLong();
    private final AtomicLong skippedInGrace = new AtomicLong();
    private final AtomicLong staleOrdersFound = new AtomicLong();
    private final AtomicLong ordersRecreated = new AtomicLong();
    private volatile Instant lastSummaryAt = Instant.EPOCH;

    public BuyOrderMonitor(OrderRepository orderRepository,
                           OrderService orderService,
                           OrderTimeoutService orderTimeoutService,
                           ExchangeGateway exchangeGateway,
                           StaleOrderPolicy buyOrderStalePolicy,
                           MonitorProperties monitorProperties,
                           ScheduledTaskGuard scheduledTaskGuard) {
        super("buy-order-monitor", scheduledTaskGuard);
        this.orderRepository = orderRepository;
        this.orderService = orderService;
        this.orderTimeoutService = orderTimeoutService;
        this.exchangeGateway = exchangeGateway;
        this.buyOrderStalePolicy = buyOrderStalePolicy;
        this.monitorProperties = monitorProperties;
    }

    @Override
    public void runOnce() {
        checksPerformed.incrementAndGet();
        Instant now = Instant.now();
        Duration grace = Duration.ofSeconds(monitorProperties.getBuyOrder().getGracePeriodSeconds());
        List<Order> candidates = orderRepository.findOpenOrdersBySide(OrderSide.BUY).stream()
                .filter(order -> order.getExchangeId() != null)
                .toList();

        int stale = 0;
        Map<String, BigDecimal> tickCache = new HashMap<>();
        MarketPriceSource prices = symbol -> tickCache.computeIfAbsent(symbol, this::fetchMarketPrice);
        for (Order order : candidates) {
            if (order.ageAt(now).compareTo(grace) < 0) {
                skippedInGrace.incrementAndGet();
                log.debug("BUY {} still in grace period age={}s", order.getId(), order.ageAt(now).toSeconds());
                continue;
            }
            ordersInspected.incrementAndGet();
            Order refreshed = orderService.getOrderStatus(order);
            if (refreshed.getStatus() != OrderStatus.OPEN) {
                continue;
            }
            Optional<String> reason = buyOrderStalePolicy.evaluate(refreshed, now, prices);
            if (reason.isEmpty()) {
                continue;
            }
            stale++;
            staleOrdersFound.incrementAndGet();
            RemediationOutcome outcome = orderTimeoutService.handleStaleOrder(refreshed, reason.get());
            if (outcome.action() == RemediationOutcome.Action.RECREATED) {
                ordersRecreated.incrementAndGet();
            }
            log.info("Stale BUY {} handled action={} {}", refreshed.getId(), outcome.action(),
                    outcome.message() != null ? outcome.message() : "");
        }
        orderTimeoutService.cleanupRecords();
        if (stale == 0) {
            logSummaryIfDue(now, candidates.size());
        }
    }

    private BigDecimal fetchMarketPrice(String symbol) {
        try {
            return exchangeGateway.fetchTicker(symbol);
        } catch (RuntimeException e) {
            log.warn("No market price for {}: {}", symbol, e.getMessage());
            return null;
        }
    }

    private void logSummaryIfDue(Instant now, int watched) {
        Duration every = Duration.ofSeconds(monitorProperties.getBuyOrder().getSummaryIntervalSeconds());
        if (lastSummaryAt.plus(every).isAfter(now)) {
            return;
        }
        lastSummaryAt = now;
        log.info("BUY monitor summary watching={} checks={} stale={} recreated={}",
                watched, checksPerformed.get(), staleOrdersFound.get(), ordersRecreated.get());
    }

    @Override
    protected Duration checkInterval() {
        return Duration.ofSeconds(monitorProperties.getBuyOrder().getCheckIntervalSeconds());
    }

    @Override
    protected Duration errorPause() {
        return Duration.ofSeconds(monitorProperties.getBuyOrder().getErrorPauseSeconds());
    }

    @Override
    protected boolean isEnabled() {
        return monitorProperties.getBuyOrder().isEnabled();
    }

    public BuyMonitorStatistics getStatistics() {
        return new BuyMonitorStatistics(isRunning(), checksPerformed.get(), ordersInspected.get(),
                skippedInGrace.get(), staleOrdersFound.get(), ordersRecreated.get());
    }

    public record BuyMonitorStatistics(boolean running, long checksPerformed, long ordersInspected,
                                       long skippedInGrace, long staleOrdersFound, long ordersRecreated) {
    }
}
