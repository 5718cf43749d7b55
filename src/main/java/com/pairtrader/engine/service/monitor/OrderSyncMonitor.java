package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.config.MonitorProperties;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.service.OrderService;
import com.pairtrader.engine.service.ScheduledTaskGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Reconciles every open order with the exchange on a fixed cadence, whatever its age or
 * price. Picks up fills and cancellations that happened exchange-side.
 */
@Slf4j
@Service
public class OrderSyncMonitor extends AbstractOrderMonitor {

    private final OrderService orderService;
    private final MonitorProperties monitorProperties;

    private final AtomicLong syncsPerformed = new AtomicLong();
    private final AtomicLong ordersChecked = new AtomicLong();
    private final AtomicLong ordersUpdated = new AtomicLong();
    private final AtomicLong statusChanges = new AtomicLong();
    private final AtomicLong fillChanges = new AtomicLong();

    public OrderSyncMonitor(OrderService orderService,
                            MonitorProperties monitorProperties,
                            ScheduledTaskGuard scheduledTaskGuard) {
        super("order-sync-monitor", scheduledTaskGuard);
        this.orderService = orderService;
        this.monitorProperties = monitorProperties;
    }

    @Override
    public void runOnce() {
        syncsPerformed.incrementAndGet();
        List<Order> open = orderService.getOpenOrders();
        int updated = 0;
        for (Order order : open) {
            ordersChecked.incrementAndGet();
            OrderStatus statusBefore = order.getStatus();
            BigDecimal filledBefore = order.getFilledAmount();
            orderService.getOrderStatus(order);
            boolean statusChanged = order.getStatus() != statusBefore;
            boolean fillChanged = order.getFilledAmount().compareTo(filledBefore) != 0;
            if (statusChanged) {
                statusChanges.incrementAndGet();
                log.info("Sync: order {} {} -> {}", order.getId(), statusBefore, order.getStatus());
            }
            if (fillChanged) {
                fillChanges.incrementAndGet();
                log.info("Sync: order {} filled {} -> {}", order.getId(), filledBefore, order.getFilledAmount());
            }
            if (statusChanged || fillChanged) {
                updated++;
            }
        }
        ordersUpdated.addAndGet(updated);
        if (!open.isEmpty()) {
            log.debug("Sync pass checked={} updated={}", open.size(), updated);
        }
    }

    @Override
    protected Duration checkInterval() {
        return Duration.ofSeconds(monitorProperties.getSync().getCheckIntervalSeconds());
    }

    @Override
    protected boolean isEnabled() {
        return monitorProperties.getSync().isEnabled();
    }

    public SyncStatistics getStatistics() {
        return new SyncStatistics(isRunning(), syncsPerformed.get(), ordersChecked.get(), ordersUpdated.get(),
                statusChanges.get(), fillChanges.get());
    }

    public record SyncStatistics(boolean running, long syncsPerformed, long ordersChecked, long ordersUpdated,
                                 long statusChanges, long fillChanges) {
    }
}
