package com.pairtrader.engine.service.monitor;

import com.pairtrader.engine.config.MonitorProperties;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.service.DealService;
import com.pairtrader.engine.service.ScheduledTaskGuard;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Drives open deals forward: releases the waiting SELL once its BUY fills and closes deals
 * whose legs are both filled.
 */
@Slf4j
@Service
public class DealCompletionMonitor extends AbstractOrderMonitor {

    private final DealService dealService;
    private final MonitorProperties monitorProperties;

    private final AtomicLong checksPerformed = new AtomicLong();
    private final AtomicLong dealsFinished = new AtomicLong();

    public DealCompletionMonitor(DealService dealService,
                                 MonitorProperties monitorProperties,
                                 ScheduledTaskGuard scheduledTaskGuard) {
        super("deal-completion-monitor", scheduledTaskGuard);
        this.dealService = dealService;
        this.monitorProperties = monitorProperties;
    }

    @Override
    public void runOnce() {
        checksPerformed.incrementAndGet();
        for (Deal deal : dealService.getOpenDeals()) {
            try {
                if (dealService.closeDealIfCompleted(deal)) {
                    dealsFinished.incrementAndGet();
                }
            } catch (RuntimeException e) {
                log.error("Completion check failed for deal {}", deal.getId(), e);
            }
        }
    }

    @Override
    protected Duration checkInterval() {
        return Duration.ofSeconds(monitorProperties.getDealCompletion().getCheckIntervalSeconds());
    }

    @Override
    protected boolean isEnabled() {
        return monitorProperties.getDealCompletion().isEnabled();
    }

    public CompletionStatistics getStatistics() {
        return new CompletionStatistics(isRunning(), checksPerformed.get(), dealsFinished.get());
    }

    public record CompletionStatistics(boolean running, long checksPerformed, long dealsFinished) {
    }
}
