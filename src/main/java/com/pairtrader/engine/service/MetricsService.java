package com.pairtrader.engine.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private Counter ordersPlacedCounter;
    private Counter orderFailuresCounter;
    private Counter ordersCanceledCounter;
    private Counter executionsSucceededCounter;
    private Counter executionsFailedCounter;
    private Counter emergencyCancelsCounter;
    private Counter orderRecreationsCounter;
    private Counter dealsClosedCounter;

    @PostConstruct
    void init() {
        ordersPlacedCounter = Counter.builder("orders_placed_total").register(meterRegistry);
        orderFailuresCounter = Counter.builder("order_failures_total").register(meterRegistry);
        ordersCanceledCounter = Counter.builder("orders_canceled_total").register(meterRegistry);
        executionsSucceededCounter = Counter.builder("trade_executions_total").tag("outcome", "success").register(meterRegistry);
        executionsFailedCounter = Counter.builder("trade_executions_total").tag("outcome", "failure").register(meterRegistry);
        emergencyCancelsCounter = Counter.builder("emergency_cancels_total").register(meterRegistry);
        orderRecreationsCounter = Counter.builder("order_recreations_total").register(meterRegistry);
        dealsClosedCounter = Counter.builder("deals_closed_total").register(meterRegistry);
    }

    public void incrementOrdersPlaced() {
        increment(ordersPlacedCounter);
    }

    public void incrementOrderFailures() {
        increment(orderFailuresCounter);
    }

    public void incrementOrdersCanceled() {
        increment(ordersCanceledCounter);
    }

    public void recordExecution(boolean success) {
        increment(success ? executionsSucceededCounter : executionsFailedCounter);
    }

    public void recordEmergencyCancel() {
        increment(emergencyCancelsCounter);
    }

    public void recordOrderRecreation() {
        increment(orderRecreationsCounter);
    }

    public void recordDealClosed() {
        increment(dealsClosedCounter);
    }

    public void recordTaskFailure(String task) {
        Counter.builder("scheduled_task_failures_total")
                .tag("task", task)
                .register(meterRegistry)
                .increment();
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }
}
