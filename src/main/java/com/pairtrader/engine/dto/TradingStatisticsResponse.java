package com.pairtrader.engine.dto;

import com.pairtrader.engine.service.DealService;
import com.pairtrader.engine.service.OrderExecutionService;
import com.pairtrader.engine.service.OrderService;
import com.pairtrader.engine.service.monitor.BuyOrderMonitor;
import com.pairtrader.engine.service.monitor.DealCompletionMonitor;
import com.pairtrader.engine.service.monitor.OrderSyncMonitor;
import com.pairtrader.engine.service.monitor.OrderTimeoutService;

public record TradingStatisticsResponse(
        OrderExecutionService.ExecutionStatistics execution,
        OrderService.OrderServiceStatistics orders,
        DealService.DealStatistics deals,
        OrderTimeoutService.TimeoutStatistics timeouts,
        BuyOrderMonitor.BuyMonitorStatistics buyMonitor,
        OrderSyncMonitor.SyncStatistics syncMonitor,
        DealCompletionMonitor.CompletionStatistics completionMonitor
) {
}
