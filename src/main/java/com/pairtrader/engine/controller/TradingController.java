package com.pairtrader.engine.controller;

import com.pairtrader.engine.dto.TradingSignalRequest;
import com.pairtrader.engine.dto.TradingSignalResponse;
import com.pairtrader.engine.dto.TradingStatisticsResponse;
import com.pairtrader.engine.exception.TradingException;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.StrategyCalculation;
import com.pairtrader.engine.model.StrategyResult;
import com.pairtrader.engine.service.CurrencyPairRegistry;
import com.pairtrader.engine.service.DealService;
import com.pairtrader.engine.service.ExecutionReport;
import com.pairtrader.engine.service.OrderExecutionService;
import com.pairtrader.engine.service.OrderService;
import com.pairtrader.engine.service.StateSerializer;
import com.pairtrader.engine.service.StrategyCalculator;
import com.pairtrader.engine.service.monitor.BuyOrderMonitor;
import com.pairtrader.engine.service.monitor.DealCompletionMonitor;
import com.pairtrader.engine.service.monitor.OrderSyncMonitor;
import com.pairtrader.engine.service.monitor.OrderTimeoutService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/trading")
@RequiredArgsConstructor
public class TradingController {

    private final OrderExecutionService orderExecutionService;
    private final OrderService orderService;
    private final DealService dealService;
    private final StrategyCalculator strategyCalculator;
    private final CurrencyPairRegistry currencyPairRegistry;
    private final StateSerializer stateSerializer;
    private final OrderTimeoutService orderTimeoutService;
    private final BuyOrderMonitor buyOrderMonitor;
    private final OrderSyncMonitor orderSyncMonitor;
    private final DealCompletionMonitor dealCompletionMonitor;

    @PostMapping("/signals")
    public ResponseEntity<TradingSignalResponse> submitSignal(@Valid @RequestBody TradingSignalRequest request) {
        log.info("Trading signal received symbol={} buyPrice={}", request.getSymbol(), request.getBuyPrice());
        CurrencyPair pair = currencyPairRegistry.get(request.getSymbol());
        StrategyResult strategy = resolveStrategy(pair, request);
        ExecutionReport report = orderExecutionService.executeTradingStrategy(pair, strategy);
        HttpStatus status = report.success() ? HttpStatus.CREATED : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(toResponse(report));
    }

    @GetMapping("/statistics")
    public ResponseEntity<TradingStatisticsResponse> statistics() {
        return ResponseEntity.ok(new TradingStatisticsResponse(
                orderExecutionService.getExecutionStatistics(),
                orderService.getStatistics(),
                dealService.getStatistics(),
                orderTimeoutService.getStatistics(),
                buyOrderMonitor.getStatistics(),
                orderSyncMonitor.getStatistics(),
                dealCompletionMonitor.getStatistics()));
    }

    @GetMapping("/deals/open")
    public ResponseEntity<List<Map<String, Object>>> openDeals() {
        return ResponseEntity.ok(dealService.getOpenDeals().stream()
                .map(stateSerializer::dealToMap)
                .toList());
    }

    @GetMapping("/deals/{dealId}")
    public ResponseEntity<Map<String, Object>> deal(@PathVariable Long dealId) {
        return dealService.getDealById(dealId)
                .map(stateSerializer::dealToMap)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/emergency-stop")
    public ResponseEntity<OrderExecutionService.EmergencyStopReport> emergencyStop(
            @RequestParam(value = "symbol", required = false) String symbol) {
        return ResponseEntity.ok(orderExecutionService.emergencyStopAllTrading(symbol));
    }

    private StrategyResult resolveStrategy(CurrencyPair pair, TradingSignalRequest request) {
        if (request.isFullySized()) {
            return new StrategyResult(request.getBuyPrice(), request.getCoinsToBuy(), request.getSellPrice(),
                    request.getCoinsToSell());
        }
        if (request.isPreSized()) {
            throw new IllegalArgumentException("coinsToBuy, sellPrice and coinsToSell must be given together");
        }
        StrategyCalculation calculation = strategyCalculator.calculate(pair, request.getBuyPrice());
        if (!calculation.success()) {
            throw new TradingException("Strategy rejected: " + calculation.failureReason());
        }
        return calculation.result();
    }

    private TradingSignalResponse toResponse(ExecutionReport report) {
        return TradingSignalResponse.builder()
                .success(report.success())
                .dealId(report.dealId())
                .buyOrder(report.buyOrder() != null ? stateSerializer.orderToMap(report.buyOrder()) : null)
                .sellOrder(report.sellOrder() != null ? stateSerializer.orderToMap(report.sellOrder()) : null)
                .totalCost(report.totalCost())
                .expectedProfit(report.expectedProfit())
                .fees(report.fees())
                .executionTimeMs(report.executionTimeMs())
                .failureType(report.failureType() != null ? report.failureType().name() : null)
                .errorMessage(report.errorMessage())
                .warnings(report.warnings())
                .build();
    }
}
