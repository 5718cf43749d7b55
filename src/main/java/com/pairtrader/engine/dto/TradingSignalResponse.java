package com.pairtrader.engine.dto;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@Builder
public record TradingSignalResponse(
        boolean success,
        Long dealId,
        Map<String, Object> buyOrder,
        Map<String, Object> sellOrder,
        BigDecimal totalCost,
        BigDecimal expectedProfit,
        BigDecimal fees,
        long executionTimeMs,
        String failureType,
        String errorMessage,
        List<String> warnings
) {
}
