package com.pairtrader.engine.service;

import com.pairtrader.engine.model.Order;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of one trade execution. On failure {@code failureType} says which stage gave up.
 */
@Builder(toBuilder = true)
public record ExecutionReport(
        boolean success,
        Long dealId,
        Order buyOrder,
        Order sellOrder,
        BigDecimal totalCost,
        BigDecimal expectedProfit,
        BigDecimal fees,
        long executionTimeMs,
        String errorMessage,
        FailureType failureType,
        List<String> warnings
) {

    public enum FailureType {
        VALIDATION,
        INSUFFICIENT_BALANCE,
        EXCHANGE_ERROR,
        PARTIAL_FAILURE,
        UNEXPECTED
    }
}
