package com.pairtrader.engine.service;

import com.pairtrader.engine.model.Order;

/**
 * Outcome of one order operation. {@code order} is set whenever a local order exists,
 * including on failure.
 */
public record OrderExecutionResult(boolean success, Order order, String error) {

    public static OrderExecutionResult success(Order order) {
        return new OrderExecutionResult(true, order, null);
    }

    public static OrderExecutionResult failure(Order order, String error) {
        return new OrderExecutionResult(false, order, error);
    }
}
