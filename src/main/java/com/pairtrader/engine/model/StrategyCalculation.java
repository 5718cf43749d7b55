package com.pairtrader.engine.model;

public record StrategyCalculation(boolean success, StrategyResult result, String failureReason) {

    public static StrategyCalculation success(StrategyResult result) {
        return new StrategyCalculation(true, result, null);
    }

    public static StrategyCalculation failure(String reason) {
        return new StrategyCalculation(false, null, reason);
    }
}
