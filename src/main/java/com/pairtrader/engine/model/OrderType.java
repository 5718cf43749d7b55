package com.pairtrader.engine.model;

public enum OrderType {
    LIMIT,
    MARKET;

    public String toExchange() {
        return name().toLowerCase();
    }
}
