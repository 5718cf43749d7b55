package com.pairtrader.engine.model;

public enum OrderSide {
    BUY,
    SELL;

    public String toExchange() {
        return name().toLowerCase();
    }
}
