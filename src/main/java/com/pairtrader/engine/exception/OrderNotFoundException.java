package com.pairtrader.engine.exception;

public class OrderNotFoundException extends ExchangeException {
    public OrderNotFoundException(String exchangeId, String symbol) {
        super("Order " + exchangeId + " not found on exchange for " + symbol, 404, null);
    }
}
