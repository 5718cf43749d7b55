package com.pairtrader.engine.exception;

/**
 * Network, 4xx or 5xx failure reported by the exchange boundary.
 */
public class ExchangeException extends TradingException {
    private final int statusCode;

    public ExchangeException(String message) {
        super(message);
        this.statusCode = -1;
    }

    public ExchangeException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public ExchangeException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
