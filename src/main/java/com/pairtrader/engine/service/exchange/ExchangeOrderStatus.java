package com.pairtrader.engine.service.exchange;

import java.util.Locale;

/**
 * Exchange-side order status after normalization. Venues report these under many
 * spellings ("closed", "FILLED", "cancelled", "NEW", ...).
 */
public enum ExchangeOrderStatus {
    OPEN,
    CLOSED,
    CANCELED,
    REJECTED,
    EXPIRED,
    UNKNOWN;

    public static ExchangeOrderStatus normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "OPEN", "NEW", "PARTIALLY_FILLED", "PARTIAL", "PENDING_NEW" -> OPEN;
            case "CLOSED", "FILLED", "COMPLETE" -> CLOSED;
            case "CANCELED", "CANCELLED", "PENDING_CANCEL" -> CANCELED;
            case "REJECTED" -> REJECTED;
            case "EXPIRED" -> EXPIRED;
            default -> UNKNOWN;
        };
    }
}
