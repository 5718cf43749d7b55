package com.pairtrader.engine.service.exchange;

import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Canonical snapshot of one exchange order. Every gateway response is normalized into
 * this shape before it reaches the services.
 *
 * @param timestamp exchange-side time of the snapshot in epoch millis, may be null
 */
@Builder(toBuilder = true)
public record ExchangeOrderUpdate(
        String exchangeId,
        ExchangeOrderStatus status,
        BigDecimal filled,
        BigDecimal remaining,
        BigDecimal averagePrice,
        BigDecimal feeCost,
        Long timestamp
) {

    /**
     * Normalizes a loosely typed exchange payload (ccxt-style keys: id, status, filled,
     * remaining, average, fee.cost, timestamp).
     */
    public static ExchangeOrderUpdate fromPayload(Map<String, ?> payload) {
        if (payload == null) {
            throw new IllegalArgumentException("Exchange payload is null");
        }
        Object fee = payload.get("fee");
        BigDecimal feeCost = null;
        if (fee instanceof Map<?, ?> feeMap) {
            feeCost = decimal(feeMap.get("cost"));
        } else if (fee != null) {
            feeCost = decimal(fee);
        }
        Object status = payload.get("status");
        return new ExchangeOrderUpdate(
                payload.get("id") != null ? String.valueOf(payload.get("id")) : null,
                ExchangeOrderStatus.normalize(status != null ? String.valueOf(status) : null),
                decimal(payload.get("filled")),
                decimal(payload.get("remaining")),
                decimal(payload.get("average")),
                feeCost,
                payload.get("timestamp") instanceof Number number ? number.longValue() : null
        );
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal bd) {
            return bd;
        }
        String text = String.valueOf(value).trim();
        if (text.isEmpty()) {
            return null;
        }
        return new BigDecimal(text);
    }
}
