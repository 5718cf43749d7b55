package com.pairtrader.engine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pairtrader.engine.exception.TradingException;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Deal;
import com.pairtrader.engine.model.DealStatus;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.OrderType;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat snake_case snapshots of orders and deals. Decimals are written as plain strings and
 * instants as ISO-8601, so a snapshot read back equals the original.
 */
@Component
@RequiredArgsConstructor
public class StateSerializer {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public Map<String, Object> orderToMap(Order order) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", order.getId());
        map.put("symbol", order.getSymbol());
        map.put("side", name(order.getSide()));
        map.put("type", name(order.getType()));
        map.put("price", plain(order.getPrice()));
        map.put("amount", plain(order.getAmount()));
        map.put("filled_amount", plain(order.getFilledAmount()));
        map.put("average_price", plain(order.getAveragePrice()));
        map.put("fees", plain(order.getFees()));
        map.put("status", name(order.getStatus()));
        map.put("exchange_id", order.getExchangeId());
        map.put("deal_id", order.getDealId());
        map.put("client_order_id", order.getClientOrderId());
        map.put("created_at", iso(order.getCreatedAt()));
        map.put("updated_at", iso(order.getUpdatedAt()));
        map.put("closed_at", iso(order.getClosedAt()));
        map.put("exchange_timestamp", order.getExchangeTimestamp());
        map.put("retries", order.getRetries());
        map.put("error_message", order.getErrorMessage());
        return map;
    }

    public Order orderFromMap(Map<String, ?> map) {
        return Order.builder()
                .id(longValue(map.get("id")))
                .symbol(string(map.get("symbol")))
                .side(map.get("side") != null ? OrderSide.valueOf(string(map.get("side"))) : null)
                .type(map.get("type") != null ? OrderType.valueOf(string(map.get("type"))) : null)
                .price(decimal(map.get("price")))
                .amount(decimal(map.get("amount")))
                .filledAmount(decimalOrZero(map.get("filled_amount")))
                .averagePrice(decimalOrZero(map.get("average_price")))
                .fees(decimalOrZero(map.get("fees")))
                .status(OrderStatus.fromString(string(map.get("status"))))
                .exchangeId(string(map.get("exchange_id")))
                .dealId(longValue(map.get("deal_id")))
                .clientOrderId(string(map.get("client_order_id")))
                .createdAt(instant(map.get("created_at")))
                .updatedAt(instant(map.get("updated_at")))
                .closedAt(instant(map.get("closed_at")))
                .exchangeTimestamp(longValue(map.get("exchange_timestamp")))
                .retries(map.get("retries") instanceof Number number ? number.intValue() : 0)
                .errorMessage(string(map.get("error_message")))
                .build();
    }

    public Map<String, Object> dealToMap(Deal deal) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", deal.getId());
        map.put("symbol", deal.getSymbol());
        map.put("status", name(deal.getStatus()));
        map.put("profit", plain(deal.getProfit()));
        map.put("buy_order_id", deal.getBuyOrder() != null ? deal.getBuyOrder().getId() : null);
        map.put("sell_order_id", deal.getSellOrder() != null ? deal.getSellOrder().getId() : null);
        map.put("buy_order", deal.getBuyOrder() != null ? orderToMap(deal.getBuyOrder()) : null);
        map.put("sell_order", deal.getSellOrder() != null ? orderToMap(deal.getSellOrder()) : null);
        map.put("created_at", iso(deal.getCreatedAt()));
        map.put("updated_at", iso(deal.getUpdatedAt()));
        map.put("closed_at", iso(deal.getClosedAt()));
        return map;
    }

    /**
     * Pair metadata is not part of the snapshot; the caller supplies it.
     */
    @SuppressWarnings("unchecked")
    public Deal dealFromMap(Map<String, ?> map, CurrencyPair currencyPair) {
        Object buy = map.get("buy_order");
        Object sell = map.get("sell_order");
        return Deal.builder()
                .id(longValue(map.get("id")))
                .currencyPair(currencyPair)
                .status(map.get("status") != null ? DealStatus.valueOf(string(map.get("status"))) : DealStatus.OPEN)
                .profit(decimalOrZero(map.get("profit")))
                .buyOrder(buy instanceof Map<?, ?> buyMap ? orderFromMap((Map<String, ?>) buyMap) : null)
                .sellOrder(sell instanceof Map<?, ?> sellMap ? orderFromMap((Map<String, ?>) sellMap) : null)
                .createdAt(instant(map.get("created_at")))
                .updatedAt(instant(map.get("updated_at")))
                .closedAt(instant(map.get("closed_at")))
                .build();
    }

    public String toJson(Map<String, Object> snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new TradingException("Could not serialize snapshot", e);
        }
    }

    public Map<String, Object> fromJson(String json) {
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new TradingException("Could not parse snapshot", e);
        }
    }

    private static String name(Enum<?> value) {
        return value != null ? value.name() : null;
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : null;
    }

    private static String iso(Instant value) {
        return value != null ? value.toString() : null;
    }

    private static String string(Object value) {
        return value != null ? String.valueOf(value) : null;
    }

    private static Long longValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(String.valueOf(value));
    }

    private static BigDecimal decimal(Object value) {
        if (value == null) {
            return null;
        }
        return value instanceof BigDecimal bd ? bd : new BigDecimal(String.valueOf(value));
    }

    private static BigDecimal decimalOrZero(Object value) {
        BigDecimal decimal = decimal(value);
        return decimal != null ? decimal : BigDecimal.ZERO;
    }

    private static Instant instant(Object value) {
        return value != null ? Instant.parse(String.valueOf(value)) : null;
    }
}
