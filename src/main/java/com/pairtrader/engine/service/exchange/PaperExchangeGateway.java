package com.pairtrader.engine.service.exchange;

import com.pairtrader.engine.exception.ExchangeException;
import com.pairtrader.engine.exception.OrderNotFoundException;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderType;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory exchange. LIMIT orders rest until {@link #updateLastPrice} crosses them,
 * MARKET orders fill at the last price. Fees are charged in the quote currency at the
 * pair's taker rate. Never talks to a real venue.
 */
@Slf4j
public class PaperExchangeGateway implements ExchangeGateway {

    private final Map<String, BigDecimal> balances = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> lastPrices = new ConcurrentHashMap<>();
    private final Map<String, CurrencyPair> markets = new ConcurrentHashMap<>();
    private final Map<String, PaperOrder> orders = new ConcurrentHashMap<>();
    private final AtomicLong clock = new AtomicLong();

    public PaperExchangeGateway(Map<String, BigDecimal> initialBalances,
                                Map<String, BigDecimal> initialPrices,
                                List<CurrencyPair> pairs) {
        if (initialBalances != null) {
            balances.putAll(initialBalances);
        }
        if (initialPrices != null) {
            lastPrices.putAll(initialPrices);
        }
        if (pairs != null) {
            pairs.forEach(pair -> markets.put(pair.getSymbol(), pair));
        }
    }

    @Override
    public synchronized ExchangeOrderUpdate createOrder(String symbol, OrderSide side, OrderType type,
                                                        BigDecimal amount, BigDecimal price, String clientOrderId) {
        CurrencyPair pair = market(symbol);
        if (amount == null || amount.signum() <= 0) {
            throw new ExchangeException("Invalid amount " + amount, 400, null);
        }
        BigDecimal referencePrice = type == OrderType.MARKET ? fetchTicker(symbol) : price;
        if (referencePrice == null || referencePrice.signum() <= 0) {
            throw new ExchangeException("Invalid price " + price, 400, null);
        }
        BalanceCheck balance = checkSufficientBalance(symbol, side, amount, referencePrice);
        if (!balance.sufficient()) {
            throw new ExchangeException("Insufficient balance: " + balance.describe(), 400, null);
        }
        PaperOrder order = new PaperOrder(UUID.randomUUID().toString(), pair, side, type, amount, referencePrice, tick());
        orders.put(order.id, order);
        log.info("Paper order accepted id={} clientOrderId={} {} {} {} @ {}",
                order.id, clientOrderId, side, amount.toPlainString(), symbol, referencePrice.toPlainString());
        if (type == OrderType.MARKET || crosses(order, lastPrices.get(symbol))) {
            fill(order);
        }
        return order.snapshot();
    }

    @Override
    public synchronized ExchangeOrderUpdate cancelOrder(String exchangeId, String symbol) {
        PaperOrder order = find(exchangeId, symbol);
        if (order.status == ExchangeOrderStatus.OPEN) {
            order.status = ExchangeOrderStatus.CANCELED;
            order.timestamp = tick();
        }
        return order.snapshot();
    }

    @Override
    public ExchangeOrderUpdate fetchOrder(String exchangeId, String symbol) {
        synchronized (this) {
            return find(exchangeId, symbol).snapshot();
        }
    }

    @Override
    public BigDecimal fetchTicker(String symbol) {
        BigDecimal price = lastPrices.get(symbol);
        if (price == null) {
            throw new ExchangeException("No ticker for " + symbol, 404, null);
        }
        return price;
    }

    @Override
    public BalanceCheck checkSufficientBalance(String symbol, OrderSide side, BigDecimal amount, BigDecimal price) {
        CurrencyPair pair = market(symbol);
        if (side == OrderSide.BUY) {
            BigDecimal required = amount.multiply(price).multiply(BigDecimal.ONE.add(pair.getTakerFee()));
            BigDecimal available = balance(pair.getQuoteCurrency());
            return new BalanceCheck(available.compareTo(required) >= 0, pair.getQuoteCurrency(), available, required);
        }
        BigDecimal available = balance(pair.getBaseCurrency());
        return new BalanceCheck(available.compareTo(amount) >= 0, pair.getBaseCurrency(), available, amount);
    }

    @Override
    public CurrencyPair fetchCurrencyPair(String symbol) {
        return market(symbol).toBuilder().build();
    }

    /**
     * Moves the market and fills every resting LIMIT order the new price crosses.
     */
    public synchronized void updateLastPrice(String symbol, BigDecimal price) {
        lastPrices.put(symbol, price);
        orders.values().stream()
                .filter(order -> order.status == ExchangeOrderStatus.OPEN)
                .filter(order -> order.pair.getSymbol().equals(symbol))
                .filter(order -> crosses(order, price))
                .toList()
                .forEach(this::fill);
    }

    public BigDecimal balance(String currency) {
        return balances.getOrDefault(currency, BigDecimal.ZERO);
    }

    private boolean crosses(PaperOrder order, BigDecimal marketPrice) {
        if (marketPrice == null) {
            return false;
        }
        return order.side == OrderSide.BUY
                ? marketPrice.compareTo(order.price) <= 0
                : marketPrice.compareTo(order.price) >= 0;
    }

    private void fill(PaperOrder order) {
        CurrencyPair pair = order.pair;
        BigDecimal notional = order.amount.multiply(order.price);
        BigDecimal fee = notional.multiply(pair.getTakerFee());
        if (order.side == OrderSide.BUY) {
            balances.merge(pair.getQuoteCurrency(), notional.add(fee).negate(), BigDecimal::add);
            balances.merge(pair.getBaseCurrency(), order.amount, BigDecimal::add);
        } else {
            balances.merge(pair.getBaseCurrency(), order.amount.negate(), BigDecimal::add);
            balances.merge(pair.getQuoteCurrency(), notional.subtract(fee), BigDecimal::add);
        }
        order.filled = order.amount;
        order.fee = fee;
        order.status = ExchangeOrderStatus.CLOSED;
        order.timestamp = tick();
        log.info("Paper order filled id={} {} {} @ {} fee={}",
                order.id, order.side, order.amount.toPlainString(), order.price.toPlainString(), fee.toPlainString());
    }

    private PaperOrder find(String exchangeId, String symbol) {
        PaperOrder order = orders.get(exchangeId);
        if (order == null || !Objects.equals(order.pair.getSymbol(), symbol)) {
            throw new OrderNotFoundException(exchangeId, symbol);
        }
        return order;
    }

    private CurrencyPair market(String symbol) {
        CurrencyPair pair = markets.get(symbol);
        if (pair == null) {
            throw new ExchangeException("Unknown market " + symbol, 404, null);
        }
        return pair;
    }

    private long tick() {
        long now = System.currentTimeMillis();
        return clock.updateAndGet(previous -> Math.max(previous + 1, now));
    }

    private static final class PaperOrder {
        private final String id;
        private final CurrencyPair pair;
        private final OrderSide side;
        private final OrderType type;
        private final BigDecimal amount;
        private final BigDecimal price;
        private BigDecimal filled = BigDecimal.ZERO;
        private BigDecimal fee = BigDecimal.ZERO;
        private ExchangeOrderStatus status = ExchangeOrderStatus.OPEN;
        private long timestamp;

        private PaperOrder(String id, CurrencyPair pair, OrderSide side, OrderType type,
                           BigDecimal amount, BigDecimal price, long timestamp) {
            this.id = id;
            this.pair = pair;
            this.side = side;
            this.type = type;
            this.amount = amount;
            this.price = price;
            this.timestamp = timestamp;
        }

        private ExchangeOrderUpdate snapshot() {
            return ExchangeOrderUpdate.builder()
                    .exchangeId(id)
                    .status(status)
                    .filled(filled)
                    .remaining(amount.subtract(filled))
                    .averagePrice(filled.signum() > 0 ? price : null)
                    .feeCost(fee)
                    .timestamp(timestamp)
                    .build();
        }
    }
}
