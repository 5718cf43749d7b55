package com.pairtrader.engine.service;

import com.pairtrader.engine.config.ExecutionProperties;
import com.pairtrader.engine.exception.OrderNotFoundException;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderStatus;
import com.pairtrader.engine.model.OrderType;
import com.pairtrader.engine.repository.OrderRepository;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.service.exchange.ExchangeOrderUpdate;
import com.pairtrader.engine.util.BackoffRetryExecutor;
import com.pairtrader.engine.util.RetryOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Places, cancels and refreshes single orders through the exchange boundary. Public
 * methods report failures through {@link OrderExecutionResult} instead of throwing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OrderService {

    private final ExchangeGateway exchangeGateway;
    private final OrderRepository orderRepository;
    private final OrderFactory orderFactory;
    private final CurrencyPairRegistry currencyPairRegistry;
    private final ExecutionProperties executionProperties;
    private final MetricsService metricsService;

    private final AtomicLong ordersCreated = new AtomicLong();
    private final AtomicLong ordersPlaced = new AtomicLong();
    private final AtomicLong ordersFailed = new AtomicLong();
    private final AtomicLong ordersCanceled = new AtomicLong();
    private final AtomicLong retryAttempts = new AtomicLong();
    private final AtomicLong statusChecks = new AtomicLong();

    public OrderExecutionResult createAndPlaceBuyOrder(String symbol, BigDecimal amount, BigDecimal price, Long dealId) {
        return createAndPlaceOrder(symbol, OrderSide.BUY, amount, price, dealId);
    }

    public OrderExecutionResult createAndPlaceSellOrder(String symbol, BigDecimal amount, BigDecimal price, Long dealId) {
        return createAndPlaceOrder(symbol, OrderSide.SELL, amount, price, dealId);
    }

    /**
     * Creates a local LIMIT order without sending it anywhere. Used for the SELL leg of a
     * deal, which waits for its BUY to fill.
     */
    public Order createLocalOrder(String symbol, OrderSide side, BigDecimal amount, BigDecimal price, Long dealId) {
        CurrencyPair pair = currencyPairRegistry.find(symbol).orElse(null);
        Order order = orderFactory.createOrder(symbol, side, OrderType.LIMIT, amount, price, dealId, pair);
        ordersCreated.incrementAndGet();
        orderRepository.save(order);
        log.info("Local order recorded orderId={} dealId={} {} {} @ {}", order.getId(), dealId, side,
                order.getAmount(), order.getPrice());
        return order;
    }

    public OrderExecutionResult createAndPlaceOrder(String symbol, OrderSide side, BigDecimal amount,
                                                    BigDecimal price, Long dealId) {
        try {
            CurrencyPair pair = currencyPairRegistry.find(symbol).orElse(null);
            Order order = orderFactory.createOrder(symbol, side, OrderType.LIMIT, amount, price, dealId, pair);
            ordersCreated.incrementAndGet();
            return placeOrder(order);
        } catch (RuntimeException e) {
            log.error("Unexpected error creating {} order symbol={} dealId={}", side, symbol, dealId, e);
            ordersFailed.incrementAndGet();
            metricsService.incrementOrderFailures();
            return OrderExecutionResult.failure(null, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Sends a PENDING order to the exchange, retrying with exponential backoff. Every failed
     * attempt increments {@link Order#getRetries()}; when all attempts fail the order ends up
     * FAILED with the last error.
     */
    public OrderExecutionResult placeOrder(Order order) {
        if (order == null) {
            return OrderExecutionResult.failure(null, "Order is required");
        }
        if (!order.isPending()) {
            return OrderExecutionResult.failure(order,
                    "Order " + order.getId() + " cannot be placed from status " + order.getStatus());
        }
        try {
            List<String> errors = validateOrder(order);
            if (!errors.isEmpty()) {
                return fail(order, "Validation failed: " + String.join("; ", errors));
            }
            orderRepository.save(order);

            ExecutionProperties.Retry retry = executionProperties.getRetry();
            RetryOutcome<ExchangeOrderUpdate> outcome = BackoffRetryExecutor.execute(
                    "place-" + order.getClientOrderId(),
                    () -> exchangeGateway.createOrder(order.getSymbol(), order.getSide(), order.getType(),
                            order.getAmount(), order.getPrice(), order.getClientOrderId()),
                    retry.getMaxAttempts(),
                    Duration.ofMillis(retry.getBaseDelayMs()),
                    retry.getMultiplier(),
                    error -> {
                        order.incrementRetries();
                        order.setErrorMessage(error.getMessage());
                        retryAttempts.incrementAndGet();
                    });
            if (!outcome.success()) {
                return fail(order, "Failed after " + outcome.attempts() + " attempts: " + outcome.errorMessage());
            }

            ExchangeOrderUpdate placed = outcome.value();
            try {
                order.markAsPlaced(placed.exchangeId(), placed.timestamp());
                order.applyExchangeUpdate(placed);
                orderRepository.save(order);
            } catch (RuntimeException e) {
                return releaseUnrecordedOrder(order, placed, e);
            }
            ordersPlaced.incrementAndGet();
            metricsService.incrementOrdersPlaced();
            log.info("Order placed orderId={} dealId={} side={} exchangeId={} amount={} price={} status={}",
                    order.getId(), order.getDealId(), order.getSide(), order.getExchangeId(),
                    order.getAmount(), order.getPrice(), order.getStatus());
            return OrderExecutionResult.success(order);
        } catch (RuntimeException e) {
            log.error("Unexpected error placing order orderId={}", order.getId(), e);
            return fail(order, "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Local checks before anything reaches the exchange: shape, then pair limits when the
     * pair metadata can be loaded.
     */
    public List<String> validateOrder(Order order) {
        List<String> errors = new ArrayList<>(order.validateForExchange());
        if (!errors.isEmpty()) {
            return errors;
        }
        currencyPairRegistry.find(order.getSymbol()).ifPresent(pair -> {
            BigDecimal amount = order.getAmount();
            BigDecimal price = order.getPrice();
            if (pair.getMinAmount() != null && amount.compareTo(pair.getMinAmount()) < 0) {
                errors.add("Amount " + amount.toPlainString() + " is below minimum " + pair.getMinAmount().toPlainString());
            }
            if (pair.getMaxAmount() != null && amount.compareTo(pair.getMaxAmount()) > 0) {
                errors.add("Amount " + amount.toPlainString() + " is above maximum " + pair.getMaxAmount().toPlainString());
            }
            if (price != null && pair.getMinPrice() != null && price.compareTo(pair.getMinPrice()) < 0) {
                errors.add("Price " + price.toPlainString() + " is below minimum " + pair.getMinPrice().toPlainString());
            }
            if (price != null && pair.getMaxPrice() != null && price.compareTo(pair.getMaxPrice()) > 0) {
                errors.add("Price " + price.toPlainString() + " is above maximum " + pair.getMaxPrice().toPlainString());
            }
            if (price != null && pair.getMinNotional() != null
                    && amount.multiply(price).compareTo(pair.getMinNotional()) < 0) {
                errors.add("Notional " + amount.multiply(price).toPlainString() + " is below minimum "
                        + pair.getMinNotional().toPlainString());
            }
        });
        return errors;
    }

    /**
     * Fetches the exchange snapshot and merges it into the order. A snapshot that is not
     * newer than the stored one changes nothing, so repeated calls are idempotent.
     * Lookup failures are logged and the order is returned unchanged.
     */
    public Order getOrderStatus(Order order) {
        if (order == null || order.getExchangeId() == null || order.getStatus().isTerminal()) {
            return order;
        }
        statusChecks.incrementAndGet();
        try {
            ExchangeOrderUpdate update = exchangeGateway.fetchOrder(order.getExchangeId(), order.getSymbol());
            if (order.applyExchangeUpdate(update)) {
                orderRepository.save(order);
                log.debug("Order refreshed orderId={} status={} filled={}", order.getId(), order.getStatus(),
                        order.getFilledAmount());
            }
        } catch (RuntimeException e) {
            log.warn("Status check failed orderId={} exchangeId={}: {}", order.getId(), order.getExchangeId(),
                    e.getMessage());
        }
        return order;
    }

    /**
     * Cancels an order. Terminal orders are left alone and reported as success, so
     * cancelling an order that already filled is harmless; check the returned order's status
     * to see what actually happened. A PENDING order never reached the exchange and is
     * marked FAILED locally.
     */
    public OrderExecutionResult cancelOrder(Order order, String reason) {
        if (order == null) {
            return OrderExecutionResult.failure(null, "Order is required");
        }
        if (order.getStatus().isTerminal()) {
            log.debug("Cancel skipped, order {} already {}", order.getId(), order.getStatus());
            return OrderExecutionResult.success(order);
        }
        try {
            if (order.isPending()) {
                order.markAsFailed("Canceled before placement: " + reason);
                orderRepository.save(order);
                return OrderExecutionResult.success(order);
            }
            try {
                ExchangeOrderUpdate update = exchangeGateway.cancelOrder(order.getExchangeId(), order.getSymbol());
                order.applyExchangeUpdate(update);
                if (order.isOpen()) {
                    order.cancel(reason);
                }
            } catch (OrderNotFoundException e) {
                log.warn("Order {} unknown to the exchange, canceling locally", order.getExchangeId());
                order.cancel(reason + " (not found on exchange)");
            }
            if (order.getStatus() == OrderStatus.CANCELED) {
                if (order.getErrorMessage() == null) {
                    order.setErrorMessage("Canceled: " + reason);
                }
                ordersCanceled.incrementAndGet();
                metricsService.incrementOrdersCanceled();
                log.info("Order canceled orderId={} dealId={} exchangeId={} reason={}",
                        order.getId(), order.getDealId(), order.getExchangeId(), reason);
            } else {
                log.info("Order {} not canceled, exchange reports {}", order.getId(), order.getStatus());
            }
            orderRepository.save(order);
            return OrderExecutionResult.success(order);
        } catch (RuntimeException e) {
            log.error("Cancel failed orderId={} exchangeId={}", order.getId(), order.getExchangeId(), e);
            return OrderExecutionResult.failure(order, "Cancel failed: " + e.getMessage());
        }
    }

    public List<Order> getOpenOrders() {
        return orderRepository.findOpenOrders();
    }

    /**
     * Cancels every open order, or only those of {@code symbol} when it is not null.
     *
     * @return number of orders that ended up CANCELED
     */
    public int emergencyCancelAllOrders(String symbol, String reason) {
        List<Order> open = orderRepository.findOpenOrders().stream()
                .filter(order -> symbol == null || symbol.equals(order.getSymbol()))
                .toList();
        log.warn("Emergency cancel of {} open orders symbol={} reason={}", open.size(), symbol, reason);
        int canceled = 0;
        for (Order order : open) {
            OrderExecutionResult result = cancelOrder(order, reason);
            if (result.success() && result.order().getStatus() == OrderStatus.CANCELED) {
                canceled++;
            }
        }
        return canceled;
    }

    public OrderServiceStatistics getStatistics() {
        return new OrderServiceStatistics(ordersCreated.get(), ordersPlaced.get(), ordersFailed.get(),
                ordersCanceled.get(), retryAttempts.get(), statusChecks.get(),
                orderRepository.findOpenOrders().size());
    }

    /**
     * The exchange accepted the order but it could not be recorded locally. The exchange
     * order is canceled at once. The returned order keeps the exchange id and ends CANCELED,
     * FILLED when the fill won the race, or still OPEN when the cancel failed too.
     */
    private OrderExecutionResult releaseUnrecordedOrder(Order order, ExchangeOrderUpdate placed, RuntimeException cause) {
        String exchangeId = placed.exchangeId();
        log.error("Order accepted by the exchange but not recorded orderId={} exchangeId={}, canceling it",
                order.getId(), exchangeId, cause);
        String error = "Placed order could not be recorded: " + cause.getMessage();
        if (exchangeId == null || exchangeId.isBlank()) {
            return fail(order, error + " (exchange returned no order id)");
        }
        if (order.getExchangeId() == null) {
            order.setExchangeId(exchangeId);
        }
        try {
            ExchangeOrderUpdate update = exchangeGateway.cancelOrder(exchangeId, order.getSymbol());
            metricsService.recordEmergencyCancel();
            if (order.isPending()) {
                order.markAsPlaced(exchangeId, placed.timestamp());
            }
            order.applyExchangeUpdate(update);
            if (order.isOpen()) {
                order.cancel(error);
            }
            log.warn("Unrecorded order exchangeId={} released, status={}", exchangeId, order.getStatus());
        } catch (RuntimeException cancelError) {
            log.error("Emergency cancel of unrecorded order exchangeId={} failed, it is still live", exchangeId,
                    cancelError);
            error = error + "; emergency cancel failed: " + cancelError.getMessage();
        }
        order.setErrorMessage(error);
        saveQuietly(order);
        ordersFailed.incrementAndGet();
        metricsService.incrementOrderFailures();
        return OrderExecutionResult.failure(order, error);
    }

    private OrderExecutionResult fail(Order order, String error) {
        if (order.isPending()) {
            order.markAsFailed(error);
        }
        saveQuietly(order);
        ordersFailed.incrementAndGet();
        metricsService.incrementOrderFailures();
        log.warn("Order failed orderId={} dealId={} side={} retries={} error={}",
                order.getId(), order.getDealId(), order.getSide(), order.getRetries(), error);
        return OrderExecutionResult.failure(order, error);
    }

    private void saveQuietly(Order order) {
        try {
            orderRepository.save(order);
        } catch (RuntimeException e) {
            log.error("Could not store order orderId={} status={}", order.getId(), order.getStatus(), e);
        }
    }

    public record OrderServiceStatistics(long ordersCreated, long ordersPlaced, long ordersFailed,
                                         long ordersCanceled, long retryAttempts, long statusChecks,
                                         int openOrders) {
    }
}
