package com.pairtrader.engine.model;

import com.pairtrader.engine.service.exchange.ExchangeOrderStatus;
import com.pairtrader.engine.service.exchange.ExchangeOrderUpdate;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * One exchange order as tracked locally. Fill state only advances through
 * {@link #applyExchangeUpdate(ExchangeOrderUpdate)}. The monitors share instances across
 * threads, so every lifecycle mutator locks the order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Slf4j
public class Order {

    private Long id;

    private String symbol;

    private OrderSide side;

    private OrderType type;

    private BigDecimal price;

    private BigDecimal amount;

    @Builder.Default
    private BigDecimal filledAmount = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal averagePrice = BigDecimal.ZERO;

    @Builder.Default
    private BigDecimal fees = BigDecimal.ZERO;

    @Builder.Default
    private OrderStatus status = OrderStatus.PENDING;

    private String exchangeId;

    private Long dealId;

    private String clientOrderId;

    private Instant createdAt;

    private Instant updatedAt;

    private Instant closedAt;

    /** Epoch millis of the newest exchange snapshot merged into this order. */
    private Long exchangeTimestamp;

    private int retries;

    private String errorMessage;

    public synchronized void markAsPlaced(String exchangeId, Long exchangeTimestamp) {
        if (exchangeId == null || exchangeId.isBlank()) {
            throw new IllegalArgumentException("Exchange id is required to mark order " + id + " as placed");
        }
        transitionTo(OrderStatus.OPEN);
        this.exchangeId = exchangeId;
        this.exchangeTimestamp = exchangeTimestamp;
        this.errorMessage = null;
    }

    public synchronized void markAsFailed(String error) {
        transitionTo(OrderStatus.FAILED);
        this.errorMessage = error;
        this.closedAt = updatedAt;
    }

    public synchronized void incrementRetries() {
        retries++;
    }

    /**
     * Cancels an open order locally.
     *
     * @return false when the order already reached a terminal state
     * @throws IllegalStateException for an order that was never placed
     */
    public synchronized boolean cancel(String reason) {
        if (status.isTerminal()) {
            return false;
        }
        if (!status.isCancelable()) {
            throw new IllegalStateException(
                    String.format("Order %s cannot be canceled from %s", id, status));
        }
        transitionTo(OrderStatus.CANCELED);
        this.closedAt = updatedAt;
        if (reason != null) {
            this.errorMessage = "Canceled: " + reason;
        }
        return true;
    }

    /**
     * Merges an exchange snapshot. Snapshots for another exchange id, or older than the
     * stored one, are ignored; fill quantity and status never move backwards. A terminal
     * order is final and ignores every snapshot.
     *
     * @return true when any local field changed
     */
    public synchronized boolean applyExchangeUpdate(ExchangeOrderUpdate update) {
        if (update == null) {
            return false;
        }
        if (status.isTerminal()) {
            log.debug("Ignoring snapshot for finished order orderId={} status={}", id, status);
            return false;
        }
        if (exchangeId != null && update.exchangeId() != null && !exchangeId.equals(update.exchangeId())) {
            log.warn("Ignoring snapshot for foreign exchange id orderId={} expected={} got={}",
                    id, exchangeId, update.exchangeId());
            return false;
        }
        if (exchangeTimestamp != null && update.timestamp() != null && update.timestamp() < exchangeTimestamp) {
            log.debug("Ignoring stale snapshot orderId={} stored={} received={}",
                    id, exchangeTimestamp, update.timestamp());
            return false;
        }

        OrderStatus previousStatus = status;
        BigDecimal previousFilled = filledAmount;
        BigDecimal previousAverage = averagePrice;
        BigDecimal previousFees = fees;

        BigDecimal filled = filledAmount;
        if (update.filled() != null && update.filled().compareTo(filled) > 0) {
            filled = update.filled().min(amount);
        }
        this.filledAmount = filled;
        if (update.averagePrice() != null && update.averagePrice().signum() > 0) {
            this.averagePrice = update.averagePrice();
        }
        if (update.feeCost() != null && update.feeCost().compareTo(fees) > 0) {
            this.fees = update.feeCost();
        }

        OrderStatus target = targetStatus(update.status(), filled);
        if (target != null && target != status && !status.isRegressionTo(target)) {
            if (status.canTransitionTo(target)) {
                applyStatus(target);
            } else {
                log.debug("Skipping transition {} -> {} for order {}", status, target, id);
            }
        }

        boolean changed = previousStatus != status
                || previousFilled.compareTo(filledAmount) != 0
                || !Objects.equals(previousAverage, averagePrice)
                || !Objects.equals(previousFees, fees);
        if (update.timestamp() != null && (exchangeTimestamp == null || update.timestamp() > exchangeTimestamp)) {
            this.exchangeTimestamp = update.timestamp();
            changed = true;
        }
        if (changed) {
            this.updatedAt = Instant.now();
        }
        return changed;
    }

    private OrderStatus targetStatus(ExchangeOrderStatus exchangeStatus, BigDecimal filled) {
        if (exchangeStatus == null) {
            return null;
        }
        return switch (exchangeStatus) {
            case CLOSED -> OrderStatus.FILLED;
            case CANCELED, EXPIRED -> OrderStatus.CANCELED;
            // a placed order can only end FILLED or CANCELED
            case REJECTED -> status == OrderStatus.PENDING ? OrderStatus.FAILED : OrderStatus.CANCELED;
            case OPEN -> filled.signum() > 0 ? OrderStatus.PARTIALLY_FILLED : OrderStatus.OPEN;
            case UNKNOWN -> null;
        };
    }

    private void applyStatus(OrderStatus target) {
        transitionTo(target);
        if (target.isTerminal()) {
            this.closedAt = updatedAt;
        }
        if (target == OrderStatus.FILLED && filledAmount.compareTo(amount) < 0) {
            this.filledAmount = amount;
        }
    }

    /**
     * Transition to a new status with validation
     * @throws IllegalStateException if transition is invalid
     */
    private void transitionTo(OrderStatus newStatus) {
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                    String.format("Invalid order transition: %s -> %s for order %s", status, newStatus, id));
        }
        if (status == newStatus) {
            return;
        }
        OrderStatus previous = status;
        this.status = newStatus;
        this.updatedAt = Instant.now();
        log.info("Order transition orderId={} dealId={} side={} from={} to={}", id, dealId, side, previous, newStatus);
    }

    public boolean isOpen() {
        return status.isOpen();
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    public boolean isFilled() {
        return status == OrderStatus.FILLED;
    }

    public BigDecimal remainingAmount() {
        return amount.subtract(filledAmount).max(BigDecimal.ZERO);
    }

    /** Fill ratio in [0, 1]. */
    public BigDecimal fillRatio() {
        if (amount == null || amount.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return filledAmount.divide(amount, 8, RoundingMode.DOWN).min(BigDecimal.ONE);
    }

    public Duration ageAt(Instant now) {
        if (createdAt == null) {
            return Duration.ZERO;
        }
        Duration age = Duration.between(createdAt, now);
        return age.isNegative() ? Duration.ZERO : age;
    }

    /** Filled quantity valued at the execution price, fees excluded. */
    public BigDecimal totalCost() {
        BigDecimal executionPrice = averagePrice != null && averagePrice.signum() > 0 ? averagePrice : price;
        return filledAmount.multiply(executionPrice);
    }

    public BigDecimal totalCostWithFees() {
        return totalCost().add(fees);
    }

    public List<String> validateForExchange() {
        List<String> errors = new ArrayList<>();
        if (symbol == null || symbol.isBlank()) {
            errors.add("Symbol is required");
        }
        if (amount == null || amount.signum() <= 0) {
            errors.add("Amount must be positive");
        }
        if (side == null) {
            errors.add("Side must be BUY or SELL");
        }
        if (type == OrderType.LIMIT && (price == null || price.signum() <= 0)) {
            errors.add("Price must be positive for limit orders");
        }
        return errors;
    }
}
