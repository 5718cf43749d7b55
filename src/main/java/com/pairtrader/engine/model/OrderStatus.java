package com.pairtrader.engine.model;

/**
 * Order lifecycle.
 * PENDING -> OPEN -> (PARTIALLY_FILLED) -> FILLED | CANCELED
 * PENDING -> FAILED
 */
public enum OrderStatus {
    PENDING(0),          // Created locally, not yet on the exchange
    OPEN(1),             // Accepted by the exchange, nothing filled
    PARTIALLY_FILLED(2), // Some quantity filled, still resting
    FILLED(3),
    CANCELED(3),
    FAILED(3);           // Never reached the exchange: placement exhausted or rejected

    private final int rank;

    OrderStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 3;
    }

    public boolean isOpen() {
        return this == OPEN || this == PARTIALLY_FILLED;
    }

    public boolean isCancelable() {
        return isOpen();
    }

    public boolean canTransitionTo(OrderStatus target) {
        if (target == null) return false;
        if (this == target) return true; // Self-transitions allowed for idempotency

        return switch (this) {
            case PENDING -> target == OPEN || target == FAILED;
            case OPEN -> target == PARTIALLY_FILLED || target == FILLED || target == CANCELED;
            case PARTIALLY_FILLED -> target == FILLED || target == CANCELED;
            default -> false;
        };
    }

    /**
     * True when moving to {@code target} would go backwards in the lifecycle.
     */
    public boolean isRegressionTo(OrderStatus target) {
        return target != null && target.rank < rank;
    }

    public static OrderStatus fromString(String status) {
        if (status == null || status.isBlank()) {
            return PENDING;
        }
        try {
            return valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return switch (status.toUpperCase()) {
                case "NEW" -> OPEN;
                case "PARTIAL" -> PARTIALLY_FILLED;
                case "CLOSED", "COMPLETE" -> FILLED;
                case "CANCELLED" -> CANCELED;
                case "REJECTED", "EXPIRED" -> FAILED;
                default -> PENDING;
            };
        }
    }
}
