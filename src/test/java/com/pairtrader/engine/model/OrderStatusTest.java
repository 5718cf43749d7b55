package com.pairtrader.engine.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OrderStatusTest {

    @Test
    void pendingOnlyMovesToOpenOrFailed() {
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.OPEN)).isTrue();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.FAILED)).isTrue();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.FILLED)).isFalse();
        assertThat(OrderStatus.PENDING.canTransitionTo(OrderStatus.CANCELED)).isFalse();
    }

    @Test
    void terminalStatusesNeverLeave() {
        for (OrderStatus terminal : new OrderStatus[]{OrderStatus.FILLED, OrderStatus.CANCELED, OrderStatus.FAILED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (OrderStatus target : OrderStatus.values()) {
                assertThat(terminal.canTransitionTo(target)).isEqualTo(terminal == target);
            }
        }
    }

    @Test
    void placedOrderCannotFail() {
        assertThat(OrderStatus.OPEN.canTransitionTo(OrderStatus.FAILED)).isFalse();
        assertThat(OrderStatus.OPEN.canTransitionTo(OrderStatus.CANCELED)).isTrue();
        assertThat(OrderStatus.OPEN.canTransitionTo(OrderStatus.FILLED)).isTrue();
    }

    @Test
    void partiallyFilledCannotFail() {
        assertThat(OrderStatus.PARTIALLY_FILLED.canTransitionTo(OrderStatus.FILLED)).isTrue();
        assertThat(OrderStatus.PARTIALLY_FILLED.canTransitionTo(OrderStatus.CANCELED)).isTrue();
        assertThat(OrderStatus.PARTIALLY_FILLED.canTransitionTo(OrderStatus.FAILED)).isFalse();
        assertThat(OrderStatus.PARTIALLY_FILLED.isRegressionTo(OrderStatus.OPEN)).isTrue();
    }

    @Test
    void parsesExchangeSpellings() {
        assertThat(OrderStatus.fromString("closed")).isEqualTo(OrderStatus.FILLED);
        assertThat(OrderStatus.fromString("cancelled")).isEqualTo(OrderStatus.CANCELED);
        assertThat(OrderStatus.fromString("new")).isEqualTo(OrderStatus.OPEN);
        assertThat(OrderStatus.fromString(null)).isEqualTo(OrderStatus.PENDING);
        assertThat(OrderStatus.fromString("weird")).isEqualTo(OrderStatus.PENDING);
    }
}
