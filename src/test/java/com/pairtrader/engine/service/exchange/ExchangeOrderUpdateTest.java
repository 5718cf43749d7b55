package com.pairtrader.engine.service.exchange;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExchangeOrderUpdateTest {

    @Test
    void normalizesALooselyTypedPayload() {
        ExchangeOrderUpdate update = ExchangeOrderUpdate.fromPayload(Map.of(
                "id", 12345,
                "status", "closed",
                "filled", "0.0332",
                "remaining", 0,
                "average", "2990.5",
                "fee", Map.of("cost", "0.099", "currency", "USDT"),
                "timestamp", 1_714_558_530_000L));

        assertThat(update.exchangeId()).isEqualTo("12345");
        assertThat(update.status()).isEqualTo(ExchangeOrderStatus.CLOSED);
        assertThat(update.filled()).isEqualByComparingTo("0.0332");
        assertThat(update.remaining()).isEqualByComparingTo("0");
        assertThat(update.averagePrice()).isEqualByComparingTo("2990.5");
        assertThat(update.feeCost()).isEqualByComparingTo("0.099");
        assertThat(update.timestamp()).isEqualTo(1_714_558_530_000L);
    }

    @Test
    void missingFieldsStayNull() {
        ExchangeOrderUpdate update = ExchangeOrderUpdate.fromPayload(Map.of("id", "abc"));

        assertThat(update.status()).isEqualTo(ExchangeOrderStatus.UNKNOWN);
        assertThat(update.filled()).isNull();
        assertThat(update.feeCost()).isNull();
        assertThat(update.timestamp()).isNull();
        assertThatThrownBy(() -> ExchangeOrderUpdate.fromPayload(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void statusSpellings() {
        assertThat(ExchangeOrderStatus.normalize("CANCELLED")).isEqualTo(ExchangeOrderStatus.CANCELED);
        assertThat(ExchangeOrderStatus.normalize("new")).isEqualTo(ExchangeOrderStatus.OPEN);
        assertThat(ExchangeOrderStatus.normalize("FILLED")).isEqualTo(ExchangeOrderStatus.CLOSED);
        assertThat(ExchangeOrderStatus.normalize("expired")).isEqualTo(ExchangeOrderStatus.EXPIRED);
        assertThat(ExchangeOrderStatus.normalize("??")).isEqualTo(ExchangeOrderStatus.UNKNOWN);
    }
}
