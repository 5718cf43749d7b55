package com.pairtrader.engine.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "exchange")
@Data
@Validated
public class ExchangeProperties {

    private Resilience resilience = new Resilience();

    private Paper paper = new Paper();

    @Data
    public static class Resilience {
        @Positive
        private int limitPerSecond = 8;

        @Min(0)
        private long timeoutMs = 500;
    }

    /** Seed data for the in-memory exchange. */
    @Data
    public static class Paper {
        private Map<String, BigDecimal> balances = new HashMap<>();

        private Map<String, BigDecimal> prices = new HashMap<>();

        private List<Market> markets = new ArrayList<>();
    }

    @Data
    public static class Market {
        private String base;
        private String quote;
        private BigDecimal amountStep = new BigDecimal("0.0001");
        private BigDecimal priceStep = new BigDecimal("0.01");
        private BigDecimal minAmount;
        private BigDecimal maxAmount;
        private BigDecimal minPrice;
        private BigDecimal maxPrice;
        private BigDecimal minNotional = BigDecimal.TEN;
        private BigDecimal makerFee = new BigDecimal("0.001");
        private BigDecimal takerFee = new BigDecimal("0.001");
        private BigDecimal dealQuota = new BigDecimal("100");
        private BigDecimal profitMarkup = new BigDecimal("0.01");
        private int orderLifeTimeMinutes = 15;
        private int maxOpenDeals = 1;
    }
}
