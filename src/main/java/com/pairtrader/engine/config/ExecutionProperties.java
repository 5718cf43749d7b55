package com.pairtrader.engine.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Configuration
@ConfigurationProperties(prefix = "execution")
@Data
@Validated
public class ExecutionProperties {

    private Retry retry = new Retry();

    /** Minimum net profit of a sized trade as a fraction of its budget. */
    @DecimalMin("0.0")
    private BigDecimal minProfitShare = new BigDecimal("0.005");

    /** Replacement BUY price as a fraction of the last market price. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("1.0")
    private BigDecimal recreationPriceFactor = new BigDecimal("0.999");

    /** Times a failed SELL of one deal is queued again before it is left for an operator. */
    @Min(0)
    private int maxSellReplacements = 3;

    /** Pair metadata older than this is fetched again from the exchange. */
    @Min(1)
    private int pairCacheMinutes = 60;

    @Data
    public static class Retry {
        @Min(1)
        private int maxAttempts = 3;

        @Min(0)
        private long baseDelayMs = 1000;

        @Positive
        private double multiplier = 2.0;
    }
}
