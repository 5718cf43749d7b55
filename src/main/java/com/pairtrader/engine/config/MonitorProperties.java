package com.pairtrader.engine.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "monitor")
@Data
@Validated
public class MonitorProperties {

    @Valid
    private BuyOrder buyOrder = new BuyOrder();

    @Valid
    private Sync sync = new Sync();

    @Valid
    private DealCompletion dealCompletion = new DealCompletion();

    @Valid
    private Timeout timeout = new Timeout();

    @Data
    public static class BuyOrder {
        private boolean enabled = true;

        @Positive
        private long checkIntervalSeconds = 60;

        @Min(0)
        private long gracePeriodSeconds = 60;

        @Positive
        private long maxAgeMinutes = 15;

        @Positive
        private double maxPriceDeviationPct = 2.0;

        @Positive
        private long summaryIntervalSeconds = 300;

        /** Pause after a failed iteration, on top of the regular interval. */
        @Min(0)
        private long errorPauseSeconds = 30;
    }

    @Data
    public static class Sync {
        private boolean enabled = true;

        @Positive
        private long checkIntervalSeconds = 30;
    }

    @Data
    public static class DealCompletion {
        private boolean enabled = true;

        @Positive
        private long checkIntervalSeconds = 30;
    }

    @Data
    public static class Timeout {
        @Min(0)
        private int maxRecreationsPerDeal = 3;

        @Min(0)
        private long minMinutesBetweenRecreations = 2;
    }
}
