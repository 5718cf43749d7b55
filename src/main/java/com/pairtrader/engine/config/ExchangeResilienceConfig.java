package com.pairtrader.engine.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class ExchangeResilienceConfig {

    @Bean
    public RateLimiter exchangeRateLimiter(ExchangeProperties exchangeProperties) {
        ExchangeProperties.Resilience resilience = exchangeProperties.getResilience();
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(resilience.getLimitPerSecond())
                .timeoutDuration(Duration.ofMillis(resilience.getTimeoutMs()))
                .build();
        return RateLimiter.of("exchange", config);
    }
}
