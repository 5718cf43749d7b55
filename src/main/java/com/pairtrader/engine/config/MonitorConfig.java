package com.pairtrader.engine.config;

import com.pairtrader.engine.service.CurrencyPairRegistry;
import com.pairtrader.engine.service.monitor.AgeStalenessPredicate;
import com.pairtrader.engine.service.monitor.PriceDeviationStalenessPredicate;
import com.pairtrader.engine.service.monitor.StaleOrderPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

@Configuration
public class MonitorConfig {

    @Bean
    public StaleOrderPolicy buyOrderStalePolicy(MonitorProperties monitorProperties,
                                                CurrencyPairRegistry currencyPairRegistry) {
        MonitorProperties.BuyOrder buyOrder = monitorProperties.getBuyOrder();
        return new StaleOrderPolicy(List.of(
                new AgeStalenessPredicate(Duration.ofMinutes(buyOrder.getMaxAgeMinutes()),
                        symbol -> currencyPairRegistry.find(symbol)
                                .filter(pair -> pair.getOrderLifeTimeMinutes() > 0)
                                .map(pair -> Duration.ofMinutes(pair.getOrderLifeTimeMinutes()))),
                new PriceDeviationStalenessPredicate(BigDecimal.valueOf(buyOrder.getMaxPriceDeviationPct()))
        ));
    }
}
