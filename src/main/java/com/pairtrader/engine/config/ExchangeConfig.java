package com.pairtrader.engine.config;

import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.service.exchange.ExchangeGateway;
import com.pairtrader.engine.service.exchange.PaperExchangeGateway;
import com.pairtrader.engine.service.exchange.RateLimitedExchangeGateway;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.util.List;

@Slf4j
@Configuration
public class ExchangeConfig {

    @Bean
    public PaperExchangeGateway paperExchangeGateway(ExchangeProperties exchangeProperties) {
        ExchangeProperties.Paper paper = exchangeProperties.getPaper();
        List<CurrencyPair> pairs = paper.getMarkets().stream()
                .map(ExchangeConfig::toCurrencyPair)
                .toList();
        log.info("Paper exchange configured markets={} balances={}", pairs.size(), paper.getBalances().keySet());
        return new PaperExchangeGateway(paper.getBalances(), paper.getPrices(), pairs);
    }

    @Bean
    @Primary
    public ExchangeGateway exchangeGateway(PaperExchangeGateway paperExchangeGateway,
                                           RateLimiter exchangeRateLimiter,
                                           MeterRegistry meterRegistry) {
        return new RateLimitedExchangeGateway(paperExchangeGateway, exchangeRateLimiter, meterRegistry);
    }

    private static CurrencyPair toCurrencyPair(ExchangeProperties.Market market) {
        return CurrencyPair.of(market.getBase(), market.getQuote()).toBuilder()
                .amountStep(market.getAmountStep())
                .priceStep(market.getPriceStep())
                .minAmount(market.getMinAmount())
                .maxAmount(market.getMaxAmount())
                .minPrice(market.getMinPrice())
                .maxPrice(market.getMaxPrice())
                .minNotional(market.getMinNotional())
                .makerFee(market.getMakerFee())
                .takerFee(market.getTakerFee())
                .dealQuota(market.getDealQuota())
                .profitMarkup(market.getProfitMarkup())
                .orderLifeTimeMinutes(market.getOrderLifeTimeMinutes())
                .maxOpenDeals(market.getMaxOpenDeals())
                .build();
    }
}
