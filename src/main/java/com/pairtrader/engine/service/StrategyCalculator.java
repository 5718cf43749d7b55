package com.pairtrader.engine.service;

import com.pairtrader.engine.config.ExecutionProperties;
import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.StrategyCalculation;
import com.pairtrader.engine.model.StrategyResult;
import com.pairtrader.engine.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Sizes one BUY/SELL pair for a budget. Every quantity is snapped to the lot size and every
 * price to the tick size, always in the direction that keeps the spend within budget.
 * Fee and profit inputs are percents: 0.1 means 0.1%.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ExecutionProperties executionProperties;

    /**
     * Sizes a trade from the pair's own parameters: its deal quota is the budget and its
     * profit markup the desired profit.
     */
    public StrategyCalculation calculate(CurrencyPair pair, BigDecimal buyPrice) {
        if (pair == null) {
            return StrategyCalculation.failure("Invalid input: currency pair is required");
        }
        return calculate(buyPrice, pair.getDealQuota(), pair.getAmountStep(), pair.getPriceStep(),
                pair.takerFeePercent(), pair.takerFeePercent(), pair.getProfitMarkup().multiply(HUNDRED),
                pair.getMinNotional());
    }

    public StrategyCalculation calculate(BigDecimal buyPrice, BigDecimal budget, BigDecimal minStep,
                                         BigDecimal priceStep, BigDecimal buyFeePercent, BigDecimal sellFeePercent,
                                         BigDecimal profitPercent, BigDecimal minNotional) {
        String invalid = validateInputs(buyPrice, budget, minStep, priceStep, buyFeePercent, sellFeePercent, profitPercent);
        if (invalid != null) {
            return reject(invalid);
        }
        if (minNotional != null && budget.compareTo(minNotional) < 0) {
            return reject(String.format("Insufficient budget: %s is below the minimum notional %s",
                    budget.toPlainString(), minNotional.toPlainString()));
        }

        BigDecimal buyFee = MoneyUtils.percentToFraction(buyFeePercent);
        BigDecimal sellFee = MoneyUtils.percentToFraction(sellFeePercent);
        BigDecimal profit = MoneyUtils.percentToFraction(profitPercent);
        BigDecimal keptAfterSellFee = BigDecimal.ONE.subtract(sellFee);
        BigDecimal entryPrice = MoneyUtils.floorToStep(buyPrice, priceStep);
        if (entryPrice.signum() <= 0) {
            return reject("Buy price " + buyPrice.toPlainString() + " is below one price step");
        }

        BigDecimal buyPriceWithFee = MoneyUtils.floorToStep(buyPrice.multiply(BigDecimal.ONE.add(buyFee)), priceStep);
        BigDecimal sellPrice = MoneyUtils.roundToStep(buyPrice.multiply(BigDecimal.ONE.add(profit)), priceStep);
        if (sellPrice.subtract(entryPrice).compareTo(priceStep) < 0) {
            return reject("Profit is below one price step");
        }

        BigDecimal rawMaxX = MoneyUtils.divide(budget, buyPriceWithFee).multiply(keptAfterSellFee);
        BigDecimal coinsToSell = MoneyUtils.floorToStep(rawMaxX, minStep);
        if (coinsToSell.signum() <= 0) {
            return reject("Budget " + budget.toPlainString() + " does not cover one lot of " + minStep.toPlainString());
        }
        BigDecimal coinsToBuy = MoneyUtils.floorToStep(MoneyUtils.divide(coinsToSell, keptAfterSellFee), minStep);
        if (coinsToBuy.signum() <= 0) {
            return reject("Buy quantity rounds down to zero");
        }

        BigDecimal totalCost = MoneyUtils.ceilToStep(coinsToBuy.multiply(buyPriceWithFee), priceStep);
        if (totalCost.compareTo(budget) > 0) {
            return reject(String.format("Total cost %s exceeds budget %s",
                    totalCost.toPlainString(), budget.toPlainString()));
        }
        if (minNotional != null && coinsToBuy.multiply(entryPrice).compareTo(minNotional) < 0) {
            return reject(String.format("Order notional %s is below the minimum notional %s",
                    coinsToBuy.multiply(entryPrice).toPlainString(), minNotional.toPlainString()));
        }

        BigDecimal finalRevenue = MoneyUtils.floorToStep(coinsToSell.multiply(sellPrice), priceStep);
        BigDecimal netProfit = finalRevenue.subtract(totalCost);
        BigDecimal minimumProfit = budget.multiply(executionProperties.getMinProfitShare());
        if (netProfit.compareTo(minimumProfit) < 0) {
            return reject(String.format("Net profit %s is below the required %s",
                    netProfit.toPlainString(), minimumProfit.stripTrailingZeros().toPlainString()));
        }

        StrategyResult.Info info = StrategyResult.Info.builder()
                .buyPriceWithFee(buyPriceWithFee)
                .totalCost(totalCost)
                .finalRevenue(finalRevenue)
                .netProfit(netProfit)
                .comment("Trade is viable")
                .build();
        log.debug("Strategy sized buyPrice={} coinsToBuy={} sellPrice={} coinsToSell={} totalCost={} netProfit={}",
                entryPrice, coinsToBuy, sellPrice, coinsToSell, totalCost, netProfit);
        return StrategyCalculation.success(new StrategyResult(entryPrice, coinsToBuy, sellPrice, coinsToSell, info));
    }

    private String validateInputs(BigDecimal buyPrice, BigDecimal budget, BigDecimal minStep, BigDecimal priceStep,
                                  BigDecimal buyFeePercent, BigDecimal sellFeePercent, BigDecimal profitPercent) {
        if (!positive(buyPrice) || !positive(budget) || !positive(minStep) || !positive(priceStep)) {
            return "Invalid input: price, budget and steps must be positive";
        }
        if (!validPercent(buyFeePercent) || !validPercent(sellFeePercent)) {
            return "Invalid input: fees must be within [0, 100)";
        }
        if (!positive(profitPercent)) {
            return "Invalid input: profit percent must be positive";
        }
        return null;
    }

    private static boolean positive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    private static boolean validPercent(BigDecimal value) {
        return value != null && value.signum() >= 0 && value.compareTo(HUNDRED) < 0;
    }

    private static StrategyCalculation reject(String reason) {
        log.info("Strategy rejected: {}", reason);
        return StrategyCalculation.failure(reason);
    }
}
