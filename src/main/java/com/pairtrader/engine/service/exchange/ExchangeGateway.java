package com.pairtrader.engine.service.exchange;

import com.pairtrader.engine.model.CurrencyPair;
import com.pairtrader.engine.model.OrderSide;
import com.pairtrader.engine.model.OrderType;

import java.math.BigDecimal;

/**
 * Exchange boundary. Implementations normalize every response into
 * {@link ExchangeOrderUpdate} and report failures as
 * {@link com.pairtrader.engine.exception.ExchangeException}.
 */
public interface ExchangeGateway {

    ExchangeOrderUpdate createOrder(String symbol, OrderSide side, OrderType type,
                                    BigDecimal amount, BigDecimal price, String clientOrderId);

    /**
     * Cancels an order. An order that already reached a terminal state is returned as is.
     *
     * @throws com.pairtrader.engine.exception.OrderNotFoundException when the exchange does not know the id
     */
    ExchangeOrderUpdate cancelOrder(String exchangeId, String symbol);

    ExchangeOrderUpdate fetchOrder(String exchangeId, String symbol);

    /** Last traded price. */
    BigDecimal fetchTicker(String symbol);

    BalanceCheck checkSufficientBalance(String symbol, OrderSide side, BigDecimal amount, BigDecimal price);

    CurrencyPair fetchCurrencyPair(String symbol);
}
