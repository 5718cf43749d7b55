package com.pairtrader.engine.repository;

import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;

import java.util.List;
import java.util.Optional;

public interface OrderRepository {

    Order save(Order order);

    Optional<Order> findById(Long id);

    List<Order> findAll();

    /** Orders in OPEN or PARTIALLY_FILLED state. */
    List<Order> findOpenOrders();

    List<Order> findOpenOrdersBySide(OrderSide side);

    List<Order> findByDealId(Long dealId);
}
