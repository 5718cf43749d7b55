package com.pairtrader.engine.repository;

import com.pairtrader.engine.model.Order;
import com.pairtrader.engine.model.OrderSide;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;

/**
 * Process-local order store keyed by id. A save replaces the whole row (last write wins).
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final Map<Long, Order> orders = new ConcurrentHashMap<>();

    @Override
    public Order save(Order order) {
        if (order.getId() == null) {
            throw new IllegalArgumentException("Order id must be assigned before save");
        }
        orders.put(order.getId(), order);
        return order;
    }

    @Override
    public Optional<Order> findById(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(orders.get(id));
    }

    @Override
    public List<Order> findAll() {
        return select(order -> true);
    }

    @Override
    public List<Order> findOpenOrders() {
        return select(Order::isOpen);
    }

    @Override
    public List<Order> findOpenOrdersBySide(OrderSide side) {
        return select(order -> order.isOpen() && order.getSide() == side);
    }

    @Override
    public List<Order> findByDealId(Long dealId) {
        return select(order -> Objects.equals(order.getDealId(), dealId));
    }

    private List<Order> select(Predicate<Order> filter) {
        return orders.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(Order::getId))
                .toList();
    }
}
