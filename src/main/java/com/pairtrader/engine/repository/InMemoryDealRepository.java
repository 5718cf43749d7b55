package com.pairtrader.engine.repository;

import com.pairtrader.engine.model.Deal;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class InMemoryDealRepository implements DealRepository {

    private final Map<Long, Deal> deals = new ConcurrentHashMap<>();

    @Override
    public Deal save(Deal deal) {
        if (deal.getId() == null) {
            throw new IllegalArgumentException("Deal id must be assigned before save");
        }
        deals.put(deal.getId(), deal);
        return deal;
    }

    @Override
    public Optional<Deal> findById(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(deals.get(id));
    }

    @Override
    public List<Deal> findAll() {
        return deals.values().stream()
                .sorted(Comparator.comparing(Deal::getId))
                .toList();
    }

    @Override
    public List<Deal> findOpenDeals() {
        return deals.values().stream()
                .filter(Deal::isOpen)
                .sorted(Comparator.comparing(Deal::getId))
                .toList();
    }

    @Override
    public long countOpenDealsBySymbol(String symbol) {
        return deals.values().stream()
                .filter(Deal::isOpen)
                .filter(deal -> symbol != null && symbol.equals(deal.getSymbol()))
                .count();
    }
}
