package com.pairtrader.engine.repository;

import com.pairtrader.engine.model.Deal;

import java.util.List;
import java.util.Optional;

public interface DealRepository {

    Deal save(Deal deal);

    Optional<Deal> findById(Long id);

    List<Deal> findAll();

    List<Deal> findOpenDeals();

    long countOpenDealsBySymbol(String symbol);
}
