package com.folio.backend.repository;

import com.folio.backend.model.Stock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface StockRepository extends JpaRepository<Stock, Long> {
    Optional<Stock> findBySymbol(String symbol);
    List<Stock> findAllByOrderBySymbolAsc();
    List<Stock> findByWatchlistTrueOrderBySymbolAsc();
}
