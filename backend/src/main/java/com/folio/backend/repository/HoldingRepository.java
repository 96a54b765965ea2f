package com.folio.backend.repository;

import com.folio.backend.model.Holding;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface HoldingRepository extends JpaRepository<Holding, Long> {
    Optional<Holding> findByPortfolioIdAndStockId(Long portfolioId, Long stockId);
    List<Holding> findByPortfolioId(Long portfolioId);
    List<Holding> findByStockId(Long stockId);
    void deleteByPortfolioId(Long portfolioId);
}
