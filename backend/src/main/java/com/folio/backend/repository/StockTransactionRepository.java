package com.folio.backend.repository;

import com.folio.backend.model.StockTransaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface StockTransactionRepository extends JpaRepository<StockTransaction, Long> {

    /**
     * Full log in replay order; equal timestamps fall back to insertion order.
     */
    @Query("select t from StockTransaction t join fetch t.stock order by t.timestamp asc, t.id asc")
    List<StockTransaction> findAllInReplayOrder();

    @Query("select t from StockTransaction t join fetch t.stock where t.portfolioId = :portfolioId "
            + "order by t.timestamp asc, t.id asc")
    List<StockTransaction> findByPortfolioInReplayOrder(@Param("portfolioId") Long portfolioId);

    List<StockTransaction> findAllByOrderByTimestampDescIdDesc(Pageable pageable);

    List<StockTransaction> findByPortfolioIdOrderByTimestampDescIdDesc(Long portfolioId, Pageable pageable);

    List<StockTransaction> findByStockIdOrderByTimestampDescIdDesc(Long stockId, Pageable pageable);
}
