package com.folio.backend.repository;

import com.folio.backend.model.Portfolio;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PortfolioRepository extends JpaRepository<Portfolio, Long> {
    boolean existsByName(String name);
    List<Portfolio> findAllByOrderByNameAsc();
}
