package com.folio.backend.repository;

import com.folio.backend.model.Holding;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.dao.DataIntegrityViolationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
class HoldingRepositoryTest {

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private HoldingRepository holdingRepository;

    private Portfolio income;
    private Portfolio growth;
    private Stock intc;

    @BeforeEach
    void setUp() {
        income = entityManager.persist(Portfolio.builder().name("Repo Income").build());
        growth = entityManager.persist(Portfolio.builder().name("Repo Growth").build());
        intc = entityManager.persist(Stock.builder()
                .symbol("RINTC")
                .name("Intel Corporation")
                .currentPrice(MoneyUtils.bd("55.78"))
                .build());
    }

    @Test
    void lookupIsScopedToPortfolioAndStock() {
        Holding incomeHolding = entityManager.persist(holding(income, 10));
        entityManager.persist(holding(growth, 3));
        entityManager.flush();

        assertThat(holdingRepository.findByPortfolioIdAndStockId(income.getId(), intc.getId()))
                .contains(incomeHolding);
        assertThat(holdingRepository.findByStockId(intc.getId())).hasSize(2);
        assertThat(holdingRepository.findByPortfolioId(growth.getId())).hasSize(1);
    }

    @Test
    void onePositionPerPortfolioAndStock() {
        entityManager.persist(holding(income, 10));
        entityManager.flush();

        assertThatThrownBy(() -> holdingRepository.saveAndFlush(holding(income, 1)))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void deleteByPortfolioLeavesOtherPortfolios() {
        entityManager.persist(holding(income, 10));
        entityManager.persist(holding(growth, 3));
        entityManager.flush();

        holdingRepository.deleteByPortfolioId(income.getId());
        entityManager.flush();

        assertThat(holdingRepository.findByPortfolioId(income.getId())).isEmpty();
        assertThat(holdingRepository.findByPortfolioId(growth.getId())).hasSize(1);
    }

    private Holding holding(Portfolio portfolio, int quantity) {
        return Holding.builder()
                .portfolio(portfolio)
                .stock(intc)
                .quantity(quantity)
                .avgBuyPrice(MoneyUtils.bd("50"))
                .build();
    }
}
