package com.folio.backend.support;

import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.repository.AccountBalanceRepository;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.NetWorthSnapshotRepository;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockRepository;
import com.folio.backend.repository.StockTransactionRepository;
import com.folio.backend.util.MoneyUtils;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Spring context on the H2 schema built by Flyway, wiped before every test.
 */
@SpringBootTest
public abstract class LedgerIntegrationTest {

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    @Autowired
    protected StockRepository stockRepository;

    @Autowired
    protected PortfolioRepository portfolioRepository;

    @Autowired
    protected HoldingRepository holdingRepository;

    @Autowired
    protected StockTransactionRepository stockTransactionRepository;

    @Autowired
    protected AccountBalanceRepository accountBalanceRepository;

    @Autowired
    protected NetWorthSnapshotRepository netWorthSnapshotRepository;

    @BeforeEach
    void resetLedger() {
        jdbcTemplate.execute("DELETE FROM net_worth_history");
        jdbcTemplate.execute("DELETE FROM stock_transactions");
        jdbcTemplate.execute("DELETE FROM holdings");
        jdbcTemplate.execute("DELETE FROM account_balance");
        jdbcTemplate.execute("DELETE FROM portfolios");
        jdbcTemplate.execute("DELETE FROM stocks");
    }

    protected Stock stock(String symbol, String price) {
        return stockRepository.save(Stock.builder()
                .symbol(symbol)
                .name(symbol + " Inc.")
                .currentPrice(MoneyUtils.bd(price))
                .build());
    }

    protected Portfolio portfolio(String name) {
        return portfolioRepository.save(Portfolio.builder()
                .name(name)
                .build());
    }
}
