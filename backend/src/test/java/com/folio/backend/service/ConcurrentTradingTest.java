package com.folio.backend.service;

import com.folio.backend.exception.InsufficientSharesException;
import com.folio.backend.exception.PortfolioNotFoundException;
import com.folio.backend.model.Holding;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.support.LedgerIntegrationTest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Trades submitted from several threads at once, against the shared H2 database.
 */
class ConcurrentTradingTest extends LedgerIntegrationTest {

    @Autowired
    private TradeExecutor tradeExecutor;

    @Autowired
    private PortfolioService portfolioService;

    @Autowired
    private AccountBalanceService accountBalanceService;

    private ExecutorService pool;
    private Portfolio growth;
    private Stock aapl;

    @BeforeEach
    void setUp() {
        pool = Executors.newFixedThreadPool(8);
        growth = portfolio("Tech Growth Portfolio");
        aapl = stock("AAPL", "100.00");
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    void concurrentBuysAndSellsLoseNoUpdates() throws Exception {
        // the cash row was wiped by the reset, so the first buys also race to open it
        List<Callable<?>> buys = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            BigDecimal price = BigDecimal.valueOf(100 + i % 3);
            buys.add(() -> tradeExecutor.buy(growth.getId(), "AAPL", 1, price));
        }

        assertThat(runTogether(buys)).isEmpty();

        Holding holding = holdingRepository.findByPortfolioIdAndStockId(growth.getId(), aapl.getId()).orElseThrow();
        assertThat(holding.getQuantity()).isEqualTo(30);
        assertThat(holding.getAvgBuyPrice()).isEqualByComparingTo("101.0000");
        assertThat(holding.getCostBasis()).isEqualByComparingTo("3030");
        assertThat(accountBalanceRepository.count()).isEqualTo(1);
        assertThat(accountBalanceService.currentBalance()).isEqualByComparingTo("96970");
        assertThat(stockTransactionRepository.count()).isEqualTo(30);
        assertThat(netWorthSnapshotRepository.count()).isEqualTo(30);

        List<Callable<?>> sells = new ArrayList<>();
        for (int i = 0; i < 32; i++) {
            sells.add(() -> tradeExecutor.sell(growth.getId(), "AAPL", 1, new BigDecimal("110")));
        }

        List<Throwable> failures = runTogether(sells);

        assertThat(failures).hasSize(2).allMatch(InsufficientSharesException.class::isInstance);
        assertThat(holdingRepository.findByPortfolioIdAndStockId(growth.getId(), aapl.getId())).isEmpty();
        assertThat(accountBalanceService.currentBalance()).isEqualByComparingTo("100270");
        assertThat(stockTransactionRepository.count()).isEqualTo(60);
        assertThat(netWorthSnapshotRepository.count()).isEqualTo(60);
    }

    @Test
    void deletingAPortfolioMidTradingLeavesNoHoldingBehind() throws Exception {
        tradeExecutor.buy(growth.getId(), "AAPL", 1, new BigDecimal("100"));
        List<Callable<?>> work = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            work.add(() -> tradeExecutor.buy(growth.getId(), "AAPL", 1, new BigDecimal("100")));
            if (i == 10) {
                work.add(() -> {
                    portfolioService.deletePortfolio(growth.getId());
                    return null;
                });
            }
        }

        List<Throwable> failures = runTogether(work);

        assertThat(failures).allMatch(PortfolioNotFoundException.class::isInstance);
        int executedBuys = 1 + 20 - failures.size();
        assertThat(portfolioRepository.existsById(growth.getId())).isFalse();
        assertThat(holdingRepository.findByPortfolioId(growth.getId())).isEmpty();
        assertThat(stockTransactionRepository.count()).isEqualTo(executedBuys);
        assertThat(accountBalanceService.currentBalance())
                .isEqualByComparingTo(BigDecimal.valueOf(100_000 - 100L * executedBuys));
    }

    private List<Throwable> runTogether(List<Callable<?>> tasks) throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        for (Callable<?> task : tasks) {
            futures.add(pool.submit(() -> {
                start.await();
                return task.call();
            }));
        }
        start.countDown();

        List<Throwable> failures = new ArrayList<>();
        for (Future<?> future : futures) {
            try {
                future.get(60, TimeUnit.SECONDS);
            } catch (ExecutionException ex) {
                failures.add(ex.getCause());
            }
        }
        return failures;
    }
}
