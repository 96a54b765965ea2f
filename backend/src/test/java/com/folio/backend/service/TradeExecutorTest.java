package com.folio.backend.service;

import com.folio.backend.dto.TradeResult;
import com.folio.backend.exception.InsufficientBalanceException;
import com.folio.backend.exception.InsufficientSharesException;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.exception.PortfolioNotFoundException;
import com.folio.backend.exception.StockNotFoundException;
import com.folio.backend.model.Holding;
import com.folio.backend.model.NetWorthSnapshot;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.model.TradeState;
import com.folio.backend.model.TransactionType;
import com.folio.backend.support.LedgerIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.data.domain.PageRequest;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TradeExecutorTest extends LedgerIntegrationTest {

    @Autowired
    private TradeExecutor tradeExecutor;

    @Autowired
    private AccountBalanceService accountBalanceService;

    @Autowired
    private TradeMetrics tradeMetrics;

    private Portfolio growth;
    private Stock aapl;

    @BeforeEach
    void setUp() {
        growth = portfolio("Tech Growth Portfolio");
        aapl = stock("AAPL", "175.43");
    }

    @Test
    void buyThenPartialSellMovesCashAndKeepsAveragePrice() {
        TradeResult buy = tradeExecutor.buy(growth.getId(), "AAPL", 10, new BigDecimal("175.43"));

        assertThat(buy.getState()).isEqualTo(TradeState.DONE);
        assertThat(buy.getType()).isEqualTo(TransactionType.BUY);
        assertThat(buy.getNewBalance()).isEqualByComparingTo("98245.70");
        assertThat(buy.getTotalAmount()).isEqualByComparingTo("1754.30");
        assertThat(buy.getHolding().getQuantity()).isEqualTo(10);
        assertThat(buy.getHolding().getAvgBuyPrice()).isEqualByComparingTo("175.43");
        assertThat(buy.getMessage()).isEqualTo("Successfully bought 10 shares of AAPL at $175.43 for $1754.30");

        TradeResult sell = tradeExecutor.sell(growth.getId(), "aapl", 5, new BigDecimal("180"));

        assertThat(sell.getNewBalance()).isEqualByComparingTo("99145.70");
        assertThat(sell.isHoldingRemoved()).isFalse();
        Holding holding = holdingRepository.findByPortfolioIdAndStockId(growth.getId(), aapl.getId()).orElseThrow();
        assertThat(holding.getQuantity()).isEqualTo(5);
        assertThat(holding.getAvgBuyPrice()).isEqualByComparingTo("175.43");
        assertThat(accountBalanceService.currentBalance()).isEqualByComparingTo("99145.70");
        assertThat(stockTransactionRepository.count()).isEqualTo(2);
    }

    @Test
    void sellingWholePositionRemovesHolding() {
        tradeExecutor.buy(growth.getId(), "AAPL", 3, new BigDecimal("100"));

        TradeResult sell = tradeExecutor.sell(growth.getId(), "AAPL", 3, new BigDecimal("110"));

        assertThat(sell.isHoldingRemoved()).isTrue();
        assertThat(sell.getHolding()).isNull();
        assertThat(holdingRepository.findByPortfolioIdAndStockId(growth.getId(), aapl.getId())).isEmpty();
        assertThat(sell.getNewBalance()).isEqualByComparingTo("100030");
    }

    @Test
    void everyTradeAppendsExactlyOneConsistentSnapshot() {
        tradeExecutor.buy(growth.getId(), "AAPL", 10, new BigDecimal("175.43"));
        assertThat(netWorthSnapshotRepository.count()).isEqualTo(1);

        TradeResult sell = tradeExecutor.sell(growth.getId(), "AAPL", 5, new BigDecimal("180"));
        assertThat(netWorthSnapshotRepository.count()).isEqualTo(2);

        List<NetWorthSnapshot> latest = netWorthSnapshotRepository
                .findByAccountIdOrderByTimestampDescIdDesc(1L, PageRequest.of(0, 1));
        NetWorthSnapshot snapshot = latest.get(0);
        assertThat(snapshot.getAccountBalance()).isEqualByComparingTo("99145.70");
        // 5 shares left at the catalog price of 175.43
        assertThat(snapshot.getPortfolioValue()).isEqualByComparingTo("877.15");
        assertThat(snapshot.getTotalNetWorth())
                .isEqualByComparingTo(snapshot.getAccountBalance().add(snapshot.getPortfolioValue()));
        assertThat(sell.getNetWorth().getTotalNetWorth()).isEqualByComparingTo(snapshot.getTotalNetWorth());
    }

    @Test
    void buyBeyondCashIsRejectedWithoutSideEffects() {
        long rejectedBefore = rejectedCount("InsufficientBalanceException");

        assertThatThrownBy(() -> tradeExecutor.buy(growth.getId(), "AAPL", 1000, new BigDecimal("175.43")))
                .isInstanceOfSatisfying(InsufficientBalanceException.class, ex -> {
                    assertThat(ex.getRequired()).isEqualByComparingTo("175430");
                    assertThat(ex.getAvailable()).isEqualByComparingTo("100000");
                });

        assertNothingChanged();
        assertThat(rejectedCount("InsufficientBalanceException")).isEqualTo(rejectedBefore + 1);
    }

    @Test
    void sellBeyondHoldingIsRejectedWithoutSideEffects() {
        tradeExecutor.buy(growth.getId(), "AAPL", 2, new BigDecimal("100"));

        assertThatThrownBy(() -> tradeExecutor.sell(growth.getId(), "AAPL", 3, new BigDecimal("100")))
                .isInstanceOfSatisfying(InsufficientSharesException.class, ex -> {
                    assertThat(ex.getAvailable()).isEqualTo(2);
                    assertThat(ex.getRequested()).isEqualTo(3);
                });

        assertThat(stockTransactionRepository.count()).isEqualTo(1);
        assertThat(netWorthSnapshotRepository.count()).isEqualTo(1);
        assertThat(accountBalanceService.currentBalance()).isEqualByComparingTo("99800");
        assertThat(holdingRepository.findByPortfolioIdAndStockId(growth.getId(), aapl.getId()))
                .get().extracting(Holding::getQuantity).isEqualTo(2);
    }

    @Test
    void sellWithoutAnyHoldingIsRejected() {
        assertThatThrownBy(() -> tradeExecutor.sell(growth.getId(), "AAPL", 1, new BigDecimal("100")))
                .isInstanceOf(InsufficientSharesException.class);
        assertNothingChanged();
    }

    @Test
    void unknownStockOrPortfolioIsRejected() {
        assertThatThrownBy(() -> tradeExecutor.buy(growth.getId(), "ZZZZ", 1, new BigDecimal("1")))
                .isInstanceOf(StockNotFoundException.class)
                .hasMessage("Stock not found: ZZZZ");
        assertThatThrownBy(() -> tradeExecutor.buy(growth.getId() + 1000, "AAPL", 1, new BigDecimal("1")))
                .isInstanceOf(PortfolioNotFoundException.class);
        assertNothingChanged();
    }

    @Test
    void nonPositiveQuantityOrPriceIsRejected() {
        assertThatThrownBy(() -> tradeExecutor.buy(growth.getId(), "AAPL", 0, new BigDecimal("1")))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> tradeExecutor.sell(growth.getId(), "AAPL", 1, BigDecimal.ZERO))
                .isInstanceOf(InvalidInputException.class);
        assertNothingChanged();
    }

    @Test
    void priceThatRoundsToZeroIsRejectedBeforeRecording() {
        long rejectedBefore = rejectedCount("InvalidInputException");

        assertThatThrownBy(() -> tradeExecutor.buy(growth.getId(), "AAPL", 1, new BigDecimal("0.00001")))
                .isInstanceOfSatisfying(InvalidInputException.class,
                        ex -> assertThat(ex.getMessage()).contains("Price"));
        assertThatThrownBy(() -> tradeExecutor.sell(growth.getId(), "AAPL", 1, new BigDecimal("0.00004")))
                .isInstanceOf(InvalidInputException.class);

        assertNothingChanged();
        assertThat(rejectedCount("InvalidInputException")).isEqualTo(rejectedBefore + 1);
    }

    @Test
    void executedTradesAreCounted() {
        double before = tradeMetrics.executedCount(TransactionType.BUY);

        tradeExecutor.buy(growth.getId(), "AAPL", 1, new BigDecimal("10"));

        assertThat(tradeMetrics.executedCount(TransactionType.BUY)).isEqualTo(before + 1);
    }

    private void assertNothingChanged() {
        assertThat(stockTransactionRepository.count()).isZero();
        assertThat(holdingRepository.count()).isZero();
        assertThat(netWorthSnapshotRepository.count()).isZero();
        assertThat(accountBalanceService.currentBalance()).isEqualByComparingTo("100000");
    }

    private long rejectedCount(String reason) {
        return Math.round(tradeMetrics.rejectedCount(TransactionType.BUY, reason));
    }
}
