package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.model.AccountBalance;
import com.folio.backend.model.Holding;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.model.StockTransaction;
import com.folio.backend.model.TransactionType;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockRepository;
import com.folio.backend.repository.StockTransactionRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Rebuilds holdings and cash from the transaction log and compares them with
 * the stored cache. The log is ground truth: {@link #repair()} overwrites
 * holdings and balance with the replayed state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LedgerReconciliationService {

    private final StockTransactionRepository stockTransactionRepository;
    private final HoldingRepository holdingRepository;
    private final PortfolioRepository portfolioRepository;
    private final StockRepository stockRepository;
    private final AccountBalanceService accountBalanceService;
    private final NetWorthSnapshotter netWorthSnapshotter;
    private final LedgerProperties ledgerProperties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!ledgerProperties.getReconcile().isOnStartup()) {
            return;
        }
        log.info("Running ledger reconciliation on application ready");
        try {
            reconcile();
        } catch (RuntimeException e) {
            log.error("Ledger reconciliation failed on startup", e);
        }
    }

    @Transactional(readOnly = true)
    public ReconciliationReport reconcile() {
        ReconciliationReport report = compare(replay(), accountBalanceService.currentBalance());
        if (report.consistent()) {
            log.info("Ledger reconciliation: consistent ({} transactions replayed)", report.transactionsReplayed());
        } else {
            log.warn("Ledger reconciliation found {} holding mismatches, balance expected {} actual {}",
                    report.holdingMismatches().size(), report.balance().expected(), report.balance().actual());
        }
        return report;
    }

    /**
     * Rewrites holdings and balance to the replayed state under the balance lock and records a snapshot.
     */
    @Transactional
    public RepairResult repair() {
        AccountBalance account = accountBalanceService.lockForTrade();
        Replay replay = replay();
        ReconciliationReport before = compare(replay, MoneyUtils.scale(account.getBalance()));
        if (before.consistent()) {
            log.info("Ledger repair skipped: nothing to fix");
            return new RepairResult(before, 0, 0, false);
        }

        int written = 0;
        int deleted = 0;
        Map<PositionKey, Holding> stored = storedHoldings();
        for (Map.Entry<PositionKey, Holding> entry : stored.entrySet()) {
            if (!replay.positions().containsKey(entry.getKey())) {
                holdingRepository.delete(entry.getValue());
                deleted++;
            }
        }
        for (Map.Entry<PositionKey, ReplayedPosition> entry : replay.positions().entrySet()) {
            PositionKey key = entry.getKey();
            ReplayedPosition expected = entry.getValue();
            Holding holding = stored.get(key);
            if (holding == null) {
                holding = Holding.builder()
                        .portfolio(portfolioRepository.getReferenceById(key.portfolioId()))
                        .stock(stockRepository.getReferenceById(key.stockId()))
                        .build();
            } else if (holding.getQuantity() == expected.quantity
                    && holding.getAvgBuyPrice().compareTo(expected.averagePrice) == 0) {
                continue;
            }
            holding.setQuantity(expected.quantity);
            holding.setAvgBuyPrice(expected.averagePrice);
            holding.setCostBasis(expected.cost);
            holdingRepository.save(holding);
            written++;
        }

        boolean balanceRewritten = !before.balance().matches();
        if (balanceRewritten) {
            accountBalanceService.overwrite(account, before.balance().expected());
        }
        holdingRepository.flush();
        netWorthSnapshotter.snapshot();
        log.warn("Ledger repaired: {} holdings written, {} deleted, balance rewritten={}",
                written, deleted, balanceRewritten);
        return new RepairResult(before, written, deleted, balanceRewritten);
    }

    private Replay replay() {
        Set<Long> livePortfolios = portfolioRepository.findAll().stream()
                .map(Portfolio::getId)
                .collect(Collectors.toSet());
        Map<PositionKey, ReplayedPosition> positions = new LinkedHashMap<>();
        BigDecimal balance = MoneyUtils.scale(ledgerProperties.getStartingBalance());
        List<StockTransaction> transactions = stockTransactionRepository.findAllInReplayOrder();
        int skipped = 0;

        for (StockTransaction transaction : transactions) {
            BigDecimal amount = MoneyUtils.multiply(transaction.getPrice(), transaction.getQuantity());
            balance = transaction.getType() == TransactionType.BUY
                    ? MoneyUtils.subtract(balance, amount)
                    : MoneyUtils.add(balance, amount);
            if (!livePortfolios.contains(transaction.getPortfolioId())) {
                skipped++;
                continue;
            }
            PositionKey key = new PositionKey(transaction.getPortfolioId(), transaction.getStock().getId());
            if (transaction.getType() == TransactionType.BUY) {
                ReplayedPosition position = positions.computeIfAbsent(key,
                        k -> new ReplayedPosition(transaction.getStock()));
                position.cost = HoldingsAccumulator.addCost(position.cost, transaction.getQuantity(), transaction.getPrice());
                position.quantity += transaction.getQuantity();
                position.averagePrice = HoldingsAccumulator.averageCost(position.cost, position.quantity);
                continue;
            }
            ReplayedPosition position = positions.get(key);
            int held = position == null ? 0 : position.quantity;
            if (held < transaction.getQuantity()) {
                log.warn("Transaction {} sells {} {} but the replay only holds {}",
                        transaction.getId(), transaction.getQuantity(), transaction.getSymbol(), held);
            }
            if (position != null) {
                int remaining = position.quantity - transaction.getQuantity();
                if (remaining <= 0) {
                    positions.remove(key);
                } else {
                    position.cost = HoldingsAccumulator.reduceCost(position.cost, position.quantity, remaining);
                    position.quantity = remaining;
                }
            }
        }
        return new Replay(positions, balance, transactions.size(), skipped);
    }

    private ReconciliationReport compare(Replay replay, BigDecimal actualBalance) {
        List<HoldingMismatch> mismatches = new ArrayList<>();
        Map<PositionKey, Holding> stored = storedHoldings();

        replay.positions().forEach((key, expected) -> {
            Holding actual = stored.get(key);
            if (actual == null) {
                mismatches.add(new HoldingMismatch(key.portfolioId(), expected.stock.getSymbol(), MismatchType.MISSING,
                        expected.quantity, null, expected.averagePrice, null));
            } else if (actual.getQuantity() != expected.quantity) {
                mismatches.add(new HoldingMismatch(key.portfolioId(), expected.stock.getSymbol(), MismatchType.QUANTITY,
                        expected.quantity, actual.getQuantity(), expected.averagePrice, actual.getAvgBuyPrice()));
            } else if (actual.getAvgBuyPrice().compareTo(expected.averagePrice) != 0) {
                mismatches.add(new HoldingMismatch(key.portfolioId(), expected.stock.getSymbol(), MismatchType.AVERAGE_PRICE,
                        expected.quantity, actual.getQuantity(), expected.averagePrice, actual.getAvgBuyPrice()));
            }
        });
        stored.forEach((key, actual) -> {
            if (!replay.positions().containsKey(key)) {
                mismatches.add(new HoldingMismatch(key.portfolioId(), actual.getStock().getSymbol(), MismatchType.UNEXPECTED,
                        null, actual.getQuantity(), null, actual.getAvgBuyPrice()));
            }
        });

        BigDecimal expectedBalance = replay.balance();
        BalanceCheck balance = new BalanceCheck(expectedBalance, actualBalance,
                expectedBalance.compareTo(actualBalance) == 0);
        return new ReconciliationReport(List.copyOf(mismatches), balance, replay.transactionCount(),
                replay.skippedTransactions(), LocalDateTime.now());
    }

    private Map<PositionKey, Holding> storedHoldings() {
        Map<PositionKey, Holding> stored = new HashMap<>();
        for (Holding holding : holdingRepository.findAll()) {
            stored.put(new PositionKey(holding.getPortfolio().getId(), holding.getStock().getId()), holding);
        }
        return stored;
    }

    private record PositionKey(Long portfolioId, Long stockId) {
    }

    private static final class ReplayedPosition {
        private final Stock stock;
        private int quantity;
        private BigDecimal averagePrice = MoneyUtils.ZERO;
        private BigDecimal cost = BigDecimal.ZERO;

        private ReplayedPosition(Stock stock) {
            this.stock = stock;
        }
    }

    private record Replay(Map<PositionKey, ReplayedPosition> positions, BigDecimal balance,
                          int transactionCount, int skippedTransactions) {
    }

    public enum MismatchType {
        MISSING,
        UNEXPECTED,
        QUANTITY,
        AVERAGE_PRICE
    }

    public record HoldingMismatch(
            Long portfolioId,
            String symbol,
            MismatchType type,
            Integer expectedQuantity,
            Integer actualQuantity,
            BigDecimal expectedAvgPrice,
            BigDecimal actualAvgPrice
    ) {
    }

    public record BalanceCheck(BigDecimal expected, BigDecimal actual, boolean matches) {
    }

    /**
     * @param skippedTransactions transactions of deleted portfolios; they still move the expected balance
     */
    public record ReconciliationReport(
            List<HoldingMismatch> holdingMismatches,
            BalanceCheck balance,
            int transactionsReplayed,
            int skippedTransactions,
            LocalDateTime checkedAt
    ) {
        public boolean consistent() {
            return holdingMismatches.isEmpty() && balance.matches();
        }
    }

    public record RepairResult(ReconciliationReport before, int holdingsWritten, int holdingsDeleted,
                               boolean balanceRewritten) {
    }
}
