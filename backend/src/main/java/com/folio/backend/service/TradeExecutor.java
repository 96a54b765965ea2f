package com.folio.backend.service;

import com.folio.backend.dto.HoldingDTO;
import com.folio.backend.dto.NetWorthPointDTO;
import com.folio.backend.dto.TradeResult;
import com.folio.backend.exception.BadRequestException;
import com.folio.backend.exception.InsufficientBalanceException;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.exception.NotFoundException;
import com.folio.backend.exception.PersistenceFailureException;
import com.folio.backend.exception.PortfolioNotFoundException;
import com.folio.backend.exception.TradingException;
import com.folio.backend.model.AccountBalance;
import com.folio.backend.model.Holding;
import com.folio.backend.model.NetWorthSnapshot;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.Stock;
import com.folio.backend.model.StockTransaction;
import com.folio.backend.model.TradeState;
import com.folio.backend.model.TransactionType;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockTransactionRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Runs a buy or sell through VALIDATING, RECORDING, UPDATING, SETTLING and DONE.
 *
 * <p>All checks happen in VALIDATING, before the first write, so a rejected
 * trade leaves the log, holdings and balance as they were. Writes go log first,
 * then holdings, then cash, then the net-worth snapshot. The whole sequence runs
 * in one transaction holding the cash-register row lock, which serializes trades.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeExecutor {

    private final AccountBalanceService accountBalanceService;
    private final PriceCatalog priceCatalog;
    private final PortfolioRepository portfolioRepository;
    private final StockTransactionRepository stockTransactionRepository;
    private final HoldingsAccumulator holdingsAccumulator;
    private final NetWorthSnapshotter netWorthSnapshotter;
    private final TradeMetrics tradeMetrics;

    @Transactional
    public TradeResult buy(Long portfolioId, String symbol, Integer quantity, BigDecimal price) {
        TradeRun run = new TradeRun(TransactionType.BUY, symbol);
        try {
            validateInputs(portfolioId, quantity, price);
            AccountBalance account = accountBalanceService.lockForTrade();
            Portfolio portfolio = requirePortfolio(portfolioId);
            Stock stock = priceCatalog.requireStock(symbol);
            BigDecimal totalCost = MoneyUtils.multiply(price, quantity);
            if (totalCost.compareTo(account.getBalance()) > 0) {
                throw new InsufficientBalanceException(totalCost, MoneyUtils.scale(account.getBalance()));
            }

            run.advance(TradeState.RECORDING);
            StockTransaction transaction = record(stock, portfolio, TransactionType.BUY, quantity, price);

            run.advance(TradeState.UPDATING);
            Holding holding = holdingsAccumulator.applyBuy(portfolio.getId(), stock.getId(), quantity, price);

            run.advance(TradeState.SETTLING);
            BigDecimal newBalance = accountBalanceService.debit(account, totalCost);
            NetWorthSnapshot snapshot = netWorthSnapshotter.snapshot();

            run.advance(TradeState.DONE);
            tradeMetrics.recordExecuted(TransactionType.BUY);
            log.info("BUY {} x {} @ {} in portfolio {} (cost {}, balance {})",
                    quantity, stock.getSymbol(), price, portfolio.getId(), totalCost, newBalance);
            return result(run, transaction, totalCost, newBalance, Optional.of(holding), snapshot,
                    String.format("Successfully bought %d shares of %s at $%s for $%s",
                            quantity, stock.getSymbol(), display(price), display(totalCost)));
        } catch (TradingException | NotFoundException | BadRequestException ex) {
            throw run.reject(ex);
        } catch (DataAccessException ex) {
            throw run.fail(ex);
        }
    }

    @Transactional
    public TradeResult sell(Long portfolioId, String symbol, Integer quantity, BigDecimal price) {
        TradeRun run = new TradeRun(TransactionType.SELL, symbol);
        try {
            validateInputs(portfolioId, quantity, price);
            AccountBalance account = accountBalanceService.lockForTrade();
            Portfolio portfolio = requirePortfolio(portfolioId);
            Stock stock = priceCatalog.requireStock(symbol);
            holdingsAccumulator.checkSell(portfolio.getId(), stock.getId(), quantity);
            BigDecimal proceeds = MoneyUtils.multiply(price, quantity);

            run.advance(TradeState.RECORDING);
            StockTransaction transaction = record(stock, portfolio, TransactionType.SELL, quantity, price);

            run.advance(TradeState.UPDATING);
            Optional<Holding> remaining = holdingsAccumulator.applySell(portfolio.getId(), stock.getId(), quantity);

            run.advance(TradeState.SETTLING);
            BigDecimal newBalance = accountBalanceService.credit(account, proceeds);
            NetWorthSnapshot snapshot = netWorthSnapshotter.snapshot();

            run.advance(TradeState.DONE);
            tradeMetrics.recordExecuted(TransactionType.SELL);
            log.info("SELL {} x {} @ {} in portfolio {} (proceeds {}, balance {}, position {})",
                    quantity, stock.getSymbol(), price, portfolio.getId(), proceeds, newBalance,
                    remaining.map(h -> String.valueOf(h.getQuantity())).orElse("closed"));
            return result(run, transaction, proceeds, newBalance, remaining, snapshot,
                    String.format("Successfully sold %d shares of %s at $%s for $%s",
                            quantity, stock.getSymbol(), display(price), display(proceeds)));
        } catch (TradingException | NotFoundException | BadRequestException ex) {
            throw run.reject(ex);
        } catch (DataAccessException ex) {
            throw run.fail(ex);
        }
    }

    private void validateInputs(Long portfolioId, Integer quantity, BigDecimal price) {
        if (portfolioId == null) {
            throw new InvalidInputException("portfolioId", "Portfolio is required");
        }
        if (quantity == null || quantity <= 0) {
            throw new InvalidInputException("quantity", "Quantity must be greater than zero");
        }
        if (!MoneyUtils.isPositive(MoneyUtils.scale(price))) {
            throw new InvalidInputException("price", "Price must be greater than zero");
        }
    }

    private Portfolio requirePortfolio(Long portfolioId) {
        return portfolioRepository.findById(portfolioId)
                .orElseThrow(() -> new PortfolioNotFoundException(portfolioId));
    }

    private StockTransaction record(Stock stock, Portfolio portfolio, TransactionType type, int quantity, BigDecimal price) {
        StockTransaction transaction = StockTransaction.builder()
                .stock(stock)
                .portfolioId(portfolio.getId())
                .type(type)
                .quantity(quantity)
                .price(MoneyUtils.scale(price))
                .timestamp(LocalDateTime.now())
                .build();
        return stockTransactionRepository.saveAndFlush(transaction);
    }

    private TradeResult result(TradeRun run, StockTransaction transaction, BigDecimal total, BigDecimal newBalance,
                               Optional<Holding> holding, NetWorthSnapshot snapshot, String message) {
        return TradeResult.builder()
                .transactionId(transaction.getId())
                .type(transaction.getType())
                .symbol(transaction.getSymbol())
                .portfolioId(transaction.getPortfolioId())
                .quantity(transaction.getQuantity())
                .price(transaction.getPrice())
                .totalAmount(total)
                .executedAt(transaction.getTimestamp())
                .newBalance(newBalance)
                .holding(holding.map(HoldingDTO::from).orElse(null))
                .holdingRemoved(holding.isEmpty())
                .netWorth(NetWorthPointDTO.from(snapshot))
                .state(run.state())
                .message(message)
                .build();
    }

    private static String display(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private final class TradeRun {

        private final TransactionType side;
        private final String symbol;
        private TradeState state = TradeState.VALIDATING;

        private TradeRun(TransactionType side, String symbol) {
            this.side = side;
            this.symbol = symbol;
        }

        TradeState state() {
            return state;
        }

        void advance(TradeState target) {
            if (!state.canTransitionTo(target)) {
                throw new IllegalStateException("Invalid trade state transition: " + state + " -> " + target);
            }
            log.debug("{} {}: {} -> {}", side, symbol, state, target);
            state = target;
        }

        RuntimeException reject(RuntimeException cause) {
            if (state != TradeState.VALIDATING) {
                // Rule checks only run while validating; anything later is a ledger fault
                log.error("{} {} failed in {} after writes began", side, symbol, state, cause);
                return cause;
            }
            state = TradeState.REJECTED;
            tradeMetrics.recordRejected(side, cause.getClass().getSimpleName());
            log.warn("{} {} rejected: {}", side, symbol, cause.getMessage());
            return cause;
        }

        RuntimeException fail(DataAccessException cause) {
            log.error("{} {} hit a storage fault in {}", side, symbol, state, cause);
            return new PersistenceFailureException("Ledger storage failure while processing " + side + " " + symbol, cause);
        }
    }
}
