package com.folio.backend.service;

import com.folio.backend.exception.PortfolioNotFoundException;
import com.folio.backend.model.Holding;
import com.folio.backend.model.StockTransaction;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockTransactionRepository;
import com.folio.backend.service.pnl.FifoRealizedPnlEngine;
import com.folio.backend.service.pnl.RealizedPnl;
import com.folio.backend.service.pnl.UnrealizedPnl;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;

/**
 * Read models over the ledger. Unrealized P&L uses the weighted-average cost
 * kept on holdings; realized P&L replays the transaction log through FIFO.
 */
@Service
@RequiredArgsConstructor
public class PnlService {

    private final StockTransactionRepository stockTransactionRepository;
    private final HoldingRepository holdingRepository;
    private final PortfolioRepository portfolioRepository;
    private final FifoRealizedPnlEngine fifoRealizedPnlEngine;

    @Transactional(readOnly = true)
    public RealizedPnl getRealizedPL() {
        return fifoRealizedPnlEngine.calculate(stockTransactionRepository.findAllInReplayOrder());
    }

    /**
     * @param portfolioId restricts the replay to one portfolio's transactions; null for the whole log
     */
    @Transactional(readOnly = true)
    public RealizedPnl getRealizedPL(Long portfolioId) {
        if (portfolioId == null) {
            return getRealizedPL();
        }
        requirePortfolio(portfolioId);
        List<StockTransaction> transactions = stockTransactionRepository.findByPortfolioInReplayOrder(portfolioId);
        return fifoRealizedPnlEngine.calculate(transactions);
    }

    @Transactional(readOnly = true)
    public UnrealizedPnl getUnrealizedPL(Long portfolioId) {
        List<Holding> holdings;
        if (portfolioId == null) {
            holdings = holdingRepository.findAll();
        } else {
            requirePortfolio(portfolioId);
            holdings = holdingRepository.findByPortfolioId(portfolioId);
        }
        return unrealized(holdings);
    }

    public static UnrealizedPnl unrealized(List<Holding> holdings) {
        BigDecimal costBasis = MoneyUtils.ZERO;
        BigDecimal currentValue = MoneyUtils.ZERO;
        for (Holding holding : holdings) {
            costBasis = MoneyUtils.add(costBasis, MoneyUtils.multiply(holding.getAvgBuyPrice(), holding.getQuantity()));
            currentValue = MoneyUtils.add(currentValue,
                    MoneyUtils.multiply(holding.getStock().getCurrentPrice(), holding.getQuantity()));
        }
        BigDecimal amount = MoneyUtils.subtract(currentValue, costBasis);
        return new UnrealizedPnl(costBasis, currentValue, amount, MoneyUtils.percentage(amount, costBasis));
    }

    private void requirePortfolio(Long portfolioId) {
        if (!portfolioRepository.existsById(portfolioId)) {
            throw new PortfolioNotFoundException(portfolioId);
        }
    }
}
