package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.dto.DashboardResponse;
import com.folio.backend.dto.PortfolioSummaryDTO;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.service.pnl.RealizedPnl;
import com.folio.backend.service.pnl.UnrealizedPnl;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class DashboardService {

    private final PortfolioService portfolioService;
    private final PnlService pnlService;
    private final AccountBalanceService accountBalanceService;
    private final TransactionService transactionService;
    private final HoldingRepository holdingRepository;
    private final LedgerProperties ledgerProperties;

    @Transactional(readOnly = true)
    public DashboardResponse getDashboard() {
        List<PortfolioSummaryDTO> portfolios = portfolioService.listPortfolios().stream()
                .sorted(Comparator.comparing(PortfolioSummaryDTO::getTotalValue).reversed())
                .collect(Collectors.toList());
        BigDecimal totalValue = portfolios.stream()
                .map(PortfolioSummaryDTO::getTotalValue)
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);

        UnrealizedPnl unrealized = pnlService.getUnrealizedPL(null);
        RealizedPnl realized = pnlService.getRealizedPL();
        BigDecimal totalAmount = MoneyUtils.add(unrealized.amount(), realized.amount());
        BigDecimal totalInvested = MoneyUtils.add(unrealized.costBasis(), realized.totalSoldCostBasis());

        return DashboardResponse.builder()
                .portfolios(portfolios)
                .totalValue(totalValue)
                .unrealized(pnl(unrealized.amount(), unrealized.percentage()))
                .realized(pnl(realized.amount(), realized.percentage()))
                .total(pnl(totalAmount, MoneyUtils.percentage(totalAmount, totalInvested)))
                .totalCostBasis(unrealized.costBasis())
                .totalInvested(totalInvested)
                .accountBalance(accountBalanceService.currentBalance())
                .totalHoldings(holdingRepository.count())
                .recentTransactions(transactionService.recentTransactions(ledgerProperties.getDashboardTransactionsLimit()))
                .generatedAt(LocalDateTime.now())
                .build();
    }

    private static DashboardResponse.PnlSummary pnl(BigDecimal amount, BigDecimal percentage) {
        return DashboardResponse.PnlSummary.builder()
                .amount(amount)
                .percentage(percentage)
                .build();
    }
}
