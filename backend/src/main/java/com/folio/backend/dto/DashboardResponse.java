package com.folio.backend.dto;

import lombok.Builder;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
public class DashboardResponse {
    private List<PortfolioSummaryDTO> portfolios;
    private BigDecimal totalValue;
    private PnlSummary unrealized;
    private PnlSummary realized;
    private PnlSummary total;
    private BigDecimal totalCostBasis;
    private BigDecimal totalInvested;
    private BigDecimal accountBalance;
    private long totalHoldings;
    private List<TransactionDTO> recentTransactions;
    private LocalDateTime generatedAt;

    @Data
    @Builder
    public static class PnlSummary {
        private BigDecimal amount;
        private BigDecimal percentage;
    }
}
