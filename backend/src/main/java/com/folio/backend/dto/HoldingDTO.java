package com.folio.backend.dto;

import com.folio.backend.model.Holding;
import com.folio.backend.util.MoneyUtils;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldingDTO {
    private Long id;
    private Long portfolioId;
    private String portfolioName;
    private String symbol;
    private String name;
    private Integer quantity;
    private BigDecimal avgBuyPrice;
    private BigDecimal currentPrice;
    private BigDecimal costBasis;
    private BigDecimal currentValue;
    private BigDecimal profitLoss;
    private BigDecimal profitLossPercent;

    public static HoldingDTO from(Holding holding) {
        BigDecimal costBasis = MoneyUtils.multiply(holding.getAvgBuyPrice(), holding.getQuantity());
        BigDecimal currentValue = MoneyUtils.multiply(holding.getStock().getCurrentPrice(), holding.getQuantity());
        BigDecimal profitLoss = MoneyUtils.subtract(currentValue, costBasis);
        return HoldingDTO.builder()
                .id(holding.getId())
                .portfolioId(holding.getPortfolio().getId())
                .portfolioName(holding.getPortfolio().getName())
                .symbol(holding.getStock().getSymbol())
                .name(holding.getStock().getName())
                .quantity(holding.getQuantity())
                .avgBuyPrice(holding.getAvgBuyPrice())
                .currentPrice(holding.getStock().getCurrentPrice())
                .costBasis(costBasis)
                .currentValue(currentValue)
                .profitLoss(profitLoss)
                .profitLossPercent(MoneyUtils.percentage(profitLoss, costBasis))
                .build();
    }
}
