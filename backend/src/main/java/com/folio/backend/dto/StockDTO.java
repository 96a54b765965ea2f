package com.folio.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockDTO {
    private Long id;
    private String symbol;
    private String name;
    private BigDecimal currentPrice;
    private boolean watchlist;
    private long totalSharesHeld;
    private BigDecimal totalValueHeld;
    private BigDecimal totalCostBasis;
}
