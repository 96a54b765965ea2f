package com.folio.backend.service.pnl;

import java.math.BigDecimal;

/**
 * @param unmatchedQuantity shares sold beyond every lot ever bought; counted at zero cost
 */
public record SymbolRealizedPnl(
        String symbol,
        BigDecimal amount,
        BigDecimal soldValue,
        BigDecimal soldCostBasis,
        int unmatchedQuantity
) {
}
