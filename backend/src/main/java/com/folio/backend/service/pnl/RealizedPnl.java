package com.folio.backend.service.pnl;

import com.folio.backend.util.MoneyUtils;

import java.math.BigDecimal;
import java.util.List;

public record RealizedPnl(
        BigDecimal amount,
        BigDecimal percentage,
        BigDecimal totalSoldValue,
        BigDecimal totalSoldCostBasis,
        List<SymbolRealizedPnl> bySymbol
) {

    public static RealizedPnl empty() {
        return new RealizedPnl(MoneyUtils.ZERO, MoneyUtils.ZERO, MoneyUtils.ZERO, MoneyUtils.ZERO, List.of());
    }
}
