package com.folio.backend.service.pnl;

import java.math.BigDecimal;

public record UnrealizedPnl(
        BigDecimal costBasis,
        BigDecimal currentValue,
        BigDecimal amount,
        BigDecimal percentage
) {
}
