package com.folio.backend.dto;

import com.folio.backend.model.TradeState;
import com.folio.backend.model.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TradeResult {
    private Long transactionId;
    private TransactionType type;
    private String symbol;
    private Long portfolioId;
    private Integer quantity;
    private BigDecimal price;
    private BigDecimal totalAmount;
    private LocalDateTime executedAt;
    private BigDecimal newBalance;
    // null when the sell closed the position
    private HoldingDTO holding;
    private boolean holdingRemoved;
    private NetWorthPointDTO netWorth;
    private TradeState state;
    private String message;
}
