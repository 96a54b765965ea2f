package com.folio.backend.dto;

import com.folio.backend.model.StockTransaction;
import com.folio.backend.model.TransactionType;
import com.folio.backend.util.MoneyUtils;
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
public class TransactionDTO {
    private Long id;
    private TransactionType type;
    private String symbol;
    private String name;
    private Long portfolioId;
    // null once the portfolio has been deleted
    private String portfolioName;
    private Integer quantity;
    private BigDecimal price;
    private BigDecimal total;
    private LocalDateTime timestamp;

    public static TransactionDTO from(StockTransaction transaction, String portfolioName) {
        return TransactionDTO.builder()
                .id(transaction.getId())
                .type(transaction.getType())
                .symbol(transaction.getStock().getSymbol())
                .name(transaction.getStock().getName())
                .portfolioId(transaction.getPortfolioId())
                .portfolioName(portfolioName)
                .quantity(transaction.getQuantity())
                .price(transaction.getPrice())
                .total(MoneyUtils.multiply(transaction.getPrice(), transaction.getQuantity()))
                .timestamp(transaction.getTimestamp())
                .build();
    }
}
