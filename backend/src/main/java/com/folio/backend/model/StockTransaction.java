package com.folio.backend.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.Immutable;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only trade record, the source of truth for holdings and realized P&L.
 * {@code portfolioId} is a plain column so history survives portfolio deletion.
 */
@Entity
@Immutable
@Table(name = "stock_transactions")
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StockTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(optional = false)
    @JoinColumn(name = "stock_id", nullable = false, updatable = false)
    private Stock stock;

    @Column(name = "portfolio_id", nullable = false, updatable = false)
    private Long portfolioId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 4, updatable = false)
    private TransactionType type;

    @Column(nullable = false, updatable = false)
    private Integer quantity;

    @Column(nullable = false, precision = 19, scale = 4, updatable = false)
    private BigDecimal price;

    @Column(name = "executed_at", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    public String getSymbol() {
        return stock == null ? null : stock.getSymbol();
    }
}
