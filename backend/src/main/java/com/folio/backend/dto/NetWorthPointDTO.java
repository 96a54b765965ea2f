package com.folio.backend.dto;

import com.folio.backend.model.NetWorthSnapshot;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NetWorthPointDTO {
    private LocalDate date;
    private LocalDateTime timestamp;
    private BigDecimal accountBalance;
    private BigDecimal portfolioValue;
    private BigDecimal totalNetWorth;

    public static NetWorthPointDTO from(NetWorthSnapshot snapshot) {
        return NetWorthPointDTO.builder()
                .date(snapshot.getDate())
                .timestamp(snapshot.getTimestamp())
                .accountBalance(snapshot.getAccountBalance())
                .portfolioValue(snapshot.getPortfolioValue())
                .totalNetWorth(snapshot.getTotalNetWorth())
                .build();
    }
}
