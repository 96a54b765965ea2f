package com.folio.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PortfolioDetailDTO {
    private PortfolioSummaryDTO portfolio;
    private List<HoldingDTO> holdings;
    private List<TransactionDTO> transactions;
}
