package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.dto.HoldingDTO;
import com.folio.backend.dto.PortfolioDetailDTO;
import com.folio.backend.dto.PortfolioSummaryDTO;
import com.folio.backend.exception.ConflictException;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.exception.PortfolioNotFoundException;
import com.folio.backend.model.Holding;
import com.folio.backend.model.Portfolio;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.PortfolioRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class PortfolioService {

    private final PortfolioRepository portfolioRepository;
    private final HoldingRepository holdingRepository;
    private final AccountBalanceService accountBalanceService;
    private final TransactionService transactionService;
    private final LedgerProperties ledgerProperties;

    @Transactional
    public PortfolioSummaryDTO createPortfolio(String name, String description) {
        String trimmedName = name == null ? "" : name.trim();
        if (trimmedName.isEmpty()) {
            throw new InvalidInputException("name", "Portfolio name is required");
        }
        if (portfolioRepository.existsByName(trimmedName)) {
            throw new ConflictException("A portfolio with this name already exists: " + trimmedName);
        }
        String trimmedDescription = description == null ? null : description.trim();
        Portfolio saved = portfolioRepository.save(Portfolio.builder()
                .name(trimmedName)
                .description(trimmedDescription == null || trimmedDescription.isEmpty() ? null : trimmedDescription)
                .build());
        log.info("Created portfolio {} '{}'", saved.getId(), saved.getName());
        return summary(saved, List.of());
    }

    /**
     * Removes the portfolio and its holdings under the trade lock. Its transactions stay in the log.
     */
    @Transactional
    public void deletePortfolio(Long portfolioId) {
        accountBalanceService.lockForTrade();
        Portfolio portfolio = requirePortfolio(portfolioId);
        holdingRepository.deleteByPortfolioId(portfolioId);
        portfolioRepository.delete(portfolio);
        log.info("Deleted portfolio {} '{}'", portfolioId, portfolio.getName());
    }

    @Transactional(readOnly = true)
    public List<PortfolioSummaryDTO> listPortfolios() {
        return portfolioRepository.findAllByOrderByNameAsc().stream()
                .map(portfolio -> summary(portfolio, holdingRepository.findByPortfolioId(portfolio.getId())))
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public PortfolioDetailDTO getPortfolioDetail(Long portfolioId) {
        Portfolio portfolio = requirePortfolio(portfolioId);
        List<Holding> holdings = holdingRepository.findByPortfolioId(portfolioId);
        List<HoldingDTO> holdingDtos = holdings.stream()
                .map(HoldingDTO::from)
                .sorted(Comparator.comparing(HoldingDTO::getCurrentValue).reversed())
                .collect(Collectors.toList());
        return PortfolioDetailDTO.builder()
                .portfolio(summary(portfolio, holdings))
                .holdings(holdingDtos)
                .transactions(transactionService.forPortfolio(portfolioId, ledgerProperties.getDetailTransactionsLimit()))
                .build();
    }

    @Transactional(readOnly = true)
    public BigDecimal getPortfolioValue(Long portfolioId) {
        requirePortfolio(portfolioId);
        return NetWorthSnapshotter.portfolioValue(holdingRepository.findByPortfolioId(portfolioId));
    }

    private Portfolio requirePortfolio(Long portfolioId) {
        return portfolioRepository.findById(portfolioId)
                .orElseThrow(() -> new PortfolioNotFoundException(portfolioId));
    }

    private PortfolioSummaryDTO summary(Portfolio portfolio, List<Holding> holdings) {
        return PortfolioSummaryDTO.builder()
                .id(portfolio.getId())
                .name(portfolio.getName())
                .description(portfolio.getDescription())
                .holdingsCount(holdings.size())
                .totalValue(NetWorthSnapshotter.portfolioValue(holdings))
                .build();
    }
}
