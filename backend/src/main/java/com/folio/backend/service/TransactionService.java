package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.dto.TransactionDTO;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.model.Portfolio;
import com.folio.backend.model.StockTransaction;
import com.folio.backend.repository.PortfolioRepository;
import com.folio.backend.repository.StockTransactionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
public class TransactionService {

    private final StockTransactionRepository stockTransactionRepository;
    private final PortfolioRepository portfolioRepository;
    private final LedgerProperties ledgerProperties;

    /**
     * Newest first. Transactions of a deleted portfolio keep their id but carry no name.
     */
    @Transactional(readOnly = true)
    public List<TransactionDTO> recentTransactions(Integer limit) {
        int effective = limit == null ? ledgerProperties.getRecentTransactionsLimit() : limit;
        if (effective <= 0) {
            throw new InvalidInputException("limit", "Limit must be greater than zero");
        }
        return toDtos(stockTransactionRepository.findAllByOrderByTimestampDescIdDesc(PageRequest.of(0, effective)));
    }

    @Transactional(readOnly = true)
    public List<TransactionDTO> forPortfolio(Long portfolioId, int limit) {
        return toDtos(stockTransactionRepository.findByPortfolioIdOrderByTimestampDescIdDesc(
                portfolioId, PageRequest.of(0, limit)));
    }

    @Transactional(readOnly = true)
    public List<TransactionDTO> forStock(Long stockId, int limit) {
        return toDtos(stockTransactionRepository.findByStockIdOrderByTimestampDescIdDesc(
                stockId, PageRequest.of(0, limit)));
    }

    private List<TransactionDTO> toDtos(List<StockTransaction> transactions) {
        Map<Long, String> names = portfolioRepository.findAll().stream()
                .collect(Collectors.toMap(Portfolio::getId, Portfolio::getName));
        return transactions.stream()
                .map(transaction -> TransactionDTO.from(transaction, names.get(transaction.getPortfolioId())))
                .collect(Collectors.toList());
    }
}
