package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.dto.HoldingDTO;
import com.folio.backend.dto.StockDTO;
import com.folio.backend.dto.StockDetailDTO;
import com.folio.backend.model.Holding;
import com.folio.backend.model.Stock;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.StockRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Catalog views with cross-portfolio exposure, the price feed entry point and the watchlist flag.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StockService {

    private final StockRepository stockRepository;
    private final HoldingRepository holdingRepository;
    private final PriceCatalog priceCatalog;
    private final TransactionService transactionService;
    private final LedgerProperties ledgerProperties;

    @Transactional(readOnly = true)
    public List<StockDTO> listStocks() {
        return toDtos(stockRepository.findAllByOrderBySymbolAsc());
    }

    @Transactional(readOnly = true)
    public StockDetailDTO getStockDetail(String symbol) {
        Stock stock = priceCatalog.requireStock(symbol);
        List<Holding> holdings = holdingRepository.findByStockId(stock.getId());
        return StockDetailDTO.builder()
                .stock(toDto(stock, holdings))
                .holdings(holdings.stream().map(HoldingDTO::from).collect(Collectors.toList()))
                .transactions(transactionService.forStock(stock.getId(), ledgerProperties.getDetailTransactionsLimit()))
                .build();
    }

    public Map<String, BigDecimal> getPrices() {
        return priceCatalog.allPrices();
    }

    @Transactional
    public StockDTO updatePrice(String symbol, BigDecimal price) {
        Stock stock = priceCatalog.updatePrice(symbol, price);
        return toDto(stock, holdingRepository.findByStockId(stock.getId()));
    }

    /**
     * Applies a batch from the price feed in one transaction; an unknown symbol aborts the whole batch.
     */
    @Transactional
    public Map<String, BigDecimal> updatePrices(Map<String, BigDecimal> prices) {
        prices.forEach(priceCatalog::updatePrice);
        log.info("Applied {} price updates", prices.size());
        return priceCatalog.allPrices();
    }

    @Transactional(readOnly = true)
    public List<StockDTO> getWatchlist() {
        return toDtos(stockRepository.findByWatchlistTrueOrderBySymbolAsc());
    }

    @Transactional
    public StockDTO addToWatchlist(String symbol) {
        return setWatchlist(symbol, true);
    }

    @Transactional
    public StockDTO removeFromWatchlist(String symbol) {
        return setWatchlist(symbol, false);
    }

    private StockDTO setWatchlist(String symbol, boolean watched) {
        Stock stock = priceCatalog.requireStock(symbol);
        if (stock.isWatchlist() != watched) {
            stock.setWatchlist(watched);
            stock = stockRepository.save(stock);
            log.debug("Watchlist {} {}", watched ? "+" : "-", stock.getSymbol());
        }
        return toDto(stock, holdingRepository.findByStockId(stock.getId()));
    }

    private List<StockDTO> toDtos(List<Stock> stocks) {
        Map<Long, List<Holding>> byStock = holdingRepository.findAll().stream()
                .collect(Collectors.groupingBy(holding -> holding.getStock().getId()));
        return stocks.stream()
                .map(stock -> toDto(stock, byStock.getOrDefault(stock.getId(), List.of())))
                .collect(Collectors.toList());
    }

    private StockDTO toDto(Stock stock, List<Holding> holdings) {
        long shares = holdings.stream().mapToLong(Holding::getQuantity).sum();
        BigDecimal costBasis = holdings.stream()
                .map(holding -> MoneyUtils.multiply(holding.getAvgBuyPrice(), holding.getQuantity()))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        return StockDTO.builder()
                .id(stock.getId())
                .symbol(stock.getSymbol())
                .name(stock.getName())
                .currentPrice(stock.getCurrentPrice())
                .watchlist(stock.isWatchlist())
                .totalSharesHeld(shares)
                .totalValueHeld(MoneyUtils.multiply(stock.getCurrentPrice(), BigDecimal.valueOf(shares)))
                .totalCostBasis(costBasis)
                .build();
    }
}
