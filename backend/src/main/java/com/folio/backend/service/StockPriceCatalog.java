package com.folio.backend.service;

import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.exception.StockNotFoundException;
import com.folio.backend.model.Stock;
import com.folio.backend.repository.StockRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class StockPriceCatalog implements PriceCatalog {

    private final StockRepository stockRepository;

    @Override
    @Transactional(readOnly = true)
    public BigDecimal currentPrice(String symbol) {
        return requireStock(symbol).getCurrentPrice();
    }

    @Override
    @Transactional(readOnly = true)
    public Stock requireStock(String symbol) {
        String normalized = PriceCatalog.normalize(symbol);
        return stockRepository.findBySymbol(normalized)
                .orElseThrow(() -> new StockNotFoundException(normalized));
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, BigDecimal> allPrices() {
        Map<String, BigDecimal> prices = new LinkedHashMap<>();
        stockRepository.findAllByOrderBySymbolAsc()
                .forEach(stock -> prices.put(stock.getSymbol(), stock.getCurrentPrice()));
        return prices;
    }

    @Override
    @Transactional
    public Stock updatePrice(String symbol, BigDecimal price) {
        if (!MoneyUtils.isPositive(MoneyUtils.scale(price))) {
            throw new InvalidInputException("price", "Price must be greater than zero");
        }
        Stock stock = requireStock(symbol);
        stock.setCurrentPrice(MoneyUtils.scale(price));
        Stock saved = stockRepository.save(stock);
        log.debug("Price updated: {} -> {}", saved.getSymbol(), saved.getCurrentPrice());
        return saved;
    }
}
