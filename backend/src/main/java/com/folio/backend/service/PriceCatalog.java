package com.folio.backend.service;

import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.model.Stock;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Symbol to current market price. Prices are pushed in by an external feed;
 * the ledger only reads them.
 */
public interface PriceCatalog {

    /**
     * @throws com.folio.backend.exception.StockNotFoundException when the symbol is unknown
     */
    BigDecimal currentPrice(String symbol);

    Stock requireStock(String symbol);

    Map<String, BigDecimal> allPrices();

    Stock updatePrice(String symbol, BigDecimal price);

    static String normalize(String symbol) {
        if (symbol == null || symbol.isBlank()) {
            throw new InvalidInputException("symbol", "Symbol is required");
        }
        return symbol.trim().toUpperCase(Locale.ROOT);
    }
}
