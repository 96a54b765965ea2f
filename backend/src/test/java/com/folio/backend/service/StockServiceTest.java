package com.folio.backend.service;

import com.folio.backend.dto.StockDTO;
import com.folio.backend.dto.StockDetailDTO;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.exception.StockNotFoundException;
import com.folio.backend.model.Portfolio;
import com.folio.backend.support.LedgerIntegrationTest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StockServiceTest extends LedgerIntegrationTest {

    @Autowired
    private StockService stockService;

    @Autowired
    private TradeExecutor tradeExecutor;

    private Portfolio first;
    private Portfolio second;

    @BeforeEach
    void setUp() {
        stock("MSFT", "338.85");
        stock("AAPL", "175.43");
        first = portfolio("First");
        second = portfolio("Second");
    }

    @Test
    void listAggregatesExposureAcrossPortfolios() {
        tradeExecutor.buy(first.getId(), "AAPL", 3, new BigDecimal("170"));
        tradeExecutor.buy(second.getId(), "AAPL", 2, new BigDecimal("180"));

        List<StockDTO> stocks = stockService.listStocks();

        assertThat(stocks).extracting(StockDTO::getSymbol).containsExactly("AAPL", "MSFT");
        StockDTO aapl = stocks.get(0);
        assertThat(aapl.getTotalSharesHeld()).isEqualTo(5);
        assertThat(aapl.getTotalValueHeld()).isEqualByComparingTo("877.15");
        assertThat(aapl.getTotalCostBasis()).isEqualByComparingTo("870");
        assertThat(stocks.get(1).getTotalSharesHeld()).isZero();
    }

    @Test
    void detailMatchesSymbolCaseInsensitively() {
        tradeExecutor.buy(first.getId(), "AAPL", 1, new BigDecimal("175.43"));

        StockDetailDTO detail = stockService.getStockDetail(" aapl ");

        assertThat(detail.getStock().getSymbol()).isEqualTo("AAPL");
        assertThat(detail.getHoldings()).hasSize(1);
        assertThat(detail.getTransactions()).hasSize(1);
    }

    @Test
    void priceFeedUpdatesCatalog() {
        stockService.updatePrice("MSFT", new BigDecimal("340.10"));
        Map<String, BigDecimal> batch = new LinkedHashMap<>();
        batch.put("AAPL", new BigDecimal("181.5"));

        Map<String, BigDecimal> prices = stockService.updatePrices(batch);

        assertThat(prices).containsOnlyKeys("AAPL", "MSFT");
        assertThat(prices.get("AAPL")).isEqualByComparingTo("181.5");
        assertThat(prices.get("MSFT")).isEqualByComparingTo("340.10");
    }

    @Test
    void priceFeedRejectsBadInput() {
        assertThatThrownBy(() -> stockService.updatePrice("MSFT", BigDecimal.ZERO))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> stockService.updatePrice("NOPE", BigDecimal.ONE))
                .isInstanceOf(StockNotFoundException.class);
    }

    @Test
    void priceFeedRejectsPriceThatRoundsToZero() {
        assertThatThrownBy(() -> stockService.updatePrice("MSFT", new BigDecimal("0.00003")))
                .isInstanceOf(InvalidInputException.class);

        assertThat(stockRepository.findBySymbol("MSFT").orElseThrow().getCurrentPrice()).isPositive();
    }

    @Test
    void watchlistToggles() {
        stockService.addToWatchlist("msft");
        assertThat(stockService.getWatchlist()).extracting(StockDTO::getSymbol).containsExactly("MSFT");

        stockService.removeFromWatchlist("MSFT");
        assertThat(stockService.getWatchlist()).isEmpty();
    }
}
