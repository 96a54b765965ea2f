package com.folio.backend.controller;

import com.folio.backend.dto.PriceUpdateRequest;
import com.folio.backend.dto.StockDTO;
import com.folio.backend.dto.StockDetailDTO;
import com.folio.backend.service.StockService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
@Tag(name = "Stocks")
public class StockController {

    private final StockService stockService;

    @GetMapping
    @Operation(summary = "List stocks with shares and value held across portfolios")
    public ResponseEntity<List<StockDTO>> listStocks() {
        return ResponseEntity.ok(stockService.listStocks());
    }

    @GetMapping("/prices")
    @Operation(summary = "Current price of every stock")
    public ResponseEntity<Map<String, BigDecimal>> getPrices() {
        return ResponseEntity.ok(stockService.getPrices());
    }

    @PutMapping("/prices")
    @Operation(summary = "Apply a batch of price updates from the price feed")
    public ResponseEntity<Map<String, BigDecimal>> updatePrices(@RequestBody Map<String, BigDecimal> prices) {
        return ResponseEntity.ok(stockService.updatePrices(prices));
    }

    @GetMapping("/{symbol}")
    @Operation(summary = "Stock detail with holdings and recent transactions")
    public ResponseEntity<StockDetailDTO> getStock(@PathVariable String symbol) {
        return ResponseEntity.ok(stockService.getStockDetail(symbol));
    }

    @PutMapping("/{symbol}/price")
    @Operation(summary = "Update the current price of one stock")
    public ResponseEntity<StockDTO> updatePrice(@PathVariable String symbol,
                                                @Valid @RequestBody PriceUpdateRequest request) {
        return ResponseEntity.ok(stockService.updatePrice(symbol, request.getPrice()));
    }
}
