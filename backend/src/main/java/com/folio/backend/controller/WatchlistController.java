package com.folio.backend.controller;

import com.folio.backend.dto.StockDTO;
import com.folio.backend.service.StockService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Watchlist")
public class WatchlistController {

    private final StockService stockService;

    @GetMapping("/watchlist")
    @Operation(summary = "Watchlisted stocks with exposure")
    public ResponseEntity<List<StockDTO>> getWatchlist() {
        return ResponseEntity.ok(stockService.getWatchlist());
    }

    @PostMapping("/stocks/{symbol}/watchlist")
    @Operation(summary = "Add a stock to the watchlist")
    public ResponseEntity<StockDTO> add(@PathVariable String symbol) {
        return ResponseEntity.ok(stockService.addToWatchlist(symbol));
    }

    @DeleteMapping("/stocks/{symbol}/watchlist")
    @Operation(summary = "Remove a stock from the watchlist")
    public ResponseEntity<StockDTO> remove(@PathVariable String symbol) {
        return ResponseEntity.ok(stockService.removeFromWatchlist(symbol));
    }
}
