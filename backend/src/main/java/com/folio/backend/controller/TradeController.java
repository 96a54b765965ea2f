package com.folio.backend.controller;

import com.folio.backend.dto.ApiError;
import com.folio.backend.dto.TradeRequest;
import com.folio.backend.dto.TradeResult;
import com.folio.backend.service.PriceCatalog;
import com.folio.backend.service.TradeExecutor;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;

@Slf4j
@RestController
@RequestMapping("/api/stocks")
@RequiredArgsConstructor
@Tag(name = "Trading")
public class TradeController {

    private final TradeExecutor tradeExecutor;
    private final PriceCatalog priceCatalog;

    @PostMapping("/{symbol}/buy")
    @Operation(summary = "Buy shares into a portfolio")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = TradeResult.class)))
    @ApiResponse(responseCode = "422", description = "Insufficient balance",
            content = @Content(schema = @Schema(implementation = ApiError.class)))
    public ResponseEntity<TradeResult> buy(@PathVariable String symbol, @Valid @RequestBody TradeRequest request) {
        BigDecimal price = resolvePrice(symbol, request);
        return ResponseEntity.ok(tradeExecutor.buy(request.getPortfolioId(), symbol, request.getQuantity(), price));
    }

    @PostMapping("/{symbol}/sell")
    @Operation(summary = "Sell shares out of a portfolio")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = TradeResult.class)))
    @ApiResponse(responseCode = "422", description = "Insufficient shares",
            content = @Content(schema = @Schema(implementation = ApiError.class)))
    public ResponseEntity<TradeResult> sell(@PathVariable String symbol, @Valid @RequestBody TradeRequest request) {
        BigDecimal price = resolvePrice(symbol, request);
        return ResponseEntity.ok(tradeExecutor.sell(request.getPortfolioId(), symbol, request.getQuantity(), price));
    }

    // Looked up before the executor takes the balance lock
    private BigDecimal resolvePrice(String symbol, TradeRequest request) {
        if (request.getPrice() != null) {
            return request.getPrice();
        }
        BigDecimal price = priceCatalog.currentPrice(symbol);
        log.debug("No price on {} request, using catalog price {}", symbol, price);
        return price;
    }
}
