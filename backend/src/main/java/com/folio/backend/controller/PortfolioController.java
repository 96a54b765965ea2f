package com.folio.backend.controller;

import com.folio.backend.dto.CreatePortfolioRequest;
import com.folio.backend.dto.PortfolioDetailDTO;
import com.folio.backend.dto.PortfolioSummaryDTO;
import com.folio.backend.service.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/portfolios")
@RequiredArgsConstructor
@Tag(name = "Portfolios")
public class PortfolioController {

    private final PortfolioService portfolioService;

    @GetMapping
    @Operation(summary = "List portfolios with holdings count and market value")
    public ResponseEntity<List<PortfolioSummaryDTO>> listPortfolios() {
        return ResponseEntity.ok(portfolioService.listPortfolios());
    }

    @PostMapping
    @Operation(summary = "Create a portfolio")
    @ApiResponse(responseCode = "201")
    @ApiResponse(responseCode = "409", description = "Name already taken")
    public ResponseEntity<PortfolioSummaryDTO> createPortfolio(@Valid @RequestBody CreatePortfolioRequest request) {
        PortfolioSummaryDTO created = portfolioService.createPortfolio(request.getName(), request.getDescription());
        return ResponseEntity.status(HttpStatus.CREATED).body(created);
    }

    @GetMapping("/{id}")
    @Operation(summary = "Portfolio detail with holdings and recent transactions")
    public ResponseEntity<PortfolioDetailDTO> getPortfolio(@PathVariable Long id) {
        return ResponseEntity.ok(portfolioService.getPortfolioDetail(id));
    }

    @GetMapping("/{id}/value")
    @Operation(summary = "Market value of a portfolio")
    public ResponseEntity<Map<String, Object>> getPortfolioValue(@PathVariable Long id) {
        BigDecimal value = portfolioService.getPortfolioValue(id);
        return ResponseEntity.ok(Map.of("portfolioId", id, "totalValue", value));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a portfolio and its holdings; transactions are kept")
    @ApiResponse(responseCode = "204", content = @Content)
    public ResponseEntity<Void> deletePortfolio(@PathVariable Long id) {
        portfolioService.deletePortfolio(id);
        return ResponseEntity.noContent().build();
    }
}
