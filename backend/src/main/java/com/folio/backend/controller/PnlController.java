package com.folio.backend.controller;

import com.folio.backend.service.PnlService;
import com.folio.backend.service.pnl.RealizedPnl;
import com.folio.backend.service.pnl.UnrealizedPnl;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/pnl")
@RequiredArgsConstructor
@Tag(name = "P&L")
public class PnlController {

    private final PnlService pnlService;

    @GetMapping("/realized")
    @Operation(summary = "Realized P&L by FIFO lot matching, optionally for one portfolio")
    public ResponseEntity<RealizedPnl> realized(@RequestParam(required = false) Long portfolioId) {
        return ResponseEntity.ok(pnlService.getRealizedPL(portfolioId));
    }

    @GetMapping("/unrealized")
    @Operation(summary = "Unrealized P&L on open holdings at current prices")
    public ResponseEntity<UnrealizedPnl> unrealized(@RequestParam(required = false) Long portfolioId) {
        return ResponseEntity.ok(pnlService.getUnrealizedPL(portfolioId));
    }
}
