package com.folio.backend.controller;

import com.folio.backend.service.LedgerReconciliationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/admin/reconcile")
@RequiredArgsConstructor
@Tag(name = "Admin Reconcile")
public class AdminReconciliationController {

    private final LedgerReconciliationService reconciliationService;

    @PostMapping("/run")
    @Operation(summary = "Compare holdings and balance with a replay of the transaction log")
    public ResponseEntity<LedgerReconciliationService.ReconciliationReport> run() {
        return ResponseEntity.ok(reconciliationService.reconcile());
    }

    @PostMapping("/repair")
    @Operation(summary = "Rewrite holdings and balance from the transaction log")
    public ResponseEntity<LedgerReconciliationService.RepairResult> repair() {
        log.warn("Admin ledger repair requested");
        return ResponseEntity.ok(reconciliationService.repair());
    }
}
