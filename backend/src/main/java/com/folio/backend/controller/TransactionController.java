package com.folio.backend.controller;

import com.folio.backend.dto.TransactionDTO;
import com.folio.backend.service.TransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/transactions")
@RequiredArgsConstructor
@Tag(name = "Transactions")
public class TransactionController {

    private final TransactionService transactionService;

    @GetMapping
    @Operation(summary = "Most recent transactions, newest first")
    public ResponseEntity<List<TransactionDTO>> recent(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(transactionService.recentTransactions(limit));
    }
}
