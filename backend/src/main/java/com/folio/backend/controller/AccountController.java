package com.folio.backend.controller;

import com.folio.backend.dto.BalanceDTO;
import com.folio.backend.dto.NetWorthPointDTO;
import com.folio.backend.model.AccountBalance;
import com.folio.backend.service.AccountBalanceService;
import com.folio.backend.service.NetWorthSnapshotter;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Account")
public class AccountController {

    private final AccountBalanceService accountBalanceService;
    private final NetWorthSnapshotter netWorthSnapshotter;

    @GetMapping("/account/balance")
    @Operation(summary = "Current cash balance")
    public ResponseEntity<BalanceDTO> getBalance() {
        AccountBalance account = accountBalanceService.current();
        return ResponseEntity.ok(BalanceDTO.builder()
                .balance(account.getBalance())
                .lastUpdated(account.getLastUpdated())
                .build());
    }

    @GetMapping("/net-worth/history")
    @Operation(summary = "Latest net-worth snapshots in chronological order")
    public ResponseEntity<List<NetWorthPointDTO>> getNetWorthHistory(@RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(netWorthSnapshotter.history(limit).stream()
                .map(NetWorthPointDTO::from)
                .collect(Collectors.toList()));
    }
}
