package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.exception.InvalidInputException;
import com.folio.backend.model.AccountBalance;
import com.folio.backend.model.Holding;
import com.folio.backend.model.NetWorthSnapshot;
import com.folio.backend.repository.HoldingRepository;
import com.folio.backend.repository.NetWorthSnapshotRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Appends one net-worth row per executed trade. Rows are never merged per day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NetWorthSnapshotter {

    private final AccountBalanceService accountBalanceService;
    private final HoldingRepository holdingRepository;
    private final NetWorthSnapshotRepository netWorthSnapshotRepository;
    private final LedgerProperties ledgerProperties;

    @Transactional
    public NetWorthSnapshot snapshot() {
        AccountBalance account = accountBalanceService.current();
        BigDecimal balance = MoneyUtils.scale(account.getBalance());
        BigDecimal portfolioValue = portfolioValue(holdingRepository.findAll());
        LocalDateTime now = LocalDateTime.now();
        NetWorthSnapshot snapshot = NetWorthSnapshot.builder()
                .accountId(account.getAccountId())
                .date(now.toLocalDate())
                .accountBalance(balance)
                .portfolioValue(portfolioValue)
                .totalNetWorth(MoneyUtils.add(balance, portfolioValue))
                .timestamp(now)
                .build();
        NetWorthSnapshot saved = netWorthSnapshotRepository.saveAndFlush(snapshot);
        log.debug("Net worth snapshot: balance={} holdings={} total={}",
                saved.getAccountBalance(), saved.getPortfolioValue(), saved.getTotalNetWorth());
        return saved;
    }

    /**
     * @return the latest {@code limit} rows, oldest first
     */
    @Transactional(readOnly = true)
    public List<NetWorthSnapshot> history(Integer limit) {
        int effective = limit == null ? ledgerProperties.getNetWorthHistoryDefaultLimit() : limit;
        if (effective <= 0) {
            throw new InvalidInputException("limit", "Limit must be greater than zero");
        }
        List<NetWorthSnapshot> latest = new ArrayList<>(netWorthSnapshotRepository
                .findByAccountIdOrderByTimestampDescIdDesc(ledgerProperties.getAccountId(), PageRequest.of(0, effective)));
        Collections.reverse(latest);
        return latest;
    }

    /**
     * Market value of the given holdings at current catalog prices.
     */
    public static BigDecimal portfolioValue(List<Holding> holdings) {
        return holdings.stream()
                .map(holding -> MoneyUtils.multiply(holding.getStock().getCurrentPrice(), holding.getQuantity()))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
    }
}
