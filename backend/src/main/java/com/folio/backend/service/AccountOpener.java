package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.model.AccountBalance;
import com.folio.backend.repository.AccountBalanceRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Inserts the cash row in a transaction of its own, so a caller that lost the
 * race to open it can go on to lock the winner's row.
 */
@Slf4j
@Component
@RequiredArgsConstructor
class AccountOpener {

    private final AccountBalanceRepository accountBalanceRepository;
    private final LedgerProperties ledgerProperties;

    /**
     * @throws org.springframework.dao.DataIntegrityViolationException when another transaction opened it first
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void openIfMissing() {
        Long accountId = ledgerProperties.getAccountId();
        if (accountBalanceRepository.findByAccountId(accountId).isPresent()) {
            return;
        }
        log.info("Opening account {} with starting balance {}", accountId, ledgerProperties.getStartingBalance());
        accountBalanceRepository.saveAndFlush(AccountBalance.builder()
                .accountId(accountId)
                .balance(MoneyUtils.scale(ledgerProperties.getStartingBalance()))
                .build());
    }
}
