package com.folio.backend.service;

import com.folio.backend.config.LedgerProperties;
import com.folio.backend.exception.InsufficientBalanceException;
import com.folio.backend.model.AccountBalance;
import com.folio.backend.repository.AccountBalanceRepository;
import com.folio.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owner of the ledger's cash register. Trade paths go through
 * {@link #lockForTrade()} so that balance, holdings and the transaction log
 * change under one row lock. The row is opened at startup, or by the first
 * caller that finds it missing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountBalanceService {

    private final AccountBalanceRepository accountBalanceRepository;
    private final LedgerProperties ledgerProperties;
    private final AccountOpener accountOpener;
    private final ReentrantLock openLock = new ReentrantLock();

    @Transactional
    public AccountBalance current() {
        return accountBalanceRepository.findByAccountId(ledgerProperties.getAccountId())
                .orElseGet(() -> {
                    ensureOpen();
                    return accountBalanceRepository.findByAccountId(ledgerProperties.getAccountId())
                            .orElseThrow(this::missingAccount);
                });
    }

    /**
     * Read-only view; an account that was never opened reports the starting balance.
     */
    @Transactional(readOnly = true)
    public BigDecimal currentBalance() {
        return accountBalanceRepository.findByAccountId(ledgerProperties.getAccountId())
                .map(AccountBalance::getBalance)
                .map(MoneyUtils::scale)
                .orElseGet(() -> MoneyUtils.scale(ledgerProperties.getStartingBalance()));
    }

    /**
     * Must run inside the caller's transaction; the lock is released on commit or rollback.
     */
    @Transactional
    public AccountBalance lockForTrade() {
        return accountBalanceRepository.findForUpdate(ledgerProperties.getAccountId())
                .orElseGet(() -> {
                    ensureOpen();
                    return accountBalanceRepository.findForUpdate(ledgerProperties.getAccountId())
                            .orElseThrow(this::missingAccount);
                });
    }

    @EventListener(ApplicationReadyEvent.class)
    public void openOnStartup() {
        ensureOpen();
    }

    @Transactional
    public BigDecimal debit(AccountBalance account, BigDecimal amount) {
        BigDecimal updated = MoneyUtils.subtract(account.getBalance(), amount);
        if (updated.signum() < 0) {
            throw new InsufficientBalanceException(MoneyUtils.scale(amount), MoneyUtils.scale(account.getBalance()));
        }
        return store(account, updated);
    }

    @Transactional
    public BigDecimal credit(AccountBalance account, BigDecimal amount) {
        return store(account, MoneyUtils.add(account.getBalance(), amount));
    }

    @Transactional
    public BigDecimal overwrite(AccountBalance account, BigDecimal balance) {
        log.warn("Balance of account {} overwritten: {} -> {}", account.getAccountId(), account.getBalance(), balance);
        return store(account, MoneyUtils.scale(balance));
    }

    private BigDecimal store(AccountBalance account, BigDecimal balance) {
        account.setBalance(balance);
        return accountBalanceRepository.save(account).getBalance();
    }

    private void ensureOpen() {
        openLock.lock();
        try {
            accountOpener.openIfMissing();
        } catch (DataIntegrityViolationException ex) {
            log.debug("Account {} was opened by another instance", ledgerProperties.getAccountId());
        } finally {
            openLock.unlock();
        }
    }

    private IllegalStateException missingAccount() {
        return new IllegalStateException("Account " + ledgerProperties.getAccountId() + " could not be opened");
    }
}
