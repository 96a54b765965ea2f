package com.folio.backend.repository;

import com.folio.backend.model.AccountBalance;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface AccountBalanceRepository extends JpaRepository<AccountBalance, Long> {

    Optional<AccountBalance> findByAccountId(Long accountId);

    /**
     * Row lock on the cash register; held until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select a from AccountBalance a where a.accountId = :accountId")
    Optional<AccountBalance> findForUpdate(@Param("accountId") Long accountId);
}
