package com.folio.backend.repository;

import com.folio.backend.model.NetWorthSnapshot;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface NetWorthSnapshotRepository extends JpaRepository<NetWorthSnapshot, Long> {
    List<NetWorthSnapshot> findByAccountIdOrderByTimestampDescIdDesc(Long accountId, Pageable pageable);
}
