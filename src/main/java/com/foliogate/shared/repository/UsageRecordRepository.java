package com.foliogate.shared.repository;

import com.foliogate.shared.model.UsageRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for usage ledger records. Only inserts and reads are used.
 */
@Repository
public interface UsageRecordRepository extends JpaRepository<UsageRecord, UUID>,
        JpaSpecificationExecutor<UsageRecord> {

    List<UsageRecord> findByPrincipalIdOrderByTimestampAsc(String principalId);

    long countByPrincipalIdAndOperationClass(String principalId, String operationClass);
}
