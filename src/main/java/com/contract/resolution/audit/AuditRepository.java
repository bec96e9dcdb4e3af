package com.contract.resolution.audit;

import java.time.Instant;
import java.util.List;

/**
 * Storage for audit entries. Entries are only ever appended.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findByContractId(String contractId);

    /**
     * Entries about one document, chunk, override or reference.
     */
    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    List<AuditEntry> findRecent(int limit);
}
