package com.contract.resolution.audit;

import com.contract.resolution.registry.RegistryResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only audit trail of registry mutations, rejections, retractions and inferences.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    /**
     * Records an audit entry.
     */
    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("Audit entry recorded: {} on {} in contract {} by {}",
                entry.action(), entry.subjectId(), entry.contractId(), entry.actorId());
        return entry;
    }

    /**
     * Records the outcome of a registry mutation. Rejections are recorded as
     * {@link AuditAction#MUTATION_REJECTED} with the blocking issue in the details.
     */
    public AuditEntry recordMutation(AuditAction action, String contractId, String subjectId, String actorId,
                                     RegistryResult result) {
        Map<String, Object> details = new HashMap<>();
        AuditAction recorded = action;
        if (result.isRejected()) {
            recorded = AuditAction.MUTATION_REJECTED;
            details.put("attemptedAction", action.name());
            result.blockingIssue().ifPresent(issue -> {
                details.put("code", issue.code().name());
                details.put("message", issue.message());
            });
        } else {
            List<String> warnings = result.warnings().stream().map(w -> w.code().name()).toList();
            if (!warnings.isEmpty()) {
                details.put("warnings", warnings);
            }
            if (!result.affectedClauses().isEmpty()) {
                details.put("affectedClauses", result.affectedClauses().stream().map(Object::toString).sorted().toList());
            }
        }
        return record(AuditEntry.builder()
                .action(recorded)
                .contractId(contractId)
                .subjectId(subjectId)
                .actorId(actorId)
                .snapshotVersion(result.snapshot().getVersion())
                .details(details)
                .build());
    }

    public List<AuditEntry> getEntriesForContract(String contractId) {
        return repository.findByContractId(contractId);
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    public List<AuditEntry> getRecentEntries(int limit) {
        return repository.findRecent(limit);
    }

    public int size() {
        return repository.count();
    }
}
