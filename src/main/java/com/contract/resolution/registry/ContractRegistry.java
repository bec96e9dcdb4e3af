package com.contract.resolution.registry;

import com.contract.resolution.audit.AuditAction;
import com.contract.resolution.audit.AuditService;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.lock.ContractWriteLock;
import com.contract.resolution.lock.LocalContractWriteLock;
import com.contract.resolution.logging.LogContext;
import com.contract.resolution.metrics.MetricsService;
import com.contract.resolution.metrics.NoOpMetricsService;
import com.contract.resolution.tracing.NoOpTracingService;
import com.contract.resolution.tracing.Span;
import com.contract.resolution.tracing.TracingService;
import com.contract.resolution.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * The single writer of one contract.
 *
 * <p>Writes are serialized through a per-contract lock, applied by the {@link SnapshotEditor}
 * and, when accepted, published atomically as the new current snapshot. Readers call
 * {@link #snapshot()} and work on that immutable value, so they never observe a partial update.
 * Every write is audited and every publication is announced to registered listeners.</p>
 */
public class ContractRegistry {
    private static final Logger log = LoggerFactory.getLogger(ContractRegistry.class);

    private final String contractId;
    private final SnapshotEditor editor;
    private final OverrideInference inference;
    private final ContractWriteLock writeLock;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final String actorId;
    private final AtomicReference<ContractSnapshot> current;
    private final List<SnapshotListener> listeners = new CopyOnWriteArrayList<>();

    private ContractRegistry(Builder builder) {
        this.contractId = builder.contractId;
        this.editor = builder.editor;
        this.inference = builder.inference;
        this.writeLock = builder.writeLock;
        this.auditService = builder.auditService;
        this.metricsService = builder.metricsService;
        this.tracingService = builder.tracingService;
        this.actorId = builder.actorId;
        ContractSnapshot initial = builder.initialSnapshot != null
                ? builder.initialSnapshot : ContractSnapshot.empty(contractId);
        if (!initial.getContractId().equals(contractId)) {
            throw new IllegalArgumentException("Initial snapshot belongs to contract " + initial.getContractId());
        }
        this.current = new AtomicReference<>(initial);
    }

    public String getContractId() {
        return contractId;
    }

    /**
     * The current snapshot. Never changes once returned.
     */
    public ContractSnapshot snapshot() {
        return current.get();
    }

    public void addListener(SnapshotListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener is required"));
    }

    public void removeListener(SnapshotListener listener) {
        listeners.remove(listener);
    }

    public RegistryResult addDocument(Document document) {
        return write("addDocument", AuditAction.DOCUMENT_ADDED, document.getId(),
                s -> editor.addDocument(s, document));
    }

    public RegistryResult addChunk(DocumentChunk chunk) {
        return write("addChunk", AuditAction.CHUNK_ADDED, chunk.getId(),
                s -> editor.addChunk(s, chunk));
    }

    public RegistryResult addOverride(DocumentOverride override) {
        return write("addOverride", AuditAction.OVERRIDE_DECLARED, override.id(),
                s -> editor.addOverride(s, override));
    }

    public RegistryResult addReference(ClauseReference reference) {
        return write("addReference", AuditAction.REFERENCE_ADDED, reference.id(),
                s -> editor.addReference(s, reference));
    }

    /**
     * Removes an override. Listeners learn which clause IDs it affected.
     */
    public RegistryResult retractOverride(String overrideId) {
        RegistryResult result = write("retractOverride", AuditAction.OVERRIDE_RETRACTED, overrideId,
                s -> editor.retractOverride(s, overrideId));
        if (result.isAccepted()) {
            for (SnapshotListener listener : listeners) {
                try {
                    listener.onOverrideRetracted(contractId, overrideId, result.affectedClauses());
                } catch (RuntimeException e) {
                    log.warn("Snapshot listener {} failed on retraction of {}", listener, overrideId, e);
                }
            }
        }
        return result;
    }

    /**
     * Adds the overrides implied by the contract structure. Proposals that would close a
     * cycle are rejected by the editor and skipped.
     *
     * @return the accepted inferences
     */
    public List<DocumentOverride> inferOverrides() {
        List<DocumentOverride> accepted = new ArrayList<>();
        for (DocumentOverride proposal : inference.infer(snapshot())) {
            RegistryResult result = write("inferOverride", AuditAction.OVERRIDE_INFERRED, proposal.id(),
                    s -> editor.addOverride(s, proposal));
            if (result.isAccepted()) {
                accepted.add(proposal);
                metricsService.incrementOverrideInferred();
            } else {
                log.info("Skipped inferred override {}: {}", proposal.id(),
                        result.blockingIssue().map(ValidationIssue::message).orElse("rejected"));
            }
        }
        return accepted;
    }

    private RegistryResult write(String operation, AuditAction action, String subjectId,
                                 Function<ContractSnapshot, RegistryResult> mutation) {
        writeLock.lock(contractId);
        try (LogContext ctx = LogContext.forMutation(contractId, operation);
             Span span = tracingService.startContractSpan("registry." + operation, contractId)) {
            ContractSnapshot before = current.get();
            RegistryResult result = mutation.apply(before);
            span.setAttribute("accepted", result.isAccepted());

            if (result.isAccepted()) {
                metricsService.incrementMutationAccepted(operation);
                if (result.snapshot().getVersion() != before.getVersion()) {
                    current.set(result.snapshot());
                    metricsService.recordSnapshotVersion(contractId, result.snapshot().getVersion());
                    span.setAttribute("version", result.snapshot().getVersion());
                    publish(result.snapshot());
                }
                span.setStatus(Span.SpanStatus.OK);
            } else {
                result.blockingIssue().ifPresent(issue ->
                        metricsService.incrementMutationRejected(operation, issue.code()));
                span.setStatus(Span.SpanStatus.ERROR);
            }
            auditService.recordMutation(action, contractId, subjectId, actorId, result);
            return result;
        } finally {
            writeLock.unlock(contractId);
        }
    }

    private void publish(ContractSnapshot snapshot) {
        for (SnapshotListener listener : listeners) {
            try {
                listener.onSnapshotPublished(snapshot);
            } catch (RuntimeException e) {
                log.warn("Snapshot listener {} failed on version {}", listener, snapshot.getVersion(), e);
            }
        }
    }

    public static Builder builder(String contractId) {
        return new Builder(contractId);
    }

    public static class Builder {
        private final String contractId;
        private SnapshotEditor editor;
        private OverrideInference inference;
        private ContractWriteLock writeLock;
        private AuditService auditService;
        private MetricsService metricsService;
        private TracingService tracingService;
        private String actorId = "system";
        private ContractSnapshot initialSnapshot;

        private Builder(String contractId) {
            this.contractId = contractId;
        }

        public Builder editor(SnapshotEditor editor) {
            this.editor = editor;
            return this;
        }

        public Builder inference(OverrideInference inference) {
            this.inference = inference;
            return this;
        }

        public Builder writeLock(ContractWriteLock writeLock) {
            this.writeLock = writeLock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        /**
         * Starts from a caller-supplied snapshot instead of an empty one.
         */
        public Builder initialSnapshot(ContractSnapshot initialSnapshot) {
            this.initialSnapshot = initialSnapshot;
            return this;
        }

        public ContractRegistry build() {
            Objects.requireNonNull(contractId, "contractId is required");
            if (editor == null) editor = new SnapshotEditor();
            if (inference == null) inference = new OverrideInference();
            if (writeLock == null) writeLock = new LocalContractWriteLock();
            if (auditService == null) auditService = new AuditService();
            if (metricsService == null) metricsService = new NoOpMetricsService();
            if (tracingService == null) tracingService = new NoOpTracingService();
            return new ContractRegistry(this);
        }
    }
}
