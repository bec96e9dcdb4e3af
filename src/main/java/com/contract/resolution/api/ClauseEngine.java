package com.contract.resolution.api;

import com.contract.resolution.audit.AuditRepository;
import com.contract.resolution.audit.AuditService;
import com.contract.resolution.cache.CacheConfig;
import com.contract.resolution.cache.CacheStats;
import com.contract.resolution.cache.CaffeineEffectiveClauseCache;
import com.contract.resolution.cache.EffectiveClauseCache;
import com.contract.resolution.cache.NoOpEffectiveClauseCache;
import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseIdVariantSet;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.linking.ClauseLinker;
import com.contract.resolution.linking.KeywordHighlighter;
import com.contract.resolution.linking.ReferenceDetector;
import com.contract.resolution.lock.ContractWriteLock;
import com.contract.resolution.lock.LocalContractWriteLock;
import com.contract.resolution.lock.LockConfig;
import com.contract.resolution.logging.LogContext;
import com.contract.resolution.metrics.MetricsService;
import com.contract.resolution.metrics.NoOpMetricsService;
import com.contract.resolution.ordering.ClauseIdComparator;
import com.contract.resolution.registry.ContractRegistry;
import com.contract.resolution.registry.ContractSnapshot;
import com.contract.resolution.registry.OverrideInference;
import com.contract.resolution.registry.RegistryOptions;
import com.contract.resolution.registry.RegistryResult;
import com.contract.resolution.registry.SnapshotEditor;
import com.contract.resolution.registry.SnapshotListener;
import com.contract.resolution.resolver.ClauseResolutionResult;
import com.contract.resolution.resolver.EffectiveClauseResolver;
import com.contract.resolution.resolver.ResolutionOptions;
import com.contract.resolution.rules.ClauseIdNormalizer;
import com.contract.resolution.rules.NormalizationEngine;
import com.contract.resolution.tracing.NoOpTracingService;
import com.contract.resolution.tracing.Span;
import com.contract.resolution.tracing.TracingService;
import com.contract.resolution.validation.ContractValidator;
import com.contract.resolution.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main entry point of the clause resolution library.
 *
 * <p>Holds one {@link ContractRegistry} per contract and exposes normalization, ordering,
 * linking, registry writes, effective-clause resolution and whole-contract validation.</p>
 *
 * <pre>{@code
 * ClauseEngine engine = ClauseEngine.builder()
 *         .cacheConfig(CacheConfig.defaults())
 *         .metricsService(new MicrometerMetricsService(registry))
 *         .build();
 *
 * engine.addDocument(gc);
 * engine.addChunk(chunk);
 * ClauseResolutionResult result = engine.resolve("contract-1", "Clause 14.1");
 * }</pre>
 */
public class ClauseEngine {
    private static final Logger log = LoggerFactory.getLogger(ClauseEngine.class);

    private final ClauseIdNormalizer normalizer;
    private final SnapshotEditor editor;
    private final OverrideInference inference;
    private final EffectiveClauseResolver resolver;
    private final ClauseLinker linker;
    private final KeywordHighlighter highlighter;
    private final ReferenceDetector referenceDetector;
    private final ContractValidator validator;
    private final EffectiveClauseCache cache;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ContractWriteLock writeLock;
    private final ResolutionOptions defaultOptions;
    private final String actorId;
    private final Map<String, ContractRegistry> registries = new ConcurrentHashMap<>();

    private ClauseEngine(Builder builder) {
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        this.normalizer = builder.normalizationEngine != null
                ? new ClauseIdNormalizer(builder.normalizationEngine) : new ClauseIdNormalizer();
        RegistryOptions registryOptions = builder.registryOptions != null
                ? builder.registryOptions : RegistryOptions.defaults();
        this.editor = new SnapshotEditor(normalizer, registryOptions);
        this.inference = new OverrideInference();
        this.resolver = new EffectiveClauseResolver(normalizer, metricsService);
        this.linker = new ClauseLinker(normalizer);
        this.highlighter = new KeywordHighlighter();
        this.referenceDetector = new ReferenceDetector(normalizer);
        this.validator = new ContractValidator(normalizer, registryOptions.getOcrConfidenceThreshold());

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        if (builder.cache != null) {
            this.cache = builder.cache;
        } else if (builder.cacheConfig != null && builder.cacheConfig.enabled()) {
            this.cache = new CaffeineEffectiveClauseCache(builder.cacheConfig);
        } else {
            this.cache = new NoOpEffectiveClauseCache();
        }

        this.writeLock = builder.writeLock != null
                ? builder.writeLock : new LocalContractWriteLock(builder.lockConfig);
        this.defaultOptions = builder.options;
        this.actorId = builder.actorId;

        log.info("ClauseEngine initialized with normalization rules {}", normalizer.ruleNames());
    }

    // ========== Clause identity ==========

    public CanonicalClauseId normalize(String rawClauseNumber) {
        return normalizer.normalize(rawClauseNumber);
    }

    public ClauseIdVariantSet variants(String rawClauseNumber) {
        return normalizer.variants(rawClauseNumber);
    }

    /**
     * Natural order of two clause numbers as written, e.g. {@code 2 < 2.1 < 10}.
     */
    public int compare(String a, String b) {
        return ClauseIdComparator.compareRaw(a, b);
    }

    public List<String> sort(List<String> clauseNumbers) {
        List<String> sorted = new ArrayList<>(clauseNumbers);
        sorted.sort(ClauseIdComparator::compareRaw);
        return sorted;
    }

    // ========== Linking ==========

    /**
     * Links clause mentions in {@code text} to the clauses the contract actually holds.
     */
    public String link(String contractId, String text) {
        return linker.link(text, snapshot(contractId));
    }

    public String highlight(String text, List<String> keywords) {
        return highlighter.highlight(text, keywords);
    }

    // ========== Registry ==========

    /**
     * Returns the registry of a contract, creating an empty one on first use.
     */
    public ContractRegistry registry(String contractId) {
        return registries.computeIfAbsent(contractId, this::createRegistry);
    }

    public ContractSnapshot snapshot(String contractId) {
        ContractRegistry registry = registries.get(contractId);
        return registry != null ? registry.snapshot() : ContractSnapshot.empty(contractId);
    }

    public RegistryResult addDocument(Document document) {
        return registry(document.getContractId()).addDocument(document);
    }

    public RegistryResult addChunk(DocumentChunk chunk) {
        return registry(chunk.getContractId()).addChunk(chunk);
    }

    public RegistryResult addOverride(String contractId, DocumentOverride override) {
        return registry(contractId).addOverride(override);
    }

    public RegistryResult addReference(String contractId, ClauseReference reference) {
        return registry(contractId).addReference(reference);
    }

    public RegistryResult retractOverride(String contractId, String overrideId) {
        return registry(contractId).retractOverride(overrideId);
    }

    public List<DocumentOverride> inferOverrides(String contractId) {
        return registry(contractId).inferOverrides();
    }

    /**
     * Detects the cross-references in a stored chunk and registers those above the
     * configured confidence threshold.
     */
    public List<RegistryResult> detectAndRegisterReferences(String contractId, String chunkId) {
        ContractRegistry registry = registry(contractId);
        ContractSnapshot snapshot = registry.snapshot();
        Optional<DocumentChunk> chunk = snapshot.findChunk(chunkId);
        if (chunk.isEmpty()) {
            throw new IllegalArgumentException("Unknown chunk " + chunkId + " in contract " + contractId);
        }
        List<ClauseReference> references = referenceDetector.toReferences(
                chunk.get(), snapshot, editor.getOptions().getReferenceConfidenceThreshold());
        List<RegistryResult> results = new ArrayList<>(references.size());
        for (ClauseReference reference : references) {
            results.add(registry.addReference(reference));
        }
        log.debug("Registered {} reference(s) detected in chunk {}", results.size(), chunkId);
        return results;
    }

    // ========== Resolution ==========

    public ClauseResolutionResult resolve(String contractId, String rawClauseNumber) {
        return resolve(contractId, rawClauseNumber, defaultOptions);
    }

    /**
     * Resolves the effective clause against the contract's current snapshot.
     * Results are cached per snapshot version, so a write never serves a stale answer.
     */
    public ClauseResolutionResult resolve(String contractId, String rawClauseNumber, ResolutionOptions options) {
        CanonicalClauseId clauseId = normalizer.normalize(rawClauseNumber);
        ContractSnapshot snapshot = snapshot(contractId);

        try (LogContext ctx = LogContext.forResolution(contractId, clauseId.value());
             Span span = tracingService.startContractSpan("clause.resolve", contractId)) {
            span.setAttribute("clauseId", clauseId.value());
            span.setAttribute("snapshotVersion", snapshot.getVersion());

            Optional<ClauseResolutionResult> cached =
                    cache.get(contractId, snapshot.getVersion(), clauseId, options.cacheKey());
            if (cached.isPresent()) {
                metricsService.recordCacheHit();
                span.setAttribute("cacheHit", true);
                span.setStatus(Span.SpanStatus.OK);
                return cached.get();
            }
            metricsService.recordCacheMiss();
            span.setAttribute("cacheHit", false);

            ClauseResolutionResult result = resolver.resolve(clauseId, snapshot, options);
            cache.put(contractId, snapshot.getVersion(), clauseId, options.cacheKey(), result);
            span.setAttribute("success", result.isSuccess());
            span.setStatus(Span.SpanStatus.OK);
            return result;
        }
    }

    // ========== Validation ==========

    public ValidationResult validate(String contractId) {
        try (Span span = tracingService.startContractSpan("contract.validate", contractId)) {
            ValidationResult result = validator.validate(snapshot(contractId));
            span.setAttribute("errors", result.errors().size());
            span.setAttribute("warnings", result.warnings().size());
            span.setStatus(Span.SpanStatus.OK);
            return result;
        }
    }

    // ========== Accessors ==========

    public AuditService getAuditService() {
        return auditService;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public ResolutionOptions getDefaultOptions() {
        return defaultOptions;
    }

    private ContractRegistry createRegistry(String contractId) {
        ContractRegistry registry = ContractRegistry.builder(contractId)
                .editor(editor)
                .inference(inference)
                .writeLock(writeLock)
                .auditService(auditService)
                .metricsService(metricsService)
                .tracingService(tracingService)
                .actorId(actorId)
                .build();
        if (cache instanceof SnapshotListener listener) {
            registry.addListener(listener);
        }
        log.info("Created registry for contract {}", contractId);
        return registry;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ClauseEngine.
     */
    public static class Builder {
        private NormalizationEngine normalizationEngine;
        private RegistryOptions registryOptions;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private AuditService auditService;
        private AuditRepository auditRepository;
        private EffectiveClauseCache cache;
        private CacheConfig cacheConfig;
        private ContractWriteLock writeLock;
        private LockConfig lockConfig = LockConfig.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private String actorId = "system";

        /**
         * Replaces the default clause-number normalization rules.
         */
        public Builder normalizationEngine(NormalizationEngine normalizationEngine) {
            this.normalizationEngine = normalizationEngine;
            return this;
        }

        public Builder registryOptions(RegistryOptions registryOptions) {
            this.registryOptions = registryOptions;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        /**
         * Uses a caller-supplied cache; takes precedence over {@link #cacheConfig(CacheConfig)}.
         */
        public Builder cache(EffectiveClauseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        public Builder writeLock(ContractWriteLock writeLock) {
            this.writeLock = writeLock;
            return this;
        }

        public Builder lockTimeout(Duration timeout) {
            this.lockConfig = new LockConfig(timeout.toMillis(), lockConfig.fair());
            return this;
        }

        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
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

        public ClauseEngine build() {
            if (options == null) {
                throw new IllegalStateException("Resolution options are required");
            }
            if (lockConfig == null) {
                throw new IllegalStateException("Lock configuration is required");
            }
            if (actorId == null || actorId.isBlank()) {
                throw new IllegalStateException("actorId is required");
            }
            return new ClauseEngine(this);
        }
    }
}
