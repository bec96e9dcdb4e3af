package com.contract.resolution.resolver;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentStatus;
import com.contract.resolution.core.model.EffectiveClause;
import com.contract.resolution.core.model.ResolutionTier;
import com.contract.resolution.core.model.SupersededChunk;
import com.contract.resolution.metrics.MetricsService;
import com.contract.resolution.metrics.NoOpMetricsService;
import com.contract.resolution.registry.ContractSnapshot;
import com.contract.resolution.registry.OverrideGraph;
import com.contract.resolution.rules.ClauseIdNormalizer;
import com.contract.resolution.validation.ErrorCode;
import com.contract.resolution.validation.Severity;
import com.contract.resolution.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Picks the authoritative chunk for a clause ID within a contract snapshot.
 *
 * <p>Candidates are the live chunks carrying the ID. Every pair of candidates is decided
 * by the first tier that separates them:</p>
 * <ol>
 *   <li>a clause-specific override listing the clause</li>
 *   <li>a partial override covering the clause</li>
 *   <li>a full override</li>
 *   <li>an OVERRIDES or AMENDS reference to the clause from one of the two documents</li>
 *   <li>group precedence</li>
 *   <li>the higher sequence within one group</li>
 * </ol>
 * <p>Override chains are followed transitively. The winner must beat every other candidate;
 * if no candidate does, the clause is reported as ambiguous. Resolution reads the snapshot
 * only and is deterministic for a given snapshot.</p>
 */
public class EffectiveClauseResolver {
    private static final Logger log = LoggerFactory.getLogger(EffectiveClauseResolver.class);

    private static final Comparator<SupersededChunk> SUPERSEDED_ORDER = Comparator
            .comparing(SupersededChunk::group)
            .thenComparingInt(SupersededChunk::sequence)
            .thenComparing(SupersededChunk::chunkId);

    private final ClauseIdNormalizer normalizer;
    private final MetricsService metricsService;

    public EffectiveClauseResolver() {
        this(new ClauseIdNormalizer(), new NoOpMetricsService());
    }

    public EffectiveClauseResolver(ClauseIdNormalizer normalizer, MetricsService metricsService) {
        this.normalizer = normalizer;
        this.metricsService = metricsService;
    }

    /**
     * Resolves a raw clause number, normalizing it first.
     */
    public ClauseResolutionResult resolve(String rawClauseNumber, ContractSnapshot snapshot) {
        return resolve(normalizer.normalize(rawClauseNumber), snapshot, ResolutionOptions.defaults());
    }

    public ClauseResolutionResult resolve(CanonicalClauseId clauseId, ContractSnapshot snapshot) {
        return resolve(clauseId, snapshot, ResolutionOptions.defaults());
    }

    public ClauseResolutionResult resolve(CanonicalClauseId clauseId, ContractSnapshot snapshot,
                                          ResolutionOptions options) {
        long start = System.nanoTime();
        ClauseResolutionResult result = doResolve(clauseId, snapshot, options);
        String outcome = result.isSuccess() ? "resolved" : result.issue().code().name();
        metricsService.recordResolutionDuration(outcome, Duration.ofNanos(System.nanoTime() - start));
        return result;
    }

    private ClauseResolutionResult doResolve(CanonicalClauseId clauseId, ContractSnapshot snapshot,
                                             ResolutionOptions options) {
        long version = snapshot.getVersion();
        List<ValidationIssue> warnings = new ArrayList<>();
        if (clauseId.isEmpty()) {
            return ClauseResolutionResult.failure(
                    ValidationIssue.error(ErrorCode.UNRESOLVED_REFERENCE, "Empty clause ID"), warnings, version);
        }

        CanonicalClauseId matched = clauseId;
        List<DocumentChunk> candidates = candidatesFor(clauseId, snapshot, options);
        boolean fuzzy = false;
        if (candidates.isEmpty() && options.isFuzzyMatching()) {
            for (String variant : normalizer.variants(clauseId).alternates()) {
                if (!CanonicalClauseId.isCanonical(variant)) {
                    continue;
                }
                CanonicalClauseId alternate = CanonicalClauseId.of(variant);
                List<DocumentChunk> found = candidatesFor(alternate, snapshot, options);
                if (!found.isEmpty()) {
                    matched = alternate;
                    candidates = found;
                    fuzzy = true;
                    break;
                }
            }
            if (fuzzy) {
                metricsService.incrementFuzzyMatch();
                warnings.add(ValidationIssue.builder(ErrorCode.INVALID_CLAUSE_NUMBER, Severity.WARNING)
                        .message("No chunk carries '" + clauseId + "'; matched variant '" + matched + "'")
                        .clauseId(clauseId.value())
                        .build());
            }
        }

        if (candidates.isEmpty()) {
            return ClauseResolutionResult.failure(ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, Severity.ERROR)
                    .message("No chunk carries clause '" + clauseId + "' or any of its variants")
                    .clauseId(clauseId.value())
                    .build(), warnings, version);
        }

        Map<String, List<String>> byDocument = new LinkedHashMap<>();
        for (DocumentChunk chunk : candidates) {
            byDocument.computeIfAbsent(chunk.getDocumentId(), k -> new ArrayList<>()).add(chunk.getId());
        }
        for (Map.Entry<String, List<String>> entry : byDocument.entrySet()) {
            if (entry.getValue().size() > 1) {
                return ClauseResolutionResult.failure(ValidationIssue.builder(ErrorCode.DUPLICATE_CLAUSE, Severity.ERROR)
                        .message("Document " + entry.getKey() + " holds " + entry.getValue().size()
                                + " live chunks for clause '" + matched + "'")
                        .documentId(entry.getKey())
                        .clauseId(matched.value())
                        .relatedIds(entry.getValue())
                        .build(), warnings, version);
            }
        }

        DocumentChunk winner = null;
        List<SupersededChunk> overriddenBy = new ArrayList<>();
        for (DocumentChunk candidate : candidates) {
            List<SupersededChunk> beaten = beatsAll(candidate, candidates, matched, snapshot, options);
            if (beaten != null) {
                winner = candidate;
                overriddenBy.addAll(beaten);
                beaten.forEach(s -> metricsService.incrementContestDecided(s.tier()));
                break;
            }
        }

        if (winner == null) {
            List<String> tied = candidates.stream().map(DocumentChunk::getId).sorted().toList();
            return ClauseResolutionResult.failure(ValidationIssue.builder(ErrorCode.MISSING_PC_OVERRIDE, Severity.ERROR)
                    .message("No candidate for clause '" + matched + "' prevails over all others; tied chunks " + tied)
                    .clauseId(matched.value())
                    .relatedIds(tied)
                    .build(), warnings, version);
        }

        for (DocumentChunk chunk : snapshot.getChunks()) {
            if (snapshot.isSuperseded(chunk.getId()) && chunk.getCanonicalId().equals(matched)
                    && eligible(chunk, snapshot, options)) {
                overriddenBy.add(superseded(chunk, snapshot, ResolutionTier.REINGESTED));
            }
        }
        overriddenBy.sort(SUPERSEDED_ORDER);

        EffectiveClause clause = new EffectiveClause(clauseId, matched, winner.getId(), winner.getDocumentId(),
                overriddenBy, fuzzy);
        log.debug("Clause '{}' resolved to chunk {} in document {}; {} superseded",
                clauseId, winner.getId(), winner.getDocumentId(), overriddenBy.size());
        return ClauseResolutionResult.success(clause, warnings, version);
    }

    /**
     * Returns the chunks {@code candidate} supersedes when it beats every other candidate, otherwise null.
     */
    private List<SupersededChunk> beatsAll(DocumentChunk candidate, List<DocumentChunk> candidates,
                                           CanonicalClauseId clauseId, ContractSnapshot snapshot,
                                           ResolutionOptions options) {
        List<SupersededChunk> beaten = new ArrayList<>();
        for (DocumentChunk other : candidates) {
            if (other == candidate) {
                continue;
            }
            Optional<Contest> contest = contest(candidate, other, clauseId, snapshot, options);
            if (contest.isEmpty() || contest.get().winner() != candidate) {
                return null;
            }
            beaten.add(superseded(other, snapshot, contest.get().tier()));
        }
        return beaten;
    }

    /**
     * Decides a pair of candidates by the first tier that separates them.
     */
    Optional<Contest> contest(DocumentChunk a, DocumentChunk b, CanonicalClauseId clauseId,
                              ContractSnapshot snapshot, ResolutionOptions options) {
        Document docA = document(snapshot, a);
        Document docB = document(snapshot, b);

        Optional<ResolutionTier> aOverB = OverrideGraph.strongestTier(snapshot, docA.getId(), docB.getId(), clauseId);
        Optional<ResolutionTier> bOverA = OverrideGraph.strongestTier(snapshot, docB.getId(), docA.getId(), clauseId);
        if (aOverB.isPresent() && (bOverA.isEmpty() || aOverB.get().compareTo(bOverA.get()) < 0)) {
            return decided(a, b, aOverB.get());
        }
        if (bOverA.isPresent() && (aOverB.isEmpty() || bOverA.get().compareTo(aOverB.get()) < 0)) {
            return decided(b, a, bOverA.get());
        }

        if (options.isReferenceIntent()) {
            boolean intentA = hasOverrideIntent(snapshot, docA, clauseId);
            boolean intentB = hasOverrideIntent(snapshot, docB, clauseId);
            if (intentA != intentB) {
                return intentA
                        ? decided(a, b, ResolutionTier.REFERENCE_INTENT)
                        : decided(b, a, ResolutionTier.REFERENCE_INTENT);
            }
        }

        int byGroup = GroupPrecedence.compare(docA, docB);
        if (byGroup != 0) {
            return byGroup > 0
                    ? decided(a, b, ResolutionTier.GROUP_PRECEDENCE)
                    : decided(b, a, ResolutionTier.GROUP_PRECEDENCE);
        }

        if (docA.getGroup() == docB.getGroup() && docA.getSequence() != docB.getSequence()) {
            return docA.getSequence() > docB.getSequence()
                    ? decided(a, b, ResolutionTier.SEQUENCE)
                    : decided(b, a, ResolutionTier.SEQUENCE);
        }

        log.debug("Contest between chunks {} and {} for '{}' is undecided", a.getId(), b.getId(), clauseId);
        return Optional.empty();
    }

    private static Optional<Contest> decided(DocumentChunk winner, DocumentChunk loser, ResolutionTier tier) {
        log.debug("Chunk {} prevails over {} at tier {}", winner.getId(), loser.getId(), tier);
        return Optional.of(new Contest(winner, tier));
    }

    private static boolean hasOverrideIntent(ContractSnapshot snapshot, Document document, CanonicalClauseId clauseId) {
        for (ClauseReference reference : snapshot.getReferences()) {
            if (reference.referenceType().expressesOverrideIntent()
                    && reference.targetClause().equals(clauseId)
                    && document.getId().equals(reference.sourceDocumentId())) {
                return true;
            }
        }
        return false;
    }

    private static List<DocumentChunk> candidatesFor(CanonicalClauseId clauseId, ContractSnapshot snapshot,
                                                     ResolutionOptions options) {
        return snapshot.liveChunks().stream()
                .filter(c -> c.getCanonicalId().equals(clauseId))
                .filter(c -> eligible(c, snapshot, options))
                .toList();
    }

    private static boolean eligible(DocumentChunk chunk, ContractSnapshot snapshot, ResolutionOptions options) {
        return snapshot.findDocument(chunk.getDocumentId())
                .filter(d -> d.getStatus() != DocumentStatus.ERROR)
                .filter(d -> options.includes(d.getGroup()))
                .isPresent();
    }

    private static SupersededChunk superseded(DocumentChunk chunk, ContractSnapshot snapshot, ResolutionTier tier) {
        Document document = document(snapshot, chunk);
        return new SupersededChunk(chunk.getId(), document.getId(), document.getGroup(), document.getSequence(), tier);
    }

    private static Document document(ContractSnapshot snapshot, DocumentChunk chunk) {
        return snapshot.findDocument(chunk.getDocumentId())
                .orElseThrow(() -> new IllegalStateException("Chunk " + chunk.getId() + " has no document in snapshot"));
    }

    /**
     * Outcome of a decided pairwise contest.
     */
    record Contest(DocumentChunk winner, ResolutionTier tier) {
    }
}
