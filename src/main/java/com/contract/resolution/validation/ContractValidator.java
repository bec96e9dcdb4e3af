package com.contract.resolution.validation;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.ContentType;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentGroup;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.core.model.ReferenceType;
import com.contract.resolution.logging.LogContext;
import com.contract.resolution.ordering.ClauseIdComparator;
import com.contract.resolution.registry.ContractSnapshot;
import com.contract.resolution.rules.ClauseIdNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Whole-contract ingestion checks run over a snapshot.
 */
public class ContractValidator {
    private static final Logger log = LoggerFactory.getLogger(ContractValidator.class);

    static final int OCR_ERROR_LIMIT = 5;
    static final int UNRESOLVED_ERROR_LIMIT = 10;

    private static final Map<String, Pattern> OCR_MISTAKES = ocrMistakes();
    private static final Pattern PIPE_OR_TAB = Pattern.compile("\\t|\\|");
    private static final Pattern ALIGNED_AMOUNTS = Pattern.compile("\\d+\\.\\d{2}\\s+\\d+\\.\\d{2}\\s+\\d+\\.\\d{2}");

    private final ClauseIdNormalizer normalizer;
    private final double ocrConfidenceThreshold;

    public ContractValidator() {
        this(new ClauseIdNormalizer(), 0.8);
    }

    public ContractValidator(ClauseIdNormalizer normalizer, double ocrConfidenceThreshold) {
        this.normalizer = normalizer;
        this.ocrConfidenceThreshold = ocrConfidenceThreshold;
    }

    public ValidationResult validate(ContractSnapshot snapshot) {
        try (LogContext ctx = LogContext.forValidation(snapshot.getContractId())) {
            List<ValidationIssue> issues = new ArrayList<>();
            issues.addAll(checkDuplicateClauses(snapshot));
            issues.addAll(checkClauseNumbers(snapshot));
            issues.addAll(checkOcrConfidence(snapshot));
            issues.addAll(checkDuplicateContent(snapshot));
            issues.addAll(checkAddendumOrder(snapshot));
            issues.addAll(checkConditionsOverrides(snapshot));
            issues.addAll(checkTableExtraction(snapshot));
            issues.addAll(checkUnresolvedReferences(snapshot));
            issues.addAll(checkNamingConventions(snapshot));
            issues.addAll(checkAddendumConflicts(snapshot));

            List<ValidationIssue> errors = issues.stream().filter(ValidationIssue::isError).toList();
            List<ValidationIssue> warnings = issues.stream().filter(i -> !i.isError()).toList();
            ValidationSummary summary = new ValidationSummary(
                    snapshot.documentCount(),
                    snapshot.getChunks().size(),
                    snapshot.getReferences().size(),
                    snapshot.unresolvedReferences().size(),
                    lowConfidenceChunks(snapshot).size());

            log.info("Validated contract {} at version {}: {} error(s), {} warning(s)",
                    snapshot.getContractId(), snapshot.getVersion(), errors.size(), warnings.size());
            return new ValidationResult(snapshot.getContractId(), snapshot.getVersion(), errors, warnings, summary);
        }
    }

    List<ValidationIssue> checkDuplicateClauses(ContractSnapshot snapshot) {
        Map<String, List<DocumentChunk>> groups = new LinkedHashMap<>();
        for (DocumentChunk chunk : snapshot.liveChunks()) {
            if (chunk.hasClauseNumber()) {
                groups.computeIfAbsent(chunk.getDocumentId() + "|" + chunk.getCanonicalId(), k -> new ArrayList<>())
                        .add(chunk);
            }
        }
        List<ValidationIssue> issues = new ArrayList<>();
        for (List<DocumentChunk> chunks : groups.values()) {
            if (chunks.size() > 1) {
                DocumentChunk first = chunks.get(0);
                issues.add(ValidationIssue.builder(ErrorCode.DUPLICATE_CLAUSE, Severity.ERROR)
                        .message("Clause '" + first.getCanonicalId() + "' appears " + chunks.size()
                                + " times in document " + first.getDocumentId())
                        .documentId(first.getDocumentId())
                        .clauseId(first.getCanonicalId().value())
                        .relatedIds(chunks.stream().map(DocumentChunk::getId).toList())
                        .build());
            }
        }
        return issues;
    }

    List<ValidationIssue> checkClauseNumbers(ContractSnapshot snapshot) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (DocumentChunk chunk : snapshot.liveChunks()) {
            String raw = chunk.getClauseNumber();
            if (!raw.isBlank() && !normalizer.isWellFormed(raw)) {
                issues.add(ValidationIssue.builder(ErrorCode.INVALID_CLAUSE_NUMBER, Severity.WARNING)
                        .message("Clause number '" + raw + "' is not well formed")
                        .documentId(chunk.getDocumentId())
                        .chunkId(chunk.getId())
                        .clauseId(chunk.getCanonicalId().value())
                        .build());
            }
        }
        return issues;
    }

    List<ValidationIssue> checkOcrConfidence(ContractSnapshot snapshot) {
        List<DocumentChunk> low = lowConfidenceChunks(snapshot);
        Severity severity = low.size() > OCR_ERROR_LIMIT ? Severity.ERROR : Severity.WARNING;
        List<ValidationIssue> issues = new ArrayList<>();
        for (DocumentChunk chunk : low) {
            List<String> suspicious = detectOcrErrors(chunk.getContent());
            String message = String.format("Confidence %.2f below %.2f", chunk.getConfidence(), ocrConfidenceThreshold)
                    + (suspicious.isEmpty() ? "" : "; suspected: " + String.join(", ", suspicious));
            issues.add(ValidationIssue.builder(ErrorCode.OCR_CONFIDENCE_LOW, severity)
                    .message(message)
                    .documentId(chunk.getDocumentId())
                    .chunkId(chunk.getId())
                    .clauseId(chunk.getCanonicalId().value())
                    .build());
        }
        return issues;
    }

    List<ValidationIssue> checkDuplicateContent(ContractSnapshot snapshot) {
        Map<String, List<DocumentChunk>> byHash = new LinkedHashMap<>();
        for (DocumentChunk chunk : snapshot.liveChunks()) {
            byHash.computeIfAbsent(chunk.getContentHash(), k -> new ArrayList<>()).add(chunk);
        }
        List<ValidationIssue> issues = new ArrayList<>();
        for (List<DocumentChunk> chunks : byHash.values()) {
            long documents = chunks.stream().map(DocumentChunk::getDocumentId).distinct().count();
            if (documents < 2) {
                continue;
            }
            for (int i = 0; i < chunks.size() - 1; i++) {
                DocumentChunk a = chunks.get(i);
                DocumentChunk b = chunks.get(i + 1);
                issues.add(ValidationIssue.builder(ErrorCode.DUPLICATE_CHUNK, Severity.WARNING)
                        .message("Identical content in chunks " + a.getId() + " and " + b.getId() + ": " + a.preview())
                        .documentId(b.getDocumentId())
                        .chunkId(b.getId())
                        .relatedIds(List.of(a.getId()))
                        .build());
            }
        }
        return issues;
    }

    List<ValidationIssue> checkAddendumOrder(ContractSnapshot snapshot) {
        List<Document> addendums = addendums(snapshot);
        List<ValidationIssue> issues = new ArrayList<>();
        for (int i = 1; i < addendums.size(); i++) {
            Document previous = addendums.get(i - 1);
            Document current = addendums.get(i);
            if (current.getEffectiveDate().isEmpty()) {
                issues.add(ValidationIssue.builder(ErrorCode.ADDENDUM_ORDER, Severity.WARNING)
                        .message("Addendum " + current.getCode() + " is missing its effective date")
                        .documentId(current.getId())
                        .build());
            } else if (previous.getEffectiveDate().isPresent()
                    && current.getEffectiveDate().get().isBefore(previous.getEffectiveDate().get())) {
                issues.add(ValidationIssue.builder(ErrorCode.ADDENDUM_ORDER, Severity.ERROR)
                        .message("Addendum " + current.getCode() + " (" + current.getEffectiveDate().get()
                                + ") is dated before " + previous.getCode() + " (" + previous.getEffectiveDate().get() + ")")
                        .documentId(current.getId())
                        .relatedIds(List.of(previous.getId()))
                        .build());
            }
        }
        return issues;
    }

    List<ValidationIssue> checkConditionsOverrides(ContractSnapshot snapshot) {
        List<Document> particular = snapshot.getDocuments().stream().filter(Document::isParticularConditions).toList();
        List<Document> general = snapshot.getDocuments().stream()
                .filter(d -> d.getGroup() == DocumentGroup.C && !d.isParticularConditions()).toList();
        List<ValidationIssue> issues = new ArrayList<>();
        for (Document pc : particular) {
            for (Document gc : general) {
                Set<CanonicalClauseId> shared = new LinkedHashSet<>(clauseIdsOf(snapshot, pc));
                shared.retainAll(clauseIdsOf(snapshot, gc));
                for (CanonicalClauseId clause : sorted(shared)) {
                    if (!hasOverride(snapshot, pc, gc, clause) && !hasOverrideReference(snapshot, pc, clause)) {
                        issues.add(ValidationIssue.builder(ErrorCode.MISSING_PC_OVERRIDE, Severity.WARNING)
                                .message("Clause '" + clause + "' exists in " + pc.getCode() + " and " + gc.getCode()
                                        + " but no override relationship is recorded")
                                .documentId(pc.getId())
                                .clauseId(clause.value())
                                .relatedIds(List.of(gc.getId()))
                                .build());
                    }
                }
            }
        }
        return issues;
    }

    List<ValidationIssue> checkTableExtraction(ContractSnapshot snapshot) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Document boq : snapshot.getDocuments()) {
            if (boq.getGroup() != DocumentGroup.I) {
                continue;
            }
            List<DocumentChunk> chunks = snapshot.chunksOf(boq.getId());
            if (!chunks.isEmpty() && chunks.stream().noneMatch(c -> c.getContentType() == ContentType.TABLE)) {
                issues.add(ValidationIssue.builder(ErrorCode.TABLE_EXTRACTION_FAILED, Severity.WARNING)
                        .message("BOQ document " + boq.getCode() + " has no table chunks; it may have been extracted as plain text")
                        .documentId(boq.getId())
                        .build());
            }
            for (DocumentChunk chunk : chunks) {
                if (chunk.getContentType() == ContentType.TEXT && looksTabular(chunk.getContent())) {
                    issues.add(ValidationIssue.builder(ErrorCode.TABLE_EXTRACTION_FAILED, Severity.WARNING)
                            .message("Text chunk appears to contain tabular data: " + chunk.preview())
                            .documentId(boq.getId())
                            .chunkId(chunk.getId())
                            .build());
                }
            }
        }
        return issues;
    }

    List<ValidationIssue> checkUnresolvedReferences(ContractSnapshot snapshot) {
        List<ClauseReference> unresolved = snapshot.unresolvedReferences();
        Severity severity = unresolved.size() > UNRESOLVED_ERROR_LIMIT ? Severity.ERROR : Severity.WARNING;
        return unresolved.stream()
                .map(r -> ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, severity)
                        .message("Reference from '" + r.sourceClause() + "' to '" + r.targetClause() + "' cannot be resolved")
                        .documentId(r.sourceDocumentId())
                        .chunkId(r.sourceChunkId())
                        .clauseId(r.targetClause().value())
                        .relatedIds(List.of(r.id()))
                        .build())
                .toList();
    }

    List<ValidationIssue> checkNamingConventions(ContractSnapshot snapshot) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (Document document : snapshot.getDocuments()) {
            issues.addAll(NamingConventions.check(document));
        }
        return issues;
    }

    List<ValidationIssue> checkAddendumConflicts(ContractSnapshot snapshot) {
        Map<CanonicalClauseId, List<Document>> amendedIn = new TreeMap<>(ClauseIdComparator.INSTANCE);
        for (Document addendum : addendums(snapshot)) {
            for (CanonicalClauseId clause : clauseIdsOf(snapshot, addendum)) {
                amendedIn.computeIfAbsent(clause, k -> new ArrayList<>()).add(addendum);
            }
        }
        List<ValidationIssue> issues = new ArrayList<>();
        amendedIn.forEach((clause, documents) -> {
            if (documents.size() > 1) {
                issues.add(ValidationIssue.builder(ErrorCode.ADDENDUM_ORDER, Severity.WARNING)
                        .message("Clause '" + clause + "' is modified in " + documents.size() + " different addendums")
                        .clauseId(clause.value())
                        .relatedIds(documents.stream().map(Document::getId).toList())
                        .build());
            }
        });
        return issues;
    }

    private List<DocumentChunk> lowConfidenceChunks(ContractSnapshot snapshot) {
        return snapshot.liveChunks().stream().filter(c -> c.getConfidence() < ocrConfidenceThreshold).toList();
    }

    static List<String> detectOcrErrors(String text) {
        List<String> found = new ArrayList<>();
        OCR_MISTAKES.forEach((description, pattern) -> {
            if (pattern.matcher(text).find()) {
                found.add(description);
            }
        });
        return found;
    }

    static boolean looksTabular(String text) {
        String[] lines = text.split("\n", -1);
        int tabular = 0;
        for (String line : lines) {
            if (PIPE_OR_TAB.split(line, -1).length > 3) {
                tabular++;
            }
            if (ALIGNED_AMOUNTS.matcher(line).find()) {
                tabular++;
            }
        }
        return tabular > lines.length * 0.3;
    }

    private static List<Document> addendums(ContractSnapshot snapshot) {
        return snapshot.getDocuments().stream()
                .filter(d -> d.getGroup() == DocumentGroup.D)
                .sorted(Comparator.comparingInt(Document::getSequence))
                .toList();
    }

    private static Set<CanonicalClauseId> clauseIdsOf(ContractSnapshot snapshot, Document document) {
        Set<CanonicalClauseId> ids = new LinkedHashSet<>();
        for (DocumentChunk chunk : snapshot.liveChunks()) {
            if (chunk.getDocumentId().equals(document.getId()) && chunk.hasClauseNumber()) {
                ids.add(chunk.getCanonicalId());
            }
        }
        return ids;
    }

    private static List<CanonicalClauseId> sorted(Set<CanonicalClauseId> ids) {
        List<CanonicalClauseId> list = new ArrayList<>(ids);
        list.sort(ClauseIdComparator.INSTANCE);
        return list;
    }

    private static boolean hasOverride(ContractSnapshot snapshot, Document pc, Document gc, CanonicalClauseId clause) {
        for (DocumentOverride override : snapshot.getOverrides()) {
            if (override.connects(pc.getId(), gc.getId()) && override.covers(clause)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasOverrideReference(ContractSnapshot snapshot, Document pc, CanonicalClauseId clause) {
        for (ClauseReference reference : snapshot.getReferences()) {
            if (reference.referenceType() == ReferenceType.OVERRIDES
                    && pc.getId().equals(reference.sourceDocumentId())
                    && (reference.targetClause().equals(clause) || reference.sourceClause().equals(clause))) {
                return true;
            }
        }
        return false;
    }

    private static Map<String, Pattern> ocrMistakes() {
        Map<String, Pattern> mistakes = new LinkedHashMap<>();
        mistakes.put("O/0 substitution in numbers", Pattern.compile("\\b(\\d+)[oO](\\d+)\\b"));
        mistakes.put("1/I/l confusion", Pattern.compile("\\b[1Il][A-Za-z]"));
        mistakes.put("rn/m confusion", Pattern.compile("\\brn\\b"));
        mistakes.put("vv/w confusion", Pattern.compile("\\bvv\\b"));
        mistakes.put("Letter in day count", Pattern.compile("\\b(\\d+)[A-Za-z](\\d+)\\s*days?\\b", Pattern.CASE_INSENSITIVE));
        mistakes.put("Inconsistent number formatting", Pattern.compile("\\b(\\d+)[.,](\\d{3})[.,](\\d+)\\b"));
        return mistakes;
    }
}
