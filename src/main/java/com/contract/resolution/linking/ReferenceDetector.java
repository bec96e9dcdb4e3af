package com.contract.resolution.linking;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.ReferenceType;
import com.contract.resolution.registry.ContractSnapshot;
import com.contract.resolution.rules.ClauseIdNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects clause references in chunk text and classifies them by the words around them.
 *
 * <p>A reference is classified as OVERRIDES when replacement language ({@code delete},
 * {@code replace}, {@code notwithstanding}, ...) occurs within 50 characters of it,
 * SUPPLEMENTS for additive language ({@code add}, {@code insert}, ...), CROSS_REFERENCE
 * for appendix references and MENTIONS otherwise. Self-references and repeated targets
 * are skipped.</p>
 */
public class ReferenceDetector {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDetector.class);

    private static final int CONTEXT_WINDOW = 50;

    private static final Pattern OVERRIDE_CONTEXT = Pattern.compile(
            "\\b(?:delete|deleted|replace|replaced|substitute|substituted|amend|amended|modify|modified"
                    + "|supersede|superseded|override|overridden|notwithstanding|in lieu of)\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern SUPPLEMENT_CONTEXT = Pattern.compile(
            "\\b(?:add|added|addition|additional|supplement|supplemented|insert|inserted"
                    + "|include|included|extend|extended)\\b",
            Pattern.CASE_INSENSITIVE);

    private final ClauseIdNormalizer normalizer;

    public ReferenceDetector() {
        this(new ClauseIdNormalizer());
    }

    public ReferenceDetector(ClauseIdNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Detects references without knowledge of which clauses exist.
     */
    public List<DetectedReference> detect(String text, CanonicalClauseId sourceClause) {
        return detect(text, sourceClause, id -> false);
    }

    /**
     * Detects references, boosting the confidence of targets the predicate knows.
     * Results are ordered by position in the text.
     */
    public List<DetectedReference> detect(String text, CanonicalClauseId sourceClause,
                                          Predicate<CanonicalClauseId> isKnown) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<DetectedReference> references = new ArrayList<>();
        Set<CanonicalClauseId> seen = new HashSet<>();

        for (ReferencePattern referencePattern : ReferencePattern.values()) {
            Matcher m = referencePattern.getPattern().matcher(text);
            while (m.find()) {
                CanonicalClauseId target = normalizer.normalize(stripLeadingZeros(m.group(1)));
                if (target.isEmpty() || target.equals(sourceClause) || !seen.add(target)) {
                    continue;
                }
                String context = text.substring(Math.max(0, m.start() - CONTEXT_WINDOW),
                        Math.min(text.length(), m.end() + CONTEXT_WINDOW));
                references.add(new DetectedReference(
                        target,
                        m.group(),
                        classify(context, referencePattern),
                        referencePattern,
                        m.start(),
                        m.end(),
                        confidence(referencePattern, target, isKnown)));
            }
        }
        references.sort(Comparator.comparingInt(DetectedReference::startIndex));
        return references;
    }

    /**
     * Turns the references detected in a chunk into edges ready for the registry.
     * Detections below {@code threshold} are dropped.
     */
    public List<ClauseReference> toReferences(DocumentChunk chunk, ContractSnapshot snapshot, double threshold) {
        List<DetectedReference> detected = detect(chunk.getContent(), chunk.getCanonicalId(), snapshot::isKnownClause);
        List<ClauseReference> edges = new ArrayList<>();
        for (DetectedReference reference : detected) {
            if (reference.confidence() < threshold) {
                log.debug("Dropped reference '{}' from chunk {} at confidence {}",
                        reference.referenceText(), chunk.getId(), reference.confidence());
                continue;
            }
            edges.add(ClauseReference.builder()
                    .sourceClause(chunk.getCanonicalId())
                    .targetClause(reference.targetClause())
                    .referenceType(reference.referenceType())
                    .sourceDocumentId(chunk.getDocumentId())
                    .sourceChunkId(chunk.getId())
                    .referenceText(reference.referenceText())
                    .confidence(reference.confidence())
                    .build());
        }
        return edges;
    }

    static ReferenceType classify(String context, ReferencePattern pattern) {
        String lower = context.toLowerCase(Locale.ROOT);
        if (OVERRIDE_CONTEXT.matcher(lower).find()) {
            return ReferenceType.OVERRIDES;
        }
        if (SUPPLEMENT_CONTEXT.matcher(lower).find()) {
            return ReferenceType.SUPPLEMENTS;
        }
        if (pattern == ReferencePattern.APPENDIX) {
            return ReferenceType.CROSS_REFERENCE;
        }
        return ReferenceType.MENTIONS;
    }

    static double confidence(ReferencePattern pattern, CanonicalClauseId target,
                             Predicate<CanonicalClauseId> isKnown) {
        double confidence = pattern.getBaseConfidence();
        if (isKnown.test(target)) {
            confidence = Math.min(1.0, confidence + 0.10);
        }
        if (target.segments().size() == 1) {
            confidence *= 0.8;
        }
        return confidence;
    }

    private static String stripLeadingZeros(String number) {
        String stripped = number.trim().replaceFirst("^0+(?=\\d)", "");
        return stripped.isEmpty() ? number : stripped;
    }
}
