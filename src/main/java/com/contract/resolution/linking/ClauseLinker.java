package com.contract.resolution.linking;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.registry.ContractSnapshot;
import com.contract.resolution.rules.ClauseIdNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites clause mentions in free text into anchors pointing at known clause IDs.
 *
 * <p>A mention is a keyword ({@code Clause}, {@code Sub-clause}, {@code Article},
 * {@code Paragraph}, {@code Sub-paragraph}) followed by a clause number such as
 * {@code 14.1}, {@code 6 A.2 (b)} or {@code 22A.1}. Mentions of unknown clauses are left
 * as they are, and so is text inside tags or inside an {@code <a>} element that is not a
 * clause link. Anchors inserted by an earlier run are stripped back to their label first,
 * so linking is idempotent.</p>
 */
public class ClauseLinker {
    private static final Logger log = LoggerFactory.getLogger(ClauseLinker.class);

    private static final Pattern MENTION = Pattern.compile(
            "\\b(?:sub-?clause|clause|article|sub-?paragraph|paragraph)\\s+"
                    + "(\\d+(?:\\s?[A-Za-z](?![A-Za-z]))?(?:\\.\\d+[A-Za-z]?)*(?:\\s*\\([A-Za-z0-9]{1,4}\\))?)"
                    + "(?=[\\s,;:.)\\]\"']|$)",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private static final Pattern EXISTING_LINK = Pattern.compile(
            "<a\\s+href=\"#clause-[^\"]*\"[^>]*class=\"clause-link\"[^>]*>([^<]*)</a>",
            Pattern.CASE_INSENSITIVE);

    private final ClauseIdNormalizer normalizer;

    public ClauseLinker() {
        this(new ClauseIdNormalizer());
    }

    public ClauseLinker(ClauseIdNormalizer normalizer) {
        this.normalizer = normalizer;
    }

    /**
     * Links every mention whose canonical ID, or one of its variants, is in {@code knownIds}.
     * Only text outside tags and outside any remaining {@code <a>} element is rewritten.
     * Null text yields the empty string.
     */
    public String link(String text, Set<String> knownIds) {
        if (text == null) {
            return "";
        }
        String clean = stripLinks(text);
        if (knownIds == null || knownIds.isEmpty()) {
            return clean;
        }

        StringBuilder out = new StringBuilder(clean.length() + 64);
        int anchorDepth = 0;
        int position = 0;
        int linked = 0;
        Matcher tags = TAG.matcher(clean);
        while (tags.find()) {
            linked += appendLinked(out, clean.substring(position, tags.start()), knownIds, anchorDepth > 0);
            String tag = tags.group().toLowerCase(Locale.ROOT);
            if (tag.startsWith("<a ") || tag.equals("<a>")) {
                anchorDepth++;
            } else if (tag.startsWith("</a")) {
                anchorDepth = Math.max(0, anchorDepth - 1);
            }
            out.append(tags.group());
            position = tags.end();
        }
        linked += appendLinked(out, clean.substring(position), knownIds, anchorDepth > 0);
        if (linked > 0) {
            log.debug("Linked {} clause mention(s)", linked);
        }
        return out.toString();
    }

    /**
     * Links text against the clauses known to a contract snapshot.
     */
    public String link(String text, ContractSnapshot snapshot) {
        return link(text, knownIdsOf(snapshot));
    }

    /**
     * Replaces previously inserted clause anchors by their label.
     */
    public String stripLinks(String text) {
        if (text == null) {
            return "";
        }
        // Nested anchors unwrap one level per pass
        String previous;
        String current = text;
        do {
            previous = current;
            current = EXISTING_LINK.matcher(previous).replaceAll("$1");
        } while (!current.equals(previous));
        return current;
    }

    /**
     * Finds every keyword-prefixed clause mention, known or not, in order of appearance.
     */
    public List<ClauseMention> findMentions(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<ClauseMention> mentions = new ArrayList<>();
        Matcher m = MENTION.matcher(stripLinks(text));
        while (m.find()) {
            mentions.add(new ClauseMention(m.group(), m.group(1), normalizer.normalize(m.group(1)), m.start(), m.end()));
        }
        return mentions;
    }

    /**
     * The known-ID index of a contract: every chunk's canonical ID and its variant spellings.
     */
    public Set<String> knownIdsOf(ContractSnapshot snapshot) {
        Set<String> known = new LinkedHashSet<>();
        for (DocumentChunk chunk : snapshot.getChunks()) {
            if (chunk.hasClauseNumber()) {
                known.addAll(normalizer.variants(chunk.getClauseNumber()).all());
            }
        }
        return Collections.unmodifiableSet(known);
    }

    private int appendLinked(StringBuilder out, String segment, Set<String> knownIds, boolean insideAnchor) {
        if (insideAnchor || segment.isEmpty()) {
            out.append(segment);
            return 0;
        }
        Matcher m = MENTION.matcher(segment);
        int last = 0;
        int linked = 0;
        while (m.find()) {
            Optional<String> target = matchKnown(m.group(1), knownIds);
            if (target.isPresent()) {
                out.append(segment, last, m.start()).append(anchor(target.get(), m.group()));
                last = m.end();
                linked++;
            }
        }
        out.append(segment, last, segment.length());
        return linked;
    }

    // Anchors always carry the canonical spelling of the known ID that matched
    private Optional<String> matchKnown(String rawNumber, Set<String> knownIds) {
        CanonicalClauseId canonical = normalizer.normalize(rawNumber);
        if (canonical.isEmpty()) {
            return Optional.empty();
        }
        if (knownIds.contains(canonical.value())) {
            return Optional.of(canonical.value());
        }
        for (String spelling : normalizer.variants(rawNumber).all()) {
            if (knownIds.contains(spelling)) {
                return Optional.of(normalizer.normalize(spelling).value());
            }
        }
        return Optional.empty();
    }

    static String anchor(String id, String label) {
        return "<a href=\"#clause-" + id + "\" class=\"clause-link\" data-clause-id=\"" + id + "\">" + label + "</a>";
    }
}
