package com.contract.resolution.linking;

import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Wraps search keywords in {@code <mark class="highlight-keyword">}.
 *
 * Text inside tags, inside an existing highlight and inside a clause link is left alone.
 * All keywords are matched in one pass, longest first, so a longer keyword wins over a
 * shorter one it contains.
 */
public class KeywordHighlighter {

    static final String OPEN_MARK = "<mark class=\"highlight-keyword\">";
    static final String CLOSE_MARK = "</mark>";

    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    public String highlight(String text, List<String> keywords) {
        if (text == null) {
            return "";
        }
        Pattern pattern = compile(keywords);
        if (pattern == null) {
            return text;
        }

        StringBuilder out = new StringBuilder(text.length() + 64);
        int linkDepth = 0;
        int markDepth = 0;
        int anchorDepth = 0;
        int position = 0;
        Matcher tags = TAG.matcher(text);
        while (tags.find()) {
            appendText(out, text.substring(position, tags.start()), pattern, linkDepth > 0 || markDepth > 0);
            String tag = tags.group();
            String lower = tag.toLowerCase(Locale.ROOT);
            if (lower.startsWith("<a ") || lower.equals("<a>")) {
                anchorDepth++;
                if (lower.contains("clause-link")) {
                    linkDepth = anchorDepth;
                }
            } else if (lower.startsWith("</a")) {
                if (linkDepth == anchorDepth) {
                    linkDepth = 0;
                }
                anchorDepth = Math.max(0, anchorDepth - 1);
            } else if (lower.startsWith("<mark")) {
                if (markDepth > 0 || lower.contains("highlight-keyword")) {
                    markDepth++;
                }
            } else if (lower.startsWith("</mark") && markDepth > 0) {
                markDepth--;
            }
            out.append(tag);
            position = tags.end();
        }
        appendText(out, text.substring(position), pattern, linkDepth > 0 || markDepth > 0);
        return out.toString();
    }

    private static void appendText(StringBuilder out, String segment, Pattern pattern, boolean protectedSegment) {
        if (protectedSegment || segment.isEmpty()) {
            out.append(segment);
            return;
        }
        Matcher m = pattern.matcher(segment);
        int last = 0;
        while (m.find()) {
            out.append(segment, last, m.start());
            out.append(OPEN_MARK).append(m.group()).append(CLOSE_MARK);
            last = m.end();
        }
        out.append(segment, last, segment.length());
    }

    private static Pattern compile(List<String> keywords) {
        if (keywords == null) {
            return null;
        }
        Set<String> distinct = keywords.stream()
                .filter(k -> k != null && !k.isBlank())
                .map(String::trim)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (distinct.isEmpty()) {
            return null;
        }
        String alternation = distinct.stream()
                .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
                .map(Pattern::quote)
                .collect(Collectors.joining("|"));
        return Pattern.compile(alternation, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
