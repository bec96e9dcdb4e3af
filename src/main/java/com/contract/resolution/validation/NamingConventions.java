package com.contract.resolution.validation;

import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentGroup;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Filing rules for contract documents: filenames follow {@code <group><sequence>_<name>},
 * appendices belong in group N and addendums in group D.
 */
public final class NamingConventions {

    private static final Pattern FILENAME = Pattern.compile("^([A-Za-z])(\\d+)_(\\S.*)$");

    private NamingConventions() {
    }

    /**
     * Returns one warning per rule the document breaks.
     */
    public static List<ValidationIssue> check(Document document) {
        List<ValidationIssue> issues = new ArrayList<>();
        document.getOriginalFilename().ifPresent(filename -> {
            String problem = filenameProblem(document, filename);
            if (problem != null) {
                issues.add(issue(document, problem + "; suggested name: " + suggestedFilename(document, filename)));
            }
        });

        String name = document.getName().toLowerCase(Locale.ROOT);
        if (document.getGroup() == DocumentGroup.D
                && (name.contains("appendix") || name.contains("annex") || name.contains("schedule"))) {
            issues.add(issue(document, "Appendix/Annex/Schedule should be in group N, not D"));
        }
        if (document.getGroup() == DocumentGroup.N && name.contains("addendum")) {
            issues.add(issue(document, "Addendum should be in group D, not N"));
        }
        return issues;
    }

    /**
     * Describes why the filename breaks the convention, or returns null when it follows it.
     */
    static String filenameProblem(Document document, String filename) {
        Matcher m = FILENAME.matcher(filename);
        if (!m.matches()) {
            return "Filename '" + filename + "' does not follow <group><sequence>_<name>";
        }
        String group = m.group(1).toUpperCase(Locale.ROOT);
        if (!group.equals(document.getGroup().name())) {
            return "Filename '" + filename + "' is prefixed with group " + group
                    + " but the document is filed under " + document.getGroup().name();
        }
        if (!new BigInteger(m.group(2)).equals(BigInteger.valueOf(document.getSequence()))) {
            return "Filename '" + filename + "' carries sequence " + m.group(2)
                    + " but the document has sequence " + document.getSequence();
        }
        return null;
    }

    static String suggestedFilename(Document document, String filename) {
        int dot = filename.lastIndexOf('.');
        String extension = dot > 0 ? filename.substring(dot) : "";
        String base = document.getName().trim().replaceAll("[^A-Za-z0-9]+", "_").replaceAll("^_+|_+$", "");
        return document.getCode() + "_" + base + extension;
    }

    private static ValidationIssue issue(Document document, String message) {
        return ValidationIssue.builder(ErrorCode.NAMING_CONVENTION_VIOLATION, Severity.WARNING)
                .message(message)
                .documentId(document.getId())
                .build();
    }
}
