package com.contract.resolution.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Renders a {@link ValidationResult} for an operator, as Markdown or as JSON.
 */
public class ValidationReportWriter {

    private final ObjectMapper objectMapper;

    public ValidationReportWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ValidationReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toMarkdown(ValidationResult result, Instant generatedAt) {
        ValidationSummary summary = result.summary();
        StringBuilder out = new StringBuilder();
        out.append("# Contract Ingestion Validation Report\n\n");
        out.append("Generated: ").append(generatedAt).append('\n');
        out.append("Contract ID: ").append(result.contractId()).append('\n');
        out.append("Snapshot version: ").append(result.snapshotVersion()).append("\n\n");
        out.append("## Summary\n\n");
        out.append("- **Status**: ").append(result.isValid() ? "VALID" : "INVALID").append('\n');
        out.append("- **Total Documents**: ").append(summary.totalDocuments()).append('\n');
        out.append("- **Total Chunks**: ").append(summary.totalChunks()).append('\n');
        out.append("- **Total References**: ").append(summary.totalReferences()).append('\n');
        out.append("- **Unresolved References**: ").append(summary.unresolvedReferences()).append('\n');
        out.append("- **Low Confidence Chunks**: ").append(summary.lowConfidenceChunks()).append("\n\n");
        appendSection(out, "Errors", result.errors());
        appendSection(out, "Warnings", result.warnings());
        return out.toString();
    }

    public String toJson(ValidationResult result) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("contractId", result.contractId());
        root.put("snapshotVersion", result.snapshotVersion());
        root.put("valid", result.isValid());
        root.set("summary", objectMapper.valueToTree(result.summary()));
        root.set("errors", issues(result.errors()));
        root.set("warnings", issues(result.warnings()));
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize validation report for " + result.contractId(), e);
        }
    }

    private ArrayNode issues(List<ValidationIssue> issues) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ValidationIssue issue : issues) {
            ObjectNode node = array.addObject();
            node.put("code", issue.code().name());
            node.put("severity", issue.severity().name());
            node.put("message", issue.message());
            putIfPresent(node, "documentId", issue.documentId());
            putIfPresent(node, "chunkId", issue.chunkId());
            putIfPresent(node, "clauseId", issue.clauseId());
            if (!issue.relatedIds().isEmpty()) {
                ArrayNode related = node.putArray("relatedIds");
                issue.relatedIds().forEach(related::add);
            }
        }
        return array;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }

    private static void appendSection(StringBuilder out, String title, List<ValidationIssue> issues) {
        if (issues.isEmpty()) {
            return;
        }
        out.append("## ").append(title).append("\n\n");
        Map<ErrorCode, List<ValidationIssue>> byCode = issues.stream()
                .collect(Collectors.groupingBy(ValidationIssue::code, TreeMap::new, Collectors.toList()));
        byCode.forEach((code, group) -> {
            out.append("### ").append(code.name()).append('\n');
            out.append(code.getDescription()).append('\n');
            out.append("Found ").append(group.size()).append(" issues\n\n");
            for (ValidationIssue issue : group) {
                out.append("- ").append(issue.message()).append('\n');
            }
            out.append('\n');
        });
    }
}
