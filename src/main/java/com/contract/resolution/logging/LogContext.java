package com.contract.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(contractId, "14.1")) {
 *     log.info("clause.resolved chunkId={} tier={}", chunkId, tier);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for resolving one clause of a contract.
     */
    public static LogContext forResolution(String contractId, String clauseId) {
        LogContext ctx = new LogContext();
        ctx.put("contractId", contractId);
        ctx.put("clauseId", clauseId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Context for a registry write such as {@code addChunk} or {@code retractOverride}.
     */
    public static LogContext forMutation(String contractId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("contractId", contractId);
        ctx.put("operation", operation);
        return ctx;
    }

    /**
     * Context for a whole-contract validation run.
     */
    public static LogContext forValidation(String contractId) {
        LogContext ctx = new LogContext();
        ctx.put("contractId", contractId);
        ctx.put("operation", "validate");
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
