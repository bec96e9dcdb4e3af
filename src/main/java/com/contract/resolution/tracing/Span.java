package com.contract.resolution.tracing;

/**
 * A unit of work in a trace. Ends when closed, so it fits try-with-resources:
 *
 * <pre>
 * try (Span span = tracingService.startSpan("clause.resolve")) {
 *     span.setAttribute("clauseId", "14.1");
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, boolean value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
