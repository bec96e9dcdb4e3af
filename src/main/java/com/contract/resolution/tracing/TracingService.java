package com.contract.resolution.tracing;

import java.util.Map;

/**
 * Tracing integration point. {@link NoOpTracingService} is used when no tracer is configured.
 */
public interface TracingService {

    Span startSpan(String operationName);

    Span startSpan(String operationName, Map<String, String> attributes);

    /**
     * Starts a span tagged with the contract it works on.
     */
    default Span startContractSpan(String operationName, String contractId) {
        return startSpan(operationName, Map.of("contractId", contractId));
    }
}
