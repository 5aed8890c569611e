package com.cityhive.observability;

/**
 * Immutable correlation context that flows through a request.
 * <p>
 * Every incoming HTTP request establishes a {@code CorrelationContext}. Its values are
 * injected into SLF4J MDC for automatic inclusion in log output and echoed back to the
 * client in response headers and error bodies.
 *
 * @param correlationId unique ID for the business flow, supplied by the client or generated
 * @param requestId     unique ID for this specific request
 */
public record CorrelationContext(String correlationId, String requestId) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
