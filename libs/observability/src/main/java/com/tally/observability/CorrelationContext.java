package com.tally.observability;

/**
 * Immutable per-request context that ties log lines to the request that produced them.
 *
 * <p>Set by the HTTP layer when a request arrives and exposed to SLF4J through MDC, so every log
 * statement on the handling thread carries the same identifiers.
 *
 * @param correlationId ID shared by every request in one client flow (propagated via header)
 * @param requestId unique ID of this single request (nullable)
 * @param clientAddress resolved client address of the caller (nullable)
 */
public record CorrelationContext(String correlationId, String requestId, String clientAddress) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the client address. */
    public static final String MDC_CLIENT_ADDRESS = "clientAddress";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Context carrying only a correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null);
    }
}
