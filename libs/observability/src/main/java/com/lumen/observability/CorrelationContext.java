package com.lumen.observability;

/**
 * Immutable correlation context that flows with one gateway operation.
 *
 * <p>Every inbound request (HTTP call or subscription) establishes a {@code CorrelationContext}.
 * The values are copied into SLF4J MDC so that every log line written on behalf of the operation
 * carries them, including the lines written later by a subscription pipeline.
 *
 * @param correlationId unique ID for the business flow, echoed to the client
 * @param userId        authenticated user performing the operation (nullable for anonymous calls)
 * @param operation     logical operation name, e.g. {@code createThreadAndRun} (nullable)
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String userId,
        String operation,
        String requestId
) {

    public static final String MDC_CORRELATION_ID = "correlationId";

    public static final String MDC_USER_ID = "userId";

    public static final String MDC_OPERATION = "operation";

    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Compact constructor, correlationId is never null.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /** Creates a context carrying only the correlation ID. */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /** Returns a copy of this context bound to the given user. */
    public CorrelationContext withUser(String userId) {
        return new CorrelationContext(correlationId, userId, operation, requestId);
    }

    /** Returns a copy of this context bound to the given operation name. */
    public CorrelationContext withOperation(String operation) {
        return new CorrelationContext(correlationId, userId, operation, requestId);
    }
}
