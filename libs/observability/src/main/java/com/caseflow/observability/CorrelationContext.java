package com.caseflow.observability;

/**
 * Immutable correlation context for one command submission.
 *
 * <p>The holder copies these identifiers into the SLF4J MDC so every log line written while the
 * command runs, including lines written by the event store and the unit of work, carries them.
 *
 * @param correlationId unique ID for the business flow the command belongs to
 * @param aggregateId   the case or application the command targets (nullable)
 * @param actorId       the person submitting the command (nullable for system work)
 * @param requestId     unique ID for this specific submission (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String aggregateId,
        String actorId,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for aggregate ID. */
    public static final String MDC_AGGREGATE_ID = "aggregateId";

    /** MDC key for actor ID. */
    public static final String MDC_ACTOR_ID = "actorId";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }
}
