package com.caseflow.observability.testing;

import com.caseflow.observability.CorrelationContext;

import java.util.UUID;

/**
 * Test factory for {@link CorrelationContext} instances.
 * <p>
 * Lives in {@code src/main/java} so other modules can use it from their tests.
 */
public final class TestCorrelationContextFactory {

    /** Default correlation ID for tests. */
    public static final String DEFAULT_CORRELATION_ID = "test-corr-001";

    /** Default actor ID for tests. */
    public static final String DEFAULT_ACTOR_ID = "actor-test-001";

    private TestCorrelationContextFactory() {
        // Utility class
    }

    /**
     * Creates a context with the default correlation and actor IDs and no aggregate.
     */
    public static CorrelationContext createDefault() {
        return new CorrelationContext(DEFAULT_CORRELATION_ID, null, DEFAULT_ACTOR_ID, null);
    }

    /**
     * Creates a context for the given aggregate with a random request ID.
     *
     * @param aggregateId the aggregate the test command targets
     */
    public static CorrelationContext forAggregate(String aggregateId) {
        return new CorrelationContext(
                DEFAULT_CORRELATION_ID, aggregateId, DEFAULT_ACTOR_ID, UUID.randomUUID().toString());
    }
}
