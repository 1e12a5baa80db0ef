package com.caseflow.eventstore;

/**
 * Thrown when an append names a version that is no longer the stored version. Nothing was
 * written.
 */
public class ConcurrencyException extends RuntimeException {

    private final String aggregateId;
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyException(String aggregateId, long expectedVersion, long actualVersion) {
        super("Version conflict on %s: expected %d, actual %d"
                .formatted(aggregateId, expectedVersion, actualVersion));
        this.aggregateId = aggregateId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String aggregateId() {
        return aggregateId;
    }

    public long expectedVersion() {
        return expectedVersion;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
