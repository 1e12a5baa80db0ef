package com.caseflow.projection;

/**
 * Thrown when an event log cannot be folded: it is empty, does not start with a creation event,
 * repeats the creation event, or breaks an ordering the state machine enforces.
 */
public class MalformedSequenceException extends RuntimeException {

    private final String aggregateId;

    public MalformedSequenceException(String aggregateId, String message) {
        super("Malformed event sequence for %s: %s".formatted(aggregateId, message));
        this.aggregateId = aggregateId;
    }

    public String aggregateId() {
        return aggregateId;
    }
}
