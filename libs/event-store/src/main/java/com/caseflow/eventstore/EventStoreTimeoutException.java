package com.caseflow.eventstore;

import java.time.Duration;

/** Thrown when an event store operation does not complete within its configured timeout. */
public class EventStoreTimeoutException extends EventStoreException {

    private final Duration timeout;

    public EventStoreTimeoutException(String aggregateId, Duration timeout) {
        super("Event store operation on %s timed out after %d ms"
                .formatted(aggregateId, timeout.toMillis()));
        this.timeout = timeout;
    }

    public EventStoreTimeoutException(String aggregateId, Duration timeout, Throwable cause) {
        super("Event store operation on %s timed out after %d ms"
                .formatted(aggregateId, timeout.toMillis()), cause);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
