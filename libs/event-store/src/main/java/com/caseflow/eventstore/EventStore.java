package com.caseflow.eventstore;

import com.caseflow.eventmodel.DomainEvent;
import java.util.List;

/**
 * Append-only, per-aggregate event log with optimistic concurrency control.
 *
 * <p>The version of an aggregate is the number of events in its log. An append names the version
 * the caller based its decision on; it succeeds only if that is still the stored version, and the
 * comparison and the write happen as one indivisible step. On a mismatch nothing is written and
 * a {@link ConcurrencyException} reports both versions. Callers must re-read, re-validate and
 * retry themselves; the store never retries.
 */
public interface EventStore {

    /**
     * Appends a single event.
     *
     * @return the new version (expectedVersion + 1)
     * @throws ConcurrencyException if the stored version differs from expectedVersion
     */
    default long append(String aggregateId, DomainEvent event, long expectedVersion) {
        return appendBatch(aggregateId, List.of(event), expectedVersion);
    }

    /**
     * Appends events all-or-nothing.
     *
     * @return the new version (expectedVersion + events.size())
     * @throws IllegalArgumentException if the batch is empty or an event belongs to another aggregate
     * @throws ConcurrencyException if the stored version differs from expectedVersion
     * @throws EventStoreException if the backing medium fails or times out
     */
    long appendBatch(String aggregateId, List<DomainEvent> events, long expectedVersion);

    /**
     * Reads an aggregate's full log in append order. Side-effect free.
     *
     * @return the events and current version; an empty stream at version 0 for unknown aggregates
     */
    EventStream get(String aggregateId);

    /** Returns the ids of every aggregate with at least one event. */
    List<String> aggregateIds();

    /**
     * Checks the batch shape shared by every implementation.
     *
     * @throws IllegalArgumentException if the batch is empty or mixes aggregates
     */
    static void requireValidBatch(String aggregateId, List<DomainEvent> events) {
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId must not be null or blank");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("Cannot append an empty batch");
        }
        for (DomainEvent event : events) {
            if (!aggregateId.equals(event.aggregateId())) {
                throw new IllegalArgumentException(
                        "All events must belong to aggregate %s, got %s"
                                .formatted(aggregateId, event.aggregateId()));
            }
        }
    }
}
