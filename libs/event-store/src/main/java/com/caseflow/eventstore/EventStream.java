package com.caseflow.eventstore;

import com.caseflow.eventmodel.DomainEvent;
import java.util.List;

/**
 * An aggregate's log as read at one point in time.
 *
 * @param aggregateId the aggregate
 * @param events events in append order
 * @param version number of events; the token to pass as expected version on the next append
 */
public record EventStream(String aggregateId, List<DomainEvent> events, long version) {

    public EventStream {
        events = List.copyOf(events);
        if (version != events.size()) {
            throw new IllegalArgumentException(
                    "version %d does not match %d events".formatted(version, events.size()));
        }
    }

    /** The stream of an aggregate with no events. */
    public static EventStream empty(String aggregateId) {
        return new EventStream(aggregateId, List.of(), 0);
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
