package com.caseflow.uow;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventstore.EventStream;
import java.util.List;

/** The event store operations available inside a unit of work. */
public interface EventLog {

    /**
     * @return the aggregate's version after the append, as seen by this unit
     * @see com.caseflow.eventstore.EventStore#append(String, DomainEvent, long)
     */
    long append(String aggregateId, DomainEvent event, long expectedVersion);

    /** @see com.caseflow.eventstore.EventStore#appendBatch(String, List, long) */
    long appendBatch(String aggregateId, List<DomainEvent> events, long expectedVersion);

    /** Reads the log as this unit sees it, including its own appends. */
    EventStream get(String aggregateId);
}
