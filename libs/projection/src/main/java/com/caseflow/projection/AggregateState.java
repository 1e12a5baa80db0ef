package com.caseflow.projection;

import java.time.Instant;

/** What every projected aggregate state exposes. */
public interface AggregateState {

    String aggregateId();

    /** Number of events folded into this state; equals the log version it was built from. */
    int eventCount();

    Instant lastActivityAt();
}
