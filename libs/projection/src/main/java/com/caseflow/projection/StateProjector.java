package com.caseflow.projection;

import com.caseflow.eventmodel.DomainEvent;
import java.util.List;

/**
 * Folds an aggregate's event log into its current state.
 *
 * <p>Implementations are pure: the same events always give an equal state, and folding a prefix
 * then applying the rest gives the same state as folding everything at once.
 *
 * @param <S> the immutable state type
 */
public interface StateProjector<S> {

    /**
     * Folds a complete log, starting from its creation event.
     *
     * @throws MalformedSequenceException if the log is empty or does not start with the
     *     aggregate's creation event
     */
    S computeState(List<DomainEvent> events);

    /** Applies one event to an existing state and returns the new state. */
    S apply(S state, DomainEvent event);

    /** Applies events in order to an existing state. */
    default S applyAll(S state, List<DomainEvent> events) {
        S current = state;
        for (DomainEvent event : events) {
            current = apply(current, event);
        }
        return current;
    }
}
