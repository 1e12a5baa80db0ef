package com.caseflow.projection;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.KnownEventType;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for projectors of one aggregate kind.
 *
 * <p>Handles what every projector shares: the log must start with a creation event of this
 * aggregate's type enum and must not repeat it, and events of a type this projector does not
 * know (unknown types, or types of another aggregate kind) are logged and skipped. Subclasses
 * provide one transition per event type.
 *
 * @param <S> the immutable state type
 * @param <T> the event type enum of this aggregate kind
 */
public abstract class TypedProjector<S, T extends Enum<T> & KnownEventType> implements StateProjector<S> {

    private static final Logger log = LoggerFactory.getLogger(TypedProjector.class);

    private final Class<T> typeClass;

    protected TypedProjector(Class<T> typeClass) {
        this.typeClass = typeClass;
    }

    @Override
    public final S computeState(List<DomainEvent> events) {
        if (events == null || events.isEmpty()) {
            throw new MalformedSequenceException(null, "no events");
        }
        DomainEvent first = events.get(0);
        T type = typed(first);
        if (type == null || !type.isCreation()) {
            throw new MalformedSequenceException(
                    first.aggregateId(),
                    "first event is %s, expected a creation event".formatted(typeName(first)));
        }
        S state = create(type, first);
        return applyAll(state, events.subList(1, events.size()));
    }

    @Override
    public final S apply(S state, DomainEvent event) {
        if (state == null) {
            throw new MalformedSequenceException(event.aggregateId(), "event applied before creation");
        }
        String aggregateId = aggregateId(state);
        if (!aggregateId.equals(event.aggregateId())) {
            throw new MalformedSequenceException(
                    aggregateId, "event %s belongs to %s".formatted(event.eventId(), event.aggregateId()));
        }
        T type = typed(event);
        if (type == null) {
            log.warn("Skipping event {} of unhandled type {} on {}", event.eventId(), typeName(event), aggregateId);
            return state;
        }
        if (type.isCreation()) {
            throw new MalformedSequenceException(aggregateId, "repeated creation event " + event.eventId());
        }
        return transition(state, type, event);
    }

    /** Builds the initial state from the creation event. */
    protected abstract S create(T type, DomainEvent event);

    /** Applies a non-creation event of a known type. */
    protected abstract S transition(S state, T type, DomainEvent event);

    /** Returns the aggregate id held by a state. */
    protected abstract String aggregateId(S state);

    private T typed(DomainEvent event) {
        return typeClass.isInstance(event.eventType()) ? typeClass.cast(event.eventType()) : null;
    }

    private static String typeName(DomainEvent event) {
        return event.eventType() == null ? "null" : event.eventType().value();
    }
}
