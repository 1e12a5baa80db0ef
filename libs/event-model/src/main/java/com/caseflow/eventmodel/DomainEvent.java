package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.EventPayload;
import java.time.Instant;
import java.util.Optional;

/**
 * An immutable fact in an aggregate's log.
 *
 * <p>Events are never mutated or deleted. A correction is a new event (an update or a
 * withdrawal) appended after the one it corrects. The position of an event in its log, not its
 * {@code occurredAt} timestamp, defines its order.
 *
 * @param eventId unique identifier of this event (UUID v4)
 * @param aggregateId the aggregate (case or application) this event belongs to
 * @param eventType the event type variant
 * @param occurredAt when the event was recorded
 * @param actorId identifier of the person who submitted the event
 * @param actorRole role the actor submitted the event in
 * @param payload type-specific data
 */
public record DomainEvent(
        String eventId,
        String aggregateId,
        EventType eventType,
        Instant occurredAt,
        String actorId,
        ActorRole actorRole,
        EventPayload payload) {

    /** Returns the event type if this build knows it. */
    public Optional<KnownEventType> knownType() {
        return eventType instanceof KnownEventType known ? Optional.of(known) : Optional.empty();
    }

    /**
     * Returns the payload cast to the expected record type.
     *
     * @throws IllegalStateException if the payload is of a different type
     */
    public <P extends EventPayload> P payloadAs(Class<P> type) {
        if (!type.isInstance(payload)) {
            throw new IllegalStateException(
                    "Event %s of type %s carries %s, expected %s"
                            .formatted(
                                    eventId,
                                    eventType == null ? null : eventType.value(),
                                    payload == null ? null : payload.getClass().getSimpleName(),
                                    type.getSimpleName()));
        }
        return type.cast(payload);
    }
}
