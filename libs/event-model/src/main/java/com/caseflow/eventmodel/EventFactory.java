package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.EventPayload;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/** Factory methods for creating {@link DomainEvent} instances. */
public final class EventFactory {

    private EventFactory() {
        // utility class
    }

    /** Creates a new event with a generated eventId and the current timestamp. */
    public static DomainEvent create(
            String aggregateId,
            KnownEventType eventType,
            String actorId,
            ActorRole actorRole,
            EventPayload payload) {
        return create(aggregateId, eventType, actorId, actorRole, payload, Clock.systemUTC());
    }

    /** Creates a new event with a generated eventId, timestamped by the given clock. */
    public static DomainEvent create(
            String aggregateId,
            KnownEventType eventType,
            String actorId,
            ActorRole actorRole,
            EventPayload payload,
            Clock clock) {
        return new DomainEvent(
                UUID.randomUUID().toString(),
                aggregateId,
                eventType,
                Instant.now(clock),
                actorId,
                actorRole,
                payload);
    }

    /**
     * Creates an event submitted by the role the event type allows. Mostly useful for tests and
     * replays where the actor is implied by the type.
     */
    public static DomainEvent createAsAllowedRole(
            String aggregateId, KnownEventType eventType, String actorId, EventPayload payload) {
        return create(aggregateId, eventType, actorId, eventType.allowedRole(), payload);
    }
}
