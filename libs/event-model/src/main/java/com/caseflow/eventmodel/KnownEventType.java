package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.EventPayload;

/** An event type this build knows how to project and validate. */
public sealed interface KnownEventType extends EventType permits CaseEventType, ExemptionEventType {

    /** The aggregate kind whose log may contain this event type. */
    AggregateKind aggregateKind();

    /** The only role allowed to submit this event type. */
    ActorRole allowedRole();

    /** The payload record carried by events of this type. */
    Class<? extends EventPayload> payloadType();

    /** Whether this event type starts a new aggregate. */
    boolean isCreation();
}
