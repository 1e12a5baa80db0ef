package com.caseflow.caseservice.command;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.EventType;
import com.caseflow.eventmodel.EventTypes;
import com.caseflow.eventmodel.payload.EventPayload;

/**
 * A request to append one event.
 *
 * @param aggregateId the case or application
 * @param expectedVersion the version the submitter based the request on, 0 to create
 * @param eventType the type of event to append
 * @param payload the event payload
 * @param actorId who submits
 * @param actorRole the role they submit in
 */
public record SubmitCommand(
        String aggregateId,
        long expectedVersion,
        EventType eventType,
        EventPayload payload,
        String actorId,
        ActorRole actorRole) {

    /** Builds a command from the event type's wire name; unknown names yield an invalid command. */
    public static SubmitCommand of(
            String aggregateId,
            long expectedVersion,
            String eventType,
            EventPayload payload,
            String actorId,
            ActorRole actorRole) {
        return new SubmitCommand(
                aggregateId, expectedVersion, EventTypes.resolve(eventType), payload, actorId, actorRole);
    }
}
