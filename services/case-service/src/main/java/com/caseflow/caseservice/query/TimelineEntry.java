package com.caseflow.caseservice.query;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.Track;
import java.time.Instant;

/**
 * One line of an aggregate's history.
 *
 * @param version the aggregate version this event produced
 * @param eventId the event
 * @param occurredAt when it was recorded
 * @param eventType wire name of the event type
 * @param actorId who submitted it
 * @param actorRole in which role
 * @param track the claim track concerned, null for other events
 * @param summary short description
 */
public record TimelineEntry(
        long version,
        String eventId,
        Instant occurredAt,
        String eventType,
        String actorId,
        ActorRole actorRole,
        Track track,
        String summary) {}
