package com.caseflow.eventstore.metadata;

import com.caseflow.eventmodel.AggregateKind;
import java.time.Instant;

/**
 * Cached summary of one aggregate for listings.
 *
 * <p>The event log is the source of truth; this record only caches values derived from it and can
 * always be rebuilt by replaying the log.
 *
 * @param aggregateId   the case or application
 * @param aggregateKind which kind of aggregate it is
 * @param projectId     owning project, nullable
 * @param title         cached title
 * @param status        cached overall status string
 * @param createdAt     when the aggregate was created
 * @param createdBy     who created it
 * @param lastEventAt   timestamp of the most recent event
 */
public record CaseMetadata(
        String aggregateId,
        AggregateKind aggregateKind,
        String projectId,
        String title,
        String status,
        Instant createdAt,
        String createdBy,
        Instant lastEventAt) {

    public CaseMetadata {
        if (aggregateId == null || aggregateId.isBlank()) {
            throw new IllegalArgumentException("aggregateId must not be null or blank");
        }
        if (aggregateKind == null) {
            throw new IllegalArgumentException("aggregateKind must not be null");
        }
    }

    /** Returns a copy with the cached fields replaced. */
    public CaseMetadata withCache(String newTitle, String newStatus, Instant newLastEventAt) {
        return new CaseMetadata(
                aggregateId, aggregateKind, projectId, newTitle, newStatus, createdAt, createdBy, newLastEventAt);
    }
}
