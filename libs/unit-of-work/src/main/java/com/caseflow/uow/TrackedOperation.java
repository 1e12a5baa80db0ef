package com.caseflow.uow;

import com.caseflow.eventstore.metadata.CaseMetadata;

/**
 * An operation a compensating unit of work has already applied.
 *
 * @param kind what was done
 * @param aggregateId the aggregate it was done to
 * @param rollbackPayload metadata as it was before the operation, null if there was none
 * @param compensator undoes the operation, null when it cannot be undone
 */
public record TrackedOperation(
        OperationKind kind, String aggregateId, CaseMetadata rollbackPayload, Runnable compensator) {

    public boolean isCompensable() {
        return compensator != null;
    }
}
