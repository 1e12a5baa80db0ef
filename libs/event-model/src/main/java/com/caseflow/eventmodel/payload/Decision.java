package com.caseflow.eventmodel.payload;

/** Outcome of an approver response or an approval-stage review. */
public enum Decision {
    APPROVED,
    PARTIALLY_APPROVED,
    REJECTED,
    NEEDS_CLARIFICATION
}
