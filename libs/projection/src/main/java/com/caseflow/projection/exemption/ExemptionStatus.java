package com.caseflow.projection.exemption;

import java.util.EnumSet;
import java.util.Set;

/** Lifecycle status of an exemption application. */
public enum ExemptionStatus {
    DRAFT,
    SUBMITTED,
    RETURNED_BY_ADVISOR,
    UNDER_PROJECT_LEAD_REVIEW,
    RETURNED_BY_PROJECT_LEAD,
    UNDER_WORKING_GROUP_REVIEW,
    AWAITING_OWNER_DECISION,
    APPROVED,
    PARTIALLY_APPROVED,
    REJECTED,
    WITHDRAWN;

    private static final Set<ExemptionStatus> EDITABLE =
            EnumSet.of(DRAFT, RETURNED_BY_ADVISOR, RETURNED_BY_PROJECT_LEAD);
    private static final Set<ExemptionStatus> AWAITING_REVIEW = EnumSet.of(
            SUBMITTED, UNDER_PROJECT_LEAD_REVIEW, UNDER_WORKING_GROUP_REVIEW, AWAITING_OWNER_DECISION);
    private static final Set<ExemptionStatus> DECIDED = EnumSet.of(APPROVED, PARTIALLY_APPROVED, REJECTED);

    /** The applicant may still change the application. */
    public boolean isEditable() {
        return EDITABLE.contains(this);
    }

    /** The application sits with one of the approval stages. */
    public boolean isAwaitingReview() {
        return AWAITING_REVIEW.contains(this);
    }

    /** The owner has decided. */
    public boolean isDecided() {
        return DECIDED.contains(this);
    }

    /** Decided or withdrawn; no further events are accepted. */
    public boolean isFinal() {
        return isDecided() || this == WITHDRAWN;
    }
}
