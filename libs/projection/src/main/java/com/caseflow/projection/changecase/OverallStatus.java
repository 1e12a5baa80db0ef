package com.caseflow.projection.changecase;

/** Status of a case as a whole, derived from its tracks. */
public enum OverallStatus {
    NO_ACTIVE_TRACKS,
    DRAFT,
    AWAITING_RESPONSE,
    UNDER_REVIEW,
    UNDER_NEGOTIATION,
    AGREED,
    WITHDRAWN,
    CLOSED,
    UNKNOWN;

    /** Whether a case in this status accepts nothing but the change order. */
    public boolean isClosed() {
        return this == AGREED || this == WITHDRAWN || this == CLOSED;
    }
}
