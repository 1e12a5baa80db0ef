package com.caseflow.projection.changecase;

import java.util.EnumSet;
import java.util.Set;

/** Status of one claim track. */
public enum TrackStatus {
    NOT_APPLICABLE,
    DRAFT,
    SUBMITTED,
    UNDER_REVIEW,
    APPROVED,
    PARTIALLY_APPROVED,
    REJECTED,
    UNDER_NEGOTIATION,
    WITHDRAWN,
    LOCKED;

    private static final Set<TrackStatus> FINISHED = EnumSet.of(APPROVED, LOCKED, WITHDRAWN);
    private static final Set<TrackStatus> IN_DISPUTE = EnumSet.of(REJECTED, PARTIALLY_APPROVED, UNDER_NEGOTIATION);
    private static final Set<TrackStatus> AWAITING_CLIENT = EnumSet.of(SUBMITTED, UNDER_REVIEW);

    /** Approved, locked or withdrawn: nothing more will happen on the track. */
    public boolean isFinished() {
        return FINISHED.contains(this);
    }

    /** The client answered with anything short of full approval. */
    public boolean isInDispute() {
        return IN_DISPUTE.contains(this);
    }

    /** A claim is outstanding and the client has not answered it. */
    public boolean isAwaitingClient() {
        return AWAITING_CLIENT.contains(this);
    }

    /** The contractor has sent a claim on this track at some point. */
    public boolean isClaimed() {
        return this != NOT_APPLICABLE && this != DRAFT;
    }

    public boolean isAgreed() {
        return this == APPROVED || this == LOCKED;
    }
}
