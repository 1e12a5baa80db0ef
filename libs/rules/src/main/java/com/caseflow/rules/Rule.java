package com.caseflow.rules;

/** Business rules checked before an event is appended. */
public enum Rule {
    /** Each event type may only be submitted by one role. */
    ROLE_CHECK,
    /** Closed cases and final applications accept no further events. */
    CASE_NOT_CLOSED,
    /** Dependent claims need the basis; machine applications need items. */
    PREREQUISITE_REQUIRED,
    /** A response needs an outstanding claim. */
    TRACK_SUBMITTED_REQUIRED,
    /** Locked tracks and applications under review cannot be edited. */
    NOT_LOCKED,
    /** Updates and withdrawals need something to update or withdraw. */
    ACTIVE_CLAIM_EXISTS,
    /** The change order needs every track settled. */
    FINAL_ACTION_READY,
    /** Approval stages act in order. */
    STEP_ORDER,
    /** The owner must explain a decision that departs from the working group. */
    RATIONALE_REQUIRED
}
