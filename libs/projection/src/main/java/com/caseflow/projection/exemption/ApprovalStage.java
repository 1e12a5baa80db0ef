package com.caseflow.projection.exemption;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.ExemptionEventType;
import java.util.Optional;

/** The approval stages in the order an application passes through them. */
public enum ApprovalStage {
    ADVISOR(ActorRole.ADVISOR, ExemptionStatus.SUBMITTED),
    PROJECT_LEAD(ActorRole.PROJECT_LEAD, ExemptionStatus.UNDER_PROJECT_LEAD_REVIEW),
    WORKING_GROUP(ActorRole.WORKING_GROUP, ExemptionStatus.UNDER_WORKING_GROUP_REVIEW),
    OWNER(ActorRole.OWNER, ExemptionStatus.AWAITING_OWNER_DECISION);

    private final ActorRole role;
    private final ExemptionStatus awaitingStatus;

    ApprovalStage(ActorRole role, ExemptionStatus awaitingStatus) {
        this.role = role;
        this.awaitingStatus = awaitingStatus;
    }

    /** The role that completes this stage. */
    public ActorRole role() {
        return role;
    }

    /** Application status while this stage is pending. */
    public ExemptionStatus awaitingStatus() {
        return awaitingStatus;
    }

    /** The following stage, empty after the owner. */
    public Optional<ApprovalStage> next() {
        ApprovalStage[] stages = values();
        return ordinal() + 1 < stages.length ? Optional.of(stages[ordinal() + 1]) : Optional.empty();
    }

    /** The stage a review or return event belongs to; empty for applicant events. */
    public static Optional<ApprovalStage> of(ExemptionEventType type) {
        return switch (type) {
            case ADVISOR_REVIEWED, ADVISOR_RETURNED -> Optional.of(ADVISOR);
            case PROJECT_LEAD_REVIEWED, PROJECT_LEAD_RETURNED -> Optional.of(PROJECT_LEAD);
            case WORKING_GROUP_REVIEWED -> Optional.of(WORKING_GROUP);
            case OWNER_DECIDED -> Optional.of(OWNER);
            case APPLICATION_CREATED,
                    APPLICATION_UPDATED,
                    ITEM_ADDED,
                    ITEM_UPDATED,
                    ITEM_REMOVED,
                    APPLICATION_SUBMITTED,
                    APPLICATION_WITHDRAWN -> Optional.empty();
        };
    }
}
