package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.ApplicationDetails;
import com.caseflow.eventmodel.payload.EventPayload;
import com.caseflow.eventmodel.payload.FinalDecision;
import com.caseflow.eventmodel.payload.ItemDetails;
import com.caseflow.eventmodel.payload.ItemRemoval;
import com.caseflow.eventmodel.payload.StageReturn;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.eventmodel.payload.Submission;
import com.caseflow.eventmodel.payload.Withdrawal;
import java.util.Optional;

/**
 * Event types of an exemption application.
 *
 * <p>The applicant drafts the application and its items, then submits it. Each approval stage is
 * represented by a review event submitted by the role owning that stage; the advisor and the
 * project lead may also return the application to the applicant.
 */
public enum ExemptionEventType implements KnownEventType {

    // ---- Applicant ----
    APPLICATION_CREATED(
            "ApplicationCreated", Kind.CREATION, ActorRole.APPLICANT, ApplicationDetails.class),
    APPLICATION_UPDATED(
            "ApplicationUpdated", Kind.EDIT, ActorRole.APPLICANT, ApplicationDetails.class),
    ITEM_ADDED("ItemAdded", Kind.ITEM_EDIT, ActorRole.APPLICANT, ItemDetails.class),
    ITEM_UPDATED("ItemUpdated", Kind.ITEM_EDIT, ActorRole.APPLICANT, ItemDetails.class),
    ITEM_REMOVED("ItemRemoved", Kind.ITEM_EDIT, ActorRole.APPLICANT, ItemRemoval.class),
    APPLICATION_SUBMITTED(
            "ApplicationSubmitted", Kind.SUBMISSION, ActorRole.APPLICANT, Submission.class),
    APPLICATION_WITHDRAWN(
            "ApplicationWithdrawn", Kind.WITHDRAWAL, ActorRole.APPLICANT, Withdrawal.class),

    // ---- Approval chain ----
    ADVISOR_REVIEWED("AdvisorReviewed", Kind.REVIEW, ActorRole.ADVISOR, StageReview.class),
    ADVISOR_RETURNED("AdvisorReturned", Kind.RETURN, ActorRole.ADVISOR, StageReturn.class),
    PROJECT_LEAD_REVIEWED(
            "ProjectLeadReviewed", Kind.REVIEW, ActorRole.PROJECT_LEAD, StageReview.class),
    PROJECT_LEAD_RETURNED(
            "ProjectLeadReturned", Kind.RETURN, ActorRole.PROJECT_LEAD, StageReturn.class),
    WORKING_GROUP_REVIEWED(
            "WorkingGroupReviewed", Kind.REVIEW, ActorRole.WORKING_GROUP, StageReview.class),
    OWNER_DECIDED("OwnerDecided", Kind.REVIEW, ActorRole.OWNER, FinalDecision.class);

    /** What an event of a given type does to the application. */
    public enum Kind {
        CREATION,
        EDIT,
        ITEM_EDIT,
        SUBMISSION,
        WITHDRAWAL,
        REVIEW,
        RETURN
    }

    private final String value;
    private final Kind kind;
    private final ActorRole allowedRole;
    private final Class<? extends EventPayload> payloadType;

    ExemptionEventType(
            String value, Kind kind, ActorRole allowedRole, Class<? extends EventPayload> payloadType) {
        this.value = value;
        this.kind = kind;
        this.allowedRole = allowedRole;
        this.payloadType = payloadType;
    }

    @Override
    public String value() {
        return value;
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public AggregateKind aggregateKind() {
        return AggregateKind.EXEMPTION;
    }

    @Override
    public ActorRole allowedRole() {
        return allowedRole;
    }

    @Override
    public Class<? extends EventPayload> payloadType() {
        return payloadType;
    }

    @Override
    public boolean isCreation() {
        return kind == Kind.CREATION;
    }

    /**
     * Looks up an ExemptionEventType by its canonical string value.
     *
     * @param value the string to match (e.g. "AdvisorReviewed")
     * @return the matching type, or empty if not found
     */
    public static Optional<ExemptionEventType> fromString(String value) {
        for (ExemptionEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
