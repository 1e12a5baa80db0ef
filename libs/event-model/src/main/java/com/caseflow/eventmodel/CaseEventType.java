package com.caseflow.eventmodel;

import com.caseflow.eventmodel.payload.BasisClaim;
import com.caseflow.eventmodel.payload.CaseClosed;
import com.caseflow.eventmodel.payload.CaseCreated;
import com.caseflow.eventmodel.payload.ChangeOrderIssued;
import com.caseflow.eventmodel.payload.CompensationClaim;
import com.caseflow.eventmodel.payload.DeadlineClaim;
import com.caseflow.eventmodel.payload.EventPayload;
import com.caseflow.eventmodel.payload.TrackResponse;
import com.caseflow.eventmodel.payload.Withdrawal;
import java.util.Optional;

/**
 * Event types of a change-claim case.
 *
 * <p>The contractor raises and maintains claims on the three tracks; the client responds to each
 * track and finally issues the change order. Every constant fixes the track it touches (null for
 * case-level events), its {@link Kind}, the single role allowed to submit it, and its payload.
 */
public enum CaseEventType implements KnownEventType {

    // ---- Case lifecycle ----
    CASE_CREATED("CaseCreated", null, Kind.CREATION, ActorRole.CONTRACTOR, CaseCreated.class),
    CHANGE_ORDER_ISSUED(
            "ChangeOrderIssued", null, Kind.CHANGE_ORDER, ActorRole.CLIENT, ChangeOrderIssued.class),
    CASE_CLOSED("CaseClosed", null, Kind.CLOSURE, ActorRole.CLIENT, CaseClosed.class),

    // ---- Basis track ----
    BASIS_SUBMITTED("BasisSubmitted", Track.BASIS, Kind.SUBMISSION, ActorRole.CONTRACTOR, BasisClaim.class),
    BASIS_UPDATED("BasisUpdated", Track.BASIS, Kind.UPDATE, ActorRole.CONTRACTOR, BasisClaim.class),
    BASIS_WITHDRAWN("BasisWithdrawn", Track.BASIS, Kind.WITHDRAWAL, ActorRole.CONTRACTOR, Withdrawal.class),
    BASIS_RESPONDED("BasisResponded", Track.BASIS, Kind.RESPONSE, ActorRole.CLIENT, TrackResponse.class),

    // ---- Compensation track ----
    COMPENSATION_SUBMITTED(
            "CompensationSubmitted",
            Track.COMPENSATION,
            Kind.SUBMISSION,
            ActorRole.CONTRACTOR,
            CompensationClaim.class),
    COMPENSATION_UPDATED(
            "CompensationUpdated",
            Track.COMPENSATION,
            Kind.UPDATE,
            ActorRole.CONTRACTOR,
            CompensationClaim.class),
    COMPENSATION_WITHDRAWN(
            "CompensationWithdrawn",
            Track.COMPENSATION,
            Kind.WITHDRAWAL,
            ActorRole.CONTRACTOR,
            Withdrawal.class),
    COMPENSATION_RESPONDED(
            "CompensationResponded",
            Track.COMPENSATION,
            Kind.RESPONSE,
            ActorRole.CLIENT,
            TrackResponse.class),

    // ---- Deadline track ----
    DEADLINE_SUBMITTED(
            "DeadlineSubmitted", Track.DEADLINE, Kind.SUBMISSION, ActorRole.CONTRACTOR, DeadlineClaim.class),
    DEADLINE_UPDATED("DeadlineUpdated", Track.DEADLINE, Kind.UPDATE, ActorRole.CONTRACTOR, DeadlineClaim.class),
    DEADLINE_WITHDRAWN(
            "DeadlineWithdrawn", Track.DEADLINE, Kind.WITHDRAWAL, ActorRole.CONTRACTOR, Withdrawal.class),
    DEADLINE_RESPONDED(
            "DeadlineResponded", Track.DEADLINE, Kind.RESPONSE, ActorRole.CLIENT, TrackResponse.class);

    /** What an event of a given type does to its track or case. */
    public enum Kind {
        CREATION,
        SUBMISSION,
        UPDATE,
        WITHDRAWAL,
        RESPONSE,
        CHANGE_ORDER,
        CLOSURE
    }

    private final String value;
    private final Track track;
    private final Kind kind;
    private final ActorRole allowedRole;
    private final Class<? extends EventPayload> payloadType;

    CaseEventType(
            String value,
            Track track,
            Kind kind,
            ActorRole allowedRole,
            Class<? extends EventPayload> payloadType) {
        this.value = value;
        this.track = track;
        this.kind = kind;
        this.allowedRole = allowedRole;
        this.payloadType = payloadType;
    }

    @Override
    public String value() {
        return value;
    }

    /** The track this event touches, or empty for case-level events. */
    public Optional<Track> track() {
        return Optional.ofNullable(track);
    }

    public Kind kind() {
        return kind;
    }

    @Override
    public AggregateKind aggregateKind() {
        return AggregateKind.CHANGE_CASE;
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
     * Returns the event type of the given kind on the given track.
     *
     * @throws IllegalArgumentException if no such type exists
     */
    public static CaseEventType of(Track track, Kind kind) {
        for (CaseEventType type : values()) {
            if (type.track == track && type.kind == kind) {
                return type;
            }
        }
        throw new IllegalArgumentException("No event type for " + track + "/" + kind);
    }

    /**
     * Looks up a CaseEventType by its canonical string value.
     *
     * @param value the string to match (e.g. "BasisSubmitted")
     * @return the matching type, or empty if not found
     */
    public static Optional<CaseEventType> fromString(String value) {
        for (CaseEventType type : values()) {
            if (type.value.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
