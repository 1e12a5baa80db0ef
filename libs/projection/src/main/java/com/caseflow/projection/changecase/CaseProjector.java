package com.caseflow.projection.changecase;

import com.caseflow.eventmodel.CaseEventType;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.Track;
import com.caseflow.eventmodel.payload.CaseClosed;
import com.caseflow.eventmodel.payload.CaseCreated;
import com.caseflow.eventmodel.payload.ChangeOrderIssued;
import com.caseflow.eventmodel.payload.TrackResponse;
import com.caseflow.projection.MalformedSequenceException;
import com.caseflow.projection.TypedProjector;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * Folds a change-claim case log into {@link CaseState}.
 *
 * <p>The projector applies whatever the log says. Whether an event was allowed is decided before
 * it is appended; the only thing rejected here is a log that does not describe a case at all.
 */
public final class CaseProjector extends TypedProjector<CaseState, CaseEventType> {

    public CaseProjector() {
        super(CaseEventType.class);
    }

    @Override
    protected CaseState create(CaseEventType type, DomainEvent event) {
        CaseCreated created = event.payloadAs(CaseCreated.class);
        Map<Track, TrackState> tracks = new EnumMap<>(Track.class);
        tracks.put(Track.BASIS, TrackState.initial(Track.BASIS, TrackStatus.DRAFT));
        tracks.put(Track.COMPENSATION, TrackState.initial(Track.COMPENSATION, TrackStatus.NOT_APPLICABLE));
        tracks.put(Track.DEADLINE, TrackState.initial(Track.DEADLINE, TrackStatus.NOT_APPLICABLE));
        return new CaseState(
                event.aggregateId(),
                created.title(),
                created.projectId(),
                created.reference(),
                event.occurredAt(),
                event.actorId(),
                tracks,
                null,
                false,
                null,
                1,
                event.occurredAt());
    }

    @Override
    protected CaseState transition(CaseState state, CaseEventType type, DomainEvent event) {
        Instant at = event.occurredAt();
        return switch (type.kind()) {
            case CREATION -> throw new MalformedSequenceException(state.aggregateId(), "repeated creation");
            case SUBMISSION -> submit(state, track(type), event);
            case UPDATE -> updateTrack(state, track(type), state.track(track(type)).revised(event.payload(), at), at);
            case WITHDRAWAL -> updateTrack(
                    state, track(type), state.track(track(type)).withStatus(TrackStatus.WITHDRAWN, at), at);
            case RESPONSE -> respond(state, track(type), event.payloadAs(TrackResponse.class), at);
            case CHANGE_ORDER -> issueChangeOrder(state, event);
            case CLOSURE -> close(state, event.payloadAs(CaseClosed.class), at);
        };
    }

    @Override
    protected String aggregateId(CaseState state) {
        return state.aggregateId();
    }

    private static Track track(CaseEventType type) {
        return type.track().orElseThrow(() -> new IllegalStateException(type + " has no track"));
    }

    private static CaseState submit(CaseState state, Track track, DomainEvent event) {
        Instant at = event.occurredAt();
        Map<Track, TrackState> tracks = new EnumMap<>(state.tracks());
        tracks.put(track, state.track(track).submitted(event.payload(), at));
        if (track == Track.BASIS) {
            // A submitted basis opens the two dependent tracks for drafting.
            for (Track dependent : new Track[] {Track.COMPENSATION, Track.DEADLINE}) {
                TrackState current = tracks.get(dependent);
                if (current.status() == TrackStatus.NOT_APPLICABLE) {
                    tracks.put(dependent, current.withStatus(TrackStatus.DRAFT, current.lastUpdated()));
                }
            }
        }
        return withTracks(state, tracks, at);
    }

    private static CaseState respond(CaseState state, Track track, TrackResponse response, Instant at) {
        TrackStatus status;
        boolean lock = false;
        switch (response.result()) {
            case APPROVED -> {
                status = track == Track.BASIS ? TrackStatus.LOCKED : TrackStatus.APPROVED;
                lock = true;
            }
            case PARTIALLY_APPROVED -> status = TrackStatus.PARTIALLY_APPROVED;
            case REJECTED -> status = TrackStatus.REJECTED;
            case NEEDS_CLARIFICATION -> status = TrackStatus.UNDER_NEGOTIATION;
            default -> throw new IllegalStateException("Unexpected decision " + response.result());
        }
        return updateTrack(state, track, state.track(track).answered(response, status, lock, at), at);
    }

    private static CaseState issueChangeOrder(CaseState state, DomainEvent event) {
        ChangeOrderIssued issued = event.payloadAs(ChangeOrderIssued.class);
        ChangeOrder order = new ChangeOrder(
                issued.orderNumber(), issued.agreedAmount(), issued.agreedDays(), event.occurredAt(), event.actorId());
        return new CaseState(
                state.aggregateId(),
                state.title(),
                state.projectId(),
                state.reference(),
                state.createdAt(),
                state.createdBy(),
                state.tracks(),
                order,
                true,
                state.closeReason(),
                state.eventCount() + 1,
                event.occurredAt());
    }

    private static CaseState close(CaseState state, CaseClosed closed, Instant at) {
        return new CaseState(
                state.aggregateId(),
                state.title(),
                state.projectId(),
                state.reference(),
                state.createdAt(),
                state.createdBy(),
                state.tracks(),
                state.changeOrder(),
                true,
                closed.reason(),
                state.eventCount() + 1,
                at);
    }

    private static CaseState updateTrack(CaseState state, Track track, TrackState updated, Instant at) {
        Map<Track, TrackState> tracks = new EnumMap<>(state.tracks());
        tracks.put(track, updated);
        return withTracks(state, tracks, at);
    }

    private static CaseState withTracks(CaseState state, Map<Track, TrackState> tracks, Instant at) {
        return new CaseState(
                state.aggregateId(),
                state.title(),
                state.projectId(),
                state.reference(),
                state.createdAt(),
                state.createdBy(),
                tracks,
                state.changeOrder(),
                state.closed(),
                state.closeReason(),
                state.eventCount() + 1,
                at);
    }
}
