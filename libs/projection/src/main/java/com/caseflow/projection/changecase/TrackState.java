package com.caseflow.projection.changecase;

import com.caseflow.eventmodel.Track;
import com.caseflow.eventmodel.payload.EventPayload;
import com.caseflow.eventmodel.payload.TrackResponse;
import java.time.Instant;
import java.util.Optional;

/**
 * State of one claim track.
 *
 * @param track which track
 * @param status current status
 * @param locked set once the client approves; no further claim events are accepted
 * @param revision number of claim versions sent (0 before the first submission)
 * @param claim the latest claim payload, replaced wholesale by updates
 * @param response the client's latest response
 * @param respondedRevision the claim revision the latest response answered
 * @param lastUpdated timestamp of the last event on this track
 */
public record TrackState(
        Track track,
        TrackStatus status,
        boolean locked,
        int revision,
        EventPayload claim,
        TrackResponse response,
        int respondedRevision,
        Instant lastUpdated) {

    static TrackState initial(Track track, TrackStatus status) {
        return new TrackState(track, status, false, 0, null, null, 0, null);
    }

    /** Returns the claim as the expected payload type, if one was sent. */
    public <P extends EventPayload> Optional<P> claimAs(Class<P> type) {
        return type.isInstance(claim) ? Optional.of(type.cast(claim)) : Optional.empty();
    }

    public Optional<TrackResponse> latestResponse() {
        return Optional.ofNullable(response);
    }

    /** Whether the latest response answered an older revision than the current claim. */
    public boolean hasUnansweredRevision() {
        return response != null && respondedRevision < revision;
    }

    TrackState withStatus(TrackStatus newStatus, Instant at) {
        return new TrackState(track, newStatus, locked, revision, claim, response, respondedRevision, at);
    }

    TrackState submitted(EventPayload newClaim, Instant at) {
        return new TrackState(track, TrackStatus.SUBMITTED, false, 1, newClaim, null, 0, at);
    }

    TrackState revised(EventPayload newClaim, Instant at) {
        TrackStatus next = status.isInDispute() ? TrackStatus.SUBMITTED : status;
        return new TrackState(track, next, locked, revision + 1, newClaim, response, respondedRevision, at);
    }

    TrackState answered(TrackResponse newResponse, TrackStatus newStatus, boolean lock, Instant at) {
        return new TrackState(track, newStatus, locked || lock, revision, claim, newResponse, revision, at);
    }
}
