package com.caseflow.projection.changecase;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.Track;
import com.caseflow.eventmodel.payload.CompensationClaim;
import com.caseflow.eventmodel.payload.DeadlineClaim;
import com.caseflow.eventmodel.payload.TrackResponse;
import com.caseflow.projection.AggregateState;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Current state of a change-claim case, folded from its log.
 *
 * <p>Only facts taken from events are stored. Overall status, change-order readiness, next
 * action and totals are computed from them on every call.
 *
 * @param aggregateId the case
 * @param title case title
 * @param projectId owning project
 * @param reference external reference, nullable
 * @param createdAt when the case was created
 * @param createdBy who created it
 * @param tracks state of each track
 * @param changeOrder the issued change order, null until issued
 * @param closed whether the case is closed
 * @param closeReason why it was closed without a change order, nullable
 * @param eventCount number of events folded
 * @param lastActivityAt timestamp of the latest event
 */
public record CaseState(
        String aggregateId,
        String title,
        String projectId,
        String reference,
        Instant createdAt,
        String createdBy,
        Map<Track, TrackState> tracks,
        ChangeOrder changeOrder,
        boolean closed,
        String closeReason,
        int eventCount,
        Instant lastActivityAt)
        implements AggregateState {

    private static final List<Track> ORDER = List.of(Track.BASIS, Track.COMPENSATION, Track.DEADLINE);

    public CaseState {
        tracks = Collections.unmodifiableMap(new EnumMap<>(tracks));
    }

    public TrackState track(Track track) {
        return tracks.get(track);
    }

    public TrackState basis() {
        return track(Track.BASIS);
    }

    public TrackState compensation() {
        return track(Track.COMPENSATION);
    }

    public TrackState deadline() {
        return track(Track.DEADLINE);
    }

    /** Overall status derived from the track statuses. */
    public OverallStatus overallStatus() {
        if (closed) {
            return OverallStatus.CLOSED;
        }
        List<TrackStatus> active =
                ORDER.stream().map(t -> track(t).status()).filter(s -> s != TrackStatus.NOT_APPLICABLE).toList();
        if (active.isEmpty()) {
            return OverallStatus.NO_ACTIVE_TRACKS;
        }
        if (active.stream().allMatch(TrackStatus::isFinished)
                && active.stream().anyMatch(TrackStatus::isAgreed)) {
            return OverallStatus.AGREED;
        }
        if (active.stream().allMatch(s -> s == TrackStatus.WITHDRAWN)) {
            return OverallStatus.WITHDRAWN;
        }
        if (active.stream().anyMatch(TrackStatus::isInDispute)) {
            return OverallStatus.UNDER_NEGOTIATION;
        }
        if (active.contains(TrackStatus.UNDER_REVIEW)) {
            return OverallStatus.UNDER_REVIEW;
        }
        if (active.contains(TrackStatus.SUBMITTED)) {
            return OverallStatus.AWAITING_RESPONSE;
        }
        if (active.contains(TrackStatus.DRAFT)
                && active.stream().allMatch(s -> s == TrackStatus.DRAFT || s.isFinished())) {
            return OverallStatus.DRAFT;
        }
        return OverallStatus.UNKNOWN;
    }

    /**
     * Whether the client may issue the change order: the basis is agreed and every other track is
     * agreed, withdrawn, or was never claimed.
     */
    public boolean canIssueChangeOrder() {
        if (closed || !basis().status().isAgreed()) {
            return false;
        }
        return isSettledOrUnclaimed(compensation().status()) && isSettledOrUnclaimed(deadline().status());
    }

    private static boolean isSettledOrUnclaimed(TrackStatus status) {
        return !status.isClaimed() || status.isFinished();
    }

    /** Suggests who should do what next; empty once the case is closed or nothing is pending. */
    public Optional<NextAction> nextAction() {
        if (closed) {
            return Optional.empty();
        }
        for (Track track : ORDER) {
            TrackStatus status = track(track).status();
            String name = track.name().toLowerCase();
            if (status == TrackStatus.DRAFT) {
                return Optional.of(new NextAction(ActorRole.CONTRACTOR, "Submit " + name + " claim", track));
            }
            if (status.isAwaitingClient()) {
                return Optional.of(new NextAction(ActorRole.CLIENT, "Respond to " + name + " claim", track));
            }
            if (status.isInDispute()) {
                return Optional.of(
                        new NextAction(ActorRole.CONTRACTOR, "Update or withdraw " + name + " claim", track));
            }
        }
        if (canIssueChangeOrder()) {
            return Optional.of(new NextAction(ActorRole.CLIENT, "Issue change order", null));
        }
        return Optional.empty();
    }

    /** Claimed compensation, zero when no live claim exists. */
    public BigDecimal totalClaimed() {
        if (!isLive(compensation())) {
            return BigDecimal.ZERO;
        }
        return compensation().claimAs(CompensationClaim.class)
                .map(CompensationClaim::amount)
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Approved compensation: the approved amount of the latest response, or the claimed amount
     * for a full approval that named none.
     */
    public BigDecimal totalApproved() {
        TrackState track = compensation();
        if (!isLive(track) || !isGranted(track.status())) {
            return BigDecimal.ZERO;
        }
        BigDecimal approved = track.latestResponse().map(TrackResponse::approvedAmount).orElse(null);
        if (approved != null) {
            return approved;
        }
        return track.status().isAgreed() ? totalClaimed() : BigDecimal.ZERO;
    }

    /** Claimed extension in days, zero when no live claim names days. */
    public int daysClaimed() {
        if (!isLive(deadline())) {
            return 0;
        }
        return deadline().claimAs(DeadlineClaim.class)
                .map(DeadlineClaim::days)
                .orElse(0);
    }

    /** Approved extension in days, following the same rules as {@link #totalApproved()}. */
    public int daysApproved() {
        TrackState track = deadline();
        if (!isLive(track) || !isGranted(track.status())) {
            return 0;
        }
        Integer approved = track.latestResponse().map(TrackResponse::approvedDays).orElse(null);
        if (approved != null) {
            return approved;
        }
        return track.status().isAgreed() ? daysClaimed() : 0;
    }

    private static boolean isLive(TrackState track) {
        return track.status().isClaimed() && track.status() != TrackStatus.WITHDRAWN;
    }

    private static boolean isGranted(TrackStatus status) {
        return status.isAgreed() || status == TrackStatus.PARTIALLY_APPROVED;
    }
}
