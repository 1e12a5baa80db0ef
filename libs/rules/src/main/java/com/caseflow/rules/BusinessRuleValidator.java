package com.caseflow.rules;

import com.caseflow.eventmodel.CaseEventType;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.ExemptionEventType;
import com.caseflow.eventmodel.KnownEventType;
import com.caseflow.eventmodel.Track;
import com.caseflow.eventmodel.payload.FinalDecision;
import com.caseflow.eventmodel.payload.ItemDecision;
import com.caseflow.eventmodel.payload.ItemDetails;
import com.caseflow.eventmodel.payload.ItemRemoval;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.projection.MalformedSequenceException;
import com.caseflow.projection.changecase.CaseState;
import com.caseflow.projection.changecase.TrackState;
import com.caseflow.projection.changecase.TrackStatus;
import com.caseflow.projection.exemption.ApprovalStage;
import com.caseflow.projection.exemption.ExemptionState;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a candidate event may be appended to an aggregate in a given state.
 *
 * <p>Checks are pure and run before the append. Rules are evaluated in a fixed order, role
 * first, and evaluation stops at the first violation. Structural payload checks belong to
 * {@link com.caseflow.eventmodel.EventValidator} and are assumed to have passed.
 */
public final class BusinessRuleValidator {

    private static final Logger log = LoggerFactory.getLogger(BusinessRuleValidator.class);

    private BusinessRuleValidator() {
        // utility class
    }

    /**
     * Checks the first event of a new aggregate. Only the role is checked.
     *
     * @throws MalformedSequenceException if the event is not a creation event
     */
    public static ValidationResult validateCreation(DomainEvent candidate) {
        KnownEventType type = known(candidate);
        if (type == null) {
            return denied(candidate, Rule.ROLE_CHECK, "unknown event type cannot be submitted");
        }
        if (!type.isCreation()) {
            throw new MalformedSequenceException(
                    candidate.aggregateId(), type.value() + " cannot start a log; the aggregate does not exist");
        }
        return checkRole(candidate, type);
    }

    /**
     * Checks an event against the current state of a change case.
     *
     * @throws MalformedSequenceException if the event would create the case a second time
     */
    public static ValidationResult validate(DomainEvent candidate, CaseState state) {
        if (!(candidate.eventType() instanceof CaseEventType type)) {
            return denied(candidate, Rule.ROLE_CHECK, "not a change case event: " + typeName(candidate));
        }
        if (type.isCreation()) {
            throw repeatedCreation(candidate, type);
        }
        ValidationResult role = checkRole(candidate, type);
        if (!role.allowed()) {
            return role;
        }
        if (state.overallStatus().isClosed() && type != CaseEventType.CHANGE_ORDER_ISSUED) {
            return denied(candidate, Rule.CASE_NOT_CLOSED, "case is " + state.overallStatus());
        }
        ValidationResult result = switch (type.kind()) {
            case CREATION -> throw repeatedCreation(candidate, type);
            case SUBMISSION -> checkSubmission(state, type);
            case UPDATE -> checkClaimChange(state, type, true);
            case WITHDRAWAL -> checkClaimChange(state, type, false);
            case RESPONSE -> checkResponse(state, type);
            case CHANGE_ORDER -> checkChangeOrder(state);
            case CLOSURE -> ValidationResult.ok();
        };
        return logged(candidate, result);
    }

    /**
     * Checks an event against the current state of an exemption application.
     *
     * @throws MalformedSequenceException if the event would create the application a second time
     */
    public static ValidationResult validate(DomainEvent candidate, ExemptionState state) {
        if (!(candidate.eventType() instanceof ExemptionEventType type)) {
            return denied(candidate, Rule.ROLE_CHECK, "not an exemption event: " + typeName(candidate));
        }
        if (type.isCreation()) {
            throw repeatedCreation(candidate, type);
        }
        ValidationResult role = checkRole(candidate, type);
        if (!role.allowed()) {
            return role;
        }
        if (state.isFinal()) {
            return denied(candidate, Rule.CASE_NOT_CLOSED, "application is " + state.status());
        }
        ValidationResult result = switch (type) {
            case APPLICATION_CREATED -> throw repeatedCreation(candidate, type);
            case APPLICATION_UPDATED -> checkEditable(state);
            case ITEM_ADDED -> checkItemEdit(state, candidate.payloadAs(ItemDetails.class).itemId(), false);
            case ITEM_UPDATED -> checkItemEdit(state, candidate.payloadAs(ItemDetails.class).itemId(), true);
            case ITEM_REMOVED -> checkItemEdit(state, candidate.payloadAs(ItemRemoval.class).itemId(), true);
            case APPLICATION_SUBMITTED -> checkApplicationSubmission(state);
            case APPLICATION_WITHDRAWN -> ValidationResult.ok();
            case ADVISOR_REVIEWED, PROJECT_LEAD_REVIEWED, WORKING_GROUP_REVIEWED ->
                    checkReview(state, type, candidate.payloadAs(StageReview.class).itemDecisions());
            case ADVISOR_RETURNED, PROJECT_LEAD_RETURNED -> checkStage(state, type);
            case OWNER_DECIDED -> checkOwnerDecision(state, type, candidate.payloadAs(FinalDecision.class));
        };
        return logged(candidate, result);
    }

    // ---- Shared ----

    private static MalformedSequenceException repeatedCreation(DomainEvent candidate, KnownEventType type) {
        return new MalformedSequenceException(
                candidate.aggregateId(), type.value() + " repeats the creation of an existing aggregate");
    }

    private static ValidationResult checkRole(DomainEvent candidate, KnownEventType type) {
        if (candidate.actorRole() != type.allowedRole()) {
            return denied(
                    candidate,
                    Rule.ROLE_CHECK,
                    "%s may only be submitted by %s, not %s".formatted(type.value(), type.allowedRole(), candidate.actorRole()));
        }
        return ValidationResult.ok();
    }

    // ---- Change case ----

    private static ValidationResult checkSubmission(CaseState state, CaseEventType type) {
        Track track = trackOf(type);
        TrackState current = state.track(track);
        if (isLocked(current)) {
            return ValidationResult.deny(Rule.NOT_LOCKED, "%s track is %s".formatted(track, current.status()));
        }
        if (track != Track.BASIS && !state.basis().status().isClaimed()) {
            return ValidationResult.deny(
                    Rule.PREREQUISITE_REQUIRED, "%s claim needs a submitted basis".formatted(track));
        }
        if (current.status().isClaimed()) {
            return ValidationResult.deny(
                    Rule.NOT_LOCKED, "%s track already has a claim, use an update".formatted(track));
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkClaimChange(CaseState state, CaseEventType type, boolean update) {
        Track track = trackOf(type);
        TrackState current = state.track(track);
        if (isLocked(current)) {
            return ValidationResult.deny(Rule.NOT_LOCKED, "%s track is %s".formatted(track, current.status()));
        }
        if (!current.status().isClaimed()) {
            return ValidationResult.deny(
                    Rule.ACTIVE_CLAIM_EXISTS,
                    "no %s claim to %s".formatted(track, update ? "update" : "withdraw"));
        }
        if (update && track != Track.BASIS && !state.basis().status().isClaimed()) {
            return ValidationResult.deny(
                    Rule.PREREQUISITE_REQUIRED, "%s claim needs a submitted basis".formatted(track));
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkResponse(CaseState state, CaseEventType type) {
        Track track = trackOf(type);
        TrackStatus status = state.track(track).status();
        if (!status.isClaimed() || status == TrackStatus.WITHDRAWN) {
            return ValidationResult.deny(
                    Rule.TRACK_SUBMITTED_REQUIRED, "%s track has no outstanding claim (%s)".formatted(track, status));
        }
        if (state.track(track).locked()) {
            return ValidationResult.deny(Rule.NOT_LOCKED, "%s track is already agreed".formatted(track));
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkChangeOrder(CaseState state) {
        if (state.closed()) {
            return ValidationResult.deny(Rule.CASE_NOT_CLOSED, "case is already closed");
        }
        if (!state.canIssueChangeOrder()) {
            return ValidationResult.deny(
                    Rule.FINAL_ACTION_READY,
                    "tracks not settled: basis %s, compensation %s, deadline %s"
                            .formatted(
                                    state.basis().status(),
                                    state.compensation().status(),
                                    state.deadline().status()));
        }
        return ValidationResult.ok();
    }

    private static boolean isLocked(TrackState track) {
        return track.locked() || track.status().isFinished();
    }

    private static Track trackOf(CaseEventType type) {
        return type.track().orElseThrow(() -> new IllegalStateException(type + " has no track"));
    }

    // ---- Exemption ----

    private static ValidationResult checkEditable(ExemptionState state) {
        if (!state.isEditable()) {
            return ValidationResult.deny(Rule.NOT_LOCKED, "application is " + state.status());
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkItemEdit(ExemptionState state, String itemId, boolean mustExist) {
        ValidationResult editable = checkEditable(state);
        if (!editable.allowed()) {
            return editable;
        }
        boolean exists = state.item(itemId).isPresent();
        if (mustExist && !exists) {
            return ValidationResult.deny(Rule.ACTIVE_CLAIM_EXISTS, "no item " + itemId);
        }
        if (!mustExist && exists) {
            return ValidationResult.deny(Rule.ACTIVE_CLAIM_EXISTS, "item " + itemId + " already exists");
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkApplicationSubmission(ExemptionState state) {
        ValidationResult editable = checkEditable(state);
        if (!editable.allowed()) {
            return editable;
        }
        if (!state.canSubmit()) {
            return ValidationResult.deny(
                    Rule.PREREQUISITE_REQUIRED, "a machine application needs at least one item");
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkStage(ExemptionState state, ExemptionEventType type) {
        ApprovalStage stage = ApprovalStage.of(type)
                .orElseThrow(() -> new IllegalStateException(type + " has no stage"));
        Optional<ApprovalStage> current = state.chain().currentStage();
        if (current.filter(stage::equals).isEmpty() || state.status() != stage.awaitingStatus()) {
            return ValidationResult.deny(
                    Rule.STEP_ORDER,
                    "%s cannot act: application is %s, chain at %s"
                            .formatted(stage, state.status(), current.map(Enum::name).orElse("end")));
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkReview(
            ExemptionState state, ExemptionEventType type, List<ItemDecision> decisions) {
        ValidationResult order = checkStage(state, type);
        if (!order.allowed()) {
            return order;
        }
        for (ItemDecision decision : decisions) {
            if (state.item(decision.itemId()).isEmpty()) {
                return ValidationResult.deny(Rule.ACTIVE_CLAIM_EXISTS, "decision for unknown item " + decision.itemId());
            }
        }
        return ValidationResult.ok();
    }

    private static ValidationResult checkOwnerDecision(
            ExemptionState state, ExemptionEventType type, FinalDecision decision) {
        ValidationResult review = checkReview(state, type, decision.itemDecisions());
        if (!review.allowed()) {
            return review;
        }
        boolean diverges = !decision.followsWorkingGroup()
                || state.workingGroupRecommendation().filter(decision.decision()::equals).isEmpty();
        if (diverges && (decision.rationale() == null || decision.rationale().isBlank())) {
            return ValidationResult.deny(
                    Rule.RATIONALE_REQUIRED,
                    "decision %s departs from the working group recommendation %s"
                            .formatted(decision.decision(), state.workingGroupRecommendation().orElse(null)));
        }
        return ValidationResult.ok();
    }

    // ---- Helpers ----

    private static KnownEventType known(DomainEvent candidate) {
        return candidate.knownType().orElse(null);
    }

    private static String typeName(DomainEvent candidate) {
        return candidate.eventType() == null ? "null" : candidate.eventType().value();
    }

    private static ValidationResult denied(DomainEvent candidate, Rule rule, String message) {
        return logged(candidate, ValidationResult.deny(rule, message));
    }

    private static ValidationResult logged(DomainEvent candidate, ValidationResult result) {
        if (!result.allowed()) {
            log.debug(
                    "Denied {} on {} by {}: {}",
                    typeName(candidate),
                    candidate.aggregateId(),
                    result.violatedRule(),
                    result.message());
        }
        return result;
    }
}
