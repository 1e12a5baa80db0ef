package com.caseflow.projection.exemption;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.ExemptionEventType;
import com.caseflow.eventmodel.payload.ApplicationDetails;
import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.FinalDecision;
import com.caseflow.eventmodel.payload.ItemDecision;
import com.caseflow.eventmodel.payload.ItemDetails;
import com.caseflow.eventmodel.payload.ItemRemoval;
import com.caseflow.eventmodel.payload.StageReturn;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.eventmodel.payload.Withdrawal;
import com.caseflow.projection.MalformedSequenceException;
import com.caseflow.projection.TypedProjector;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Folds an exemption application log into {@link ExemptionState}. */
public final class ExemptionProjector extends TypedProjector<ExemptionState, ExemptionEventType> {

    public ExemptionProjector() {
        super(ExemptionEventType.class);
    }

    @Override
    protected ExemptionState create(ExemptionEventType type, DomainEvent event) {
        return new ExemptionState(
                event.aggregateId(),
                event.payloadAs(ApplicationDetails.class),
                Map.of(),
                ApprovalChain.initial(),
                ExemptionStatus.DRAFT,
                0,
                event.occurredAt(),
                event.actorId(),
                null,
                null,
                null,
                1,
                event.occurredAt());
    }

    @Override
    protected ExemptionState transition(ExemptionState state, ExemptionEventType type, DomainEvent event) {
        Builder next = new Builder(state, event.occurredAt());
        switch (type) {
            case APPLICATION_CREATED -> throw new MalformedSequenceException(state.aggregateId(), "repeated creation");
            case APPLICATION_UPDATED -> next.details = event.payloadAs(ApplicationDetails.class);
            case ITEM_ADDED -> {
                ItemDetails item = event.payloadAs(ItemDetails.class);
                next.items.put(item.itemId(), ItemState.of(item));
            }
            case ITEM_UPDATED -> {
                ItemDetails item = event.payloadAs(ItemDetails.class);
                ItemState current = next.items.get(item.itemId());
                next.items.put(item.itemId(), current == null ? ItemState.of(item) : current.withDetails(item));
            }
            case ITEM_REMOVED -> next.items.remove(event.payloadAs(ItemRemoval.class).itemId());
            case APPLICATION_SUBMITTED -> {
                ApprovalStage awaited = state.chain().currentStage()
                        .orElseThrow(() -> malformed(state, event, "submitted after the chain completed"));
                next.status = awaited.awaitingStatus();
                next.submissionCount++;
                next.submittedAt = event.occurredAt();
            }
            case APPLICATION_WITHDRAWN -> {
                next.status = ExemptionStatus.WITHDRAWN;
                next.withdrawReason = event.payloadAs(Withdrawal.class).reason();
            }
            case ADVISOR_REVIEWED, PROJECT_LEAD_REVIEWED, WORKING_GROUP_REVIEWED ->
                    review(next, stageOf(type), event.payloadAs(StageReview.class), event);
            case ADVISOR_RETURNED, PROJECT_LEAD_RETURNED ->
                    returnApplication(next, stageOf(type), event.payloadAs(StageReturn.class), event);
            case OWNER_DECIDED -> decide(next, event.payloadAs(FinalDecision.class), event);
        }
        return next.build();
    }

    @Override
    protected String aggregateId(ExemptionState state) {
        return state.aggregateId();
    }

    private static ApprovalStage stageOf(ExemptionEventType type) {
        return ApprovalStage.of(type).orElseThrow(() -> new IllegalStateException(type + " has no stage"));
    }

    private static void review(Builder next, ApprovalStage stage, StageReview review, DomainEvent event) {
        requireAt(next, stage, event);
        next.chain = next.chain.complete(
                stage,
                StepState.completed(
                        stage,
                        review.recommendation(),
                        review.documentationSufficient(),
                        review.comment(),
                        event.actorId(),
                        event.occurredAt()));
        recordDecisions(next, stage, review.itemDecisions());
        next.status = stage.next()
                .map(ApprovalStage::awaitingStatus)
                .orElseThrow(() -> new IllegalStateException(stage + " is not a reviewing stage"));
    }

    private static void returnApplication(Builder next, ApprovalStage stage, StageReturn ret, DomainEvent event) {
        requireAt(next, stage, event);
        next.chain = next.chain.returnAt(
                stage, StepState.returned(stage, ret.missingDocumentation(), event.actorId(), event.occurredAt()));
        next.status = stage == ApprovalStage.ADVISOR
                ? ExemptionStatus.RETURNED_BY_ADVISOR
                : ExemptionStatus.RETURNED_BY_PROJECT_LEAD;
    }

    private static void decide(Builder next, FinalDecision decision, DomainEvent event) {
        requireAt(next, ApprovalStage.OWNER, event);
        next.chain = next.chain.complete(
                ApprovalStage.OWNER,
                StepState.completed(
                        ApprovalStage.OWNER,
                        decision.decision(),
                        true,
                        decision.rationale(),
                        event.actorId(),
                        event.occurredAt()));
        if (decision.itemDecisions().isEmpty()) {
            // A blanket approval or rejection covers every item; a partial one leaves them as they are.
            if (decision.decision() == Decision.APPROVED || decision.decision() == Decision.REJECTED) {
                next.items.replaceAll((id, item) -> item.withDecision(
                        ApprovalStage.OWNER, new ItemDecision(id, decision.decision(), null)));
            }
        } else {
            recordDecisions(next, ApprovalStage.OWNER, decision.itemDecisions());
        }
        next.status = switch (decision.decision()) {
            case APPROVED -> ExemptionStatus.APPROVED;
            case PARTIALLY_APPROVED -> ExemptionStatus.PARTIALLY_APPROVED;
            case REJECTED -> ExemptionStatus.REJECTED;
            case NEEDS_CLARIFICATION -> throw malformed(next.source, event, "owner decision cannot ask for clarification");
        };
        next.decidedAt = event.occurredAt();
    }

    private static void recordDecisions(Builder next, ApprovalStage stage, List<ItemDecision> decisions) {
        for (ItemDecision decision : decisions) {
            ItemState item = next.items.get(decision.itemId());
            if (item == null) {
                throw new MalformedSequenceException(
                        next.source.aggregateId(), stage + " decided unknown item " + decision.itemId());
            }
            next.items.put(decision.itemId(), item.withDecision(stage, decision));
        }
    }

    private static void requireAt(Builder next, ApprovalStage stage, DomainEvent event) {
        if (!next.chain.isAt(stage) || next.status != stage.awaitingStatus()) {
            throw malformed(
                    next.source,
                    event,
                    "%s acted while the application is %s".formatted(stage, next.status));
        }
    }

    private static MalformedSequenceException malformed(ExemptionState state, DomainEvent event, String message) {
        return new MalformedSequenceException(state.aggregateId(), "event " + event.eventId() + ": " + message);
    }

    /** Mutable scratch copy of a state, used while applying one event. */
    private static final class Builder {
        private final ExemptionState source;
        private final Instant at;
        private ApplicationDetails details;
        private final Map<String, ItemState> items;
        private ApprovalChain chain;
        private ExemptionStatus status;
        private int submissionCount;
        private Instant submittedAt;
        private Instant decidedAt;
        private String withdrawReason;

        Builder(ExemptionState source, Instant at) {
            this.source = source;
            this.at = at;
            this.details = source.details();
            this.items = new LinkedHashMap<>(source.items());
            this.chain = source.chain();
            this.status = source.status();
            this.submissionCount = source.submissionCount();
            this.submittedAt = source.submittedAt();
            this.decidedAt = source.decidedAt();
            this.withdrawReason = source.withdrawReason();
        }

        ExemptionState build() {
            return new ExemptionState(
                    source.aggregateId(),
                    details,
                    items,
                    chain,
                    status,
                    submissionCount,
                    source.createdAt(),
                    source.createdBy(),
                    submittedAt,
                    decidedAt,
                    withdrawReason,
                    source.eventCount() + 1,
                    at);
        }
    }
}
