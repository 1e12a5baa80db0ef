package com.caseflow.projection.exemption;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.payload.ApplicationDetails;
import com.caseflow.eventmodel.payload.ApplicationType;
import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.projection.AggregateState;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Current state of an exemption application, folded from its log.
 *
 * @param aggregateId the application
 * @param details header data as last written
 * @param items items by id, in the order they were added
 * @param chain the approval chain
 * @param status lifecycle status
 * @param submissionCount how often the application was submitted
 * @param createdAt creation time
 * @param createdBy the applicant
 * @param submittedAt latest submission time, null before the first
 * @param decidedAt time of the owner's decision, null until decided
 * @param withdrawReason reason given on withdrawal, nullable
 * @param eventCount number of events folded
 * @param lastActivityAt timestamp of the latest event
 */
public record ExemptionState(
        String aggregateId,
        ApplicationDetails details,
        Map<String, ItemState> items,
        ApprovalChain chain,
        ExemptionStatus status,
        int submissionCount,
        Instant createdAt,
        String createdBy,
        Instant submittedAt,
        Instant decidedAt,
        String withdrawReason,
        int eventCount,
        Instant lastActivityAt)
        implements AggregateState {

    public ExemptionState {
        items = Collections.unmodifiableMap(new LinkedHashMap<>(items));
    }

    public Optional<ItemState> item(String itemId) {
        return Optional.ofNullable(items.get(itemId));
    }

    public boolean isEditable() {
        return status.isEditable();
    }

    public boolean isFinal() {
        return status.isFinal();
    }

    /** Machine applications cannot be submitted without items. */
    public boolean canSubmit() {
        if (!isEditable()) {
            return false;
        }
        return details.applicationType() != ApplicationType.MACHINE || !items.isEmpty();
    }

    /**
     * Aggregate outcome over all items: all approved gives APPROVED, all rejected gives REJECTED,
     * any other mix gives PARTIALLY_APPROVED. Empty while there are no items or any item is
     * unassessed.
     */
    public Optional<Decision> aggregateOutcome() {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        List<Optional<Decision>> outcomes =
                items.values().stream().map(ItemState::outcome).toList();
        if (outcomes.stream().anyMatch(Optional::isEmpty)) {
            return Optional.empty();
        }
        if (outcomes.stream().allMatch(o -> o.get() == Decision.APPROVED)) {
            return Optional.of(Decision.APPROVED);
        }
        if (outcomes.stream().allMatch(o -> o.get() == Decision.REJECTED)) {
            return Optional.of(Decision.REJECTED);
        }
        return Optional.of(Decision.PARTIALLY_APPROVED);
    }

    public long approvedItemCount() {
        return countOutcome(Decision.APPROVED);
    }

    public long rejectedItemCount() {
        return countOutcome(Decision.REJECTED);
    }

    public long unassessedItemCount() {
        return items.values().stream().filter(i -> i.outcome().isEmpty()).count();
    }

    private long countOutcome(Decision decision) {
        return items.values().stream()
                .filter(i -> i.outcome().filter(decision::equals).isPresent())
                .count();
    }

    /** The working group's recommendation, once it has reviewed. */
    public Optional<Decision> workingGroupRecommendation() {
        StepState step = chain.step(ApprovalStage.WORKING_GROUP);
        return step.completed() ? Optional.ofNullable(step.decision()) : Optional.empty();
    }

    public Optional<NextStep> nextStep() {
        if (status.isFinal()) {
            return Optional.empty();
        }
        if (status.isEditable()) {
            String action = canSubmit() ? "Submit application" : "Add at least one item";
            return Optional.of(new NextStep(ActorRole.APPLICANT, action, null));
        }
        return chain.currentStage().map(stage -> new NextStep(
                stage.role(),
                stage == ApprovalStage.OWNER ? "Decide application" : "Review application",
                stage));
    }
}
