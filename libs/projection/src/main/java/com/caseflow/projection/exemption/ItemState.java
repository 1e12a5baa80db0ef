package com.caseflow.projection.exemption;

import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.ItemDecision;
import com.caseflow.eventmodel.payload.ItemDetails;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An item of an application with the decisions the stages made on it.
 *
 * @param details the item as last written by the applicant
 * @param decisions per-stage decisions
 */
public record ItemState(ItemDetails details, Map<ApprovalStage, ItemDecision> decisions) {

    private static final List<ApprovalStage> PRECEDENCE = List.of(
            ApprovalStage.OWNER, ApprovalStage.WORKING_GROUP, ApprovalStage.PROJECT_LEAD, ApprovalStage.ADVISOR);

    public ItemState {
        decisions = decisions.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(decisions));
    }

    public static ItemState of(ItemDetails details) {
        return new ItemState(details, Map.of());
    }

    public String itemId() {
        return details.itemId();
    }

    /**
     * The item's outcome: the decision of the latest stage that decided it. A
     * {@link Decision#NEEDS_CLARIFICATION} counts as not assessed.
     */
    public Optional<Decision> outcome() {
        for (ApprovalStage stage : PRECEDENCE) {
            ItemDecision decision = decisions.get(stage);
            if (decision != null) {
                return decision.decision() == Decision.NEEDS_CLARIFICATION
                        ? Optional.empty()
                        : Optional.of(decision.decision());
            }
        }
        return Optional.empty();
    }

    ItemState withDetails(ItemDetails newDetails) {
        return new ItemState(newDetails, decisions);
    }

    ItemState withDecision(ApprovalStage stage, ItemDecision decision) {
        Map<ApprovalStage, ItemDecision> copy = new EnumMap<>(ApprovalStage.class);
        copy.putAll(decisions);
        copy.put(stage, decision);
        return new ItemState(details, copy);
    }
}
