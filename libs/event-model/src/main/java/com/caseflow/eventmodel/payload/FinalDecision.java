package com.caseflow.eventmodel.payload;

import java.util.List;

/**
 * The owner's final decision.
 *
 * <p>When {@code followsWorkingGroup} is false the owner departs from the working group's
 * recommendation and must give a rationale.
 *
 * @param decision overall decision, never {@link Decision#NEEDS_CLARIFICATION}
 * @param followsWorkingGroup whether the decision follows the working group
 * @param rationale reason for the decision, required when diverging
 * @param itemDecisions per-item decisions; when empty the overall decision applies to every item
 */
public record FinalDecision(
        Decision decision,
        boolean followsWorkingGroup,
        String rationale,
        List<ItemDecision> itemDecisions)
        implements EventPayload {

    public FinalDecision {
        itemDecisions = itemDecisions == null ? List.of() : List.copyOf(itemDecisions);
    }
}
