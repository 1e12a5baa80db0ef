package com.caseflow.eventmodel.payload;

import java.util.List;

/**
 * Completes one approval stage.
 *
 * @param itemDecisions per-item decisions, may be empty for stages that only recommend
 * @param recommendation the stage's aggregate recommendation
 * @param documentationSufficient whether the documentation was judged sufficient
 * @param comment free-text comment
 */
public record StageReview(
        List<ItemDecision> itemDecisions,
        Decision recommendation,
        boolean documentationSufficient,
        String comment)
        implements EventPayload {

    public StageReview {
        itemDecisions = itemDecisions == null ? List.of() : List.copyOf(itemDecisions);
    }
}
