package com.caseflow.eventmodel.payload;

/**
 * A stage's decision for a single item.
 *
 * @param itemId the item decided on
 * @param decision the decision
 * @param comment optional comment
 */
public record ItemDecision(String itemId, Decision decision, String comment) {}
