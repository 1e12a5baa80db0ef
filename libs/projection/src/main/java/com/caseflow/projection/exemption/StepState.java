package com.caseflow.projection.exemption;

import com.caseflow.eventmodel.payload.Decision;
import java.time.Instant;

/**
 * One step of the approval chain.
 *
 * <p>A step that was returned stays not completed and keeps the missing-documentation note until
 * it is reviewed after re-submission.
 *
 * @param stage the stage
 * @param completed whether the stage has reviewed
 * @param decision the stage's recommendation or, for the owner, the decision
 * @param documentationSufficient the reviewer's documentation verdict
 * @param note review comment or the owner's rationale
 * @param missingDocumentation set when the stage returned the application
 * @param reviewer actor who reviewed or returned
 * @param at when
 */
public record StepState(
        ApprovalStage stage,
        boolean completed,
        Decision decision,
        boolean documentationSufficient,
        String note,
        String missingDocumentation,
        String reviewer,
        Instant at) {

    public static StepState notStarted(ApprovalStage stage) {
        return new StepState(stage, false, null, false, null, null, null, null);
    }

    public static StepState completed(
            ApprovalStage stage,
            Decision decision,
            boolean documentationSufficient,
            String note,
            String reviewer,
            Instant at) {
        return new StepState(stage, true, decision, documentationSufficient, note, null, reviewer, at);
    }

    public static StepState returned(ApprovalStage stage, String missingDocumentation, String reviewer, Instant at) {
        return new StepState(stage, false, null, false, null, missingDocumentation, reviewer, at);
    }

    public boolean wasReturned() {
        return !completed && missingDocumentation != null;
    }
}
