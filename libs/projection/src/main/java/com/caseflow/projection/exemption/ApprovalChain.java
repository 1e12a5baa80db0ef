package com.caseflow.projection.exemption;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The strictly sequential approval chain of an application.
 *
 * <p>The pointer is the first step not completed. Completing advances it by exactly one stage;
 * returning leaves it where it is so that the next submission resumes at the returning stage.
 */
public record ApprovalChain(Map<ApprovalStage, StepState> steps) {

    public ApprovalChain {
        steps = Collections.unmodifiableMap(new EnumMap<>(steps));
    }

    public static ApprovalChain initial() {
        Map<ApprovalStage, StepState> steps = new EnumMap<>(ApprovalStage.class);
        for (ApprovalStage stage : ApprovalStage.values()) {
            steps.put(stage, StepState.notStarted(stage));
        }
        return new ApprovalChain(steps);
    }

    public StepState step(ApprovalStage stage) {
        return steps.get(stage);
    }

    /** The first incomplete stage, empty once the owner has decided. */
    public Optional<ApprovalStage> currentStage() {
        for (ApprovalStage stage : ApprovalStage.values()) {
            if (!steps.get(stage).completed()) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    public boolean isAt(ApprovalStage stage) {
        return currentStage().filter(stage::equals).isPresent();
    }

    public boolean isComplete() {
        return currentStage().isEmpty();
    }

    /**
     * Completes the current stage.
     *
     * @throws IllegalStateException if {@code stage} is not the current stage
     */
    public ApprovalChain complete(ApprovalStage stage, StepState step) {
        requireCurrent(stage);
        if (!step.completed() || step.stage() != stage) {
            throw new IllegalArgumentException("Expected a completed step for " + stage);
        }
        return with(stage, step);
    }

    /**
     * Records a return by the current stage. The stage stays pending.
     *
     * @throws IllegalStateException if {@code stage} is not the current stage
     */
    public ApprovalChain returnAt(ApprovalStage stage, StepState step) {
        requireCurrent(stage);
        if (!step.wasReturned() || step.stage() != stage) {
            throw new IllegalArgumentException("Expected a returned step for " + stage);
        }
        return with(stage, step);
    }

    private void requireCurrent(ApprovalStage stage) {
        if (!isAt(stage)) {
            throw new IllegalStateException(
                    "Stage " + stage + " is not current, chain is at " + currentStage().orElse(null));
        }
    }

    private ApprovalChain with(ApprovalStage stage, StepState step) {
        Map<ApprovalStage, StepState> copy = new EnumMap<>(steps);
        copy.put(stage, step);
        return new ApprovalChain(copy);
    }
}
