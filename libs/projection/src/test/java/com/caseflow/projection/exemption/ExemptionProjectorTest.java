package com.caseflow.projection.exemption;

import static com.caseflow.eventmodel.testing.TestEvents.item;
import static com.caseflow.eventmodel.testing.TestEvents.machineApplication;
import static com.caseflow.eventmodel.testing.TestEvents.review;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.ExemptionEventType;
import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.FinalDecision;
import com.caseflow.eventmodel.payload.ItemDecision;
import com.caseflow.eventmodel.payload.ItemRemoval;
import com.caseflow.eventmodel.payload.StageReturn;
import com.caseflow.eventmodel.payload.StageReview;
import com.caseflow.eventmodel.payload.Submission;
import com.caseflow.eventmodel.payload.Withdrawal;
import com.caseflow.eventmodel.testing.TestEvents;
import com.caseflow.projection.MalformedSequenceException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ExemptionProjector")
class ExemptionProjectorTest {

    private final ExemptionProjector projector = new ExemptionProjector();
    private TestEvents events;

    @BeforeEach
    void setUp() {
        events = TestEvents.forAggregate("app-1");
    }

    /** Application with items m-1 and m-2, submitted. */
    private List<DomainEvent> submitted() {
        List<DomainEvent> log = new ArrayList<>();
        log.add(events.next(ExemptionEventType.APPLICATION_CREATED, machineApplication()));
        log.add(events.next(ExemptionEventType.ITEM_ADDED, item("m-1")));
        log.add(events.next(ExemptionEventType.ITEM_ADDED, item("m-2")));
        log.add(events.next(ExemptionEventType.APPLICATION_SUBMITTED, new Submission(null)));
        return log;
    }

    /** Submitted and reviewed by advisor, project lead and working group. */
    private List<DomainEvent> awaitingOwner(Decision workingGroup) {
        List<DomainEvent> log = submitted();
        log.add(events.next(ExemptionEventType.ADVISOR_REVIEWED, review(Decision.APPROVED)));
        log.add(events.next(ExemptionEventType.PROJECT_LEAD_REVIEWED, review(Decision.APPROVED)));
        log.add(events.next(
                ExemptionEventType.WORKING_GROUP_REVIEWED,
                new StageReview(
                        List.of(
                                new ItemDecision("m-1", Decision.APPROVED, null),
                                new ItemDecision("m-2", workingGroup, null)),
                        workingGroup == Decision.APPROVED ? Decision.APPROVED : Decision.PARTIALLY_APPROVED,
                        true,
                        null)));
        return log;
    }

    @Nested
    @DisplayName("drafting")
    class Drafting {

        @Test
        @DisplayName("a new machine application cannot be submitted before it has items")
        void needsItems() {
            ExemptionState state = projector.computeState(
                    List.of(events.next(ExemptionEventType.APPLICATION_CREATED, machineApplication())));

            assertThat(state.status()).isEqualTo(ExemptionStatus.DRAFT);
            assertThat(state.canSubmit()).isFalse();
            assertThat(state.nextStep()).contains(new NextStep(ActorRole.APPLICANT, "Add at least one item", null));
        }

        @Test
        @DisplayName("item update keeps position and removal erases the item")
        void itemEdits() {
            List<DomainEvent> log = submitted().subList(0, 3);
            List<DomainEvent> edited = new ArrayList<>(log);
            edited.add(events.next(ExemptionEventType.ITEM_UPDATED, item("m-1")));
            edited.add(events.next(ExemptionEventType.ITEM_REMOVED, new ItemRemoval("m-2")));

            ExemptionState state = projector.computeState(edited);

            assertThat(state.items()).containsOnlyKeys("m-1");
            assertThat(state.canSubmit()).isTrue();
        }
    }

    @Nested
    @DisplayName("approval chain")
    class Chain {

        @Test
        @DisplayName("submission puts the application with the advisor")
        void submission() {
            ExemptionState state = projector.computeState(submitted());

            assertThat(state.status()).isEqualTo(ExemptionStatus.SUBMITTED);
            assertThat(state.submissionCount()).isEqualTo(1);
            assertThat(state.chain().currentStage()).contains(ApprovalStage.ADVISOR);
            assertThat(state.nextStep()).get().extracting(NextStep::role).isEqualTo(ActorRole.ADVISOR);
        }

        @Test
        @DisplayName("each review advances the pointer exactly one stage")
        void reviewsAdvance() {
            List<DomainEvent> log = submitted();
            log.add(events.next(ExemptionEventType.ADVISOR_REVIEWED, review(Decision.APPROVED)));
            ExemptionState afterAdvisor = projector.computeState(log);
            assertThat(afterAdvisor.chain().currentStage()).contains(ApprovalStage.PROJECT_LEAD);
            assertThat(afterAdvisor.status()).isEqualTo(ExemptionStatus.UNDER_PROJECT_LEAD_REVIEW);
            assertThat(afterAdvisor.chain().step(ApprovalStage.ADVISOR).reviewer()).isEqualTo("advisor-1");

            ExemptionState awaiting = projector.computeState(awaitingOwner(Decision.APPROVED));
            assertThat(awaiting.status()).isEqualTo(ExemptionStatus.AWAITING_OWNER_DECISION);
            assertThat(awaiting.chain().currentStage()).contains(ApprovalStage.OWNER);
            assertThat(awaiting.workingGroupRecommendation()).contains(Decision.APPROVED);
        }

        @Test
        @DisplayName("an out-of-order review makes the log malformed")
        void outOfOrder() {
            List<DomainEvent> log = submitted();
            log.add(events.next(ExemptionEventType.WORKING_GROUP_REVIEWED, review(Decision.APPROVED)));

            assertThatThrownBy(() -> projector.computeState(log))
                    .isInstanceOf(MalformedSequenceException.class)
                    .hasMessageContaining("WORKING_GROUP");
        }

        @Test
        @DisplayName("a return resets the step and re-submission resumes there")
        void returnAndResubmit() {
            List<DomainEvent> log = submitted();
            log.add(events.next(ExemptionEventType.ADVISOR_REVIEWED, review(Decision.APPROVED)));
            log.add(events.next(
                    ExemptionEventType.PROJECT_LEAD_RETURNED, new StageReturn("Emission figures", null)));

            ExemptionState returned = projector.computeState(log);
            assertThat(returned.status()).isEqualTo(ExemptionStatus.RETURNED_BY_PROJECT_LEAD);
            assertThat(returned.isEditable()).isTrue();
            assertThat(returned.chain().step(ApprovalStage.PROJECT_LEAD).wasReturned()).isTrue();
            assertThat(returned.chain().step(ApprovalStage.PROJECT_LEAD).missingDocumentation())
                    .isEqualTo("Emission figures");

            log.add(events.next(ExemptionEventType.APPLICATION_SUBMITTED, new Submission("Added figures")));
            ExemptionState resubmitted = projector.computeState(log);

            assertThat(resubmitted.status()).isEqualTo(ExemptionStatus.UNDER_PROJECT_LEAD_REVIEW);
            assertThat(resubmitted.chain().currentStage()).contains(ApprovalStage.PROJECT_LEAD);
            assertThat(resubmitted.chain().step(ApprovalStage.ADVISOR).completed()).isTrue();
            assertThat(resubmitted.submissionCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("outcome")
    class Outcome {

        @Test
        @DisplayName("mixed item outcomes aggregate to partial approval")
        void partial() {
            ExemptionState state = projector.computeState(awaitingOwner(Decision.REJECTED));

            assertThat(state.aggregateOutcome()).contains(Decision.PARTIALLY_APPROVED);
            assertThat(state.approvedItemCount()).isEqualTo(1);
            assertThat(state.rejectedItemCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("an unassessed item leaves the aggregate outcome empty")
        void unassessed() {
            ExemptionState state = projector.computeState(awaitingOwner(Decision.NEEDS_CLARIFICATION));

            assertThat(state.aggregateOutcome()).isEmpty();
            assertThat(state.unassessedItemCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("a blanket owner approval decides every item")
        void ownerApproves() {
            List<DomainEvent> log = awaitingOwner(Decision.REJECTED);
            log.add(events.next(
                    ExemptionEventType.OWNER_DECIDED,
                    new FinalDecision(Decision.APPROVED, false, "Project-critical machines", List.of())));

            ExemptionState state = projector.computeState(log);

            assertThat(state.status()).isEqualTo(ExemptionStatus.APPROVED);
            assertThat(state.isFinal()).isTrue();
            assertThat(state.aggregateOutcome()).contains(Decision.APPROVED);
            assertThat(state.chain().isComplete()).isTrue();
            assertThat(state.decidedAt()).isNotNull();
            assertThat(state.nextStep()).isEmpty();
        }

        @Test
        @DisplayName("owner item decisions override earlier stages")
        void ownerItemDecision() {
            List<DomainEvent> log = awaitingOwner(Decision.APPROVED);
            log.add(events.next(
                    ExemptionEventType.OWNER_DECIDED,
                    new FinalDecision(
                            Decision.PARTIALLY_APPROVED,
                            false,
                            "m-2 has an alternative",
                            List.of(new ItemDecision("m-2", Decision.REJECTED, null)))));

            ExemptionState state = projector.computeState(log);

            assertThat(state.item("m-2")).get()
                    .extracting(ItemState::outcome)
                    .isEqualTo(Optional.of(Decision.REJECTED));
            assertThat(state.aggregateOutcome()).contains(Decision.PARTIALLY_APPROVED);
        }

        @Test
        @DisplayName("withdrawal is final")
        void withdrawn() {
            List<DomainEvent> log = submitted();
            log.add(events.next(ExemptionEventType.APPLICATION_WITHDRAWN, new Withdrawal("Project cancelled")));

            ExemptionState state = projector.computeState(log);

            assertThat(state.status()).isEqualTo(ExemptionStatus.WITHDRAWN);
            assertThat(state.withdrawReason()).isEqualTo("Project cancelled");
            assertThat(state.isFinal()).isTrue();
        }
    }

    @Test
    @DisplayName("replaying the tail onto any prefix state gives the full state")
    void everySplit() {
        List<DomainEvent> log = awaitingOwner(Decision.REJECTED);
        ExemptionState full = projector.computeState(log);

        for (int k = 1; k <= log.size(); k++) {
            assertThat(projector.applyAll(projector.computeState(log.subList(0, k)), log.subList(k, log.size())))
                    .as("split at %d", k)
                    .isEqualTo(full);
        }
    }
}
