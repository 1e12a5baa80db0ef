package com.caseflow.projection.changecase;

import static com.caseflow.eventmodel.testing.TestEvents.basisClaim;
import static com.caseflow.eventmodel.testing.TestEvents.caseCreated;
import static com.caseflow.eventmodel.testing.TestEvents.compensationClaim;
import static com.caseflow.eventmodel.testing.TestEvents.deadlineClaim;
import static com.caseflow.eventmodel.testing.TestEvents.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.caseflow.eventmodel.ActorRole;
import com.caseflow.eventmodel.CaseEventType;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.ExemptionEventType;
import com.caseflow.eventmodel.Track;
import com.caseflow.eventmodel.UnknownEventType;
import com.caseflow.eventmodel.payload.CaseClosed;
import com.caseflow.eventmodel.payload.ChangeOrderIssued;
import com.caseflow.eventmodel.payload.Decision;
import com.caseflow.eventmodel.payload.RawPayload;
import com.caseflow.eventmodel.payload.TrackResponse;
import com.caseflow.eventmodel.payload.Withdrawal;
import com.caseflow.eventmodel.testing.TestEvents;
import com.caseflow.projection.MalformedSequenceException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CaseProjector")
class CaseProjectorTest {

    private final CaseProjector projector = new CaseProjector();
    private TestEvents events;

    @BeforeEach
    void setUp() {
        events = TestEvents.forAggregate("case-1");
    }

    /** Created, basis submitted and approved, compensation and deadline submitted. */
    private List<DomainEvent> fullCase() {
        List<DomainEvent> log = new ArrayList<>();
        log.add(events.next(CaseEventType.CASE_CREATED, caseCreated()));
        log.add(events.next(CaseEventType.BASIS_SUBMITTED, basisClaim()));
        log.add(events.next(CaseEventType.BASIS_RESPONDED, response(Decision.APPROVED)));
        log.add(events.next(CaseEventType.COMPENSATION_SUBMITTED, compensationClaim("125000.50")));
        log.add(events.next(CaseEventType.DEADLINE_SUBMITTED, deadlineClaim(14)));
        return log;
    }

    @Nested
    @DisplayName("creation")
    class Creation {

        @Test
        @DisplayName("opens the basis track as draft and leaves the others not applicable")
        void createdState() {
            CaseState state = projector.computeState(List.of(events.next(CaseEventType.CASE_CREATED, caseCreated())));

            assertThat(state.aggregateId()).isEqualTo("case-1");
            assertThat(state.title()).isEqualTo("Unexpected rock at km 12");
            assertThat(state.createdBy()).isEqualTo("contractor-1");
            assertThat(state.basis().status()).isEqualTo(TrackStatus.DRAFT);
            assertThat(state.compensation().status()).isEqualTo(TrackStatus.NOT_APPLICABLE);
            assertThat(state.deadline().status()).isEqualTo(TrackStatus.NOT_APPLICABLE);
            assertThat(state.eventCount()).isEqualTo(1);
            assertThat(state.overallStatus()).isEqualTo(OverallStatus.DRAFT);
        }

        @Test
        @DisplayName("submitting the basis opens the dependent tracks")
        void basisOpensDependents() {
            CaseState state = projector.computeState(List.of(
                    events.next(CaseEventType.CASE_CREATED, caseCreated()),
                    events.next(CaseEventType.BASIS_SUBMITTED, basisClaim())));

            assertThat(state.basis().status()).isEqualTo(TrackStatus.SUBMITTED);
            assertThat(state.basis().revision()).isEqualTo(1);
            assertThat(state.compensation().status()).isEqualTo(TrackStatus.DRAFT);
            assertThat(state.deadline().status()).isEqualTo(TrackStatus.DRAFT);
            assertThat(state.overallStatus()).isEqualTo(OverallStatus.AWAITING_RESPONSE);
        }
    }

    @Nested
    @DisplayName("track transitions")
    class TrackTransitions {

        @Test
        @DisplayName("approval locks the basis track")
        void approvalLocksBasis() {
            CaseState state = projector.computeState(fullCase().subList(0, 3));

            assertThat(state.basis().status()).isEqualTo(TrackStatus.LOCKED);
            assertThat(state.basis().locked()).isTrue();
            assertThat(state.basis().respondedRevision()).isEqualTo(1);
        }

        @Test
        @DisplayName("an update after rejection resubmits with a new revision")
        void updateAfterRejection() {
            List<DomainEvent> log = new ArrayList<>(fullCase());
            log.add(events.next(CaseEventType.COMPENSATION_RESPONDED, response(Decision.REJECTED)));
            CaseState rejected = projector.computeState(log);
            assertThat(rejected.compensation().status()).isEqualTo(TrackStatus.REJECTED);
            assertThat(rejected.overallStatus()).isEqualTo(OverallStatus.UNDER_NEGOTIATION);

            log.add(events.next(CaseEventType.COMPENSATION_UPDATED, compensationClaim("90000")));
            CaseState updated = projector.computeState(log);

            assertThat(updated.compensation().status()).isEqualTo(TrackStatus.SUBMITTED);
            assertThat(updated.compensation().revision()).isEqualTo(2);
            assertThat(updated.compensation().hasUnansweredRevision()).isTrue();
            assertThat(updated.totalClaimed()).isEqualByComparingTo("90000");
        }

        @Test
        @DisplayName("clarification request puts the track under negotiation")
        void clarification() {
            List<DomainEvent> log = new ArrayList<>(fullCase());
            log.add(events.next(CaseEventType.DEADLINE_RESPONDED, response(Decision.NEEDS_CLARIFICATION)));

            assertThat(projector.computeState(log).deadline().status()).isEqualTo(TrackStatus.UNDER_NEGOTIATION);
        }

        @Test
        @DisplayName("withdrawal finishes a track")
        void withdrawal() {
            List<DomainEvent> log = new ArrayList<>(fullCase());
            log.add(events.next(CaseEventType.DEADLINE_WITHDRAWN, new Withdrawal("Not needed")));

            CaseState state = projector.computeState(log);

            assertThat(state.deadline().status()).isEqualTo(TrackStatus.WITHDRAWN);
            assertThat(state.daysClaimed()).isZero();
        }
    }

    @Nested
    @DisplayName("derived values")
    class Derived {

        @Test
        @DisplayName("partial approval counts the approved amount")
        void partialApproval() {
            List<DomainEvent> log = new ArrayList<>(fullCase());
            log.add(events.next(
                    CaseEventType.COMPENSATION_RESPONDED,
                    new TrackResponse(Decision.PARTIALLY_APPROVED, "Too high", new BigDecimal("80000"), null)));
            log.add(events.next(CaseEventType.DEADLINE_RESPONDED, response(Decision.APPROVED)));

            CaseState state = projector.computeState(log);

            assertThat(state.totalClaimed()).isEqualByComparingTo("125000.50");
            assertThat(state.totalApproved()).isEqualByComparingTo("80000");
            assertThat(state.daysClaimed()).isEqualTo(14);
            assertThat(state.daysApproved()).isEqualTo(14);
            assertThat(state.canIssueChangeOrder()).isFalse();
            assertThat(state.nextAction()).get()
                    .extracting(NextAction::role, NextAction::track)
                    .containsExactly(ActorRole.CONTRACTOR, Track.COMPENSATION);
        }

        @Test
        @DisplayName("all tracks agreed makes the change order issuable")
        void agreed() {
            List<DomainEvent> log = new ArrayList<>(fullCase());
            log.add(events.next(CaseEventType.COMPENSATION_RESPONDED, response(Decision.APPROVED)));
            log.add(events.next(CaseEventType.DEADLINE_WITHDRAWN, new Withdrawal("Absorbed")));

            CaseState state = projector.computeState(log);

            assertThat(state.overallStatus()).isEqualTo(OverallStatus.AGREED);
            assertThat(state.canIssueChangeOrder()).isTrue();
            assertThat(state.totalApproved()).isEqualByComparingTo("125000.50");
            assertThat(state.nextAction()).contains(new NextAction(ActorRole.CLIENT, "Issue change order", null));
        }

        @Test
        @DisplayName("the change order closes the case")
        void changeOrder() {
            List<DomainEvent> log = new ArrayList<>(fullCase());
            log.add(events.next(CaseEventType.COMPENSATION_RESPONDED, response(Decision.APPROVED)));
            log.add(events.next(CaseEventType.DEADLINE_RESPONDED, response(Decision.APPROVED)));
            log.add(events.next(
                    CaseEventType.CHANGE_ORDER_ISSUED,
                    new ChangeOrderIssued("EO-7", new BigDecimal("125000.50"), 14, null)));

            CaseState state = projector.computeState(log);

            assertThat(state.closed()).isTrue();
            assertThat(state.changeOrder().orderNumber()).isEqualTo("EO-7");
            assertThat(state.changeOrder().issuedBy()).isEqualTo("client-1");
            assertThat(state.overallStatus()).isEqualTo(OverallStatus.CLOSED);
            assertThat(state.canIssueChangeOrder()).isFalse();
            assertThat(state.nextAction()).isEmpty();
            assertThat(state.eventCount()).isEqualTo(8);
            assertThat(state.lastActivityAt()).isEqualTo(log.get(7).occurredAt());
        }

        @Test
        @DisplayName("closing records the reason")
        void closed() {
            List<DomainEvent> log = new ArrayList<>(fullCase().subList(0, 2));
            log.add(events.next(CaseEventType.CASE_CLOSED, new CaseClosed("Settled outside the process")));

            CaseState state = projector.computeState(log);

            assertThat(state.closed()).isTrue();
            assertThat(state.closeReason()).isEqualTo("Settled outside the process");
            assertThat(state.changeOrder()).isNull();
        }
    }

    @Nested
    @DisplayName("replay")
    class Replay {

        @Test
        @DisplayName("is deterministic")
        void deterministic() {
            List<DomainEvent> log = fullCase();

            assertThat(projector.computeState(log)).isEqualTo(projector.computeState(List.copyOf(log)));
        }

        @Test
        @DisplayName("applying the tail to any prefix state gives the full state")
        void everySplit() {
            List<DomainEvent> log = fullCase();
            CaseState full = projector.computeState(log);

            for (int k = 1; k <= log.size(); k++) {
                CaseState prefix = projector.computeState(log.subList(0, k));
                assertThat(projector.applyAll(prefix, log.subList(k, log.size())))
                        .as("split at %d", k)
                        .isEqualTo(full);
            }
        }

        @Test
        @DisplayName("skips events of unknown or foreign types")
        void skipsUnknown() {
            List<DomainEvent> log = fullCase();
            CaseState before = projector.computeState(log);
            DomainEvent unknown = new DomainEvent(
                    "e-unknown", "case-1", new UnknownEventType("FutureThing"), TestEvents.START,
                    "x", ActorRole.CLIENT, new RawPayload(JsonNodeFactory.instance.objectNode()));
            DomainEvent foreign = events.next(ExemptionEventType.APPLICATION_SUBMITTED, null);

            assertThat(projector.apply(projector.apply(before, unknown), foreign)).isEqualTo(before);
        }
    }

    @Nested
    @DisplayName("malformed logs")
    class Malformed {

        @Test
        @DisplayName("rejects an empty log")
        void empty() {
            assertThatThrownBy(() -> projector.computeState(List.of()))
                    .isInstanceOf(MalformedSequenceException.class);
        }

        @Test
        @DisplayName("rejects a log that does not start with creation")
        void noCreation() {
            DomainEvent basis = events.next(CaseEventType.BASIS_SUBMITTED, basisClaim());

            assertThatThrownBy(() -> projector.computeState(List.of(basis)))
                    .isInstanceOf(MalformedSequenceException.class)
                    .hasMessageContaining("BasisSubmitted");
        }

        @Test
        @DisplayName("rejects a repeated creation event")
        void repeatedCreation() {
            List<DomainEvent> log = List.of(
                    events.next(CaseEventType.CASE_CREATED, caseCreated()),
                    events.next(CaseEventType.CASE_CREATED, caseCreated()));

            assertThatThrownBy(() -> projector.computeState(log))
                    .isInstanceOf(MalformedSequenceException.class)
                    .satisfies(e -> assertThat(((MalformedSequenceException) e).aggregateId()).isEqualTo("case-1"));
        }

        @Test
        @DisplayName("rejects an event of another aggregate")
        void otherAggregate() {
            CaseState state = projector.computeState(List.of(events.next(CaseEventType.CASE_CREATED, caseCreated())));
            DomainEvent other = TestEvents.forAggregate("case-2").next(CaseEventType.BASIS_SUBMITTED, basisClaim());

            assertThatThrownBy(() -> projector.apply(state, other)).isInstanceOf(MalformedSequenceException.class);
        }
    }
}
