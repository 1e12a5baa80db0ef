package com.caseflow.uow;

import static com.caseflow.eventmodel.testing.TestEvents.basisClaim;
import static com.caseflow.eventmodel.testing.TestEvents.caseCreated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.CaseEventType;
import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.testing.TestEvents;
import com.caseflow.eventstore.ConcurrencyException;
import com.caseflow.eventstore.InMemoryEventStore;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.eventstore.metadata.InMemoryCaseMetadataRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/** Metadata is written and then the append fails: no strategy may leave the metadata behind. */
@DisplayName("Rollback after a failed append")
class RollbackScenarioTest {

    private record Stores(InMemoryEventStore events, InMemoryCaseMetadataRepository metadata) {}

    private static Stores runScenario(UnitOfWorkStrategy strategy) {
        InMemoryEventStore store = new InMemoryEventStore();
        InMemoryCaseMetadataRepository repository = new InMemoryCaseMetadataRepository();
        TestEvents events = TestEvents.forAggregate("case-1");
        DomainEvent created = events.next(CaseEventType.CASE_CREATED, caseCreated());
        store.append("case-1", created, 0);
        UnitOfWorkFactory factory = new UnitOfWorkFactory(store, repository, strategy);

        assertThatThrownBy(() -> {
                    try (UnitOfWork uow = factory.begin()) {
                        uow.metadata().create(new CaseMetadata(
                                "case-1", AggregateKind.CHANGE_CASE, "project-1", "Title", "DRAFT",
                                created.occurredAt(), created.actorId(), created.occurredAt()));
                        // Stale version: the log is already at 1.
                        uow.events().append("case-1", events.next(CaseEventType.BASIS_SUBMITTED, basisClaim()), 0);
                        uow.commit();
                    }
                })
                .isInstanceOf(ConcurrencyException.class);

        return new Stores(store, repository);
    }

    @ParameterizedTest
    @EnumSource(UnitOfWorkStrategy.class)
    @DisplayName("leaves no metadata and only the original event")
    void noMetadataLeft(UnitOfWorkStrategy strategy) {
        Stores stores = runScenario(strategy);

        assertThat(stores.metadata().listAll()).isEmpty();
        assertThat(stores.events().get("case-1").version()).isEqualTo(1);
    }

    @Test
    @DisplayName("both strategies end with identical stores")
    void strategiesAgree() {
        Stores buffered = runScenario(UnitOfWorkStrategy.BUFFERED);
        Stores compensating = runScenario(UnitOfWorkStrategy.COMPENSATING);

        assertThat(buffered.metadata().listAll()).isEqualTo(compensating.metadata().listAll());
        assertThat(buffered.events().aggregateIds()).isEqualTo(compensating.events().aggregateIds());
        assertThat(buffered.events().get("case-1").version())
                .isEqualTo(compensating.events().get("case-1").version());
    }
}
