package com.caseflow.uow;

import static com.caseflow.eventmodel.testing.TestEvents.caseCreated;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventmodel.CaseEventType;
import com.caseflow.eventmodel.testing.TestEvents;
import com.caseflow.eventstore.InMemoryEventStore;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.eventstore.metadata.InMemoryCaseMetadataRepository;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CompensatingUnitOfWork")
class CompensatingUnitOfWorkTest {

    private InMemoryEventStore store;
    private InMemoryCaseMetadataRepository repository;
    private UnitOfWorkFactory factory;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventStore();
        repository = spy(new InMemoryCaseMetadataRepository());
        factory = new UnitOfWorkFactory(store, repository, UnitOfWorkStrategy.COMPENSATING);
    }

    private static CaseMetadata metadata(String aggregateId, String title) {
        return new CaseMetadata(
                aggregateId, AggregateKind.CHANGE_CASE, "project-1", title, "DRAFT",
                TestEvents.START, "contractor-1", TestEvents.START);
    }

    @Test
    @DisplayName("writes immediately")
    void writesImmediately() {
        try (UnitOfWork uow = factory.begin()) {
            uow.metadata().create(metadata("case-1", "Title"));

            assertThat(repository.get("case-1")).isPresent();
            uow.commit();
        }

        assertThat(repository.get("case-1")).isPresent();
    }

    @Test
    @DisplayName("rollback undoes metadata writes newest first")
    void rollbackRestores() {
        repository.save(metadata("case-2", "Before"));

        try (CompensatingUnitOfWork uow = (CompensatingUnitOfWork) factory.begin()) {
            uow.metadata().create(metadata("case-1", "Title"));
            uow.metadata().updateCache("case-2", "After", "AGREED", Instant.parse("2025-06-01T00:00:00Z"));
            uow.metadata().delete("case-2");

            assertThat(uow.trackedOperations())
                    .extracting(TrackedOperation::kind)
                    .containsExactly(
                            OperationKind.METADATA_DELETE, OperationKind.METADATA_UPDATE, OperationKind.METADATA_CREATE);
        }

        assertThat(repository.get("case-1")).isEmpty();
        assertThat(repository.get("case-2")).contains(metadata("case-2", "Before"));
    }

    @Test
    @DisplayName("appended events stay after rollback")
    void appendsNotCompensable() {
        try (CompensatingUnitOfWork uow = (CompensatingUnitOfWork) factory.begin()) {
            uow.events().append(
                    "case-1", TestEvents.forAggregate("case-1").next(CaseEventType.CASE_CREATED, caseCreated()), 0);

            assertThat(uow.trackedOperations()).singleElement().satisfies(op -> {
                assertThat(op.kind()).isEqualTo(OperationKind.EVENT_APPEND);
                assertThat(op.isCompensable()).isFalse();
            });
        }

        assertThat(store.get("case-1").version()).isEqualTo(1);
    }

    @Test
    @DisplayName("a failing compensation does not stop the others")
    void failingCompensation() {
        repository.save(metadata("case-2", "Before"));
        doThrow(new IllegalStateException("disk full")).when(repository).delete(anyString());

        try (UnitOfWork uow = factory.begin()) {
            uow.metadata().updateCache("case-2", "After", "AGREED", TestEvents.START);
            uow.metadata().create(metadata("case-1", "Title"));
        }

        verify(repository).delete("case-1");
        assertThat(repository.get("case-2")).get().extracting(CaseMetadata::title).isEqualTo("Before");
    }
}
