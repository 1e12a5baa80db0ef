package com.caseflow.uow;

import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import java.util.Objects;

/** Opens units of work over one event store and metadata repository. */
public final class UnitOfWorkFactory {

    private final EventStore eventStore;
    private final CaseMetadataRepository metadataRepository;
    private final UnitOfWorkStrategy strategy;

    public UnitOfWorkFactory(
            EventStore eventStore, CaseMetadataRepository metadataRepository, UnitOfWorkStrategy strategy) {
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
        this.metadataRepository = Objects.requireNonNull(metadataRepository, "metadataRepository");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    /** Opens a unit with the configured strategy. */
    public UnitOfWork begin() {
        return begin(strategy);
    }

    public UnitOfWork begin(UnitOfWorkStrategy override) {
        return switch (override) {
            case BUFFERED -> new BufferedUnitOfWork(eventStore, metadataRepository);
            case COMPENSATING -> new CompensatingUnitOfWork(eventStore, metadataRepository);
        };
    }

    public UnitOfWorkStrategy strategy() {
        return strategy;
    }
}
