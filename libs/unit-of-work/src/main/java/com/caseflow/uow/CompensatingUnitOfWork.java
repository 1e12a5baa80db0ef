package com.caseflow.uow;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.EventStream;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit of work that writes immediately and undoes its writes on rollback.
 *
 * <p>Every write is recorded as a {@link TrackedOperation}. Rollback walks them newest first:
 * a metadata create is deleted, a cache update restores the prior snapshot, and a delete
 * re-creates the prior record. Event appends cannot be undone and are only reported. A failing
 * compensation is logged and the remaining ones still run.
 */
public final class CompensatingUnitOfWork extends UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(CompensatingUnitOfWork.class);

    private final Deque<TrackedOperation> operations = new ArrayDeque<>();
    private final EventLog events = new DirectEventLog();
    private final MetadataCache metadata = new TrackedMetadataCache();

    CompensatingUnitOfWork(EventStore eventStore, CaseMetadataRepository metadataRepository) {
        super(eventStore, metadataRepository);
    }

    @Override
    public EventLog events() {
        return events;
    }

    @Override
    public MetadataCache metadata() {
        return metadata;
    }

    /** Operations applied so far, newest first. */
    public List<TrackedOperation> trackedOperations() {
        return List.copyOf(operations);
    }

    @Override
    protected void doCommit() {
        operations.clear();
    }

    @Override
    protected void doRollback() {
        int failures = 0;
        while (!operations.isEmpty()) {
            TrackedOperation operation = operations.pop();
            if (!operation.isCompensable()) {
                log.warn(
                        "Unit {} cannot undo {} on {}",
                        id(),
                        operation.kind(),
                        operation.aggregateId());
                continue;
            }
            try {
                operation.compensator().run();
            } catch (RuntimeException e) {
                failures++;
                log.error(
                        "Unit {} failed to compensate {} on {}", id(), operation.kind(), operation.aggregateId(), e);
            }
        }
        if (failures > 0) {
            log.error("Unit {} rolled back with {} failed compensation(s)", id(), failures);
        }
    }

    private void track(OperationKind kind, String aggregateId, CaseMetadata prior, Runnable compensator) {
        operations.push(new TrackedOperation(kind, aggregateId, prior, compensator));
    }

    private final class DirectEventLog implements EventLog {

        @Override
        public long append(String aggregateId, DomainEvent event, long expectedVersion) {
            return appendBatch(aggregateId, List.of(event), expectedVersion);
        }

        @Override
        public long appendBatch(String aggregateId, List<DomainEvent> batch, long expectedVersion) {
            requireActive("append");
            long version = eventStore.appendBatch(aggregateId, batch, expectedVersion);
            track(OperationKind.EVENT_APPEND, aggregateId, null, null);
            return version;
        }

        @Override
        public EventStream get(String aggregateId) {
            requireActive("read");
            return eventStore.get(aggregateId);
        }
    }

    private final class TrackedMetadataCache implements MetadataCache {

        @Override
        public void create(CaseMetadata created) {
            requireActive("create metadata");
            metadataRepository.create(created);
            String aggregateId = created.aggregateId();
            track(OperationKind.METADATA_CREATE, aggregateId, null, () -> metadataRepository.delete(aggregateId));
        }

        @Override
        public Optional<CaseMetadata> get(String aggregateId) {
            requireActive("read metadata");
            return metadataRepository.get(aggregateId);
        }

        @Override
        public boolean updateCache(String aggregateId, String title, String status, Instant lastEventAt) {
            requireActive("update metadata");
            Optional<CaseMetadata> prior = metadataRepository.get(aggregateId);
            boolean updated = metadataRepository.updateCache(aggregateId, title, status, lastEventAt);
            if (updated && prior.isPresent()) {
                CaseMetadata snapshot = prior.get();
                track(OperationKind.METADATA_UPDATE, aggregateId, snapshot, () -> metadataRepository.save(snapshot));
            }
            return updated;
        }

        @Override
        public boolean delete(String aggregateId) {
            requireActive("delete metadata");
            Optional<CaseMetadata> prior = metadataRepository.get(aggregateId);
            boolean deleted = metadataRepository.delete(aggregateId);
            if (deleted) {
                CaseMetadata snapshot = prior.orElse(null);
                Runnable compensator = snapshot == null ? null : () -> metadataRepository.save(snapshot);
                if (compensator == null) {
                    log.warn("Unit {} deleted metadata of {} without a prior snapshot", id(), aggregateId);
                }
                track(OperationKind.METADATA_DELETE, aggregateId, snapshot, compensator);
            }
            return deleted;
        }
    }
}
