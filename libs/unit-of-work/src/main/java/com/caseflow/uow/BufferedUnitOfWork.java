package com.caseflow.uow;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventstore.ConcurrencyException;
import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.EventStream;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import com.caseflow.eventstore.metadata.MetadataExistsException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Unit of work that writes nothing until commit.
 *
 * <p>Appends are queued per aggregate and metadata writes in call order; reads through this unit
 * see its queued writes. Commit first checks that every queued metadata create still finds no
 * stored entry, then flushes each aggregate's events with one atomic {@code appendBatch}, then
 * replays the metadata writes. A failed check or a version conflict leaves both stores untouched.
 *
 * <p>Once events are stored the commit stands: the metadata is a cache derived from the log, so
 * a metadata write that fails after the flush is logged and left for a rebuild from the log
 * instead of failing the unit. A unit without events fails on its first failed metadata write.
 * Rollback discards the queues.
 */
public final class BufferedUnitOfWork extends UnitOfWork {

    private static final Logger log = LoggerFactory.getLogger(BufferedUnitOfWork.class);

    private final Map<String, PendingBatch> pendingEvents = new LinkedHashMap<>();
    private final List<PendingWrite> pendingMetadata = new ArrayList<>();
    // Metadata as this unit sees it; an empty Optional marks a pending delete.
    private final Map<String, Optional<CaseMetadata>> metadataView = new HashMap<>();

    private final EventLog events = new BufferedEventLog();
    private final MetadataCache metadata = new BufferedMetadataCache();

    BufferedUnitOfWork(EventStore eventStore, CaseMetadataRepository metadataRepository) {
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

    @Override
    protected void doCommit() {
        checkQueuedCreates();
        for (Map.Entry<String, PendingBatch> entry : pendingEvents.entrySet()) {
            PendingBatch batch = entry.getValue();
            eventStore.appendBatch(entry.getKey(), batch.events, batch.expectedVersion);
        }
        int failed = 0;
        for (PendingWrite write : pendingMetadata) {
            try {
                write.apply().accept(metadataRepository);
            } catch (RuntimeException e) {
                if (pendingEvents.isEmpty()) {
                    throw e;
                }
                failed++;
                log.error(
                        "Unit {} stored its events but {} on {} failed; rebuild the metadata from the log",
                        id(), write.kind(), write.aggregateId(), e);
            }
        }
        log.debug(
                "Flushed {} aggregate(s) and {} of {} metadata write(s) for unit {}",
                pendingEvents.size(),
                pendingMetadata.size() - failed,
                pendingMetadata.size(),
                id());
        clear();
    }

    /** Replays the queued creates and deletes against the stored entries, in queue order. */
    private void checkQueuedCreates() {
        Map<String, Boolean> exists = new HashMap<>();
        for (PendingWrite write : pendingMetadata) {
            boolean present = exists.computeIfAbsent(
                    write.aggregateId(), key -> metadataRepository.get(key).isPresent());
            if (write.kind() == OperationKind.METADATA_CREATE) {
                if (present) {
                    throw new MetadataExistsException(write.aggregateId());
                }
                exists.put(write.aggregateId(), true);
            } else if (write.kind() == OperationKind.METADATA_DELETE) {
                exists.put(write.aggregateId(), false);
            }
        }
    }

    @Override
    protected void doRollback() {
        if (!pendingEvents.isEmpty() || !pendingMetadata.isEmpty()) {
            log.debug("Discarding {} pending metadata write(s) for unit {}", pendingMetadata.size(), id());
        }
        clear();
    }

    private void clear() {
        pendingEvents.clear();
        pendingMetadata.clear();
        metadataView.clear();
    }

    private record PendingWrite(OperationKind kind, String aggregateId, Consumer<CaseMetadataRepository> apply) {}

    private static final class PendingBatch {
        private final long expectedVersion;
        private final List<DomainEvent> events = new ArrayList<>();

        PendingBatch(long expectedVersion) {
            this.expectedVersion = expectedVersion;
        }

        long version() {
            return expectedVersion + events.size();
        }
    }

    private final class BufferedEventLog implements EventLog {

        @Override
        public long append(String aggregateId, DomainEvent event, long expectedVersion) {
            return appendBatch(aggregateId, List.of(event), expectedVersion);
        }

        @Override
        public long appendBatch(String aggregateId, List<DomainEvent> batch, long expectedVersion) {
            requireActive("append");
            EventStore.requireValidBatch(aggregateId, batch);
            PendingBatch pending = pendingEvents.get(aggregateId);
            if (pending == null) {
                pending = new PendingBatch(expectedVersion);
                pendingEvents.put(aggregateId, pending);
            } else if (pending.version() != expectedVersion) {
                throw new ConcurrencyException(aggregateId, expectedVersion, pending.version());
            }
            pending.events.addAll(batch);
            return pending.version();
        }

        @Override
        public EventStream get(String aggregateId) {
            requireActive("read");
            EventStream stored = eventStore.get(aggregateId);
            PendingBatch pending = pendingEvents.get(aggregateId);
            if (pending == null) {
                return stored;
            }
            List<DomainEvent> merged = new ArrayList<>(stored.events());
            merged.addAll(pending.events);
            return new EventStream(aggregateId, merged, merged.size());
        }
    }

    private final class BufferedMetadataCache implements MetadataCache {

        @Override
        public void create(CaseMetadata created) {
            requireActive("create metadata");
            if (get(created.aggregateId()).isPresent()) {
                throw new MetadataExistsException(created.aggregateId());
            }
            metadataView.put(created.aggregateId(), Optional.of(created));
            pendingMetadata.add(new PendingWrite(
                    OperationKind.METADATA_CREATE, created.aggregateId(), repository -> repository.create(created)));
        }

        @Override
        public Optional<CaseMetadata> get(String aggregateId) {
            requireActive("read metadata");
            Optional<CaseMetadata> pending = metadataView.get(aggregateId);
            return pending != null ? pending : metadataRepository.get(aggregateId);
        }

        @Override
        public boolean updateCache(String aggregateId, String title, String status, Instant lastEventAt) {
            requireActive("update metadata");
            Optional<CaseMetadata> current = get(aggregateId);
            if (current.isEmpty()) {
                return false;
            }
            metadataView.put(aggregateId, Optional.of(current.get().withCache(title, status, lastEventAt)));
            pendingMetadata.add(new PendingWrite(
                    OperationKind.METADATA_UPDATE,
                    aggregateId,
                    repository -> repository.updateCache(aggregateId, title, status, lastEventAt)));
            return true;
        }

        @Override
        public boolean delete(String aggregateId) {
            requireActive("delete metadata");
            if (get(aggregateId).isEmpty()) {
                return false;
            }
            metadataView.put(aggregateId, Optional.empty());
            pendingMetadata.add(new PendingWrite(
                    OperationKind.METADATA_DELETE, aggregateId, repository -> repository.delete(aggregateId)));
            return true;
        }
    }
}
