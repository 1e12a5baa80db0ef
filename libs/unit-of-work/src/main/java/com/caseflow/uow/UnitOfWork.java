package com.caseflow.uow;

import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups event appends and metadata writes so they take effect together or not at all.
 *
 * <p>Use with try-with-resources. {@link #close()} rolls back unless {@link #commit()} succeeded,
 * so every exit path that skips the commit undoes the unit:
 *
 * <pre>{@code
 * try (UnitOfWork uow = factory.begin()) {
 *     uow.events().append(id, event, version);
 *     uow.metadata().updateCache(id, title, status, at);
 *     uow.commit();
 * }
 * }</pre>
 *
 * <p>A unit is finalized exactly once. A failed commit rolls the unit back before rethrowing.
 */
public abstract class UnitOfWork implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(UnitOfWork.class);

    private enum Phase {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }

    protected final EventStore eventStore;
    protected final CaseMetadataRepository metadataRepository;
    private final String id = UUID.randomUUID().toString();
    private Phase phase = Phase.ACTIVE;

    protected UnitOfWork(EventStore eventStore, CaseMetadataRepository metadataRepository) {
        this.eventStore = eventStore;
        this.metadataRepository = metadataRepository;
    }

    public abstract EventLog events();

    public abstract MetadataCache metadata();

    public String id() {
        return id;
    }

    public boolean isActive() {
        return phase == Phase.ACTIVE;
    }

    /**
     * Makes the unit's writes permanent.
     *
     * @throws UnitOfWorkStateException if the unit was already finalized
     */
    public final void commit() {
        requireActive("commit");
        try {
            doCommit();
        } catch (RuntimeException e) {
            log.warn("Commit of unit {} failed, rolling back: {}", id, e.getMessage());
            phase = Phase.ROLLED_BACK;
            doRollback();
            throw e;
        }
        phase = Phase.COMMITTED;
        log.debug("Committed unit {}", id);
    }

    /**
     * Undoes the unit's writes.
     *
     * @throws UnitOfWorkStateException if the unit was already finalized
     */
    public final void rollback() {
        requireActive("rollback");
        phase = Phase.ROLLED_BACK;
        doRollback();
        log.debug("Rolled back unit {}", id);
    }

    /** Rolls back unless the unit was already finalized. */
    @Override
    public final void close() {
        if (phase == Phase.ACTIVE) {
            rollback();
        }
    }

    /** Fails if the unit is no longer usable. Subclasses call this before every operation. */
    protected final void requireActive(String operation) {
        if (phase != Phase.ACTIVE) {
            throw new UnitOfWorkStateException(
                    "Cannot %s: unit of work %s is already %s".formatted(operation, id, phase));
        }
    }

    protected abstract void doCommit();

    protected abstract void doRollback();
}
