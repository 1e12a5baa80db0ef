package com.caseflow.eventstore;

import com.caseflow.eventmodel.DomainEvent;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Event store held in process memory, guarded by a single mutex.
 *
 * <p>The version check and the write happen under the same lock, so two racing appends at the
 * same version cannot both succeed. Waiting for the lock is bounded by the configured timeout.
 */
public class InMemoryEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    /** Lock timeout used by the no-argument constructor. */
    public static final Duration DEFAULT_LOCK_TIMEOUT = Duration.ofSeconds(5);

    private final Map<String, List<DomainEvent>> logs = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Duration lockTimeout;

    public InMemoryEventStore() {
        this(DEFAULT_LOCK_TIMEOUT);
    }

    public InMemoryEventStore(Duration lockTimeout) {
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalArgumentException("lockTimeout must be positive");
        }
        this.lockTimeout = lockTimeout;
    }

    @Override
    public long appendBatch(String aggregateId, List<DomainEvent> events, long expectedVersion) {
        EventStore.requireValidBatch(aggregateId, events);
        acquire(aggregateId);
        try {
            List<DomainEvent> stored = logs.getOrDefault(aggregateId, List.of());
            if (stored.size() != expectedVersion) {
                log.debug(
                        "Rejected append to {}: expected version {}, actual {}",
                        aggregateId, expectedVersion, stored.size());
                throw new ConcurrencyException(aggregateId, expectedVersion, stored.size());
            }
            List<DomainEvent> updated = new ArrayList<>(stored.size() + events.size());
            updated.addAll(stored);
            updated.addAll(events);
            logs.put(aggregateId, List.copyOf(updated));
            log.debug("Appended {} event(s) to {}, version now {}", events.size(), aggregateId, updated.size());
            return updated.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public EventStream get(String aggregateId) {
        acquire(aggregateId);
        try {
            List<DomainEvent> stored = logs.get(aggregateId);
            return stored == null
                    ? EventStream.empty(aggregateId)
                    : new EventStream(aggregateId, stored, stored.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> aggregateIds() {
        acquire("*");
        try {
            return List.copyOf(logs.keySet());
        } finally {
            lock.unlock();
        }
    }

    private void acquire(String aggregateId) {
        try {
            if (!lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new EventStoreTimeoutException(aggregateId, lockTimeout);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventStoreTimeoutException(aggregateId, lockTimeout, e);
        }
    }
}
