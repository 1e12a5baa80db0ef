package com.caseflow.database;

import com.caseflow.eventmodel.DomainEvent;
import com.caseflow.eventmodel.EventSerializer;
import com.caseflow.eventstore.ConcurrencyException;
import com.caseflow.eventstore.EventStore;
import com.caseflow.eventstore.EventStoreException;
import com.caseflow.eventstore.EventStoreTimeoutException;
import com.caseflow.eventstore.EventStream;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import javax.sql.DataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Event store backed by a relational database.
 *
 * <p>Each append runs in one transaction: it moves the stream's version row from the expected
 * version to the new one (or inserts the row for a new aggregate) and inserts the events. If the
 * version row did not match, or a racing writer got there first and the database reports a
 * duplicate key or lock failure, the transaction rolls back and the caller gets a
 * {@link ConcurrencyException} carrying the version read afterwards.
 *
 * <p>Every statement and transaction is bounded by the configured timeout.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String INSERT_STREAM =
            "INSERT INTO event_streams (aggregate_id, version, updated_at) VALUES (?, ?, ?)";
    private static final String ADVANCE_STREAM =
            "UPDATE event_streams SET version = ?, updated_at = ? WHERE aggregate_id = ? AND version = ?";
    private static final String INSERT_EVENT =
            "INSERT INTO events (aggregate_id, version, event_id, event_type, occurred_at, event_json)"
                    + " VALUES (?, ?, ?, ?, ?, ?)";
    private static final String SELECT_EVENTS =
            "SELECT event_json FROM events WHERE aggregate_id = ? ORDER BY version";
    private static final String SELECT_VERSION =
            "SELECT version FROM event_streams WHERE aggregate_id = ?";
    private static final String SELECT_IDS = "SELECT aggregate_id FROM event_streams ORDER BY aggregate_id";

    private final JdbcTemplate jdbc;
    private final TransactionTemplate transactions;
    private final Duration timeout;
    private final Clock clock;

    public JdbcEventStore(DataSource dataSource, Duration timeout) {
        this(dataSource, timeout, Clock.systemUTC());
    }

    public JdbcEventStore(DataSource dataSource, Duration timeout, Clock clock) {
        if (dataSource == null) {
            throw new IllegalArgumentException("dataSource must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        int seconds = (int) Math.max(1, timeout.toSeconds());
        this.jdbc = new JdbcTemplate(dataSource);
        this.jdbc.setQueryTimeout(seconds);
        this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.transactions.setTimeout(seconds);
        this.timeout = timeout;
        this.clock = clock;
    }

    @Override
    public long appendBatch(String aggregateId, List<DomainEvent> events, long expectedVersion) {
        EventStore.requireValidBatch(aggregateId, events);
        try {
            Long newVersion = transactions.execute(status -> write(aggregateId, events, expectedVersion));
            log.debug("Appended {} event(s) to {}, version now {}", events.size(), aggregateId, newVersion);
            return newVersion;
        } catch (StaleVersion e) {
            throw conflict(aggregateId, expectedVersion);
        } catch (QueryTimeoutException | TransactionTimedOutException e) {
            throw new EventStoreTimeoutException(aggregateId, timeout, e);
        } catch (DataAccessException e) {
            long actual = currentVersion(aggregateId);
            if (actual != expectedVersion) {
                log.debug("Append to {} lost a race: {}", aggregateId, e.getMessage());
                throw new ConcurrencyException(aggregateId, expectedVersion, actual);
            }
            throw new EventStoreException("Failed to append to " + aggregateId, e);
        }
    }

    private long write(String aggregateId, List<DomainEvent> events, long expectedVersion) {
        long newVersion = expectedVersion + events.size();
        Timestamp now = Timestamp.from(Instant.now(clock));
        if (expectedVersion == 0) {
            if (currentVersionOrNull(aggregateId) != null) {
                throw new StaleVersion();
            }
            jdbc.update(INSERT_STREAM, aggregateId, newVersion, now);
        } else if (jdbc.update(ADVANCE_STREAM, newVersion, now, aggregateId, expectedVersion) == 0) {
            throw new StaleVersion();
        }
        long version = expectedVersion;
        for (DomainEvent event : events) {
            version++;
            jdbc.update(
                    INSERT_EVENT,
                    aggregateId,
                    version,
                    event.eventId(),
                    event.eventType().value(),
                    Timestamp.from(event.occurredAt()),
                    EventSerializer.serialize(event));
        }
        return newVersion;
    }

    @Override
    public EventStream get(String aggregateId) {
        try {
            List<DomainEvent> events =
                    jdbc.query(SELECT_EVENTS, (rs, row) -> EventSerializer.deserialize(rs.getString(1)), aggregateId);
            return new EventStream(aggregateId, events, events.size());
        } catch (QueryTimeoutException e) {
            throw new EventStoreTimeoutException(aggregateId, timeout, e);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to read " + aggregateId, e);
        }
    }

    @Override
    public List<String> aggregateIds() {
        try {
            return jdbc.queryForList(SELECT_IDS, String.class);
        } catch (DataAccessException e) {
            throw new EventStoreException("Failed to list aggregates", e);
        }
    }

    private ConcurrencyException conflict(String aggregateId, long expectedVersion) {
        long actual = currentVersion(aggregateId);
        log.debug("Rejected append to {}: expected version {}, actual {}", aggregateId, expectedVersion, actual);
        return new ConcurrencyException(aggregateId, expectedVersion, actual);
    }

    private long currentVersion(String aggregateId) {
        Long version = currentVersionOrNull(aggregateId);
        return version == null ? 0 : version;
    }

    private Long currentVersionOrNull(String aggregateId) {
        List<Long> versions = jdbc.queryForList(SELECT_VERSION, Long.class, aggregateId);
        return versions.isEmpty() ? null : versions.get(0);
    }

    /** Signals a version mismatch out of the transaction callback so the transaction rolls back. */
    private static final class StaleVersion extends RuntimeException {
        StaleVersion() {
            super(null, null, false, false);
        }
    }
}
