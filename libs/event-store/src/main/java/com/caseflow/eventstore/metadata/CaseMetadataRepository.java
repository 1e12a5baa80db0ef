package com.caseflow.eventstore.metadata;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Storage for {@link CaseMetadata}, kept in step with the event log by the unit of work. */
public interface CaseMetadataRepository {

    /**
     * Stores metadata for a new aggregate.
     *
     * @throws MetadataExistsException if metadata for the aggregate already exists
     */
    void create(CaseMetadata metadata);

    Optional<CaseMetadata> get(String aggregateId);

    /**
     * Replaces the cached title, status and last-event timestamp.
     *
     * @return false if no metadata exists for the aggregate
     */
    boolean updateCache(String aggregateId, String title, String status, Instant lastEventAt);

    /**
     * Replaces stored metadata wholesale, creating it if absent. Used when rebuilding from the log
     * and when restoring a snapshot.
     */
    void save(CaseMetadata metadata);

    /** @return true if metadata existed and was removed */
    boolean delete(String aggregateId);

    List<CaseMetadata> listAll();

    List<CaseMetadata> listByProject(String projectId);
}
