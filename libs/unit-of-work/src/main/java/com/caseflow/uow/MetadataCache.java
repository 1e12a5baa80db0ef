package com.caseflow.uow;

import com.caseflow.eventstore.metadata.CaseMetadata;
import java.time.Instant;
import java.util.Optional;

/** The metadata operations available inside a unit of work. */
public interface MetadataCache {

    /** @throws com.caseflow.eventstore.metadata.MetadataExistsException if already present */
    void create(CaseMetadata metadata);

    Optional<CaseMetadata> get(String aggregateId);

    /** @return false if no metadata exists for the aggregate */
    boolean updateCache(String aggregateId, String title, String status, Instant lastEventAt);

    /** @return true if metadata existed */
    boolean delete(String aggregateId);
}
