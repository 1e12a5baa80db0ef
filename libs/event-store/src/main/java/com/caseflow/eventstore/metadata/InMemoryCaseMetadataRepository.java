package com.caseflow.eventstore.metadata;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/** Metadata repository held in process memory. */
public class InMemoryCaseMetadataRepository implements CaseMetadataRepository {

    private static final Comparator<CaseMetadata> NEWEST_FIRST =
            Comparator.comparing(
                            CaseMetadata::lastEventAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
                    .thenComparing(CaseMetadata::aggregateId);

    private final ConcurrentMap<String, CaseMetadata> entries = new ConcurrentHashMap<>();

    @Override
    public void create(CaseMetadata metadata) {
        if (entries.putIfAbsent(metadata.aggregateId(), metadata) != null) {
            throw new MetadataExistsException(metadata.aggregateId());
        }
    }

    @Override
    public Optional<CaseMetadata> get(String aggregateId) {
        return Optional.ofNullable(entries.get(aggregateId));
    }

    @Override
    public boolean updateCache(String aggregateId, String title, String status, Instant lastEventAt) {
        return entries.computeIfPresent(aggregateId, (id, current) -> current.withCache(title, status, lastEventAt))
                != null;
    }

    @Override
    public void save(CaseMetadata metadata) {
        entries.put(metadata.aggregateId(), metadata);
    }

    @Override
    public boolean delete(String aggregateId) {
        return entries.remove(aggregateId) != null;
    }

    @Override
    public List<CaseMetadata> listAll() {
        return entries.values().stream().sorted(NEWEST_FIRST).toList();
    }

    @Override
    public List<CaseMetadata> listByProject(String projectId) {
        return entries.values().stream()
                .filter(m -> Objects.equals(m.projectId(), projectId))
                .sorted(NEWEST_FIRST)
                .toList();
    }
}
