package com.caseflow.database;

import com.caseflow.eventmodel.AggregateKind;
import com.caseflow.eventstore.metadata.CaseMetadata;
import com.caseflow.eventstore.metadata.CaseMetadataRepository;
import com.caseflow.eventstore.metadata.MetadataExistsException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import javax.sql.DataSource;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

/** Metadata repository backed by the {@code case_metadata} table. */
public class JdbcCaseMetadataRepository implements CaseMetadataRepository {

    private static final String COLUMNS =
            "aggregate_id, aggregate_kind, project_id, title, status, created_at, created_by, last_event_at";
    private static final String ORDER = " ORDER BY last_event_at DESC NULLS LAST, aggregate_id";

    private final JdbcTemplate jdbc;

    public JdbcCaseMetadataRepository(DataSource dataSource) {
        this.jdbc = new JdbcTemplate(dataSource);
    }

    @Override
    public void create(CaseMetadata metadata) {
        try {
            insert(metadata);
        } catch (DuplicateKeyException e) {
            throw new MetadataExistsException(metadata.aggregateId());
        }
    }

    @Override
    public Optional<CaseMetadata> get(String aggregateId) {
        return jdbc.query("SELECT " + COLUMNS + " FROM case_metadata WHERE aggregate_id = ?", this::map, aggregateId)
                .stream()
                .findFirst();
    }

    @Override
    public boolean updateCache(String aggregateId, String title, String status, Instant lastEventAt) {
        return jdbc.update(
                        "UPDATE case_metadata SET title = ?, status = ?, last_event_at = ? WHERE aggregate_id = ?",
                        title,
                        status,
                        timestamp(lastEventAt),
                        aggregateId)
                > 0;
    }

    @Override
    public void save(CaseMetadata metadata) {
        int updated =
                jdbc.update(
                        "UPDATE case_metadata SET aggregate_kind = ?, project_id = ?, title = ?, status = ?,"
                                + " created_at = ?, created_by = ?, last_event_at = ? WHERE aggregate_id = ?",
                        metadata.aggregateKind().value(),
                        metadata.projectId(),
                        metadata.title(),
                        metadata.status(),
                        timestamp(metadata.createdAt()),
                        metadata.createdBy(),
                        timestamp(metadata.lastEventAt()),
                        metadata.aggregateId());
        if (updated == 0) {
            insert(metadata);
        }
    }

    @Override
    public boolean delete(String aggregateId) {
        return jdbc.update("DELETE FROM case_metadata WHERE aggregate_id = ?", aggregateId) > 0;
    }

    @Override
    public List<CaseMetadata> listAll() {
        return jdbc.query("SELECT " + COLUMNS + " FROM case_metadata" + ORDER, this::map);
    }

    @Override
    public List<CaseMetadata> listByProject(String projectId) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM case_metadata WHERE project_id = ?" + ORDER, this::map, projectId);
    }

    private void insert(CaseMetadata metadata) {
        jdbc.update(
                "INSERT INTO case_metadata (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
                metadata.aggregateId(),
                metadata.aggregateKind().value(),
                metadata.projectId(),
                metadata.title(),
                metadata.status(),
                timestamp(metadata.createdAt()),
                metadata.createdBy(),
                timestamp(metadata.lastEventAt()));
    }

    private CaseMetadata map(ResultSet rs, int row) throws SQLException {
        String kind = rs.getString("aggregate_kind");
        return new CaseMetadata(
                rs.getString("aggregate_id"),
                AggregateKind.fromString(kind)
                        .orElseThrow(() -> new IllegalStateException("Unknown aggregate kind: " + kind)),
                rs.getString("project_id"),
                rs.getString("title"),
                rs.getString("status"),
                instant(rs.getTimestamp("created_at")),
                rs.getString("created_by"),
                instant(rs.getTimestamp("last_event_at")));
    }

    private static Timestamp timestamp(Instant instant) {
        return instant == null ? null : Timestamp.from(instant);
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
