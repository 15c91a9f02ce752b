package com.ivyintel.tracker.scrape.persistence;

import com.ivyintel.tracker.scrape.model.InsertOutcome;
import com.ivyintel.tracker.scrape.model.NewSnapshot;
import com.ivyintel.tracker.scrape.model.Snapshot;
import com.ivyintel.tracker.scrape.model.SnapshotFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

@Repository
public class SnapshotJdbcRepository implements SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotJdbcRepository.class);
    private static final String SELECT_COLUMNS =
        "SELECT id, university, page_type, url, extracted_at, content_hash, data_json FROM extracted_data";

    private final NamedParameterJdbcTemplate jdbc;

    public SnapshotJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean isReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    @Override
    public InsertOutcome insert(NewSnapshot snapshot) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("university", snapshot.university())
            .addValue("pageType", snapshot.pageType())
            .addValue("url", snapshot.url())
            .addValue("extractedAt", snapshot.extractedAt().atOffset(ZoneOffset.UTC))
            .addValue("contentHash", snapshot.contentHash())
            .addValue("dataJson", snapshot.payloadJson());
        try {
            jdbc.update(
                """
                    INSERT INTO extracted_data (university, page_type, url, extracted_at, content_hash, data_json)
                    VALUES (:university, :pageType, :url, :extractedAt, :contentHash, :dataJson)
                    """,
                params
            );
            return InsertOutcome.INSERTED;
        } catch (DuplicateKeyException e) {
            log.debug("Unchanged content for {} (hash {})", snapshot.url(), snapshot.contentHash());
            return InsertOutcome.DUPLICATE;
        }
    }

    @Override
    public List<Snapshot> listByUniversity(String university) {
        return jdbc.query(
            SELECT_COLUMNS + " WHERE university = :university ORDER BY extracted_at DESC, id DESC",
            new MapSqlParameterSource("university", university),
            snapshotRowMapper()
        );
    }

    @Override
    public List<Snapshot> listLatest(int limit) {
        return jdbc.query(
            SELECT_COLUMNS + " ORDER BY extracted_at DESC, id DESC LIMIT :limit",
            new MapSqlParameterSource("limit", Math.max(1, limit)),
            snapshotRowMapper()
        );
    }

    @Override
    public void delete(long snapshotId) {
        jdbc.update("DELETE FROM extracted_data WHERE id = :id", new MapSqlParameterSource("id", snapshotId));
    }

    @Override
    public long count(SnapshotFilter filter) {
        SnapshotFilter safeFilter = filter == null ? SnapshotFilter.all() : filter;
        StringBuilder sql = new StringBuilder("SELECT COUNT(*) FROM extracted_data WHERE 1 = 1");
        MapSqlParameterSource params = new MapSqlParameterSource();
        if (safeFilter.university() != null) {
            sql.append(" AND university = :university");
            params.addValue("university", safeFilter.university());
        }
        if (safeFilter.pageType() != null) {
            sql.append(" AND page_type = :pageType");
            params.addValue("pageType", safeFilter.pageType());
        }
        Long total = jdbc.queryForObject(sql.toString(), params, Long.class);
        return total == null ? 0L : total;
    }

    private RowMapper<Snapshot> snapshotRowMapper() {
        return (rs, rowNum) -> new Snapshot(
            rs.getLong("id"),
            rs.getString("university"),
            rs.getString("page_type"),
            rs.getString("url"),
            rs.getObject("extracted_at", OffsetDateTime.class).toInstant(),
            rs.getString("content_hash"),
            rs.getString("data_json")
        );
    }
}
