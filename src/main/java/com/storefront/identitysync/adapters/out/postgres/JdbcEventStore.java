package com.storefront.identitysync.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.valueobject.EventStatus;

/**
 * PostgreSQL implementation of the EventStore outbound port.
 * <p>
 * Uses ON CONFLICT DO NOTHING on (workspace_id, dedupe_key) for idempotent
 * writes; a duplicate bumps {@code dupe_count} on the stored row.
 * </p>
 */
@Component
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private static final String COLUMNS = "id, workspace_id, unified_user_id, anonymous_id, event_type, "
            + "event_name, properties, event_time, source, dedupe_key, status";

    private static final String INSERT_SQL = "INSERT INTO events (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?, ?) "
            + "ON CONFLICT (workspace_id, dedupe_key) DO NOTHING";

    private static final String SELECT_BY_ID_SQL = "SELECT " + COLUMNS + " FROM events WHERE id = ?";

    private static final String SELECT_BY_DEDUPE_SQL = "SELECT " + COLUMNS + " FROM events "
            + "WHERE workspace_id = ? AND dedupe_key = ?";

    private static final String DUPLICATE_SQL = "UPDATE events SET dupe_count = dupe_count + 1 "
            + "WHERE workspace_id = ? AND dedupe_key = ?";

    private static final String ATTACH_SQL = "UPDATE events SET unified_user_id = ? WHERE id = ?";

    private static final String RELINK_SQL = "UPDATE events SET unified_user_id = ? "
            + "WHERE workspace_id = ? AND anonymous_id = ? "
            + "AND (unified_user_id IS NULL OR unified_user_id <> ?)";

    private static final String REASSIGN_SQL = "UPDATE events SET unified_user_id = ? WHERE unified_user_id = ?";

    private static final String MARK_STATUS_SQL = "UPDATE events SET status = ?, "
            + "processed_at = CASE WHEN ?::text IN ('processed', 'failed') THEN now() ELSE processed_at END, "
            + "synced_at = CASE WHEN ?::text = 'synced' THEN now() ELSE synced_at END "
            + "WHERE id = ?";

    private static final String SELECT_BY_USER_SINCE_SQL = "SELECT " + COLUMNS + " FROM events "
            + "WHERE unified_user_id = ? AND event_time >= ? ORDER BY event_time";

    private static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM events";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, JsonColumns jsonColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public boolean insert(TrackedEvent event) {
        int rows = jdbcTemplate.update(INSERT_SQL,
                event.getId(),
                event.getWorkspaceId(),
                event.getUnifiedUserId(),
                event.getAnonymousId(),
                event.getEventType(),
                event.getEventName(),
                jsonColumns.write(event.getProperties()),
                Timestamp.from(event.getEventTime()),
                event.getSource(),
                event.getDedupeKey(),
                event.getStatus().getValue());

        if (rows > 0) {
            log.debug("action=event_saved eventId={} workspaceId={}", event.getId(), event.getWorkspaceId());
            return true;
        }
        log.debug("action=event_duplicate_skipped workspaceId={} dedupeKey={}",
                event.getWorkspaceId(), event.getDedupeKey());
        return false;
    }

    @Override
    public Optional<TrackedEvent> findById(String eventId) {
        return jdbcTemplate.query(SELECT_BY_ID_SQL, (rs, rowNum) -> mapRow(rs), eventId)
                .stream().findFirst();
    }

    @Override
    public Optional<TrackedEvent> findByDedupeKey(String workspaceId, String dedupeKey) {
        return jdbcTemplate.query(SELECT_BY_DEDUPE_SQL, (rs, rowNum) -> mapRow(rs), workspaceId, dedupeKey)
                .stream().findFirst();
    }

    @Override
    public void recordDuplicate(String workspaceId, String dedupeKey) {
        jdbcTemplate.update(DUPLICATE_SQL, workspaceId, dedupeKey);
    }

    @Override
    public void attach(String eventId, String unifiedUserId) {
        jdbcTemplate.update(ATTACH_SQL, unifiedUserId, eventId);
    }

    @Override
    public int relinkByAnonymousId(String workspaceId, String anonymousId, String unifiedUserId) {
        int rows = jdbcTemplate.update(RELINK_SQL, unifiedUserId, workspaceId, anonymousId, unifiedUserId);
        if (rows > 0) {
            log.info("action=events_relinked workspaceId={} unifiedUserId={} count={}",
                    workspaceId, unifiedUserId, rows);
        }
        return rows;
    }

    @Override
    public int reassign(String fromUserId, String toUserId) {
        return jdbcTemplate.update(REASSIGN_SQL, toUserId, fromUserId);
    }

    @Override
    public void markStatus(String eventId, EventStatus status) {
        String value = status.getValue();
        jdbcTemplate.update(MARK_STATUS_SQL, value, value, value, eventId);
    }

    @Override
    public List<TrackedEvent> findByUnifiedUserSince(String unifiedUserId, Instant since) {
        return jdbcTemplate.query(SELECT_BY_USER_SINCE_SQL, (rs, rowNum) -> mapRow(rs),
                unifiedUserId, Timestamp.from(since));
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject(COUNT_ALL_SQL, Long.class);
        return count != null ? count : 0;
    }

    // ─────────────────── Private Helpers ───────────────────

    private TrackedEvent mapRow(ResultSet rs) throws SQLException {
        return new TrackedEvent(
                rs.getString("id"),
                rs.getString("workspace_id"),
                rs.getString("unified_user_id"),
                rs.getString("anonymous_id"),
                rs.getString("event_type"),
                rs.getString("event_name"),
                jsonColumns.read(rs.getString("properties")),
                rs.getTimestamp("event_time").toInstant(),
                rs.getString("source"),
                rs.getString("dedupe_key"),
                EventStatus.fromValue(rs.getString("status")));
    }
}
