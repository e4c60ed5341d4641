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

import com.storefront.identitysync.application.port.out.DestinationStore;
import com.storefront.identitysync.domain.entity.Destination;

/**
 * PostgreSQL implementation of the DestinationStore outbound port. The API key
 * is read from {@code config->>'api_key'}.
 */
@Component
public class JdbcDestinationStore implements DestinationStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcDestinationStore.class);

    private static final String COLUMNS = "id, workspace_id, type, enabled, config->>'api_key' AS api_key, "
            + "last_sync_at, last_error";

    private static final String SELECT_BY_ID_SQL = "SELECT " + COLUMNS + " FROM destinations WHERE id = ?";

    private static final String SELECT_ACTIVE_SQL = "SELECT " + COLUMNS + " FROM destinations "
            + "WHERE workspace_id = ? AND enabled = true AND type = 'klaviyo' ORDER BY created_at LIMIT 1";

    private static final String SELECT_ENABLED_SQL = "SELECT " + COLUMNS + " FROM destinations "
            + "WHERE enabled = true ORDER BY created_at";

    private static final String SUCCESS_SQL = "UPDATE destinations SET last_sync_at = ?, last_error = NULL, "
            + "updated_at = ? WHERE id = ?";

    private static final String ERROR_SQL = "UPDATE destinations SET last_error = ?, updated_at = ? WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcDestinationStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Destination> findById(String destinationId) {
        return jdbcTemplate.query(SELECT_BY_ID_SQL, (rs, rowNum) -> mapRow(rs), destinationId)
                .stream().findFirst();
    }

    @Override
    public Optional<Destination> findActiveForWorkspace(String workspaceId) {
        return jdbcTemplate.query(SELECT_ACTIVE_SQL, (rs, rowNum) -> mapRow(rs), workspaceId)
                .stream().findFirst();
    }

    @Override
    public List<Destination> findAllEnabled() {
        return jdbcTemplate.query(SELECT_ENABLED_SQL, (rs, rowNum) -> mapRow(rs));
    }

    @Override
    public void recordSuccess(String destinationId, Instant at) {
        jdbcTemplate.update(SUCCESS_SQL, Timestamp.from(at), Timestamp.from(at), destinationId);
    }

    @Override
    public void recordError(String destinationId, String error, Instant at) {
        jdbcTemplate.update(ERROR_SQL, error, Timestamp.from(at), destinationId);
        log.warn("action=destination_error destinationId={} error={}", destinationId, error);
    }

    private Destination mapRow(ResultSet rs) throws SQLException {
        return new Destination(
                rs.getString("id"),
                rs.getString("workspace_id"),
                rs.getString("type"),
                rs.getBoolean("enabled"),
                rs.getString("api_key"),
                JdbcSyncJobStore.instant(rs.getTimestamp("last_sync_at")),
                rs.getString("last_error"));
    }
}
