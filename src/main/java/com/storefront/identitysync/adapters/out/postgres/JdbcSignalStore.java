package com.storefront.identitysync.adapters.out.postgres;

import java.sql.Timestamp;
import java.util.List;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.SignalStore;
import com.storefront.identitysync.domain.entity.IdentitySignal;

/**
 * PostgreSQL implementation of the SignalStore outbound port.
 */
@Component
public class JdbcSignalStore implements SignalStore {

    private static final String UPSERT_SQL = "INSERT INTO identity_signals "
            + "(unified_user_id, signal_type, workspace_id, value, payload, computed_at) "
            + "VALUES (?, ?, ?, ?, ?::jsonb, ?) "
            + "ON CONFLICT (unified_user_id, signal_type) DO UPDATE SET value = EXCLUDED.value, "
            + "payload = EXCLUDED.payload, computed_at = EXCLUDED.computed_at";

    // colliding types on the target win
    private static final String DELETE_COLLIDING_SQL = "DELETE FROM identity_signals s WHERE s.unified_user_id = ? "
            + "AND EXISTS (SELECT 1 FROM identity_signals t WHERE t.unified_user_id = ? "
            + "AND t.signal_type = s.signal_type)";

    private static final String REASSIGN_SQL = "UPDATE identity_signals SET unified_user_id = ? WHERE unified_user_id = ?";

    private static final String SELECT_BY_USER_SQL = "SELECT unified_user_id, signal_type, workspace_id, value, "
            + "payload, computed_at FROM identity_signals WHERE unified_user_id = ? ORDER BY signal_type";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    public JdbcSignalStore(JdbcTemplate jdbcTemplate, JsonColumns jsonColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public void upsert(IdentitySignal signal) {
        jdbcTemplate.update(UPSERT_SQL,
                signal.getUnifiedUserId(),
                signal.getSignalType(),
                signal.getWorkspaceId(),
                signal.getValue(),
                jsonColumns.write(signal.getPayload()),
                Timestamp.from(signal.getComputedAt()));
    }

    @Override
    public int reassign(String fromUserId, String toUserId) {
        jdbcTemplate.update(DELETE_COLLIDING_SQL, fromUserId, toUserId);
        return jdbcTemplate.update(REASSIGN_SQL, toUserId, fromUserId);
    }

    @Override
    public List<IdentitySignal> findByUnifiedUserId(String unifiedUserId) {
        return jdbcTemplate.query(SELECT_BY_USER_SQL, (rs, rowNum) -> new IdentitySignal(
                rs.getString("workspace_id"),
                rs.getString("unified_user_id"),
                rs.getString("signal_type"),
                rs.getDouble("value"),
                jsonColumns.read(rs.getString("payload")),
                rs.getTimestamp("computed_at").toInstant()), unifiedUserId);
    }
}
