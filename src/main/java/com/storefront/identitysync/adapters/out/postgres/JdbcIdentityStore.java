package com.storefront.identitysync.adapters.out.postgres;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;

/**
 * PostgreSQL implementation of the IdentityStore outbound port.
 * <p>
 * Identifier sets live in {@code text[]} columns, traits and computed state in
 * JSONB. Every write to {@code computed} bumps {@code version}; the email
 * critical section is a transaction-scoped advisory lock.
 * </p>
 */
@Component
public class JdbcIdentityStore implements IdentityStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdentityStore.class);

    private static final String COLUMNS = "id, workspace_id, primary_email, emails, phone, customer_ids, "
            + "anonymous_ids, traits, computed, version, first_seen_at, last_seen_at, created_at, updated_at";

    private static final String LOCK_EMAIL_SQL = "SELECT pg_advisory_xact_lock(hashtext(?))";

    private static final String SELECT_BY_ID_SQL = "SELECT " + COLUMNS + " FROM unified_users WHERE id = ?";

    private static final String SELECT_BY_ANONYMOUS_ID_SQL = "SELECT " + COLUMNS + " FROM unified_users "
            + "WHERE workspace_id = ? AND ? = ANY(anonymous_ids) ORDER BY created_at LIMIT 1";

    private static final String SELECT_BY_EMAIL_SQL = "SELECT " + COLUMNS + " FROM unified_users "
            + "WHERE workspace_id = ? AND (primary_email = ? OR ? = ANY(emails)) "
            + "ORDER BY COALESCE(primary_email = ?, false) DESC, created_at LIMIT 1";

    private static final String SELECT_BY_CUSTOMER_ID_SQL = "SELECT " + COLUMNS + " FROM unified_users "
            + "WHERE workspace_id = ? AND ? = ANY(customer_ids) ORDER BY created_at LIMIT 1";

    private static final String INSERT_SQL = "INSERT INTO unified_users (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?::jsonb, ?, ?, ?, ?, ?)";

    private static final String UNION_SQL = "ARRAY(SELECT v FROM unnest(%1$s || ?::text[]) WITH ORDINALITY AS t(v, n) "
            + "GROUP BY v ORDER BY MIN(n))";

    private static final String MERGE_IDENTIFIERS_SQL = "UPDATE unified_users SET "
            + "primary_email = COALESCE(primary_email, ?), "
            + "emails = " + String.format(UNION_SQL, "emails") + ", "
            + "phone = COALESCE(phone, ?), "
            + "customer_ids = " + String.format(UNION_SQL, "customer_ids") + ", "
            + "anonymous_ids = " + String.format(UNION_SQL, "anonymous_ids") + ", "
            + "traits = COALESCE(traits, '{}'::jsonb) || ?::jsonb, "
            + "first_seen_at = LEAST(first_seen_at, ?), last_seen_at = GREATEST(last_seen_at, ?), "
            + "updated_at = GREATEST(updated_at, ?) WHERE id = ?";

    private static final String DELETE_SQL = "DELETE FROM unified_users WHERE id = ?";

    private static final String UPDATE_COMPUTED_SQL = "UPDATE unified_users SET computed = ?::jsonb, "
            + "version = version + 1 WHERE id = ? AND version = ?";

    private static final String SET_FLAG_SQL = "UPDATE unified_users SET computed = jsonb_set(computed, '{flags}', "
            + "COALESCE(computed->'flags', '{}'::jsonb) || jsonb_build_object(?::text, ?::text), true), "
            + "version = version + 1 WHERE id = ?";

    private static final String CLEAR_FLAGS_SQL = "UPDATE unified_users SET computed = jsonb_set(computed, '{flags}', "
            + "COALESCE(computed->'flags', '{}'::jsonb) - ?::text[], true), "
            + "version = version + 1 WHERE id = ?";

    private static final String SNAPSHOT_SQL = "UPDATE unified_users SET last_synced_computed = ?::jsonb, "
            + "last_synced_at = ? WHERE id = ?";

    private static final String STALE_ACTIVE_SQL = "SELECT id FROM unified_users WHERE last_seen_at >= ? "
            + "AND (computed->>'computed_at' IS NULL OR (computed->>'computed_at')::timestamptz < ?) "
            + "ORDER BY last_seen_at DESC LIMIT ?";

    private static final String INACTIVE_SQL = "SELECT id FROM unified_users WHERE last_seen_at < ? "
            + "AND (computed->>'last_decayed_at' IS NULL OR (computed->>'last_decayed_at')::timestamptz < ?) "
            + "ORDER BY last_seen_at LIMIT ?";

    private static final String CART_CANDIDATES_SQL = "SELECT u.id FROM unified_users u "
            + "WHERE u.primary_email IS NOT NULL "
            + "AND (u.computed->>'last_cart_at')::timestamptz < ? "
            + "AND (u.computed->>'last_cart_at')::timestamptz >= ? "
            + "AND NOT EXISTS (SELECT 1 FROM identity_signals s WHERE s.unified_user_id = u.id "
            + "AND s.signal_type = 'cart_abandonment' "
            + "AND s.computed_at >= (u.computed->>'last_cart_at')::timestamptz) "
            + "ORDER BY (u.computed->>'last_cart_at')::timestamptz LIMIT ?";

    private static final String CHECKOUT_CANDIDATES_SQL = "SELECT u.id FROM unified_users u "
            + "WHERE u.primary_email IS NOT NULL "
            + "AND (u.computed->>'checkout_started_at')::timestamptz < ? "
            + "AND (u.computed->>'checkout_started_at')::timestamptz >= ? "
            + "AND NOT EXISTS (SELECT 1 FROM identity_signals s WHERE s.unified_user_id = u.id "
            + "AND s.signal_type = 'checkout_abandonment' "
            + "AND s.computed_at >= (u.computed->>'checkout_started_at')::timestamptz) "
            + "ORDER BY (u.computed->>'checkout_started_at')::timestamptz LIMIT ?";

    private static final String EMAIL_UPDATED_SQL = "SELECT id FROM unified_users "
            + "WHERE primary_email IS NOT NULL AND updated_at >= ? "
            + "AND (last_synced_at IS NULL OR last_synced_at < updated_at) "
            + "ORDER BY updated_at DESC LIMIT ?";

    private static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM unified_users";

    private static final String COUNT_WITH_EMAIL_SQL = "SELECT COUNT(*) FROM unified_users WHERE primary_email IS NOT NULL";

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns jsonColumns;

    public JdbcIdentityStore(JdbcTemplate jdbcTemplate, JsonColumns jsonColumns) {
        this.jdbcTemplate = jdbcTemplate;
        this.jsonColumns = jsonColumns;
    }

    @Override
    public void lockEmail(String workspaceId, String email) {
        jdbcTemplate.queryForList(LOCK_EMAIL_SQL, workspaceId + ":" + email);
    }

    @Override
    public Optional<UnifiedIdentity> findById(String id) {
        return first(jdbcTemplate.query(SELECT_BY_ID_SQL, (rs, rowNum) -> mapRow(rs), id));
    }

    @Override
    public Optional<UnifiedIdentity> findByAnonymousId(String workspaceId, String anonymousId) {
        return first(jdbcTemplate.query(SELECT_BY_ANONYMOUS_ID_SQL, (rs, rowNum) -> mapRow(rs),
                workspaceId, anonymousId));
    }

    @Override
    public Optional<UnifiedIdentity> findByEmail(String workspaceId, String email) {
        return first(jdbcTemplate.query(SELECT_BY_EMAIL_SQL, (rs, rowNum) -> mapRow(rs),
                workspaceId, email, email, email));
    }

    @Override
    public Optional<UnifiedIdentity> findByCustomerId(String workspaceId, String customerId) {
        return first(jdbcTemplate.query(SELECT_BY_CUSTOMER_ID_SQL, (rs, rowNum) -> mapRow(rs),
                workspaceId, customerId));
    }

    @Override
    public void insert(UnifiedIdentity identity) {
        jdbcTemplate.update(INSERT_SQL, ps -> {
            ps.setString(1, identity.getId());
            ps.setString(2, identity.getWorkspaceId());
            ps.setString(3, identity.getPrimaryEmail());
            ps.setArray(4, textArray(ps, identity.getEmails()));
            ps.setString(5, identity.getPhone());
            ps.setArray(6, textArray(ps, identity.getCustomerIds()));
            ps.setArray(7, textArray(ps, identity.getAnonymousIds()));
            ps.setString(8, jsonColumns.write(identity.getTraits()));
            ps.setString(9, jsonColumns.write(identity.getComputed().toMap()));
            ps.setLong(10, identity.getVersion());
            ps.setTimestamp(11, Timestamp.from(identity.getFirstSeenAt()));
            ps.setTimestamp(12, Timestamp.from(identity.getLastSeenAt()));
            ps.setTimestamp(13, Timestamp.from(identity.getCreatedAt()));
            ps.setTimestamp(14, Timestamp.from(identity.getUpdatedAt()));
        });
        log.debug("action=identity_inserted unifiedUserId={} workspaceId={}",
                identity.getId(), identity.getWorkspaceId());
    }

    @Override
    public void mergeIdentifiers(UnifiedIdentity identity) {
        int rows = jdbcTemplate.update(MERGE_IDENTIFIERS_SQL, ps -> {
            ps.setString(1, identity.getPrimaryEmail());
            ps.setArray(2, textArray(ps, identity.getEmails()));
            ps.setString(3, identity.getPhone());
            ps.setArray(4, textArray(ps, identity.getCustomerIds()));
            ps.setArray(5, textArray(ps, identity.getAnonymousIds()));
            ps.setString(6, jsonColumns.write(identity.getTraits()));
            ps.setTimestamp(7, Timestamp.from(identity.getFirstSeenAt()));
            ps.setTimestamp(8, Timestamp.from(identity.getLastSeenAt()));
            ps.setTimestamp(9, Timestamp.from(identity.getUpdatedAt()));
            ps.setString(10, identity.getId());
        });
        if (rows == 0) {
            log.warn("action=identity_update_missed unifiedUserId={}", identity.getId());
        }
    }

    @Override
    public void delete(String id) {
        jdbcTemplate.update(DELETE_SQL, id);
        log.info("action=identity_deleted unifiedUserId={}", id);
    }

    @Override
    public boolean updateComputed(String id, long expectedVersion, ComputedTraits computed, Instant now) {
        int rows = jdbcTemplate.update(UPDATE_COMPUTED_SQL, jsonColumns.write(computed.toMap()), id, expectedVersion);
        if (rows == 0) {
            log.debug("action=computed_cas_miss unifiedUserId={} expectedVersion={}", id, expectedVersion);
        }
        return rows > 0;
    }

    @Override
    public void setSyncFlag(String id, String flag, Instant at) {
        jdbcTemplate.update(SET_FLAG_SQL, flag, at.toString(), id);
        log.debug("action=sync_flag_set unifiedUserId={} flag={}", id, flag);
    }

    @Override
    public void clearSyncFlags(String id, Collection<String> flags) {
        jdbcTemplate.update(CLEAR_FLAGS_SQL, ps -> {
            ps.setArray(1, textArray(ps, flags));
            ps.setString(2, id);
        });
        log.debug("action=sync_flags_cleared unifiedUserId={} flags={}", id, flags);
    }

    @Override
    public void recordSyncSnapshot(String id, Map<String, Object> snapshot, Instant at) {
        jdbcTemplate.update(SNAPSHOT_SQL, jsonColumns.write(snapshot), Timestamp.from(at), id);
    }

    @Override
    public List<String> findStaleActive(Instant seenSince, Instant computedBefore, int limit) {
        return jdbcTemplate.queryForList(STALE_ACTIVE_SQL, String.class,
                Timestamp.from(seenSince), Timestamp.from(computedBefore), limit);
    }

    @Override
    public List<String> findInactiveSince(Instant lastSeenBefore, Instant decayedBefore, int limit) {
        return jdbcTemplate.queryForList(INACTIVE_SQL, String.class,
                Timestamp.from(lastSeenBefore), Timestamp.from(decayedBefore), limit);
    }

    @Override
    public List<String> findCartAbandonmentCandidates(Instant cartIdleBefore, Instant lookbackStart, int limit) {
        return jdbcTemplate.queryForList(CART_CANDIDATES_SQL, String.class,
                Timestamp.from(cartIdleBefore), Timestamp.from(lookbackStart), limit);
    }

    @Override
    public List<String> findCheckoutAbandonmentCandidates(Instant checkoutIdleBefore, Instant lookbackStart,
            int limit) {
        return jdbcTemplate.queryForList(CHECKOUT_CANDIDATES_SQL, String.class,
                Timestamp.from(checkoutIdleBefore), Timestamp.from(lookbackStart), limit);
    }

    @Override
    public List<String> findEmailIdentitiesUpdatedSince(Instant since, int limit) {
        return jdbcTemplate.queryForList(EMAIL_UPDATED_SQL, String.class, Timestamp.from(since), limit);
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject(COUNT_ALL_SQL, Long.class);
        return count != null ? count : 0;
    }

    @Override
    public long countWithEmail() {
        Long count = jdbcTemplate.queryForObject(COUNT_WITH_EMAIL_SQL, Long.class);
        return count != null ? count : 0;
    }

    // ─────────────────── Private Helpers ───────────────────

    private UnifiedIdentity mapRow(ResultSet rs) throws SQLException {
        return UnifiedIdentity.reconstruct(
                rs.getString("id"),
                rs.getString("workspace_id"),
                readArray(rs, "anonymous_ids"),
                readArray(rs, "emails"),
                readArray(rs, "customer_ids"),
                rs.getString("primary_email"),
                rs.getString("phone"),
                ComputedTraits.fromMap(jsonColumns.read(rs.getString("computed"))),
                jsonColumns.read(rs.getString("traits")),
                rs.getTimestamp("first_seen_at").toInstant(),
                rs.getTimestamp("last_seen_at").toInstant(),
                rs.getTimestamp("created_at").toInstant(),
                rs.getTimestamp("updated_at").toInstant(),
                rs.getLong("version"));
    }

    static Array textArray(PreparedStatement ps, Collection<String> values) throws SQLException {
        return ps.getConnection().createArrayOf("text", values.toArray());
    }

    private static Set<String> readArray(ResultSet rs, String column) throws SQLException {
        Array array = rs.getArray(column);
        if (array == null) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(Arrays.asList((String[]) array.getArray()));
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
