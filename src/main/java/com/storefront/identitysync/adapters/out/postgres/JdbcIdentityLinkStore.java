package com.storefront.identitysync.adapters.out.postgres;

import java.sql.Timestamp;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.IdentityLinkStore;
import com.storefront.identitysync.domain.entity.IdentityLink;
import com.storefront.identitysync.domain.valueobject.IdentityType;

/**
 * PostgreSQL implementation of the IdentityLinkStore outbound port.
 * First writer wins on (workspace, type, value).
 */
@Component
public class JdbcIdentityLinkStore implements IdentityLinkStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdentityLinkStore.class);

    private static final String INSERT_SQL = "INSERT INTO identities "
            + "(workspace_id, unified_user_id, identity_type, identity_value, confidence, source, created_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?) "
            + "ON CONFLICT (workspace_id, identity_type, identity_value) DO NOTHING";

    private static final String REASSIGN_SQL = "UPDATE identities SET unified_user_id = ? WHERE unified_user_id = ?";

    private static final String SELECT_BY_USER_SQL = "SELECT workspace_id, unified_user_id, identity_type, "
            + "identity_value, confidence, source, created_at FROM identities "
            + "WHERE unified_user_id = ? ORDER BY created_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcIdentityLinkStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void link(IdentityLink link) {
        int rows = jdbcTemplate.update(INSERT_SQL,
                link.getWorkspaceId(),
                link.getUnifiedUserId(),
                link.getIdentityType().getValue(),
                link.getIdentityValue(),
                link.getConfidence(),
                link.getSource(),
                Timestamp.from(link.getCreatedAt()));
        if (rows > 0) {
            log.debug("action=identity_linked unifiedUserId={} type={}",
                    link.getUnifiedUserId(), link.getIdentityType().getValue());
        }
    }

    @Override
    public int reassign(String fromUserId, String toUserId) {
        return jdbcTemplate.update(REASSIGN_SQL, toUserId, fromUserId);
    }

    @Override
    public List<IdentityLink> findByUnifiedUserId(String unifiedUserId) {
        return jdbcTemplate.query(SELECT_BY_USER_SQL, (rs, rowNum) -> new IdentityLink(
                rs.getString("workspace_id"),
                rs.getString("unified_user_id"),
                IdentityType.fromValue(rs.getString("identity_type")),
                rs.getString("identity_value"),
                rs.getString("source"),
                rs.getDouble("confidence"),
                rs.getTimestamp("created_at").toInstant()), unifiedUserId);
    }
}
