package com.storefront.identitysync.adapters.out.postgres;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Array;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.ApiKeyValidator;

/**
 * Validates ingestion keys against {@code api_keys.key_hash} (SHA-256 hex of
 * the raw key). Revoked and expired keys are rejected.
 */
@Component
public class JdbcApiKeyValidator implements ApiKeyValidator {

    private static final Logger log = LoggerFactory.getLogger(JdbcApiKeyValidator.class);

    private static final String SELECT_SQL = "SELECT id, workspace_id, scopes FROM api_keys "
            + "WHERE key_hash = ? AND revoked_at IS NULL AND (expires_at IS NULL OR expires_at > now()) LIMIT 1";

    private static final String TOUCH_SQL = "UPDATE api_keys SET last_used_at = now() WHERE id = ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcApiKeyValidator(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<ApiKeyGrant> validate(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            return Optional.empty();
        }
        String keyHash = sha256(rawApiKey.trim());
        Optional<KeyRow> row = jdbcTemplate.query(SELECT_SQL, (rs, rowNum) -> {
            Array scopes = rs.getArray("scopes");
            Set<String> scopeSet = scopes != null
                    ? new LinkedHashSet<>(Arrays.asList((String[]) scopes.getArray()))
                    : Set.of();
            return new KeyRow(rs.getString("id"), new ApiKeyGrant(rs.getString("workspace_id"), scopeSet));
        }, keyHash).stream().findFirst();

        if (row.isEmpty()) {
            log.warn("action=api_key_rejected keyPrefix={}", prefix(rawApiKey));
            return Optional.empty();
        }
        jdbcTemplate.update(TOUCH_SQL, row.get().id());
        return Optional.of(row.get().grant());
    }

    static String sha256(String raw) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(raw.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String prefix(String raw) {
        return raw.length() > 8 ? raw.substring(0, 8) : raw;
    }

    private record KeyRow(String id, ApiKeyGrant grant) {
    }
}
