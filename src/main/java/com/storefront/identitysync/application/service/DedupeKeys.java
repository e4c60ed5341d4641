package com.storefront.identitysync.application.service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * Deterministic keys for event deduplication and cookieless fingerprints.
 */
public final class DedupeKeys {

    /** Checked in order; the first present value identifies the business object. */
    static final List<String> PRIMARY_KEY_PROPERTIES = List.of(
            "checkout_id", "checkout_token", "cart_token", "order_id", "order_number", "token");

    static final long FALLBACK_BUCKET_SECONDS = 300;

    private static final int FINGERPRINT_HEX_LENGTH = 16;

    private DedupeKeys() {
    }

    /**
     * Key for a storefront event: the business object id when the properties
     * carry one, otherwise the anonymous id within a 5 minute bucket.
     */
    public static String forEvent(String workspaceId, String eventName, Map<String, Object> properties,
            String anonymousId, Instant eventTime) {
        String primaryKey = primaryKeyOf(properties);
        if (primaryKey != null) {
            return md5(workspaceId + "::" + eventName + "::" + primaryKey);
        }
        long bucket = (eventTime.getEpochSecond() / FALLBACK_BUCKET_SECONDS) * FALLBACK_BUCKET_SECONDS;
        return md5(workspaceId + "::" + eventName + "::" + anonymousId + "::" + bucket);
    }

    /** Key for an event pulled from the destination, bound to its remote id. */
    public static String forExternalEvent(String workspaceId, String source, String externalId) {
        return md5(workspaceId + "::" + source + "::" + externalId);
    }

    /** Key for a synthesized event, bound to the state transition that produced it. */
    public static String forDerivedEvent(String workspaceId, String unifiedUserId, String eventName,
            Instant anchor) {
        return md5(workspaceId + "::" + unifiedUserId + "::" + eventName + "::" + anchor);
    }

    /**
     * Pseudo anonymous id for cookieless traffic.
     *
     * @return {@code fp_<hash>}, or null when the client IP is unknown
     */
    public static String fingerprint(String clientIp, String userAgent) {
        if (clientIp == null || clientIp.isBlank()) {
            return null;
        }
        String ua = userAgent != null ? userAgent : "";
        return "fp_" + sha256(clientIp.trim() + "|" + ua).substring(0, FINGERPRINT_HEX_LENGTH);
    }

    static String primaryKeyOf(Map<String, Object> properties) {
        if (properties == null) {
            return null;
        }
        for (String key : PRIMARY_KEY_PROPERTIES) {
            Object value = properties.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    private static String md5(String input) {
        return digest("MD5", input);
    }

    private static String sha256(String input) {
        return digest("SHA-256", input);
    }

    private static String digest(String algorithm, String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(algorithm + " not available", e);
        }
    }
}
