package com.storefront.identitysync.domain.entity;

import java.time.Instant;
import java.util.Objects;

import com.storefront.identitysync.domain.valueobject.IdentityType;

/**
 * Evidence that one identifier value belongs to a unified identity.
 * Rows are never updated in place; merges repoint them to the surviving record.
 */
public final class IdentityLink {

    public static final double FULL_CONFIDENCE = 1.0;

    private final String workspaceId;
    private final String unifiedUserId;
    private final IdentityType identityType;
    private final String identityValue;
    private final String source;
    private final double confidence;
    private final Instant createdAt;

    public IdentityLink(String workspaceId, String unifiedUserId, IdentityType identityType,
            String identityValue, String source, double confidence, Instant createdAt) {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId cannot be null or blank");
        }
        if (unifiedUserId == null || unifiedUserId.isBlank()) {
            throw new IllegalArgumentException("unifiedUserId cannot be null or blank");
        }
        if (identityType == null) {
            throw new IllegalArgumentException("identityType cannot be null");
        }
        if (identityValue == null || identityValue.isBlank()) {
            throw new IllegalArgumentException("identityValue cannot be null or blank");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0, 1], got: " + confidence);
        }
        this.workspaceId = workspaceId;
        this.unifiedUserId = unifiedUserId;
        this.identityType = identityType;
        this.identityValue = identityValue;
        this.source = source;
        this.confidence = confidence;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * Link captured directly from a call that carried the identifier.
     */
    public static IdentityLink observed(String workspaceId, String unifiedUserId, IdentityType type,
            String value, String source, Instant now) {
        return new IdentityLink(workspaceId, unifiedUserId, type, value, source, FULL_CONFIDENCE, now);
    }

    // ─────────────────── Getters ───────────────────

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getUnifiedUserId() {
        return unifiedUserId;
    }

    public IdentityType getIdentityType() {
        return identityType;
    }

    public String getIdentityValue() {
        return identityValue;
    }

    public String getSource() {
        return source;
    }

    public double getConfidence() {
        return confidence;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        IdentityLink that = (IdentityLink) o;
        return workspaceId.equals(that.workspaceId)
                && identityType == that.identityType
                && identityValue.equals(that.identityValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(workspaceId, identityType, identityValue);
    }

    @Override
    public String toString() {
        return "IdentityLink{unifiedUserId='" + unifiedUserId
                + "', type=" + identityType
                + ", source='" + source + "'}";
    }
}
