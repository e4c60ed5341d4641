package com.storefront.identitysync.domain.entity;

import java.time.Instant;
import java.util.Objects;

/**
 * Configuration of one outbound integration, consumed read-only by the sync
 * worker apart from its health fields.
 */
public final class Destination {

    public static final String KLAVIYO = "klaviyo";

    private final String id;
    private final String workspaceId;
    private final String type;
    private final boolean enabled;
    private final String apiKey;
    private final Instant lastSyncAt;
    private final String lastError;

    public Destination(String id, String workspaceId, String type, boolean enabled,
            String apiKey, Instant lastSyncAt, String lastError) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId cannot be null or blank");
        }
        this.id = id;
        this.workspaceId = workspaceId;
        this.type = type;
        this.enabled = enabled;
        this.apiKey = apiKey;
        this.lastSyncAt = lastSyncAt;
        this.lastError = lastError;
    }

    /**
     * @return why this destination cannot receive syncs, or null if it can
     */
    public String misconfiguration() {
        if (!enabled) {
            return "Destination disabled";
        }
        if (!KLAVIYO.equalsIgnoreCase(type)) {
            return "Unsupported destination type: " + type;
        }
        if (apiKey == null || apiKey.isBlank()) {
            return "Destination is missing api_key";
        }
        return null;
    }

    public boolean isUsable() {
        return misconfiguration() == null;
    }

    // ─────────────────── Getters ───────────────────

    public String getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getType() {
        return type;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public String getApiKey() {
        return apiKey;
    }

    public Instant getLastSyncAt() {
        return lastSyncAt;
    }

    public String getLastError() {
        return lastError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(id, ((Destination) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Destination{id='" + id + "', type='" + type + "', enabled=" + enabled + "}";
    }
}
