package com.storefront.identitysync.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Derived signal row, unique per (unifiedUserId, signalType).
 */
public final class IdentitySignal {

    public static final String INTENT = "intent";
    public static final String CART_ABANDONMENT = "cart_abandonment";
    public static final String CHECKOUT_ABANDONMENT = "checkout_abandonment";

    private final String workspaceId;
    private final String unifiedUserId;
    private final String signalType;
    private final double value;
    private final Map<String, Object> payload;
    private final Instant computedAt;

    public IdentitySignal(String workspaceId, String unifiedUserId, String signalType,
            double value, Map<String, Object> payload, Instant computedAt) {
        if (workspaceId == null || unifiedUserId == null) {
            throw new IllegalArgumentException("workspaceId and unifiedUserId are required");
        }
        if (signalType == null || signalType.isBlank()) {
            throw new IllegalArgumentException("signalType cannot be null or blank");
        }
        if (computedAt == null) {
            throw new IllegalArgumentException("computedAt cannot be null");
        }
        this.workspaceId = workspaceId;
        this.unifiedUserId = unifiedUserId;
        this.signalType = signalType;
        this.value = value;
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Collections.emptyMap();
        this.computedAt = computedAt;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getUnifiedUserId() {
        return unifiedUserId;
    }

    public String getSignalType() {
        return signalType;
    }

    public double getValue() {
        return value;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getComputedAt() {
        return computedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        IdentitySignal that = (IdentitySignal) o;
        return unifiedUserId.equals(that.unifiedUserId) && signalType.equals(that.signalType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(unifiedUserId, signalType);
    }

    @Override
    public String toString() {
        return "IdentitySignal{unifiedUserId='" + unifiedUserId
                + "', signalType='" + signalType + "', value=" + value + "}";
    }
}
