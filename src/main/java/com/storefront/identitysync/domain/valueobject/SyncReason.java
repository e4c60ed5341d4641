package com.storefront.identitysync.domain.valueobject;

import java.util.Locale;

/**
 * Why a profile sync was enqueued.
 * <p>
 * Forced reasons are declared in priority order; each owns the idempotence
 * flag that is written once a sync for that reason succeeded.
 * </p>
 */
public enum SyncReason {

    CHECKOUT_ABANDONED("checkout_abandoned_synced"),
    CART_HIGH_INTENT("cart_synced"),
    CART_ABANDONED("cart_abandoned_synced"),
    PRODUCT_HIGH_INTENT("product_view_synced"),
    FIRST_SYNC("first_sync_completed"),
    OPPORTUNISTIC(null),
    DERIVED_EVENT(null);

    private final String flagName;

    SyncReason(String flagName) {
        this.flagName = flagName;
    }

    /**
     * @return flag key in {@code computed.flags}, or null for unforced reasons
     */
    public String getFlagName() {
        return flagName;
    }

    public boolean isForced() {
        return flagName != null;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static SyncReason fromValue(String value) {
        if (value == null) {
            return OPPORTUNISTIC;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
