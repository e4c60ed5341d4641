package com.storefront.identitysync.domain.valueobject;

import java.util.Locale;

/** Processing status of a stored event: pending → processed → synced, or failed. */
public enum EventStatus {
    PENDING,
    PROCESSED,
    FAILED,
    SYNCED;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static EventStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
