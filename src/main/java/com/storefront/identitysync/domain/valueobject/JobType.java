package com.storefront.identitysync.domain.valueobject;

import java.util.Locale;

public enum JobType {
    PROFILE_UPSERT,
    EVENT_TRACK;

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobType fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
