package com.storefront.identitysync.domain.valueobject;

import java.util.Locale;

/**
 * Sync job lifecycle.
 *
 * <pre>
 *   PENDING → RUNNING → COMPLETED
 *                     → PENDING (backoff retry)
 *                     → FAILED (terminal)
 * </pre>
 */
public enum JobStatus {

    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static JobStatus fromValue(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
