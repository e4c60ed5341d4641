package com.storefront.identitysync.domain.valueobject;

/**
 * Result of processing one sync job.
 * SKIPPED and BLOCKED are expected non-errors and count as successes.
 */
public enum SyncOutcome {

    SYNCED,
    SKIPPED,
    BLOCKED,
    RETRY_SCHEDULED,
    FAILED;

    public boolean isSuccess() {
        return this == SYNCED || this == SKIPPED || this == BLOCKED;
    }
}
