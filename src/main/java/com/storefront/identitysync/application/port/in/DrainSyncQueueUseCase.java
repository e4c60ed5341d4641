package com.storefront.identitysync.application.port.in;

/**
 * Primary (inbound) port: drains due sync jobs towards the destination.
 */
public interface DrainSyncQueueUseCase {

    DrainSummary drain(int limit);

    record DrainSummary(int claimed, int synced, int skipped, int blocked, int retried, int failed) {

        public static DrainSummary empty() {
            return new DrainSummary(0, 0, 0, 0, 0, 0);
        }
    }
}
