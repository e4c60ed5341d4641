package com.storefront.identitysync.application.port.in;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Primary (inbound) port: server-side event ingestion.
 * <p>
 * Callers see a flat outcome: accepted, duplicate (still a success) or a
 * validation error. Signal and sync failures after the event is stored are
 * reported as warnings, never as a failed ingest.
 * </p>
 */
public interface IngestEventUseCase {

    /**
     * Stores, resolves and processes one event.
     *
     * @param command event and the identifiers observed with it
     * @return outcome of the ingest
     * @throws IllegalArgumentException  if no identifier can be established
     * @throws PayloadTooLargeException if properties exceed the size or depth limit
     */
    IngestResult ingest(IngestCommand command);

    record IngestCommand(
            String workspaceId,
            String eventType,
            String eventName,
            Map<String, Object> properties,
            String anonymousId,
            String email,
            String customerId,
            String phone,
            String clientIp,
            String userAgent,
            String source,
            Instant timestamp,
            String dedupeKey) {
    }

    record IngestResult(
            String eventId,
            String unifiedUserId,
            boolean newUser,
            boolean identityMerged,
            boolean duplicate,
            int eventsLinked,
            int syncJobsCreated,
            List<String> warnings) {

        public static IngestResult duplicateOf(String eventId, String unifiedUserId) {
            return new IngestResult(eventId, unifiedUserId, false, false, true, 0, 0, List.of());
        }
    }
}
