package com.storefront.identitysync.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.storefront.identitysync.domain.entity.Destination;

/**
 * Secondary (outbound) port: the marketing-automation destination API.
 * <p>
 * Profile upserts are idempotent by email. Event tracks carry a caller-supplied
 * unique id so the destination can deduplicate redelivery.
 * Every call is bounded by a timeout; failures surface as
 * {@link DestinationException}.
 * </p>
 */
public interface DestinationClient {

    /**
     * Creates the profile, or updates it in place when one already exists.
     *
     * @return destination-side profile id
     */
    String upsertProfile(Destination destination, ProfileUpsert profile);

    void trackEvent(Destination destination, MetricEvent event);

    /**
     * Engagement (opens, clicks, subscribes) recorded by the destination since
     * the given instant.
     */
    List<EngagementEvent> fetchEngagement(Destination destination, Instant since);

    record ProfileUpsert(
            String email,
            String externalId,
            String phone,
            Map<String, Object> properties) {
    }

    record MetricEvent(
            String metricName,
            String email,
            String externalId,
            Map<String, Object> properties,
            Instant time,
            String uniqueId) {
    }

    record EngagementEvent(
            String externalEventId,
            String email,
            String metricName,
            Instant occurredAt,
            Map<String, Object> properties) {
    }
}
