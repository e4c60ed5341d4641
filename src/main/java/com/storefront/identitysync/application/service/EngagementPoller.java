package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.in.IngestEventUseCase;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.application.port.out.DestinationClient.EngagementEvent;
import com.storefront.identitysync.application.port.out.DestinationException;
import com.storefront.identitysync.application.port.out.DestinationStore;
import com.storefront.identitysync.domain.entity.Destination;
import com.storefront.identitysync.domain.entity.TrackedEvent;

/**
 * Pulls email engagement (opens, clicks, subscriptions) back from every usable
 * destination and feeds it through ingestion as {@code email} events, deduped
 * by the destination's own event id.
 * <p>
 * Only the metrics in {@link #ENGAGEMENT_METRICS} are ingested. The event list
 * also contains the metrics this service tracked itself ({@code SF Placed Order}
 * and so on); those already went through ingestion once.
 * </p>
 */
public class EngagementPoller {

    private static final Logger log = Logger.getLogger(EngagementPoller.class.getName());

    static final Set<String> ENGAGEMENT_METRICS = Set.of(
            "Opened Email",
            "Clicked Email",
            "Received Email",
            "Subscribed to List",
            "Unsubscribed",
            "Clicked SMS");

    private final DestinationStore destinationStore;
    private final DestinationClient destinationClient;
    private final IngestEventUseCase ingestEventUseCase;
    private final Clock clock;
    private final Duration lookback;

    public EngagementPoller(DestinationStore destinationStore,
            DestinationClient destinationClient,
            IngestEventUseCase ingestEventUseCase,
            Clock clock,
            Duration lookback) {
        if (destinationStore == null)
            throw new IllegalArgumentException("destinationStore cannot be null");
        if (destinationClient == null)
            throw new IllegalArgumentException("destinationClient cannot be null");
        if (ingestEventUseCase == null)
            throw new IllegalArgumentException("ingestEventUseCase cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (lookback == null || lookback.isNegative() || lookback.isZero())
            throw new IllegalArgumentException("lookback must be positive");

        this.destinationStore = destinationStore;
        this.destinationClient = destinationClient;
        this.ingestEventUseCase = ingestEventUseCase;
        this.clock = clock;
        this.lookback = lookback;
    }

    /**
     * @return engagement events newly ingested across all destinations
     */
    public int pollAll() {
        Instant since = clock.instant().minus(lookback);
        int ingested = 0;
        for (Destination destination : destinationStore.findAllEnabled()) {
            if (!destination.isUsable()) {
                continue;
            }
            try {
                ingested += poll(destination, since);
            } catch (DestinationException e) {
                destinationStore.recordError(destination.getId(), e.getMessage(), clock.instant());
                log.log(Level.WARNING, String.format("action=engagement_poll_failed destinationId=%s status=%d",
                        destination.getId(), e.getStatusCode()), e);
            }
        }
        return ingested;
    }

    private int poll(Destination destination, Instant since) {
        List<EngagementEvent> events = destinationClient.fetchEngagement(destination, since);
        int ingested = 0;
        int ignored = 0;
        for (EngagementEvent engagement : events) {
            if (engagement.email() == null || engagement.metricName() == null) {
                continue;
            }
            if (!ENGAGEMENT_METRICS.contains(engagement.metricName())) {
                ignored++;
                continue;
            }
            try {
                IngestResult result = ingestEventUseCase.ingest(new IngestCommand(
                        destination.getWorkspaceId(), TrackedEvent.EMAIL_TYPE, engagement.metricName(),
                        engagement.properties(), null, engagement.email(), null, null, null, null,
                        Destination.KLAVIYO, engagement.occurredAt(),
                        DedupeKeys.forExternalEvent(destination.getWorkspaceId(), Destination.KLAVIYO,
                                engagement.externalEventId())));
                if (!result.duplicate()) {
                    ingested++;
                }
            } catch (IllegalArgumentException e) {
                log.warning(String.format("action=engagement_event_rejected destinationId=%s externalId=%s error=%s",
                        destination.getId(), engagement.externalEventId(), e.getMessage()));
            }
        }
        log.info(String.format("action=engagement_polled destinationId=%s fetched=%d ingested=%d ignored=%d",
                destination.getId(), events.size(), ingested, ignored));
        return ingested;
    }
}
