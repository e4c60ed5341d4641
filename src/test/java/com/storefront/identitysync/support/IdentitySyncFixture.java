package com.storefront.identitysync.support;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.application.service.DestinationSyncWorker;
import com.storefront.identitysync.application.service.EngagementPoller;
import com.storefront.identitysync.application.service.EventIngestor;
import com.storefront.identitysync.application.service.IdentifyService;
import com.storefront.identitysync.application.service.IdentityMerger;
import com.storefront.identitysync.application.service.IdentityResolver;
import com.storefront.identitysync.application.service.MaintenanceRunner;
import com.storefront.identitysync.application.service.PayloadLimits;
import com.storefront.identitysync.application.service.SignalComputer;
import com.storefront.identitysync.application.service.SyncScheduler;

/**
 * Real application services wired onto in-memory stores and a controllable
 * clock. The destination client is supplied by the test, usually a mock.
 */
public class IdentitySyncFixture {

    public static final String WORKSPACE = "ws_1";
    public static final String DESTINATION = "dest_1";
    public static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final InMemoryIdentityStore identityStore = new InMemoryIdentityStore();
    public final InMemoryIdentityLinkStore linkStore = new InMemoryIdentityLinkStore();
    public final InMemoryEventStore eventStore = new InMemoryEventStore();
    public final InMemorySignalStore signalStore = new InMemorySignalStore();
    public final InMemorySyncJobStore jobStore = new InMemorySyncJobStore();
    public final InMemoryDestinationStore destinationStore = new InMemoryDestinationStore();
    public final InMemoryDeliveryLedger deliveryLedger = new InMemoryDeliveryLedger();
    public final DirectTransactionRunner transactionRunner = new DirectTransactionRunner();

    public final PayloadLimits payloadLimits;
    public final IdentityMerger merger;
    public final IdentityResolver resolver;
    public final SignalComputer signalComputer;
    public final SyncScheduler scheduler;
    public final EventIngestor ingestor;
    public final IdentifyService identifyService;
    public final DestinationSyncWorker worker;
    public final EngagementPoller engagementPoller;
    public final MaintenanceRunner maintenanceRunner;

    public IdentitySyncFixture(DestinationClient destinationClient) {
        identityStore.attachSignalStore(signalStore);
        destinationStore.put(InMemoryDestinationStore.klaviyo(DESTINATION, WORKSPACE));

        payloadLimits = new PayloadLimits(new ObjectMapper(), PayloadLimits.DEFAULT_MAX_BYTES,
                PayloadLimits.DEFAULT_MAX_DEPTH);
        merger = new IdentityMerger(identityStore, linkStore, eventStore, jobStore, signalStore);
        resolver = new IdentityResolver(identityStore, linkStore, merger, transactionRunner, clock);
        signalComputer = new SignalComputer(identityStore, eventStore, signalStore, clock,
                SignalComputer.Settings.defaults());
        scheduler = new SyncScheduler(identityStore, eventStore, jobStore, destinationStore, deliveryLedger,
                clock, SyncScheduler.Settings.defaults());
        ingestor = new EventIngestor(eventStore, resolver, signalComputer, scheduler, payloadLimits, clock);
        identifyService = new IdentifyService(resolver, identityStore, eventStore, scheduler, payloadLimits, clock);
        worker = new DestinationSyncWorker(jobStore, identityStore, eventStore, destinationStore,
                destinationClient, deliveryLedger, clock);
        engagementPoller = new EngagementPoller(destinationStore, destinationClient, ingestor, clock,
                Duration.ofMinutes(15));
        maintenanceRunner = new MaintenanceRunner(signalComputer, scheduler, engagementPoller, identityStore,
                eventStore, jobStore, clock, MaintenanceRunner.Settings.defaults());
    }
}
