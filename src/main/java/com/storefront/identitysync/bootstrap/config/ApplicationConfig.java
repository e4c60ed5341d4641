package com.storefront.identitysync.bootstrap.config;

import java.time.Clock;
import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.storefront.identitysync.application.port.out.DeliveryLedger;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.application.port.out.DestinationStore;
import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityLinkStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SignalStore;
import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.application.port.out.TransactionRunner;
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
 * Application-level bean configuration.
 * <p>
 * Application services are plain Java; they are built here from the adapter
 * implementations and the typed {@link IdentitySyncProperties}.
 * </p>
 */
@Configuration
public class ApplicationConfig {

    /**
     * Jackson ObjectMapper shared by the REST layer, the Kafka consumer and the
     * JSONB columns.
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PayloadLimits payloadLimits(ObjectMapper objectMapper, IdentitySyncProperties properties) {
        IdentitySyncProperties.Ingest ingest = properties.getIngest();
        return new PayloadLimits(objectMapper, ingest.getMaxPropertiesBytes(), ingest.getMaxDepth());
    }

    // ─────────────────── Identity ───────────────────

    @Bean
    public IdentityMerger identityMerger(IdentityStore identityStore,
            IdentityLinkStore identityLinkStore,
            EventStore eventStore,
            SyncJobStore syncJobStore,
            SignalStore signalStore) {
        return new IdentityMerger(identityStore, identityLinkStore, eventStore, syncJobStore, signalStore);
    }

    @Bean
    public IdentityResolver identityResolver(IdentityStore identityStore,
            IdentityLinkStore identityLinkStore,
            IdentityMerger identityMerger,
            TransactionRunner transactionRunner,
            Clock clock) {
        return new IdentityResolver(identityStore, identityLinkStore, identityMerger, transactionRunner, clock);
    }

    // ─────────────────── Signals & Scheduling ───────────────────

    @Bean
    public SignalComputer signalComputer(IdentityStore identityStore,
            EventStore eventStore,
            SignalStore signalStore,
            Clock clock,
            IdentitySyncProperties properties) {
        IdentitySyncProperties.Signals signals = properties.getSignals();
        SignalComputer.Settings defaults = SignalComputer.Settings.defaults();
        SignalComputer.Settings settings = new SignalComputer.Settings(
                signals.getEngagedThreshold(),
                signals.getDailyDecayFactor(),
                Duration.ofMinutes(signals.getSessionGapMinutes()),
                Duration.ofMinutes(signals.getCartAbandonMinutes()),
                Duration.ofMinutes(signals.getCheckoutAbandonMinutes()),
                defaults.activeWindow(),
                defaults.staleAfter(),
                defaults.historyWindow(),
                Duration.ofDays(signals.getAbandonmentLookbackDays()),
                defaults.casAttempts());
        return new SignalComputer(identityStore, eventStore, signalStore, clock, settings);
    }

    @Bean
    public SyncScheduler syncScheduler(IdentityStore identityStore,
            EventStore eventStore,
            SyncJobStore syncJobStore,
            DestinationStore destinationStore,
            DeliveryLedger deliveryLedger,
            Clock clock,
            IdentitySyncProperties properties) {
        IdentitySyncProperties.Sync sync = properties.getSync();
        SyncScheduler.Settings settings = new SyncScheduler.Settings(
                sync.getMaxAttempts(),
                Duration.ofMinutes(sync.getOpportunisticWindowMinutes()),
                sync.getCartIntentThreshold(),
                sync.getProductIntentThreshold(),
                Duration.ofHours(sync.getAbandonmentCooldownHours()));
        return new SyncScheduler(identityStore, eventStore, syncJobStore, destinationStore, deliveryLedger,
                clock, settings);
    }

    // ─────────────────── Use Cases ───────────────────

    @Bean
    public EventIngestor eventIngestor(EventStore eventStore,
            IdentityResolver identityResolver,
            SignalComputer signalComputer,
            SyncScheduler syncScheduler,
            PayloadLimits payloadLimits,
            Clock clock) {
        return new EventIngestor(eventStore, identityResolver, signalComputer, syncScheduler, payloadLimits, clock);
    }

    @Bean
    public IdentifyService identifyService(IdentityResolver identityResolver,
            IdentityStore identityStore,
            EventStore eventStore,
            SyncScheduler syncScheduler,
            PayloadLimits payloadLimits,
            Clock clock) {
        return new IdentifyService(identityResolver, identityStore, eventStore, syncScheduler, payloadLimits, clock);
    }

    @Bean
    public DestinationSyncWorker destinationSyncWorker(SyncJobStore syncJobStore,
            IdentityStore identityStore,
            EventStore eventStore,
            DestinationStore destinationStore,
            DestinationClient destinationClient,
            DeliveryLedger deliveryLedger,
            Clock clock) {
        return new DestinationSyncWorker(syncJobStore, identityStore, eventStore, destinationStore,
                destinationClient, deliveryLedger, clock);
    }

    @Bean
    public EngagementPoller engagementPoller(DestinationStore destinationStore,
            DestinationClient destinationClient,
            EventIngestor eventIngestor,
            Clock clock,
            IdentitySyncProperties properties) {
        return new EngagementPoller(destinationStore, destinationClient, eventIngestor, clock,
                Duration.ofMinutes(properties.getKlaviyo().getEngagementLookbackMinutes()));
    }

    @Bean
    public MaintenanceRunner maintenanceRunner(SignalComputer signalComputer,
            SyncScheduler syncScheduler,
            EngagementPoller engagementPoller,
            IdentityStore identityStore,
            EventStore eventStore,
            SyncJobStore syncJobStore,
            Clock clock,
            IdentitySyncProperties properties) {
        MaintenanceRunner.Settings defaults = MaintenanceRunner.Settings.defaults();
        MaintenanceRunner.Settings settings = new MaintenanceRunner.Settings(
                properties.getSignals().getBatchSize(),
                Duration.ofMinutes(properties.getSync().getStaleJobMinutes()),
                defaults.recentWindow());
        return new MaintenanceRunner(signalComputer, syncScheduler, engagementPoller, identityStore, eventStore,
                syncJobStore, clock, settings);
    }
}
