package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.in.DrainSyncQueueUseCase;
import com.storefront.identitysync.application.port.out.DeliveryLedger;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.application.port.out.DestinationException;
import com.storefront.identitysync.application.port.out.DestinationStore;
import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.domain.entity.Destination;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.EventStatus;
import com.storefront.identitysync.domain.valueobject.SyncOutcome;
import com.storefront.identitysync.domain.valueobject.SyncReason;

/**
 * Drains due sync jobs towards the destination.
 *
 * <p>
 * <b>Outcomes per job:</b>
 * </p>
 * <ul>
 * <li>Synced: destination accepted the call</li>
 * <li>Skipped: nothing to send (no email, event gone, already delivered)</li>
 * <li>Blocked: event not on the allow-list</li>
 * <li>Retry scheduled: transient failure with attempts left, backoff 2^attempts minutes</li>
 * <li>Failed: misconfiguration, rejected credentials, or attempts exhausted</li>
 * </ul>
 *
 * <p>
 * Event deliveries go through the {@link DeliveryLedger} so a redelivered job
 * never produces a second destination call for the same event.
 * </p>
 */
public class DestinationSyncWorker implements DrainSyncQueueUseCase {

    private static final Logger log = Logger.getLogger(DestinationSyncWorker.class.getName());

    static final String NOTE_NO_EMAIL = "Skipped - no email";
    static final String NOTE_EVENT_MISSING = "Skipped - event not found";
    static final String NOTE_ALREADY_DELIVERED = "Skipped - already delivered";
    static final String NOTE_BLOCKED = "Blocked - event not in allow-list";

    private final SyncJobStore syncJobStore;
    private final IdentityStore identityStore;
    private final EventStore eventStore;
    private final DestinationStore destinationStore;
    private final DestinationClient destinationClient;
    private final DeliveryLedger deliveryLedger;
    private final Clock clock;

    public DestinationSyncWorker(SyncJobStore syncJobStore,
            IdentityStore identityStore,
            EventStore eventStore,
            DestinationStore destinationStore,
            DestinationClient destinationClient,
            DeliveryLedger deliveryLedger,
            Clock clock) {
        if (syncJobStore == null)
            throw new IllegalArgumentException("syncJobStore cannot be null");
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (destinationStore == null)
            throw new IllegalArgumentException("destinationStore cannot be null");
        if (destinationClient == null)
            throw new IllegalArgumentException("destinationClient cannot be null");
        if (deliveryLedger == null)
            throw new IllegalArgumentException("deliveryLedger cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.syncJobStore = syncJobStore;
        this.identityStore = identityStore;
        this.eventStore = eventStore;
        this.destinationStore = destinationStore;
        this.destinationClient = destinationClient;
        this.deliveryLedger = deliveryLedger;
        this.clock = clock;
    }

    @Override
    public DrainSummary drain(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        List<SyncJob> jobs = syncJobStore.claimDue(clock.instant(), limit);
        if (jobs.isEmpty()) {
            return DrainSummary.empty();
        }

        int synced = 0;
        int skipped = 0;
        int blocked = 0;
        int retried = 0;
        int failed = 0;

        for (SyncJob job : jobs) {
            SyncOutcome outcome = process(job);
            switch (outcome) {
                case SYNCED -> synced++;
                case SKIPPED -> skipped++;
                case BLOCKED -> blocked++;
                case RETRY_SCHEDULED -> retried++;
                case FAILED -> failed++;
            }
        }

        log.info(String.format(
                "action=sync_drain claimed=%d synced=%d skipped=%d blocked=%d retried=%d failed=%d",
                jobs.size(), synced, skipped, blocked, retried, failed));
        return new DrainSummary(jobs.size(), synced, skipped, blocked, retried, failed);
    }

    /**
     * Runs one claimed (RUNNING) job to its next state.
     */
    SyncOutcome process(SyncJob job) {
        Destination destination = destinationStore.findById(job.getDestinationId()).orElse(null);
        String misconfiguration = destination == null
                ? "Destination not found: " + job.getDestinationId()
                : destination.misconfiguration();
        if (misconfiguration != null) {
            return failTerminally(job, destination, misconfiguration);
        }

        try {
            return switch (job.getJobType()) {
                case PROFILE_UPSERT -> syncProfile(job, destination);
                case EVENT_TRACK -> syncEvent(job, destination);
            };
        } catch (DestinationException e) {
            if (e.isCredentialRejection()) {
                return failTerminally(job, destination, "Destination rejected credentials: " + e.getMessage());
            }
            return retryOrFail(job, destination, e.getMessage(), e);
        } catch (IllegalStateException e) {
            // delivery held by another worker
            return retryOrFail(job, destination, e.getMessage(), e);
        } catch (RuntimeException e) {
            // store or ledger outage; the job must not stay RUNNING
            return retryOrFail(job, destination, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    // ─────────────────── Job Types ───────────────────

    private SyncOutcome syncProfile(SyncJob job, Destination destination) {
        UnifiedIdentity identity = identityStore.findById(job.getUnifiedUserId()).orElse(null);
        if (identity == null || !identity.hasEmail()) {
            return completeWithoutSync(job, NOTE_NO_EMAIL, SyncOutcome.SKIPPED);
        }

        Map<String, Object> properties = ProfilePropertiesMapper.toProperties(identity);
        String profileId = destinationClient.upsertProfile(destination,
                new DestinationClient.ProfileUpsert(identity.getPrimaryEmail(), identity.getId(),
                        identity.getPhone(), properties));

        Instant now = clock.instant();
        SyncReason reason = job.getReason();
        if (reason != null && reason.isForced()) {
            identityStore.setSyncFlag(identity.getId(), reason.getFlagName(), now);
        }
        if (!identity.getComputed().getFlags().isSet(SyncReason.FIRST_SYNC.getFlagName())) {
            identityStore.setSyncFlag(identity.getId(), SyncReason.FIRST_SYNC.getFlagName(), now);
        }
        identityStore.recordSyncSnapshot(identity.getId(), properties, now);

        log.info(String.format("action=profile_synced jobId=%s unifiedUserId=%s profileId=%s reason=%s",
                job.getId(), identity.getId(), profileId, reason != null ? reason.getValue() : null));
        return succeed(job, destination, null);
    }

    private SyncOutcome syncEvent(SyncJob job, Destination destination) {
        Optional<TrackedEvent> found = eventStore.findById(job.getEventId());
        if (found.isEmpty()) {
            return completeWithoutSync(job, NOTE_EVENT_MISSING, SyncOutcome.SKIPPED);
        }
        TrackedEvent event = found.get();

        Optional<String> metricName = DestinationEventPolicy.metricNameFor(event);
        if (metricName.isEmpty()) {
            return completeWithoutSync(job, NOTE_BLOCKED, SyncOutcome.BLOCKED);
        }

        UnifiedIdentity identity = identityStore.findById(job.getUnifiedUserId()).orElse(null);
        if (identity == null || !identity.hasEmail()) {
            return completeWithoutSync(job, NOTE_NO_EMAIL, SyncOutcome.SKIPPED);
        }

        String deliveryKey = "event:" + event.getId();
        if (!deliveryLedger.beginDelivery(deliveryKey)) {
            return completeWithoutSync(job, NOTE_ALREADY_DELIVERED, SyncOutcome.SKIPPED);
        }

        Map<String, Object> properties = new LinkedHashMap<>(event.getProperties());
        properties.put("sf_event_id", event.getId());
        properties.put("sf_unified_user_id", identity.getId());
        try {
            destinationClient.trackEvent(destination, new DestinationClient.MetricEvent(metricName.get(),
                    identity.getPrimaryEmail(), identity.getId(), properties, event.getEventTime(),
                    event.getId()));
        } catch (RuntimeException e) {
            deliveryLedger.abandonDelivery(deliveryKey);
            throw e;
        }
        deliveryLedger.completeDelivery(deliveryKey);
        eventStore.markStatus(event.getId(), EventStatus.SYNCED);

        log.info(String.format("action=event_synced jobId=%s eventId=%s metric=%s",
                job.getId(), event.getId(), metricName.get()));
        return succeed(job, destination, null);
    }

    // ─────────────────── Transitions ───────────────────

    private SyncOutcome succeed(SyncJob job, Destination destination, String note) {
        Instant now = clock.instant();
        syncJobStore.update(job.complete(now, note));
        destinationStore.recordSuccess(destination.getId(), now);
        return SyncOutcome.SYNCED;
    }

    private SyncOutcome completeWithoutSync(SyncJob job, String note, SyncOutcome outcome) {
        syncJobStore.update(job.complete(clock.instant(), note));
        log.fine(String.format("action=sync_job_completed jobId=%s note=%s", job.getId(), note));
        return outcome;
    }

    private SyncOutcome retryOrFail(SyncJob job, Destination destination, String error, Exception cause) {
        Instant now = clock.instant();
        if (job.canRetry()) {
            SyncJob retry = job.retryLater(now, error);
            syncJobStore.update(retry);
            log.log(Level.WARNING, String.format(
                    "action=sync_job_retry jobId=%s attempts=%d nextAttemptAt=%s error=%s",
                    job.getId(), job.getAttempts(), retry.getScheduledAt(), error), cause);
            return SyncOutcome.RETRY_SCHEDULED;
        }
        syncJobStore.update(job.fail(now, error));
        destinationStore.recordError(destination.getId(), error, now);
        log.log(Level.SEVERE, String.format("action=sync_job_failed jobId=%s attempts=%d error=%s",
                job.getId(), job.getAttempts(), error), cause);
        return SyncOutcome.FAILED;
    }

    private SyncOutcome failTerminally(SyncJob job, Destination destination, String error) {
        Instant now = clock.instant();
        syncJobStore.update(job.fail(now, error));
        if (destination != null) {
            destinationStore.recordError(destination.getId(), error, now);
        }
        log.severe(String.format("action=sync_job_failed jobId=%s terminal=true error=%s", job.getId(), error));
        return SyncOutcome.FAILED;
    }
}
