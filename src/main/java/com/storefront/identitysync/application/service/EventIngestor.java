package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.in.IngestEventUseCase;
import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.valueobject.EventStatus;
import com.storefront.identitysync.domain.valueobject.IdentityEvidence;

/**
 * Event ingestion pipeline.
 *
 * <p>
 * <b>Flow:</b>
 * </p>
 * <ol>
 * <li>Validate properties, fingerprint cookieless traffic</li>
 * <li>Store the event under its dedupe key. Duplicates stop here, unless the
 * stored row is still pending and unattached: then an earlier attempt failed
 * before resolution and this one resumes it</li>
 * <li>Resolve the identity and attach the event</li>
 * <li>Relink earlier anonymous events when the identity gained an email or merged</li>
 * <li>Update signals, then schedule a sync for identities with an email</li>
 * </ol>
 *
 * <p>
 * Failures after the event is stored do not fail the ingest. They are logged
 * and returned as warnings.
 * </p>
 */
public class EventIngestor implements IngestEventUseCase {

    private static final Logger log = Logger.getLogger(EventIngestor.class.getName());

    private final EventStore eventStore;
    private final IdentityResolver identityResolver;
    private final SignalComputer signalComputer;
    private final SyncScheduler syncScheduler;
    private final PayloadLimits payloadLimits;
    private final Clock clock;

    public EventIngestor(EventStore eventStore,
            IdentityResolver identityResolver,
            SignalComputer signalComputer,
            SyncScheduler syncScheduler,
            PayloadLimits payloadLimits,
            Clock clock) {
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (identityResolver == null)
            throw new IllegalArgumentException("identityResolver cannot be null");
        if (signalComputer == null)
            throw new IllegalArgumentException("signalComputer cannot be null");
        if (syncScheduler == null)
            throw new IllegalArgumentException("syncScheduler cannot be null");
        if (payloadLimits == null)
            throw new IllegalArgumentException("payloadLimits cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.eventStore = eventStore;
        this.identityResolver = identityResolver;
        this.signalComputer = signalComputer;
        this.syncScheduler = syncScheduler;
        this.payloadLimits = payloadLimits;
        this.clock = clock;
    }

    @Override
    public IngestResult ingest(IngestCommand command) {
        if (command.workspaceId() == null || command.workspaceId().isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        if (command.eventName() == null || command.eventName().isBlank()) {
            throw new IllegalArgumentException("event name is required");
        }
        payloadLimits.check("properties", command.properties());

        // ── Step 1: identifiers ──
        String anonymousId = command.anonymousId();
        if (anonymousId == null || anonymousId.isBlank()) {
            anonymousId = DedupeKeys.fingerprint(command.clientIp(), command.userAgent());
        }
        IdentityEvidence evidence = new IdentityEvidence(anonymousId, command.email(), command.phone(),
                command.customerId(), command.source());
        if (!evidence.hasAnyIdentifier()) {
            throw new IllegalArgumentException(
                    "at least one of anonymous_id, email, customer_id or phone is required");
        }

        // ── Step 2: store ──
        Instant eventTime = command.timestamp() != null ? command.timestamp() : clock.instant();
        String dedupeKey = command.dedupeKey() != null && !command.dedupeKey().isBlank()
                ? command.dedupeKey()
                : DedupeKeys.forEvent(command.workspaceId(), command.eventName(), command.properties(),
                        evidence.getAnonymousId(), eventTime);

        TrackedEvent event = TrackedEvent.create(command.workspaceId(), evidence.getAnonymousId(),
                command.eventType(), command.eventName(), command.properties(), eventTime,
                evidence.getSource(), dedupeKey);

        if (!eventStore.insert(event)) {
            TrackedEvent existing = eventStore.findByDedupeKey(command.workspaceId(), dedupeKey)
                    .orElseThrow(() -> new IllegalStateException("duplicate event vanished: " + dedupeKey));
            if (isUnfinished(existing)) {
                log.info(String.format("action=event_resumed workspaceId=%s eventId=%s dedupeKey=%s",
                        command.workspaceId(), existing.getId(), dedupeKey));
                return process(command, evidence, existing);
            }
            eventStore.recordDuplicate(command.workspaceId(), dedupeKey);
            log.info(String.format("action=event_duplicate workspaceId=%s eventId=%s dedupeKey=%s",
                    command.workspaceId(), existing.getId(), dedupeKey));
            return IngestResult.duplicateOf(existing.getId(), existing.getUnifiedUserId());
        }

        return process(command, evidence, event);
    }

    private IngestResult process(IngestCommand command, IdentityEvidence evidence, TrackedEvent event) {
        // ── Step 3: resolve + attach ──
        IdentityResolver.Resolution resolution = identityResolver.resolve(command.workspaceId(), evidence);
        String unifiedUserId = resolution.unifiedUserId();
        eventStore.attach(event.getId(), unifiedUserId);
        TrackedEvent attached = event.attachTo(unifiedUserId);

        List<String> warnings = new ArrayList<>();

        // ── Step 4: retroactive linking ──
        int eventsLinked = 0;
        if (resolution.identityChanged() && evidence.hasAnonymousId()) {
            try {
                eventsLinked = eventStore.relinkByAnonymousId(command.workspaceId(),
                        evidence.getAnonymousId(), unifiedUserId);
            } catch (RuntimeException e) {
                warnings.add("retroactive linking failed: " + e.getMessage());
                log.log(Level.WARNING, String.format("action=relink_failed unifiedUserId=%s", unifiedUserId), e);
            }
        }

        // ── Step 5: signals, then sync ──
        boolean signalsFailed = false;
        try {
            signalComputer.onEvent(unifiedUserId, attached);
        } catch (RuntimeException e) {
            signalsFailed = true;
            warnings.add("signal computation failed: " + e.getMessage());
            log.log(Level.WARNING, String.format("action=signals_failed eventId=%s unifiedUserId=%s",
                    event.getId(), unifiedUserId), e);
        }

        int jobsCreated = 0;
        if (resolution.identity().hasEmail()) {
            try {
                jobsCreated = syncScheduler.scheduleIfNeeded(unifiedUserId,
                        SyncScheduler.SyncTrigger.forEvent(attached)).jobsCreated();
            } catch (RuntimeException e) {
                warnings.add("sync scheduling failed: " + e.getMessage());
                log.log(Level.WARNING, String.format("action=schedule_failed eventId=%s unifiedUserId=%s",
                        event.getId(), unifiedUserId), e);
            }
        }

        eventStore.markStatus(event.getId(), signalsFailed ? EventStatus.FAILED : EventStatus.PROCESSED);

        log.info(String.format(
                "action=event_ingested workspaceId=%s eventId=%s unifiedUserId=%s event=%s newUser=%s merged=%s linked=%d jobs=%d",
                command.workspaceId(), event.getId(), unifiedUserId, command.eventName(),
                resolution.created(), resolution.merged(), eventsLinked, jobsCreated));

        return new IngestResult(event.getId(), unifiedUserId, resolution.created(), resolution.merged(),
                false, eventsLinked, jobsCreated, List.copyOf(warnings));
    }

    /** Stored by an attempt that failed before the identity was resolved. */
    private static boolean isUnfinished(TrackedEvent existing) {
        return existing.getStatus() == EventStatus.PENDING && existing.getUnifiedUserId() == null;
    }
}
