package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.in.IdentifyUseCase;
import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.IdentityEvidence;

/**
 * Handles explicit identify calls: resolves the identity, stores the supplied
 * traits, relinks the caller's anonymous history and schedules a sync.
 */
public class IdentifyService implements IdentifyUseCase {

    private static final Logger log = Logger.getLogger(IdentifyService.class.getName());

    private static final String SOURCE = "identify";

    private final IdentityResolver identityResolver;
    private final IdentityStore identityStore;
    private final EventStore eventStore;
    private final SyncScheduler syncScheduler;
    private final PayloadLimits payloadLimits;
    private final Clock clock;

    public IdentifyService(IdentityResolver identityResolver,
            IdentityStore identityStore,
            EventStore eventStore,
            SyncScheduler syncScheduler,
            PayloadLimits payloadLimits,
            Clock clock) {
        if (identityResolver == null)
            throw new IllegalArgumentException("identityResolver cannot be null");
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (syncScheduler == null)
            throw new IllegalArgumentException("syncScheduler cannot be null");
        if (payloadLimits == null)
            throw new IllegalArgumentException("payloadLimits cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.identityResolver = identityResolver;
        this.identityStore = identityStore;
        this.eventStore = eventStore;
        this.syncScheduler = syncScheduler;
        this.payloadLimits = payloadLimits;
        this.clock = clock;
    }

    @Override
    public IdentifyResult identify(IdentifyCommand command) {
        if (command.workspaceId() == null || command.workspaceId().isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        payloadLimits.check("traits", command.traits());

        IdentityEvidence evidence = new IdentityEvidence(command.anonymousId(), command.email(),
                command.phone(), command.userId(), SOURCE);
        IdentityResolver.Resolution resolution = identityResolver.resolve(command.workspaceId(), evidence);
        UnifiedIdentity identity = resolution.identity();

        if (command.traits() != null && !command.traits().isEmpty()) {
            identity = identity.withTraits(command.traits(), clock.instant());
            identityStore.mergeIdentifiers(identity);
        }

        // events the merge moved count as linked too
        int eventsLinked = resolution.eventsMoved();
        if (evidence.hasAnonymousId() && identity.containsAnonymousId(evidence.getAnonymousId())) {
            eventsLinked += eventStore.relinkByAnonymousId(command.workspaceId(), evidence.getAnonymousId(),
                    identity.getId());
        }

        int jobsCreated = 0;
        if (identity.hasEmail()) {
            try {
                jobsCreated = syncScheduler.scheduleIfNeeded(identity.getId(),
                        SyncScheduler.SyncTrigger.sweep()).jobsCreated();
            } catch (RuntimeException e) {
                log.log(Level.WARNING, String.format("action=schedule_failed unifiedUserId=%s",
                        identity.getId()), e);
            }
        }

        log.info(String.format(
                "action=identify workspaceId=%s unifiedUserId=%s newUser=%s merged=%s linked=%d jobs=%d",
                command.workspaceId(), identity.getId(), resolution.created(), resolution.merged(),
                eventsLinked, jobsCreated));

        return new IdentifyResult(identity.getId(), resolution.created(), resolution.merged(),
                eventsLinked, jobsCreated);
    }
}
