package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.IntSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.in.RunMaintenanceUseCase;
import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;

/**
 * Periodic background pass. Steps run in a fixed order and each one is
 * guarded on its own.
 */
public class MaintenanceRunner implements RunMaintenanceUseCase {

    private static final Logger log = Logger.getLogger(MaintenanceRunner.class.getName());

    static final String DETECT_ABANDONMENTS = "detect_abandonments";
    static final String DECAY_RECENCY = "decay_recency";
    static final String RECOMPUTE_SIGNALS = "recompute_signals";
    static final String BACKFILL_IDENTITIES = "backfill_identities";
    static final String POLL_ENGAGEMENT = "poll_engagement";
    static final String RELEASE_STALE_JOBS = "release_stale_jobs";
    static final String SCHEDULE_SYNCS = "schedule_syncs";

    private final SignalComputer signalComputer;
    private final SyncScheduler syncScheduler;
    private final EngagementPoller engagementPoller;
    private final IdentityStore identityStore;
    private final EventStore eventStore;
    private final SyncJobStore syncJobStore;
    private final Clock clock;
    private final Settings settings;

    public MaintenanceRunner(SignalComputer signalComputer,
            SyncScheduler syncScheduler,
            EngagementPoller engagementPoller,
            IdentityStore identityStore,
            EventStore eventStore,
            SyncJobStore syncJobStore,
            Clock clock,
            Settings settings) {
        if (signalComputer == null)
            throw new IllegalArgumentException("signalComputer cannot be null");
        if (syncScheduler == null)
            throw new IllegalArgumentException("syncScheduler cannot be null");
        if (engagementPoller == null)
            throw new IllegalArgumentException("engagementPoller cannot be null");
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (syncJobStore == null)
            throw new IllegalArgumentException("syncJobStore cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (settings == null)
            throw new IllegalArgumentException("settings cannot be null");

        this.signalComputer = signalComputer;
        this.syncScheduler = syncScheduler;
        this.engagementPoller = engagementPoller;
        this.identityStore = identityStore;
        this.eventStore = eventStore;
        this.syncJobStore = syncJobStore;
        this.clock = clock;
        this.settings = settings;
    }

    @Override
    public MaintenanceReport runMaintenance() {
        long started = clock.millis();
        List<StepResult> steps = new ArrayList<>();

        steps.add(runStep(DETECT_ABANDONMENTS, this::detectAbandonments));
        steps.add(runStep(DECAY_RECENCY, () -> signalComputer.decayRecency(settings.batchSize())));
        steps.add(runStep(RECOMPUTE_SIGNALS, () -> signalComputer.recomputeStale(settings.batchSize())));
        steps.add(runStep(BACKFILL_IDENTITIES, this::backfillIdentities));
        steps.add(runStep(POLL_ENGAGEMENT, engagementPoller::pollAll));
        steps.add(runStep(RELEASE_STALE_JOBS,
                () -> syncJobStore.releaseStale(clock.instant().minus(settings.staleJobAfter()))));
        steps.add(runStep(SCHEDULE_SYNCS, this::scheduleSyncs));

        MaintenanceReport report = new MaintenanceReport(List.copyOf(steps), clock.millis() - started);
        log.info(String.format("action=maintenance_completed steps=%d allSucceeded=%s durationMs=%d",
                steps.size(), report.allSucceeded(), report.durationMs()));
        return report;
    }

    // ─────────────────── Steps ───────────────────

    private int detectAbandonments() {
        int emitted = 0;
        for (SignalComputer.AbandonmentDetection detection : signalComputer.detectAbandonments(settings.batchSize())) {
            emitted += syncScheduler.scheduleAbandonment(detection);
        }
        return emitted;
    }

    private int backfillIdentities() {
        int relinked = 0;
        for (String id : recentlyUpdatedWithEmail()) {
            UnifiedIdentity identity = identityStore.findById(id).orElse(null);
            if (identity == null) {
                continue;
            }
            for (String anonymousId : identity.getAnonymousIds()) {
                relinked += eventStore.relinkByAnonymousId(identity.getWorkspaceId(), anonymousId, identity.getId());
            }
        }
        return relinked;
    }

    private int scheduleSyncs() {
        int created = 0;
        for (String id : recentlyUpdatedWithEmail()) {
            created += syncScheduler.scheduleIfNeeded(id, SyncScheduler.SyncTrigger.sweep()).jobsCreated();
        }
        return created;
    }

    private List<String> recentlyUpdatedWithEmail() {
        Instant since = clock.instant().minus(settings.recentWindow());
        return identityStore.findEmailIdentitiesUpdatedSince(since, settings.batchSize());
    }

    private StepResult runStep(String name, IntSupplier step) {
        long started = clock.millis();
        try {
            int processed = step.getAsInt();
            long duration = clock.millis() - started;
            log.info(String.format("action=maintenance_step step=%s success=true processed=%d durationMs=%d",
                    name, processed, duration));
            return new StepResult(name, true, processed, null, duration);
        } catch (RuntimeException e) {
            long duration = clock.millis() - started;
            log.log(Level.SEVERE, String.format("action=maintenance_step step=%s success=false durationMs=%d",
                    name, duration), e);
            return new StepResult(name, false, 0, e.getMessage(), duration);
        }
    }

    /**
     * @param batchSize     identities handled per step
     * @param staleJobAfter running time after which a job is considered abandoned
     * @param recentWindow  update window for backfill and sync sweeps
     */
    public record Settings(int batchSize, Duration staleJobAfter, Duration recentWindow) {

        public static Settings defaults() {
            return new Settings(100, Duration.ofMinutes(15), Duration.ofHours(1));
        }
    }
}
