package com.storefront.identitysync.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;

import com.storefront.identitysync.application.port.out.DeliveryLedger;
import com.storefront.identitysync.application.port.out.DestinationStore;
import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.Destination;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.DropOffStage;
import com.storefront.identitysync.domain.valueobject.EventCategory;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncFlags;
import com.storefront.identitysync.domain.valueobject.SyncReason;

/**
 * Decides whether an identity's profile (and the triggering event) should be
 * pushed to the workspace's destination, and enqueues the jobs.
 *
 * <p>
 * <b>Forced reasons</b> fire once per funnel and are remembered through the
 * flags in the computed bag, written by the worker after a successful sync. A
 * purchase clears the funnel flags so the next funnel can fire again.
 * </p>
 */
public class SyncScheduler {

    private static final Logger log = Logger.getLogger(SyncScheduler.class.getName());

    static final List<String> FUNNEL_FLAGS = List.of(
            SyncReason.CHECKOUT_ABANDONED.getFlagName(),
            SyncReason.CART_ABANDONED.getFlagName(),
            SyncReason.CART_HIGH_INTENT.getFlagName(),
            SyncReason.PRODUCT_HIGH_INTENT.getFlagName());

    private final IdentityStore identityStore;
    private final EventStore eventStore;
    private final SyncJobStore syncJobStore;
    private final DestinationStore destinationStore;
    private final DeliveryLedger deliveryLedger;
    private final Clock clock;
    private final Settings settings;

    public SyncScheduler(IdentityStore identityStore,
            EventStore eventStore,
            SyncJobStore syncJobStore,
            DestinationStore destinationStore,
            DeliveryLedger deliveryLedger,
            Clock clock,
            Settings settings) {
        if (identityStore == null)
            throw new IllegalArgumentException("identityStore cannot be null");
        if (eventStore == null)
            throw new IllegalArgumentException("eventStore cannot be null");
        if (syncJobStore == null)
            throw new IllegalArgumentException("syncJobStore cannot be null");
        if (destinationStore == null)
            throw new IllegalArgumentException("destinationStore cannot be null");
        if (deliveryLedger == null)
            throw new IllegalArgumentException("deliveryLedger cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (settings == null)
            throw new IllegalArgumentException("settings cannot be null");

        this.identityStore = identityStore;
        this.eventStore = eventStore;
        this.syncJobStore = syncJobStore;
        this.destinationStore = destinationStore;
        this.deliveryLedger = deliveryLedger;
        this.clock = clock;
        this.settings = settings;
    }

    // ─────────────────── Operations ───────────────────

    /**
     * Enqueues a profile upsert (and an event track job for the triggering
     * event) when the identity qualifies.
     */
    public ScheduleResult scheduleIfNeeded(String unifiedUserId, SyncTrigger trigger) {
        UnifiedIdentity identity = identityStore.findById(unifiedUserId).orElse(null);
        if (identity == null || !identity.hasEmail()) {
            return ScheduleResult.none();
        }

        Destination destination = destinationStore.findActiveForWorkspace(identity.getWorkspaceId()).orElse(null);
        if (destination == null) {
            log.fine(String.format("action=sync_not_scheduled unifiedUserId=%s reason=no_destination",
                    unifiedUserId));
            return ScheduleResult.none();
        }

        Instant now = clock.instant();
        ComputedTraits computed = identity.getComputed();

        if (trigger.category() != null && trigger.category().isOrder()) {
            computed = clearFunnelFlags(identity, computed, now);
        }

        int jobsCreated = 0;
        SyncReason reason = decideReason(computed, trigger.category(),
                identity.wasUpdatedWithin(settings.opportunisticWindow(), now), settings);

        if (reason != null && !hasPendingProfileJob(unifiedUserId, reason)) {
            syncJobStore.insert(SyncJob.profileUpsert(identity.getWorkspaceId(), destination.getId(),
                    unifiedUserId, reason, settings.maxAttempts(), now));
            jobsCreated++;
            log.info(String.format("action=sync_scheduled unifiedUserId=%s jobType=profile_upsert reason=%s",
                    unifiedUserId, reason.getValue()));
        }

        if (trigger.eventId() != null && !trigger.fromDestination()
                && !syncJobStore.hasJobForEvent(trigger.eventId())) {
            syncJobStore.insert(SyncJob.eventTrack(identity.getWorkspaceId(), destination.getId(),
                    unifiedUserId, trigger.eventId(), reason != null ? reason : SyncReason.OPPORTUNISTIC,
                    settings.maxAttempts(), now));
            jobsCreated++;
        }

        return new ScheduleResult(jobsCreated, reason);
    }

    /**
     * Emits the derived abandonment event for a confirmed abandonment and
     * enqueues its event track job. At most one per identity per cooldown
     * window.
     *
     * @return jobs created (0 or 1)
     */
    public int scheduleAbandonment(SignalComputer.AbandonmentDetection detection) {
        UnifiedIdentity identity = identityStore.findById(detection.unifiedUserId()).orElse(null);
        if (identity == null || !identity.hasEmail()) {
            return 0;
        }
        Destination destination = destinationStore.findActiveForWorkspace(identity.getWorkspaceId()).orElse(null);
        if (destination == null) {
            return 0;
        }

        String eventName = detection.kind().getEventName();
        String dedupeKey = DedupeKeys.forDerivedEvent(identity.getWorkspaceId(), identity.getId(),
                eventName, detection.anchor());
        if (eventStore.findByDedupeKey(identity.getWorkspaceId(), dedupeKey).isPresent()) {
            return 0;
        }

        String cooldownKey = "abandonment:" + detection.kind().name().toLowerCase(Locale.ROOT) + ":" + identity.getId();
        if (!deliveryLedger.tryStartCooldown(cooldownKey, settings.abandonmentCooldown())) {
            log.info(String.format("action=abandonment_cooldown unifiedUserId=%s kind=%s",
                    identity.getId(), detection.kind()));
            return 0;
        }

        Instant now = clock.instant();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("abandoned_at", detection.anchor().toString());
        properties.put("intent_score", detection.intentScore());

        TrackedEvent derived = TrackedEvent.create(identity.getWorkspaceId(), null, TrackedEvent.DERIVED_TYPE,
                eventName, properties, now, "system", dedupeKey).attachTo(identity.getId());
        if (!eventStore.insert(derived)) {
            return 0;
        }

        syncJobStore.insert(SyncJob.eventTrack(identity.getWorkspaceId(), destination.getId(),
                identity.getId(), derived.getId(), SyncReason.DERIVED_EVENT, settings.maxAttempts(), now));
        log.info(String.format("action=abandonment_event_emitted unifiedUserId=%s event=%s eventId=%s",
                identity.getId(), eventName, derived.getId()));
        return 1;
    }

    // ─────────────────── Rules ───────────────────

    /**
     * First matching reason in priority order, or null when nothing should be
     * sent. The intent reasons need a triggering event of the matching kind;
     * sweeps and identify calls only reach the stage and first-sync rules.
     *
     * @param triggerCategory category of the triggering event, null for sweeps
     * @param recentlyUpdated identity changed within the opportunistic window
     */
    public static SyncReason decideReason(ComputedTraits computed, EventCategory triggerCategory,
            boolean recentlyUpdated, Settings settings) {
        SyncFlags flags = computed.getFlags();
        int intent = computed.getIntentScore();

        if (computed.getDropOffStage() == DropOffStage.CHECKOUT_ABANDONED
                && !flags.isSet(SyncReason.CHECKOUT_ABANDONED.getFlagName())) {
            return SyncReason.CHECKOUT_ABANDONED;
        }
        if (triggerCategory != null && triggerCategory.isCart() && intent >= settings.cartIntentThreshold()
                && !flags.isSet(SyncReason.CART_HIGH_INTENT.getFlagName())) {
            return SyncReason.CART_HIGH_INTENT;
        }
        if (computed.getDropOffStage() == DropOffStage.CART_ABANDONED
                && !flags.isSet(SyncReason.CART_ABANDONED.getFlagName())) {
            return SyncReason.CART_ABANDONED;
        }
        if (triggerCategory != null && triggerCategory.isProductView()
                && intent >= settings.productIntentThreshold()
                && !flags.isSet(SyncReason.PRODUCT_HIGH_INTENT.getFlagName())) {
            return SyncReason.PRODUCT_HIGH_INTENT;
        }
        if (!flags.isSet(SyncReason.FIRST_SYNC.getFlagName())) {
            return SyncReason.FIRST_SYNC;
        }
        return recentlyUpdated ? SyncReason.OPPORTUNISTIC : null;
    }

    // ─────────────────── Private Helpers ───────────────────

    private boolean hasPendingProfileJob(String unifiedUserId, SyncReason reason) {
        if (reason.isForced()) {
            return syncJobStore.hasActiveJob(unifiedUserId, JobType.PROFILE_UPSERT, reason);
        }
        return syncJobStore.hasActiveJob(unifiedUserId, JobType.PROFILE_UPSERT);
    }

    private ComputedTraits clearFunnelFlags(UnifiedIdentity identity, ComputedTraits computed, Instant now) {
        SyncFlags flags = computed.getFlags();
        boolean anySet = FUNNEL_FLAGS.stream().anyMatch(flags::isSet);
        if (!anySet) {
            return computed;
        }
        identityStore.clearSyncFlags(identity.getId(), FUNNEL_FLAGS);
        log.info(String.format("action=sync_flags_cleared unifiedUserId=%s trigger=purchase", identity.getId()));
        return computed.withFlags(flags.without(FUNNEL_FLAGS));
    }

    // ─────────────────── Types ───────────────────

    /**
     * @param maxAttempts            attempts per job
     * @param opportunisticWindow    recent-update window for unforced syncs
     * @param cartIntentThreshold    intent needed for a cart-driven sync
     * @param productIntentThreshold intent needed for a product-view sync
     * @param abandonmentCooldown    minimum gap between derived abandonment events
     */
    public record Settings(
            int maxAttempts,
            Duration opportunisticWindow,
            int cartIntentThreshold,
            int productIntentThreshold,
            Duration abandonmentCooldown) {

        public static Settings defaults() {
            return new Settings(SyncJob.DEFAULT_MAX_ATTEMPTS, Duration.ofMinutes(60), 50, 30,
                    Duration.ofHours(24));
        }
    }

    /**
     * What caused a scheduling attempt.
     *
     * @param category        category of the triggering event, null for sweeps
     * @param eventId         event to forward, null for sweeps
     * @param fromDestination event was pulled from the destination itself
     */
    public record SyncTrigger(EventCategory category, String eventId, boolean fromDestination) {

        public static SyncTrigger forEvent(TrackedEvent event) {
            return new SyncTrigger(event.category(), event.getId(),
                    Destination.KLAVIYO.equalsIgnoreCase(event.getSource()));
        }

        public static SyncTrigger sweep() {
            return new SyncTrigger(null, null, false);
        }
    }

    public record ScheduleResult(int jobsCreated, SyncReason reason) {

        public static ScheduleResult none() {
            return new ScheduleResult(0, null);
        }
    }
}
