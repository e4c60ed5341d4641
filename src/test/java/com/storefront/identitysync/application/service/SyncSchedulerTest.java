package com.storefront.identitysync.application.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.storefront.identitysync.application.port.in.IdentifyUseCase;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.Destination;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.DropOffStage;
import com.storefront.identitysync.domain.valueobject.EventCategory;
import com.storefront.identitysync.domain.valueobject.IdentityEvidence;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncFlags;
import com.storefront.identitysync.domain.valueobject.SyncReason;
import com.storefront.identitysync.support.IdentitySyncFixture;

@ExtendWith(MockitoExtension.class)
class SyncSchedulerTest {

    private static final String WS = IdentitySyncFixture.WORKSPACE;
    private static final Instant T0 = IdentitySyncFixture.START;
    private static final SyncScheduler.Settings SETTINGS = SyncScheduler.Settings.defaults();

    @Mock
    private DestinationClient destinationClient;

    private IdentitySyncFixture fixture;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        fixture = new IdentitySyncFixture(destinationClient);
        scheduler = fixture.scheduler;
    }

    // ─────────────────── Reason Priority ───────────────────

    @Test
    void testDecideReason_CheckoutAbandonedWinsOverCartIntent() {
        ComputedTraits traits = ComputedTraits.builder()
                .dropOffStage(DropOffStage.CHECKOUT_ABANDONED)
                .lastCartAt(T0)
                .intentScore(70)
                .build();

        assertEquals(SyncReason.CHECKOUT_ABANDONED,
                SyncScheduler.decideReason(traits, EventCategory.CART_ADD, false, SETTINGS));
    }

    @Test
    void testDecideReason_FallsThroughOnceFlagIsSet() {
        ComputedTraits traits = ComputedTraits.builder()
                .dropOffStage(DropOffStage.CHECKOUT_ABANDONED)
                .lastCartAt(T0)
                .intentScore(70)
                .flags(SyncFlags.empty().with(SyncReason.CHECKOUT_ABANDONED.getFlagName(), T0))
                .build();

        assertEquals(SyncReason.CART_HIGH_INTENT,
                SyncScheduler.decideReason(traits, EventCategory.CART_ADD, false, SETTINGS));
    }

    @Test
    void testDecideReason_ProductIntentNeedsThreshold() {
        ComputedTraits below = ComputedTraits.builder().lastProductViewedAt(T0).intentScore(29)
                .flags(SyncFlags.empty().with(SyncReason.FIRST_SYNC.getFlagName(), T0)).build();
        ComputedTraits at = below.toBuilder().intentScore(30).build();

        assertNull(SyncScheduler.decideReason(below, EventCategory.PRODUCT_VIEW, false, SETTINGS));
        assertEquals(SyncReason.PRODUCT_HIGH_INTENT,
                SyncScheduler.decideReason(at, EventCategory.PRODUCT_VIEW, false, SETTINGS));
        assertNull(SyncScheduler.decideReason(at, EventCategory.PAGE_VIEW, false, SETTINGS));
    }

    @Test
    void testDecideReason_FirstSyncThenOpportunistic() {
        ComputedTraits fresh = ComputedTraits.empty();
        ComputedTraits synced = fresh.withFlags(SyncFlags.empty().with(SyncReason.FIRST_SYNC.getFlagName(), T0));

        assertEquals(SyncReason.FIRST_SYNC, SyncScheduler.decideReason(fresh, null, false, SETTINGS));
        assertEquals(SyncReason.OPPORTUNISTIC, SyncScheduler.decideReason(synced, null, true, SETTINGS));
        assertNull(SyncScheduler.decideReason(synced, null, false, SETTINGS));
    }

    @Test
    void testDecideReason_CartIntentNeedsCartTrigger() {
        ComputedTraits traits = ComputedTraits.builder()
                .dropOffStage(DropOffStage.CART_ABANDONED)
                .lastCartAt(T0)
                .intentScore(60)
                .build();

        assertEquals(SyncReason.CART_ABANDONED, SyncScheduler.decideReason(traits, null, false, SETTINGS));
        assertEquals(SyncReason.CART_ABANDONED,
                SyncScheduler.decideReason(traits, EventCategory.PAGE_VIEW, false, SETTINGS));
        assertEquals(SyncReason.CART_HIGH_INTENT,
                SyncScheduler.decideReason(traits, EventCategory.CART_ADD, false, SETTINGS));
    }

    // ─────────────────── Scheduling ───────────────────

    @Test
    void testScheduleIfNeeded_IdentifyAfterAnonymousCartsDoesNotForceCartIntent() {
        // Given
        for (int i = 0; i < 6; i++) {
            fixture.ingestor.ingest(new IngestCommand(WS, "track", "Added to Cart", Map.of("sku", "s" + i),
                    "anon_cart", null, null, null, null, null, "web", null, "cart-" + i));
        }

        // When
        IdentifyUseCase.IdentifyResult result = fixture.identifyService.identify(new IdentifyUseCase.IdentifyCommand(
                WS, "anon_cart", null, "jane@example.com", null, Map.of()));

        // Then
        assertEquals(60, fixture.identityStore.findById(result.unifiedUserId()).orElseThrow()
                .getComputed().getIntentScore());
        SyncJob profile = fixture.jobStore.ofType(JobType.PROFILE_UPSERT).get(0);
        assertEquals(SyncReason.CART_ABANDONED, profile.getReason());
    }

    @Test
    void testScheduleIfNeeded_NoEmailSchedulesNothing() {
        // Given
        UnifiedIdentity anonymous = seed(new IdentityEvidence("anon_1", null, null, null, "web"));

        // When
        SyncScheduler.ScheduleResult result = scheduler.scheduleIfNeeded(anonymous.getId(),
                SyncScheduler.SyncTrigger.sweep());

        // Then
        assertEquals(0, result.jobsCreated());
        assertTrue(fixture.jobStore.all().isEmpty());
    }

    @Test
    void testScheduleIfNeeded_NoActiveDestinationSchedulesNothing() {
        // Given
        fixture.destinationStore.put(new Destination(IdentitySyncFixture.DESTINATION, WS, Destination.KLAVIYO,
                false, "pk_test", null, null));
        UnifiedIdentity known = seed(IdentityEvidence.email("jane@example.com", "web"));

        // When
        SyncScheduler.ScheduleResult result = scheduler.scheduleIfNeeded(known.getId(),
                SyncScheduler.SyncTrigger.sweep());

        // Then
        assertEquals(0, result.jobsCreated());
    }

    @Test
    void testScheduleIfNeeded_PendingProfileJobIsNotDuplicated() {
        // Given
        UnifiedIdentity known = seed(IdentityEvidence.email("jane@example.com", "web"));

        // When
        SyncScheduler.ScheduleResult first = scheduler.scheduleIfNeeded(known.getId(), SyncScheduler.SyncTrigger.sweep());
        SyncScheduler.ScheduleResult second = scheduler.scheduleIfNeeded(known.getId(), SyncScheduler.SyncTrigger.sweep());

        // Then
        assertEquals(1, first.jobsCreated());
        assertEquals(SyncReason.FIRST_SYNC, first.reason());
        assertEquals(0, second.jobsCreated());
        assertEquals(1, fixture.jobStore.ofType(JobType.PROFILE_UPSERT).size());
    }

    @Test
    void testScheduleIfNeeded_OrderClearsFunnelFlags() {
        // Given
        UnifiedIdentity known = seed(IdentityEvidence.email("jane@example.com", "web"));
        fixture.identityStore.setSyncFlag(known.getId(), SyncReason.CART_ABANDONED.getFlagName(), T0);
        fixture.identityStore.setSyncFlag(known.getId(), SyncReason.FIRST_SYNC.getFlagName(), T0);
        TrackedEvent order = TrackedEvent.create(WS, null, "track", "Order Completed", Map.of("order_id", "o1"),
                T0, "web", "order-1").attachTo(known.getId());
        fixture.eventStore.insert(order);
        fixture.clock.advance(Duration.ofHours(2));

        // When
        SyncScheduler.ScheduleResult result = scheduler.scheduleIfNeeded(known.getId(),
                SyncScheduler.SyncTrigger.forEvent(order));

        // Then
        SyncFlags flags = fixture.identityStore.findById(known.getId()).orElseThrow().getComputed().getFlags();
        assertFalse(flags.isSet(SyncReason.CART_ABANDONED.getFlagName()));
        assertTrue(flags.isSet(SyncReason.FIRST_SYNC.getFlagName()));
        assertTrue(fixture.jobStore.hasJobForEvent(order.getId()));
        assertEquals(1, result.jobsCreated());
    }

    // ─────────────────── Abandonment ───────────────────

    @Test
    void testScheduleAbandonment_EmitsDerivedEventOnce() {
        // Given
        UnifiedIdentity known = seed(IdentityEvidence.email("jane@example.com", "web"));
        SignalComputer.AbandonmentDetection detection = new SignalComputer.AbandonmentDetection(WS, known.getId(),
                SignalComputer.AbandonmentKind.CART, T0.minus(Duration.ofHours(2)), 35);

        // When
        int first = scheduler.scheduleAbandonment(detection);
        int second = scheduler.scheduleAbandonment(detection);

        // Then
        assertEquals(1, first);
        assertEquals(0, second);
        TrackedEvent derived = fixture.eventStore.all().get(0);
        assertTrue(derived.isDerived());
        assertEquals("Cart Abandoned", derived.getEventName());
        assertEquals(known.getId(), derived.getUnifiedUserId());

        SyncJob job = fixture.jobStore.ofType(JobType.EVENT_TRACK).get(0);
        assertEquals(derived.getId(), job.getEventId());
        assertEquals(SyncReason.DERIVED_EVENT, job.getReason());
    }

    @Test
    void testScheduleAbandonment_CooldownBlocksNewAnchor() {
        // Given
        UnifiedIdentity known = seed(IdentityEvidence.email("jane@example.com", "web"));
        scheduler.scheduleAbandonment(new SignalComputer.AbandonmentDetection(WS, known.getId(),
                SignalComputer.AbandonmentKind.CHECKOUT, T0.minus(Duration.ofHours(4)), 50));

        // When
        int emitted = scheduler.scheduleAbandonment(new SignalComputer.AbandonmentDetection(WS, known.getId(),
                SignalComputer.AbandonmentKind.CHECKOUT, T0.minus(Duration.ofHours(3)), 50));

        // Then
        assertEquals(0, emitted);
        assertEquals(1, fixture.eventStore.all().size());
    }

    private UnifiedIdentity seed(IdentityEvidence evidence) {
        UnifiedIdentity identity = UnifiedIdentity.create(WS, evidence, T0);
        fixture.identityStore.insert(identity);
        return identity;
    }
}
