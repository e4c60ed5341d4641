package com.storefront.identitysync.application.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.application.port.in.PayloadTooLargeException;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.valueobject.EventStatus;
import com.storefront.identitysync.domain.valueobject.IdentityEvidence;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncReason;
import com.storefront.identitysync.support.IdentitySyncFixture;

@ExtendWith(MockitoExtension.class)
class EventIngestorTest {

    private static final String WS = IdentitySyncFixture.WORKSPACE;

    @Mock
    private DestinationClient destinationClient;

    @Mock
    private SignalComputer failingSignals;

    private IdentitySyncFixture fixture;
    private EventIngestor ingestor;

    @BeforeEach
    void setUp() {
        fixture = new IdentitySyncFixture(destinationClient);
        ingestor = fixture.ingestor;
    }

    @Test
    void testIngest_AnonymousEventCreatesIdentityWithoutSync() {
        // When
        IngestResult result = ingestor.ingest(track("Product Viewed", Map.of("product_id", "p1"), "anon_1", null));

        // Then
        assertTrue(result.newUser());
        assertFalse(result.duplicate());
        assertEquals(0, result.syncJobsCreated());
        assertTrue(result.warnings().isEmpty());

        TrackedEvent stored = fixture.eventStore.findById(result.eventId()).orElseThrow();
        assertEquals(result.unifiedUserId(), stored.getUnifiedUserId());
        assertEquals(EventStatus.PROCESSED, stored.getStatus());
        assertEquals(3, fixture.identityStore.findById(result.unifiedUserId()).orElseThrow()
                .getComputed().getIntentScore());
    }

    @Test
    void testIngest_DuplicateDedupeKeyReturnsOriginalEvent() {
        // Given
        Map<String, Object> props = Map.of("checkout_token", "tok_1");
        IngestResult first = ingestor.ingest(track("Checkout Started", props, "anon_1", null));

        // When
        IngestResult second = ingestor.ingest(track("Checkout Started", props, "anon_1", null));

        // Then
        assertTrue(second.duplicate());
        assertEquals(first.eventId(), second.eventId());
        assertEquals(first.unifiedUserId(), second.unifiedUserId());
        assertEquals(1, fixture.eventStore.all().size());
        assertEquals(1, fixture.eventStore.duplicateCount(WS, fixture.eventStore.all().get(0).getDedupeKey()));
    }

    @Test
    void testIngest_CookielessTrafficGetsFingerprint() {
        // Given
        IngestCommand command = new IngestCommand(WS, "track", "Page Viewed", Map.of(), null, null, null, null,
                "203.0.113.9", "Mozilla/5.0", "web", null, null);

        // When
        IngestResult first = ingestor.ingest(command);
        fixture.clock.advance(Duration.ofMinutes(10));
        IngestResult second = ingestor.ingest(command);

        // Then
        TrackedEvent stored = fixture.eventStore.findById(first.eventId()).orElseThrow();
        assertTrue(stored.getAnonymousId().startsWith("fp_"));
        assertFalse(second.duplicate());
        assertEquals(first.unifiedUserId(), second.unifiedUserId());
    }

    @Test
    void testIngest_MissingIdentifierIsRejected() {
        IngestCommand command = new IngestCommand(WS, "track", "Page Viewed", Map.of(), null, null, null, null,
                null, "Mozilla/5.0", "web", null, null);

        assertThrows(IllegalArgumentException.class, () -> ingestor.ingest(command));
        assertTrue(fixture.eventStore.all().isEmpty());
    }

    @Test
    void testIngest_OversizedPropertiesAreRejected() {
        // Given
        Map<String, Object> props = new HashMap<>();
        props.put("blob", "x".repeat(PayloadLimits.DEFAULT_MAX_BYTES + 1));

        // When / Then
        assertThrows(PayloadTooLargeException.class,
                () -> ingestor.ingest(track("Product Viewed", props, "anon_1", null)));
        assertEquals(0, fixture.identityStore.countAll());
    }

    @Test
    void testIngest_KnownShopperCartAddSchedulesProfileAndEvent() {
        // When
        IngestResult result = ingestor.ingest(track("Added to Cart", Map.of("cart_token", "c1"), "anon_1",
                "jane@example.com"));

        // Then
        assertEquals(2, result.syncJobsCreated());
        SyncJob profile = fixture.jobStore.ofType(JobType.PROFILE_UPSERT).get(0);
        SyncJob event = fixture.jobStore.ofType(JobType.EVENT_TRACK).get(0);
        assertEquals(SyncReason.CART_ABANDONED, profile.getReason());
        assertEquals(result.eventId(), event.getEventId());
        assertEquals(IdentitySyncFixture.DESTINATION, event.getDestinationId());
    }

    @Test
    void testIngest_EngagementFromDestinationIsNotEchoedBack() {
        // Given
        IngestCommand command = new IngestCommand(WS, TrackedEvent.EMAIL_TYPE, "Opened Email", Map.of(), null,
                "jane@example.com", null, null, null, null, "klaviyo", null, "ext-1");

        // When
        IngestResult result = ingestor.ingest(command);

        // Then
        assertTrue(fixture.jobStore.ofType(JobType.EVENT_TRACK).isEmpty());
        assertEquals(1, result.syncJobsCreated());
        assertEquals(1, fixture.identityStore.findById(result.unifiedUserId()).orElseThrow()
                .getComputed().getEmailOpens30d());
    }

    @Test
    void testIngest_SignalFailureIsReportedAsWarning() {
        // Given
        EventIngestor withFailingSignals = new EventIngestor(fixture.eventStore, fixture.resolver, failingSignals,
                fixture.scheduler, fixture.payloadLimits, fixture.clock);
        when(failingSignals.onEvent(anyString(), any(TrackedEvent.class)))
                .thenThrow(new IllegalStateException("version race lost"));

        // When
        IngestResult result = withFailingSignals.ingest(track("Product Viewed", Map.of(), "anon_1", null));

        // Then
        assertFalse(result.duplicate());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("signal computation failed"));
        assertEquals(EventStatus.FAILED, fixture.eventStore.findById(result.eventId()).orElseThrow().getStatus());
        verify(failingSignals, times(1)).onEvent(eq(result.unifiedUserId()), any(TrackedEvent.class));
    }

    @Test
    void testIngest_RetryResumesEventLeftPendingByFailedResolution() {
        // Given
        int[] calls = {0};
        IdentityResolver flaky = new IdentityResolver(fixture.identityStore, fixture.linkStore, fixture.merger,
                fixture.transactionRunner, fixture.clock) {
            @Override
            public Resolution resolve(String workspaceId, IdentityEvidence evidence) {
                if (calls[0]++ == 0) {
                    throw new IllegalStateException("lock timeout");
                }
                return super.resolve(workspaceId, evidence);
            }
        };
        EventIngestor withFlakyResolver = new EventIngestor(fixture.eventStore, flaky, fixture.signalComputer,
                fixture.scheduler, fixture.payloadLimits, fixture.clock);
        IngestCommand command = track("Added to Cart", Map.of("cart_token", "c1"), "anon_1", "jane@example.com");
        assertThrows(IllegalStateException.class, () -> withFlakyResolver.ingest(command));
        TrackedEvent pending = fixture.eventStore.all().get(0);
        assertEquals(EventStatus.PENDING, pending.getStatus());
        assertNull(pending.getUnifiedUserId());

        // When
        IngestResult retried = withFlakyResolver.ingest(command);

        // Then
        assertFalse(retried.duplicate());
        assertEquals(pending.getId(), retried.eventId());
        assertNotNull(retried.unifiedUserId());
        TrackedEvent stored = fixture.eventStore.findById(pending.getId()).orElseThrow();
        assertEquals(retried.unifiedUserId(), stored.getUnifiedUserId());
        assertEquals(EventStatus.PROCESSED, stored.getStatus());
        assertEquals(0, fixture.eventStore.duplicateCount(WS, stored.getDedupeKey()));
        assertEquals(1, fixture.eventStore.all().size());

        // a further retry is an ordinary duplicate
        assertTrue(withFlakyResolver.ingest(command).duplicate());
    }

    private static IngestCommand track(String name, Map<String, Object> props, String anonymousId, String email) {
        return new IngestCommand(WS, "track", name, props, anonymousId, email, null, null, null, null, "web",
                null, null);
    }
}
