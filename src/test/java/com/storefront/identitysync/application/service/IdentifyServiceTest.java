package com.storefront.identitysync.application.service;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.storefront.identitysync.application.port.in.IdentifyUseCase.IdentifyCommand;
import com.storefront.identitysync.application.port.in.IdentifyUseCase.IdentifyResult;
import com.storefront.identitysync.application.port.in.PayloadTooLargeException;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.entity.UnifiedIdentity;
import com.storefront.identitysync.domain.valueobject.IdentityEvidence;
import com.storefront.identitysync.support.IdentitySyncFixture;

@ExtendWith(MockitoExtension.class)
class IdentifyServiceTest {

    private static final String WS = IdentitySyncFixture.WORKSPACE;

    @Mock
    private DestinationClient destinationClient;

    private IdentitySyncFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new IdentitySyncFixture(destinationClient);
    }

    @Test
    void testIdentify_StoresTraitsAndSchedulesFirstSync() {
        // When
        IdentifyResult result = fixture.identifyService.identify(new IdentifyCommand(WS, "anon_1", "cust_1",
                "jane@example.com", null, Map.of("first_name", "Jane")));

        // Then
        assertTrue(result.newUser());
        assertEquals(1, result.syncJobsCreated());
        UnifiedIdentity stored = fixture.identityStore.findById(result.unifiedUserId()).orElseThrow();
        assertEquals("Jane", stored.getTraits().get("first_name"));
        assertTrue(stored.getCustomerIds().contains("cust_1"));
    }

    @Test
    void testIdentify_RelinksOrphanedAnonymousEvents() {
        // Given
        fixture.eventStore.insert(TrackedEvent.create(WS, "anon_1", "track", "Page Viewed", Map.of(),
                IdentitySyncFixture.START, "web", "orphan-1"));

        // When
        IdentifyResult result = fixture.identifyService.identify(new IdentifyCommand(WS, "anon_1", null,
                "jane@example.com", null, null));

        // Then
        assertEquals(1, result.eventsLinked());
        assertEquals(result.unifiedUserId(), fixture.eventStore.all().get(0).getUnifiedUserId());
    }

    @Test
    void testIdentify_CountsEventsMovedByMerge() {
        // Given
        String anonymousOwner = fixture.resolver.resolve(WS, IdentityEvidence.anonymous("anon_phone", "web"))
                .unifiedUserId();
        fixture.resolver.resolve(WS, IdentityEvidence.email("jane@example.com", "web"));
        fixture.eventStore.insert(TrackedEvent.create(WS, "anon_phone", "track", "Page Viewed", Map.of(),
                IdentitySyncFixture.START, "web", "phone-1").attachTo(anonymousOwner));
        fixture.eventStore.insert(TrackedEvent.create(WS, "anon_phone", "track", "Product Viewed", Map.of(),
                IdentitySyncFixture.START, "web", "phone-2").attachTo(anonymousOwner));
        fixture.clock.advance(Duration.ofMinutes(5));

        // When
        IdentifyResult result = fixture.identifyService.identify(new IdentifyCommand(WS, "anon_phone", null,
                "jane@example.com", null, null));

        // Then
        assertTrue(result.identityMerged());
        assertEquals(2, result.eventsLinked());
    }

    @Test
    void testIdentify_TraitWriteKeepsIdentifiersAddedConcurrently() {
        // Given
        IdentityResolver interleaved = new IdentityResolver(fixture.identityStore, fixture.linkStore,
                fixture.merger, fixture.transactionRunner, fixture.clock) {
            @Override
            public Resolution resolve(String workspaceId, IdentityEvidence evidence) {
                Resolution stale = super.resolve(workspaceId, evidence);
                super.resolve(workspaceId, new IdentityEvidence(null, "jane@example.com", null, "cust_9", "shopify"));
                return stale;
            }
        };
        IdentifyService service = new IdentifyService(interleaved, fixture.identityStore, fixture.eventStore,
                fixture.scheduler, fixture.payloadLimits, fixture.clock);

        // When
        IdentifyResult result = service.identify(new IdentifyCommand(WS, "anon_1", null, "jane@example.com", null,
                Map.of("first_name", "Jane")));

        // Then
        UnifiedIdentity stored = fixture.identityStore.findById(result.unifiedUserId()).orElseThrow();
        assertTrue(stored.getCustomerIds().contains("cust_9"));
        assertTrue(stored.containsAnonymousId("anon_1"));
        assertEquals("Jane", stored.getTraits().get("first_name"));
        assertEquals(result.unifiedUserId(),
                fixture.identityStore.findByCustomerId(WS, "cust_9").orElseThrow().getId());
    }

    @Test
    void testIdentify_AnonymousOnlyCallSchedulesNothing() {
        IdentifyResult result = fixture.identifyService.identify(new IdentifyCommand(WS, "anon_1", null, null,
                null, null));

        assertEquals(0, result.syncJobsCreated());
        assertTrue(fixture.jobStore.all().isEmpty());
    }

    @Test
    void testIdentify_RejectsDeepTraits() {
        // Given
        Map<String, Object> deep = Map.of("v", "leaf");
        for (int i = 0; i < 12; i++) {
            deep = Map.of("n", deep);
        }
        IdentifyCommand command = new IdentifyCommand(WS, "anon_1", null, null, null, deep);

        // When / Then
        assertThrows(PayloadTooLargeException.class, () -> fixture.identifyService.identify(command));
    }
}
