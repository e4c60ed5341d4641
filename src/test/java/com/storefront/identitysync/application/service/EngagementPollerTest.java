package com.storefront.identitysync.application.service;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.application.port.out.DestinationClient.EngagementEvent;
import com.storefront.identitysync.application.port.out.DestinationException;
import com.storefront.identitysync.domain.entity.Destination;
import com.storefront.identitysync.domain.entity.ComputedTraits;
import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.support.IdentitySyncFixture;

@ExtendWith(MockitoExtension.class)
class EngagementPollerTest {

    private static final Instant T0 = IdentitySyncFixture.START;

    @Mock
    private DestinationClient destinationClient;

    private IdentitySyncFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new IdentitySyncFixture(destinationClient);
    }

    @Test
    void testPollAll_IngestsEngagementOnceAsEmailEvents() {
        // Given
        List<EngagementEvent> events = List.of(
                new EngagementEvent("evt_1", "Jane@Example.com", "Opened Email", T0.minusSeconds(120),
                        Map.of("campaign", "spring")),
                new EngagementEvent("evt_2", null, "Clicked Email", T0.minusSeconds(60), Map.of()));
        when(destinationClient.fetchEngagement(any(Destination.class), eq(T0.minus(Duration.ofMinutes(15)))))
                .thenReturn(events);

        // When
        int first = fixture.engagementPoller.pollAll();
        int second = fixture.engagementPoller.pollAll();

        // Then
        assertEquals(1, first);
        assertEquals(0, second);

        TrackedEvent stored = fixture.eventStore.all().get(0);
        assertEquals(TrackedEvent.EMAIL_TYPE, stored.getEventType());
        assertEquals(Destination.KLAVIYO, stored.getSource());
        assertEquals(T0.minusSeconds(120), stored.getEventTime());
        assertEquals("jane@example.com",
                fixture.identityStore.findById(stored.getUnifiedUserId()).orElseThrow().getPrimaryEmail());
        assertTrue(fixture.jobStore.ofType(JobType.EVENT_TRACK).isEmpty());
    }

    @Test
    void testPollAll_IgnoresEchoOfTrackedMetrics() {
        // Given
        IngestResult order = fixture.ingestor.ingest(new IngestCommand(IdentitySyncFixture.WORKSPACE, "track",
                "Order Completed", Map.of("order_id", "o1", "total_price", "50"), null, "jane@example.com", null,
                null, null, null, "web", null, null));
        when(destinationClient.fetchEngagement(any(Destination.class), any(Instant.class))).thenReturn(List.of(
                new EngagementEvent("evt_echo", "jane@example.com", "SF Placed Order", T0.minusSeconds(30),
                        Map.of("total_price", "50")),
                new EngagementEvent("evt_open", "jane@example.com", "Opened Email", T0.minusSeconds(20),
                        Map.of())));

        // When
        int ingested = fixture.engagementPoller.pollAll();

        // Then
        assertEquals(1, ingested);
        ComputedTraits computed = fixture.identityStore.findById(order.unifiedUserId()).orElseThrow().getComputed();
        assertEquals(1, computed.getOrdersCount());
        assertEquals(50.0, computed.getLifetimeValue(), 0.001);
        assertEquals(1, computed.getEmailOpens30d());
        assertEquals(2, fixture.eventStore.all().size());
    }

    @Test
    void testPollAll_DestinationErrorIsRecorded() {
        // Given
        when(destinationClient.fetchEngagement(any(Destination.class), any(Instant.class)))
                .thenThrow(DestinationException.forStatus("fetch_engagement", 500, "oops"));

        // When
        int ingested = fixture.engagementPoller.pollAll();

        // Then
        assertEquals(0, ingested);
        assertNotNull(fixture.destinationStore.findById(IdentitySyncFixture.DESTINATION).orElseThrow().getLastError());
    }

    @Test
    void testPollAll_SkipsUnusableDestinations() {
        // Given
        fixture.destinationStore.put(new Destination(IdentitySyncFixture.DESTINATION, IdentitySyncFixture.WORKSPACE,
                Destination.KLAVIYO, true, null, null, null));

        // When
        int ingested = fixture.engagementPoller.pollAll();

        // Then
        assertEquals(0, ingested);
        verifyNoInteractions(destinationClient);
    }
}
