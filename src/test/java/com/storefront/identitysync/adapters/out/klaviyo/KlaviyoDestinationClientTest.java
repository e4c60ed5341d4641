package com.storefront.identitysync.adapters.out.klaviyo;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.application.port.out.DestinationClient.EngagementEvent;
import com.storefront.identitysync.application.port.out.DestinationClient.MetricEvent;
import com.storefront.identitysync.application.port.out.DestinationClient.ProfileUpsert;
import com.storefront.identitysync.application.port.out.DestinationException;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;
import com.storefront.identitysync.domain.entity.Destination;
import com.storefront.identitysync.support.InMemoryDestinationStore;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import reactor.core.publisher.Mono;

class KlaviyoDestinationClientTest {

    private static final Destination DESTINATION = InMemoryDestinationStore.klaviyo("dest_1", "ws_1");
    private static final ProfileUpsert PROFILE = new ProfileUpsert("jane@example.com", "uid_1", null,
            Map.of("intent_score", 42));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final List<ClientRequest> requests = new ArrayList<>();
    private final Deque<Object> replies = new ArrayDeque<>();

    private SimpleMeterRegistry meterRegistry;
    private KlaviyoDestinationClient client;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            Object next = replies.poll();
            if (next instanceof RuntimeException) {
                return Mono.error((RuntimeException) next);
            }
            return Mono.just((ClientResponse) next);
        });
        client = new KlaviyoDestinationClient(builder, objectMapper, new IdentitySyncProperties(), meterRegistry);
    }

    // ─────────────────── Profiles ───────────────────

    @Test
    void testUpsertProfile_CreatedReturnsNewId() {
        // Given
        replies.add(json(HttpStatus.CREATED, "{\"data\":{\"type\":\"profile\",\"id\":\"01NEW\"}}"));

        // When
        String profileId = client.upsertProfile(DESTINATION, PROFILE);

        // Then
        assertEquals("01NEW", profileId);
        assertEquals(1, requests.size());
        ClientRequest request = requests.get(0);
        assertEquals(HttpMethod.POST, request.method());
        assertTrue(request.url().getPath().endsWith(KlaviyoDestinationClient.PROFILES_PATH));
        assertEquals("Klaviyo-API-Key pk_test", request.headers().getFirst(HttpHeaders.AUTHORIZATION));
        assertNotNull(request.headers().getFirst("revision"));
        assertEquals(1, meterRegistry.find("identity_sync.destination.call")
                .tag("operation", "profile_create").tag("status", "201").timer().count());
    }

    @Test
    void testUpsertProfile_ConflictPatchesExistingProfile() {
        // Given
        replies.add(json(HttpStatus.CONFLICT,
                "{\"errors\":[{\"status\":409,\"meta\":{\"duplicate_profile_id\":\"01DUP\"}}]}"));
        replies.add(json(HttpStatus.OK, "{\"data\":{\"type\":\"profile\",\"id\":\"01DUP\"}}"));

        // When
        String profileId = client.upsertProfile(DESTINATION, PROFILE);

        // Then
        assertEquals("01DUP", profileId);
        assertEquals(2, requests.size());
        assertEquals(HttpMethod.PATCH, requests.get(1).method());
        assertTrue(requests.get(1).url().getPath().endsWith("/api/profiles/01DUP"));
    }

    @Test
    void testUpsertProfile_ConflictWithoutDuplicateIdFails() {
        // Given
        replies.add(json(HttpStatus.CONFLICT, "{\"errors\":[{\"status\":409}]}"));

        // When
        DestinationException error = assertThrows(DestinationException.class,
                () -> client.upsertProfile(DESTINATION, PROFILE));

        // Then
        assertEquals(409, error.getStatusCode());
        assertFalse(error.isTransientFailure());
        assertEquals(1, requests.size());
    }

    @Test
    void testUpsertProfile_ServerErrorIsTransient() {
        // Given
        replies.add(json(HttpStatus.SERVICE_UNAVAILABLE, "{\"errors\":[]}"));

        // When
        DestinationException error = assertThrows(DestinationException.class,
                () -> client.upsertProfile(DESTINATION, PROFILE));

        // Then
        assertEquals(503, error.getStatusCode());
        assertTrue(error.isTransientFailure());
        assertFalse(error.isCredentialRejection());
    }

    @Test
    void testUpsertProfile_UnauthorizedIsCredentialRejection() {
        // Given
        replies.add(json(HttpStatus.UNAUTHORIZED, "{\"errors\":[{\"code\":\"not_authenticated\"}]}"));

        // When
        DestinationException error = assertThrows(DestinationException.class,
                () -> client.upsertProfile(DESTINATION, PROFILE));

        // Then
        assertTrue(error.isCredentialRejection());
        assertFalse(error.isTransientFailure());
        assertTrue(error.getMessage().contains("HTTP 401"));
    }

    @Test
    void testUpsertProfile_ConnectionFailureIsTransient() {
        // Given
        replies.add(new WebClientRequestException(new IOException("connection refused"), HttpMethod.POST,
                URI.create("https://a.klaviyo.com/api/profiles/"), new HttpHeaders()));

        // When
        DestinationException error = assertThrows(DestinationException.class,
                () -> client.upsertProfile(DESTINATION, PROFILE));

        // Then
        assertEquals(0, error.getStatusCode());
        assertTrue(error.isTransientFailure());
        assertEquals(1, meterRegistry.find("identity_sync.destination.call")
                .tag("status", "error").timer().count());
    }

    // ─────────────────── Events ───────────────────

    @Test
    void testTrackEvent_PostsToEventsEndpoint() {
        // Given
        replies.add(json(HttpStatus.ACCEPTED, ""));
        MetricEvent event = new MetricEvent("Added to Cart", "jane@example.com", "uid_1", Map.of("value", 10),
                Instant.parse("2024-03-01T10:00:00Z"), "evt_1");

        // When
        client.trackEvent(DESTINATION, event);

        // Then
        assertEquals(HttpMethod.POST, requests.get(0).method());
        assertTrue(requests.get(0).url().getPath().endsWith(KlaviyoDestinationClient.EVENTS_PATH));
    }

    @Test
    void testFetchEngagement_RejectedListSurfacesStatus() {
        // Given
        replies.add(json(HttpStatus.TOO_MANY_REQUESTS, "{}"));

        // When
        DestinationException error = assertThrows(DestinationException.class,
                () -> client.fetchEngagement(DESTINATION, Instant.parse("2024-03-01T09:00:00Z")));

        // Then
        assertEquals(429, error.getStatusCode());
        assertTrue(error.isTransientFailure());
        assertEquals(HttpMethod.GET, requests.get(0).method());
        assertTrue(requests.get(0).url().getQuery().contains("include=profile,metric"));
    }

    @Test
    void testFetchEngagement_FollowsNextLinks() {
        // Given
        String next = "https://a.klaviyo.com/api/events/?page%5Bcursor%5D=bmV4dA";
        replies.add(json(HttpStatus.OK, engagementPage("ev_1", next)));
        replies.add(json(HttpStatus.OK, engagementPage("ev_2", null)));

        // When
        List<EngagementEvent> events = client.fetchEngagement(DESTINATION, Instant.parse("2024-03-01T09:00:00Z"));

        // Then
        assertEquals(2, events.size());
        assertEquals("ev_1", events.get(0).externalEventId());
        assertEquals("ev_2", events.get(1).externalEventId());
        assertEquals(2, requests.size());
        assertEquals(URI.create(next), requests.get(1).url());
    }

    @Test
    void testFetchEngagement_StopsAtPageCap() {
        // Given
        for (int i = 0; i <= KlaviyoDestinationClient.MAX_ENGAGEMENT_PAGES; i++) {
            replies.add(json(HttpStatus.OK, engagementPage("ev_" + i,
                    "https://a.klaviyo.com/api/events/?page%5Bcursor%5D=p" + i)));
        }

        // When
        List<EngagementEvent> events = client.fetchEngagement(DESTINATION, Instant.parse("2024-03-01T09:00:00Z"));

        // Then
        assertEquals(KlaviyoDestinationClient.MAX_ENGAGEMENT_PAGES, requests.size());
        assertEquals(KlaviyoDestinationClient.MAX_ENGAGEMENT_PAGES, events.size());
    }

    @Test
    void testParseEngagement_JoinsIncludedProfilesAndMetrics() throws Exception {
        // Given
        String body = """
                {
                  "data": [
                    {"id": "ev_1", "attributes": {"datetime": "2024-03-01T09:30:00+00:00",
                        "event_properties": {"subject": "Spring sale"}},
                     "relationships": {"profile": {"data": {"id": "pr_1"}},
                                       "metric": {"data": {"id": "me_1"}}}},
                    {"id": "ev_2", "attributes": {"datetime": "2024-03-01T09:31:00+00:00"},
                     "relationships": {"profile": {"data": {"id": "pr_missing"}},
                                       "metric": {"data": {"id": "me_1"}}}},
                    {"id": "ev_3", "attributes": {"datetime": "yesterday"},
                     "relationships": {"profile": {"data": {"id": "pr_1"}},
                                       "metric": {"data": {"id": "me_1"}}}},
                    {"id": "ev_4", "attributes": {"datetime": "2024-03-01T09:40:00Z"},
                     "relationships": {"profile": {"data": {"id": "pr_1"}},
                                       "metric": {"data": {"id": "me_unknown"}}}}
                  ],
                  "included": [
                    {"type": "profile", "id": "pr_1", "attributes": {"email": "jane@example.com"}},
                    {"type": "metric", "id": "me_1", "attributes": {"name": "Opened Email"}}
                  ]
                }
                """;

        // When
        List<EngagementEvent> events = client.parseEngagement(objectMapper.readTree(body));

        // Then
        assertEquals(2, events.size());
        EngagementEvent opened = events.get(0);
        assertEquals("ev_1", opened.externalEventId());
        assertEquals("jane@example.com", opened.email());
        assertEquals("Opened Email", opened.metricName());
        assertEquals(Instant.parse("2024-03-01T09:30:00Z"), opened.occurredAt());
        assertEquals("Spring sale", opened.properties().get("subject"));
        assertEquals("me_1", opened.properties().get("klaviyo_metric_id"));
        assertEquals("pr_1", opened.properties().get("klaviyo_profile_id"));
        assertEquals("Unknown", events.get(1).metricName());
    }

    private static String engagementPage(String eventId, String next) {
        String nextLink = next != null ? "\"" + next + "\"" : "null";
        return """
                {
                  "links": {"next": %s},
                  "data": [
                    {"id": "%s", "attributes": {"datetime": "2024-03-01T09:30:00Z"},
                     "relationships": {"profile": {"data": {"id": "pr_1"}},
                                       "metric": {"data": {"id": "me_1"}}}}
                  ],
                  "included": [
                    {"type": "profile", "id": "pr_1", "attributes": {"email": "jane@example.com"}},
                    {"type": "metric", "id": "me_1", "attributes": {"name": "Opened Email"}}
                  ]
                }
                """.formatted(nextLink, eventId);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(body)
                .build();
    }
}
