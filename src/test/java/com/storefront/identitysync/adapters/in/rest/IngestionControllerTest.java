package com.storefront.identitysync.adapters.in.rest;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import com.storefront.identitysync.application.port.in.IdentifyUseCase;
import com.storefront.identitysync.application.port.in.IdentifyUseCase.IdentifyCommand;
import com.storefront.identitysync.application.port.in.IdentifyUseCase.IdentifyResult;
import com.storefront.identitysync.application.port.in.IngestEventUseCase;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.application.port.in.PayloadTooLargeException;
import com.storefront.identitysync.application.port.out.ApiKeyValidator;
import com.storefront.identitysync.application.port.out.ApiKeyValidator.ApiKeyGrant;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

@ExtendWith(MockitoExtension.class)
class IngestionControllerTest {

    private static final String KEY = "sk_live_1";

    @Mock
    private IngestEventUseCase ingestEventUseCase;

    @Mock
    private IdentifyUseCase identifyUseCase;

    @Mock
    private ApiKeyValidator apiKeyValidator;

    private SimpleMeterRegistry meterRegistry;
    private IngestionController controller;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        controller = new IngestionController(ingestEventUseCase, identifyUseCase, apiKeyValidator, meterRegistry);
    }

    // ─────────────────── Track ───────────────────

    @Test
    void testTrack_AcceptedEventUsesKeyWorkspace() {
        // Given
        grant("track");
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenReturn(new IngestResult("evt_1", "uid_1", true, false, false, 0, 0, List.of()));
        TrackRequest request = trackRequest();
        request.setWorkspaceId("ws_spoofed");

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, request);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("evt_1", response.getBody().get("event_id"));
        assertEquals(true, response.getBody().get("is_new_user"));
        assertFalse(response.getBody().containsKey("duplicate"));

        ArgumentCaptor<IngestCommand> captor = ArgumentCaptor.forClass(IngestCommand.class);
        verify(ingestEventUseCase).ingest(captor.capture());
        assertEquals("ws_1", captor.getValue().workspaceId());
        assertEquals("server", captor.getValue().source());
        assertEquals(1.0, meterRegistry.counter("identity_sync.ingest.outcome",
                "status", "accepted", "channel", "http").count());
    }

    @Test
    void testTrack_DuplicateIsStillSuccess() {
        // Given
        grant("track");
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenReturn(IngestResult.duplicateOf("evt_1", "uid_1"));

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, trackRequest());

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals(true, response.getBody().get("duplicate"));
    }

    @Test
    void testTrack_MissingKeyIsUnauthorized() {
        // When
        ResponseEntity<Map<String, Object>> response = controller.track(" ", trackRequest());

        // Then
        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        verifyNoInteractions(apiKeyValidator, ingestEventUseCase);
    }

    @Test
    void testTrack_UnknownKeyIsUnauthorized() {
        // Given
        when(apiKeyValidator.validate(KEY)).thenReturn(Optional.empty());

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, trackRequest());

        // Then
        assertEquals(HttpStatus.UNAUTHORIZED, response.getStatusCode());
        assertEquals("Invalid API key", response.getBody().get("error"));
    }

    @Test
    void testTrack_KeyWithoutScopeIsForbidden() {
        // Given
        grant("identify");

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, trackRequest());

        // Then
        assertEquals(HttpStatus.FORBIDDEN, response.getStatusCode());
        verifyNoInteractions(ingestEventUseCase);
        assertEquals(1.0, meterRegistry.counter("identity_sync.ingest.outcome",
                "status", "rejected", "channel", "http").count());
    }

    @Test
    void testTrack_ValidationErrorIsBadRequest() {
        // Given
        grant("track");
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenThrow(new IllegalArgumentException("event_name is required"));

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, trackRequest());

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        assertEquals("event_name is required", response.getBody().get("error"));
    }

    @Test
    void testTrack_MalformedTimestampIsBadRequest() {
        // Given
        grant("track");
        TrackRequest request = trackRequest();
        request.setTimestamp("last tuesday");

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, request);

        // Then
        assertEquals(HttpStatus.BAD_REQUEST, response.getStatusCode());
        verifyNoInteractions(ingestEventUseCase);
    }

    @Test
    void testTrack_OversizedPayloadIsRejected() {
        // Given
        grant("track");
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenThrow(new PayloadTooLargeException("properties exceeds 32768 bytes"));

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, trackRequest());

        // Then
        assertEquals(HttpStatus.PAYLOAD_TOO_LARGE, response.getStatusCode());
    }

    @Test
    void testTrack_UnexpectedFailureHidesDetails() {
        // Given
        grant("track");
        when(ingestEventUseCase.ingest(any(IngestCommand.class)))
                .thenThrow(new IllegalStateException("connection pool exhausted"));

        // When
        ResponseEntity<Map<String, Object>> response = controller.track(KEY, trackRequest());

        // Then
        assertEquals(HttpStatus.INTERNAL_SERVER_ERROR, response.getStatusCode());
        assertEquals("Internal error", response.getBody().get("error"));
    }

    // ─────────────────── Identify ───────────────────

    @Test
    void testIdentify_ReturnsResolutionSummary() {
        // Given
        grant("identify");
        when(identifyUseCase.identify(any(IdentifyCommand.class)))
                .thenReturn(new IdentifyResult("uid_1", false, true, 3, 1));
        IdentifyRequest request = new IdentifyRequest();
        request.setAnonymousId("anon_1");
        request.setEmail("jane@example.com");

        // When
        ResponseEntity<Map<String, Object>> response = controller.identify(KEY, request);

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("uid_1", response.getBody().get("unified_user_id"));
        assertEquals(true, response.getBody().get("identity_merged"));
        assertEquals(3, response.getBody().get("events_linked"));

        ArgumentCaptor<IdentifyCommand> captor = ArgumentCaptor.forClass(IdentifyCommand.class);
        verify(identifyUseCase).identify(captor.capture());
        assertEquals("ws_1", captor.getValue().workspaceId());
        assertTrue(captor.getValue().traits().isEmpty());
    }

    @Test
    void testIdentify_WildcardScopeIsAccepted() {
        // Given
        grant("*");
        when(identifyUseCase.identify(any(IdentifyCommand.class)))
                .thenReturn(new IdentifyResult("uid_1", true, false, 0, 0));

        // When
        ResponseEntity<Map<String, Object>> response = controller.identify(KEY, new IdentifyRequest());

        // Then
        assertEquals(HttpStatus.OK, response.getStatusCode());
    }

    private void grant(String scope) {
        when(apiKeyValidator.validate(KEY)).thenReturn(Optional.of(new ApiKeyGrant("ws_1", Set.of(scope))));
    }

    private static TrackRequest trackRequest() {
        TrackRequest request = new TrackRequest();
        request.setEventName("Product Viewed");
        request.setAnonymousId("anon_1");
        request.setProperties(Map.of("product_id", "p1"));
        return request;
    }
}
