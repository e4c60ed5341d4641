package com.storefront.identitysync.adapters.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.storefront.identitysync.application.port.in.IdentifyUseCase;
import com.storefront.identitysync.application.port.in.IdentifyUseCase.IdentifyResult;
import com.storefront.identitysync.application.port.in.IngestEventUseCase;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestResult;
import com.storefront.identitysync.application.port.in.PayloadTooLargeException;
import com.storefront.identitysync.application.port.out.ApiKeyValidator;
import com.storefront.identitysync.application.port.out.ApiKeyValidator.ApiKeyGrant;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Public ingestion API: {@code POST /v1/identify} and {@code POST /v1/track}.
 * <p>
 * Callers see success, duplicate (200 with {@code duplicate=true}) or a
 * validation error. Internal merge, signal and sync failures never surface
 * here.
 * </p>
 */
@RestController
@RequestMapping("/v1")
public class IngestionController {

    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    static final String API_KEY_HEADER = "x-api-key";
    static final String SCOPE_IDENTIFY = "identify";
    static final String SCOPE_TRACK = "track";
    private static final String SERVER_SOURCE = "server";

    private final IngestEventUseCase ingestEventUseCase;
    private final IdentifyUseCase identifyUseCase;
    private final ApiKeyValidator apiKeyValidator;
    private final MeterRegistry meterRegistry;

    public IngestionController(IngestEventUseCase ingestEventUseCase,
            IdentifyUseCase identifyUseCase,
            ApiKeyValidator apiKeyValidator,
            MeterRegistry meterRegistry) {
        this.ingestEventUseCase = ingestEventUseCase;
        this.identifyUseCase = identifyUseCase;
        this.apiKeyValidator = apiKeyValidator;
        this.meterRegistry = meterRegistry;
    }

    @PostMapping("/identify")
    public ResponseEntity<Map<String, Object>> identify(
            @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
            @RequestBody IdentifyRequest request) {
        try {
            ApiKeyGrant grant = authorize(apiKey, SCOPE_IDENTIFY);
            IdentifyResult result = identifyUseCase.identify(request.toCommand(grant.workspaceId()));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("unified_user_id", result.unifiedUserId());
            body.put("is_new_user", result.newUser());
            body.put("identity_merged", result.identityMerged());
            body.put("events_linked", result.eventsLinked());
            body.put("sync_jobs_created", result.syncJobsCreated());
            return ResponseEntity.ok(body);

        } catch (Exception e) {
            return failure("identify", e);
        }
    }

    @PostMapping("/track")
    public ResponseEntity<Map<String, Object>> track(
            @RequestHeader(name = API_KEY_HEADER, required = false) String apiKey,
            @RequestBody TrackRequest request) {
        try {
            ApiKeyGrant grant = authorize(apiKey, SCOPE_TRACK);
            IngestResult result = ingestEventUseCase.ingest(request.toCommand(grant.workspaceId(), SERVER_SOURCE));
            countIngest(result.duplicate() ? "duplicate" : "accepted");

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", true);
            body.put("event_id", result.eventId());
            body.put("unified_user_id", result.unifiedUserId());
            body.put("is_new_user", result.newUser());
            body.put("identity_merged", result.identityMerged());
            if (result.duplicate()) {
                body.put("duplicate", true);
            }
            return ResponseEntity.ok(body);

        } catch (Exception e) {
            countIngest("rejected");
            return failure("track", e);
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    private ApiKeyGrant authorize(String apiKey, String scope) {
        if (apiKey == null || apiKey.isBlank()) {
            throw ApiKeyRejectedException.missing();
        }
        ApiKeyGrant grant = apiKeyValidator.validate(apiKey).orElseThrow(ApiKeyRejectedException::invalid);
        if (!grant.allows(scope)) {
            throw ApiKeyRejectedException.missingScope(scope);
        }
        return grant;
    }

    private ResponseEntity<Map<String, Object>> failure(String operation, Exception e) {
        if (e instanceof ApiKeyRejectedException) {
            ApiKeyRejectedException rejected = (ApiKeyRejectedException) e;
            log.warn("action=api_key_rejected operation={} status={}", operation, rejected.getStatus());
            return error(HttpStatus.valueOf(rejected.getStatus()), rejected.getMessage());
        }
        if (e instanceof PayloadTooLargeException) {
            log.warn("action=payload_too_large operation={} error={}", operation, e.getMessage());
            return error(HttpStatus.PAYLOAD_TOO_LARGE, e.getMessage());
        }
        if (e instanceof IllegalArgumentException) {
            log.warn("action=validation_error operation={} error={}", operation, e.getMessage());
            return error(HttpStatus.BAD_REQUEST, e.getMessage());
        }
        log.error("action={}_error error={}", operation, e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal error");
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }

    private void countIngest(String status) {
        meterRegistry.counter("identity_sync.ingest.outcome", "status", status, "channel", "http").increment();
    }
}
