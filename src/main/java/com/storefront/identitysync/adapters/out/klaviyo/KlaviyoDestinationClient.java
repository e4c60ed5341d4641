package com.storefront.identitysync.adapters.out.klaviyo;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.util.UriBuilder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storefront.identitysync.application.port.out.DestinationClient;
import com.storefront.identitysync.application.port.out.DestinationException;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;
import com.storefront.identitysync.domain.entity.Destination;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import reactor.netty.http.client.HttpClient;

/**
 * Klaviyo JSON:API client.
 * <p>
 * Every call blocks for at most the configured timeout. Non-2xx replies are
 * mapped to {@link DestinationException}; a 409 on profile create is resolved
 * by patching the existing profile it reports.
 * </p>
 */
@Component
public class KlaviyoDestinationClient implements DestinationClient {

    private static final Logger log = LoggerFactory.getLogger(KlaviyoDestinationClient.class);

    static final String PROFILES_PATH = "/api/profiles/";
    static final String EVENTS_PATH = "/api/events/";
    static final int MAX_ENGAGEMENT_PAGES = 10;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String revision;
    private final Duration timeout;

    public KlaviyoDestinationClient(WebClient.Builder webClientBuilder,
            ObjectMapper objectMapper,
            IdentitySyncProperties properties,
            MeterRegistry meterRegistry) {
        IdentitySyncProperties.Klaviyo klaviyo = properties.getKlaviyo();
        this.timeout = Duration.ofMillis(klaviyo.getTimeoutMs());
        this.revision = klaviyo.getRevision();
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;

        HttpClient http = HttpClient.create().responseTimeout(timeout);
        this.webClient = webClientBuilder
                .clientConnector(new ReactorClientHttpConnector(http))
                .baseUrl(klaviyo.getBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .defaultHeader("revision", revision)
                .build();
    }

    // ─────────────────── Profiles ───────────────────

    @Override
    public String upsertProfile(Destination destination, ProfileUpsert profile) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("email", profile.email());
        attributes.put("external_id", profile.externalId());
        if (profile.phone() != null) {
            attributes.put("phone_number", profile.phone());
        }
        attributes.put("properties", profile.properties());

        Reply created = call("profile_create", destination, HttpMethod.POST,
                uri -> uri.path(PROFILES_PATH).build(), document("profile", null, attributes));

        if (created.status() == 409) {
            String existingId = created.body().path("errors").path(0).path("meta")
                    .path("duplicate_profile_id").asText(null);
            if (existingId == null) {
                throw DestinationException.forStatus("profile_create", 409, created.raw());
            }
            Reply updated = call("profile_update", destination, HttpMethod.PATCH,
                    uri -> uri.path(PROFILES_PATH + "{id}").build(existingId),
                    document("profile", existingId, attributes));
            requireSuccess("profile_update", updated);
            log.info("action=klaviyo_profile_updated destinationId={} profileId={}",
                    destination.getId(), existingId);
            return existingId;
        }

        requireSuccess("profile_create", created);
        String profileId = created.body().path("data").path("id").asText(null);
        log.info("action=klaviyo_profile_created destinationId={} profileId={}", destination.getId(), profileId);
        return profileId;
    }

    // ─────────────────── Events ───────────────────

    @Override
    public void trackEvent(Destination destination, MetricEvent event) {
        Map<String, Object> profileAttributes = new LinkedHashMap<>();
        profileAttributes.put("email", event.email());
        profileAttributes.put("external_id", event.externalId());

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("properties", event.properties());
        attributes.put("time", event.time().toString());
        attributes.put("unique_id", event.uniqueId());
        attributes.put("metric", document("metric", null, Map.of("name", event.metricName())));
        attributes.put("profile", document("profile", null, profileAttributes));

        Reply reply = call("event_create", destination, HttpMethod.POST,
                uri -> uri.path(EVENTS_PATH).build(), document("event", null, attributes));
        requireSuccess("event_create", reply);
        log.info("action=klaviyo_event_tracked destinationId={} metric={} uniqueId={}",
                destination.getId(), event.metricName(), event.uniqueId());
    }

    @Override
    public List<EngagementEvent> fetchEngagement(Destination destination, Instant since) {
        String filter = "greater-than(datetime," + since + ")";
        Reply reply = call("event_list", destination, HttpMethod.GET,
                uri -> uri.path(EVENTS_PATH)
                        .queryParam("filter", "{filter}")
                        .queryParam("include", "profile,metric")
                        .queryParam("sort", "-datetime")
                        .build(filter),
                null);
        requireSuccess("event_list", reply);
        List<EngagementEvent> events = new ArrayList<>(parseEngagement(reply.body()));

        int pages = 1;
        String next = nextPage(reply.body());
        while (next != null && pages < MAX_ENGAGEMENT_PAGES) {
            URI nextUri = URI.create(next);
            reply = call("event_list", destination, HttpMethod.GET, uri -> nextUri, null);
            requireSuccess("event_list", reply);
            events.addAll(parseEngagement(reply.body()));
            next = nextPage(reply.body());
            pages++;
        }
        if (next != null) {
            log.warn("action=klaviyo_engagement_truncated destinationId={} pages={}", destination.getId(), pages);
        }
        return events;
    }

    private static String nextPage(JsonNode body) {
        JsonNode next = body.path("links").path("next");
        return next.isTextual() && !next.asText().isBlank() ? next.asText() : null;
    }

    List<EngagementEvent> parseEngagement(JsonNode body) {
        Map<String, JsonNode> profiles = new HashMap<>();
        Map<String, String> metricNames = new HashMap<>();
        for (JsonNode included : body.path("included")) {
            String type = included.path("type").asText();
            String id = included.path("id").asText();
            if ("profile".equals(type)) {
                profiles.put(id, included.path("attributes"));
            } else if ("metric".equals(type)) {
                metricNames.put(id, included.path("attributes").path("name").asText(null));
            }
        }

        List<EngagementEvent> events = new ArrayList<>();
        for (JsonNode item : body.path("data")) {
            String profileId = item.path("relationships").path("profile").path("data").path("id").asText(null);
            String metricId = item.path("relationships").path("metric").path("data").path("id").asText(null);
            JsonNode profile = profileId != null ? profiles.get(profileId) : null;
            String email = profile != null ? profile.path("email").asText(null) : null;
            if (email == null || email.isBlank()) {
                continue;
            }
            String metricName = metricId != null ? metricNames.getOrDefault(metricId, "Unknown") : "Unknown";
            Instant occurredAt = parseInstant(item.path("attributes").path("datetime").asText(null));
            if (occurredAt == null) {
                continue;
            }

            Map<String, Object> properties = new LinkedHashMap<>(
                    toMap(item.path("attributes").path("event_properties")));
            properties.put("klaviyo_metric_id", metricId);
            properties.put("klaviyo_profile_id", profileId);
            events.add(new EngagementEvent(item.path("id").asText(), email, metricName, occurredAt, properties));
        }
        return events;
    }

    // ─────────────────── Transport ───────────────────

    private Reply call(String operation, Destination destination, HttpMethod method,
            Function<UriBuilder, URI> uri, Object body) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            WebClient.RequestBodySpec bodySpec = webClient.method(method)
                    .uri(uri)
                    .header(HttpHeaders.AUTHORIZATION, "Klaviyo-API-Key " + destination.getApiKey());
            WebClient.RequestHeadersSpec<?> request = body != null
                    ? bodySpec.contentType(MediaType.APPLICATION_JSON).bodyValue(body)
                    : bodySpec;
            Reply reply = request.exchangeToMono(response -> response.bodyToMono(String.class)
                    .defaultIfEmpty("")
                    .map(raw -> new Reply(response.statusCode().value(), raw, readTree(raw))))
                    .block(timeout);
            if (reply == null) {
                throw DestinationException.timeout(operation, null);
            }
            outcome = String.valueOf(reply.status());
            return reply;
        } catch (WebClientRequestException e) {
            log.warn("action=klaviyo_request_failed operation={} destinationId={} error={}",
                    operation, destination.getId(), e.getMessage());
            throw new DestinationException(operation + " request failed: " + e.getMessage(), 0, true, e);
        } catch (IllegalStateException e) {
            // block(timeout) expired
            log.warn("action=klaviyo_timeout operation={} destinationId={}", operation, destination.getId());
            throw DestinationException.timeout(operation, e);
        } finally {
            sample.stop(meterRegistry.timer("identity_sync.destination.call",
                    "operation", operation, "status", outcome));
        }
    }

    private void requireSuccess(String operation, Reply reply) {
        if (reply.status() < 200 || reply.status() >= 300) {
            log.warn("action=klaviyo_call_rejected operation={} status={}", operation, reply.status());
            throw DestinationException.forStatus(operation, reply.status(), reply.raw());
        }
    }

    private static Map<String, Object> document(String type, String id, Map<String, Object> attributes) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type);
        if (id != null) {
            data.put("id", id);
        }
        data.put("attributes", attributes);
        return Map.of("data", data);
    }

    private JsonNode readTree(String raw) {
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            log.debug("action=klaviyo_body_not_json length={}", raw.length());
            return objectMapper.createObjectNode();
        }
    }

    private Map<String, Object> toMap(JsonNode node) {
        if (node == null || !node.isObject()) {
            return Map.of();
        }
        return objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {
        });
    }

    private static Instant parseInstant(String value) {
        if (value == null) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    record Reply(int status, String raw, JsonNode body) {
    }
}
