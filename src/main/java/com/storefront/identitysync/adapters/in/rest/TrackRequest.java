package com.storefront.identitysync.adapters.in.rest;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.storefront.identitysync.application.port.in.IngestEventUseCase.IngestCommand;

/**
 * Server-track body. The Kafka feed carries the same shape plus
 * {@code workspace_id}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TrackRequest {

    @JsonProperty("workspace_id")
    private String workspaceId;

    @JsonProperty("event_type")
    private String eventType;

    @JsonProperty("event_name")
    private String eventName;

    @JsonProperty("properties")
    private Map<String, Object> properties;

    @JsonProperty("anonymous_id")
    private String anonymousId;

    @JsonProperty("email")
    private String email;

    @JsonProperty("customer_id")
    private String customerId;

    @JsonProperty("phone")
    private String phone;

    @JsonProperty("client_ip")
    private String clientIp;

    @JsonProperty("user_agent")
    private String userAgent;

    @JsonProperty("source")
    private String source;

    @JsonProperty("timestamp")
    private String timestamp;

    @JsonProperty("dedupe_key")
    private String dedupeKey;

    /**
     * @param workspace owning workspace; for HTTP calls this comes from the API
     *                  key, never from the body
     */
    public IngestCommand toCommand(String workspace, String fallbackSource) {
        return new IngestCommand(
                workspace,
                eventType != null && !eventType.isBlank() ? eventType : "track",
                eventName,
                properties != null ? properties : Map.of(),
                anonymousId,
                email,
                customerId,
                phone,
                clientIp,
                userAgent,
                source != null && !source.isBlank() ? source : fallbackSource,
                parseTimestamp(timestamp),
                dedupeKey);
    }

    private static Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("timestamp must be ISO-8601: " + value, e);
        }
    }

    // Getters/Setters for Jackson
    public String getWorkspaceId() {
        return workspaceId;
    }

    public void setWorkspaceId(String workspaceId) {
        this.workspaceId = workspaceId;
    }

    public String getEventType() {
        return eventType;
    }

    public void setEventType(String eventType) {
        this.eventType = eventType;
    }

    public String getEventName() {
        return eventName;
    }

    public void setEventName(String eventName) {
        this.eventName = eventName;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public void setProperties(Map<String, Object> properties) {
        this.properties = properties;
    }

    public String getAnonymousId() {
        return anonymousId;
    }

    public void setAnonymousId(String anonymousId) {
        this.anonymousId = anonymousId;
    }

    public String getEmail() {
        return email;
    }

    public void setEmail(String email) {
        this.email = email;
    }

    public String getCustomerId() {
        return customerId;
    }

    public void setCustomerId(String customerId) {
        this.customerId = customerId;
    }

    public String getPhone() {
        return phone;
    }

    public void setPhone(String phone) {
        this.phone = phone;
    }

    public String getClientIp() {
        return clientIp;
    }

    public void setClientIp(String clientIp) {
        this.clientIp = clientIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getDedupeKey() {
        return dedupeKey;
    }

    public void setDedupeKey(String dedupeKey) {
        this.dedupeKey = dedupeKey;
    }
}
