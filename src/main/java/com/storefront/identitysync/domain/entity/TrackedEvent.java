package com.storefront.identitysync.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.storefront.identitysync.domain.valueobject.EventCategory;
import com.storefront.identitysync.domain.valueobject.EventStatus;

/**
 * Immutable record of one tracked storefront or engagement occurrence.
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>id, workspaceId and eventName are non-blank</li>
 * <li>eventTime is non-null</li>
 * <li>properties is never null (empty map if not provided)</li>
 * <li>unifiedUserId is null until the event is resolved</li>
 * </ul>
 */
public final class TrackedEvent {

    /** Event type used for events synthesized from computed state. */
    public static final String DERIVED_TYPE = "derived";

    /** Event type used for engagement pulled back from the destination. */
    public static final String EMAIL_TYPE = "email";

    private final String id;
    private final String workspaceId;
    private final String unifiedUserId;
    private final String anonymousId;
    private final String eventType;
    private final String eventName;
    private final Map<String, Object> properties;
    private final Instant eventTime;
    private final String source;
    private final String dedupeKey;
    private final EventStatus status;

    public TrackedEvent(String id, String workspaceId, String unifiedUserId, String anonymousId,
            String eventType, String eventName, Map<String, Object> properties,
            Instant eventTime, String source, String dedupeKey, EventStatus status) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId cannot be null or blank");
        }
        if (eventName == null || eventName.isBlank()) {
            throw new IllegalArgumentException("eventName cannot be null or blank");
        }
        if (eventTime == null) {
            throw new IllegalArgumentException("eventTime cannot be null");
        }

        this.id = id;
        this.workspaceId = workspaceId;
        this.unifiedUserId = unifiedUserId;
        this.anonymousId = anonymousId;
        this.eventType = eventType != null && !eventType.isBlank() ? eventType : "track";
        this.eventName = eventName;
        this.properties = properties != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(properties))
                : Collections.emptyMap();
        this.eventTime = eventTime;
        this.source = source;
        this.dedupeKey = dedupeKey;
        this.status = status != null ? status : EventStatus.PENDING;
    }

    // ─────────────────── Factory Method ───────────────────

    /**
     * Creates a new, unresolved event with a generated id.
     */
    public static TrackedEvent create(String workspaceId, String anonymousId, String eventType,
            String eventName, Map<String, Object> properties, Instant eventTime,
            String source, String dedupeKey) {
        return new TrackedEvent(UUID.randomUUID().toString(), workspaceId, null, anonymousId,
                eventType, eventName, properties, eventTime, source, dedupeKey, EventStatus.PENDING);
    }

    // ─────────────────── Behavior Methods ───────────────────

    public EventCategory category() {
        return EventCategory.classify(eventType, eventName);
    }

    public boolean isDerived() {
        return DERIVED_TYPE.equals(eventType);
    }

    public TrackedEvent attachTo(String newUnifiedUserId) {
        return new TrackedEvent(id, workspaceId, newUnifiedUserId, anonymousId, eventType, eventName,
                properties, eventTime, source, dedupeKey, status);
    }

    public TrackedEvent withStatus(EventStatus newStatus) {
        return new TrackedEvent(id, workspaceId, unifiedUserId, anonymousId, eventType, eventName,
                properties, eventTime, source, dedupeKey, newStatus);
    }

    /**
     * @return first non-blank string value among the given property keys, or null
     */
    public String firstProperty(String... keys) {
        for (String key : keys) {
            Object value = properties.get(key);
            if (value != null && !String.valueOf(value).isBlank()) {
                return String.valueOf(value);
            }
        }
        return null;
    }

    // ─────────────────── Getters ───────────────────

    public String getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getUnifiedUserId() {
        return unifiedUserId;
    }

    public String getAnonymousId() {
        return anonymousId;
    }

    public String getEventType() {
        return eventType;
    }

    public String getEventName() {
        return eventName;
    }

    public Map<String, Object> getProperties() {
        return properties;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public String getSource() {
        return source;
    }

    public String getDedupeKey() {
        return dedupeKey;
    }

    public EventStatus getStatus() {
        return status;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        TrackedEvent that = (TrackedEvent) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TrackedEvent{id='" + id
                + "', workspaceId='" + workspaceId
                + "', eventName='" + eventName
                + "', unifiedUserId='" + unifiedUserId
                + "', eventTime=" + eventTime
                + ", status=" + status + "}";
    }
}
