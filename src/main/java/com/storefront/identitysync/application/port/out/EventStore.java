package com.storefront.identitysync.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.storefront.identitysync.domain.entity.TrackedEvent;
import com.storefront.identitysync.domain.valueobject.EventStatus;

/**
 * Secondary (outbound) port: tracked event persistence.
 * <p>
 * {@code dedupeKey} is unique per workspace; inserting a second event with the
 * same key is a no-op reported through the return value.
 * </p>
 */
public interface EventStore {

    /**
     * @return true if stored, false if the dedupe key already exists
     */
    boolean insert(TrackedEvent event);

    Optional<TrackedEvent> findById(String eventId);

    Optional<TrackedEvent> findByDedupeKey(String workspaceId, String dedupeKey);

    /** Bumps the duplicate counter of the stored event. */
    void recordDuplicate(String workspaceId, String dedupeKey);

    void attach(String eventId, String unifiedUserId);

    /**
     * Reassigns events carrying the anonymous id whose owner is null or
     * different.
     *
     * @return events relinked
     */
    int relinkByAnonymousId(String workspaceId, String anonymousId, String unifiedUserId);

    int reassign(String fromUserId, String toUserId);

    void markStatus(String eventId, EventStatus status);

    /**
     * @return events of the identity at or after {@code since}, oldest first
     */
    List<TrackedEvent> findByUnifiedUserSince(String unifiedUserId, Instant since);

    long countAll();
}
