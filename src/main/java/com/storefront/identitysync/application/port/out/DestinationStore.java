package com.storefront.identitysync.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.storefront.identitysync.domain.entity.Destination;

public interface DestinationStore {

    Optional<Destination> findById(String destinationId);

    /**
     * @return the enabled destination that receives syncs for the workspace
     */
    Optional<Destination> findActiveForWorkspace(String workspaceId);

    List<Destination> findAllEnabled();

    /** Sets lastSyncAt and clears lastError. */
    void recordSuccess(String destinationId, Instant at);

    void recordError(String destinationId, String error, Instant at);
}
