package com.storefront.identitysync.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.valueobject.JobStatus;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncReason;

/**
 * Secondary (outbound) port: durable outbound job queue.
 */
public interface SyncJobStore {

    void insert(SyncJob job);

    /** @return true if a pending/running job of the type exists for the identity */
    boolean hasActiveJob(String unifiedUserId, JobType jobType);

    /** @return true if a pending/running job of the type and reason exists */
    boolean hasActiveJob(String unifiedUserId, JobType jobType, SyncReason reason);

    boolean hasJobForEvent(String eventId);

    /**
     * Atomically claims due jobs: pending, {@code scheduled_at <= now},
     * {@code attempts < max_attempts}, oldest first. Claimed rows come back
     * RUNNING with their attempt counter already incremented. Concurrent
     * claimers never receive the same job.
     */
    List<SyncJob> claimDue(Instant now, int limit);

    void update(SyncJob job);

    int reassign(String fromUserId, String toUserId);

    /**
     * Returns RUNNING jobs started before the cutoff to PENDING.
     *
     * @return jobs released
     */
    int releaseStale(Instant startedBefore);

    Map<JobStatus, Long> countByStatus();

    List<SyncJob> findRecentFailures(int limit);
}
