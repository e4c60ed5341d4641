package com.storefront.identitysync.domain.entity;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

import com.storefront.identitysync.domain.valueobject.JobStatus;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncReason;

/**
 * One unit of outbound work towards a destination.
 * <p>
 * <b>IMMUTABLE:</b> every transition returns a NEW instance and rejects moves
 * the lifecycle does not allow.
 * </p>
 *
 * <pre>
 *   PENDING ──[claim]──→ RUNNING
 *   RUNNING ──[complete]──→ COMPLETED
 *   RUNNING ──[retry]──→ PENDING (scheduledAt = now + 2^attempts min)
 *   RUNNING ──[fail]──→ FAILED
 *   RUNNING ──[release]──→ PENDING (crashed worker)
 * </pre>
 */
public final class SyncJob {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;

    private final String id;
    private final String workspaceId;
    private final String destinationId;
    private final String unifiedUserId;
    private final String eventId;
    private final JobType jobType;
    private final JobStatus status;
    private final SyncReason reason;
    private final int attempts;
    private final int maxAttempts;
    private final String lastError;
    private final Instant scheduledAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant createdAt;

    public SyncJob(String id, String workspaceId, String destinationId, String unifiedUserId,
            String eventId, JobType jobType, JobStatus status, SyncReason reason,
            int attempts, int maxAttempts, String lastError,
            Instant scheduledAt, Instant startedAt, Instant completedAt, Instant createdAt) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (workspaceId == null || destinationId == null || unifiedUserId == null) {
            throw new IllegalArgumentException("workspaceId, destinationId and unifiedUserId are required");
        }
        if (jobType == null || status == null) {
            throw new IllegalArgumentException("jobType and status cannot be null");
        }
        if (jobType == JobType.EVENT_TRACK && eventId == null) {
            throw new IllegalArgumentException("event_track jobs must reference an event");
        }
        if (attempts < 0 || maxAttempts < 1) {
            throw new IllegalArgumentException("attempts must be >= 0 and maxAttempts >= 1");
        }
        if (scheduledAt == null) {
            throw new IllegalArgumentException("scheduledAt cannot be null");
        }

        this.id = id;
        this.workspaceId = workspaceId;
        this.destinationId = destinationId;
        this.unifiedUserId = unifiedUserId;
        this.eventId = eventId;
        this.jobType = jobType;
        this.status = status;
        this.reason = reason != null ? reason : SyncReason.OPPORTUNISTIC;
        this.attempts = attempts;
        this.maxAttempts = maxAttempts;
        this.lastError = lastError;
        this.scheduledAt = scheduledAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.createdAt = createdAt != null ? createdAt : scheduledAt;
    }

    // ─────────────────── Factory Methods ───────────────────

    public static SyncJob profileUpsert(String workspaceId, String destinationId, String unifiedUserId,
            SyncReason reason, int maxAttempts, Instant now) {
        return new SyncJob(UUID.randomUUID().toString(), workspaceId, destinationId, unifiedUserId,
                null, JobType.PROFILE_UPSERT, JobStatus.PENDING, reason, 0, maxAttempts,
                null, now, null, null, now);
    }

    public static SyncJob eventTrack(String workspaceId, String destinationId, String unifiedUserId,
            String eventId, SyncReason reason, int maxAttempts, Instant now) {
        return new SyncJob(UUID.randomUUID().toString(), workspaceId, destinationId, unifiedUserId,
                eventId, JobType.EVENT_TRACK, JobStatus.PENDING, reason, 0, maxAttempts,
                null, now, null, null, now);
    }

    // ─────────────────── Transitions ───────────────────

    /**
     * Claim for processing: RUNNING with one more attempt.
     */
    public SyncJob start(Instant now) {
        requireStatus(JobStatus.PENDING, "start");
        return copy(JobStatus.RUNNING, attempts + 1, lastError, scheduledAt, now, null);
    }

    /**
     * Successful (or expected no-op) completion. The note is kept in lastError
     * for operator visibility, e.g. "Skipped - no email".
     */
    public SyncJob complete(Instant now, String note) {
        requireStatus(JobStatus.RUNNING, "complete");
        return copy(JobStatus.COMPLETED, attempts, note, scheduledAt, startedAt, now);
    }

    /**
     * Back to PENDING with exponential backoff: now + 2^attempts minutes.
     */
    public SyncJob retryLater(Instant now, String error) {
        requireStatus(JobStatus.RUNNING, "retry");
        if (!canRetry()) {
            throw new IllegalStateException("job " + id + " exhausted " + maxAttempts + " attempts");
        }
        return copy(JobStatus.PENDING, attempts, error, now.plus(backoffFor(attempts)), startedAt, null);
    }

    public SyncJob fail(Instant now, String error) {
        requireStatus(JobStatus.RUNNING, "fail");
        return copy(JobStatus.FAILED, attempts, error, scheduledAt, startedAt, now);
    }

    public boolean canRetry() {
        return attempts < maxAttempts;
    }

    public static Duration backoffFor(int attempts) {
        return Duration.ofMinutes(1L << Math.min(Math.max(attempts, 0), 20));
    }

    private void requireStatus(JobStatus expected, String transition) {
        if (status != expected) {
            throw new IllegalStateException(
                    "Cannot " + transition + " job " + id + " in status " + status);
        }
    }

    private SyncJob copy(JobStatus newStatus, int newAttempts, String newError,
            Instant newScheduledAt, Instant newStartedAt, Instant newCompletedAt) {
        return new SyncJob(id, workspaceId, destinationId, unifiedUserId, eventId, jobType,
                newStatus, reason, newAttempts, maxAttempts, newError, newScheduledAt,
                newStartedAt, newCompletedAt, createdAt);
    }

    // ─────────────────── Getters ───────────────────

    public String getId() {
        return id;
    }

    public String getWorkspaceId() {
        return workspaceId;
    }

    public String getDestinationId() {
        return destinationId;
    }

    public String getUnifiedUserId() {
        return unifiedUserId;
    }

    public String getEventId() {
        return eventId;
    }

    public JobType getJobType() {
        return jobType;
    }

    public JobStatus getStatus() {
        return status;
    }

    public SyncReason getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getScheduledAt() {
        return scheduledAt;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        return Objects.equals(id, ((SyncJob) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncJob{id='" + id
                + "', type=" + jobType
                + ", status=" + status
                + ", reason=" + reason
                + ", attempts=" + attempts + "/" + maxAttempts
                + ", unifiedUserId='" + unifiedUserId + "'}";
    }
}
