package com.storefront.identitysync.support;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.valueobject.JobStatus;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncReason;

public class InMemorySyncJobStore implements SyncJobStore {

    private final Map<String, SyncJob> jobs = new LinkedHashMap<>();

    public List<SyncJob> all() {
        return new ArrayList<>(jobs.values());
    }

    public List<SyncJob> ofType(JobType type) {
        return jobs.values().stream().filter(j -> j.getJobType() == type).collect(Collectors.toList());
    }

    public SyncJob get(String id) {
        return jobs.get(id);
    }

    @Override
    public void insert(SyncJob job) {
        jobs.put(job.getId(), job);
    }

    @Override
    public boolean hasActiveJob(String unifiedUserId, JobType jobType) {
        return jobs.values().stream().anyMatch(j -> j.getUnifiedUserId().equals(unifiedUserId)
                && j.getJobType() == jobType && isActive(j));
    }

    @Override
    public boolean hasActiveJob(String unifiedUserId, JobType jobType, SyncReason reason) {
        return jobs.values().stream().anyMatch(j -> j.getUnifiedUserId().equals(unifiedUserId)
                && j.getJobType() == jobType && j.getReason() == reason && isActive(j));
    }

    @Override
    public boolean hasJobForEvent(String eventId) {
        return jobs.values().stream().anyMatch(j -> eventId.equals(j.getEventId()));
    }

    @Override
    public List<SyncJob> claimDue(Instant now, int limit) {
        List<SyncJob> due = jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.PENDING && !j.getScheduledAt().isAfter(now)
                        && j.getAttempts() < j.getMaxAttempts())
                .sorted(Comparator.comparing(SyncJob::getScheduledAt))
                .limit(limit)
                .collect(Collectors.toList());
        List<SyncJob> claimed = new ArrayList<>();
        for (SyncJob job : due) {
            SyncJob running = job.start(now);
            jobs.put(running.getId(), running);
            claimed.add(running);
        }
        return claimed;
    }

    @Override
    public void update(SyncJob job) {
        jobs.put(job.getId(), job);
    }

    @Override
    public int reassign(String fromUserId, String toUserId) {
        int moved = 0;
        for (Map.Entry<String, SyncJob> entry : jobs.entrySet()) {
            SyncJob j = entry.getValue();
            if (j.getUnifiedUserId().equals(fromUserId)) {
                entry.setValue(new SyncJob(j.getId(), j.getWorkspaceId(), j.getDestinationId(), toUserId,
                        j.getEventId(), j.getJobType(), j.getStatus(), j.getReason(), j.getAttempts(),
                        j.getMaxAttempts(), j.getLastError(), j.getScheduledAt(), j.getStartedAt(),
                        j.getCompletedAt(), j.getCreatedAt()));
                moved++;
            }
        }
        return moved;
    }

    @Override
    public int releaseStale(Instant startedBefore) {
        int released = 0;
        for (Map.Entry<String, SyncJob> entry : jobs.entrySet()) {
            SyncJob j = entry.getValue();
            if (j.getStatus() == JobStatus.RUNNING && j.getStartedAt() != null
                    && j.getStartedAt().isBefore(startedBefore)) {
                JobStatus next = j.getAttempts() < j.getMaxAttempts() ? JobStatus.PENDING : JobStatus.FAILED;
                entry.setValue(new SyncJob(j.getId(), j.getWorkspaceId(), j.getDestinationId(),
                        j.getUnifiedUserId(), j.getEventId(), j.getJobType(), next, j.getReason(),
                        j.getAttempts(), j.getMaxAttempts(), "Released after stalling in running state",
                        j.getScheduledAt(), null, next == JobStatus.FAILED ? startedBefore : null,
                        j.getCreatedAt()));
                released++;
            }
        }
        return released;
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (SyncJob job : jobs.values()) {
            counts.merge(job.getStatus(), 1L, Long::sum);
        }
        return counts;
    }

    @Override
    public List<SyncJob> findRecentFailures(int limit) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == JobStatus.FAILED)
                .limit(limit)
                .collect(Collectors.toList());
    }

    private static boolean isActive(SyncJob job) {
        return job.getStatus() == JobStatus.PENDING || job.getStatus() == JobStatus.RUNNING;
    }
}
