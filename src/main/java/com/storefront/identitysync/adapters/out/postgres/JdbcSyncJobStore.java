package com.storefront.identitysync.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.valueobject.JobStatus;
import com.storefront.identitysync.domain.valueobject.JobType;
import com.storefront.identitysync.domain.valueobject.SyncReason;

/**
 * PostgreSQL implementation of the SyncJobStore outbound port.
 * <p>
 * Claiming uses {@code FOR UPDATE SKIP LOCKED} so concurrent workers never
 * receive the same job.
 * </p>
 */
@Component
public class JdbcSyncJobStore implements SyncJobStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSyncJobStore.class);

    private static final String COLUMNS = "id, workspace_id, destination_id, unified_user_id, event_id, job_type, "
            + "status, reason, attempts, max_attempts, last_error, scheduled_at, started_at, completed_at, created_at";

    private static final String INSERT_SQL = "INSERT INTO sync_jobs (" + COLUMNS + ") "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String ACTIVE_JOB_SQL = "SELECT EXISTS (SELECT 1 FROM sync_jobs "
            + "WHERE unified_user_id = ? AND job_type = ? AND status IN ('pending', 'running'))";

    private static final String ACTIVE_JOB_WITH_REASON_SQL = "SELECT EXISTS (SELECT 1 FROM sync_jobs "
            + "WHERE unified_user_id = ? AND job_type = ? AND reason = ? AND status IN ('pending', 'running'))";

    private static final String JOB_FOR_EVENT_SQL = "SELECT EXISTS (SELECT 1 FROM sync_jobs WHERE event_id = ?)";

    private static final String CLAIM_SQL = "UPDATE sync_jobs SET status = 'running', attempts = attempts + 1, "
            + "started_at = ? WHERE id IN (SELECT id FROM sync_jobs WHERE status = 'pending' "
            + "AND scheduled_at <= ? AND attempts < max_attempts ORDER BY scheduled_at "
            + "LIMIT ? FOR UPDATE SKIP LOCKED) RETURNING " + COLUMNS;

    private static final String UPDATE_SQL = "UPDATE sync_jobs SET status = ?, attempts = ?, last_error = ?, "
            + "scheduled_at = ?, started_at = ?, completed_at = ? WHERE id = ?";

    private static final String REASSIGN_SQL = "UPDATE sync_jobs SET unified_user_id = ? WHERE unified_user_id = ?";

    private static final String RELEASE_STALE_SQL = "UPDATE sync_jobs SET "
            + "status = CASE WHEN attempts < max_attempts THEN 'pending' ELSE 'failed' END, "
            + "last_error = 'Released after stalling in running state', started_at = NULL, "
            + "completed_at = CASE WHEN attempts < max_attempts THEN NULL ELSE now() END "
            + "WHERE status = 'running' AND started_at < ?";

    private static final String COUNT_BY_STATUS_SQL = "SELECT status, COUNT(*) AS cnt FROM sync_jobs GROUP BY status";

    private static final String RECENT_FAILURES_SQL = "SELECT " + COLUMNS + " FROM sync_jobs "
            + "WHERE status = 'failed' ORDER BY completed_at DESC NULLS LAST LIMIT ?";

    private final JdbcTemplate jdbcTemplate;

    public JdbcSyncJobStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public void insert(SyncJob job) {
        jdbcTemplate.update(INSERT_SQL,
                job.getId(),
                job.getWorkspaceId(),
                job.getDestinationId(),
                job.getUnifiedUserId(),
                job.getEventId(),
                job.getJobType().getValue(),
                job.getStatus().getValue(),
                job.getReason() != null ? job.getReason().getValue() : null,
                job.getAttempts(),
                job.getMaxAttempts(),
                job.getLastError(),
                timestamp(job.getScheduledAt()),
                timestamp(job.getStartedAt()),
                timestamp(job.getCompletedAt()),
                timestamp(job.getCreatedAt()));
        log.debug("action=sync_job_inserted jobId={} type={} unifiedUserId={}",
                job.getId(), job.getJobType().getValue(), job.getUnifiedUserId());
    }

    @Override
    public boolean hasActiveJob(String unifiedUserId, JobType jobType) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(ACTIVE_JOB_SQL, Boolean.class,
                unifiedUserId, jobType.getValue()));
    }

    @Override
    public boolean hasActiveJob(String unifiedUserId, JobType jobType, SyncReason reason) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(ACTIVE_JOB_WITH_REASON_SQL, Boolean.class,
                unifiedUserId, jobType.getValue(), reason.getValue()));
    }

    @Override
    public boolean hasJobForEvent(String eventId) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(JOB_FOR_EVENT_SQL, Boolean.class, eventId));
    }

    @Override
    public List<SyncJob> claimDue(Instant now, int limit) {
        List<SyncJob> claimed = jdbcTemplate.query(CLAIM_SQL, (rs, rowNum) -> mapRow(rs),
                Timestamp.from(now), Timestamp.from(now), limit);
        if (!claimed.isEmpty()) {
            log.debug("action=sync_jobs_claimed count={}", claimed.size());
        }
        return claimed.stream()
                .sorted(Comparator.comparing(SyncJob::getScheduledAt))
                .collect(Collectors.toList());
    }

    @Override
    public void update(SyncJob job) {
        jdbcTemplate.update(UPDATE_SQL,
                job.getStatus().getValue(),
                job.getAttempts(),
                job.getLastError(),
                timestamp(job.getScheduledAt()),
                timestamp(job.getStartedAt()),
                timestamp(job.getCompletedAt()),
                job.getId());
    }

    @Override
    public int reassign(String fromUserId, String toUserId) {
        return jdbcTemplate.update(REASSIGN_SQL, toUserId, fromUserId);
    }

    @Override
    public int releaseStale(Instant startedBefore) {
        int released = jdbcTemplate.update(RELEASE_STALE_SQL, Timestamp.from(startedBefore));
        if (released > 0) {
            log.warn("action=stale_jobs_released count={} startedBefore={}", released, startedBefore);
        }
        return released;
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        jdbcTemplate.query(COUNT_BY_STATUS_SQL, rs -> {
            counts.put(JobStatus.fromValue(rs.getString("status")), rs.getLong("cnt"));
        });
        return counts;
    }

    @Override
    public List<SyncJob> findRecentFailures(int limit) {
        return jdbcTemplate.query(RECENT_FAILURES_SQL, (rs, rowNum) -> mapRow(rs), limit);
    }

    // ─────────────────── Private Helpers ───────────────────

    private SyncJob mapRow(ResultSet rs) throws SQLException {
        String reason = rs.getString("reason");
        return new SyncJob(
                rs.getString("id"),
                rs.getString("workspace_id"),
                rs.getString("destination_id"),
                rs.getString("unified_user_id"),
                rs.getString("event_id"),
                JobType.fromValue(rs.getString("job_type")),
                JobStatus.fromValue(rs.getString("status")),
                SyncReason.fromValue(reason),
                rs.getInt("attempts"),
                rs.getInt("max_attempts"),
                rs.getString("last_error"),
                instant(rs.getTimestamp("scheduled_at")),
                instant(rs.getTimestamp("started_at")),
                instant(rs.getTimestamp("completed_at")),
                instant(rs.getTimestamp("created_at")));
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
