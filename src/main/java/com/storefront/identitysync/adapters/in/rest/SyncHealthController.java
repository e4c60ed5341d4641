package com.storefront.identitysync.adapters.in.rest;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.storefront.identitysync.application.port.out.EventStore;
import com.storefront.identitysync.application.port.out.IdentityStore;
import com.storefront.identitysync.application.port.out.SyncJobStore;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;
import com.storefront.identitysync.domain.entity.SyncJob;
import com.storefront.identitysync.domain.valueobject.JobStatus;

@RestController
@RequestMapping("/internal/sync")
public class SyncHealthController {

    private static final Logger log = LoggerFactory.getLogger(SyncHealthController.class);

    private final SyncJobStore syncJobStore;
    private final IdentityStore identityStore;
    private final EventStore eventStore;
    private final int defaultRecentFailuresLimit;

    public SyncHealthController(SyncJobStore syncJobStore,
            IdentityStore identityStore,
            EventStore eventStore,
            IdentitySyncProperties properties) {
        this.syncJobStore = syncJobStore;
        this.identityStore = identityStore;
        this.eventStore = eventStore;
        this.defaultRecentFailuresLimit = Math.max(1, properties.getDashboard().getRecentFailuresLimit());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats(
            @RequestParam(name = "recentLimit", required = false) Integer recentLimit) {
        try {
            int effectiveLimit = normalizeLimit(recentLimit);

            Map<JobStatus, Long> counts = syncJobStore.countByStatus();
            Map<String, Long> jobsByStatus = new LinkedHashMap<>();
            for (JobStatus status : JobStatus.values()) {
                jobsByStatus.put(status.getValue(), counts.getOrDefault(status, 0L));
            }

            List<SyncJob> failures = syncJobStore.findRecentFailures(effectiveLimit);
            List<Map<String, Object>> recentFailures = failures.stream()
                    .map(job -> {
                        Map<String, Object> item = new HashMap<>();
                        item.put("jobId", job.getId());
                        item.put("unifiedUserId", job.getUnifiedUserId());
                        item.put("jobType", job.getJobType().getValue());
                        item.put("attempts", job.getAttempts());
                        item.put("lastError", job.getLastError());
                        item.put("completedAt", job.getCompletedAt() != null ? job.getCompletedAt().toString() : null);
                        return item;
                    })
                    .collect(Collectors.toList());

            long totalIdentities = identityStore.countAll();
            long identitiesWithEmail = identityStore.countWithEmail();

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("totalEvents", eventStore.countAll());
            stats.put("totalIdentities", totalIdentities);
            stats.put("identitiesWithEmail", identitiesWithEmail);
            stats.put("anonymousIdentities", totalIdentities - identitiesWithEmail);
            stats.put("jobsByStatus", jobsByStatus);
            stats.put("recentFailures", recentFailures);
            stats.put("recentFailuresLimit", effectiveLimit);
            return ResponseEntity.ok(stats);

        } catch (Exception e) {
            log.error("action=sync_stats_error error={}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(
                    Map.of("error", "Unable to load sync stats"));
        }
    }

    private int normalizeLimit(Integer limit) {
        int candidate = limit != null ? limit : defaultRecentFailuresLimit;
        return Math.min(Math.max(candidate, 1), 100);
    }
}
