package com.storefront.identitysync.adapters.in.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.storefront.identitysync.adapters.in.scheduler.SyncOutcomeRecorder;
import com.storefront.identitysync.application.port.in.DrainSyncQueueUseCase;
import com.storefront.identitysync.application.port.in.DrainSyncQueueUseCase.DrainSummary;
import com.storefront.identitysync.application.port.in.RunMaintenanceUseCase;
import com.storefront.identitysync.application.port.in.RunMaintenanceUseCase.MaintenanceReport;
import com.storefront.identitysync.bootstrap.config.IdentitySyncProperties;

/**
 * On-demand triggers for the background work, for operators and cron
 * callers outside the scheduler.
 */
@RestController
@RequestMapping("/internal")
public class InternalOpsController {

    private static final Logger log = LoggerFactory.getLogger(InternalOpsController.class);

    private final DrainSyncQueueUseCase drainSyncQueueUseCase;
    private final RunMaintenanceUseCase runMaintenanceUseCase;
    private final SyncOutcomeRecorder outcomeRecorder;
    private final int defaultBatchSize;

    public InternalOpsController(DrainSyncQueueUseCase drainSyncQueueUseCase,
            RunMaintenanceUseCase runMaintenanceUseCase,
            SyncOutcomeRecorder outcomeRecorder,
            IdentitySyncProperties properties) {
        this.drainSyncQueueUseCase = drainSyncQueueUseCase;
        this.runMaintenanceUseCase = runMaintenanceUseCase;
        this.outcomeRecorder = outcomeRecorder;
        this.defaultBatchSize = Math.max(1, properties.getSync().getBatchSize());
    }

    @PostMapping("/sync/drain")
    public ResponseEntity<Map<String, Object>> drain(
            @RequestParam(name = "limit", required = false) Integer limit) {
        int effectiveLimit = limit != null ? Math.min(Math.max(limit, 1), 500) : defaultBatchSize;
        try {
            DrainSummary summary = outcomeRecorder.record(drainSyncQueueUseCase.drain(effectiveLimit));

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("claimed", summary.claimed());
            body.put("synced", summary.synced());
            body.put("skipped", summary.skipped());
            body.put("blocked", summary.blocked());
            body.put("retried", summary.retried());
            body.put("failed", summary.failed());
            return ResponseEntity.ok(body);

        } catch (Exception e) {
            log.error("action=sync_drain_error error={}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Unable to drain sync queue"));
        }
    }

    @PostMapping("/maintenance/run")
    public ResponseEntity<Map<String, Object>> runMaintenance() {
        try {
            MaintenanceReport report = runMaintenanceUseCase.runMaintenance();
            List<Map<String, Object>> steps = report.steps().stream()
                    .map(step -> {
                        Map<String, Object> item = new LinkedHashMap<>();
                        item.put("name", step.name());
                        item.put("success", step.success());
                        item.put("processed", step.processed());
                        item.put("error", step.error());
                        item.put("duration_ms", step.durationMs());
                        return item;
                    })
                    .collect(Collectors.toList());

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("success", report.allSucceeded());
            body.put("steps", steps);
            body.put("duration_ms", report.durationMs());
            return ResponseEntity.ok(body);

        } catch (Exception e) {
            log.error("action=maintenance_error error={}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "Unable to run maintenance"));
        }
    }
}
