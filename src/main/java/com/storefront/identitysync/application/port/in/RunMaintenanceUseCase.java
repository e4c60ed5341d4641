package com.storefront.identitysync.application.port.in;

import java.util.List;

/**
 * Primary (inbound) port: periodic background maintenance.
 * Every step runs and reports on its own; one failing step never stops the next.
 */
public interface RunMaintenanceUseCase {

    MaintenanceReport runMaintenance();

    record StepResult(String name, boolean success, int processed, String error, long durationMs) {
    }

    record MaintenanceReport(List<StepResult> steps, long durationMs) {

        public boolean allSucceeded() {
            return steps.stream().allMatch(StepResult::success);
        }
    }
}
