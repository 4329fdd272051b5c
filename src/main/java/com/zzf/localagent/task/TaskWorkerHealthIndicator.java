package com.zzf.localagent.task;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the task worker's liveness and counters.
 */
public class TaskWorkerHealthIndicator implements HealthIndicator {

    private final TaskWorker worker;

    public TaskWorkerHealthIndicator(TaskWorker worker) {
        this.worker = worker;
    }

    @Override
    public Health health() {
        TaskWorker.Status s = worker.status();
        Health.Builder builder = s.running ? Health.up() : Health.unknown().withDetail("reason", "worker not started");
        builder.withDetail("processed", s.processed)
                .withDetail("failed", s.failed)
                .withDetail("startedAt", s.startedAt)
                .withDetail("lastTick", s.lastTick);
        if (s.currentTask != null) {
            builder.withDetail("currentTask", s.currentTask);
        }
        if (s.lastError != null) {
            builder.withDetail("lastError", s.lastError);
        }
        return builder.build();
    }
}
