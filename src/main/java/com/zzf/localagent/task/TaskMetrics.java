package com.zzf.localagent.task;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;

/**
 * Micrometer meters of the task worker.
 */
public class TaskMetrics {

    private final MeterRegistry registry;

    public TaskMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordCompleted(String type, TaskStatus status, long ms) {
        Counter.builder("localagent.tasks.completed")
                .tag("status", status.wireName())
                .register(registry)
                .increment();
        Timer.builder("localagent.tasks.duration")
                .tag("type", type)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
