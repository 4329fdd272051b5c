package com.zzf.localagent.task;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;

class TaskMetricsTest {

    @Test
    void testRecordCompleted() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        TaskMetrics metrics = new TaskMetrics(registry);

        metrics.recordCompleted("QUERY", TaskStatus.SUCCEEDED, 120);
        metrics.recordCompleted("QUERY", TaskStatus.SUCCEEDED, 80);
        metrics.recordCompleted("REVERT", TaskStatus.FAILED, 5);

        assertEquals(2.0, registry.get("localagent.tasks.completed").tag("status", "succeeded").counter().count());
        assertEquals(1.0, registry.get("localagent.tasks.completed").tag("status", "failed").counter().count());
        assertEquals(2, registry.get("localagent.tasks.duration").tag("type", "QUERY").timer().count());
        assertEquals(200.0, registry.get("localagent.tasks.duration").tag("type", "QUERY").timer().totalTime(TimeUnit.MILLISECONDS));
    }
}
