package com.zzf.localagent.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class TaskWorkerTest {

    @TempDir
    Path tasksRoot;

    private TaskQueue queue;
    private TaskHandlerRegistry registry;
    private SimpleMeterRegistry meters;
    private TaskWorker worker;

    @BeforeEach
    void setUp() {
        queue = new TaskQueue(tasksRoot, new ObjectMapper());
        registry = new TaskHandlerRegistry(List.of());
        meters = new SimpleMeterRegistry();
        worker = new TaskWorker(queue, registry, new TaskMetrics(meters), Duration.ofMillis(50), false);
    }

    @AfterEach
    void tearDown() {
        worker.stop();
    }

    @Test
    void testSuccessfulTaskStoresResult() throws Exception {
        registry.register(handler("echo", task -> Map.of("echo", task.getPayload().get("text"))));
        String id = queue.submit("ECHO", Map.of("text", "hi"));

        assertTrue(worker.runOnce(Duration.ZERO));

        TaskMeta meta = queue.status(id);
        assertEquals(TaskStatus.SUCCEEDED, meta.getStatus());
        assertNotNull(meta.getStartedAt());
        assertNotNull(meta.getFinishedAt());
        assertEquals("hi", queue.readResult(id).orElseThrow().get("echo"));
        assertEquals("running ECHO", queue.readLogs(id, null).get(0).getMsg());
        assertEquals(1, worker.status().processed);
    }

    @Test
    void testNullResultIsStoredAsOk() throws Exception {
        registry.register(handler("NOOP", task -> null));
        String id = queue.submit("NOOP", Map.of());
        worker.runOnce(Duration.ZERO);
        assertEquals(Map.of("ok", true), queue.readResult(id).orElseThrow());
    }

    @Test
    void testFailureDoesNotBlockNextTask() throws Exception {
        registry.register(handler("BOOM", task -> {
            throw new IllegalStateException("exploded");
        }));
        registry.register(handler("SILENT", task -> {
            throw new RuntimeException();
        }));
        registry.register(handler("OK", task -> Map.of()));
        String boom = queue.submit("BOOM", Map.of());
        String silent = queue.submit("SILENT", Map.of());
        String ok = queue.submit("OK", Map.of());

        worker.runOnce(Duration.ZERO);
        worker.runOnce(Duration.ZERO);
        worker.runOnce(Duration.ZERO);

        assertEquals(TaskStatus.FAILED, queue.status(boom).getStatus());
        assertEquals("exploded", queue.status(boom).getError());
        assertEquals("RuntimeException", queue.status(silent).getError());
        assertEquals(TaskStatus.SUCCEEDED, queue.status(ok).getStatus());
        assertEquals(2, worker.status().failed);
        assertEquals("RuntimeException", worker.status().lastError);
        assertEquals(2.0, meters.get("localagent.tasks.completed").tag("status", "failed").counter().count());
        assertEquals(1.0, meters.get("localagent.tasks.completed").tag("status", "succeeded").counter().count());
    }

    @Test
    void testUnknownTypeFails() throws Exception {
        String id = queue.submit("MYSTERY", Map.of());
        worker.runOnce(Duration.ZERO);
        TaskMeta meta = queue.status(id);
        assertEquals(TaskStatus.FAILED, meta.getStatus());
        assertTrue(meta.getError().contains("no handler registered for task type"));
    }

    @Test
    void testCancelledTaskIsSkipped() throws Exception {
        List<String> seen = new ArrayList<>();
        registry.register(handler("QUERY", task -> {
            seen.add(task.getId());
            return null;
        }));
        String id = queue.submit("QUERY", Map.of());
        queue.cancel(id);

        assertTrue(worker.runOnce(Duration.ZERO));
        assertTrue(seen.isEmpty());
        assertEquals(TaskStatus.CANCELLED, queue.status(id).getStatus());
        assertEquals(0, worker.status().processed);
    }

    @Test
    void testEmptyQueueTimesOut() throws Exception {
        assertFalse(worker.runOnce(Duration.ofMillis(10)));
        assertTrue(worker.status().lastTick > 0);
    }

    @Test
    void testBackgroundLifecycleAndCancelWhileRunning() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        registry.register(handler("SLOW", task -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return Map.of("done", true);
        }));
        registry.register(handler("FAST", task -> null));
        worker.start();
        assertTrue(worker.isRunning());

        String slow = queue.submit("SLOW", Map.of());
        String fast = queue.submit("FAST", Map.of());
        assertTrue(started.await(5, TimeUnit.SECONDS));
        assertEquals(TaskStatus.RUNNING, queue.status(slow).getStatus());
        assertEquals(slow, worker.status().currentTask);
        assertEquals(TaskStatus.QUEUED, queue.status(fast).getStatus());

        assertFalse(queue.cancel(slow));
        release.countDown();

        waitFor(() -> queue.status(fast).getStatus() == TaskStatus.SUCCEEDED);
        assertEquals(TaskStatus.SUCCEEDED, queue.status(slow).getStatus());

        worker.stop();
        assertFalse(worker.isRunning());
    }

    @Test
    void testRestartWhileTaskInProgressNeverRunsTwoAtOnce() throws Exception {
        TaskWorker quickStop = new TaskWorker(queue, registry, new TaskMetrics(meters),
                Duration.ofMillis(20), false, Duration.ofMillis(50));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        registry.register(handler("BUSY", task -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            try {
                if ("first".equals(task.getPayload().get("name"))) {
                    started.countDown();
                    assertTrue(release.await(5, TimeUnit.SECONDS));
                } else {
                    Thread.sleep(30);
                }
                return null;
            } finally {
                inFlight.decrementAndGet();
            }
        }));
        try {
            quickStop.start();
            String first = queue.submit("BUSY", Map.of("name", "first"));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            quickStop.stop();
            assertFalse(quickStop.start());
            assertFalse(quickStop.isRunning());

            List<String> others = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                others.add(queue.submit("BUSY", Map.of("name", "other" + i)));
            }
            release.countDown();
            waitFor(() -> queue.status(first).getStatus() == TaskStatus.SUCCEEDED);
            waitFor(() -> quickStop.start());

            for (String id : others) {
                waitFor(() -> queue.status(id).getStatus() == TaskStatus.SUCCEEDED);
            }
            assertEquals(1, maxInFlight.get());
        } finally {
            release.countDown();
            quickStop.stop();
        }
    }

    @Test
    void testStopLetsTaskInProgressFinish() throws Exception {
        TaskWorker quickStop = new TaskWorker(queue, registry, new TaskMetrics(meters),
                Duration.ofMillis(20), false, Duration.ofMillis(50));
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        registry.register(handler("SLOW", task -> {
            started.countDown();
            assertTrue(release.await(5, TimeUnit.SECONDS));
            return null;
        }));
        quickStop.start();
        String id = queue.submit("SLOW", Map.of());
        assertTrue(started.await(5, TimeUnit.SECONDS));

        quickStop.stop();
        release.countDown();

        waitFor(() -> queue.status(id).getStatus().isTerminal());
        assertEquals(TaskStatus.SUCCEEDED, queue.status(id).getStatus());
    }

    private static TaskHandler handler(String type, Body body) {
        return new TaskHandler() {
            @Override
            public String getType() {
                return type;
            }

            @Override
            public Map<String, Object> handle(TaskRecord task) throws Exception {
                return body.apply(task);
            }
        };
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(20);
        }
    }

    @FunctionalInterface
    private interface Body {
        Map<String, Object> apply(TaskRecord task) throws Exception;
    }
}
