package com.zzf.localagent.task;

import com.zzf.localagent.logging.MdcContext;
import com.zzf.localagent.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single consumer of {@link TaskQueue}. Tasks run one at a time in submission order; a
 * failing handler marks its own task failed and the loop moves on.
 */
public final class TaskWorker implements InitializingBean, DisposableBean {
    private static final Logger logger = LoggerFactory.getLogger(TaskWorker.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile Thread thread;

    private final AtomicLong processed = new AtomicLong(0);
    private final AtomicLong failed = new AtomicLong(0);
    private volatile long startedAt;
    private volatile long lastTick;
    private volatile String currentTask;
    private volatile String lastError;

    private final TaskQueue queue;
    private final TaskHandlerRegistry handlers;
    private final TaskMetrics metrics;
    private final Duration pollInterval;
    private final boolean autostart;
    private final Duration stopTimeout;

    public TaskWorker(TaskQueue queue, TaskHandlerRegistry handlers, TaskMetrics metrics,
                      Duration pollInterval, boolean autostart) {
        this(queue, handlers, metrics, pollInterval, autostart, Duration.ofSeconds(3));
    }

    TaskWorker(TaskQueue queue, TaskHandlerRegistry handlers, TaskMetrics metrics,
               Duration pollInterval, boolean autostart, Duration stopTimeout) {
        this.queue = queue;
        this.handlers = handlers;
        this.metrics = metrics;
        this.pollInterval = pollInterval;
        this.autostart = autostart;
        this.stopTimeout = stopTimeout;
    }

    @Override
    public void afterPropertiesSet() {
        logger.info("worker.autostart enabled={}", autostart);
        if (autostart) {
            start();
        }
    }

    @Override
    public void destroy() {
        stop();
    }

    /**
     * Starts the consumer thread. Refused while the thread of a previous run is still
     * finishing its current task, so at most one task runs at a time.
     *
     * @return whether a consumer thread is running after the call
     */
    public synchronized boolean start() {
        if (thread != null && thread.isAlive() && !running.get()) {
            logger.warn("worker.start skip reason=previous_still_running current={}", currentTask);
            return false;
        }
        if (running.getAndSet(true)) {
            logger.info("worker.start skip reason=already_running");
            return true;
        }
        startedAt = System.currentTimeMillis();
        logger.info("worker.start ok handlers={} pollMs={}", handlers.types(), pollInterval.toMillis());
        thread = new Thread(this::runLoop, "localagent-task-worker");
        thread.setDaemon(true);
        thread.start();
        return true;
    }

    /**
     * Clears the run flag and waits for the consumer to leave its loop. A task in progress is
     * allowed to finish.
     */
    public synchronized void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        if (thread != null) {
            try {
                thread.join(stopTimeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                logger.warn("worker.stop pending reason=task_in_progress current={}", currentTask);
            }
        }
        logger.info("worker.stop ok processed={} failed={}", processed.get(), failed.get());
    }

    public boolean isRunning() {
        return running.get();
    }

    public Status status() {
        Status s = new Status();
        s.running = running.get();
        s.startedAt = startedAt;
        s.lastTick = lastTick;
        s.processed = processed.get();
        s.failed = failed.get();
        s.currentTask = currentTask;
        s.lastError = lastError;
        return s;
    }

    /**
     * Waits up to {@code timeout} for one task and runs it on the calling thread.
     *
     * @return whether a task was taken off the queue
     */
    boolean runOnce(Duration timeout) throws InterruptedException {
        lastTick = System.currentTimeMillis();
        TaskRecord task = queue.poll(timeout);
        if (task == null) {
            return false;
        }
        execute(task);
        return true;
    }

    private void runLoop() {
        Thread self = Thread.currentThread();
        while (running.get() && self == thread) {
            try {
                runOnce(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                if (self == thread) {
                    running.set(false);
                }
                break;
            } catch (RuntimeException e) {
                lastError = StringUtils.errorText(e);
                logger.error("worker.loop.failed", e);
            }
        }
        logger.info("worker.loop.exit");
    }

    private void execute(TaskRecord task) {
        TaskMeta meta = queue.readMeta(task.getId()).orElse(null);
        if (meta == null || meta.getStatus() != TaskStatus.QUEUED) {
            logger.info("worker.task.skip id={} status={}", task.getId(), meta == null ? null : meta.getStatus());
            return;
        }
        long begin = System.currentTimeMillis();
        currentTask = task.getId();
        MdcContext.setTask(task.getId(), task.getType());
        TaskStatus outcome;
        try {
            queue.writeMeta(meta.toBuilder()
                    .status(TaskStatus.RUNNING)
                    .startedAt(begin)
                    .build());
            queue.appendLog(task.getId(), "running " + task.getType());
            logger.info("worker.task.start id={} type={}", task.getId(), task.getType());
            outcome = runHandler(task, meta, begin);
        } finally {
            processed.incrementAndGet();
            currentTask = null;
            MdcContext.clear();
        }
        if (metrics != null) {
            metrics.recordCompleted(task.getType(), outcome, System.currentTimeMillis() - begin);
        }
    }

    private TaskStatus runHandler(TaskRecord task, TaskMeta meta, long begin) {
        try {
            TaskHandler handler = handlers.find(task.getType())
                    .orElseThrow(() -> new IllegalStateException("no handler registered for task type: " + task.getType()));
            Map<String, Object> result = handler.handle(task);
            Map<String, Object> stored = new LinkedHashMap<>();
            if (result == null) {
                stored.put("ok", true);
            } else {
                stored.putAll(result);
            }
            queue.writeResult(task.getId(), stored);
            queue.writeMeta(meta.toBuilder()
                    .status(TaskStatus.SUCCEEDED)
                    .startedAt(begin)
                    .finishedAt(System.currentTimeMillis())
                    .build());
            queue.appendLog(task.getId(), "succeeded");
            logger.info("worker.task.ok id={} ms={}", task.getId(), System.currentTimeMillis() - begin);
            return TaskStatus.SUCCEEDED;
        } catch (Exception e) {
            String error = StringUtils.errorText(e);
            failed.incrementAndGet();
            lastError = error;
            queue.writeMeta(meta.toBuilder()
                    .status(TaskStatus.FAILED)
                    .error(error)
                    .startedAt(begin)
                    .finishedAt(System.currentTimeMillis())
                    .build());
            queue.appendLog(task.getId(), "failed: " + error);
            logger.error("worker.task.failed id={} type={}", task.getId(), task.getType(), e);
            if (e instanceof InterruptedException) {
                // restored after the task's files are written; file channels close on interrupt
                Thread.currentThread().interrupt();
            }
            return TaskStatus.FAILED;
        }
    }

    public static final class Status {
        public boolean running;
        public long startedAt;
        public long lastTick;
        public long processed;
        public long failed;
        public String currentTask;
        public String lastError;
    }
}
