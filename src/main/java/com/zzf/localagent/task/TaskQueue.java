package com.zzf.localagent.task;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.localagent.exception.NotFoundException;
import com.zzf.localagent.exception.StorageException;
import com.zzf.localagent.exception.ValidationException;
import com.zzf.localagent.storage.DocumentStore;
import com.zzf.localagent.storage.FileSystemDocumentStore;
import com.zzf.localagent.util.Identifier;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static com.zzf.localagent.storage.DocumentStore.key;

/**
 * Durable submission log plus the in-process hand-off to the worker.
 * <pre>
 * tasks.jsonl              append-only {id, type, payload, status, ts}
 * &lt;task_id&gt;/meta.json      {id, type, status, error?, createdAt, startedAt?, finishedAt?}
 * &lt;task_id&gt;/logs.jsonl     append-only {ts, msg}
 * &lt;task_id&gt;/result.json
 * </pre>
 * Tasks still {@code queued} in the log when the queue is opened are handed to the worker
 * again, in log order.
 */
@Slf4j
public class TaskQueue {

    private static final String QUEUE_LOG = "tasks.jsonl";
    private static final String META = "meta.json";
    private static final String LOGS = "logs.jsonl";
    private static final String RESULT = "result.json";
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final DocumentStore store;
    private final ObjectMapper objectMapper;
    private final BlockingQueue<TaskRecord> pending = new LinkedBlockingQueue<>();
    private final AtomicLong lastLogStamp = new AtomicLong(0L);

    public TaskQueue(Path tasksRoot, ObjectMapper objectMapper) {
        this.store = new FileSystemDocumentStore(tasksRoot, objectMapper);
        this.objectMapper = objectMapper;
        store.createDirectories(List.of());
        recoverQueued();
    }

    /**
     * Records a new task and returns its id without waiting for it to run.
     */
    public String submit(String type, Map<String, Object> payload) {
        if (type == null || type.isBlank()) {
            throw new ValidationException("task type is required");
        }
        long now = System.currentTimeMillis();
        TaskRecord task = TaskRecord.builder()
                .id(Identifier.timeOrdered("task"))
                .type(type.trim())
                .payload(payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload))
                .status(TaskStatus.QUEUED)
                .ts(now)
                .build();
        store.appendLine(key(QUEUE_LOG), toJson(task));
        writeMeta(TaskMeta.builder()
                .id(task.getId())
                .type(task.getType())
                .status(TaskStatus.QUEUED)
                .createdAt(now)
                .build());
        pending.add(task);
        log.info("task.submit ok id={} type={}", task.getId(), task.getType());
        return task.getId();
    }

    /**
     * Next task handed to the worker, or {@code null} when none arrives within {@code timeout}.
     */
    TaskRecord poll(Duration timeout) throws InterruptedException {
        return pending.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public TaskMeta status(String taskId) {
        return readMeta(taskId).orElseGet(() -> TaskMeta.builder()
                .id(taskId)
                .status(TaskStatus.UNKNOWN)
                .build());
    }

    /**
     * Last {@code limit} submissions in submission order, with current status and error.
     */
    public List<TaskRecord> list(int limit) {
        List<TaskRecord> records = readQueueLog();
        int from = Math.max(0, records.size() - Math.max(0, limit));
        List<TaskRecord> out = new ArrayList<>();
        for (TaskRecord record : records.subList(from, records.size())) {
            Optional<TaskMeta> meta = readMeta(record.getId());
            out.add(meta.map(m -> record.toBuilder().status(m.getStatus()).error(m.getError()).build())
                    .orElse(record));
        }
        return out;
    }

    /**
     * Cancels a task that has not started yet. A task that is already running, or finished,
     * is left alone.
     *
     * @return whether the task is now cancelled
     * @throws NotFoundException for an unknown id
     */
    public boolean cancel(String taskId) {
        TaskMeta meta = readMeta(taskId)
                .orElseThrow(() -> new NotFoundException("task not found: " + taskId));
        if (meta.getStatus() == TaskStatus.CANCELLED) {
            return true;
        }
        if (meta.getStatus() != TaskStatus.QUEUED) {
            log.info("task.cancel skip id={} status={}", taskId, meta.getStatus());
            return false;
        }
        writeMeta(meta.toBuilder()
                .status(TaskStatus.CANCELLED)
                .finishedAt(System.currentTimeMillis())
                .build());
        appendLog(taskId, "cancelled");
        log.info("task.cancel ok id={}", taskId);
        return true;
    }

    /**
     * Appends a log line stamped with epoch millis, bumped past the previous stamp so that
     * {@link #readLogs(String, Long)} with the last seen {@code ts} never skips an entry.
     * Stamping and appending happen under one lock so file order matches stamp order.
     */
    public synchronized void appendLog(String taskId, String message) {
        long now = System.currentTimeMillis();
        TaskLogEntry entry = TaskLogEntry.builder()
                .ts(lastLogStamp.updateAndGet(prev -> Math.max(prev + 1, now)))
                .msg(message)
                .build();
        store.appendLine(key(taskId, LOGS), toJson(entry));
    }

    /**
     * Log entries written strictly after {@code after} (epoch millis); all entries when
     * {@code after} is null.
     */
    public List<TaskLogEntry> readLogs(String taskId, Long after) {
        List<TaskLogEntry> out = new ArrayList<>();
        for (String line : store.readLines(key(taskId, LOGS))) {
            try {
                TaskLogEntry entry = objectMapper.readValue(line, TaskLogEntry.class);
                if (after == null || entry.getTs() > after) {
                    out.add(entry);
                }
            } catch (IOException e) {
                log.warn("task.logs.skip_line id={} err={}", taskId, e.getMessage());
            }
        }
        return out;
    }

    public Optional<Map<String, Object>> readResult(String taskId) {
        return store.readJson(key(taskId, RESULT), MAP_TYPE).map(m -> m);
    }

    void writeResult(String taskId, Map<String, Object> result) {
        store.writeJson(key(taskId, RESULT), result);
    }

    void writeMeta(TaskMeta meta) {
        store.writeJson(key(meta.getId(), META), meta);
    }

    Optional<TaskMeta> readMeta(String taskId) {
        if (taskId == null || taskId.isBlank()) {
            return Optional.empty();
        }
        return store.readJson(key(taskId, META), TaskMeta.class);
    }

    int pendingCount() {
        return pending.size();
    }

    private void recoverQueued() {
        int recovered = 0;
        for (TaskRecord record : readQueueLog()) {
            TaskStatus status = readMeta(record.getId()).map(TaskMeta::getStatus).orElse(TaskStatus.UNKNOWN);
            if (status == TaskStatus.QUEUED) {
                pending.add(record);
                recovered++;
            }
        }
        if (recovered > 0) {
            log.info("task.recover ok queued={}", recovered);
        }
    }

    private List<TaskRecord> readQueueLog() {
        List<TaskRecord> records = new ArrayList<>();
        for (String line : store.readLines(key(QUEUE_LOG))) {
            try {
                records.add(objectMapper.readValue(line, TaskRecord.class));
            } catch (IOException e) {
                log.warn("task.queue_log.skip_line err={}", e.getMessage());
            }
        }
        return records;
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to serialise task document", e);
        }
    }
}
