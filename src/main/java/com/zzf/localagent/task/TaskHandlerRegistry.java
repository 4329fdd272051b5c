package com.zzf.localagent.task;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
public class TaskHandlerRegistry {

    private final Map<String, TaskHandler> handlers = new ConcurrentHashMap<>();

    public TaskHandlerRegistry(List<TaskHandler> initial) {
        if (initial != null) {
            initial.forEach(this::register);
        }
    }

    public void register(TaskHandler handler) {
        String type = normalize(handler.getType());
        TaskHandler previous = handlers.put(type, handler);
        if (previous != null) {
            log.warn("task.handler.replaced type={} previous={}", type, previous.getClass().getSimpleName());
        }
    }

    public Optional<TaskHandler> find(String type) {
        if (type == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(handlers.get(normalize(type)));
    }

    public Set<String> types() {
        return Set.copyOf(handlers.keySet());
    }

    private static String normalize(String type) {
        return type.trim().toUpperCase(Locale.ROOT);
    }
}
