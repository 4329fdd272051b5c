package com.zzf.localagent.task;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TaskHandlerRegistryTest {

    @Test
    void testLookupIsCaseInsensitive() {
        TaskHandler query = new FixedHandler("query");
        TaskHandlerRegistry registry = new TaskHandlerRegistry(List.of(query));
        assertSame(query, registry.find("QUERY").orElseThrow());
        assertSame(query, registry.find(" Query ").orElseThrow());
        assertTrue(registry.find("REVERT").isEmpty());
        assertTrue(registry.find(null).isEmpty());
        assertEquals(Set.of("QUERY"), registry.types());
    }

    @Test
    void testLaterRegistrationWins() {
        TaskHandlerRegistry registry = new TaskHandlerRegistry(null);
        TaskHandler second = new FixedHandler("SNAPSHOT");
        registry.register(new FixedHandler("SNAPSHOT"));
        registry.register(second);
        assertSame(second, registry.find("snapshot").orElseThrow());
    }

    @Test
    void testStatusWireNames() {
        assertEquals("cancelled", TaskStatus.CANCELLED.wireName());
        assertEquals(TaskStatus.RUNNING, TaskStatus.fromWire("running"));
        assertEquals(TaskStatus.UNKNOWN, TaskStatus.fromWire("exploded"));
        assertTrue(TaskStatus.FAILED.isTerminal());
        assertFalse(TaskStatus.QUEUED.isTerminal());
    }

    private static final class FixedHandler implements TaskHandler {
        private final String type;

        FixedHandler(String type) {
            this.type = type;
        }

        @Override
        public String getType() {
            return type;
        }

        @Override
        public Map<String, Object> handle(TaskRecord task) {
            return Map.of();
        }
    }
}
