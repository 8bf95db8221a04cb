package io.sweepmesh.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification emitted while a run executes. {@code data} holds the type-specific fields, for example
 * {@code task_id}, {@code params} and {@code will_retry} on {@link RunEventType#TASK_FAILED}.
 */
public record RunEvent(long runId, RunEventType type, long timestampMs, Map<String, Object> data) {
    public RunEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public Object get(String field) {
        return data.get(field);
    }
}
