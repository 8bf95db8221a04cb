package io.sweepmesh.queue;

import java.util.Map;

/**
 * Unit of work held by the queue: the task id, the parameter mapping handed to workers and the
 * number of executions already started, which is also its retry priority.
 */
public record QueuedTask(long taskId, Map<String, Object> params, int attempts) {
    public QueuedTask {
        params = params == null ? Map.of() : params;
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts must be >= 0: " + attempts);
        }
    }

    public QueuedTask(long taskId, Map<String, Object> params) {
        this(taskId, params, 0);
    }

    public QueuedTask withAttempts(int value) {
        return new QueuedTask(taskId, params, value);
    }
}
