package io.sweepmesh.model;

import java.util.Map;

/**
 * One parameter combination of a run. {@code params} keeps insertion order; {@code paramsKey} is the
 * canonical form used for cache lookups.
 */
public record SweepTask(
        long id,
        long runId,
        Map<String, Object> params,
        String paramsKey,
        TaskStatus status,
        int attempts,
        String leaseOwner,
        long leaseEpoch,
        String lastError,
        Long startedAtMs,
        Long completedAtMs,
        long createdAtMs
) {
    public SweepTask {
        params = params == null ? Map.of() : params;
    }
}
