package io.sweepmesh.engine;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sweepmesh.model.RunStatus;

public record RunSummary(
        @JsonProperty("run_id") long runId,
        @JsonProperty("status") RunStatus status,
        @JsonProperty("total_tasks") int totalTasks,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("pending") int pending,
        @JsonProperty("cache_hits") int cacheHits,
        @JsonProperty("worker_restarts") int workerRestarts,
        @JsonProperty("duration_ms") long durationMs,
        @JsonProperty("error") String error
) {
}
