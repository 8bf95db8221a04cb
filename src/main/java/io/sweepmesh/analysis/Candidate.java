package io.sweepmesh.analysis;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.sweepmesh.model.Metrics;

import java.util.Map;

/**
 * One measured parameter combination of a run.
 */
public record Candidate(
        @JsonProperty("task_id") long taskId,
        @JsonProperty("params") Map<String, Object> params,
        @JsonProperty("metrics") Metrics metrics
) {
    public Candidate {
        params = params == null ? Map.of() : params;
        metrics = metrics == null ? Metrics.empty() : metrics;
    }
}
