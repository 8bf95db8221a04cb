package io.sweepmesh.queue;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueueStats(
        @JsonProperty("pending") int pending,
        @JsonProperty("in_progress") int inProgress,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed
) {
    public boolean drained() {
        return pending == 0 && inProgress == 0;
    }
}
