package io.sweepmesh.model;

public record ResultRecord(
        long id,
        long taskId,
        Metrics metrics,
        String rawDataJson,
        Long cachedFromTaskId,
        long createdAtMs
) {
    public boolean cached() {
        return cachedFromTaskId != null;
    }
}
