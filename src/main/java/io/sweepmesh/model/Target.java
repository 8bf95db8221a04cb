package io.sweepmesh.model;

public record Target(
        long id,
        String url,
        String name,
        int runCount,
        Long lastRunAtMs,
        long createdAtMs
) {
}
