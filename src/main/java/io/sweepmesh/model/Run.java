package io.sweepmesh.model;

public record Run(
        long id,
        long targetId,
        String name,
        RunMode mode,
        String configJson,
        RunStatus status,
        Long startedAtMs,
        Long completedAtMs,
        long createdAtMs
) {
}
