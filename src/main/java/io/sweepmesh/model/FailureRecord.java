package io.sweepmesh.model;

public record FailureRecord(
        long id,
        long taskId,
        int attemptNumber,
        FailureType failureType,
        String errorMessage,
        String screenshotPath,
        String htmlPath,
        String consoleLogJson,
        long createdAtMs
) {
}
