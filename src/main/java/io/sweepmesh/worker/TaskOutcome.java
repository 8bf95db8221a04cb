package io.sweepmesh.worker;

import io.sweepmesh.model.FailureType;
import io.sweepmesh.model.Metrics;

import java.util.Map;

/**
 * Result of one delegation. A successful outcome carries metrics; a failed one carries a classification
 * and whatever artifacts were captured.
 */
public record TaskOutcome(
        boolean success,
        Metrics results,
        Map<String, Object> rawData,
        String errorMessage,
        FailureType failureType,
        Artifacts artifacts
) {
    public TaskOutcome {
        rawData = rawData == null ? Map.of() : rawData;
        artifacts = artifacts == null ? Artifacts.none() : artifacts;
        if (!success && failureType == null) {
            failureType = FailureType.UNKNOWN;
        }
    }

    public static TaskOutcome success(Metrics results, Map<String, Object> rawData) {
        return new TaskOutcome(true, results == null ? Metrics.empty() : results, rawData, null, null, Artifacts.none());
    }

    public static TaskOutcome failure(FailureType failureType, String errorMessage) {
        return failure(failureType, errorMessage, Artifacts.none());
    }

    public static TaskOutcome failure(FailureType failureType, String errorMessage, Artifacts artifacts) {
        return new TaskOutcome(false, null, Map.of(), errorMessage, failureType, artifacts);
    }

    public record Artifacts(String screenshotPath, String htmlPath, String consoleLogJson) {
        public static Artifacts none() {
            return new Artifacts(null, null, null);
        }
    }
}
