package io.sweepmesh.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.sweepmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Engine tunables. Defaults apply unless {@code sweepmesh-settings.json} exists under the data root;
 * a handful of values can be overridden by environment variables.
 */
public record EngineSettings(
        int maxRetries,
        int restartAfterConsecutiveFailures,
        long watchdogIntervalMs,
        long stallThresholdMs,
        long progressIntervalMs,
        long pollTimeoutMs,
        long shutdownGraceMs,
        int defaultWorkers,
        long workerTimeoutMs
) {
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_RESTART_AFTER_CONSECUTIVE_FAILURES = 5;
    public static final long DEFAULT_WATCHDOG_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_STALL_THRESHOLD_MS = 300_000L;
    public static final long DEFAULT_PROGRESS_INTERVAL_MS = 2_000L;
    public static final long DEFAULT_POLL_TIMEOUT_MS = 1_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 15_000L;
    public static final int DEFAULT_WORKERS = 2;
    public static final long DEFAULT_WORKER_TIMEOUT_MS = 300_000L;

    public static final String ENV_MAX_WORKERS = "SWEEPMESH_MAX_WORKERS";

    public EngineSettings {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
        }
        if (restartAfterConsecutiveFailures < 1) {
            throw new IllegalArgumentException("restartAfterConsecutiveFailures must be >= 1: " + restartAfterConsecutiveFailures);
        }
        requirePositive("watchdogIntervalMs", watchdogIntervalMs);
        requirePositive("stallThresholdMs", stallThresholdMs);
        requirePositive("progressIntervalMs", progressIntervalMs);
        requirePositive("pollTimeoutMs", pollTimeoutMs);
        requirePositive("workerTimeoutMs", workerTimeoutMs);
        if (shutdownGraceMs < 0) {
            throw new IllegalArgumentException("shutdownGraceMs must be >= 0: " + shutdownGraceMs);
        }
        if (defaultWorkers < 1) {
            throw new IllegalArgumentException("defaultWorkers must be >= 1: " + defaultWorkers);
        }
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_MAX_RETRIES,
                DEFAULT_RESTART_AFTER_CONSECUTIVE_FAILURES,
                DEFAULT_WATCHDOG_INTERVAL_MS,
                DEFAULT_STALL_THRESHOLD_MS,
                DEFAULT_PROGRESS_INTERVAL_MS,
                DEFAULT_POLL_TIMEOUT_MS,
                DEFAULT_SHUTDOWN_GRACE_MS,
                DEFAULT_WORKERS,
                DEFAULT_WORKER_TIMEOUT_MS
        );
    }

    public static EngineSettings load(SweepMeshConfig config) {
        return load(config.settingsFile(), System.getenv());
    }

    public static EngineSettings load(Path settingsFile, Map<String, String> env) {
        EngineSettings base = defaults();
        if (settingsFile != null && Files.exists(settingsFile)) {
            try {
                SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
                base = file == null ? base : file.applyTo(base);
            } catch (IOException e) {
                throw new IllegalArgumentException("Failed to read settings file: " + settingsFile, e);
            }
        }
        String workers = env == null ? null : env.get(ENV_MAX_WORKERS);
        if (workers != null && !workers.isBlank()) {
            try {
                base = base.withDefaultWorkers(Integer.parseInt(workers.trim()));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(ENV_MAX_WORKERS + " must be an integer: " + workers, e);
            }
        }
        return base;
    }

    public EngineSettings withDefaultWorkers(int workers) {
        return new EngineSettings(maxRetries, restartAfterConsecutiveFailures, watchdogIntervalMs, stallThresholdMs,
                progressIntervalMs, pollTimeoutMs, shutdownGraceMs, workers, workerTimeoutMs);
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0: " + value);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            @JsonProperty("max_retries") Integer maxRetries,
            @JsonProperty("restart_after_consecutive_failures") Integer restartAfterConsecutiveFailures,
            @JsonProperty("watchdog_interval_ms") Long watchdogIntervalMs,
            @JsonProperty("stall_threshold_ms") Long stallThresholdMs,
            @JsonProperty("progress_interval_ms") Long progressIntervalMs,
            @JsonProperty("poll_timeout_ms") Long pollTimeoutMs,
            @JsonProperty("shutdown_grace_ms") Long shutdownGraceMs,
            @JsonProperty("default_workers") Integer defaultWorkers,
            @JsonProperty("worker_timeout_ms") Long workerTimeoutMs
    ) {
        EngineSettings applyTo(EngineSettings base) {
            return new EngineSettings(
                    maxRetries == null ? base.maxRetries() : maxRetries,
                    restartAfterConsecutiveFailures == null ? base.restartAfterConsecutiveFailures() : restartAfterConsecutiveFailures,
                    watchdogIntervalMs == null ? base.watchdogIntervalMs() : watchdogIntervalMs,
                    stallThresholdMs == null ? base.stallThresholdMs() : stallThresholdMs,
                    progressIntervalMs == null ? base.progressIntervalMs() : progressIntervalMs,
                    pollTimeoutMs == null ? base.pollTimeoutMs() : pollTimeoutMs,
                    shutdownGraceMs == null ? base.shutdownGraceMs() : shutdownGraceMs,
                    defaultWorkers == null ? base.defaultWorkers() : defaultWorkers,
                    workerTimeoutMs == null ? base.workerTimeoutMs() : workerTimeoutMs
            );
        }
    }
}
