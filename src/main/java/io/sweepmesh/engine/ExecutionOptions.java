package io.sweepmesh.engine;

import io.sweepmesh.config.EngineSettings;

/**
 * Per-run execution knobs, derived from {@link EngineSettings} plus command-line flags.
 */
public record ExecutionOptions(
        boolean skipCache,
        int maxRetries,
        int restartAfterConsecutiveFailures,
        long watchdogIntervalMs,
        long stallThresholdMs,
        long progressIntervalMs,
        long pollTimeoutMs,
        long shutdownGraceMs,
        int maxHandleCreationFailures
) {
    public static final int DEFAULT_MAX_HANDLE_CREATION_FAILURES = 3;

    public ExecutionOptions {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        if (restartAfterConsecutiveFailures < 1) {
            throw new IllegalArgumentException("restartAfterConsecutiveFailures must be >= 1");
        }
        if (watchdogIntervalMs <= 0 || stallThresholdMs <= 0 || progressIntervalMs <= 0 || pollTimeoutMs <= 0) {
            throw new IllegalArgumentException("intervals must be > 0");
        }
        if (maxHandleCreationFailures < 1) {
            throw new IllegalArgumentException("maxHandleCreationFailures must be >= 1");
        }
    }

    public static ExecutionOptions defaults() {
        return fromSettings(EngineSettings.defaults(), false);
    }

    public static ExecutionOptions fromSettings(EngineSettings settings, boolean skipCache) {
        return new ExecutionOptions(
                skipCache,
                settings.maxRetries(),
                settings.restartAfterConsecutiveFailures(),
                settings.watchdogIntervalMs(),
                settings.stallThresholdMs(),
                settings.progressIntervalMs(),
                settings.pollTimeoutMs(),
                settings.shutdownGraceMs(),
                DEFAULT_MAX_HANDLE_CREATION_FAILURES
        );
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static final class Builder {
        private boolean skipCache;
        private int maxRetries;
        private int restartAfterConsecutiveFailures;
        private long watchdogIntervalMs;
        private long stallThresholdMs;
        private long progressIntervalMs;
        private long pollTimeoutMs;
        private long shutdownGraceMs;
        private int maxHandleCreationFailures;

        private Builder(ExecutionOptions base) {
            this.skipCache = base.skipCache;
            this.maxRetries = base.maxRetries;
            this.restartAfterConsecutiveFailures = base.restartAfterConsecutiveFailures;
            this.watchdogIntervalMs = base.watchdogIntervalMs;
            this.stallThresholdMs = base.stallThresholdMs;
            this.progressIntervalMs = base.progressIntervalMs;
            this.pollTimeoutMs = base.pollTimeoutMs;
            this.shutdownGraceMs = base.shutdownGraceMs;
            this.maxHandleCreationFailures = base.maxHandleCreationFailures;
        }

        public Builder skipCache(boolean value) {
            this.skipCache = value;
            return this;
        }

        public Builder maxRetries(int value) {
            this.maxRetries = value;
            return this;
        }

        public Builder restartAfterConsecutiveFailures(int value) {
            this.restartAfterConsecutiveFailures = value;
            return this;
        }

        public Builder watchdogIntervalMs(long value) {
            this.watchdogIntervalMs = value;
            return this;
        }

        public Builder stallThresholdMs(long value) {
            this.stallThresholdMs = value;
            return this;
        }

        public Builder progressIntervalMs(long value) {
            this.progressIntervalMs = value;
            return this;
        }

        public Builder pollTimeoutMs(long value) {
            this.pollTimeoutMs = value;
            return this;
        }

        public Builder shutdownGraceMs(long value) {
            this.shutdownGraceMs = value;
            return this;
        }

        public Builder maxHandleCreationFailures(int value) {
            this.maxHandleCreationFailures = value;
            return this;
        }

        public ExecutionOptions build() {
            return new ExecutionOptions(skipCache, maxRetries, restartAfterConsecutiveFailures, watchdogIntervalMs,
                    stallThresholdMs, progressIntervalMs, pollTimeoutMs, shutdownGraceMs, maxHandleCreationFailures);
        }
    }
}
