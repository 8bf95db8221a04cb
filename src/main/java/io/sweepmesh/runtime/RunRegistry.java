package io.sweepmesh.runtime;

import io.sweepmesh.engine.RunExecutor;

import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Executors of runs currently in progress, keyed by run id. At most one executor per run.
 */
public final class RunRegistry {
    private final ConcurrentMap<Long, RunExecutor> active = new ConcurrentHashMap<>();

    public void register(RunExecutor executor) {
        RunExecutor existing = active.putIfAbsent(executor.runId(), executor);
        if (existing != null) {
            throw new IllegalStateException("Run " + executor.runId() + " is already executing");
        }
    }

    public boolean unregister(RunExecutor executor) {
        return active.remove(executor.runId(), executor);
    }

    public Optional<RunExecutor> find(long runId) {
        return Optional.ofNullable(active.get(runId));
    }

    public boolean stop(long runId) {
        Optional<RunExecutor> executor = find(runId);
        executor.ifPresent(RunExecutor::stop);
        return executor.isPresent();
    }

    public boolean pause(long runId) {
        return find(runId).map(RunExecutor::pause).orElse(false);
    }

    public boolean resume(long runId) {
        return find(runId).map(RunExecutor::resume).orElse(false);
    }

    public boolean isPaused(long runId) {
        return find(runId).map(RunExecutor::isPaused).orElse(false);
    }

    public Set<Long> activeRunIds() {
        return Set.copyOf(active.keySet());
    }
}
