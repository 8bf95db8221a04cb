package io.sweepmesh.engine;

@FunctionalInterface
public interface RunUpdateListener {
    RunUpdateListener NOOP = (runId, event) -> {
    };

    void onUpdate(long runId, RunEvent event);
}
