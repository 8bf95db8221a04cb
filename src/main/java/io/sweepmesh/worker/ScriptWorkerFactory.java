package io.sweepmesh.worker;

import java.util.List;

public final class ScriptWorkerFactory implements WorkerFactory {
    private final List<String> command;
    private final long timeoutMs;

    public ScriptWorkerFactory(List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public WorkerHandle create(WorkerContext context) {
        return new ScriptWorker(context, command, timeoutMs);
    }

    public List<String> command() {
        return command;
    }
}
