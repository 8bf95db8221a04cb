package io.sweepmesh.testing;

import io.sweepmesh.worker.TaskOutcome;
import io.sweepmesh.worker.TaskRequest;
import io.sweepmesh.worker.WorkerContext;
import io.sweepmesh.worker.WorkerFactory;
import io.sweepmesh.worker.WorkerHandle;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker factory whose handles answer through a {@link Behavior}. Every handle and every request is
 * recorded so tests can count creations and invocations.
 */
public final class FakeWorkerFactory implements WorkerFactory {
    private final Behavior behavior;
    private final AtomicInteger creations = new AtomicInteger();
    private final AtomicInteger closes = new AtomicInteger();
    private final List<TaskRequest> requests = new CopyOnWriteArrayList<>();
    private volatile int failCreations;

    public FakeWorkerFactory(Behavior behavior) {
        this.behavior = behavior;
    }

    public static FakeWorkerFactory alwaysSucceeding() {
        return new FakeWorkerFactory((handleNo, request) -> Outcomes.pl(request.taskId()));
    }

    public FakeWorkerFactory failingCreations(int count) {
        this.failCreations = count;
        return this;
    }

    @Override
    public WorkerHandle create(WorkerContext context) throws Exception {
        int handleNo = creations.incrementAndGet();
        if (handleNo <= failCreations) {
            throw new IllegalStateException("browser launch failed #" + handleNo);
        }
        return new WorkerHandle() {
            @Override
            public TaskOutcome execute(TaskRequest request) throws Exception {
                requests.add(request);
                return behavior.execute(handleNo, request);
            }

            @Override
            public void close() {
                closes.incrementAndGet();
            }
        };
    }

    public int creations() {
        return creations.get();
    }

    public int closes() {
        return closes.get();
    }

    public List<TaskRequest> requests() {
        return List.copyOf(requests);
    }

    @FunctionalInterface
    public interface Behavior {
        TaskOutcome execute(int handleNo, TaskRequest request) throws Exception;
    }
}
