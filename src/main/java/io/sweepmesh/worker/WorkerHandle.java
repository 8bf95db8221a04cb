package io.sweepmesh.worker;

/**
 * A live session able to execute tasks one at a time. Handles are discarded and recreated by the
 * executor after crashes, so {@link #close()} must tolerate a broken session.
 */
public interface WorkerHandle extends AutoCloseable {
    TaskOutcome execute(TaskRequest request) throws Exception;

    @Override
    void close();
}
