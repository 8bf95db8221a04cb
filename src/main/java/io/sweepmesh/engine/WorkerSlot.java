package io.sweepmesh.engine;

import io.sweepmesh.queue.QueuedTask;
import io.sweepmesh.worker.WorkerHandle;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Supervision state of one worker position. The generation changes whenever the slot's loop is
 * replaced; a loop whose generation is stale must exit and can no longer claim work. The in-flight
 * claim is finalized by exactly one of {@link #release(Claim)} (the loop) and {@link #revoke()} (the
 * watchdog, or the loop's own exit path).
 */
final class WorkerSlot {
    private final int index;
    private final String workerId;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger restarts = new AtomicInteger();
    private volatile WorkerHandle handle;
    private volatile Thread thread;
    private volatile long lastActivityMs;
    private Claim currentClaim;

    WorkerSlot(int index, String workerId) {
        this.index = index;
        this.workerId = workerId;
    }

    int index() {
        return index;
    }

    String workerId() {
        return workerId;
    }

    long generation() {
        return generation.get();
    }

    long nextGeneration() {
        return generation.incrementAndGet();
    }

    WorkerHandle handle() {
        return handle;
    }

    void handle(WorkerHandle value) {
        this.handle = value;
    }

    Thread thread() {
        return thread;
    }

    void thread(Thread value) {
        this.thread = value;
    }

    long lastActivityMs() {
        return lastActivityMs;
    }

    void touch(long nowMs) {
        this.lastActivityMs = nowMs;
    }

    int recordFailure() {
        return consecutiveFailures.incrementAndGet();
    }

    void resetFailures() {
        consecutiveFailures.set(0);
    }

    int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    void recordRestart() {
        restarts.incrementAndGet();
        consecutiveFailures.set(0);
    }

    int restarts() {
        return restarts.get();
    }

    /**
     * Installs {@code value} unless the slot was taken over by a newer generation meanwhile.
     */
    synchronized boolean installHandle(long expectedGeneration, WorkerHandle value) {
        if (generation.get() != expectedGeneration) {
            return false;
        }
        this.handle = value;
        return true;
    }

    /**
     * @return false when the claim's generation is no longer current; the caller must hand the task back
     */
    synchronized boolean claim(Claim claim) {
        if (claim.generation() != generation.get()) {
            return false;
        }
        this.currentClaim = claim;
        return true;
    }

    synchronized boolean hasClaim() {
        return currentClaim != null;
    }

    /**
     * @return false when the watchdog revoked the claim first; the caller must drop its outcome
     */
    synchronized boolean release(Claim claim) {
        if (currentClaim != claim) {
            return false;
        }
        currentClaim = null;
        return true;
    }

    synchronized Optional<Claim> revoke() {
        Claim claim = currentClaim;
        currentClaim = null;
        return Optional.ofNullable(claim);
    }

    /**
     * Revokes the current claim only if it was taken by a loop of {@code ownerGeneration}.
     */
    synchronized Optional<Claim> revoke(long ownerGeneration) {
        if (currentClaim == null || currentClaim.generation() != ownerGeneration) {
            return Optional.empty();
        }
        return revoke();
    }

    record Claim(QueuedTask task, long generation, long leaseEpoch, int attempts) {
    }
}
