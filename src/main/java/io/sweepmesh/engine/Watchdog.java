package io.sweepmesh.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Periodic health check of the worker slots. A slot whose last activity is older than the stall
 * threshold is restarted while the run is active and not paused. A slot holding an in-flight task is
 * always eligible; a slot without one only while tasks are waiting in the queue.
 */
final class Watchdog implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(Watchdog.class);

    private final RunExecutor executor;
    private final List<WorkerSlot> slots;
    private final Clock clock;
    private final long stallThresholdMs;

    Watchdog(RunExecutor executor, List<WorkerSlot> slots, Clock clock, long stallThresholdMs) {
        this.executor = executor;
        this.slots = slots;
        this.clock = clock;
        this.stallThresholdMs = stallThresholdMs;
    }

    @Override
    public void run() {
        try {
            check();
        } catch (RuntimeException e) {
            executor.fail("watchdog", e);
        }
    }

    int check() {
        if (!executor.watchdogShouldAct()) {
            return 0;
        }
        long now = clock.millis();
        boolean waiting = executor.hasWaitingTasks();
        int restarted = 0;
        for (WorkerSlot slot : slots) {
            long idleMs = now - slot.lastActivityMs();
            if (idleMs > stallThresholdMs && (slot.hasClaim() || waiting)) {
                log.warn("Worker {} inactive for {} ms, forcing restart", slot.workerId(), idleMs);
                executor.forceRestart(slot);
                restarted++;
            }
        }
        return restarted;
    }
}
