package io.sweepmesh.engine;

import io.sweepmesh.config.SweepMeshConfig;
import io.sweepmesh.model.Run;
import io.sweepmesh.model.RunMode;
import io.sweepmesh.model.RunStatus;
import io.sweepmesh.model.Target;
import io.sweepmesh.queue.QueuedTask;
import io.sweepmesh.storage.Database;
import io.sweepmesh.storage.SweepStore;
import io.sweepmesh.testing.FakeWorkerFactory;
import io.sweepmesh.testing.MutableClock;
import io.sweepmesh.testing.Outcomes;
import io.sweepmesh.testing.TempDirs;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

final class WatchdogTest {
    private static final ExecutionOptions OPTIONS = ExecutionOptions.defaults().toBuilder()
            .pollTimeoutMs(20L)
            .progressIntervalMs(50L)
            .watchdogIntervalMs(20L)
            .build();

    @Test
    void onlyTheSlotHoldingAStalledTaskIsRestarted() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-watchdog-idle-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, List.of(Map.of("delta", 5)));
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch never = new CountDownLatch(1);
            FakeWorkerFactory factory = new FakeWorkerFactory((handleNo, request) -> {
                if (request.attempt() == 0) {
                    started.countDown();
                    never.await();
                }
                return Outcomes.pl(1.0);
            });
            MutableClock clock = new MutableClock(5_000_000L);
            RunExecutor executor = RunExecutor.builder(store, run.id(), factory)
                    .numWorkers(2)
                    .options(OPTIONS.toBuilder().pollTimeoutMs(5L).build())
                    .clock(clock)
                    .build();

            AtomicReference<RunSummary> summary = new AtomicReference<>();
            Thread runner = new Thread(() -> summary.set(executor.execute()));
            runner.start();
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            clock.advance(600_000L);
            runner.join(10_000L);

            Assertions.assertNotNull(summary.get());
            Assertions.assertEquals(RunStatus.COMPLETED, summary.get().status());
            Assertions.assertEquals(1, summary.get().workerRestarts());
            Assertions.assertEquals(3, factory.creations());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void pausedRunIsNeverRestarted() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-watchdog-paused-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, List.of(Map.of("delta", 5), Map.of("delta", 6)));
            CountDownLatch started = new CountDownLatch(1);
            FakeWorkerFactory factory = new FakeWorkerFactory((handleNo, request) -> {
                started.countDown();
                return Outcomes.pl(1.0);
            });
            MutableClock clock = new MutableClock(5_000_000L);
            RunExecutor executor = RunExecutor.builder(store, run.id(), factory).options(OPTIONS).clock(clock).build();

            AtomicReference<RunSummary> summary = new AtomicReference<>();
            Thread runner = new Thread(() -> summary.set(executor.execute()));
            runner.start();
            Assertions.assertTrue(started.await(5, TimeUnit.SECONDS));
            executor.pause();
            clock.advance(600_000L);
            Thread.sleep(200L);
            Assertions.assertEquals(0, executor.workerRestarts());
            executor.resume();
            runner.join(10_000L);

            Assertions.assertEquals(RunStatus.COMPLETED, summary.get().status());
            Assertions.assertEquals(0, summary.get().workerRestarts());
        } finally {
            TempDirs.deleteRecursively(root);
        }
    }

    @Test
    void slotClaimIsFinalizedOnceAndGenerationsFenceHandles() throws Exception {
        WorkerSlot slot = new WorkerSlot(0, "run-1-worker-0");
        slot.touch(100L);
        Assertions.assertEquals(100L, slot.lastActivityMs());

        WorkerSlot.Claim claim = new WorkerSlot.Claim(new QueuedTask(1L, Map.of()), slot.generation(), 1L, 1);
        Assertions.assertTrue(slot.claim(claim));
        Assertions.assertTrue(slot.hasClaim());
        Assertions.assertTrue(slot.revoke().isPresent());
        Assertions.assertFalse(slot.release(claim));
        Assertions.assertTrue(slot.revoke().isEmpty());

        long generation = slot.nextGeneration();
        Assertions.assertFalse(slot.installHandle(generation - 1, null));
        Assertions.assertTrue(slot.installHandle(generation, null));

        slot.recordFailure();
        slot.recordFailure();
        slot.recordRestart();
        Assertions.assertEquals(0, slot.consecutiveFailures());
        Assertions.assertEquals(1, slot.restarts());
    }

    @Test
    void replacedLoopCannotClaimAndOnlyRevokesItsOwnClaim() {
        WorkerSlot slot = new WorkerSlot(0, "run-1-worker-0");
        long old = slot.generation();
        long current = slot.nextGeneration();

        WorkerSlot.Claim stale = new WorkerSlot.Claim(new QueuedTask(1L, Map.of(), 2), old, 3L, 3);
        Assertions.assertFalse(slot.claim(stale));
        Assertions.assertFalse(slot.hasClaim());

        WorkerSlot.Claim fresh = new WorkerSlot.Claim(new QueuedTask(2L, Map.of()), current, 1L, 1);
        Assertions.assertTrue(slot.claim(fresh));
        Assertions.assertTrue(slot.revoke(old).isEmpty());
        Assertions.assertTrue(slot.hasClaim());
        Assertions.assertEquals(fresh, slot.revoke(current).orElseThrow());
        Assertions.assertFalse(slot.release(fresh));
    }

    private static SweepStore openStore(Path root) {
        Database db = new Database(SweepMeshConfig.fromRoot(root.toString()));
        db.init();
        return new SweepStore(db);
    }

    private static Run newRun(SweepStore store, List<Map<String, Object>> combinations) {
        Target target = store.getOrCreateTarget("https://example.test/bt/watchdog", null, 1L);
        return store.createRun(target.id(), null, RunMode.SWEEP, "{}", combinations, 2L);
    }
}
