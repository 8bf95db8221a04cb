package io.sweepmesh.storage;

import io.sweepmesh.config.SweepMeshConfig;
import io.sweepmesh.model.CacheKey;
import io.sweepmesh.model.FailureRecord;
import io.sweepmesh.model.FailureType;
import io.sweepmesh.model.Metrics;
import io.sweepmesh.model.ResultRecord;
import io.sweepmesh.model.Run;
import io.sweepmesh.model.RunMode;
import io.sweepmesh.model.RunStatus;
import io.sweepmesh.model.SweepTask;
import io.sweepmesh.model.Target;
import io.sweepmesh.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

final class SweepStoreTest {

    @Test
    void createRunInsertsOnePendingTaskPerCombination() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-create-");
        try {
            SweepStore store = openStore(root);
            Target target = store.getOrCreateTarget("https://example.test/bt/1", "Iron condor", 1_000L);
            Run run = store.createRun(target.id(), "delta sweep", RunMode.SWEEP, "{}",
                    List.of(Map.of("delta", 5), Map.of("delta", 6), Map.of("delta", 7)), 2_000L);

            Assertions.assertEquals(RunStatus.PENDING, run.status());
            Assertions.assertNull(run.startedAtMs());
            List<SweepTask> tasks = store.listTasks(run.id(), null);
            Assertions.assertEquals(3, tasks.size());
            Assertions.assertTrue(tasks.stream().allMatch(t -> t.status() == TaskStatus.PENDING && t.attempts() == 0));
            Assertions.assertEquals(5, tasks.get(0).params().get("delta"));

            Target reloaded = store.getTarget(target.id()).orElseThrow();
            Assertions.assertEquals(1, reloaded.runCount());
            Assertions.assertEquals(2_000L, reloaded.lastRunAtMs());

            Target again = store.getOrCreateTarget("https://example.test/bt/1", null, 3_000L);
            Assertions.assertEquals(target.id(), again.id());
            Assertions.assertEquals("Iron condor", again.name());
            Assertions.assertEquals(1, store.listTargets().size());

            Assertions.assertThrows(IllegalArgumentException.class, () ->
                    store.createRun(9_999L, null, RunMode.SWEEP, "{}", List.of(Map.of("delta", 5)), 4_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runTransitionsFollowLifecycle() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-transition-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, "https://example.test/bt/2", List.of(Map.of("delta", 5)));

            Run running = store.transitionRun(run.id(), RunStatus.PENDING, RunStatus.RUNNING, 10L);
            Assertions.assertEquals(RunStatus.RUNNING, running.status());
            Assertions.assertEquals(10L, running.startedAtMs());

            store.transitionRun(run.id(), RunStatus.RUNNING, RunStatus.PAUSED, 20L);
            Run resumed = store.transitionRun(run.id(), RunStatus.PAUSED, RunStatus.RUNNING, 30L);
            Assertions.assertEquals(10L, resumed.startedAtMs());

            Assertions.assertThrows(IllegalStateException.class, () ->
                    store.transitionRun(run.id(), RunStatus.PAUSED, RunStatus.RUNNING, 40L));

            Run done = store.transitionRun(run.id(), RunStatus.RUNNING, RunStatus.COMPLETED, 50L);
            Assertions.assertEquals(50L, done.completedAtMs());
            Assertions.assertThrows(IllegalStateException.class, () ->
                    store.transitionRun(run.id(), RunStatus.COMPLETED, RunStatus.RUNNING, 60L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void leaseEpochFencesStaleSuccessAndFailureCommits() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-lease-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, "https://example.test/bt/3", List.of(Map.of("delta", 5)));
            long taskId = store.listTasks(run.id(), null).get(0).id();

            SweepStore.LeaseGrant grant = store.tryMarkTaskRunning(taskId, "run-1-worker-0", 100L);
            Assertions.assertTrue(grant.started());
            Assertions.assertEquals(1L, grant.leaseEpoch());
            Assertions.assertEquals(1, grant.attempts());
            Assertions.assertFalse(store.tryMarkTaskRunning(taskId, "run-1-worker-1", 101L).started());

            SweepStore.FailureResolution stale = store.tryCompleteFailureWithLease(
                    taskId, grant.leaseEpoch() + 1L, SweepStore.FailureDetail.of(FailureType.TIMING, "slow"), 3, 102L);
            Assertions.assertEquals(SweepStore.FailureOutcome.STALE_LEASE, stale.outcome());
            Assertions.assertFalse(store.tryMarkTaskSuccessWithLease(taskId, grant.leaseEpoch() + 1L, pl(1.0), "{}", 103L));

            SweepStore.FailureResolution retry = store.tryCompleteFailureWithLease(
                    taskId, grant.leaseEpoch(), SweepStore.FailureDetail.of(FailureType.TIMING, "slow"), 3, 104L);
            Assertions.assertEquals(SweepStore.FailureOutcome.RETRY_SCHEDULED, retry.outcome());
            SweepTask afterRetry = store.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, afterRetry.status());
            Assertions.assertEquals("slow", afterRetry.lastError());
            Assertions.assertNull(afterRetry.leaseOwner());

            SweepStore.LeaseGrant second = store.tryMarkTaskRunning(taskId, "run-1-worker-0", 105L);
            Assertions.assertEquals(2L, second.leaseEpoch());
            Assertions.assertFalse(store.tryMarkTaskSuccessWithLease(taskId, grant.leaseEpoch(), pl(1.0), "{}", 106L));
            Assertions.assertTrue(store.tryMarkTaskSuccessWithLease(taskId, second.leaseEpoch(), pl(42.5), "{\"rows\":3}", 107L));

            SweepTask done = store.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, done.status());
            Assertions.assertEquals(2, done.attempts());
            ResultRecord result = store.getResult(taskId).orElseThrow();
            Assertions.assertEquals(42.5, result.metrics().pl());
            Assertions.assertFalse(result.cached());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exhaustedRetriesFailPermanentlyWithOneFailureRecord() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-exhaust-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, "https://example.test/bt/4", List.of(Map.of("stop_loss", 50)));
            long taskId = store.listTasks(run.id(), null).get(0).id();

            SweepStore.FailureResolution resolution = null;
            for (int i = 0; i < 4; i++) {
                SweepStore.LeaseGrant grant = store.tryMarkTaskRunning(taskId, "w", 10L + i);
                Assertions.assertTrue(grant.started());
                resolution = store.tryCompleteFailureWithLease(taskId, grant.leaseEpoch(),
                        new SweepStore.FailureDetail(FailureType.MODAL, "modal " + i, "/tmp/s.png", null, "[]"), 3, 20L + i);
                if (i < 3) {
                    Assertions.assertEquals(SweepStore.FailureOutcome.RETRY_SCHEDULED, resolution.outcome());
                }
            }
            Assertions.assertEquals(SweepStore.FailureOutcome.FAILED_PERMANENTLY, resolution.outcome());
            Assertions.assertEquals(4, resolution.attempts());
            Assertions.assertEquals(TaskStatus.FAILED, store.getTask(taskId).orElseThrow().status());
            Assertions.assertFalse(store.tryMarkTaskRunning(taskId, "w", 99L).started());

            List<FailureRecord> failures = store.listFailures(run.id());
            Assertions.assertEquals(1, failures.size());
            Assertions.assertEquals(3, failures.get(0).attemptNumber());
            Assertions.assertEquals(FailureType.MODAL, failures.get(0).failureType());
            Assertions.assertEquals("modal 3", failures.get(0).errorMessage());
            Assertions.assertEquals("/tmp/s.png", failures.get(0).screenshotPath());
            Assertions.assertEquals(new SweepStore.RunStats(1, 0, 0, 0, 1), store.runStats(run.id()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cacheLookupIsScopedToTargetAndCompletedTasks() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-cache-");
        try {
            SweepStore store = openStore(root);
            Run first = newRun(store, "https://example.test/bt/5", List.of(Map.of("delta", 10), Map.of("delta", 11)));
            Target target = store.getTarget(first.targetId()).orElseThrow();
            List<SweepTask> tasks = store.listTasks(first.id(), null);

            Assertions.assertTrue(store.findCachedResult(CacheKey.single(target.id(), "delta", 10)).isEmpty());

            SweepStore.LeaseGrant grant = store.tryMarkTaskRunning(tasks.get(0).id(), "w", 10L);
            store.tryMarkTaskSuccessWithLease(tasks.get(0).id(), grant.leaseEpoch(), pl(7.0), "{}", 11L);
            SweepStore.LeaseGrant failing = store.tryMarkTaskRunning(tasks.get(1).id(), "w", 12L);
            store.tryCompleteFailureWithLease(tasks.get(1).id(), failing.leaseEpoch(),
                    SweepStore.FailureDetail.of(FailureType.PERMANENT, "bad"), 0, 13L);

            Optional<ResultRecord> hit = store.findCachedResult(CacheKey.single(target.id(), "delta", 10));
            Assertions.assertTrue(hit.isPresent());
            Assertions.assertEquals(tasks.get(0).id(), hit.get().taskId());
            Assertions.assertTrue(store.findCachedResult(CacheKey.single(target.id(), "delta", 11)).isEmpty());

            Run other = newRun(store, "https://example.test/bt/other", List.of(Map.of("delta", 10)));
            Assertions.assertTrue(store.findCachedResult(CacheKey.single(other.targetId(), "delta", 10)).isEmpty());

            Run second = store.createRun(target.id(), null, RunMode.SWEEP, "{}", List.of(Map.of("delta", 10)), 20L);
            long reuseId = store.listTasks(second.id(), null).get(0).id();
            Assertions.assertTrue(store.completeFromCache(reuseId, hit.get(), 21L));
            Assertions.assertFalse(store.completeFromCache(reuseId, hit.get(), 22L));

            SweepTask reused = store.getTask(reuseId).orElseThrow();
            Assertions.assertEquals(TaskStatus.COMPLETED, reused.status());
            Assertions.assertEquals(0, reused.attempts());
            ResultRecord copy = store.getResult(reuseId).orElseThrow();
            Assertions.assertTrue(copy.cached());
            Assertions.assertEquals(tasks.get(0).id(), copy.cachedFromTaskId());
            Assertions.assertEquals(7.0, copy.metrics().pl());

            ResultRecord newest = store.findCachedResult(CacheKey.single(target.id(), "delta", 10)).orElseThrow();
            Assertions.assertEquals(reuseId, newest.taskId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resetRunningTasksRecoversAbandonedLeases() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-reset-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, "https://example.test/bt/6", List.of(Map.of("delta", 5), Map.of("delta", 6)));
            long taskId = store.listTasks(run.id(), null).get(0).id();
            store.tryMarkTaskRunning(taskId, "w", 10L);

            Assertions.assertEquals(1, store.listTasks(run.id(), TaskStatus.RUNNING).size());
            Assertions.assertEquals(1, store.resetRunningTasks(run.id(), 11L));
            Assertions.assertEquals(2, store.listTasks(run.id(), TaskStatus.PENDING).size());
            Assertions.assertEquals(1, store.getTask(taskId).orElseThrow().attempts());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void databaseInitIsIdempotentAndRecordsMigrations() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-init-");
        try {
            Database db = new Database(SweepMeshConfig.fromRoot(root.toString()));
            db.init();
            db.init();
            Assertions.assertTrue(db.appliedMigrations().contains("20261019_001_cache_lookup_index"));
            Assertions.assertTrue(Files.isDirectory(root.resolve("artifacts")));
            Assertions.assertTrue(Files.exists(root.resolve("sweepmesh.db")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void releasedLeaseReturnsTaskToPendingWithoutChargingAnAttempt() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-release-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, "https://example.test/bt/7", List.of(Map.of("delta", 5)));
            long taskId = store.listTasks(run.id(), null).get(0).id();
            SweepStore.LeaseGrant grant = store.tryMarkTaskRunning(taskId, "w", 10L);

            Assertions.assertFalse(store.releaseLease(taskId, grant.leaseEpoch() - 1, 11L));
            Assertions.assertTrue(store.releaseLease(taskId, grant.leaseEpoch(), 11L));
            Assertions.assertFalse(store.releaseLease(taskId, grant.leaseEpoch(), 12L));

            SweepTask task = store.getTask(taskId).orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, task.status());
            Assertions.assertEquals(0, task.attempts());
            Assertions.assertNull(task.leaseOwner());
            Assertions.assertFalse(store.tryMarkTaskSuccessWithLease(taskId, grant.leaseEpoch(), pl(1.0), "{}", 13L));

            SweepStore.LeaseGrant next = store.tryMarkTaskRunning(taskId, "w2", 14L);
            Assertions.assertEquals(1, next.attempts());
            Assertions.assertTrue(next.leaseEpoch() > grant.leaseEpoch());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void listResultsCoversCompletedTasksOfOneRun() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-results-");
        try {
            SweepStore store = openStore(root);
            Run run = newRun(store, "https://example.test/bt/8", List.of(Map.of("delta", 5), Map.of("delta", 6), Map.of("delta", 7)));
            List<SweepTask> tasks = store.listTasks(run.id(), null);
            SweepStore.LeaseGrant first = store.tryMarkTaskRunning(tasks.get(0).id(), "w", 10L);
            store.tryMarkTaskSuccessWithLease(tasks.get(0).id(), first.leaseEpoch(), pl(10.0), "{}", 11L);
            SweepStore.LeaseGrant third = store.tryMarkTaskRunning(tasks.get(2).id(), "w", 12L);
            store.tryMarkTaskSuccessWithLease(tasks.get(2).id(), third.leaseEpoch(), pl(30.0), "{}", 13L);
            Run other = newRun(store, "https://example.test/bt/8", List.of(Map.of("delta", 9)));
            long otherTask = store.listTasks(other.id(), null).get(0).id();
            SweepStore.LeaseGrant elsewhere = store.tryMarkTaskRunning(otherTask, "w", 14L);
            store.tryMarkTaskSuccessWithLease(otherTask, elsewhere.leaseEpoch(), pl(90.0), "{}", 15L);

            List<ResultRecord> results = store.listResults(run.id());
            Assertions.assertEquals(List.of(tasks.get(0).id(), tasks.get(2).id()),
                    results.stream().map(ResultRecord::taskId).toList());
            Assertions.assertEquals(30.0, results.get(1).metrics().pl());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reinitLeavesTaskRowsUntouched() throws Exception {
        Path root = Files.createTempDirectory("sweepmesh-test-store-reinit-");
        try {
            Database db = new Database(SweepMeshConfig.fromRoot(root.toString()));
            db.init();
            SweepStore store = new SweepStore(db);
            Run run = newRun(store, "https://example.test/bt/9", List.of(Map.of("delta", 5)));
            long taskId = store.listTasks(run.id(), null).get(0).id();
            try (Connection c = db.openConnection();
                 PreparedStatement ps = c.prepareStatement("UPDATE tasks SET attempts=2,lease_epoch=0 WHERE id=?")) {
                ps.setLong(1, taskId);
                ps.executeUpdate();
            }

            db.init();

            SweepTask task = store.getTask(taskId).orElseThrow();
            Assertions.assertEquals(2, task.attempts());
            Assertions.assertEquals(0L, task.leaseEpoch());
            Assertions.assertEquals(List.of("20261019_001_cache_lookup_index", "20261019_002_result_provenance_index"),
                    db.appliedMigrations());
        } finally {
            deleteRecursively(root);
        }
    }

    static SweepStore openStore(Path root) {
        Database db = new Database(SweepMeshConfig.fromRoot(root.toString()));
        db.init();
        return new SweepStore(db);
    }

    private static Run newRun(SweepStore store, String url, List<Map<String, Object>> combinations) {
        Target target = store.getOrCreateTarget(url, null, 1L);
        return store.createRun(target.id(), null, RunMode.SWEEP, "{}", combinations, 2L);
    }

    private static Metrics pl(double value) {
        return new Metrics(value, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
