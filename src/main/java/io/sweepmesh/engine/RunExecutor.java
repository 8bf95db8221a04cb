package io.sweepmesh.engine;

import io.sweepmesh.cache.CacheGate;
import io.sweepmesh.model.Credentials;
import io.sweepmesh.model.FailureType;
import io.sweepmesh.model.ResultRecord;
import io.sweepmesh.model.Run;
import io.sweepmesh.model.RunStatus;
import io.sweepmesh.model.SweepTask;
import io.sweepmesh.model.Target;
import io.sweepmesh.model.TaskStatus;
import io.sweepmesh.queue.PriorityTaskQueue;
import io.sweepmesh.queue.QueueStats;
import io.sweepmesh.queue.QueuedTask;
import io.sweepmesh.storage.SweepStore;
import io.sweepmesh.util.Jsons;
import io.sweepmesh.worker.CrashSignatures;
import io.sweepmesh.worker.TaskOutcome;
import io.sweepmesh.worker.TaskRequest;
import io.sweepmesh.worker.WorkerContext;
import io.sweepmesh.worker.WorkerFactory;
import io.sweepmesh.worker.WorkerHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Executes one run: loads its pending tasks into a priority queue and drains it with a pool of
 * supervised worker loops, a watchdog and a progress reporter.
 * <p>
 * Lifecycle: {@code pending -> running <-> paused -> completed | failed}. {@link #execute()} blocks the
 * calling thread until the queue is drained, {@link #stop()} is called or an infrastructure error
 * occurs; {@link #pause()}, {@link #resume()} and {@link #stop()} may be called from any thread.
 * <p>
 * A failed attempt is retried by re-queueing the task with priority equal to its attempt count, so
 * fresh tasks go first. After {@code maxRetries} retries the task fails permanently; that never fails
 * the run. Store errors do.
 */
public final class RunExecutor {
    private static final Logger log = LoggerFactory.getLogger(RunExecutor.class);
    private static final long FINAL_JOIN_MS = 1_000L;

    private final SweepStore store;
    private final long runId;
    private final WorkerFactory workerFactory;
    private final int numWorkers;
    private final ExecutionOptions options;
    private final Credentials credentials;
    private final Path artifactsDir;
    private final Function<Map<String, Object>, List<Map<String, Object>>> instructionResolver;
    private final List<RunUpdateListener> listeners;
    private final Clock clock;
    private final CacheGate cacheGate;
    private final PriorityTaskQueue queue = new PriorityTaskQueue();
    private final List<WorkerSlot> slots = new ArrayList<>();
    private final Object stateLock = new Object();
    private final AtomicInteger cacheHits = new AtomicInteger();
    private final AtomicInteger restartsInProgress = new AtomicInteger();
    private final AtomicReference<Throwable> fatal = new AtomicReference<>();

    private volatile boolean paused;
    private volatile boolean stopRequested;
    private volatile boolean shuttingDown;
    private volatile Target target;
    private boolean started;
    private RunStatus status;
    private ScheduledExecutorService scheduler;

    private RunExecutor(Builder builder) {
        this.store = builder.store;
        this.runId = builder.runId;
        this.workerFactory = builder.workerFactory;
        this.numWorkers = builder.numWorkers;
        this.options = builder.options;
        this.credentials = builder.credentials;
        this.artifactsDir = builder.artifactsDir;
        this.instructionResolver = builder.instructionResolver;
        this.listeners = List.copyOf(builder.listeners);
        this.clock = builder.clock;
        this.cacheGate = new CacheGate(store);
    }

    public static Builder builder(SweepStore store, long runId, WorkerFactory workerFactory) {
        return new Builder(store, runId, workerFactory);
    }

    public long runId() {
        return runId;
    }

    public RunSummary execute() {
        long startedAtMs = clock.millis();
        synchronized (stateLock) {
            if (started) {
                throw new IllegalStateException("Run executor already started for run " + runId);
            }
            started = true;
        }
        Run run = store.getRun(runId).orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        if (run.status().isTerminal()) {
            throw new IllegalStateException("Run " + runId + " is already " + run.status().wireName());
        }
        target = store.getTarget(run.targetId())
                .orElseThrow(() -> new IllegalStateException("Run " + runId + " references missing target " + run.targetId()));

        int recovered = store.resetRunningTasks(runId, clock.millis());
        if (recovered > 0) {
            log.info("Run {}: {} task(s) left running by a previous execution returned to pending", runId, recovered);
        }
        List<SweepTask> pending = store.listTasks(runId, TaskStatus.PENDING);
        for (SweepTask task : pending) {
            queue.put(new QueuedTask(task.id(), task.params(), task.attempts()), task.attempts());
        }
        enterRunning(run.status());
        log.info("Run {} started: {} task(s), {} worker(s), target {}", runId, pending.size(), numWorkers, target.url());
        emit(RunEventType.RUN_STARTED, Map.of("total_tasks", pending.size()));

        try {
            if (!pending.isEmpty()) {
                launch();
                awaitCompletion();
            }
        } catch (RuntimeException e) {
            fail("executor", e);
        } finally {
            shutdown();
        }
        return finish(startedAtMs);
    }

    /**
     * @return true when the run moved from running to paused
     */
    public boolean pause() {
        synchronized (stateLock) {
            if (status != RunStatus.RUNNING || shuttingDown) {
                return false;
            }
            store.transitionRun(runId, RunStatus.RUNNING, RunStatus.PAUSED, clock.millis());
            status = RunStatus.PAUSED;
            paused = true;
        }
        log.info("Run {} paused", runId);
        return true;
    }

    public boolean resume() {
        synchronized (stateLock) {
            if (status != RunStatus.PAUSED || shuttingDown) {
                return false;
            }
            store.transitionRun(runId, RunStatus.PAUSED, RunStatus.RUNNING, clock.millis());
            status = RunStatus.RUNNING;
            paused = false;
            stateLock.notifyAll();
        }
        log.info("Run {} resumed", runId);
        return true;
    }

    public void stop() {
        if (!stopRequested) {
            log.info("Run {} stop requested", runId);
        }
        stopRequested = true;
        signal();
    }

    public boolean isPaused() {
        return paused;
    }

    public QueueStats queueStats() {
        return queue.stats();
    }

    public int workerRestarts() {
        int total = 0;
        for (WorkerSlot slot : slots) {
            total += slot.restarts();
        }
        return total;
    }

    public int cacheHits() {
        return cacheHits.get();
    }

    private void enterRunning(RunStatus current) {
        synchronized (stateLock) {
            if (current != RunStatus.RUNNING) {
                store.transitionRun(runId, current, RunStatus.RUNNING, clock.millis());
            }
            status = RunStatus.RUNNING;
        }
    }

    private void launch() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "sweepmesh-run-" + runId + "-watchdog");
            t.setDaemon(true);
            return t;
        });
        for (int i = 0; i < numWorkers; i++) {
            slots.add(new WorkerSlot(i, "run-" + runId + "-worker-" + i));
        }
        for (WorkerSlot slot : slots) {
            WorkerHandle handle = createHandle(slot);
            if (handle == null) {
                return;
            }
            slot.installHandle(slot.generation(), handle);
            slot.touch(clock.millis());
        }
        for (WorkerSlot slot : slots) {
            startLoop(slot, slot.generation());
        }
        Watchdog watchdog = new Watchdog(this, List.copyOf(slots), clock, options.stallThresholdMs());
        scheduler.scheduleWithFixedDelay(watchdog, options.watchdogIntervalMs(), options.watchdogIntervalMs(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::emitProgress, options.progressIntervalMs(), options.progressIntervalMs(), TimeUnit.MILLISECONDS);
    }

    private void awaitCompletion() {
        try {
            synchronized (stateLock) {
                while (!queue.isDrained() && !stopRequested && fatal.get() == null) {
                    if (restartsInProgress.get() == 0 && !anyLoopAlive()) {
                        throw new IllegalStateException("All worker loops exited with work remaining");
                    }
                    stateLock.wait(options.pollTimeoutMs());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Run {} monitor interrupted, stopping", runId);
            stopRequested = true;
        }
    }

    private boolean anyLoopAlive() {
        for (WorkerSlot slot : slots) {
            Thread thread = slot.thread();
            if (thread != null && thread.isAlive()) {
                return true;
            }
        }
        return false;
    }

    private void startLoop(WorkerSlot slot, long generation) {
        Thread thread = new Thread(() -> workerLoop(slot, generation), "sweepmesh-run-" + runId + "-worker-" + slot.index());
        thread.setDaemon(true);
        slot.thread(thread);
        thread.start();
    }

    private boolean isLive(WorkerSlot slot, long generation) {
        return !shuttingDown && !stopRequested && fatal.get() == null && slot.generation() == generation;
    }

    private void workerLoop(WorkerSlot slot, long generation) {
        log.debug("Worker loop {} (generation {}) started", slot.workerId(), generation);
        try {
            while (isLive(slot, generation)) {
                if (paused) {
                    slot.touch(clock.millis());
                    Thread.sleep(options.pollTimeoutMs());
                    continue;
                }
                Optional<QueuedTask> next = queue.get(options.pollTimeoutMs(), TimeUnit.MILLISECONDS);
                if (next.isEmpty()) {
                    slot.touch(clock.millis());
                    continue;
                }
                if (!isLive(slot, generation)) {
                    queue.requeue(next.get(), next.get().attempts());
                    break;
                }
                process(slot, generation, next.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker loop {} interrupted", slot.workerId());
        } catch (RuntimeException | Error e) {
            fail(slot.workerId(), e);
        } finally {
            abandonClaim(slot, generation);
            signal();
        }
    }

    /**
     * Settles a claim the exiting loop still holds so its task is neither left in flight nor running.
     */
    private void abandonClaim(WorkerSlot slot, long generation) {
        Optional<WorkerSlot.Claim> leftover = slot.revoke(generation);
        if (leftover.isEmpty()) {
            return;
        }
        log.warn("Worker loop {} exited while holding task {}", slot.workerId(), leftover.get().task().taskId());
        try {
            settleFailure(leftover.get(), FailureType.UNKNOWN, "worker loop exited", TaskOutcome.Artifacts.none());
        } catch (RuntimeException e) {
            fail(slot.workerId(), e);
        }
    }

    private void process(WorkerSlot slot, long generation, QueuedTask task) {
        Optional<ResultRecord> cached = cacheGate.tryServe(target.id(), task.taskId(), task.params(), options.skipCache(), clock.millis());
        if (cached.isPresent()) {
            queue.markCompleted(task);
            cacheHits.incrementAndGet();
            slot.touch(clock.millis());
            Map<String, Object> data = taskData(task);
            data.put("result", Jsons.convertToMap(cached.get().metrics()));
            data.put("cached", true);
            data.put("cached_from_task_id", cached.get().taskId());
            emit(RunEventType.TASK_COMPLETED, data);
            signal();
            return;
        }

        List<Map<String, Object>> instructions = instructionResolver.apply(task.params());
        SweepStore.LeaseGrant grant = store.tryMarkTaskRunning(task.taskId(), slot.workerId(), clock.millis());
        if (!grant.started()) {
            log.warn("Task {} is no longer pending, dropping it from the queue", task.taskId());
            queue.release(task);
            signal();
            return;
        }
        WorkerSlot.Claim claim = new WorkerSlot.Claim(task.withAttempts(grant.attempts()), generation,
                grant.leaseEpoch(), grant.attempts());
        if (!slot.claim(claim)) {
            log.debug("Worker loop {} was replaced before claiming task {}, handing it back", slot.workerId(), task.taskId());
            store.releaseLease(task.taskId(), grant.leaseEpoch(), clock.millis());
            queue.requeue(task, task.attempts());
            signal();
            return;
        }
        slot.touch(clock.millis());
        int attemptIndex = grant.attempts() - 1;
        Map<String, Object> startedData = taskData(task);
        startedData.put("attempt", attemptIndex);
        emit(RunEventType.TASK_STARTED, startedData);

        TaskOutcome outcome = delegate(slot.handle(),
                new TaskRequest(runId, task.taskId(), attemptIndex, target.url(), task.params(), instructions));
        if (!slot.release(claim)) {
            log.info("Discarding late outcome of task {} from replaced worker {}", task.taskId(), slot.workerId());
            return;
        }
        slot.touch(clock.millis());

        if (outcome.success()) {
            boolean stored = store.tryMarkTaskSuccessWithLease(task.taskId(), claim.leaseEpoch(), outcome.results(),
                    Jsons.toCompactJson(outcome.rawData()), clock.millis());
            if (stored) {
                queue.markCompleted(task);
                slot.resetFailures();
                Map<String, Object> data = taskData(task);
                data.put("result", Jsons.convertToMap(outcome.results()));
                data.put("cached", false);
                emit(RunEventType.TASK_COMPLETED, data);
            } else {
                log.warn("Lease on task {} was lost before its result was stored, result discarded", task.taskId());
                queue.release(task);
            }
            signal();
            return;
        }

        int consecutive = slot.recordFailure();
        settleFailure(claim, outcome.failureType(), outcome.errorMessage(), outcome.artifacts());
        if (outcome.failureType().requiresRestart()) {
            restartFromLoop(slot, generation, "browser failure on task " + task.taskId());
        } else if (consecutive >= options.restartAfterConsecutiveFailures()) {
            restartFromLoop(slot, generation, consecutive + " consecutive failures");
        }
    }

    private TaskOutcome delegate(WorkerHandle handle, TaskRequest request) {
        try {
            TaskOutcome outcome = handle.execute(request);
            return outcome == null ? TaskOutcome.failure(FailureType.UNKNOWN, "worker returned no outcome") : outcome;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.failure(FailureType.BROWSER, "worker interrupted");
        } catch (Throwable e) {
            FailureType type = CrashSignatures.classify(e);
            log.debug("Worker raised on task {} ({})", request.taskId(), type.wireName(), e);
            return TaskOutcome.failure(type, CrashSignatures.describe(e));
        }
    }

    private void settleFailure(WorkerSlot.Claim claim, FailureType type, String message, TaskOutcome.Artifacts artifacts) {
        QueuedTask task = claim.task();
        TaskOutcome.Artifacts captured = artifacts == null ? TaskOutcome.Artifacts.none() : artifacts;
        SweepStore.FailureDetail detail = new SweepStore.FailureDetail(
                type, message, captured.screenshotPath(), captured.htmlPath(), captured.consoleLogJson());
        SweepStore.FailureResolution resolution = store.tryCompleteFailureWithLease(
                task.taskId(), claim.leaseEpoch(), detail, options.maxRetries(), clock.millis());
        switch (resolution.outcome()) {
            case STALE_LEASE -> {
                log.warn("Lease on task {} was lost before its failure was recorded", task.taskId());
                queue.release(task);
            }
            case FAILED_PERMANENTLY -> {
                queue.markFailed(task);
                log.warn("Task {} failed permanently after {} attempt(s): [{}] {}",
                        task.taskId(), resolution.attempts(), type.wireName(), message);
                emit(RunEventType.TASK_FAILED, failureData(task, type, message, resolution.attempts(), false));
            }
            case RETRY_SCHEDULED -> {
                queue.requeue(task.withAttempts(resolution.attempts()), resolution.attempts());
                log.info("Task {} attempt {} failed [{}], retrying: {}",
                        task.taskId(), resolution.attempts() - 1, type.wireName(), message);
                emit(RunEventType.TASK_FAILED, failureData(task, type, message, resolution.attempts(), true));
            }
        }
        signal();
    }

    private void restartFromLoop(WorkerSlot slot, long generation, String reason) {
        log.warn("Restarting worker {}: {}", slot.workerId(), reason);
        restartsInProgress.incrementAndGet();
        try {
            closeQuietly(slot);
            WorkerHandle fresh = createHandle(slot);
            if (fresh == null) {
                return;
            }
            if (!slot.installHandle(generation, fresh)) {
                fresh.close();
                return;
            }
            slot.recordRestart();
            slot.touch(clock.millis());
        } finally {
            restartsInProgress.decrementAndGet();
        }
    }

    boolean watchdogShouldAct() {
        return !paused && !shuttingDown && !stopRequested && fatal.get() == null && !queue.isDrained();
    }

    boolean hasWaitingTasks() {
        return queue.hasPending();
    }

    /**
     * Replaces a stalled slot: its claim is failed as a browser failure, its handle closed, its thread
     * interrupted and a new loop started with a fresh handle.
     */
    void forceRestart(WorkerSlot slot) {
        restartsInProgress.incrementAndGet();
        try {
            long generation = slot.nextGeneration();
            Optional<WorkerSlot.Claim> revoked = slot.revoke();
            Thread stuck = slot.thread();
            closeQuietly(slot);
            if (stuck != null) {
                stuck.interrupt();
            }
            revoked.ifPresent(claim -> settleFailure(claim, FailureType.BROWSER, "worker stalled", TaskOutcome.Artifacts.none()));
            WorkerHandle fresh = createHandle(slot);
            if (fresh == null || !slot.installHandle(generation, fresh)) {
                return;
            }
            slot.recordRestart();
            slot.touch(clock.millis());
            startLoop(slot, generation);
        } finally {
            restartsInProgress.decrementAndGet();
        }
    }

    private WorkerHandle createHandle(WorkerSlot slot) {
        WorkerContext context = new WorkerContext(runId, slot.index(), target.url(), credentials, artifactsDir);
        Exception last = null;
        for (int attempt = 1; attempt <= options.maxHandleCreationFailures(); attempt++) {
            if (shuttingDown || fatal.get() != null) {
                return null;
            }
            try {
                return workerFactory.create(context);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            } catch (Exception e) {
                last = e;
                log.warn("Failed to create worker handle for {} (attempt {}/{}): {}",
                        slot.workerId(), attempt, options.maxHandleCreationFailures(), e.toString());
            }
        }
        fail(slot.workerId(), new IllegalStateException(
                "Could not create a worker handle for " + slot.workerId() + " after "
                        + options.maxHandleCreationFailures() + " attempts", last));
        return null;
    }

    private void closeQuietly(WorkerSlot slot) {
        WorkerHandle handle = slot.handle();
        if (handle == null) {
            return;
        }
        try {
            handle.close();
        } catch (RuntimeException e) {
            log.warn("Closing worker handle of {} failed", slot.workerId(), e);
        }
    }

    void fail(String source, Throwable error) {
        if (fatal.compareAndSet(null, error)) {
            log.error("Run {} aborted by {}", runId, source, error);
        }
        signal();
    }

    private void shutdown() {
        shuttingDown = true;
        signal();
        if (scheduler != null) {
            scheduler.shutdownNow();
            try {
                if (!scheduler.awaitTermination(FINAL_JOIN_MS, TimeUnit.MILLISECONDS)) {
                    log.warn("Watchdog of run {} did not stop within {} ms", runId, FINAL_JOIN_MS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(options.shutdownGraceMs());
        for (WorkerSlot slot : slots) {
            join(slot.thread(), Math.max(0L, TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime())));
        }
        for (WorkerSlot slot : slots) {
            Thread thread = slot.thread();
            if (thread != null && thread.isAlive()) {
                log.warn("Worker loop {} did not finish within the shutdown grace period, interrupting", slot.workerId());
                thread.interrupt();
                join(thread, FINAL_JOIN_MS);
            }
        }
        for (WorkerSlot slot : slots) {
            closeQuietly(slot);
        }
    }

    private void join(Thread thread, long timeoutMs) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(Math.max(1L, timeoutMs));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private RunSummary finish(long startedAtMs) {
        SweepStore.RunStats stats = store.runStats(runId);
        Throwable error = fatal.get();
        RunStatus finalStatus = error == null && stats.pending() == 0 && stats.running() == 0
                ? RunStatus.COMPLETED
                : RunStatus.FAILED;
        synchronized (stateLock) {
            store.transitionRun(runId, status, finalStatus, clock.millis());
            status = finalStatus;
            paused = false;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("status", finalStatus.wireName());
        data.put("stats", statsMap(queue.stats()));
        emit(RunEventType.RUN_COMPLETED, data);
        log.info("Run {} finished {}: {} completed, {} failed, {} pending, {} cache hit(s), {} worker restart(s)",
                runId, finalStatus.wireName(), stats.completed(), stats.failed(), stats.pending() + stats.running(),
                cacheHits.get(), workerRestarts());
        return new RunSummary(
                runId,
                finalStatus,
                stats.total(),
                stats.completed(),
                stats.failed(),
                stats.pending() + stats.running(),
                cacheHits.get(),
                workerRestarts(),
                Math.max(0L, clock.millis() - startedAtMs),
                error == null ? null : CrashSignatures.describe(error)
        );
    }

    private void emitProgress() {
        try {
            emit(RunEventType.PROGRESS, Map.of("stats", statsMap(queue.stats())));
        } catch (RuntimeException e) {
            log.warn("Progress report for run {} failed", runId, e);
        }
    }

    private void emit(RunEventType type, Map<String, Object> data) {
        RunEvent event = new RunEvent(runId, type, clock.millis(), data);
        for (RunUpdateListener listener : listeners) {
            try {
                listener.onUpdate(runId, event);
            } catch (RuntimeException e) {
                log.warn("Run update listener failed on {} for run {}", type.wireName(), runId, e);
            }
        }
    }

    private void signal() {
        synchronized (stateLock) {
            stateLock.notifyAll();
        }
    }

    private static Map<String, Object> taskData(QueuedTask task) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("task_id", task.taskId());
        data.put("params", task.params());
        return data;
    }

    private static Map<String, Object> failureData(QueuedTask task, FailureType type, String error, int attempts, boolean willRetry) {
        Map<String, Object> data = taskData(task);
        data.put("error", error);
        data.put("failure_type", type.wireName());
        data.put("attempt", attempts - 1);
        data.put("will_retry", willRetry);
        return data;
    }

    private static Map<String, Object> statsMap(QueueStats stats) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("pending", stats.pending());
        out.put("in_progress", stats.inProgress());
        out.put("completed", stats.completed());
        out.put("failed", stats.failed());
        return out;
    }

    public static final class Builder {
        private final SweepStore store;
        private final long runId;
        private final WorkerFactory workerFactory;
        private final List<RunUpdateListener> listeners = new ArrayList<>();
        private int numWorkers = 1;
        private ExecutionOptions options = ExecutionOptions.defaults();
        private Credentials credentials = new Credentials("", "");
        private Path artifactsDir;
        private Function<Map<String, Object>, List<Map<String, Object>>> instructionResolver = params -> List.of();
        private Clock clock = Clock.systemUTC();

        private Builder(SweepStore store, long runId, WorkerFactory workerFactory) {
            if (store == null || workerFactory == null) {
                throw new IllegalArgumentException("store and worker factory are required");
            }
            this.store = store;
            this.runId = runId;
            this.workerFactory = workerFactory;
        }

        public Builder numWorkers(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("numWorkers must be >= 1: " + value);
            }
            this.numWorkers = value;
            return this;
        }

        public Builder options(ExecutionOptions value) {
            this.options = value;
            return this;
        }

        public Builder credentials(Credentials value) {
            this.credentials = value;
            return this;
        }

        public Builder artifactsDir(Path value) {
            this.artifactsDir = value;
            return this;
        }

        public Builder instructionResolver(Function<Map<String, Object>, List<Map<String, Object>>> value) {
            this.instructionResolver = value;
            return this;
        }

        public Builder listener(RunUpdateListener value) {
            if (value != null) {
                this.listeners.add(value);
            }
            return this;
        }

        public Builder clock(Clock value) {
            this.clock = value;
            return this;
        }

        public RunExecutor build() {
            return new RunExecutor(this);
        }
    }
}
