package io.sweepmesh.runtime;

import io.sweepmesh.analysis.Candidate;
import io.sweepmesh.analysis.OptimizationGoal;
import io.sweepmesh.analysis.RecommendationReport;
import io.sweepmesh.analysis.Recommendations;
import io.sweepmesh.config.EngineSettings;
import io.sweepmesh.config.SweepMeshConfig;
import io.sweepmesh.engine.ExecutionOptions;
import io.sweepmesh.engine.RunExecutor;
import io.sweepmesh.engine.RunSummary;
import io.sweepmesh.engine.RunUpdateListener;
import io.sweepmesh.model.Credentials;
import io.sweepmesh.model.FailureRecord;
import io.sweepmesh.model.ResultRecord;
import io.sweepmesh.model.Run;
import io.sweepmesh.model.SweepTask;
import io.sweepmesh.model.Target;
import io.sweepmesh.model.TaskStatus;
import io.sweepmesh.observability.RunEventJournal;
import io.sweepmesh.parameter.CombinationGenerator;
import io.sweepmesh.parameter.ParameterRegistry;
import io.sweepmesh.parameter.RunPlan;
import io.sweepmesh.storage.Database;
import io.sweepmesh.storage.SweepStore;
import io.sweepmesh.util.Jsons;
import io.sweepmesh.worker.WorkerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class SweepMeshRuntime {
    private static final Logger log = LoggerFactory.getLogger(SweepMeshRuntime.class);

    private final SweepMeshConfig config;
    private final EngineSettings settings;
    private final Database database;
    private final SweepStore store;
    private final ParameterRegistry parameters;
    private final CombinationGenerator generator;
    private final RunRegistry registry;
    private final Clock clock;

    public SweepMeshRuntime(SweepMeshConfig config) {
        this(config, EngineSettings.load(config), Clock.systemUTC());
    }

    public SweepMeshRuntime(SweepMeshConfig config, EngineSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.database = new Database(config);
        this.store = new SweepStore(database);
        this.parameters = ParameterRegistry.standard();
        this.generator = new CombinationGenerator(parameters);
        this.registry = new RunRegistry();
        this.clock = clock;
    }

    public void init() {
        database.init();
    }

    public SweepMeshConfig config() {
        return config;
    }

    public EngineSettings settings() {
        return settings;
    }

    public ParameterRegistry parameters() {
        return parameters;
    }

    public RunRegistry registry() {
        return registry;
    }

    public CreateRunOutcome createRun(String targetUrl, String targetName, RunPlan plan) {
        return createRun(targetUrl, targetName, null, plan);
    }

    /**
     * Creates (or reuses) the target, then the run with its resolved plan and one pending task per
     * generated parameter combination.
     */
    public CreateRunOutcome createRun(String targetUrl, String targetName, String runName, RunPlan plan) {
        if (plan == null || plan.sweeps().isEmpty()) {
            throw new IllegalArgumentException("run plan needs at least one parameter");
        }
        RunPlan resolved = generator.resolve(plan);
        List<Map<String, Object>> combinations = generator.generate(resolved);
        long nowMs = clock.millis();
        Target target = store.getOrCreateTarget(targetUrl, targetName, nowMs);
        Run run = store.createRun(target.id(), runName, resolved.mode(), Jsons.toCompactJson(resolved.toConfig()), combinations, nowMs);
        log.info("Created run {} ({}) against {} with {} task(s)", run.id(), resolved.mode().wireName(), target.url(), combinations.size());
        return new CreateRunOutcome(run, target, combinations.size());
    }

    /**
     * Executes a run on the calling thread until it drains or is stopped. Events go to
     * {@code onUpdate} and to the run's event journal.
     */
    public RunSummary startRunExecution(long runId, Credentials credentials, int numWorkers, ExecutionOptions options,
                                        WorkerFactory workerFactory, RunUpdateListener onUpdate) {
        Run run = store.getRun(runId).orElseThrow(() -> new IllegalArgumentException("Unknown run: " + runId));
        RunPlan plan = RunPlan.fromConfigJson(run.configJson());
        int workers = numWorkers > 0 ? numWorkers : settings.defaultWorkers();
        RunExecutor executor = RunExecutor.builder(store, runId, workerFactory)
                .numWorkers(workers)
                .options(options == null ? ExecutionOptions.fromSettings(settings, false) : options)
                .credentials(credentials == null ? new Credentials("", "") : credentials)
                .artifactsDir(config.artifactsDir(runId))
                .instructionResolver(params -> generator.instructions(plan, params))
                .listener(new RunEventJournal(config.eventJournal(runId)))
                .listener(onUpdate)
                .clock(clock)
                .build();
        registry.register(executor);
        try {
            return executor.execute();
        } finally {
            registry.unregister(executor);
        }
    }

    public boolean stopRunExecution(long runId) {
        return registry.stop(runId);
    }

    public boolean pauseRunExecution(long runId) {
        return registry.pause(runId);
    }

    public boolean resumeRunExecution(long runId) {
        return registry.resume(runId);
    }

    public boolean isRunPaused(long runId) {
        return registry.isPaused(runId);
    }

    public Optional<Run> getRun(long runId) {
        return store.getRun(runId);
    }

    public List<Run> listRuns(int limit) {
        return store.listRuns(limit);
    }

    public List<SweepTask> listTasks(long runId, TaskStatus status) {
        return store.listTasks(runId, status);
    }

    public SweepStore.RunStats runStats(long runId) {
        return store.runStats(runId);
    }

    public List<FailureRecord> listFailures(long runId) {
        return store.listFailures(runId);
    }

    public Optional<ResultRecord> getResult(long taskId) {
        return store.getResult(taskId);
    }

    /**
     * Ranks the completed tasks of a run for {@code goal}.
     */
    public RecommendationReport recommend(long runId, OptimizationGoal goal) {
        Map<Long, Map<String, Object>> paramsByTask = new HashMap<>();
        for (SweepTask task : store.listTasks(runId, TaskStatus.COMPLETED)) {
            paramsByTask.put(task.id(), task.params());
        }
        List<Candidate> candidates = new ArrayList<>();
        for (ResultRecord result : store.listResults(runId)) {
            candidates.add(new Candidate(result.taskId(), paramsByTask.get(result.taskId()), result.metrics()));
        }
        return Recommendations.recommend(candidates, goal);
    }

    public List<Target> listTargets() {
        return store.listTargets();
    }

    public record CreateRunOutcome(Run run, Target target, int taskCount) {
    }
}
