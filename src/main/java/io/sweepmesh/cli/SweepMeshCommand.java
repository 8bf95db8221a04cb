package io.sweepmesh.cli;

import io.sweepmesh.analysis.OptimizationGoal;
import io.sweepmesh.config.SweepMeshConfig;
import io.sweepmesh.engine.ExecutionOptions;
import io.sweepmesh.engine.RunEvent;
import io.sweepmesh.engine.RunSummary;
import io.sweepmesh.model.Credentials;
import io.sweepmesh.model.Run;
import io.sweepmesh.model.RunMode;
import io.sweepmesh.model.RunStatus;
import io.sweepmesh.model.TaskStatus;
import io.sweepmesh.parameter.ParameterSweep;
import io.sweepmesh.parameter.RunPlan;
import io.sweepmesh.runtime.SweepMeshRuntime;
import io.sweepmesh.util.Jsons;
import io.sweepmesh.worker.ScriptWorkerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "sweepmesh",
        mixinStandardHelpOptions = true,
        description = "SweepMesh parameter-sweep run engine CLI",
        subcommands = {
                SweepMeshCommand.InitCommand.class,
                SweepMeshCommand.ParametersCommand.class,
                SweepMeshCommand.TargetsCommand.class,
                SweepMeshCommand.CreateRunCommand.class,
                SweepMeshCommand.RunCommand.class,
                SweepMeshCommand.RunsCommand.class,
                SweepMeshCommand.TasksCommand.class,
                SweepMeshCommand.StatsCommand.class,
                SweepMeshCommand.FailuresCommand.class,
                SweepMeshCommand.RecommendCommand.class
        }
)
public final class SweepMeshCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = SweepMeshConfig.DEFAULT_ROOT)
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | parameters | targets | create-run | run | runs | tasks | stats | failures | recommend");
    }

    SweepMeshRuntime runtime() {
        SweepMeshRuntime runtime = new SweepMeshRuntime(SweepMeshConfig.fromRoot(root));
        runtime.init();
        return runtime;
    }

    /**
     * Parses {@code name} or {@code name:key=value,key=value}; integer-looking values become ints.
     */
    static ParameterSweep parseParam(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("--param must not be blank");
        }
        int colon = raw.indexOf(':');
        String name = (colon < 0 ? raw : raw.substring(0, colon)).trim();
        Map<String, Object> config = new LinkedHashMap<>();
        if (colon >= 0) {
            for (String pair : raw.substring(colon + 1).split(",")) {
                if (pair.isBlank()) {
                    continue;
                }
                int eq = pair.indexOf('=');
                if (eq <= 0) {
                    throw new IllegalArgumentException("Expected key=value in --param, got: " + pair);
                }
                String value = pair.substring(eq + 1).trim();
                config.put(pair.substring(0, eq).trim(), value.matches("-?\\d+") ? (Object) Integer.parseInt(value) : value);
            }
        }
        return new ParameterSweep(name, config);
    }

    @Command(name = "init", description = "Initialize data directories and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Override
        public Integer call() {
            SweepMeshRuntime runtime = parent.runtime();
            System.out.println("Initialized SweepMesh at: " + runtime.config().rootDir());
            return 0;
        }
    }

    @Command(name = "parameters", description = "List sweepable parameters and their defaults")
    static final class ParametersCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().parameters().describe()));
            return 0;
        }
    }

    @Command(name = "targets", description = "List known targets")
    static final class TargetsCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listTargets()));
            return 0;
        }
    }

    @Command(name = "create-run", description = "Create a run and its tasks from a parameter plan")
    static final class CreateRunCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Option(names = {"--target"}, required = true, description = "Target URL")
        String target;

        @Option(names = {"--target-name"}, description = "Optional display name of the target")
        String targetName;

        @Option(names = {"--name"}, description = "Optional run name")
        String name;

        @Option(names = {"--mode"}, defaultValue = "sweep", description = "Run mode: sweep|grid|staged")
        String mode;

        @Option(names = {"--param"}, required = true,
                description = "Parameter as name or name:key=value,...; repeat for grid and staged modes")
        List<String> params;

        @Override
        public Integer call() {
            List<ParameterSweep> sweeps = new ArrayList<>();
            for (String raw : params) {
                sweeps.add(parseParam(raw));
            }
            SweepMeshRuntime.CreateRunOutcome outcome = parent.runtime()
                    .createRun(target, targetName, name, new RunPlan(RunMode.fromString(mode), sweeps));
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("run_id", outcome.run().id());
            out.put("target_id", outcome.target().id());
            out.put("mode", outcome.run().mode().wireName());
            out.put("task_count", outcome.taskCount());
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "run", description = "Execute a run until its queue drains (Ctrl-C stops it)")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        long runId;

        @Option(names = {"--workers"}, defaultValue = "0", description = "Worker count; 0 uses the configured default")
        int workers;

        @Option(names = {"--worker-command"}, required = true,
                description = "Command executed once per task; reads request JSON on stdin, prints outcome JSON")
        String workerCommand;

        @Option(names = {"--worker-timeout-ms"}, defaultValue = "0",
                description = "Per-task timeout; 0 uses the configured default")
        long workerTimeoutMs;

        @Option(names = {"--skip-cache"}, defaultValue = "false", description = "Always execute, never reuse results")
        boolean skipCache;

        @Override
        public Integer call() {
            SweepMeshRuntime runtime = parent.runtime();
            Credentials credentials = Credentials.fromEnv(System.getenv());
            long timeout = workerTimeoutMs > 0 ? workerTimeoutMs : runtime.settings().workerTimeoutMs();
            ScriptWorkerFactory factory = new ScriptWorkerFactory(Arrays.asList(workerCommand.trim().split("\\s+")), timeout);
            ExecutionOptions options = ExecutionOptions.fromSettings(runtime.settings(), skipCache);

            Runtime.getRuntime().addShutdownHook(
                    new Thread(() -> runtime.stopRunExecution(runId), "sweepmesh-shutdown-hook"));
            RunSummary summary = runtime.startRunExecution(runId, credentials, workers, options, factory,
                    (id, event) -> System.out.println(eventLine(event)));
            System.out.println(Jsons.toJson(summary));
            return summary.status() == RunStatus.COMPLETED ? 0 : 1;
        }

        private static String eventLine(RunEvent event) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("type", event.type().wireName());
            row.put("run_id", event.runId());
            row.putAll(event.data());
            return Jsons.toCompactJson(row);
        }
    }

    @Command(name = "runs", description = "List recent runs")
    static final class RunsCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Option(names = {"--limit"}, defaultValue = "20", description = "Max rows")
        int limit;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listRuns(limit)));
            return 0;
        }
    }

    @Command(name = "tasks", description = "List the tasks of a run")
    static final class TasksCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        long runId;

        @Option(names = {"--status"}, description = "Filter: pending|running|completed|failed")
        String status;

        @Override
        public Integer call() {
            TaskStatus filter = status == null || status.isBlank() ? null : TaskStatus.fromString(status);
            System.out.println(Jsons.toJson(parent.runtime().listTasks(runId, filter)));
            return 0;
        }
    }

    @Command(name = "stats", description = "Task counts by status for a run")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        long runId;

        @Override
        public Integer call() {
            SweepMeshRuntime runtime = parent.runtime();
            Optional<Run> run = runtime.getRun(runId);
            if (run.isEmpty()) {
                System.out.println("{\"error\":\"run not found\"}");
                return 1;
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("run", run.get());
            out.put("tasks", runtime.runStats(runId));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "failures", description = "List permanent failure records of a run")
    static final class FailuresCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        long runId;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().listFailures(runId)));
            return 0;
        }
    }

    @Command(name = "recommend", description = "Rank the completed results of a run for an optimization goal")
    static final class RecommendCommand implements Callable<Integer> {
        @ParentCommand
        SweepMeshCommand parent;

        @Parameters(index = "0", description = "Run id")
        long runId;

        @Option(names = {"--goal"}, defaultValue = "balanced",
                description = "balanced | maximize_returns | protect_capital")
        String goal;

        @Override
        public Integer call() {
            SweepMeshRuntime runtime = parent.runtime();
            if (runtime.getRun(runId).isEmpty()) {
                System.out.println("{\"error\":\"run not found\"}");
                return 1;
            }
            System.out.println(Jsons.toJson(runtime.recommend(runId, OptimizationGoal.fromString(goal))));
            return 0;
        }
    }
}
