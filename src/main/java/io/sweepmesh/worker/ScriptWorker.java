package io.sweepmesh.worker;

import com.fasterxml.jackson.databind.JsonNode;
import io.sweepmesh.model.Credentials;
import io.sweepmesh.model.FailureType;
import io.sweepmesh.model.Metrics;
import io.sweepmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command once per task. The request is written to stdin as JSON, credentials are
 * passed through the environment and the command prints one outcome JSON object on stdout.
 */
public final class ScriptWorker implements WorkerHandle {
    private static final Logger log = LoggerFactory.getLogger(ScriptWorker.class);
    private static final int MAX_ERROR_CHARS = 512;

    public static final String ENV_TARGET_URL = "SWEEPMESH_TARGET_URL";
    public static final String ENV_WORKER_ID = "SWEEPMESH_WORKER_ID";

    private final WorkerContext context;
    private final List<String> command;
    private final long timeoutMs;
    private volatile Process current;

    public ScriptWorker(WorkerContext context, List<String> command, long timeoutMs) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("worker command cannot be empty");
        }
        this.context = context;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public TaskOutcome execute(TaskRequest request) throws Exception {
        Path stdoutFile = Files.createTempFile("sweepmesh-worker-", ".out");
        Path consoleLog = consoleLogPath(request);
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectOutput(stdoutFile.toFile());
        if (consoleLog == null) {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        } else {
            pb.redirectError(consoleLog.toFile());
        }
        applyEnvironment(pb.environment());
        try {
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                return TaskOutcome.failure(FailureType.BROWSER, "worker spawn failed: " + e.getMessage());
            }
            current = process;
            try {
                try (OutputStream stdin = process.getOutputStream()) {
                    stdin.write(Jsons.toCompactJson(requestBody(request)).getBytes(StandardCharsets.UTF_8));
                }
                boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(1, TimeUnit.SECONDS);
                    return TaskOutcome.failure(FailureType.TIMING,
                            "worker timeout after " + Duration.ofMillis(timeoutMs),
                            artifacts(consoleLog, null, null));
                }
            } catch (InterruptedException e) {
                process.destroyForcibly();
                throw e;
            } finally {
                current = null;
            }
            String stdout = Files.readString(stdoutFile, StandardCharsets.UTF_8).strip();
            return interpret(process.exitValue(), stdout, consoleLog);
        } finally {
            Files.deleteIfExists(stdoutFile);
        }
    }

    @Override
    public void close() {
        Process process = current;
        if (process != null && process.isAlive()) {
            log.debug("Destroying worker process of {}", context.workerId());
            process.destroyForcibly();
        }
    }

    TaskOutcome interpret(int exitCode, String stdout, Path consoleLog) {
        JsonNode node = parseOutcome(stdout);
        if (node == null) {
            if (exitCode == 0) {
                return TaskOutcome.failure(FailureType.UNKNOWN, "worker printed no outcome JSON",
                        artifacts(consoleLog, null, null));
            }
            return TaskOutcome.failure(FailureType.UNKNOWN,
                    "worker exit=" + exitCode + " output=" + truncate(stdout),
                    artifacts(consoleLog, null, null));
        }
        if (node.path("success").asBoolean(false)) {
            Metrics metrics;
            try {
                metrics = node.hasNonNull("results")
                        ? Jsons.mapper().treeToValue(node.get("results"), Metrics.class)
                        : Metrics.empty();
            } catch (IOException e) {
                return TaskOutcome.failure(FailureType.UNKNOWN, "worker returned malformed results: " + e.getMessage());
            }
            Map<String, Object> rawData = node.hasNonNull("raw_data")
                    ? Jsons.toMap(node.get("raw_data").toString())
                    : Map.of();
            return TaskOutcome.success(metrics, rawData);
        }
        String error = node.path("error").asText("");
        if (error.isBlank()) {
            error = "worker reported failure (exit=" + exitCode + ")";
        }
        String consoleLogJson = node.hasNonNull("console_log") ? node.get("console_log").toString() : null;
        return TaskOutcome.failure(
                FailureType.fromString(textOrNull(node, "failure_type")),
                error,
                artifacts(consoleLog, textOrNull(node, "screenshot_path"), textOrNull(node, "html_path"), consoleLogJson));
    }

    private JsonNode parseOutcome(String stdout) {
        if (stdout == null || stdout.isBlank()) {
            return null;
        }
        String candidate = stdout;
        int lastLine = stdout.lastIndexOf('\n');
        if (!stdout.startsWith("{") && lastLine >= 0) {
            candidate = stdout.substring(lastLine + 1).strip();
        }
        try {
            JsonNode node = Jsons.mapper().readTree(candidate);
            return node != null && node.isObject() ? node : null;
        } catch (IOException e) {
            log.debug("Worker stdout is not JSON: {}", truncate(stdout));
            return null;
        }
    }

    private Map<String, Object> requestBody(TaskRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("run_id", request.runId());
        body.put("task_id", request.taskId());
        body.put("attempt", request.attempt());
        body.put("target_url", request.targetUrl());
        body.put("params", request.params());
        body.put("instructions", request.instructions());
        return body;
    }

    private void applyEnvironment(Map<String, String> env) {
        Credentials credentials = context.credentials();
        if (credentials != null) {
            env.put(Credentials.ENV_EMAIL, nullToEmpty(credentials.email()));
            env.put(Credentials.ENV_PASSWORD, nullToEmpty(credentials.password()));
        }
        env.put(ENV_TARGET_URL, nullToEmpty(context.targetUrl()));
        env.put(ENV_WORKER_ID, context.workerId());
    }

    private Path consoleLogPath(TaskRequest request) throws IOException {
        if (context.artifactsDir() == null) {
            return null;
        }
        Files.createDirectories(context.artifactsDir());
        return context.artifactsDir().resolve("task-" + request.taskId() + "-attempt-" + request.attempt() + ".stderr.log");
    }

    private static TaskOutcome.Artifacts artifacts(Path consoleLog, String screenshotPath, String htmlPath) {
        return artifacts(consoleLog, screenshotPath, htmlPath, null);
    }

    private static TaskOutcome.Artifacts artifacts(Path consoleLog, String screenshotPath, String htmlPath, String consoleLogJson) {
        String console = consoleLogJson;
        if (console == null && consoleLog != null) {
            console = Jsons.toCompactJson(Map.of("stderr_path", consoleLog.toString()));
        }
        return new TaskOutcome.Artifacts(screenshotPath, htmlPath, console);
    }

    private static String textOrNull(JsonNode node, String field) {
        return node.hasNonNull(field) ? node.get(field).asText() : null;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
