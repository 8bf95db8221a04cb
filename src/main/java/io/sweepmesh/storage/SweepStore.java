package io.sweepmesh.storage;

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
import io.sweepmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed persistence for targets, runs, tasks, results and failures.
 * <p>
 * Task execution is fenced by a lease epoch: {@link #tryMarkTaskRunning} bumps the epoch and every
 * commit for that execution must present it. A commit carrying an older epoch is reported as stale
 * and leaves the row untouched.
 */
public final class SweepStore {
    private static final String RESULT_COLUMNS = """
            r.id,r.task_id,r.pl,r.cagr,r.max_drawdown,r.mar,r.win_percentage,r.total_premium,r.capture_rate,
            r.starting_capital,r.ending_capital,r.total_trades,r.winners,r.avg_per_trade,r.avg_winner,r.avg_loser,
            r.max_winner,r.max_loser,r.avg_minutes_in_trade,r.raw_data_json,r.cached_from_task_id,r.created_at_ms
            """;
    private static final String INSERT_RESULT = """
            INSERT INTO results(task_id,pl,cagr,max_drawdown,mar,win_percentage,total_premium,capture_rate,
            starting_capital,ending_capital,total_trades,winners,avg_per_trade,avg_winner,avg_loser,
            max_winner,max_loser,avg_minutes_in_trade,raw_data_json,cached_from_task_id,created_at_ms)
            VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
            """;
    private static final String TASK_COLUMNS =
            "id,run_id,params_json,params_key,status,attempts,lease_owner,lease_epoch,last_error,started_at_ms,completed_at_ms,created_at_ms";

    private final Database database;

    public SweepStore(Database database) {
        this.database = database;
    }

    public Target getOrCreateTarget(String url, String name, long nowMs) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("target url is required");
        }
        String trimmedUrl = url.trim();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement insert = c.prepareStatement(
                    "INSERT OR IGNORE INTO targets(url,name,run_count,created_at_ms) VALUES(?,?,0,?)");
                 PreparedStatement fillName = c.prepareStatement(
                         "UPDATE targets SET name=? WHERE url=? AND (name IS NULL OR name='')")) {
                insert.setString(1, trimmedUrl);
                insert.setString(2, blankToNull(name));
                insert.setLong(3, nowMs);
                insert.executeUpdate();
                if (name != null && !name.isBlank()) {
                    fillName.setString(1, name.trim());
                    fillName.setString(2, trimmedUrl);
                    fillName.executeUpdate();
                }
                Target target = readTargetByUrl(c, trimmedUrl)
                        .orElseThrow(() -> new IllegalStateException("target vanished after insert: " + trimmedUrl));
                c.commit();
                return target;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to get or create target: " + trimmedUrl, e);
        }
    }

    public Optional<Target> getTarget(long targetId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id,url,name,run_count,last_run_at_ms,created_at_ms FROM targets WHERE id=?")) {
            ps.setLong(1, targetId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTarget(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load target: " + targetId, e);
        }
    }

    public List<Target> listTargets() {
        List<Target> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             Statement st = c.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT id,url,name,run_count,last_run_at_ms,created_at_ms FROM targets ORDER BY id")) {
            while (rs.next()) {
                out.add(mapTarget(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list targets", e);
        }
    }

    /**
     * Inserts the run and one pending task per parameter combination in a single transaction, and
     * bumps the target's run count.
     */
    public Run createRun(long targetId, String name, RunMode mode, String configJson,
                         List<Map<String, Object>> combinations, long nowMs) {
        if (mode == null) {
            throw new IllegalArgumentException("run mode is required");
        }
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psRun = c.prepareStatement(
                    "INSERT INTO runs(target_id,name,mode,config_json,status,created_at_ms) VALUES(?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
                 PreparedStatement psTask = c.prepareStatement(
                         "INSERT INTO tasks(run_id,params_json,params_key,status,attempts,lease_epoch,created_at_ms,updated_at_ms) VALUES(?,?,?,?,0,0,?,?)");
                 PreparedStatement psTarget = c.prepareStatement(
                         "UPDATE targets SET run_count=run_count+1,last_run_at_ms=? WHERE id=?")) {
                psTarget.setLong(1, nowMs);
                psTarget.setLong(2, targetId);
                if (psTarget.executeUpdate() == 0) {
                    throw new IllegalArgumentException("Unknown target: " + targetId);
                }
                psRun.setLong(1, targetId);
                psRun.setString(2, blankToNull(name));
                psRun.setString(3, mode.name());
                psRun.setString(4, configJson == null || configJson.isBlank() ? "{}" : configJson);
                psRun.setString(5, RunStatus.PENDING.name());
                psRun.setLong(6, nowMs);
                psRun.executeUpdate();
                long runId;
                try (ResultSet keys = psRun.getGeneratedKeys()) {
                    if (!keys.next()) {
                        throw new SQLException("No run id generated");
                    }
                    runId = keys.getLong(1);
                }
                for (Map<String, Object> params : combinations == null ? List.<Map<String, Object>>of() : combinations) {
                    psTask.setLong(1, runId);
                    psTask.setString(2, Jsons.toCompactJson(params));
                    psTask.setString(3, Jsons.canonicalParams(params));
                    psTask.setString(4, TaskStatus.PENDING.name());
                    psTask.setLong(5, nowMs);
                    psTask.setLong(6, nowMs);
                    psTask.addBatch();
                }
                psTask.executeBatch();
                Run run = readRun(c, runId).orElseThrow(() -> new SQLException("Run vanished after insert"));
                c.commit();
                return run;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to create run for target: " + targetId, e);
        }
    }

    public Optional<Run> getRun(long runId) {
        try (Connection c = database.openConnection()) {
            return readRun(c, runId);
        } catch (SQLException e) {
            throw new StoreException("Failed to load run: " + runId, e);
        }
    }

    public List<Run> listRuns(int limit) {
        List<Run> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id,target_id,name,mode,config_json,status,started_at_ms,completed_at_ms,created_at_ms FROM runs ORDER BY id DESC LIMIT ?")) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapRun(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list runs", e);
        }
    }

    /**
     * Moves a run from {@code from} to {@code to}. Fails when the transition is not allowed or the run
     * is no longer in {@code from}.
     */
    public Run transitionRun(long runId, RunStatus from, RunStatus to, long nowMs) {
        if (from == null || !from.canTransitionTo(to)) {
            throw new IllegalStateException("Illegal run transition " + from + " -> " + to + " for run " + runId);
        }
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     UPDATE runs SET status=?,
                         started_at_ms=CASE WHEN ?=1 AND started_at_ms IS NULL THEN ? ELSE started_at_ms END,
                         completed_at_ms=CASE WHEN ?=1 THEN ? ELSE completed_at_ms END
                     WHERE id=? AND status=?
                     """)) {
            ps.setString(1, to.name());
            ps.setInt(2, to == RunStatus.RUNNING ? 1 : 0);
            ps.setLong(3, nowMs);
            ps.setInt(4, to.isTerminal() ? 1 : 0);
            ps.setLong(5, nowMs);
            ps.setLong(6, runId);
            ps.setString(7, from.name());
            if (ps.executeUpdate() == 0) {
                String actual = readRun(c, runId).map(r -> r.status().name()).orElse("MISSING");
                throw new IllegalStateException(
                        "Run " + runId + " is not " + from + " (actual=" + actual + "), cannot move to " + to);
            }
            return readRun(c, runId).orElseThrow(() -> new SQLException("Run vanished: " + runId));
        } catch (SQLException e) {
            throw new StoreException("Failed to transition run " + runId + " to " + to, e);
        }
    }

    /**
     * Returns tasks left running by a previous process to pending and drops their leases.
     */
    public int resetRunningTasks(long runId, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE tasks SET status=?,lease_owner=NULL,updated_at_ms=? WHERE run_id=? AND status=?")) {
            ps.setString(1, TaskStatus.PENDING.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, runId);
            ps.setString(4, TaskStatus.RUNNING.name());
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to reset running tasks of run " + runId, e);
        }
    }

    public List<SweepTask> listTasks(long runId, TaskStatus status) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM tasks WHERE run_id=?"
                + (status == null ? "" : " AND status=?")
                + " ORDER BY id";
        List<SweepTask> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, runId);
            if (status != null) {
                ps.setString(2, status.name());
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list tasks of run " + runId, e);
        }
    }

    public Optional<SweepTask> getTask(long taskId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + TASK_COLUMNS + " FROM tasks WHERE id=?")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTask(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load task: " + taskId, e);
        }
    }

    /**
     * Claims a pending task for one execution: status running, attempts+1, lease epoch+1.
     */
    public LeaseGrant tryMarkTaskRunning(long taskId, String leaseOwner, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE tasks SET status=?,lease_owner=?,lease_epoch=lease_epoch+1,attempts=attempts+1,
                        started_at_ms=?,updated_at_ms=?
                    WHERE id=? AND status=?
                    """);
                 PreparedStatement read = c.prepareStatement("SELECT attempts,lease_epoch FROM tasks WHERE id=?")) {
                ps.setString(1, TaskStatus.RUNNING.name());
                ps.setString(2, leaseOwner);
                ps.setLong(3, nowMs);
                ps.setLong(4, nowMs);
                ps.setLong(5, taskId);
                ps.setString(6, TaskStatus.PENDING.name());
                if (ps.executeUpdate() == 0) {
                    c.rollback();
                    return LeaseGrant.conflict();
                }
                read.setLong(1, taskId);
                LeaseGrant grant;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()) {
                        throw new SQLException("Task vanished while claiming: " + taskId);
                    }
                    grant = LeaseGrant.granted(rs.getLong("lease_epoch"), rs.getInt("attempts"));
                }
                c.commit();
                return grant;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to mark task running: " + taskId, e);
        }
    }

    /**
     * Hands a lease back before the execution started: the task returns to pending and the attempt it
     * was charged is undone. The epoch stays bumped so the abandoned lease can never commit.
     */
    public boolean releaseLease(long taskId, long leaseEpoch, long nowMs) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     UPDATE tasks SET status=?,lease_owner=NULL,attempts=MAX(attempts-1,0),updated_at_ms=?
                     WHERE id=? AND status=? AND lease_epoch=?
                     """)) {
            ps.setString(1, TaskStatus.PENDING.name());
            ps.setLong(2, nowMs);
            ps.setLong(3, taskId);
            ps.setString(4, TaskStatus.RUNNING.name());
            ps.setLong(5, leaseEpoch);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to release lease on task: " + taskId, e);
        }
    }

    /**
     * Stores the result and completes the task in one transaction, provided the lease is still current.
     */
    public boolean tryMarkTaskSuccessWithLease(long taskId, long leaseEpoch, Metrics metrics, String rawDataJson, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psTask = c.prepareStatement("""
                    UPDATE tasks SET status=?,lease_owner=NULL,last_error=NULL,completed_at_ms=?,updated_at_ms=?
                    WHERE id=? AND status=? AND lease_epoch=?
                    """);
                 PreparedStatement psResult = c.prepareStatement(INSERT_RESULT)) {
                psTask.setString(1, TaskStatus.COMPLETED.name());
                psTask.setLong(2, nowMs);
                psTask.setLong(3, nowMs);
                psTask.setLong(4, taskId);
                psTask.setString(5, TaskStatus.RUNNING.name());
                psTask.setLong(6, leaseEpoch);
                if (psTask.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                bindResult(psResult, taskId, metrics, rawDataJson, null, nowMs);
                psResult.executeUpdate();
                c.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to mark task success: " + taskId, e);
        }
    }

    /**
     * Applies the retry rule to a failed execution. While {@code attempts - 1 < maxRetries} the task goes
     * back to pending; otherwise it becomes failed and one failure record is written in the same
     * transaction.
     */
    public FailureResolution tryCompleteFailureWithLease(long taskId, long leaseEpoch, FailureDetail detail,
                                                         int maxRetries, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement read = c.prepareStatement("SELECT attempts,status,lease_epoch FROM tasks WHERE id=?");
                 PreparedStatement setFailed = c.prepareStatement("""
                         UPDATE tasks SET status=?,lease_owner=NULL,last_error=?,completed_at_ms=?,updated_at_ms=?
                         WHERE id=? AND status=? AND lease_epoch=?
                         """);
                 PreparedStatement setRetry = c.prepareStatement("""
                         UPDATE tasks SET status=?,lease_owner=NULL,last_error=?,updated_at_ms=?
                         WHERE id=? AND status=? AND lease_epoch=?
                         """);
                 PreparedStatement insertFailure = c.prepareStatement("""
                         INSERT INTO failures(task_id,attempt_number,failure_type,error_message,screenshot_path,
                             html_path,console_log_json,created_at_ms)
                         VALUES(?,?,?,?,?,?,?,?)
                         """)) {
                read.setLong(1, taskId);
                int attempts;
                try (ResultSet rs = read.executeQuery()) {
                    if (!rs.next()
                            || !TaskStatus.RUNNING.name().equals(rs.getString("status"))
                            || rs.getLong("lease_epoch") != leaseEpoch) {
                        c.rollback();
                        return FailureResolution.staleLease();
                    }
                    attempts = rs.getInt("attempts");
                }
                int attemptIndex = Math.max(0, attempts - 1);
                String error = detail.errorMessage();
                if (attemptIndex >= maxRetries) {
                    setFailed.setString(1, TaskStatus.FAILED.name());
                    setFailed.setString(2, error);
                    setFailed.setLong(3, nowMs);
                    setFailed.setLong(4, nowMs);
                    setFailed.setLong(5, taskId);
                    setFailed.setString(6, TaskStatus.RUNNING.name());
                    setFailed.setLong(7, leaseEpoch);
                    if (setFailed.executeUpdate() == 0) {
                        c.rollback();
                        return FailureResolution.staleLease();
                    }
                    insertFailure.setLong(1, taskId);
                    insertFailure.setInt(2, attemptIndex);
                    insertFailure.setString(3, detail.failureType().wireName());
                    insertFailure.setString(4, error);
                    insertFailure.setString(5, detail.screenshotPath());
                    insertFailure.setString(6, detail.htmlPath());
                    insertFailure.setString(7, detail.consoleLogJson());
                    insertFailure.setLong(8, nowMs);
                    insertFailure.executeUpdate();
                    c.commit();
                    return FailureResolution.failedPermanently(attempts);
                }
                setRetry.setString(1, TaskStatus.PENDING.name());
                setRetry.setString(2, error);
                setRetry.setLong(3, nowMs);
                setRetry.setLong(4, taskId);
                setRetry.setString(5, TaskStatus.RUNNING.name());
                setRetry.setLong(6, leaseEpoch);
                if (setRetry.executeUpdate() == 0) {
                    c.rollback();
                    return FailureResolution.staleLease();
                }
                c.commit();
                return FailureResolution.retryScheduled(attempts);
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record task failure: " + taskId, e);
        }
    }

    /**
     * Most recent result of a completed task, in any run against the same target, whose parameter key
     * matches.
     */
    public Optional<ResultRecord> findCachedResult(CacheKey key) {
        String sql = "SELECT " + RESULT_COLUMNS + """
                FROM results r
                JOIN tasks t ON t.id=r.task_id
                JOIN runs ru ON ru.id=t.run_id
                WHERE ru.target_id=? AND t.params_key=? AND t.status=?
                ORDER BY r.created_at_ms DESC, r.id DESC
                LIMIT 1
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, key.targetId());
            ps.setString(2, key.paramsKey());
            ps.setString(3, TaskStatus.COMPLETED.name());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapResult(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to look up cached result for " + key, e);
        }
    }

    /**
     * Completes a pending task with a copy of an earlier result. Attempts are left untouched.
     */
    public boolean completeFromCache(long taskId, ResultRecord source, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement psTask = c.prepareStatement("""
                    UPDATE tasks SET status=?,lease_owner=NULL,last_error=NULL,completed_at_ms=?,updated_at_ms=?
                    WHERE id=? AND status=?
                    """);
                 PreparedStatement psResult = c.prepareStatement(INSERT_RESULT)) {
                psTask.setString(1, TaskStatus.COMPLETED.name());
                psTask.setLong(2, nowMs);
                psTask.setLong(3, nowMs);
                psTask.setLong(4, taskId);
                psTask.setString(5, TaskStatus.PENDING.name());
                if (psTask.executeUpdate() == 0) {
                    c.rollback();
                    return false;
                }
                bindResult(psResult, taskId, source.metrics(), source.rawDataJson(), source.taskId(), nowMs);
                psResult.executeUpdate();
                c.commit();
                return true;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to complete task from cache: " + taskId, e);
        }
    }

    public Optional<ResultRecord> getResult(long taskId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT " + RESULT_COLUMNS + " FROM results r WHERE r.task_id=?")) {
            ps.setLong(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapResult(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to load result of task: " + taskId, e);
        }
    }

    /**
     * Results of the run's completed tasks, served from cache or not, in task order.
     */
    public List<ResultRecord> listResults(long runId) {
        String sql = "SELECT " + RESULT_COLUMNS + """
                FROM results r
                JOIN tasks t ON t.id=r.task_id
                WHERE t.run_id=? AND t.status=?
                ORDER BY t.id
                """;
        List<ResultRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setLong(1, runId);
            ps.setString(2, TaskStatus.COMPLETED.name());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapResult(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list results of run " + runId, e);
        }
    }

    public List<FailureRecord> listFailures(long runId) {
        List<FailureRecord> out = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("""
                     SELECT f.id,f.task_id,f.attempt_number,f.failure_type,f.error_message,f.screenshot_path,
                         f.html_path,f.console_log_json,f.created_at_ms
                     FROM failures f JOIN tasks t ON t.id=f.task_id
                     WHERE t.run_id=?
                     ORDER BY f.id
                     """)) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new FailureRecord(
                            rs.getLong("id"),
                            rs.getLong("task_id"),
                            rs.getInt("attempt_number"),
                            FailureType.fromString(rs.getString("failure_type")),
                            rs.getString("error_message"),
                            rs.getString("screenshot_path"),
                            rs.getString("html_path"),
                            rs.getString("console_log_json"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Failed to list failures of run " + runId, e);
        }
    }

    public RunStats runStats(long runId) {
        int pending = 0;
        int running = 0;
        int completed = 0;
        int failed = 0;
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT status,COUNT(*) AS n FROM tasks WHERE run_id=? GROUP BY status")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int n = rs.getInt("n");
                    switch (TaskStatus.fromString(rs.getString("status"))) {
                        case PENDING -> pending = n;
                        case RUNNING -> running = n;
                        case COMPLETED -> completed = n;
                        case FAILED -> failed = n;
                    }
                }
            }
            return new RunStats(pending + running + completed + failed, pending, running, completed, failed);
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks of run " + runId, e);
        }
    }

    private Optional<Target> readTargetByUrl(Connection c, String url) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,url,name,run_count,last_run_at_ms,created_at_ms FROM targets WHERE url=?")) {
            ps.setString(1, url);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapTarget(rs)) : Optional.empty();
            }
        }
    }

    private Optional<Run> readRun(Connection c, long runId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT id,target_id,name,mode,config_json,status,started_at_ms,completed_at_ms,created_at_ms FROM runs WHERE id=?")) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
            }
        }
    }

    private static void bindResult(PreparedStatement ps, long taskId, Metrics metrics, String rawDataJson,
                                   Long cachedFromTaskId, long nowMs) throws SQLException {
        Metrics m = metrics == null ? Metrics.empty() : metrics;
        ps.setLong(1, taskId);
        setDouble(ps, 2, m.pl());
        setDouble(ps, 3, m.cagr());
        setDouble(ps, 4, m.maxDrawdown());
        setDouble(ps, 5, m.mar());
        setDouble(ps, 6, m.winPercentage());
        setDouble(ps, 7, m.totalPremium());
        setDouble(ps, 8, m.captureRate());
        setDouble(ps, 9, m.startingCapital());
        setDouble(ps, 10, m.endingCapital());
        setInteger(ps, 11, m.totalTrades());
        setInteger(ps, 12, m.winners());
        setDouble(ps, 13, m.avgPerTrade());
        setDouble(ps, 14, m.avgWinner());
        setDouble(ps, 15, m.avgLoser());
        setDouble(ps, 16, m.maxWinner());
        setDouble(ps, 17, m.maxLoser());
        setDouble(ps, 18, m.avgMinutesInTrade());
        ps.setString(19, rawDataJson);
        if (cachedFromTaskId == null) {
            ps.setNull(20, Types.INTEGER);
        } else {
            ps.setLong(20, cachedFromTaskId);
        }
        ps.setLong(21, nowMs);
    }

    private static void setDouble(PreparedStatement ps, int index, Double value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.REAL);
        } else {
            ps.setDouble(index, value);
        }
    }

    private static void setInteger(PreparedStatement ps, int index, Integer value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setInt(index, value);
        }
    }

    private static Double getDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private static Integer getInteger(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private static Long getLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    private static Target mapTarget(ResultSet rs) throws SQLException {
        return new Target(
                rs.getLong("id"),
                rs.getString("url"),
                rs.getString("name"),
                rs.getInt("run_count"),
                getLong(rs, "last_run_at_ms"),
                rs.getLong("created_at_ms")
        );
    }

    private static Run mapRun(ResultSet rs) throws SQLException {
        return new Run(
                rs.getLong("id"),
                rs.getLong("target_id"),
                rs.getString("name"),
                RunMode.fromString(rs.getString("mode")),
                rs.getString("config_json"),
                RunStatus.fromString(rs.getString("status")),
                getLong(rs, "started_at_ms"),
                getLong(rs, "completed_at_ms"),
                rs.getLong("created_at_ms")
        );
    }

    private static SweepTask mapTask(ResultSet rs) throws SQLException {
        return new SweepTask(
                rs.getLong("id"),
                rs.getLong("run_id"),
                Jsons.toMap(rs.getString("params_json")),
                rs.getString("params_key"),
                TaskStatus.fromString(rs.getString("status")),
                rs.getInt("attempts"),
                rs.getString("lease_owner"),
                rs.getLong("lease_epoch"),
                rs.getString("last_error"),
                getLong(rs, "started_at_ms"),
                getLong(rs, "completed_at_ms"),
                rs.getLong("created_at_ms")
        );
    }

    private static ResultRecord mapResult(ResultSet rs) throws SQLException {
        Metrics metrics = new Metrics(
                getDouble(rs, "pl"),
                getDouble(rs, "cagr"),
                getDouble(rs, "max_drawdown"),
                getDouble(rs, "mar"),
                getDouble(rs, "win_percentage"),
                getDouble(rs, "total_premium"),
                getDouble(rs, "capture_rate"),
                getDouble(rs, "starting_capital"),
                getDouble(rs, "ending_capital"),
                getInteger(rs, "total_trades"),
                getInteger(rs, "winners"),
                getDouble(rs, "avg_per_trade"),
                getDouble(rs, "avg_winner"),
                getDouble(rs, "avg_loser"),
                getDouble(rs, "max_winner"),
                getDouble(rs, "max_loser"),
                getDouble(rs, "avg_minutes_in_trade")
        );
        return new ResultRecord(
                rs.getLong("id"),
                rs.getLong("task_id"),
                metrics,
                rs.getString("raw_data_json"),
                getLong(rs, "cached_from_task_id"),
                rs.getLong("created_at_ms")
        );
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public record LeaseGrant(boolean started, long leaseEpoch, int attempts) {
        public static LeaseGrant granted(long leaseEpoch, int attempts) {
            return new LeaseGrant(true, leaseEpoch, attempts);
        }

        public static LeaseGrant conflict() {
            return new LeaseGrant(false, 0L, 0);
        }
    }

    public record FailureDetail(FailureType failureType, String errorMessage, String screenshotPath,
                                String htmlPath, String consoleLogJson) {
        public FailureDetail {
            failureType = failureType == null ? FailureType.UNKNOWN : failureType;
        }

        public static FailureDetail of(FailureType failureType, String errorMessage) {
            return new FailureDetail(failureType, errorMessage, null, null, null);
        }
    }

    public enum FailureOutcome {
        RETRY_SCHEDULED,
        FAILED_PERMANENTLY,
        STALE_LEASE
    }

    public record FailureResolution(FailureOutcome outcome, int attempts) {
        public static FailureResolution retryScheduled(int attempts) {
            return new FailureResolution(FailureOutcome.RETRY_SCHEDULED, attempts);
        }

        public static FailureResolution failedPermanently(int attempts) {
            return new FailureResolution(FailureOutcome.FAILED_PERMANENTLY, attempts);
        }

        public static FailureResolution staleLease() {
            return new FailureResolution(FailureOutcome.STALE_LEASE, 0);
        }
    }

    public record RunStats(int total, int pending, int running, int completed, int failed) {
    }
}
