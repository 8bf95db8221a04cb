package io.sweepmesh.engine;

public enum RunEventType {
    RUN_STARTED("run_started"),
    TASK_STARTED("task_started"),
    TASK_COMPLETED("task_completed"),
    TASK_FAILED("task_failed"),
    PROGRESS("progress"),
    RUN_COMPLETED("run_completed");

    private final String wireName;

    RunEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
