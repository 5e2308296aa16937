package io.cadence4j.core;

/**
 * Failure of a task's work, recorded in its result history. Never propagated to other tasks.
 */
public class TaskExecutionException extends RuntimeException {

    private final String taskId;
    private final String taskName;

    public TaskExecutionException(String taskId, String taskName, Throwable cause) {
        super("Task '" + taskName + "' (" + taskId + ") failed: "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.taskId = taskId;
        this.taskName = taskName;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getTaskName() {
        return taskName;
    }
}
