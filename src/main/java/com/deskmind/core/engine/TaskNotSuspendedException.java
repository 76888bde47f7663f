package com.deskmind.core.engine;

/**
 * Thrown when a resume call does not match a gate the task is waiting at: the task
 * is unknown, was never suspended, or the gate was already answered differently.
 */
public class TaskNotSuspendedException extends RuntimeException {

    private final String taskId;

    public TaskNotSuspendedException(String taskId, String message) {
        super(message);
        this.taskId = taskId;
    }

    public String taskId() {
        return taskId;
    }
}
