package com.buildrunner.core.exception;

/**
 * Thrown when dependencies are declared for a task that was never registered.
 */
public class UnknownTaskException extends BuildRunnerException {

    private final String taskName;

    public UnknownTaskException(String taskName) {
        super("The task '" + taskName + "' has not been registered");
        this.taskName = taskName;
    }

    public String taskName() {
        return taskName;
    }
}
