package com.buildrunner.core.exception;

/**
 * Thrown when a task name is registered twice.
 */
public class DuplicateTaskException extends BuildRunnerException {
    public DuplicateTaskException(String taskName) {
        super("A task named '" + taskName + "' has already been registered");
    }
}
