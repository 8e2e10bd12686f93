package com.buildrunner.core.exception;

/**
 * Thrown when a declared dependency names a task that was never registered.
 */
public class UnknownDependencyException extends BuildRunnerException {

    private final String taskName;
    private final String dependencyName;

    public UnknownDependencyException(String taskName, String dependencyName) {
        super("The task '" + dependencyName + "' (a dependency of '" + taskName + "') has not been registered");
        this.taskName = taskName;
        this.dependencyName = dependencyName;
    }

    public String taskName() {
        return taskName;
    }

    public String dependencyName() {
        return dependencyName;
    }
}
