package com.buildrunner.core.model;

/**
 * Status of a task within a single run.
 */
public enum TaskStatus {
    READY,
    EXECUTING,
    SUCCESS,
    SUCCESS_WITH_WARNING,
    FAILURE,
    BLOCKED;  // never ran, a dependency did not succeed

    public boolean isTerminal() {
        return this != READY && this != EXECUTING;
    }

    /**
     * True for statuses that let dependents run.
     */
    public boolean isSuccessful() {
        return this == SUCCESS || this == SUCCESS_WITH_WARNING;
    }

    /**
     * Lower-case label used in metric tags and report headers, e.g. "success with warning".
     */
    public String label() {
        return name().toLowerCase().replace('_', ' ');
    }
}
