package com.buildrunner.core.exception;

import com.buildrunner.core.report.RunReport;

/**
 * Completes the future returned by {@code execute()} when at least one task failed,
 * or produced warnings that the run does not allow.
 */
public class BuildFailedException extends BuildRunnerException {

    private final transient RunReport report;

    public BuildFailedException(String message, RunReport report) {
        super(message);
        this.report = report;
    }

    public RunReport report() {
        return report;
    }
}
