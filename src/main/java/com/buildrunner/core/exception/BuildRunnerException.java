package com.buildrunner.core.exception;

/**
 * Base type for every error the runner raises.
 */
public class BuildRunnerException extends RuntimeException {
    public BuildRunnerException(String message) {
        super(message);
    }

    public BuildRunnerException(String message, Throwable cause) {
        super(message, cause);
    }
}
