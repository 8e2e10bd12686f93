package com.buildrunner.core.exception;

/**
 * Thrown at construction when the configured parallelism is not a positive integer or "max".
 */
public class InvalidParallelismException extends BuildRunnerException {
    public InvalidParallelismException(String value) {
        super(messageFor(value));
    }

    public InvalidParallelismException(String value, Throwable cause) {
        super(messageFor(value), cause);
    }

    private static String messageFor(String value) {
        return "Invalid parallelism value of '" + value + "', expected a positive number or 'max'";
    }
}
