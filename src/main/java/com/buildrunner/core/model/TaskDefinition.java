package com.buildrunner.core.model;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A named unit of work to register with a runner.
 *
 * @param name                     unique task name
 * @param operation                the work itself
 * @param incrementalBuildAllowed  passed through to callers, not interpreted by the runner
 * @param hadEmptyScript           the task has nothing to run; only changes how completion is displayed
 */
public record TaskDefinition(
    String name,
    TaskOperation operation,
    boolean incrementalBuildAllowed,
    boolean hadEmptyScript
) {

    public TaskDefinition {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(operation, "operation is required");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Task name must not be blank");
        }
    }

    public static TaskDefinition of(String name, TaskOperation operation) {
        return new TaskDefinition(name, operation, false, false);
    }

    /**
     * Wraps a synchronous body. The body runs on the worker thread that dispatches the task.
     */
    public static TaskDefinition sync(String name, Function<TaskWriter, TaskStatus> body) {
        return of(name, writer -> CompletableFuture.completedFuture(body.apply(writer)));
    }
}
