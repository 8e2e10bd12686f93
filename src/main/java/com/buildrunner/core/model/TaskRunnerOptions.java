package com.buildrunner.core.model;

import com.buildrunner.core.output.Terminal;

import java.util.Objects;

/**
 * Options a runner is constructed with.
 *
 * @param quietMode                      suppress output of tasks that succeed
 * @param parallelism                    positive integer or "max"; null or blank uses the processor count
 * @param changedProjectsOnly            passed through to callers, not interpreted by the runner
 * @param terminal                       where collated output is written
 * @param allowWarningsInSuccessfulBuild treat {@link TaskStatus#SUCCESS_WITH_WARNING} as a passing status
 */
public record TaskRunnerOptions(
    boolean quietMode,
    String parallelism,
    boolean changedProjectsOnly,
    Terminal terminal,
    boolean allowWarningsInSuccessfulBuild
) {

    public TaskRunnerOptions {
        Objects.requireNonNull(terminal, "terminal is required");
    }

    public static TaskRunnerOptions defaults(Terminal terminal) {
        return new TaskRunnerOptions(false, Parallelism.MAX_TOKEN, false, terminal, false);
    }

    public TaskRunnerOptions withParallelism(String value) {
        return new TaskRunnerOptions(quietMode, value, changedProjectsOnly, terminal, allowWarningsInSuccessfulBuild);
    }

    public TaskRunnerOptions withParallelism(int slots) {
        return withParallelism(String.valueOf(slots));
    }

    public TaskRunnerOptions withQuietMode(boolean quiet) {
        return new TaskRunnerOptions(quiet, parallelism, changedProjectsOnly, terminal, allowWarningsInSuccessfulBuild);
    }

    public TaskRunnerOptions withAllowWarningsInSuccessfulBuild(boolean allow) {
        return new TaskRunnerOptions(quietMode, parallelism, changedProjectsOnly, terminal, allow);
    }
}
