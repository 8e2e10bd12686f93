package com.buildrunner.core.config;

import com.buildrunner.core.engine.TaskRunner;
import com.buildrunner.core.events.EventBus;
import com.buildrunner.core.metrics.BuildMetrics;
import com.buildrunner.core.model.TaskRunnerOptions;
import com.buildrunner.core.output.Terminal;

/**
 * Creates a fresh {@link TaskRunner} per build from the bound properties, sharing one event bus
 * and one metrics sink across runs.
 */
public class TaskRunnerFactory {

    private final BuildRunnerProperties properties;
    private final Terminal terminal;
    private final EventBus eventBus;
    private final BuildMetrics metrics;

    public TaskRunnerFactory(BuildRunnerProperties properties, Terminal terminal,
                             EventBus eventBus, BuildMetrics metrics) {
        this.properties = properties;
        this.terminal = terminal;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * @throws com.buildrunner.core.exception.InvalidParallelismException if the configured parallelism is invalid
     */
    public TaskRunner create() {
        return create(options());
    }

    public TaskRunner create(TaskRunnerOptions options) {
        return new TaskRunner(options, eventBus, metrics);
    }

    /** Options derived from the bound properties, for callers that want to adjust them. */
    public TaskRunnerOptions options() {
        return new TaskRunnerOptions(
                properties.isQuietMode(),
                properties.getParallelism(),
                properties.isChangedProjectsOnly(),
                terminal,
                properties.isAllowWarningsInSuccessfulBuild());
    }
}
