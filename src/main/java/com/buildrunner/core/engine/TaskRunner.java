package com.buildrunner.core.engine;

import com.buildrunner.core.events.EventBus;
import com.buildrunner.core.exception.CyclicDependencyException;
import com.buildrunner.core.graph.CriticalPath;
import com.buildrunner.core.graph.CycleDetector;
import com.buildrunner.core.graph.TaskGraph;
import com.buildrunner.core.metrics.BuildMetrics;
import com.buildrunner.core.model.Parallelism;
import com.buildrunner.core.model.TaskDefinition;
import com.buildrunner.core.model.TaskRunnerOptions;
import com.buildrunner.core.output.OutputCollator;
import com.buildrunner.core.report.ReportBuilder;
import com.buildrunner.core.report.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a set of tasks in dependency order with bounded parallelism and collates their output.
 *
 * <p>Usage: register tasks and edges, then call {@link #execute()} once. A runner is single-use;
 * build a new one for the next run.
 *
 * <pre>{@code
 * var runner = new TaskRunner(TaskRunnerOptions.defaults(new ConsoleTerminal()).withParallelism("4"));
 * runner.addTask(TaskDefinition.sync("compile", w -> TaskStatus.SUCCESS));
 * runner.addTask(TaskDefinition.sync("test", w -> TaskStatus.SUCCESS));
 * runner.addDependencies("test", List.of("compile"));
 * runner.execute().join();
 * }</pre>
 */
public class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);
    private static final AtomicInteger RUN_COUNTER = new AtomicInteger(0);

    private final String runId;
    private final TaskRunnerOptions options;
    private final Parallelism parallelism;
    private final TaskGraph graph = new TaskGraph();
    private final EventBus eventBus;
    private final BuildMetrics metrics;
    private final AtomicBoolean executed = new AtomicBoolean(false);

    /**
     * @throws com.buildrunner.core.exception.InvalidParallelismException if the parallelism option is invalid
     */
    public TaskRunner(TaskRunnerOptions options) {
        this(options, new EventBus(), null);
    }

    /**
     * @param metrics may be null, in which case nothing is recorded
     * @throws com.buildrunner.core.exception.InvalidParallelismException if the parallelism option is invalid
     */
    public TaskRunner(TaskRunnerOptions options, EventBus eventBus, BuildMetrics metrics) {
        this.parallelism = Parallelism.parse(options.parallelism());
        this.options = options;
        this.runId = nextRunId();
        this.eventBus = eventBus;
        this.metrics = metrics;
        log.debug("Task runner {} created with parallelism {}, quietMode={}, changedProjectsOnly={}",
                runId, parallelism, options.quietMode(), options.changedProjectsOnly());
    }

    public void addTask(TaskDefinition definition) {
        graph.addTask(definition);
    }

    public void addDependencies(String taskName, Collection<String> dependencyNames) {
        graph.addDependencies(taskName, dependencyNames);
    }

    public void addDependencies(String taskName, String... dependencyNames) {
        addDependencies(taskName, Arrays.asList(dependencyNames));
    }

    /**
     * Run every registered task.
     *
     * <p>The graph is checked for cycles before anything is dispatched; a cycle is reported by
     * throwing, not through the returned future.
     *
     * @return completes with the run report when all tasks are terminal and none offends, or
     *         exceptionally with {@link com.buildrunner.core.exception.BuildFailedException}
     * @throws CyclicDependencyException if the dependency graph has a cycle
     * @throws IllegalStateException     if this runner has already been executed
     */
    public CompletableFuture<RunReport> execute() {
        if (!executed.compareAndSet(false, true)) {
            throw new IllegalStateException("This runner has already been executed");
        }
        graph.freeze();
        CycleDetector.check(graph.dependencyEdges());

        var tasks = graph.tasks();
        var collator = new OutputCollator(options.terminal(), options.quietMode(),
                options.allowWarningsInSuccessfulBuild(), tasks.size());
        var reportBuilder = new ReportBuilder(runId, tasks.size(), options.allowWarningsInSuccessfulBuild());
        var engine = new ExecutionEngine(runId, tasks, CriticalPath.lengths(graph.dependentEdges()),
                parallelism, collator, reportBuilder, eventBus, metrics);
        return engine.start();
    }

    /** Id of the single run this runner performs; use it to subscribe to the run's events. */
    public String runId() {
        return runId;
    }

    public TaskRunnerOptions options() {
        return options;
    }

    public Parallelism parallelism() {
        return parallelism;
    }

    public TaskGraph graph() {
        return graph;
    }

    public EventBus eventBus() {
        return eventBus;
    }

    static String nextRunId() {
        int count = RUN_COUNTER.incrementAndGet();
        int year = Instant.now().atZone(ZoneOffset.UTC).getYear();
        return String.format("RUN-%d-%04d", year, count);
    }
}
