package com.buildrunner.core.engine;

import com.buildrunner.core.events.EventBus;
import com.buildrunner.core.events.RunEvent;
import com.buildrunner.core.exception.BuildFailedException;
import com.buildrunner.core.graph.TaskNode;
import com.buildrunner.core.logging.MdcContext;
import com.buildrunner.core.metrics.BuildMetrics;
import com.buildrunner.core.model.Parallelism;
import com.buildrunner.core.model.TaskResult;
import com.buildrunner.core.model.TaskStatus;
import com.buildrunner.core.output.OutputCollator;
import com.buildrunner.core.output.TaskOutputBuffer;
import com.buildrunner.core.report.ReportBuilder;
import com.buildrunner.core.report.RunReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executes one run of a frozen, acyclic task graph.
 *
 * <p>A single scheduling thread owns all per-task state. It dispatches ready tasks to a worker
 * pool while fewer than {@code parallelism} tasks are executing, then blocks on a completion
 * queue that workers feed as task operations finish. Every completion is collated, recorded,
 * and used to release or block dependents before the next dispatch.
 *
 * <p>Ready tasks with the longest chain of dependents go first; ties go to registration order.
 */
class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final String runId;
    private final List<TaskNode> tasks;
    private final Parallelism parallelism;
    private final EventBus eventBus;
    private final BuildMetrics metrics;
    private final OutputCollator collator;
    private final ReportBuilder reportBuilder;

    private final Map<TaskNode, TaskStatus> statuses = new HashMap<>();
    private final Map<TaskNode, Integer> unfinishedDependencies = new HashMap<>();
    private final PriorityQueue<TaskNode> ready;
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final CompletableFuture<RunReport> result = new CompletableFuture<>();

    private ExecutorService workers;
    private int executing = 0;
    private long startNanos;

    ExecutionEngine(String runId, List<TaskNode> tasks, Map<String, Integer> criticalPathLengths,
                    Parallelism parallelism, OutputCollator collator, ReportBuilder reportBuilder,
                    EventBus eventBus, BuildMetrics metrics) {
        this.runId = runId;
        this.tasks = tasks;
        this.parallelism = parallelism;
        this.collator = collator;
        this.reportBuilder = reportBuilder;
        this.eventBus = eventBus;
        this.metrics = metrics;
        Comparator<TaskNode> byCriticalPath = Comparator.comparingInt(
                (TaskNode t) -> criticalPathLengths.getOrDefault(t.name(), 1)).reversed();
        this.ready = new PriorityQueue<>(byCriticalPath.thenComparingInt(TaskNode::registrationIndex));
    }

    /**
     * Start the scheduling thread.
     *
     * @return completes with the report once every task is terminal, or exceptionally with
     *         {@link BuildFailedException} when the run did not succeed
     */
    CompletableFuture<RunReport> start() {
        startNanos = System.nanoTime();
        Thread scheduler = new Thread(this::schedule, "buildrunner-scheduler-" + runId);
        scheduler.setDaemon(true);
        scheduler.start();
        return result;
    }

    private void schedule() {
        MdcContext.setRun(runId);
        workers = parallelism.isUnbounded()
                ? Executors.newCachedThreadPool(workerThreads())
                : Executors.newFixedThreadPool(Math.min(parallelism.slots(), Math.max(tasks.size(), 1)),
                        workerThreads());
        try {
            log.info("Run {} started: {} tasks, parallelism {}", runId, tasks.size(), parallelism);
            eventBus.publish(RunEvent.of(RunEvent.RUN_STARTED, runId, null,
                    Map.of("tasks", tasks.size(), "parallelism", parallelism.toString())));

            for (TaskNode task : tasks) {
                unfinishedDependencies.put(task, task.dependencies().size());
                if (task.dependencies().isEmpty()) {
                    markReady(task);
                }
            }
            dispatchReady();

            while (!reportBuilder.isComplete()) {
                if (executing == 0) {
                    throw new IllegalStateException("No task is executing or ready, but "
                            + (tasks.size() - reportBuilder.recordedCount()) + " tasks are unfinished");
                }
                Completion completion = completions.take();
                executing--;
                handle(completion);
                dispatchReady();
            }
            finish();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Run {} interrupted while waiting for tasks", runId);
            result.completeExceptionally(e);
        } catch (RuntimeException | Error e) {
            log.error("Run {} aborted by an unexpected error", runId, e);
            result.completeExceptionally(e);
        } finally {
            workers.shutdown();
            MdcContext.clear();
        }
    }

    private void markReady(TaskNode task) {
        statuses.put(task, TaskStatus.READY);
        ready.add(task);
    }

    private void dispatchReady() {
        while (executing < parallelism.slots() && !ready.isEmpty()) {
            TaskNode task = ready.poll();
            if (metrics != null) {
                metrics.recordReadyQueueDepth(ready.size());
            }
            statuses.put(task, TaskStatus.EXECUTING);
            executing++;
            log.debug("Dispatching {} ({} executing, {} ready)", task.name(), executing, ready.size());
            eventBus.publish(RunEvent.of(RunEvent.TASK_STARTED, runId, task.name(), Map.of()));

            var buffer = new TaskOutputBuffer(task.name());
            long dispatchedAt = System.nanoTime();
            workers.execute(() -> invoke(task, buffer, dispatchedAt));
        }
    }

    // Runs on a worker thread. Must post exactly one completion for the task, whatever the operation throws.
    private void invoke(TaskNode task, TaskOutputBuffer buffer, long dispatchedAt) {
        MdcContext.setTask(runId, task.name());
        try {
            CompletionStage<TaskStatus> stage = task.definition().operation().execute(buffer);
            if (stage == null) {
                completions.add(new Completion(task, buffer, null,
                        new IllegalStateException("operation returned no result"), dispatchedAt, System.nanoTime()));
                return;
            }
            stage.whenComplete((status, error) ->
                    completions.add(new Completion(task, buffer, status, error, dispatchedAt, System.nanoTime())));
        } catch (Throwable e) {
            completions.add(new Completion(task, buffer, null, e, dispatchedAt, System.nanoTime()));
        } finally {
            MdcContext.clear();
        }
    }

    private void handle(Completion completion) {
        TaskNode task = completion.task();
        TaskOutputBuffer buffer = completion.buffer();
        buffer.close();

        TaskStatus status = resolveStatus(completion);
        Duration elapsed = Duration.ofNanos(completion.completedAt() - completion.dispatchedAt());
        complete(task, new TaskResult(task.name(), status, elapsed, buffer.standardText(), buffer.errorText(),
                task.definition().hadEmptyScript()));

        if (status.isSuccessful()) {
            for (TaskNode dependent : task.dependents()) {
                int remaining = unfinishedDependencies.merge(dependent, -1, Integer::sum);
                if (remaining == 0 && !statuses.containsKey(dependent)) {
                    markReady(dependent);
                }
            }
        } else {
            blockDependentsOf(task);
        }
    }

    private TaskStatus resolveStatus(Completion completion) {
        String name = completion.task().name();
        Throwable error = completion.error();
        if (error != null) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            log.warn("Task {} failed with an exception: {}", name, cause.toString());
            completion.buffer().appendFault("Task '" + name + "' threw " + cause);
            return TaskStatus.FAILURE;
        }
        TaskStatus status = completion.status();
        if (status == null || !status.isTerminal() || status == TaskStatus.BLOCKED) {
            log.warn("Task {} returned {} instead of a completion status", name, status);
            completion.buffer().appendFault("Task '" + name + "' returned an invalid status: " + status);
            return TaskStatus.FAILURE;
        }
        return status;
    }

    private void blockDependentsOf(TaskNode failed) {
        var pending = new ArrayDeque<TaskNode>(failed.dependents());
        while (!pending.isEmpty()) {
            TaskNode dependent = pending.poll();
            TaskStatus current = statuses.get(dependent);
            if (current != null && current.isTerminal()) {
                continue;
            }
            log.debug("Task {} blocked by {}", dependent.name(), failed.name());
            complete(dependent, TaskResult.blocked(dependent.name(), dependent.definition().hadEmptyScript()));
            eventBus.publish(RunEvent.of(RunEvent.TASK_BLOCKED, runId, dependent.name(),
                    Map.of("blockedBy", failed.name())));
            pending.addAll(dependent.dependents());
        }
    }

    private void complete(TaskNode task, TaskResult taskResult) {
        statuses.put(task, taskResult.status());
        reportBuilder.record(taskResult);
        collator.taskCompleted(taskResult);
        if (metrics != null) {
            metrics.recordTaskResult(taskResult.status(), taskResult.elapsed());
        }
        if (taskResult.status() != TaskStatus.BLOCKED) {
            eventBus.publish(RunEvent.of(RunEvent.TASK_COMPLETED, runId, task.name(),
                    Map.of("status", taskResult.status().name(),
                           "elapsedMs", taskResult.elapsed().toMillis())));
        }
    }

    private void finish() {
        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        RunReport report = reportBuilder.build(elapsed);
        collator.printSummary(report);
        if (metrics != null) {
            metrics.recordRunResult(report.isSuccessful(), elapsed);
        }
        eventBus.publish(RunEvent.of(RunEvent.RUN_COMPLETED, runId, null,
                Map.of("successful", report.isSuccessful(),
                       "failed", report.failed().size(),
                       "blocked", report.blocked().size())));

        if (report.isSuccessful()) {
            log.info("Run {} succeeded in {}ms", runId, elapsed.toMillis());
            result.complete(report);
        } else {
            log.info("Run {} failed in {}ms: {} failed, {} with warnings, {} blocked", runId, elapsed.toMillis(),
                    report.failed().size(), report.warnings().size(), report.blocked().size());
            result.completeExceptionally(
                    new BuildFailedException(ReportBuilder.composeFailureMessage(report), report));
        }
    }

    private ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "buildrunner-worker-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private record Completion(TaskNode task, TaskOutputBuffer buffer, TaskStatus status,
                              Throwable error, long dispatchedAt, long completedAt) {}
}
