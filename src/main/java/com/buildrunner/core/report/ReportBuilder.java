package com.buildrunner.core.report;

import com.buildrunner.core.model.TaskResult;
import com.buildrunner.core.output.OutputCollator;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collects terminal results as a run progresses and composes the final verdict.
 * Each task may be recorded exactly once.
 */
public class ReportBuilder {

    private final String runId;
    private final int totalTasks;
    private final boolean allowWarningsInSuccessfulBuild;
    private final List<TaskResult> results = new ArrayList<>();
    private final Set<String> recorded = new HashSet<>();

    public ReportBuilder(String runId, int totalTasks, boolean allowWarningsInSuccessfulBuild) {
        this.runId = runId;
        this.totalTasks = totalTasks;
        this.allowWarningsInSuccessfulBuild = allowWarningsInSuccessfulBuild;
    }

    public synchronized void record(TaskResult result) {
        if (!result.status().isTerminal()) {
            throw new IllegalArgumentException("Task " + result.name() + " is not finished: " + result.status());
        }
        if (!recorded.add(result.name())) {
            throw new IllegalStateException("Task " + result.name() + " already has a terminal status");
        }
        results.add(result);
    }

    public synchronized int recordedCount() {
        return results.size();
    }

    public synchronized boolean isComplete() {
        return results.size() == totalTasks;
    }

    public synchronized RunReport build(Duration elapsed) {
        return new RunReport(runId, results, elapsed, allowWarningsInSuccessfulBuild);
    }

    /**
     * Message for a run that did not succeed: a summary line naming the offending tasks,
     * then one section per offending task with its abridged output.
     */
    public static String composeFailureMessage(RunReport report) {
        int total = report.totalTasks();
        var summary = new ArrayList<String>();

        List<TaskResult> failed = report.failed();
        if (!failed.isEmpty()) {
            summary.add(failed.size() + " of " + total + " " + tasks(total) + " failed: " + names(failed));
        }
        List<TaskResult> warnings = report.warnings();
        if (!warnings.isEmpty() && !report.allowWarningsInSuccessfulBuild()) {
            summary.add(warnings.size() + " of " + total + " " + tasks(total)
                    + " completed with warnings: " + names(warnings));
        }
        List<TaskResult> blocked = report.blocked();
        if (!blocked.isEmpty()) {
            summary.add(blocked.size() + " blocked: " + names(blocked));
        }

        var message = new StringBuilder(String.join("; ", summary));
        for (TaskResult result : report.offending()) {
            message.append("\n\n[").append(result.name()).append("] ").append(result.status().label());
            for (String line : OutputCollator.reportLines(result)) {
                message.append("\n  ").append(line);
            }
        }
        return message.toString();
    }

    private static String names(List<TaskResult> results) {
        return results.stream().map(TaskResult::name).collect(Collectors.joining(", "));
    }

    private static String tasks(int count) {
        return count == 1 ? "task" : "tasks";
    }
}
