package com.buildrunner.core.report;

import com.buildrunner.core.model.TaskResult;
import com.buildrunner.core.model.TaskStatus;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one run.
 *
 * @param runId                          id assigned when the run started
 * @param results                        one entry per task, in the order tasks reached a terminal status
 * @param elapsed                        wall time of the whole run
 * @param allowWarningsInSuccessfulBuild whether warnings counted as passing for this run
 */
public record RunReport(
    String runId,
    List<TaskResult> results,
    Duration elapsed,
    boolean allowWarningsInSuccessfulBuild
) {

    public RunReport {
        results = List.copyOf(results);
    }

    public List<TaskResult> withStatus(TaskStatus status) {
        return results.stream().filter(r -> r.status() == status).toList();
    }

    public List<TaskResult> succeeded() {
        return withStatus(TaskStatus.SUCCESS);
    }

    public List<TaskResult> warnings() {
        return withStatus(TaskStatus.SUCCESS_WITH_WARNING);
    }

    public List<TaskResult> failed() {
        return withStatus(TaskStatus.FAILURE);
    }

    public List<TaskResult> blocked() {
        return withStatus(TaskStatus.BLOCKED);
    }

    /**
     * Tasks that make the run fail: every failure, plus warnings when they are not allowed.
     */
    public List<TaskResult> offending() {
        return results.stream().filter(this::isOffending).toList();
    }

    public boolean isOffending(TaskResult result) {
        return result.status() == TaskStatus.FAILURE
                || (result.status() == TaskStatus.SUCCESS_WITH_WARNING && !allowWarningsInSuccessfulBuild);
    }

    public boolean isSuccessful() {
        return offending().isEmpty();
    }

    public int totalTasks() {
        return results.size();
    }
}
