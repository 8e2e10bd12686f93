package com.buildrunner.core.output;

import com.buildrunner.core.model.TaskResult;
import com.buildrunner.core.model.TaskStatus;
import com.buildrunner.core.report.RunReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serialises finished tasks' output onto the shared terminal.
 *
 * <p>Each task's block is written in one go, under a lock, when the task reaches a terminal
 * status, so blocks appear in completion order and never interleave. Blocked tasks print
 * nothing until the end-of-run summary, though they still count towards progress. Successful tasks print their standard output unless quiet mode is on. Failures and
 * warnings print an abridged report of the error channel, or of the standard channel when the
 * error channel is empty.
 */
public class OutputCollator {

    static final int HEADER_WIDTH = 79;

    private final Terminal terminal;
    private final boolean quietMode;
    private final boolean allowWarningsInSuccessfulBuild;
    private final int totalTasks;
    private final ReentrantLock lock = new ReentrantLock();
    private int completed = 0;

    public OutputCollator(Terminal terminal, boolean quietMode, boolean allowWarningsInSuccessfulBuild,
                          int totalTasks) {
        this.terminal = terminal;
        this.quietMode = quietMode;
        this.allowWarningsInSuccessfulBuild = allowWarningsInSuccessfulBuild;
        this.totalTasks = totalTasks;
    }

    /**
     * Lines shown for a failing or warning task: the error channel if it has any content,
     * otherwise the standard channel, abridged.
     */
    public static List<String> reportLines(TaskResult result) {
        String text = result.hasErrorOutput() ? result.errorOutput() : result.standardOutput();
        return OutputAbridger.abridge(text);
    }

    public void taskCompleted(TaskResult result) {
        lock.lock();
        try {
            completed++;
            switch (result.status()) {
                case SUCCESS -> emitSuccess(result);
                case SUCCESS_WITH_WARNING -> emitWarning(result);
                case FAILURE -> emitFailure(result);
                case BLOCKED -> { }
                default -> throw new IllegalArgumentException("Not a terminal status: " + result.status());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Print one section per non-empty status group. Quiet mode leaves out the success group.
     */
    public void printSummary(RunReport report) {
        lock.lock();
        try {
            terminal.writeLine("");
            if (!quietMode) {
                summarySection(report, TaskStatus.SUCCESS, "SUCCESS");
            }
            summarySection(report, TaskStatus.SUCCESS_WITH_WARNING, "SUCCESS WITH WARNINGS");
            summarySection(report, TaskStatus.BLOCKED, "BLOCKED");
            summarySection(report, TaskStatus.FAILURE, "FAILURE");

            String elapsed = seconds(report.elapsed());
            if (report.isSuccessful()) {
                terminal.writeSuccessLine("Run " + report.runId() + " succeeded in " + elapsed + " seconds");
            } else {
                terminal.writeErrorLine("Run " + report.runId() + " failed in " + elapsed + " seconds");
            }
        } finally {
            lock.unlock();
        }
    }

    private void emitSuccess(TaskResult result) {
        if (quietMode) {
            return;
        }
        terminal.writeLine(header(result.name()));
        OutputAbridger.trimmedLines(result.standardOutput()).forEach(terminal::writeLine);
        OutputAbridger.trimmedLines(result.errorOutput()).forEach(terminal::writeWarningLine);
        String outcome = result.hadEmptyScript() ? "had an empty script" : "completed successfully";
        terminal.writeSuccessLine(result.name() + " " + outcome + " in " + seconds(result.elapsed())
                + " seconds " + progress());
    }

    private void emitWarning(TaskResult result) {
        terminal.writeLine(header(result.name()));
        reportLines(result).forEach(terminal::writeLine);
        String suffix = allowWarningsInSuccessfulBuild ? "" : " (warnings are treated as errors)";
        terminal.writeWarningLine(result.name() + " completed with warnings in " + seconds(result.elapsed())
                + " seconds " + progress() + suffix);
    }

    private void emitFailure(TaskResult result) {
        terminal.writeLine(header(result.name()));
        reportLines(result).forEach(terminal::writeLine);
        terminal.writeErrorLine(result.name() + " failed in " + seconds(result.elapsed()) + " seconds " + progress());
    }

    private void summarySection(RunReport report, TaskStatus status, String title) {
        List<TaskResult> group = report.withStatus(status);
        if (group.isEmpty()) {
            return;
        }
        String noun = group.size() == 1 ? "task" : "tasks";
        var lines = new ArrayList<String>();
        lines.add(header(title + ": " + group.size() + " " + noun));
        group.forEach(r -> lines.add("  " + r.name()));
        lines.add("");
        switch (status) {
            case FAILURE -> lines.forEach(terminal::writeErrorLine);
            case SUCCESS_WITH_WARNING, BLOCKED -> lines.forEach(terminal::writeWarningLine);
            default -> lines.forEach(terminal::writeLine);
        }
    }

    private String progress() {
        return "(" + completed + " of " + totalTasks + ")";
    }

    static String header(String title) {
        var header = new StringBuilder("==[ ").append(title).append(" ]");
        while (header.length() < HEADER_WIDTH) {
            header.append('=');
        }
        return header.toString();
    }

    static String seconds(Duration duration) {
        return String.format(Locale.ROOT, "%.2f", duration.toMillis() / 1000.0);
    }
}
