package com.buildrunner.core.model;

import java.time.Duration;

/**
 * Terminal outcome of one task together with everything it wrote.
 *
 * @param name           task name
 * @param status         terminal status
 * @param elapsed        wall time between dispatch and completion; zero for blocked tasks
 * @param standardOutput captured standard channel, concatenated in write order
 * @param errorOutput    captured error channel, concatenated in write order
 * @param hadEmptyScript copied from the task definition
 */
public record TaskResult(
    String name,
    TaskStatus status,
    Duration elapsed,
    String standardOutput,
    String errorOutput,
    boolean hadEmptyScript
) {

    public static TaskResult blocked(String name, boolean hadEmptyScript) {
        return new TaskResult(name, TaskStatus.BLOCKED, Duration.ZERO, "", "", hadEmptyScript);
    }

    public boolean hasErrorOutput() {
        return errorOutput != null && !errorOutput.isBlank();
    }
}
