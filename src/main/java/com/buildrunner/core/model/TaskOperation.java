package com.buildrunner.core.model;

import java.util.concurrent.CompletionStage;

/**
 * The work a task performs. Invoked at most once per run.
 */
@FunctionalInterface
public interface TaskOperation {

    /**
     * Run the task, writing any output to {@code writer}.
     *
     * @return a stage completing with one of {@link TaskStatus#SUCCESS},
     *         {@link TaskStatus#SUCCESS_WITH_WARNING} or {@link TaskStatus#FAILURE}
     */
    CompletionStage<TaskStatus> execute(TaskWriter writer);
}
