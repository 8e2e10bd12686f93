package com.buildrunner.core.model;

import com.buildrunner.core.output.BufferedTerminal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ModelTest {

    @Test
    @DisplayName("only the four outcome statuses are terminal")
    void terminalStatuses() {
        assertFalse(TaskStatus.READY.isTerminal());
        assertFalse(TaskStatus.EXECUTING.isTerminal());
        assertTrue(TaskStatus.SUCCESS.isTerminal());
        assertTrue(TaskStatus.SUCCESS_WITH_WARNING.isTerminal());
        assertTrue(TaskStatus.FAILURE.isTerminal());
        assertTrue(TaskStatus.BLOCKED.isTerminal());
    }

    @Test
    @DisplayName("success and warning let dependents run")
    void successfulStatuses() {
        assertTrue(TaskStatus.SUCCESS.isSuccessful());
        assertTrue(TaskStatus.SUCCESS_WITH_WARNING.isSuccessful());
        assertFalse(TaskStatus.FAILURE.isSuccessful());
        assertFalse(TaskStatus.BLOCKED.isSuccessful());
        assertEquals("success with warning", TaskStatus.SUCCESS_WITH_WARNING.label());
    }

    @Test
    @DisplayName("task definition requires a non-blank name and an operation")
    void definitionValidation() {
        assertThrows(IllegalArgumentException.class, () -> TaskDefinition.sync(" ", w -> TaskStatus.SUCCESS));
        assertThrows(NullPointerException.class, () -> TaskDefinition.of("build", null));

        var definition = TaskDefinition.sync("build", w -> TaskStatus.SUCCESS);
        assertFalse(definition.incrementalBuildAllowed());
        assertFalse(definition.hadEmptyScript());
    }

    @Test
    @DisplayName("blocked result carries no output")
    void blockedResult() {
        TaskResult result = TaskResult.blocked("deploy", true);
        assertEquals(TaskStatus.BLOCKED, result.status());
        assertEquals(Duration.ZERO, result.elapsed());
        assertFalse(result.hasErrorOutput());
        assertTrue(result.hadEmptyScript());
    }

    @Test
    @DisplayName("error output made only of whitespace does not count")
    void blankErrorOutput() {
        var result = new TaskResult("lint", TaskStatus.FAILURE, Duration.ZERO, "out", " \n ", false);
        assertFalse(result.hasErrorOutput());
    }

    @Test
    @DisplayName("options require a terminal and copy with changes")
    void optionsCopy() {
        assertThrows(NullPointerException.class, () -> TaskRunnerOptions.defaults(null));

        var options = TaskRunnerOptions.defaults(new BufferedTerminal())
                .withParallelism(3)
                .withQuietMode(true)
                .withAllowWarningsInSuccessfulBuild(true);
        assertEquals("3", options.parallelism());
        assertTrue(options.quietMode());
        assertTrue(options.allowWarningsInSuccessfulBuild());
        assertFalse(options.changedProjectsOnly());
    }
}
