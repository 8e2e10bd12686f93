package com.buildrunner.core.exception;

import java.util.List;

/**
 * Thrown synchronously by {@code execute()} when the dependency graph has a cycle.
 * No task has been dispatched when this is raised.
 */
public class CyclicDependencyException extends BuildRunnerException {

    private final List<String> cycle;

    /**
     * @param cycle task names along the cycle; the first name is repeated at the end
     */
    public CyclicDependencyException(List<String> cycle) {
        super("A cyclic dependency was encountered: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    public List<String> cycle() {
        return cycle;
    }
}
