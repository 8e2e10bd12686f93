package com.buildrunner.core.graph;

import com.buildrunner.core.model.TaskDefinition;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A registered task and its edges. Edges are only added while the owning graph is open.
 */
public final class TaskNode {

    private final TaskDefinition definition;
    private final int registrationIndex;
    private final Set<TaskNode> dependencies = new LinkedHashSet<>();
    private final Set<TaskNode> dependents = new LinkedHashSet<>();

    TaskNode(TaskDefinition definition, int registrationIndex) {
        this.definition = definition;
        this.registrationIndex = registrationIndex;
    }

    public String name() {
        return definition.name();
    }

    public TaskDefinition definition() {
        return definition;
    }

    public int registrationIndex() {
        return registrationIndex;
    }

    public Set<TaskNode> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    public Set<TaskNode> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    void addDependency(TaskNode dependency) {
        if (dependencies.add(dependency)) {
            dependency.dependents.add(this);
        }
    }

    @Override
    public String toString() {
        return "TaskNode{" + name() + ", deps=" + dependencies.size() + "}";
    }
}
