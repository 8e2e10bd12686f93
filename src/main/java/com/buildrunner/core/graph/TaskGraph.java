package com.buildrunner.core.graph;

import com.buildrunner.core.exception.DuplicateTaskException;
import com.buildrunner.core.exception.UnknownDependencyException;
import com.buildrunner.core.exception.UnknownTaskException;
import com.buildrunner.core.model.TaskDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of tasks and the dependency edges between them.
 *
 * <p>The graph is open for registration until {@link #freeze()} is called, after which it is
 * read-only. Failed registrations leave the graph unchanged.
 */
public class TaskGraph {

    private static final Logger log = LoggerFactory.getLogger(TaskGraph.class);

    private final Map<String, TaskNode> tasks = new LinkedHashMap<>();
    private volatile boolean frozen = false;

    /**
     * Register a task.
     *
     * @throws DuplicateTaskException if a task with the same name exists
     * @throws IllegalStateException  if the graph has been frozen
     */
    public synchronized TaskNode addTask(TaskDefinition definition) {
        ensureOpen();
        if (tasks.containsKey(definition.name())) {
            throw new DuplicateTaskException(definition.name());
        }
        var node = new TaskNode(definition, tasks.size());
        tasks.put(definition.name(), node);
        log.debug("Registered task {}", definition.name());
        return node;
    }

    /**
     * Declare that {@code taskName} may not start until every task in {@code dependencyNames} has
     * finished successfully. All names are validated before any edge is added.
     *
     * @throws UnknownTaskException       if {@code taskName} is not registered
     * @throws UnknownDependencyException if any dependency name is not registered
     * @throws IllegalStateException      if the graph has been frozen
     */
    public synchronized void addDependencies(String taskName, Collection<String> dependencyNames) {
        ensureOpen();
        TaskNode task = tasks.get(taskName);
        if (task == null) {
            throw new UnknownTaskException(taskName);
        }
        var resolved = new ArrayList<TaskNode>(dependencyNames.size());
        for (String dependencyName : dependencyNames) {
            TaskNode dependency = tasks.get(dependencyName);
            if (dependency == null) {
                throw new UnknownDependencyException(taskName, dependencyName);
            }
            resolved.add(dependency);
        }
        resolved.forEach(task::addDependency);
        log.debug("Task {} depends on {}", taskName, dependencyNames);
    }

    /**
     * Close the graph to further registration. Idempotent.
     */
    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public synchronized Optional<TaskNode> find(String name) {
        return Optional.ofNullable(tasks.get(name));
    }

    /** Tasks in registration order. */
    public synchronized List<TaskNode> tasks() {
        return List.copyOf(tasks.values());
    }

    public synchronized int size() {
        return tasks.size();
    }

    /**
     * Fresh copy of the edges as task name to dependency names, in registration order.
     */
    public synchronized Map<String, List<String>> dependencyEdges() {
        var edges = new LinkedHashMap<String, List<String>>();
        for (var node : tasks.values()) {
            edges.put(node.name(), node.dependencies().stream().map(TaskNode::name).toList());
        }
        return edges;
    }

    /**
     * Fresh copy of the edges as task name to dependent names, in registration order.
     */
    public synchronized Map<String, List<String>> dependentEdges() {
        var edges = new LinkedHashMap<String, List<String>>();
        for (var node : tasks.values()) {
            edges.put(node.name(), node.dependents().stream().map(TaskNode::name).toList());
        }
        return edges;
    }

    private void ensureOpen() {
        if (frozen) {
            throw new IllegalStateException("Tasks cannot be registered after execution has started");
        }
    }
}
