package com.buildrunner.core.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Length of the longest chain of dependents hanging off each task. A task nothing depends on
 * has length 1. Only valid for acyclic edges.
 */
public final class CriticalPath {

    private CriticalPath() {}

    /**
     * @param dependents task name to the names of tasks that depend on it
     */
    public static Map<String, Integer> lengths(Map<String, List<String>> dependents) {
        var lengths = new HashMap<String, Integer>();
        Deque<String> stack = new ArrayDeque<>();
        for (String root : dependents.keySet()) {
            stack.push(root);
            while (!stack.isEmpty()) {
                String name = stack.peek();
                if (lengths.containsKey(name)) {
                    stack.pop();
                    continue;
                }
                // Post-order: a task is measured once every dependent has a length.
                int longest = 0;
                boolean measurable = true;
                for (String dependent : dependents.getOrDefault(name, List.of())) {
                    Integer known = lengths.get(dependent);
                    if (known == null) {
                        stack.push(dependent);
                        measurable = false;
                    } else {
                        longest = Math.max(longest, known);
                    }
                }
                if (measurable) {
                    stack.pop();
                    lengths.put(name, longest + 1);
                }
            }
        }
        return lengths;
    }
}
