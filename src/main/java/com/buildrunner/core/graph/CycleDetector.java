package com.buildrunner.core.graph;

import com.buildrunner.core.exception.CyclicDependencyException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Depth-first cycle search over an edge snapshot. Stateless; every call walks the given edges
 * from scratch. The walk keeps its own stack, so chain depth is bounded by heap, not by the
 * calling thread's stack.
 */
public final class CycleDetector {

    private CycleDetector() {}

    /**
     * @throws CyclicDependencyException naming the first cycle found
     */
    public static void check(Map<String, List<String>> edges) {
        findCycle(edges).ifPresent(cycle -> {
            throw new CyclicDependencyException(cycle);
        });
    }

    /**
     * Find a cycle in {@code edges} (node name to the names it points at).
     *
     * @return the names along the cycle with the first repeated at the end, e.g. [a, b, a]
     */
    public static Optional<List<String>> findCycle(Map<String, List<String>> edges) {
        Set<String> finished = new HashSet<>();
        Set<String> onStack = new HashSet<>();
        Deque<String> path = new ArrayDeque<>();
        Deque<Iterator<String>> unexplored = new ArrayDeque<>();

        for (String start : edges.keySet()) {
            if (finished.contains(start)) {
                continue;
            }
            enter(start, edges, onStack, path, unexplored);
            while (!unexplored.isEmpty()) {
                Iterator<String> targets = unexplored.peekLast();
                if (!targets.hasNext()) {
                    unexplored.removeLast();
                    String done = path.removeLast();
                    onStack.remove(done);
                    finished.add(done);
                    continue;
                }
                String next = targets.next();
                if (onStack.contains(next)) {
                    return Optional.of(cycleEndingAt(next, path));
                }
                if (!finished.contains(next)) {
                    enter(next, edges, onStack, path, unexplored);
                }
            }
        }
        return Optional.empty();
    }

    private static void enter(String node, Map<String, List<String>> edges, Set<String> onStack,
                              Deque<String> path, Deque<Iterator<String>> unexplored) {
        onStack.add(node);
        path.addLast(node);
        unexplored.addLast(edges.getOrDefault(node, List.of()).iterator());
    }

    private static List<String> cycleEndingAt(String repeated, Deque<String> path) {
        var cycle = new ArrayList<String>();
        boolean inCycle = false;
        for (String name : path) {
            if (name.equals(repeated)) {
                inCycle = true;
            }
            if (inCycle) {
                cycle.add(name);
            }
        }
        cycle.add(repeated);
        return cycle;
    }
}
