package com.buildrunner.core.graph;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CriticalPathTest {

    @Test
    @DisplayName("length counts the longest chain of dependents including the task")
    void chainLengths() {
        // lib <- core <- app, lib <- docs
        Map<String, List<String>> dependents = Map.of(
                "lib", List.of("core", "docs"),
                "core", List.of("app"),
                "app", List.of(),
                "docs", List.of());

        var lengths = CriticalPath.lengths(dependents);

        assertEquals(3, lengths.get("lib"));
        assertEquals(2, lengths.get("core"));
        assertEquals(1, lengths.get("app"));
        assertEquals(1, lengths.get("docs"));
    }

    @Test
    @DisplayName("empty graph gives no lengths")
    void empty() {
        assertTrue(CriticalPath.lengths(Map.of()).isEmpty());
    }

    @Test
    @DisplayName("diamond counts the longer branch once")
    void diamond() {
        // base <- left <- top, base <- right <- mid <- top
        Map<String, List<String>> dependents = Map.of(
                "base", List.of("left", "right"),
                "left", List.of("top"),
                "right", List.of("mid"),
                "mid", List.of("top"),
                "top", List.of());

        var lengths = CriticalPath.lengths(dependents);

        assertEquals(4, lengths.get("base"));
        assertEquals(2, lengths.get("left"));
        assertEquals(3, lengths.get("right"));
    }

    @Test
    @DisplayName("very deep chains are measured without exhausting the thread stack")
    void deepChain() {
        int depth = 20_000;
        var dependents = new LinkedHashMap<String, List<String>>();
        for (int i = 0; i < depth - 1; i++) {
            dependents.put("t" + i, List.of("t" + (i + 1)));
        }
        dependents.put("t" + (depth - 1), List.of());

        var lengths = CriticalPath.lengths(dependents);

        assertEquals(depth, lengths.get("t0"));
        assertEquals(1, lengths.get("t" + (depth - 1)));
        assertEquals(depth, lengths.size());
    }
}
