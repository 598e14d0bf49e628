package com.libragraph.bootstep.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DependencyGraphTest {

    // --- Ordering ---

    @Test
    void requirementsComeFirst() {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        entries.put("consumer", List.of("pool", "timer"));
        entries.put("pool", List.of("timer"));
        entries.put("timer", List.of());

        List<String> order = new DependencyGraph<>(entries).topologicalOrder();

        assertThat(order).containsExactly("timer", "pool", "consumer");
    }

    @Test
    void unrelatedNodesKeepInsertionOrder() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addNode("c");
        graph.addNode("a");
        graph.addNode("b");

        assertThat(graph.topologicalOrder()).containsExactly("c", "a", "b");
    }

    @Test
    void readyNodesPreferEarlierInsertion() {
        // d is inserted by the edge, ahead of c
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addNode("a");
        graph.addEdge("b", "d");
        graph.addNode("c");
        graph.addNode("d");

        assertThat(graph.topologicalOrder()).containsExactly("a", "d", "b", "c");
    }

    @Test
    void extraEdgesAfterConstructionPinNodeLast() {
        Map<String, List<String>> entries = new LinkedHashMap<>();
        entries.put("a", List.of());
        entries.put("c", List.of());
        entries.put("b", List.of("a"));
        DependencyGraph<String> graph = new DependencyGraph<>(entries);

        for (String node : List.of("a", "b")) {
            graph.addEdge("c", node);
        }

        assertThat(graph.topologicalOrder()).containsExactly("a", "b", "c");
    }

    @Test
    void addEdgeCreatesUnknownEndpoints() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("b", "a");

        assertThat(graph.contains("a")).isTrue();
        assertThat(graph.size()).isEqualTo(2);
        assertThat(graph.requirementsOf("b")).containsExactly("a");
        assertThat(graph.requirementsOf("missing")).isEmpty();
        assertThat(graph).containsExactly("b", "a");
    }

    @Test
    void emptyGraphHasEmptyOrder() {
        assertThat(new DependencyGraph<String>().topologicalOrder()).isEmpty();
    }

    // --- Cycles ---

    @Test
    void twoNodeCycleIsReported() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("a", "b");
        graph.addEdge("b", "a");

        assertThatThrownBy(graph::topologicalOrder)
                .isInstanceOf(CycleException.class)
                .hasMessageContaining("a -> b -> a")
                .satisfies(e -> assertThat(((CycleException) e).cycle())
                        .containsExactly("a", "b", "a"));
    }

    @Test
    void cycleExcludesNodesThatOnlyLeadIntoIt() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("entry", "x");
        graph.addEdge("x", "y");
        graph.addEdge("y", "z");
        graph.addEdge("z", "x");
        graph.addNode("free");

        CycleException e = catchThrowableOfType(graph::topologicalOrder, CycleException.class);

        assertThat(e.cycle()).containsExactly("x", "y", "z", "x");
    }

    @Test
    void selfRequirementIsACycle() {
        DependencyGraph<String> graph = new DependencyGraph<>();
        graph.addEdge("a", "a");

        assertThatExceptionOfType(CycleException.class)
                .isThrownBy(graph::topologicalOrder)
                .withMessage("Dependency cycle: a -> a");
    }

    @Test
    void rejectsNullNode() {
        assertThatNullPointerException()
                .isThrownBy(() -> new DependencyGraph<String>().addNode(null));
    }
}
