package com.libragraph.bootstep.util;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a {@link DependencyGraph} has no topological order.
 * {@link #cycle()} lists the nodes of one offending cycle, first node repeated at the end.
 */
public class CycleException extends RuntimeException {

    private final List<Object> cycle;

    public CycleException(List<?> cycle) {
        super("Dependency cycle: " + cycle.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" -> ")));
        this.cycle = List.copyOf(cycle);
    }

    public List<Object> cycle() {
        return cycle;
    }
}
