package com.libragraph.bootstep.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed graph of nodes and their requirements.
 * <p>
 * An edge {@code (node, requirement)} means {@code node} must come after
 * {@code requirement}. {@link #topologicalOrder()} returns every node after all of its
 * requirements; nodes with no ordering relation keep their insertion order.
 * <p>
 * Not thread-safe.
 */
public final class DependencyGraph<T> implements Iterable<T> {

    private final Map<T, Set<T>> requirements = new LinkedHashMap<>();

    public DependencyGraph() {
    }

    /** Builds a graph from {@code node -> requirements} entries, in map iteration order. */
    public DependencyGraph(Map<T, ? extends Iterable<T>> entries) {
        for (Map.Entry<T, ? extends Iterable<T>> entry : entries.entrySet()) {
            addNode(entry.getKey());
            for (T required : entry.getValue()) {
                addEdge(entry.getKey(), required);
            }
        }
    }

    public void addNode(T node) {
        Objects.requireNonNull(node, "node cannot be null");
        requirements.computeIfAbsent(node, k -> new LinkedHashSet<>());
    }

    /** Adds an edge; unknown endpoints become nodes. */
    public void addEdge(T node, T requirement) {
        addNode(node);
        addNode(requirement);
        requirements.get(node).add(requirement);
    }

    public boolean contains(T node) {
        return requirements.containsKey(node);
    }

    public Set<T> requirementsOf(T node) {
        Set<T> reqs = requirements.get(node);
        return reqs == null ? Set.of() : Collections.unmodifiableSet(reqs);
    }

    public int size() {
        return requirements.size();
    }

    @Override
    public Iterator<T> iterator() {
        return Collections.unmodifiableSet(requirements.keySet()).iterator();
    }

    /**
     * Returns all nodes ordered so that each follows its requirements.
     *
     * @throws CycleException if the requirements form a cycle
     */
    public List<T> topologicalOrder() {
        Map<T, Integer> position = new HashMap<>();
        Map<T, Integer> pending = new HashMap<>();
        Map<T, List<T>> dependents = new HashMap<>();
        for (Map.Entry<T, Set<T>> entry : requirements.entrySet()) {
            position.put(entry.getKey(), position.size());
            pending.put(entry.getKey(), entry.getValue().size());
            for (T required : entry.getValue()) {
                dependents.computeIfAbsent(required, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        PriorityQueue<T> ready = new PriorityQueue<>(Comparator.comparingInt(position::get));
        for (T node : requirements.keySet()) {
            if (pending.get(node) == 0) {
                ready.add(node);
            }
        }

        List<T> order = new ArrayList<>(requirements.size());
        while (!ready.isEmpty()) {
            T node = ready.poll();
            order.add(node);
            for (T dependent : dependents.getOrDefault(node, List.of())) {
                if (pending.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (order.size() < requirements.size()) {
            Set<T> unresolved = new LinkedHashSet<>(requirements.keySet());
            order.forEach(unresolved::remove);
            throw new CycleException(findCycle(unresolved));
        }
        return order;
    }

    /**
     * Every unresolved node still waits on another unresolved node, so walking
     * requirements from any of them must revisit a node.
     */
    private List<T> findCycle(Set<T> unresolved) {
        List<T> path = new ArrayList<>();
        Map<T, Integer> onPath = new HashMap<>();
        T current = unresolved.iterator().next();
        while (!onPath.containsKey(current)) {
            onPath.put(current, path.size());
            path.add(current);
            current = nextUnresolved(current, unresolved);
        }
        List<T> cycle = new ArrayList<>(path.subList(onPath.get(current), path.size()));
        cycle.add(current);
        return cycle;
    }

    private T nextUnresolved(T node, Set<T> unresolved) {
        for (T required : requirements.get(node)) {
            if (unresolved.contains(required)) {
                return required;
            }
        }
        throw new IllegalStateException("Node " + node + " has no unresolved requirement");
    }

    @Override
    public String toString() {
        return "DependencyGraph" + requirements;
    }
}
