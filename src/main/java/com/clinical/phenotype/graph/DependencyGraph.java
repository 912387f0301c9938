package com.clinical.phenotype.graph;

import com.clinical.phenotype.core.model.DependencyEdge;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Directed graph of declarations; an edge runs from a consumer to each producer it reads.
 * Immutable once built. Adjacency sets keep insertion order so every traversal is reproducible.
 */
public final class DependencyGraph {

    private final Map<String, GraphNode> nodes;
    private final Map<String, Set<String>> dependencies;
    private final Map<String, Set<String>> dependents;
    private final List<DependencyEdge> edges;

    private DependencyGraph(Builder builder) {
        this.nodes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodes));
        Map<String, Set<String>> deps = new LinkedHashMap<>();
        Map<String, Set<String>> rdeps = new LinkedHashMap<>();
        for (String name : nodes.keySet()) {
            deps.put(name, new LinkedHashSet<>());
            rdeps.put(name, new LinkedHashSet<>());
        }
        List<DependencyEdge> edgeList = new ArrayList<>();
        for (DependencyEdge edge : builder.edges) {
            if (deps.get(edge.consumer()).add(edge.producer())) {
                rdeps.get(edge.producer()).add(edge.consumer());
                edgeList.add(edge);
            }
        }
        deps.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        rdeps.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.dependencies = Collections.unmodifiableMap(deps);
        this.dependents = Collections.unmodifiableMap(rdeps);
        this.edges = List.copyOf(edgeList);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, GraphNode> nodes() {
        return nodes;
    }

    public GraphNode node(String name) {
        GraphNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Unknown graph node: " + name);
        }
        return node;
    }

    public boolean contains(String name) {
        return nodes.containsKey(name);
    }

    public List<DependencyEdge> edges() {
        return edges;
    }

    public Set<String> dependenciesOf(String name) {
        node(name);
        return dependencies.get(name);
    }

    public Set<String> dependentsOf(String name) {
        node(name);
        return dependents.get(name);
    }

    /**
     * Every node reachable through producer edges, excluding {@code name} itself.
     * Ordered by first discovery (depth-first, declaration order).
     */
    public Set<String> transitiveDependenciesOf(String name) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(name);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            for (String producer : dependenciesOf(current)) {
                if (seen.add(producer)) {
                    stack.push(producer);
                }
            }
        }
        seen.remove(name);
        return seen;
    }

    /**
     * Finds one cycle, returned as a path whose first node is repeated at the end.
     */
    public Optional<List<String>> findCycle() {
        Map<String, Integer> state = new HashMap<>();
        for (String start : nodes.keySet()) {
            if (state.containsKey(start)) {
                continue;
            }
            List<String> path = new ArrayList<>();
            List<String> cycle = visit(start, state, path);
            if (cycle != null) {
                return Optional.of(cycle);
            }
        }
        return Optional.empty();
    }

    // state: 1 = on the current path, 2 = finished
    private List<String> visit(String name, Map<String, Integer> state, List<String> path) {
        state.put(name, 1);
        path.add(name);
        for (String producer : dependencies.get(name)) {
            Integer s = state.get(producer);
            if (s == null) {
                List<String> cycle = visit(producer, state, path);
                if (cycle != null) {
                    return cycle;
                }
            } else if (s == 1) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(producer), path.size()));
                cycle.add(producer);
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        state.put(name, 2);
        return null;
    }

    /**
     * Producers before consumers; among nodes ready at the same time, declaration order wins.
     *
     * @throws CyclicDependencyException if the graph is not acyclic
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> remaining = new HashMap<>();
        PriorityQueue<GraphNode> ready = new PriorityQueue<>(Comparator.comparingInt(GraphNode::order));
        for (GraphNode node : nodes.values()) {
            int count = dependencies.get(node.name()).size();
            remaining.put(node.name(), count);
            if (count == 0) {
                ready.add(node);
            }
        }
        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            GraphNode next = ready.poll();
            order.add(next.name());
            for (String consumer : dependents.get(next.name())) {
                if (remaining.merge(consumer, -1, Integer::sum) == 0) {
                    ready.add(nodes.get(consumer));
                }
            }
        }
        if (order.size() != nodes.size()) {
            List<String> cycle = findCycle().orElseThrow();
            throw new CyclicDependencyException(cycle, nodes.get(cycle.get(0)).position());
        }
        return order;
    }

    public static class Builder {
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final List<DependencyEdge> edges = new ArrayList<>();

        public Builder node(GraphNode node) {
            if (nodes.putIfAbsent(node.name(), node) != null) {
                throw new IllegalArgumentException("Duplicate graph node: " + node.name());
            }
            return this;
        }

        public Builder edge(String consumer, String producer) {
            edges.add(new DependencyEdge(consumer, producer));
            return this;
        }

        public DependencyGraph build() {
            for (DependencyEdge edge : edges) {
                if (!nodes.containsKey(edge.consumer()) || !nodes.containsKey(edge.producer())) {
                    throw new IllegalArgumentException("Edge references unknown node: " + edge);
                }
            }
            return new DependencyGraph(this);
        }
    }
}
