package com.hcltech.depvis.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable directed dependency graph: declared packages and their ordered dependency lists.
 * <p>
 * Edge order is insertion order; duplicate edges and self-edges are kept. A package that is only
 * ever named as a dependency is not declared, but every lookup on it succeeds with no dependencies.
 */
public final class DependencyGraph {

    private final NodeNormalization normalization;
    private final Map<String, List<String>> adjacency;
    private final Set<String> allNodes;
    private final int edgeCount;

    private DependencyGraph(NodeNormalization normalization, Map<String, List<String>> adjacency) {
        this.normalization = normalization;
        Map<String, List<String>> copy = new LinkedHashMap<>();
        Set<String> all = new LinkedHashSet<>(adjacency.keySet());
        int edges = 0;
        for (var e : adjacency.entrySet()) {
            copy.put(e.getKey(), List.copyOf(e.getValue()));
            all.addAll(e.getValue());
            edges += e.getValue().size();
        }
        this.adjacency = Collections.unmodifiableMap(copy);
        this.allNodes = Collections.unmodifiableSet(all);
        this.edgeCount = edges;
    }

    public static Builder builder() {
        return new Builder(NodeNormalization.IDENTITY);
    }

    public static Builder builder(NodeNormalization normalization) {
        return new Builder(normalization);
    }

    public static DependencyGraph empty() {
        return builder().build();
    }

    public NodeNormalization normalization() {
        return normalization;
    }

    /** The identity {@code name} has in this graph (the graph's normalization applied). */
    public String canonical(String name) {
        return normalization.apply(name.strip());
    }

    /** Declared nodes, in declaration order. */
    public Set<String> nodes() {
        return adjacency.keySet();
    }

    /** Declared nodes followed by dependency-only nodes, each in first-appearance order. */
    public Set<String> allNodes() {
        return allNodes;
    }

    public boolean isDeclared(String id) {
        return adjacency.containsKey(id);
    }

    public boolean contains(String id) {
        return allNodes.contains(id);
    }

    /** Dependencies in edge order; empty for leaves and for identities the graph has never seen. */
    public List<String> dependenciesOf(String id) {
        return adjacency.getOrDefault(id, List.of());
    }

    public int edgeCount() {
        return edgeCount;
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    /**
     * New graph where every edge {@code a -> b} becomes {@code b -> a}. Every node of this graph,
     * dependency-only ones included, is declared in the result.
     */
    public DependencyGraph reversed() {
        Builder b = new Builder(normalization);
        for (String node : allNodes) b.addNode(node);
        for (var e : adjacency.entrySet()) {
            for (String dep : e.getValue()) b.addEdge(dep, e.getKey());
        }
        return b.build();
    }

    @Override
    public String toString() {
        return "DependencyGraph(nodes=" + adjacency.size() + ", edges=" + edgeCount + ")";
    }

    /** Collects nodes and edges, normalizing every identity, then freezes them into a graph. */
    public static final class Builder {
        private final NodeNormalization normalization;
        private final Map<String, List<String>> adjacency = new LinkedHashMap<>();

        private Builder(NodeNormalization normalization) {
            this.normalization = Objects.requireNonNull(normalization, "normalization");
        }

        /** Declares {@code id}; no-op if already declared. */
        public Builder addNode(String id) {
            adjacency.computeIfAbsent(canonical(id), k -> new ArrayList<>());
            return this;
        }

        /** Declares {@code from} and appends {@code to} to its dependencies. */
        public Builder addEdge(String from, String to) {
            String target = canonical(to);
            adjacency.computeIfAbsent(canonical(from), k -> new ArrayList<>()).add(target);
            return this;
        }

        public Builder addEdges(String from, List<String> to) {
            addNode(from);
            for (String t : to) addEdge(from, t);
            return this;
        }

        public DependencyGraph build() {
            return new DependencyGraph(normalization, adjacency);
        }

        private String canonical(String id) {
            Objects.requireNonNull(id, "id");
            String trimmed = id.strip();
            if (trimmed.isEmpty()) throw new IllegalArgumentException("Node identity must not be empty");
            return normalization.apply(trimmed);
        }
    }
}
