package com.hcltech.depvis.graph.render;

import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.Edge;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Flattens a graph into the edge list a graph-image renderer draws.
 * Forward: {@code node -> dependency}. Reverse: {@code dependency -> node}, swapped per pair as it is emitted.
 */
public final class EdgeExporter {
    private EdgeExporter() {}

    public static List<Edge> edges(DependencyGraph graph, boolean reverse) {
        Objects.requireNonNull(graph, "graph");
        List<Edge> out = new ArrayList<>(graph.edgeCount());
        for (String node : graph.nodes()) {
            for (String dep : graph.dependenciesOf(node)) {
                Edge edge = new Edge(node, dep);
                out.add(reverse ? edge.swapped() : edge);
            }
        }
        return out;
    }

    /** One {@code from -> to} per line. */
    public static String toText(List<Edge> edges) {
        return edges.stream().map(Edge::toString).collect(Collectors.joining("\n"));
    }
}
