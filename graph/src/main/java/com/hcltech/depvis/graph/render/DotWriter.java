package com.hcltech.depvis.graph.render;

import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.Edge;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Graphviz DOT text for the exported edge list. Declared nodes without edges are listed on their own. */
public final class DotWriter {

    public static final String GRAPH_NAME = "dependencies";

    private DotWriter() {}

    public static String toDot(DependencyGraph graph, boolean reverse) {
        List<Edge> edges = EdgeExporter.edges(graph, reverse);
        Set<String> touched = new HashSet<>();
        for (Edge e : edges) {
            touched.add(e.from());
            touched.add(e.to());
        }

        StringBuilder sb = new StringBuilder("digraph ").append(GRAPH_NAME).append(" {\n");
        for (String node : graph.nodes()) {
            if (!touched.contains(node)) sb.append("  ").append(quote(node)).append(";\n");
        }
        for (Edge e : edges) {
            sb.append("  ").append(quote(e.from())).append(" -> ").append(quote(e.to())).append(";\n");
        }
        return sb.append("}\n").toString();
    }

    static String quote(String id) {
        return '"' + id.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
