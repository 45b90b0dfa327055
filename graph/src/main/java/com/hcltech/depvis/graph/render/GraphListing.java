package com.hcltech.depvis.graph.render;

import com.hcltech.depvis.graph.DependencyGraph;

import java.util.List;

/** {@code name: dep1, dep2} for every declared node, {@code name: -} for leaves. */
public final class GraphListing {
    private GraphListing() {}

    public static String format(DependencyGraph graph) {
        StringBuilder sb = new StringBuilder();
        for (String node : graph.nodes()) {
            if (sb.length() > 0) sb.append('\n');
            List<String> deps = graph.dependenciesOf(node);
            sb.append(node).append(": ").append(deps.isEmpty() ? "-" : String.join(", ", deps));
        }
        return sb.toString();
    }
}
