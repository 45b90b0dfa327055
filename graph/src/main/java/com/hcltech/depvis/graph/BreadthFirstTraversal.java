package com.hcltech.depvis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Breadth-first reachability order. A node is marked and emitted when it is dequeued, not when it is
 * enqueued, so repeated enqueues through cycles or shared dependencies are dropped at dequeue time.
 */
public final class BreadthFirstTraversal {
    private BreadthFirstTraversal() {}

    /** Nodes reachable from {@code start} (inclusive, first), each once, in first-visit order. */
    public static List<String> bfs(DependencyGraph graph, String start) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(start, "start");

        Set<String> visited = new HashSet<>();
        List<String> order = new ArrayList<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(start);

        while (!queue.isEmpty()) {
            String node = queue.poll();
            if (!visited.add(node)) continue;
            order.add(node);
            for (String dep : graph.dependenciesOf(node)) {
                if (!visited.contains(dep)) queue.add(dep);
            }
        }
        return order;
    }

    /** Packages that depend on {@code start}, directly or transitively, breadth-first. */
    public static List<String> reverseBfs(DependencyGraph graph, String start) {
        return bfs(graph.reversed(), start);
    }

    public static List<String> bfs(DependencyGraph graph, String start, boolean reverse) {
        return reverse ? reverseBfs(graph, start) : bfs(graph, start);
    }
}
