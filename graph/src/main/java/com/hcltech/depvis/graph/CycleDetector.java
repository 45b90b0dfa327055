package com.hcltech.depvis.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Three-colour depth-first cycle detection over an explicit stack.
 * <ul>
 *   <li>{@code ON_STACK}: an ancestor on the current path; reaching it again is a back-edge, i.e. a cycle.</li>
 *   <li>{@code DONE}: fully explored without finding a cycle; never explored again.</li>
 * </ul>
 * {@link #hasCycleAnywhere} roots a search at every node, so cycles in components not reachable from
 * any particular start are found too. {@link #hasCycleFrom} only sees what is reachable from its root.
 */
public final class CycleDetector {
    private CycleDetector() {}

    private enum Colour { ON_STACK, DONE }

    public static boolean hasCycleAnywhere(DependencyGraph graph) {
        return findCycle(graph).isPresent();
    }

    /** True iff a cycle is reachable from {@code root} (a self-loop on {@code root} included). */
    public static boolean hasCycleFrom(DependencyGraph graph, String root) {
        return findCycleFrom(graph, root).isPresent();
    }

    /** The first cycle found, as a closed path such as {@code [A, B, C, A]}. */
    public static Optional<List<String>> findCycle(DependencyGraph graph) {
        Objects.requireNonNull(graph, "graph");
        Map<String, Colour> colours = new HashMap<>();
        for (String root : graph.nodes()) {
            List<String> cycle = search(graph, root, colours);
            if (cycle != null) return Optional.of(cycle);
        }
        return Optional.empty();
    }

    public static Optional<List<String>> findCycleFrom(DependencyGraph graph, String root) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(root, "root");
        return Optional.ofNullable(search(graph, root, new HashMap<>()));
    }

    private static List<String> search(DependencyGraph graph, String root, Map<String, Colour> colours) {
        if (colours.get(root) == Colour.DONE) return null;

        Deque<Frame> stack = new ArrayDeque<>();
        List<String> path = new ArrayList<>();
        colours.put(root, Colour.ON_STACK);
        stack.push(new Frame(root, graph.dependenciesOf(root)));
        path.add(root);

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.hasNext()) {
                String dep = top.next();
                Colour colour = colours.get(dep);
                if (colour == Colour.ON_STACK) {
                    List<String> cycle = new ArrayList<>(path.subList(path.lastIndexOf(dep), path.size()));
                    cycle.add(dep);
                    return cycle;
                }
                if (colour == null) {
                    colours.put(dep, Colour.ON_STACK);
                    stack.push(new Frame(dep, graph.dependenciesOf(dep)));
                    path.add(dep);
                }
            } else {
                colours.put(top.node, Colour.DONE);
                stack.pop();
                path.remove(path.size() - 1);
            }
        }
        return null;
    }

    private static final class Frame {
        final String node;
        final List<String> deps;
        int position;

        Frame(String node, List<String> deps) {
            this.node = node;
            this.deps = deps;
        }

        boolean hasNext() { return position < deps.size(); }

        String next() { return deps.get(position++); }
    }
}
