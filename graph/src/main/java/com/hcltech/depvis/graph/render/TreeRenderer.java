package com.hcltech.depvis.graph.render;

import com.hcltech.depvis.graph.DependencyGraph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pre-order tree view of a possibly cyclic graph.
 * <p>
 * Only the active path (the ancestors of the row being emitted) counts as "seen": a node shared by two
 * branches is expanded under both, while a node that is its own ancestor is emitted once as a cycle
 * row and not expanded.
 */
public final class TreeRenderer {
    private TreeRenderer() {}

    public static List<TreeLine> render(DependencyGraph graph, String root) {
        Objects.requireNonNull(graph, "graph");
        Objects.requireNonNull(root, "root");

        List<TreeLine> lines = new ArrayList<>();
        Set<String> activePath = new HashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        lines.add(new TreeLine(0, root, false, true));
        activePath.add(root);
        stack.push(new Frame(root, graph.dependenciesOf(root), 0));

        while (!stack.isEmpty()) {
            Frame top = stack.peek();
            if (top.position < top.children.size()) {
                int index = top.position++;
                String child = top.children.get(index);
                boolean last = index == top.children.size() - 1;
                int depth = top.depth + 1;
                if (activePath.contains(child)) {
                    lines.add(new TreeLine(depth, child, true, last));
                    continue;
                }
                lines.add(new TreeLine(depth, child, false, last));
                activePath.add(child);
                stack.push(new Frame(child, graph.dependenciesOf(child), depth));
            } else {
                stack.pop();
                activePath.remove(top.node);
            }
        }
        return lines;
    }

    private static final class Frame {
        final String node;
        final List<String> children;
        final int depth;
        int position;

        Frame(String node, List<String> children, int depth) {
            this.node = node;
            this.children = children;
            this.depth = depth;
        }
    }
}
