package com.hcltech.depvis.graph.render;

/**
 * One row of a rendered dependency tree.
 *
 * @param depth 0 for the root
 * @param label node identity
 * @param cycle the node is already on the path above it and was not expanded
 * @param last  the node is the last child of its parent (always true for the root)
 */
public record TreeLine(int depth, String label, boolean cycle, boolean last) {
}
