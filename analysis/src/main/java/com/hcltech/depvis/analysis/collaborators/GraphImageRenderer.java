package com.hcltech.depvis.analysis.collaborators;

import com.hcltech.depvis.graph.Edge;

import java.io.IOException;
import java.util.List;

/**
 * Draws an edge list as an image. Edges arrive already oriented: {@code package -> dependency} normally,
 * {@code dependency -> package} when {@code reverse} is set.
 */
@FunctionalInterface
public interface GraphImageRenderer {
    void render(String name, List<Edge> edges, boolean reverse) throws IOException;
}
