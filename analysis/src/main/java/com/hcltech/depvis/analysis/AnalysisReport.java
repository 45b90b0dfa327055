package com.hcltech.depvis.analysis;

import com.hcltech.depvis.graph.Edge;
import com.hcltech.depvis.graph.render.EdgeExporter;
import com.hcltech.depvis.manifest.index.PackageRecord;

import java.util.List;
import java.util.Optional;

/**
 * Everything computed for one start package.
 *
 * @param start     canonical identity of the start package
 * @param declared  false when the start package is not declared and was treated as a leaf
 * @param traversal breadth-first order from {@code start}, over the reversed graph when {@code reverse}
 * @param cyclePath first cycle found anywhere in the graph, closed ({@code [A, B, A]}), empty if acyclic
 * @param record    index metadata for {@code start}, present only for package indexes
 */
public record AnalysisReport(String start,
                             boolean reverse,
                             boolean declared,
                             List<String> traversal,
                             String traversalLine,
                             List<String> cyclePath,
                             String tree,
                             List<Edge> edges,
                             String dot,
                             String listing,
                             Optional<PackageRecord> record) {

    public AnalysisReport {
        traversal = List.copyOf(traversal);
        cyclePath = List.copyOf(cyclePath);
        edges = List.copyOf(edges);
    }

    public boolean hasCycle() {
        return !cyclePath.isEmpty();
    }

    /** Text handed to the report sink for {@code mode}. */
    public String payload(OutputMode mode) {
        return switch (mode) {
            case ASCII_TREE -> tree;
            case TRAVERSAL -> traversalLine;
            case EDGES -> EdgeExporter.toText(edges);
            case DOT -> dot;
        };
    }

    /** Version and direct dependencies, when the graph came from a package index. */
    public Optional<String> packageSummary() {
        return record.map(r -> {
            StringBuilder sb = new StringBuilder()
                    .append("Package: ").append(r.name()).append('\n')
                    .append("Version: ").append(r.version()).append('\n')
                    .append("Direct dependencies (").append(r.dependencies().size()).append("):");
            for (String dep : r.dependencies()) sb.append("\n  - ").append(dep);
            return sb.toString();
        });
    }
}
