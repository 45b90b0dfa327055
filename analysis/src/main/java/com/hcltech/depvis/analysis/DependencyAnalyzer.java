package com.hcltech.depvis.analysis;

import com.hcltech.depvis.graph.BreadthFirstTraversal;
import com.hcltech.depvis.graph.CycleDetector;
import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.render.DotWriter;
import com.hcltech.depvis.graph.render.EdgeExporter;
import com.hcltech.depvis.graph.render.GraphListing;
import com.hcltech.depvis.graph.render.TreeRenderer;
import com.hcltech.depvis.manifest.ManifestFormat;
import com.hcltech.depvis.manifest.ManifestParser;
import com.hcltech.depvis.manifest.index.PackageIndex;
import com.hcltech.depvis.manifest.index.PackageIndexParser;
import com.hcltech.depvis.manifest.index.PackageRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reads manifests with the configured normalization and runs every analysis on the resulting graph.
 * The graph is only read after parsing, so one analyzer can serve any number of start packages.
 */
public class DependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    private final AnalyzerSettings settings;

    public DependencyAnalyzer(AnalyzerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public AnalyzerSettings settings() {
        return settings;
    }

    public ManifestParser parser(ManifestFormat format) {
        log.info("Reading manifest as {} ({})", format, settings.normalization());
        return ManifestParser.forFormat(format, settings.normalization());
    }

    public DependencyGraph load(Path path, ManifestFormat format) throws IOException {
        return parser(format).parse(path);
    }

    public PackageIndex loadIndex(InputStream in, String source) throws IOException {
        log.info("Reading package index {} ({})", source, settings.normalization());
        return new PackageIndexParser(settings.normalization()).parseIndex(in, source);
    }

    public PackageIndex loadIndex(Path path) throws IOException {
        log.info("Reading package index {} ({})", path, settings.normalization());
        return new PackageIndexParser(settings.normalization()).parseIndex(path);
    }

    public AnalysisReport analyze(DependencyGraph graph, String start, boolean reverse) {
        return analyze(graph, start, reverse, Optional.empty());
    }

    public AnalysisReport analyze(PackageIndex index, String start, boolean reverse) {
        return analyze(index.graph(), start, reverse, index.find(start));
    }

    AnalysisReport analyze(DependencyGraph graph, String start, boolean reverse, Optional<PackageRecord> record) {
        String root = graph.canonical(start);
        boolean declared = graph.isDeclared(root);
        if (!declared) {
            log.warn("Package '{}' not found in repository; it will be shown as leaf", root);
        }
        DependencyGraph view = reverse ? graph.reversed() : graph;

        List<String> traversal = BreadthFirstTraversal.bfs(view, root);
        List<String> cyclePath = CycleDetector.findCycle(graph).orElse(List.of());
        if (!cyclePath.isEmpty()) log.info("Cycle found: {}", String.join(" -> ", cyclePath));

        return new AnalysisReport(
                root,
                reverse,
                declared,
                traversal,
                String.join(settings.traversalSeparator(), traversal),
                cyclePath,
                settings.treeFormatter().format(TreeRenderer.render(view, root)),
                EdgeExporter.edges(graph, reverse),
                DotWriter.toDot(graph, reverse),
                GraphListing.format(graph),
                record);
    }
}
