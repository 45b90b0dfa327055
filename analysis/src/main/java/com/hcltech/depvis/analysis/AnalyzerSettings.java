package com.hcltech.depvis.analysis;

import com.hcltech.depvis.common.settings.Settings;
import com.hcltech.depvis.graph.NodeNormalization;
import com.hcltech.depvis.graph.render.AsciiTreeFormatter;
import com.hcltech.depvis.graph.render.TreeStyle;
import com.hcltech.depvis.manifest.ManifestFormat;

import java.util.Objects;

/**
 * Engine-wide choices that do not change between runs. The normalization policy applies to every graph
 * built with these settings, so identities are never mixed within one graph.
 */
public record AnalyzerSettings(NodeNormalization normalization,
                               ManifestFormat defaultFormat,
                               TreeStyle treeStyle,
                               String cycleMarker,
                               String traversalArrow) {

    public static final String RESOURCE = "depvis.properties";
    public static final String NORMALIZATION = "depvis.normalization";
    public static final String FORMAT = "depvis.format";
    public static final String TREE_STYLE = "depvis.tree.style";
    public static final String CYCLE_MARKER = "depvis.cycle.marker";
    public static final String TRAVERSAL_ARROW = "depvis.traversal.arrow";

    public static final AnalyzerSettings DEFAULTS = new AnalyzerSettings(
            NodeNormalization.IDENTITY, ManifestFormat.LINE_CSV, TreeStyle.UNICODE,
            AsciiTreeFormatter.DEFAULT_CYCLE_MARKER, "→");

    public AnalyzerSettings {
        Objects.requireNonNull(normalization, "normalization");
        Objects.requireNonNull(defaultFormat, "defaultFormat");
        Objects.requireNonNull(treeStyle, "treeStyle");
        Objects.requireNonNull(cycleMarker, "cycleMarker");
        Objects.requireNonNull(traversalArrow, "traversalArrow");
    }

    public static AnalyzerSettings load() {
        return from(Settings.fromClasspath(RESOURCE));
    }

    public static AnalyzerSettings from(Settings settings) {
        String format = settings.get(FORMAT, null);
        ManifestFormat defaultFormat;
        try {
            defaultFormat = format == null ? DEFAULTS.defaultFormat() : ManifestFormat.fromName(format);
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid value for " + FORMAT + ": '" + format + "'", e);
        }
        return new AnalyzerSettings(
                settings.getEnum(NORMALIZATION, NodeNormalization.class, DEFAULTS.normalization()),
                defaultFormat,
                settings.getEnum(TREE_STYLE, TreeStyle.class, DEFAULTS.treeStyle()),
                settings.get(CYCLE_MARKER, DEFAULTS.cycleMarker()),
                settings.get(TRAVERSAL_ARROW, DEFAULTS.traversalArrow()));
    }

    public AsciiTreeFormatter treeFormatter() {
        return new AsciiTreeFormatter(treeStyle, cycleMarker);
    }

    /** Separator placed between nodes of a traversal line, e.g. {@code " → "}. */
    public String traversalSeparator() {
        return " " + traversalArrow + " ";
    }

    public AnalyzerSettings withNormalization(NodeNormalization n) {
        return new AnalyzerSettings(n, defaultFormat, treeStyle, cycleMarker, traversalArrow);
    }
}
