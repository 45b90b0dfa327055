package com.hcltech.depvis.graph.render;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Turns {@link TreeLine}s into text, one row per line, using a {@link TreeStyle}. */
public final class AsciiTreeFormatter {

    public static final String DEFAULT_CYCLE_MARKER = "(cycle detected)";

    private final TreeStyle style;
    private final String cycleMarker;

    public AsciiTreeFormatter(TreeStyle style, String cycleMarker) {
        this.style = Objects.requireNonNull(style, "style");
        this.cycleMarker = Objects.requireNonNull(cycleMarker, "cycleMarker");
    }

    public AsciiTreeFormatter() {
        this(TreeStyle.UNICODE, DEFAULT_CYCLE_MARKER);
    }

    public String format(List<TreeLine> lines) {
        StringBuilder sb = new StringBuilder();
        // lastAtDepth.get(d) is whether the most recent row at depth d+1 was a last child
        List<Boolean> lastAtDepth = new ArrayList<>();
        for (TreeLine line : lines) {
            if (sb.length() > 0) sb.append('\n');
            int depth = line.depth();
            while (lastAtDepth.size() > Math.max(depth - 1, 0)) lastAtDepth.remove(lastAtDepth.size() - 1);

            for (int d = 0; d < depth - 1; d++) {
                sb.append(lastAtDepth.get(d) ? style.gap : style.continuation);
            }
            if (depth > 0) {
                sb.append(line.last() ? style.lastBranch : style.branch);
                lastAtDepth.add(line.last());
            }
            sb.append(line.label());
            if (line.cycle()) sb.append(' ').append(cycleMarker);
        }
        return sb.toString();
    }
}
